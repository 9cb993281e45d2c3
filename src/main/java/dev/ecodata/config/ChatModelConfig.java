package dev.ecodata.config;

import dev.ecodata.llm.ModelProperties;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the chat model used for extraction.
 *
 * <p>Any OpenAI-compatible endpoint works (OpenAI, DeepSeek, Grok, a local Ollama {@code /v1}),
 * selected through {@code ecodata.model.base-url}. The client's own retries are disabled because
 * retries are applied by {@link dev.ecodata.llm.ChatModelGateway}.
 *
 * @see dev.ecodata.llm.ChatModelGateway
 */
@Configuration
public class ChatModelConfig {

    @Bean
    public ChatModel chatModel(ModelProperties properties) {
        return OpenAiChatModel.builder()
                .baseUrl(properties.baseUrl())
                .apiKey(properties.apiKey())
                .modelName(properties.modelName())
                .temperature(properties.temperature())
                .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
                .maxRetries(0)
                .build();
    }
}
