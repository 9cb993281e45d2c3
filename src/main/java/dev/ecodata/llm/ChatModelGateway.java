package dev.ecodata.llm;

import dev.ecodata.prompt.ExtractionPrompt;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * {@link ModelGateway} backed by a LangChain4j {@link ChatModel}.
 *
 * <p>Provider exceptions are translated at this boundary. Transient failures are retried with
 * exponential backoff; once attempts are exhausted the last {@link ProviderTransientException}
 * propagates to the caller, which records it against the row. Fatal failures are never retried.
 */
@Service
public class ChatModelGateway implements ModelGateway {

    private static final Logger log = LoggerFactory.getLogger(ChatModelGateway.class);

    private final ChatModel chatModel;

    public ChatModelGateway(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    @Retryable(
            retryFor = ProviderTransientException.class,
            noRetryFor = ProviderFatalException.class,
            maxAttemptsExpression = "${ecodata.model.retry.max-attempts}",
            backoff = @Backoff(
                    delayExpression = "${ecodata.model.retry.delay-ms}",
                    multiplierExpression = "${ecodata.model.retry.multiplier}"
            )
    )
    public String complete(ExtractionPrompt prompt) {
        ChatRequest request = ChatRequest.builder()
                .messages(
                        SystemMessage.from(prompt.systemMessage()),
                        UserMessage.from(prompt.userMessage()))
                .build();
        log.debug("Sending extraction prompt:\n{}", prompt.userMessage());

        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RuntimeException e) {
            throw translate(e);
        }

        String text = response == null || response.aiMessage() == null
                ? null
                : response.aiMessage().text();
        if (text == null) {
            throw new ProviderTransientException("Model returned an empty response");
        }
        log.debug("Raw model response:\n{}", text);
        return text;
    }

    /**
     * Maps a provider failure to the transient/fatal split. Unrecognised failures are treated as
     * transient so the row gets its bounded retries rather than counting towards job failure.
     */
    static ProviderException translate(RuntimeException e) {
        if (hasCause(e, UnknownHostException.class) || hasCause(e, ConnectException.class)) {
            log.warn("Model endpoint unreachable: {}", e.getMessage());
            return new ProviderFatalException("Model endpoint unreachable: " + e.getMessage(), e);
        }
        if (e instanceof NonRetriableException) {
            log.warn("Model call rejected: {}", e.getMessage());
            return new ProviderFatalException("Model call rejected: " + e.getMessage(), e);
        }
        if (e instanceof RetriableException || hasCause(e, IOException.class)) {
            log.warn("Transient model failure, may retry: {}", e.getMessage());
            return new ProviderTransientException("Transient model failure: " + e.getMessage(), e);
        }
        if (e instanceof LangChain4jException) {
            log.warn("Model call failed: {}", e.getMessage());
        } else {
            log.warn("Unexpected model client failure: {}", e.getMessage(), e);
        }
        return new ProviderTransientException("Model call failed: " + e.getMessage(), e);
    }

    private static boolean hasCause(Throwable e, Class<? extends Throwable> type) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return true;
            }
            if (t.getCause() == t) {
                return false;
            }
        }
        return false;
    }
}
