package dev.ecodata.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link McpToolService} methods as MCP tools.
 *
 * <p>Spring AI's MCP server auto-configuration picks up the {@link ToolCallbackProvider} bean and
 * exposes each {@code @Tool} method over the SSE transport.
 */
@Configuration
public class McpToolConfig {

    @Bean
    public ToolCallbackProvider extractionTools(McpToolService toolService) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(toolService)
                .build();
    }
}
