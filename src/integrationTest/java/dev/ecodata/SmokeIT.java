package dev.ecodata;

import dev.ecodata.feedback.FeedbackStore;
import dev.ecodata.feedback.JpaFeedbackStore;
import dev.ecodata.llm.ModelGateway;
import dev.ecodata.mcp.McpToolService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;

class SmokeIT extends BaseIntegrationTest {

    @Autowired
    private FeedbackStore feedbackStore;

    @Autowired
    private ModelGateway modelGateway;

    @Autowired
    private McpToolService mcpToolService;

    @Test
    void contextLoads() {
        // Flyway migrations applied, JPA entities mapped, chat model and MCP tools wired
        assertThat(feedbackStore).isInstanceOf(JpaFeedbackStore.class);
        assertThat(modelGateway).isNotNull();
        assertThat(mcpToolService.jobStatus("not-a-uuid")).contains("Invalid job ID format");
    }
}
