package io.github.drompincen.simgate.runtime.tools;

import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.simgate.protocol.api.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolResultTest {

    @Test
    void successCreatesSuccessfulResult() {
        ToolResult result = ToolResult.success(new TextNode("output data"));

        assertThat(result.success()).isTrue();
        assertThat(result.output().asText()).isEqualTo("output data");
        assertThat(result.error()).isNull();
        assertThat(result.errorKind()).isNull();
    }

    @Test
    void failureDefaultsToEngineFailure() {
        ToolResult result = ToolResult.failure("something went wrong");

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("something went wrong");
        assertThat(result.errorKind()).isEqualTo(ErrorKind.ENGINE_FAILURE);
        assertThat(result.output()).isNull();
    }

    @Test
    void sessionNotFoundNamesTheSession() {
        ToolResult result = ToolResult.sessionNotFound("abc-123");

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(result.error()).isEqualTo("Session not found: abc-123");
    }
}
