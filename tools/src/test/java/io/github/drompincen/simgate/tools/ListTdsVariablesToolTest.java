package io.github.drompincen.simgate.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.simgate.protocol.api.ErrorKind;
import io.github.drompincen.simgate.runtime.engine.DaeState;
import io.github.drompincen.simgate.runtime.engine.ModelHandle;
import io.github.drompincen.simgate.runtime.engine.TimeDomainState;
import io.github.drompincen.simgate.runtime.session.SessionManager;
import io.github.drompincen.simgate.runtime.tools.ToolContext;
import io.github.drompincen.simgate.runtime.tools.ToolResult;
import io.github.drompincen.simgate.runtime.tools.ToolStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ListTdsVariablesToolTest {

    private final ObjectMapper mapper = new ObjectMapper();
    @Mock private ModelHandle model;
    @Mock private TimeDomainState tds;
    @Mock private DaeState dae;

    private ListTdsVariablesTool tool;
    private ObjectNode input;

    @BeforeEach
    void setUp() {
        SessionManager manager = new SessionManager(5, Duration.ofHours(1), Clock.systemUTC());
        tool = new ListTdsVariablesTool();
        tool.setSessionManager(manager);
        input = mapper.createObjectNode().put("sessionId", manager.create(model, "kundur.raw"));
    }

    @Test
    void requiresInitializedRun() {
        when(model.timeDomain()).thenReturn(tds);

        ToolResult result = tool.execute(new ToolContext("test"), input, ToolStream.noop());

        assertThat(result.errorKind()).isEqualTo(ErrorKind.PRECONDITION_FAILED);
    }

    @Test
    void listsStateAndAlgebraicNames() {
        when(model.timeDomain()).thenReturn(tds);
        when(tds.initialized()).thenReturn(true);
        when(model.dae()).thenReturn(dae);
        when(dae.stateNames()).thenReturn(List.of("delta_GENROU_1", "omega_GENROU_1"));
        when(dae.algebraicNames()).thenReturn(List.of("v_Bus_1"));
        when(dae.stateCount()).thenReturn(2);
        when(dae.algebraicCount()).thenReturn(1);

        ToolResult result = tool.execute(new ToolContext("test"), input, ToolStream.noop());

        assertThat(result.success()).isTrue();
        assertThat(result.output().get("stateVariables").toString())
                .isEqualTo("[\"delta_GENROU_1\",\"omega_GENROU_1\"]");
        assertThat(result.output().get("algebraicVariables").get(0).asText()).isEqualTo("v_Bus_1");
        assertThat(result.output().get("nStates").asInt()).isEqualTo(2);
        assertThat(result.output().get("nAlgebraic").asInt()).isEqualTo(1);
    }
}
