package io.github.drompincen.simgate.tools;

import io.github.drompincen.simgate.protocol.api.ErrorKind;
import io.github.drompincen.simgate.protocol.api.ToolRiskProfile;
import io.github.drompincen.simgate.runtime.engine.EngineException;
import io.github.drompincen.simgate.runtime.engine.ModelHandle;
import io.github.drompincen.simgate.runtime.tools.ToolResult;
import io.github.drompincen.simgate.runtime.tools.ToolStream;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

public class RunEigenvalueTool extends SessionTool {

    @Override public String name() { return "run_eigenvalue"; }

    @Override public String description() {
        return "Run small-signal eigenvalue analysis on a loaded system whose power flow has converged. " +
               "Returns eigenvalue real and imaginary parts, stability counts and participation factors.";
    }

    @Override public JsonNode inputSchema() { return sessionSchema(); }

    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.MODEL_MUTATION); }

    @Override protected String failureContext() { return "Error running eigenvalue analysis"; }

    @Override
    protected ToolResult run(ModelHandle model, JsonNode input, ToolStream stream) throws EngineException {
        if (!model.powerFlow().converged()) {
            return ToolResult.failure(ErrorKind.PRECONDITION_FAILED,
                    "Power flow must be run successfully before eigenvalue analysis");
        }
        model.runEigen();
        stream.progress(100, "Eigenvalue analysis finished");
        return resultSerializer.eigen(model);
    }
}
