package io.github.drompincen.simgate.tools;

import io.github.drompincen.simgate.protocol.api.ErrorKind;
import io.github.drompincen.simgate.protocol.api.ToolRiskProfile;
import io.github.drompincen.simgate.runtime.config.SimulationProperties;
import io.github.drompincen.simgate.runtime.engine.EngineException;
import io.github.drompincen.simgate.runtime.engine.ModelHandle;
import io.github.drompincen.simgate.runtime.engine.TimeDomainParams;
import io.github.drompincen.simgate.runtime.engine.TimeDomainState;
import io.github.drompincen.simgate.runtime.result.NumericConversion;
import io.github.drompincen.simgate.runtime.result.ResultSerializer;
import io.github.drompincen.simgate.runtime.tools.ToolResult;
import io.github.drompincen.simgate.runtime.tools.ToolStream;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Set;

public class RunTimeDomainTool extends SessionTool {

    private SimulationProperties properties = SimulationProperties.defaults();

    @Override public String name() { return "run_time_domain"; }

    @Override public String description() {
        return "Run a time-domain simulation on a loaded system whose power flow has converged. " +
               "Returns convergence, time range and number of stored points; use get_tds_results for the data.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = sessionSchema();
        ObjectNode props = properties(schema);
        props.putObject("tf").put("type", "number").put("description", "Simulation end time in seconds (default 20.0)");
        props.putObject("tstep").put("type", "number").put("description", "Integration time step in seconds");
        props.putObject("tol").put("type", "number").put("description", "Convergence tolerance");
        props.putObject("method").put("type", "string").put("description", "Integration method, e.g. trapezoid");
        return schema;
    }

    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.MODEL_MUTATION); }

    public void setSimulationProperties(SimulationProperties properties) {
        this.properties = properties;
    }

    @Override protected String failureContext() { return "Error running time-domain simulation"; }

    @Override
    protected ToolResult run(ModelHandle model, JsonNode input, ToolStream stream) throws EngineException {
        Double tf = ToolInputs.optionalDouble(input, "tf");
        TimeDomainParams params = new TimeDomainParams(
                tf != null ? tf : properties.defaultTdsEndTime(),
                ToolInputs.optionalDouble(input, "tstep"),
                ToolInputs.optionalDouble(input, "tol"),
                ToolInputs.optionalText(input, "method"));

        if (!model.powerFlow().converged()) {
            return ToolResult.failure(ErrorKind.PRECONDITION_FAILED,
                    "Power flow must be run successfully before time-domain simulation");
        }

        model.runTimeDomain(params);
        TimeDomainState tds = model.timeDomain();

        ObjectNode result = MAPPER.createObjectNode();
        result.put("converged", ResultSerializer.timeDomainConverged(tds));
        result.set("execTime", NumericConversion.toJson(tds.execTime()));
        result.putArray("timeRange").add(tds.startTime()).add(tds.endTime());
        result.put("nPoints", NumericConversion.toJsonArray(tds.time()).size());
        result.put("message", "Time-domain simulation completed. Use get_tds_results to retrieve data.");
        stream.progress(100, "Time-domain simulation finished");
        return ToolResult.success(result);
    }
}
