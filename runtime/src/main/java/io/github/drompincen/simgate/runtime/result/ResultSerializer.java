package io.github.drompincen.simgate.runtime.result;

import io.github.drompincen.simgate.protocol.api.ErrorKind;
import io.github.drompincen.simgate.runtime.engine.*;
import io.github.drompincen.simgate.runtime.tools.ToolResult;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Builds the JSON payloads returned for system, power-flow, time-domain and eigenvalue queries.
 * Every engine array passes through {@link NumericConversion}.
 */
@Component
public class ResultSerializer {

    /** Generator-bearing component types, in the order their injections are concatenated. */
    public static final List<String> GENERATOR_TYPES = List.of("Slack", "PV", "PQ");

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public ObjectNode systemInfo(ModelHandle model) {
        ObjectNode info = NODES.objectNode();
        String name = model.name();
        info.put("name", name == null || name.isBlank() ? "Untitled" : name);
        info.put("casePath", model.casePath());
        info.put("isSetup", model.isSetup());

        ObjectNode models = info.putObject("models");
        for (Map.Entry<String, ComponentCount> e : model.componentCounts().entrySet()) {
            if (e.getValue().count() > 0) {
                models.putObject(e.getKey())
                        .put("count", e.getValue().count())
                        .put("group", e.getValue().group());
            }
        }

        DaeState dae = model.dae();
        info.putObject("daeInfo")
                .put("nStates", dae.stateCount())
                .put("nAlgebraic", dae.algebraicCount())
                .set("time", NumericConversion.toJson(dae.time()));

        info.putObject("config")
                .put("freq", model.frequency())
                .put("mva", model.powerBase());
        return info;
    }

    /**
     * Power-flow payload. A non-converged run carries only the iteration count and an error
     * message.
     */
    public ObjectNode powerFlow(ModelHandle model) {
        PowerFlowState pf = model.powerFlow();
        ObjectNode out = NODES.objectNode();
        out.put("converged", pf.converged());
        out.put("iterations", pf.iterations());
        if (!pf.converged()) {
            out.put("error", "Power flow did not converge");
            return out;
        }
        out.set("execTime", NumericConversion.toJson(pf.execTime()));

        ObjectNode buses = out.putObject("buses");
        pf.buses().ifPresent(b -> {
            buses.set("idx", NumericConversion.toJsonArray(b.idx()));
            buses.set("name", names(b.names()));
            buses.set("voltage", NumericConversion.toJsonArray(b.voltage()));
            buses.set("angle", NumericConversion.toJsonArray(b.angle()));
        });

        ArrayNode genIdx = NODES.arrayNode();
        ArrayNode genP = NODES.arrayNode();
        ArrayNode genQ = NODES.arrayNode();
        for (String type : GENERATOR_TYPES) {
            pf.injections(type).ifPresent(t -> {
                genIdx.addAll(NumericConversion.toJsonArray(t.idx()));
                genP.addAll(NumericConversion.toJsonArray(t.p()));
                genQ.addAll(NumericConversion.toJsonArray(t.q()));
            });
        }
        if (!genIdx.isEmpty()) {
            ObjectNode gens = out.putObject("generators");
            gens.set("idx", genIdx);
            gens.set("p", genP);
            gens.set("q", genQ);
        }
        return out;
    }

    /**
     * Time-domain payload.
     *
     * @param variables names to include, looked up among state then algebraic variables; unknown
     *                  names are skipped. {@code null} selects every state variable.
     * @param maxPoints bound applied to the time axis and all selected series with one stride
     */
    public ToolResult timeDomain(ModelHandle model, List<String> variables, int maxPoints) {
        TimeDomainState tds = model.timeDomain();
        if (!tds.initialized()) {
            return ToolResult.failure(ErrorKind.PRECONDITION_FAILED, "Time-domain simulation not initialized");
        }
        DaeState dae = model.dae();
        ArrayNode time = NumericConversion.toJsonArray(tds.time());
        Downsampler.Plan plan = Downsampler.plan(time.size(), maxPoints);

        ObjectNode out = NODES.objectNode();
        out.put("initialized", true);
        out.put("converged", timeDomainConverged(tds));
        out.set("execTime", NumericConversion.toJson(tds.execTime()));
        out.set("time", plan.apply(time));
        out.put("nPoints", time.size());
        out.put("downsampled", plan.downsampled());
        if (plan.downsampled()) {
            out.put("downsampleFactor", plan.stride());
        }

        ObjectNode vars = out.putObject("variables");
        List<String> stateNames = dae.stateNames();
        if (variables == null) {
            for (int i = 0; i < stateNames.size(); i++) {
                vars.set(stateNames.get(i), plan.convertAndApply(tds.stateSeries(i)));
            }
        } else {
            List<String> algebraicNames = dae.algebraicNames();
            for (String name : variables) {
                int x = stateNames.indexOf(name);
                if (x >= 0) {
                    vars.set(name, plan.convertAndApply(tds.stateSeries(x)));
                    continue;
                }
                int y = algebraicNames.indexOf(name);
                if (y >= 0) {
                    vars.set(name, plan.convertAndApply(tds.algebraicSeries(y)));
                }
            }
        }
        return ToolResult.success(out);
    }

    /** A run converged only when it reported success and the engine raised no failure flag. */
    public static boolean timeDomainConverged(TimeDomainState tds) {
        return tds.succeeded() && !tds.busted();
    }

    public ToolResult eigen(ModelHandle model) {
        EigenState eig = model.eigen();
        if (!eig.computed()) {
            return ToolResult.failure(ErrorKind.PRECONDITION_FAILED, "Eigenvalue analysis has not been run yet");
        }
        ArrayNode real = NumericConversion.toJsonArray(eig.realParts());
        ArrayNode imag = NumericConversion.toJsonArray(eig.imagParts());
        if (real.size() != imag.size()) {
            throw new IllegalStateException("Engine returned " + real.size() + " real parts but "
                    + imag.size() + " imaginary parts");
        }

        ObjectNode out = NODES.objectNode();
        out.put("nEigenvalues", real.size());
        ObjectNode values = out.putObject("eigenvalues");
        values.set("real", real);
        values.set("imag", imag);
        out.putObject("statistics")
                .put("nPositive", eig.positiveCount())
                .put("nZeros", eig.zeroCount())
                .put("nNegative", eig.negativeCount());
        eig.participationFactors()
                .ifPresent(pf -> out.set("participationFactors", NumericConversion.toJson(pf)));
        List<String> stateNames = eig.stateNames();
        if (stateNames != null && !stateNames.isEmpty()) {
            ArrayNode arr = out.putArray("stateNames");
            stateNames.forEach(n -> arr.add(String.valueOf(n)));
        }
        out.set("execTime", NumericConversion.toJson(eig.execTime()));
        return ToolResult.success(out);
    }

    private static ArrayNode names(Object names) {
        ArrayNode arr = NODES.arrayNode();
        NumericConversion.toJsonArray(names).forEach(n -> arr.add(n.isNull() ? "" : n.asText()));
        return arr;
    }
}
