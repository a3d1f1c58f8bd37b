package io.github.drompincen.simgate.runtime.result;

import io.github.drompincen.simgate.protocol.api.ErrorKind;
import io.github.drompincen.simgate.runtime.engine.*;
import io.github.drompincen.simgate.runtime.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ResultSerializerTest {

    @Mock private ModelHandle model;
    @Mock private DaeState dae;
    @Mock private PowerFlowState pf;
    @Mock private TimeDomainState tds;
    @Mock private EigenState eig;

    private final ResultSerializer serializer = new ResultSerializer();

    @BeforeEach
    void setUp() {
        when(model.dae()).thenReturn(dae);
        when(model.powerFlow()).thenReturn(pf);
        when(model.timeDomain()).thenReturn(tds);
        when(model.eigen()).thenReturn(eig);
        when(dae.stateNames()).thenReturn(List.of("delta_GENROU_1", "omega_GENROU_1"));
        when(dae.algebraicNames()).thenReturn(List.of("v_Bus_1", "a_Bus_1", "v_Bus_2"));
        when(dae.stateCount()).thenReturn(2);
        when(dae.algebraicCount()).thenReturn(3);
    }

    @Test
    void systemInfoListsOnlyPopulatedComponents() {
        Map<String, ComponentCount> counts = new LinkedHashMap<>();
        counts.put("Bus", new ComponentCount(14, "ACTopology"));
        counts.put("PQ", new ComponentCount(11, "StaticLoad"));
        counts.put("GENCLS", new ComponentCount(0, "SynGen"));
        when(model.name()).thenReturn("ieee14");
        when(model.casePath()).thenReturn("/cases/ieee14.xlsx");
        when(model.isSetup()).thenReturn(true);
        when(model.componentCounts()).thenReturn(counts);
        when(model.frequency()).thenReturn(60.0);
        when(model.powerBase()).thenReturn(100.0);
        when(dae.time()).thenReturn(0.0);

        ObjectNode info = serializer.systemInfo(model);

        assertThat(info.get("name").asText()).isEqualTo("ieee14");
        assertThat(info.get("isSetup").asBoolean()).isTrue();
        assertThat(info.get("models").has("GENCLS")).isFalse();
        assertThat(info.at("/models/Bus/count").asInt()).isEqualTo(14);
        assertThat(info.at("/models/PQ/group").asText()).isEqualTo("StaticLoad");
        assertThat(info.at("/daeInfo/nStates").asInt()).isEqualTo(2);
        assertThat(info.at("/daeInfo/nAlgebraic").asInt()).isEqualTo(3);
        assertThat(info.at("/config/freq").asDouble()).isEqualTo(60.0);
        assertThat(info.at("/config/mva").asDouble()).isEqualTo(100.0);
    }

    @Test
    void blankNameBecomesUntitled() {
        when(model.name()).thenReturn(" ");
        when(model.componentCounts()).thenReturn(Map.of());

        assertThat(serializer.systemInfo(model).get("name").asText()).isEqualTo("Untitled");
    }

    @Test
    void nonConvergedPowerFlowOmitsArrays() {
        when(pf.converged()).thenReturn(false);
        when(pf.iterations()).thenReturn(25);

        ObjectNode out = serializer.powerFlow(model);

        assertThat(out.get("converged").asBoolean()).isFalse();
        assertThat(out.get("iterations").asInt()).isEqualTo(25);
        assertThat(out.get("error").asText()).isEqualTo("Power flow did not converge");
        assertThat(out.has("buses")).isFalse();
        assertThat(out.has("generators")).isFalse();
    }

    @Test
    void convergedPowerFlowConcatenatesGeneratorsInFixedOrder() {
        when(pf.converged()).thenReturn(true);
        when(pf.iterations()).thenReturn(4);
        when(pf.execTime()).thenReturn(0.023);
        when(pf.buses()).thenReturn(Optional.of(new BusTable(
                new int[] {1, 2}, List.of("Bus 1", "Bus 2"), new double[] {1.06, 1.045}, new double[] {0.0, -0.087})));
        when(pf.injections("PV")).thenReturn(Optional.of(new InjectionTable(
                List.of(2, 3), new double[] {0.4, 0.0}, new double[] {0.1, 0.2})));
        when(pf.injections("Slack")).thenReturn(Optional.of(new InjectionTable(
                List.of(1), new double[] {2.32}, new double[] {-0.16})));
        when(pf.injections("PQ")).thenReturn(Optional.empty());

        ObjectNode out = serializer.powerFlow(model);

        assertThat(out.get("converged").asBoolean()).isTrue();
        assertThat(out.get("iterations").asInt()).isEqualTo(4);
        assertThat(out.at("/buses/idx").toString()).isEqualTo("[1,2]");
        assertThat(out.at("/buses/name").toString()).isEqualTo("[\"Bus 1\",\"Bus 2\"]");
        assertThat(out.at("/buses/voltage/1").asDouble()).isEqualTo(1.045);
        assertThat(out.at("/generators/idx").toString()).isEqualTo("[1,2,3]");
        assertThat(out.at("/generators/p").toString()).isEqualTo("[2.32,0.4,0.0]");
        assertThat(out.at("/generators/q").toString()).isEqualTo("[-0.16,0.1,0.2]");
    }

    @Test
    void timeDomainBeforeInitializationIsPreconditionFailure() {
        when(tds.initialized()).thenReturn(false);

        ToolResult result = serializer.timeDomain(model, null, 100);

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.PRECONDITION_FAILED);
        assertThat(result.error()).contains("not initialized");
        assertThat(result.output()).isNull();
    }

    @Test
    void timeDomainDefaultsToAllStateVariables() {
        stubSeries(10);

        ToolResult result = serializer.timeDomain(model, null, 100);

        JsonNode out = result.output();
        assertThat(result.success()).isTrue();
        assertThat(out.get("converged").asBoolean()).isTrue();
        assertThat(out.get("nPoints").asInt()).isEqualTo(10);
        assertThat(out.get("downsampled").asBoolean()).isFalse();
        assertThat(out.has("downsampleFactor")).isFalse();
        assertThat(out.get("variables").fieldNames()).toIterable()
                .containsExactly("delta_GENROU_1", "omega_GENROU_1");
    }

    @Test
    void timeDomainSelectsStateThenAlgebraicAndSkipsUnknown() {
        stubSeries(10);

        ToolResult result = serializer.timeDomain(model,
                List.of("v_Bus_2", "nope", "omega_GENROU_1"), 100);

        JsonNode vars = result.output().get("variables");
        assertThat(vars.fieldNames()).toIterable().containsExactly("v_Bus_2", "omega_GENROU_1");
        assertThat(vars.get("v_Bus_2").get(3).asDouble()).isEqualTo(2003.0);
        assertThat(vars.get("omega_GENROU_1").get(3).asDouble()).isEqualTo(1003.0);
    }

    @Test
    void timeDomainDownsamplesEverySeriesWithSharedStride() {
        stubSeries(1000);

        ToolResult result = serializer.timeDomain(model, List.of("delta_GENROU_1", "v_Bus_1"), 100);

        JsonNode out = result.output();
        assertThat(out.get("downsampled").asBoolean()).isTrue();
        assertThat(out.get("downsampleFactor").asInt()).isEqualTo(10);
        assertThat(out.get("nPoints").asInt()).isEqualTo(1000);
        assertThat(out.get("time")).hasSize(100);
        assertThat(out.at("/variables/delta_GENROU_1")).hasSize(100);
        assertThat(out.at("/variables/v_Bus_1")).hasSize(100);
        for (int i = 0; i < 100; i++) {
            assertThat(out.get("time").get(i).asDouble()).isEqualTo(i * 10);
            assertThat(out.at("/variables/delta_GENROU_1").get(i).asDouble()).isEqualTo(i * 10);
            assertThat(out.at("/variables/v_Bus_1").get(i).asDouble()).isEqualTo(2000.0 + i * 10);
        }
    }

    @Test
    void bustedRunIsNotConverged() {
        stubSeries(5);
        when(tds.busted()).thenReturn(true);

        assertThat(serializer.timeDomain(model, null, 100).output().get("converged").asBoolean()).isFalse();
    }

    @Test
    void runReportingFailureIsNotConvergedEvenWithoutFailureFlag() {
        stubSeries(5);
        when(tds.succeeded()).thenReturn(false);

        JsonNode out = serializer.timeDomain(model, null, 100).output();

        assertThat(out.get("initialized").asBoolean()).isTrue();
        assertThat(out.get("converged").asBoolean()).isFalse();
    }

    @Test
    void eigenBeforeRunIsPreconditionFailure() {
        when(eig.computed()).thenReturn(false);

        ToolResult result = serializer.eigen(model);

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.PRECONDITION_FAILED);
        assertThat(result.error()).contains("not been run");
    }

    @Test
    void eigenEmitsParallelArraysAndClassification() {
        when(eig.computed()).thenReturn(true);
        when(eig.realParts()).thenReturn(new double[] {-0.5, 0.0, 0.2});
        when(eig.imagParts()).thenReturn(new double[] {6.1, 0.0, 0.0});
        when(eig.positiveCount()).thenReturn(1);
        when(eig.zeroCount()).thenReturn(1);
        when(eig.negativeCount()).thenReturn(1);
        when(eig.participationFactors()).thenReturn(Optional.<Object>of(new double[][] {{0.9, 0.1}, {0.1, 0.9}}));
        when(eig.stateNames()).thenReturn(List.of("delta_GENROU_1", "omega_GENROU_1"));
        when(eig.execTime()).thenReturn(0.01);

        ToolResult result = serializer.eigen(model);

        JsonNode out = result.output();
        assertThat(result.success()).isTrue();
        assertThat(out.get("nEigenvalues").asInt()).isEqualTo(3);
        assertThat(out.at("/eigenvalues/real").toString()).isEqualTo("[-0.5,0.0,0.2]");
        assertThat(out.at("/eigenvalues/imag").toString()).isEqualTo("[6.1,0.0,0.0]");
        assertThat(out.at("/statistics/nPositive").asInt()).isEqualTo(1);
        assertThat(out.at("/statistics/nZeros").asInt()).isEqualTo(1);
        assertThat(out.at("/statistics/nNegative").asInt()).isEqualTo(1);
        assertThat(out.get("participationFactors").get(0).toString()).isEqualTo("[0.9,0.1]");
        assertThat(out.get("stateNames")).hasSize(2);
    }

    @Test
    void eigenOmitsOptionalSectionsWhenAbsent() {
        when(eig.computed()).thenReturn(true);
        when(eig.realParts()).thenReturn(List.of(-1.0));
        when(eig.imagParts()).thenReturn(List.of(0.0));
        when(eig.participationFactors()).thenReturn(Optional.empty());
        when(eig.stateNames()).thenReturn(List.of());

        JsonNode out = serializer.eigen(model).output();

        assertThat(out.has("participationFactors")).isFalse();
        assertThat(out.has("stateNames")).isFalse();
    }

    /** Time axis 0..n-1, state i = 1000*i + k, algebraic j = 2000 + 1000*j + k. */
    private void stubSeries(int n) {
        double[] time = new double[n];
        for (int k = 0; k < n; k++) time[k] = k;
        when(tds.initialized()).thenReturn(true);
        when(tds.succeeded()).thenReturn(true);
        when(tds.busted()).thenReturn(false);
        when(tds.execTime()).thenReturn(1.2);
        when(tds.time()).thenReturn(time);
        for (int i = 0; i < 2; i++) {
            when(tds.stateSeries(i)).thenReturn(offset(time, 1000.0 * i));
        }
        for (int j = 0; j < 3; j++) {
            when(tds.algebraicSeries(j)).thenReturn(offset(time, 2000.0 + 1000.0 * j));
        }
    }

    private static double[] offset(double[] base, double delta) {
        double[] out = new double[base.length];
        for (int k = 0; k < base.length; k++) out[k] = base[k] + delta;
        return out;
    }
}
