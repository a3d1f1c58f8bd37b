package io.github.drompincen.simgate.tools;

import io.github.drompincen.simgate.protocol.api.ToolRiskProfile;
import io.github.drompincen.simgate.runtime.cases.CaseCatalog;
import io.github.drompincen.simgate.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Set;

public class ListAvailableCasesTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private CaseCatalog caseCatalog;

    @Override public String name() { return "list_available_cases"; }
    @Override public String description() { return "List the built-in case files that load_case accepts by relative path"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        return schema;
    }

    @Override public JsonNode outputSchema() { return MAPPER.createObjectNode().put("type", "object"); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.READ_ONLY); }

    public void setCaseCatalog(CaseCatalog caseCatalog) {
        this.caseCatalog = caseCatalog;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (caseCatalog == null) {
            return ToolResult.failure("Case catalog not available");
        }
        List<String> cases;
        try {
            cases = caseCatalog.listCases();
        } catch (UncheckedIOException e) {
            return ToolResult.failure("Failed to list cases: " + e.getMessage());
        }
        ObjectNode result = MAPPER.createObjectNode();
        ArrayNode arr = result.putArray("cases");
        cases.forEach(arr::add);
        result.put("count", cases.size());
        result.put("casesDir", caseCatalog.root().toString());
        return ToolResult.success(result);
    }
}
