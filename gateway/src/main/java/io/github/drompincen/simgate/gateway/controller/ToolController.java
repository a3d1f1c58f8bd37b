package io.github.drompincen.simgate.gateway.controller;

import io.github.drompincen.simgate.protocol.api.ToolDescriptor;
import io.github.drompincen.simgate.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tools")
public class ToolController {

    private final ToolRegistry toolRegistry;

    public ToolController(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    @GetMapping
    public List<ToolDescriptor> list() {
        return toolRegistry.descriptors();
    }

    @GetMapping("/{name}")
    public ResponseEntity<ToolDescriptor> describe(@PathVariable String name) {
        return toolRegistry.get(name)
                .map(t -> ResponseEntity.ok(ToolRegistry.describe(t)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{name}/invoke")
    public ResponseEntity<Map<String, Object>> invoke(@PathVariable String name,
                                                      @RequestBody(required = false) JsonNode input,
                                                      @RequestHeader(value = "X-Caller-Id", required = false) String callerId) {
        return toolRegistry.get(name).map(tool -> {
            JsonNode args = input != null ? input : JsonNodeFactory.instance.objectNode();
            ToolContext ctx = new ToolContext(callerId != null ? callerId : "rest");
            ToolResult result = tool.execute(ctx, args, ToolStream.noop());
            return ResponseEntity.ok(toBody(result));
        }).orElse(ResponseEntity.notFound().build());
    }

    static Map<String, Object> toBody(ToolResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", result.success());
        if (result.success()) {
            body.put("output", result.output());
        } else {
            body.put("error", result.error());
            body.put("errorKind", result.errorKind());
        }
        return body;
    }
}
