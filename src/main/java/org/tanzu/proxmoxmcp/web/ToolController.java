package org.tanzu.proxmoxmcp.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST access to the MCP tools for clients that do not speak MCP.
 * 
 * GET /health reports liveness, GET /api/tools lists the tool catalogue with
 * input schemas, and POST /api/tools/{name} runs a tool with the JSON request
 * body as its arguments. Tools block while Proxmox tasks run, so calls are
 * moved off the event loop.
 */
@RestController
public class ToolController {

    private static final Logger logger = LoggerFactory.getLogger(ToolController.class);

    private final Map<String, ToolCallback> tools = new LinkedHashMap<>();

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ToolController(@Qualifier("registerTools") List<ToolCallback> toolCallbacks) {
        for (ToolCallback callback : toolCallbacks) {
            tools.put(callback.getToolDefinition().name(), callback);
        }
        logger.info("REST tool endpoint serving {} tools", tools.size());
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("tools", tools.size());
        return health;
    }

    @GetMapping("/api/tools")
    public List<ToolSummary> listTools() {
        List<ToolSummary> summaries = new ArrayList<>();
        for (ToolCallback callback : tools.values()) {
            ToolDefinition definition = callback.getToolDefinition();
            summaries.add(new ToolSummary(definition.name(), definition.description(), parseSchema(definition.inputSchema())));
        }
        return summaries;
    }

    @PostMapping(value = "/api/tools/{name}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<String>> callTool(@PathVariable String name, @RequestBody(required = false) String body) {
        ToolCallback callback = tools.get(name);
        if (callback == null) {
            return Mono.just(error(HttpStatus.NOT_FOUND, "Unknown tool '" + name + "'"));
        }
        String arguments = body == null || body.isBlank() ? "{}" : body;
        try {
            if (!objectMapper.readTree(arguments).isObject()) {
                return Mono.just(error(HttpStatus.BAD_REQUEST, "Tool arguments must be a JSON object"));
            }
        } catch (JsonProcessingException e) {
            return Mono.just(error(HttpStatus.BAD_REQUEST, "Invalid JSON arguments: " + e.getOriginalMessage()));
        }

        logger.info("=== REST TOOL CALL: {} ===", name);
        return Mono.fromCallable(() -> ResponseEntity.ok()
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(callback.call(arguments)))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(RuntimeException.class, e -> {
                    logger.error("Tool {} failed: {}", name, e.getMessage(), e);
                    return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage()));
                });
    }

    private ResponseEntity<String> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", message);
        try {
            return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize error body", e);
        }
    }

    private JsonNode parseSchema(String schema) {
        try {
            return objectMapper.readTree(schema);
        } catch (JsonProcessingException e) {
            logger.warn("Tool input schema is not valid JSON: {}", e.getOriginalMessage());
            return objectMapper.createObjectNode();
        }
    }

    /**
     * Data class representing one entry of the tool catalogue.
     */
    public static class ToolSummary {
        private final String name;
        private final String description;
        private final JsonNode inputSchema;

        public ToolSummary(String name, String description, JsonNode inputSchema) {
            this.name = name;
            this.description = description;
            this.inputSchema = inputSchema;
        }

        public String getName() { return name; }
        public String getDescription() { return description; }
        public JsonNode getInputSchema() { return inputSchema; }
    }
}
