package com.bat.core.llm;

import com.bat.core.model.DelegationDecision;
import com.bat.core.model.ToolSelection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Schema-checked decoding of oracle replies into decisions.
 * <p>
 * Replies may be wrapped in Markdown code fences; those are stripped before parsing.
 * Any protocol violation raises {@link OracleResponseUnparseableException}, which keeps
 * "the oracle said something malformed" apart from "the oracle said no".
 */
@Component
public class OracleResponseDecoder {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*|\\s*```");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    @Autowired
    public OracleResponseDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public OracleResponseDecoder() {
        this(new ObjectMapper());
    }

    /**
     * Decodes {@code {"tool": string, "input": object}}.
     */
    public ToolSelection decodeToolSelection(String raw) {
        JsonNode root = readObject(raw, "tool selection");
        JsonNode tool = root.get("tool");
        if (tool == null || !tool.isTextual() || tool.asText().isBlank()) {
            throw new OracleResponseUnparseableException("Tool selection reply has no \"tool\" name", raw);
        }
        JsonNode input = root.get("input");
        if (input != null && !input.isNull() && !input.isObject()) {
            throw new OracleResponseUnparseableException("Tool selection \"input\" must be an object", raw);
        }
        Map<String, Object> inputMap = input == null || input.isNull()
                ? Map.of()
                : mapper.convertValue(input, MAP_TYPE);
        return new ToolSelection(tool.asText(), inputMap);
    }

    /**
     * Decodes {@code {"shouldDelegate": boolean, "reason": string, "targetAgentRole": string}}.
     */
    public DelegationDecision decodeDelegation(String raw) {
        JsonNode root = readObject(raw, "delegation");
        JsonNode should = root.get("shouldDelegate");
        if (should == null || !should.isBoolean()) {
            throw new OracleResponseUnparseableException("Delegation reply needs a boolean \"shouldDelegate\"", raw);
        }
        String reason = textOrNull(root.get("reason"));
        String target = textOrNull(root.get("targetAgentRole"));
        if (should.asBoolean() && (target == null || target.isBlank())) {
            throw new OracleResponseUnparseableException("Delegation reply has no \"targetAgentRole\"", raw);
        }
        return new DelegationDecision(should.asBoolean(), reason, target);
    }

    /**
     * Decodes the bare yes/no capability answer.
     *
     * @return true for "yes", false for "no"
     * @throws OracleResponseUnparseableException for any other literal
     */
    public boolean decodeCapability(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if ("yes".equals(normalized)) {
            return true;
        }
        if ("no".equals(normalized)) {
            return false;
        }
        throw new OracleResponseUnparseableException("Capability reply is neither \"yes\" nor \"no\"", raw);
    }

    static String stripCodeFences(String raw) {
        return CODE_FENCE.matcher(raw.trim()).replaceAll("").trim();
    }

    private JsonNode readObject(String raw, String kind) {
        if (raw == null || raw.isBlank()) {
            throw new OracleResponseUnparseableException("Empty " + kind + " reply", raw);
        }
        JsonNode root;
        try {
            root = mapper.readTree(stripCodeFences(raw));
        } catch (JsonProcessingException e) {
            throw new OracleResponseUnparseableException("Malformed " + kind + " JSON: " + e.getOriginalMessage(), raw, e);
        }
        if (root == null || !root.isObject()) {
            throw new OracleResponseUnparseableException("The " + kind + " reply is not a JSON object", raw);
        }
        return root;
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
