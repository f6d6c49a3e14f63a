package com.company.matching.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.Set;

/**
 * Strict parser for oracle verdicts.
 *
 * <p>The response body, ignoring surrounding whitespace, must be exactly one JSON object:</p>
 * <pre>
 * {"is_match": true, "confidence": "medium", "reason": "same ABN holder"}
 * </pre>
 * <p>Missing fields, wrong JSON types, unknown or repeated fields, unknown confidence levels and any prose
 * or code fences around the object are rejected. No recovery is attempted.</p>
 */
public class VerdictParser {

    static final String IS_MATCH = "is_match";
    static final String CONFIDENCE = "confidence";
    static final String REASON = "reason";

    private static final Set<String> ALLOWED_FIELDS = Set.of(IS_MATCH, CONFIDENCE, REASON);

    private final ObjectMapper objectMapper;

    public VerdictParser() {
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY);
    }

    /**
     * Parses a raw oracle response.
     *
     * @throws VerdictParseException if the response does not match the verdict schema
     */
    public Verdict parse(String response) {
        if (response == null || response.isBlank()) {
            throw new VerdictParseException("Empty oracle response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.strip());
        } catch (JsonProcessingException e) {
            throw new VerdictParseException("Response is not a single JSON object: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new VerdictParseException("Response must be a JSON object");
        }

        Iterator<String> fieldNames = root.fieldNames();
        while (fieldNames.hasNext()) {
            String field = fieldNames.next();
            if (!ALLOWED_FIELDS.contains(field)) {
                throw new VerdictParseException("Unexpected field in verdict: '" + field + "'");
            }
        }

        JsonNode isMatch = requireField(root, IS_MATCH);
        if (!isMatch.isBoolean()) {
            throw new VerdictParseException(IS_MATCH + " must be a boolean");
        }

        JsonNode confidence = requireField(root, CONFIDENCE);
        if (!confidence.isTextual()) {
            throw new VerdictParseException(CONFIDENCE + " must be a string");
        }

        JsonNode reason = requireField(root, REASON);
        if (!reason.isTextual()) {
            throw new VerdictParseException(REASON + " must be a string");
        }

        return new Verdict(isMatch.booleanValue(),
                Confidence.fromWireValue(confidence.textValue()),
                reason.textValue());
    }

    private JsonNode requireField(JsonNode root, String name) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            throw new VerdictParseException("Missing field in verdict: '" + name + "'");
        }
        return node;
    }
}
