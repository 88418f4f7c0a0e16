package com.geico.poc.kqlcompiler.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the JSON text printed by the external KQL parser.
 *
 * The parser prints either the tree ({@code {"statements": [...]}}) or an error payload
 * {@code {"error": "<tag>", "details": "<message>"}}. The error payload becomes a
 * {@link KqlParseException}; it is never returned as if it were a tree.
 */
public class ParserOutputReader {

    public static final String OUTPUT_ERROR = "Unreadable parser output";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public JsonNode read(String output) throws KqlParseException {
        if (output == null || output.trim().isEmpty()) {
            throw new KqlParseException(OUTPUT_ERROR, "parser produced no output");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(output);
        } catch (JsonProcessingException e) {
            throw new KqlParseException(OUTPUT_ERROR, e.getOriginalMessage(), e);
        }

        if (node == null || !node.isObject()) {
            throw new KqlParseException(OUTPUT_ERROR, "expected a JSON object");
        }
        if (node.has("error")) {
            JsonNode details = node.get("details");
            throw new KqlParseException(node.get("error").asText(),
                    details == null || details.isNull() ? null : details.asText());
        }
        return node;
    }
}
