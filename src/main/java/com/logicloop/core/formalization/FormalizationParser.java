package com.logicloop.core.formalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * FormalizationParser: raw generator payload → Formalization.
 *
 * CANONICAL JSON SCHEMA (what the generator must return):
 * {
 *   "predicates": { "Human(x)": "x is human", ... },
 *   "premises":   [ "∀x (Human(x) → Mortal(x))", "Human(socrates)" ],
 *   "conclusion": "Mortal(socrates)"
 * }
 *
 * Strips markdown code fences and leading prose before the first '{'.
 * "predicates" may also be an array of signatures (glosses left empty).
 *
 * NEVER THROWS: any other shape yields Formalization.failed(reason).
 */
@Component
public class FormalizationParser {

    private static final Logger log = LoggerFactory.getLogger(FormalizationParser.class);

    private final ObjectMapper mapper;

    public FormalizationParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Formalization parse(String raw) {
        if (raw == null || raw.isBlank()) {
            log.warn("[Parser] Null/blank payload");
            return Formalization.failed("Malformed payload: empty response");
        }

        try {
            String cleaned = raw.trim();

            // Strip markdown fences
            if (cleaned.startsWith("```")) {
                int start = cleaned.indexOf('\n') + 1;
                int end   = cleaned.lastIndexOf("```");
                if (start > 0 && end > start) cleaned = cleaned.substring(start, end).trim();
            }

            // Skip leading prose to first '{'
            int jsonStart = cleaned.indexOf('{');
            if (jsonStart < 0) {
                return Formalization.failed("Malformed payload: no JSON object found");
            }
            cleaned = cleaned.substring(jsonStart);

            JsonNode root = mapper.readTree(cleaned);
            if (root == null || !root.isObject()) {
                return Formalization.failed("Malformed payload: top-level JSON value is not an object");
            }

            JsonNode premisesNode   = root.get("premises");
            JsonNode conclusionNode = root.get("conclusion");

            if (premisesNode == null || !premisesNode.isArray()) {
                return Formalization.failed("Malformed payload: missing field 'premises' (array of strings)");
            }
            if (conclusionNode == null || !conclusionNode.isTextual()) {
                return Formalization.failed("Malformed payload: missing field 'conclusion' (string)");
            }

            List<String> premises = new ArrayList<>();
            for (JsonNode p : premisesNode) {
                if (!p.isTextual()) {
                    return Formalization.failed("Malformed payload: premise is not a string: " + p);
                }
                String text = p.asText().trim();
                if (!text.isEmpty()) premises.add(text);
            }

            Map<String, String> predicates = readPredicates(root.get("predicates"));

            log.info("[Parser] Parsed {} predicates, {} premises", predicates.size(), premises.size());
            return Formalization.of(predicates, premises, conclusionNode.asText().trim());

        } catch (Exception e) {
            log.warn("[Parser] JSON parse failed: {}", e.getMessage());
            return Formalization.failed("Malformed payload: invalid JSON (" + firstLine(e.getMessage()) + ")");
        }
    }

    private static Map<String, String> readPredicates(JsonNode node) {
        Map<String, String> out = new LinkedHashMap<>();
        if (node == null || node.isNull()) return out;

        if (node.isObject()) {
            node.fields().forEachRemaining(e -> out.put(e.getKey().trim(), e.getValue().asText()));
        } else if (node.isArray()) {
            for (JsonNode sig : node) {
                String text = sig.asText().trim();
                if (!text.isEmpty()) out.putIfAbsent(text, "");
            }
        }
        return out;
    }

    private static String firstLine(String message) {
        if (message == null) return "unknown error";
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }
}
