package com.healthbud.assessment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.healthbud.errors.MalformedResponseException;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Recovers a JSON object from untrusted model output.
 *
 * <p>Steps run in order and the first one that yields an object wins:
 * strip code fence, strict parse, brace-span parse, synthesize a minimal object.
 * Only text that is empty after cleaning is rejected.
 */
public class LenientJsonParser {

    private static final String FENCE = "```";
    private static final Pattern LANGUAGE_TAG = Pattern.compile("[A-Za-z0-9_+.-]*");

    private final ObjectMapper jsonMapper;

    public LenientJsonParser(ObjectMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    public ParseOutcome parse(String raw) throws MalformedResponseException {
        String cleaned = stripCodeFence(raw);
        if (cleaned.isEmpty()) {
            throw new MalformedResponseException("Model returned an empty response");
        }

        Optional<ObjectNode> strict = parseStrict(cleaned);
        if (strict.isPresent()) {
            return new ParseOutcome(ParseOutcome.Stage.STRICT, strict.get());
        }

        Optional<ObjectNode> span = parseBraceSpan(cleaned);
        if (span.isPresent()) {
            return new ParseOutcome(ParseOutcome.Stage.BRACE_SPAN, span.get());
        }

        return new ParseOutcome(ParseOutcome.Stage.SYNTHESIZED, synthesizeMinimal(cleaned));
    }

    /**
     * Removes a surrounding markdown fence and its optional language tag, then trims.
     */
    static String stripCodeFence(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.trim();
        if (text.startsWith(FENCE)) {
            text = text.substring(FENCE.length());
            int newline = text.indexOf('\n');
            if (newline >= 0 && LANGUAGE_TAG.matcher(text.substring(0, newline).trim()).matches()) {
                text = text.substring(newline + 1);
            }
        }
        if (text.endsWith(FENCE)) {
            text = text.substring(0, text.length() - FENCE.length());
        }
        return text.trim();
    }

    Optional<ObjectNode> parseStrict(String text) {
        try {
            JsonNode node = jsonMapper.readTree(text);
            if (node != null && node.isObject()) {
                return Optional.of((ObjectNode) node);
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    Optional<ObjectNode> parseBraceSpan(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return parseStrict(text.substring(start, end + 1));
    }

    ObjectNode synthesizeMinimal(String text) {
        ObjectNode node = jsonMapper.createObjectNode();
        node.put("assistant_message", text);
        node.put("summary", text);
        return node;
    }
}
