package com.healthbud.assessment;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * A JSON object recovered from model text, tagged with the step that produced it.
 */
public final class ParseOutcome {

    public enum Stage {
        /** The cleaned text was a JSON object. */
        STRICT,
        /** Only the span between the first '{' and the last '}' parsed. */
        BRACE_SPAN,
        /** Nothing parsed; the text itself became the message and summary. */
        SYNTHESIZED
    }

    public final Stage stage;
    public final ObjectNode value;

    ParseOutcome(Stage stage, ObjectNode value) {
        this.stage = Objects.requireNonNull(stage, "stage");
        this.value = Objects.requireNonNull(value, "value");
    }
}
