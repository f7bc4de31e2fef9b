package com.challenges.stagedb.pipeline;

import java.util.Objects;

/**
 * What a {@link WorkUnit} carries. Raw statement text and final answers are the two
 * variants every pipeline knows about; stages add their own typed payloads.
 */
public interface Payload {

    /**
     * Short text used in traces and exhaustion reports.
     */
    String describe();

    /**
     * Statement text that no parser has consumed yet.
     */
    record Statement(String text) implements Payload {
        public Statement {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String describe() {
            return text;
        }
    }

    /**
     * The final answer of a run, either a success message or an error.
     */
    record Terminal(String text, boolean error) implements Payload {
        public static final String ERROR_PREFIX = "ERROR: ";

        public Terminal {
            Objects.requireNonNull(text, "text");
        }

        public static Terminal success(String text) {
            return new Terminal(text, false);
        }

        public static Terminal error(String message) {
            return new Terminal(message, true);
        }

        /**
         * Text as shown to the caller; errors carry the {@code ERROR: } prefix.
         */
        public String render() {
            return error ? ERROR_PREFIX + text : text;
        }

        @Override
        public String describe() {
            return "terminal: " + render();
        }
    }
}
