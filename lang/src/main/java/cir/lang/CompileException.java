package cir.lang;

import lombok.Getter;

/**
 * The single failure signal of the pipeline. Every error aborts the whole run;
 * nothing is generated from a partially valid program.
 */
@Getter
public class CompileException extends RuntimeException {

    public enum Phase {
        LEXICAL,
        INDENTATION,
        GRAMMAR,
        SEMANTIC,
        INTERNAL;

        @Override
        public String toString() {
            return name().toLowerCase();
        }
    }

    private final Phase phase;

    // 0 when the failure is not tied to a source position
    private final int line;
    private final int column;

    CompileException(Phase phase, int line, int column, String message) {
        super(message);
        this.phase = phase;
        this.line = line;
        this.column = column;
    }

    CompileException(Phase phase, Token token, String message) {
        this(phase, token != null ? token.line() : 0, token != null ? token.column() : 0, message);
    }

    CompileException(Phase phase, String message) {
        this(phase, 0, 0, message);
    }

    public boolean hasPosition() {
        return line > 0;
    }
}
