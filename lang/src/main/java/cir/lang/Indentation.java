package cir.lang;

import lombok.Getter;

/**
 * Indentation context of the parser. The unit width is fixed by the first
 * leading-whitespace run ever measured; every later run must be a whole number
 * of units.
 */
@Getter
final class Indentation {

    /** Saved state, restored when a line turns out to belong to an enclosing block. */
    record Snapshot(int mark, int level) {}

    private int level = 0;

    // 0 until the first indented line is seen
    private int unit = 0;

    /**
     * Consumes the leading whitespace at the cursor, if any, and makes the
     * resulting level current.
     */
    int measure(TokenStream tokens) {
        var token = tokens.peekHidden();
        if (token == null || !token.is(Token.Type.SPACES)) {
            level = 0;
            return level;
        }

        var width = token.lexeme().length();
        if (unit == 0) {
            unit = width;
        } else if (width % unit != 0) {
            throw new CompileException(CompileException.Phase.INDENTATION, token,
                "Improper indentation: Expected a multiple of " + unit + " space(s), got " + width + ".");
        }
        tokens.advanceHidden();
        level = width / unit;
        return level;
    }

    Snapshot snapshot(TokenStream tokens) {
        return new Snapshot(tokens.mark(), level);
    }

    void restore(TokenStream tokens, Snapshot snapshot) {
        tokens.reset(snapshot.mark());
        level = snapshot.level();
    }
}
