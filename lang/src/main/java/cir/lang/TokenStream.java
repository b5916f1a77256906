package cir.lang;

import static cir.lang.Token.Type.SPACES;

import java.util.List;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Cursor over scanned tokens. Runs of spaces inside a line are hidden from the
 * plain {@code peek}/{@code advance} calls; the {@code Hidden} variants see
 * every token, which is how leading indentation is read.
 *
 * <p>Peeking past the last token yields {@code null}.
 */
@RequiredArgsConstructor
public final class TokenStream {

    private final @NonNull List<Token> tokens;

    private int current = 0;
    private Token previous = null;

    public Token previous() {
        return previous;
    }

    public boolean isAtEnd() {
        return current >= tokens.size();
    }

    public boolean isAtVisibleEnd() {
        return nextVisible(current) >= tokens.size();
    }

    public Token peek() {
        return peek(0);
    }

    /**
     * Looks {@code offset} visible tokens ahead of the cursor.
     */
    public Token peek(int offset) {
        var index = nextVisible(current);
        for (int i = 0; i < offset && index < tokens.size(); i++) {
            index = nextVisible(index + 1);
        }
        return index < tokens.size() ? tokens.get(index) : null;
    }

    public Token peekHidden() {
        return isAtEnd() ? null : tokens.get(current);
    }

    public Token advance() {
        current = nextVisible(current);
        return advanceHidden();
    }

    public Token advanceHidden() {
        if (isAtEnd()) {
            throw new IllegalStateException("advance past the last token");
        }
        previous = tokens.get(current++);
        return previous;
    }

    public void skipHidden() {
        current = nextVisible(current);
    }

    /**
     * Position to hand back to {@link #reset(int)}.
     */
    public int mark() {
        return current;
    }

    public void reset(int mark) {
        if (mark < 0 || mark > current) {
            throw new IllegalArgumentException("cannot reset forward to " + mark + " from " + current);
        }
        current = mark;
        previous = mark > 0 ? tokens.get(mark - 1) : null;
    }

    public List<Token> remaining() {
        return List.copyOf(tokens.subList(current, tokens.size()));
    }

    private int nextVisible(int index) {
        while (index < tokens.size() && tokens.get(index).type() == SPACES) {
            index++;
        }
        return index;
    }
}
