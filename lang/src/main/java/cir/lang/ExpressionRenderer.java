package cir.lang;

import static cir.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns the raw tokens of a condition, assignment or argument list back into
 * C text. The rewrite is purely textual: the word operators are replaced by
 * their C symbols and spacing is normalized, nothing is checked.
 */
final class ExpressionRenderer {

    private static final Map<String, String> wordOperators = Map.of(
        "and", "&&",
        "or", "||",
        "is", "==");

    private ExpressionRenderer() {}

    static String render(List<Token> tokens) {
        var visible = new ArrayList<Token>();
        for (var token : tokens) {
            if (!token.is(SPACES) && !token.is(LINE_BREAK) && !token.is(COMMENT)) {
                visible.add(token);
            }
        }

        var out = new StringBuilder();
        Token previous = null;
        var previousUnary = false;
        for (var token : visible) {
            var unary = isUnary(token, previous);
            if (previous != null && spaceBetween(previous, previousUnary, token)) {
                out.append(' ');
            }
            out.append(text(token));
            previous = token;
            previousUnary = unary;
        }
        return out.toString().trim();
    }

    private static String text(Token token) {
        if (token.is(RETURN_TYPE)) {
            return "->";
        }
        if (token.is(OPERATOR)) {
            return wordOperators.getOrDefault(token.lexeme(), token.lexeme());
        }
        return token.lexeme();
    }

    private static boolean isUnary(Token token, Token previous) {
        if (!token.is(OPERATOR)) {
            return false;
        }
        switch (token.lexeme()) {
            case "!":
            case "~":
                return true;
            case "-":
            case "+":
                return previous == null
                    || previous.is(PAREN_LEFT)
                    || previous.is(COMMA)
                    || previous.is(SET_EQUALS)
                    || (previous.is(OPERATOR) && !isClosing(previous));
            default:
                return false;
        }
    }

    private static boolean isClosing(Token token) {
        return token.is(OPERATOR) && "]".equals(token.lexeme());
    }

    private static boolean isTight(Token token) {
        return token.is(RETURN_TYPE)
            || (token.is(OPERATOR) && ("[".equals(token.lexeme()) || ".".equals(token.lexeme())));
    }

    private static boolean spaceBetween(Token previous, boolean previousUnary, Token token) {
        if (previousUnary || previous.is(PAREN_LEFT) || isTight(previous)) {
            return false;
        }
        if (token.is(PAREN_RIGHT) || token.is(COMMA) || isTight(token) || isClosing(token)) {
            return false;
        }
        if (token.is(PAREN_LEFT) && (previous.is(WORD) || isClosing(previous))) {
            return false;
        }
        return true;
    }
}
