package cir.lang;

import static cir.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Splits CIR source into tokens by trying an ordered list of patterns at each
 * position; the first pattern that matches wins. Nothing is discarded, so the
 * lexemes of the result concatenate back to the source text.
 */
@RequiredArgsConstructor
final class Scanner {

    private static record Rule(Pattern pattern, Token.Type type) {}

    private static final List<Rule> rules = List.of(
        rule("(?i:" + String.join("|", Keyword.spellings()) + ")\\b", KEYWORD),
        rule("//[^\\r\\n]*", COMMENT),
        rule("[ \\t]+", SPACES),
        rule(":", COLON),
        rule("->|→", RETURN_TYPE),
        rule("(?:and|or|is)\\b", OPERATOR),
        rule("[A-Za-z_][A-Za-z0-9_]*", WORD),
        rule("[0-9]+", NUMBER),
        rule("[\\r\\n]+", LINE_BREAK),
        rule("&&|\\|\\||<<|>>|==|!=|<=|>=|[-+*/%!~^|&<>\\[\\].]", OPERATOR),
        rule("\\(", PAREN_LEFT),
        rule("\\)", PAREN_RIGHT),
        rule(",", COMMA),
        rule("=", SET_EQUALS));

    private static Rule rule(String regex, Token.Type type) {
        return new Rule(Pattern.compile(regex), type);
    }

    private final @NonNull String source;
    private final List<Token> tokens = new ArrayList<>();

    private int current = 0;
    private int lineStart = 0;
    private int line = 1;

    List<Token> getTokens() {
        if (!tokens.isEmpty() || source.isEmpty()) {
            return tokens;
        }

        var matchers = new ArrayList<Matcher>(rules.size());
        for (var rule : rules) {
            matchers.add(rule.pattern().matcher(source));
        }

        while (!isAtEnd()) {
            scanToken(matchers);
        }
        return tokens;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private void scanToken(List<Matcher> matchers) {
        for (int i = 0; i < rules.size(); i++) {
            var matcher = matchers.get(i);
            matcher.region(current, source.length());
            if (matcher.lookingAt()) {
                addToken(rules.get(i).type(), matcher.group());
                return;
            }
        }
        throw error("Unknown character: '" + source.charAt(current) + "'");
    }

    private void addToken(Token.Type type, String text) {
        var token = new Token(type, text, line, 1 + current - lineStart);
        if (type == SPACES && text.indexOf(' ') >= 0 && text.indexOf('\t') >= 0) {
            throw new CompileException(CompileException.Phase.LEXICAL, token, "Cannot mix tabs and spaces");
        }
        tokens.add(token);
        current += text.length();

        if (type == LINE_BREAK) {
            for (var c : text.toCharArray()) {
                if (c == '\n') {
                    line++;
                }
            }
            lineStart = current;
        }
    }

    private CompileException error(String message) {
        return new CompileException(CompileException.Phase.LEXICAL, line, 1 + current - lineStart, message);
    }
}
