package cir.lang;

import lombok.NonNull;

record Token(
    @NonNull Type type,
    @NonNull String lexeme,
    int line,
    int column) {

    Token(Type type, String lexeme) {
        this(type, lexeme, 0, 0);
    }

    boolean is(Type type) {
        return this.type == type;
    }

    boolean isKeyword(Keyword keyword) {
        return type == Type.KEYWORD && Keyword.lookup(lexeme) == keyword;
    }

    @Override
    public String toString() {
        var text = lexeme.replace("\t", "\\t").replace("\r", "\\r").replace("\n", "\\n");
        return "(Token " + type + " \"" + text + "\" " + line + ":" + column + ")";
    }

    enum Type {
        WORD,
        KEYWORD,
        NUMBER,

        // punctuation
        COLON,
        SET_EQUALS,
        PAREN_LEFT,
        PAREN_RIGHT,
        COMMA,
        RETURN_TYPE,
        OPERATOR,

        // layout
        SPACES,
        LINE_BREAK,
        COMMENT;
    }
}
