package cir.lang;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Types and mutability of declared variables. Entries are never removed, so a
 * name declared inside one body stays visible to everything generated after it.
 */
final class TypeEnvironment {

    /**
     * @param defined whether an immutable entry already has its macro
     */
    record Entry(String cType, boolean mutable, boolean defined) {}

    private final Map<String, Entry> variables = new HashMap<>();

    /** Declares or redeclares {@code name}; a redeclared immutable may be assigned again. */
    void declare(String name, String cType, boolean mutable) {
        variables.put(name, new Entry(cType, mutable, false));
    }

    /**
     * Records the single assignment of an immutable name.
     */
    void define(Token name) {
        var entry = lookup(name);
        if (entry.mutable()) {
            return;
        }
        if (entry.defined()) {
            throw new CompileException(CompileException.Phase.SEMANTIC, name,
                "Immutable " + name.lexeme() + " is already assigned. Declare it MUTABLE to assign it again.");
        }
        variables.put(name.lexeme(), new Entry(entry.cType(), false, true));
    }

    Optional<Entry> find(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    Entry lookup(Token name) {
        return find(name.lexeme()).orElseThrow(() -> new CompileException(CompileException.Phase.SEMANTIC, name,
            "Undeclared variable " + name.lexeme() + ". Did you forget a declaration?"));
    }

    /**
     * Best-effort type of a single token: {@code int} for number literals, the
     * recorded type for declared variables.
     */
    Optional<String> infer(Token token) {
        if (token.is(Token.Type.NUMBER)) {
            return Optional.of("int");
        }
        if (token.is(Token.Type.WORD)) {
            return find(token.lexeme()).map(Entry::cType);
        }
        return Optional.empty();
    }
}
