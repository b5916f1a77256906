package cir.lang;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

enum Keyword {
    STRUCTURE,
    METHOD,
    REPEAT,
    TIMES,
    SETMODE,
    DEFAULT,
    DEFINE,
    CHOOSE,
    FOR,
    TO,
    PASS,
    TODO,
    RETURN,
    IF,
    WHILE,
    ELSE,
    ELSEIF("ELSIF", "ELIF"),
    MUTABLE;

    private final List<String> aliases;

    Keyword(String... aliases) {
        this.aliases = List.of(aliases);
    }

    private static final Map<String, Keyword> bySpelling = Arrays.stream(values())
        .flatMap(k -> Stream.concat(Stream.of(k.name()), k.aliases.stream()).map(s -> Map.entry(s, k)))
        .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

    /**
     * Every accepted spelling, longest first, so that a pattern built from them
     * prefers {@code ELSEIF} over {@code ELSE}.
     */
    static List<String> spellings() {
        return bySpelling.keySet().stream()
            .sorted((a, b) -> b.length() != a.length() ? b.length() - a.length() : a.compareTo(b))
            .collect(Collectors.toList());
    }

    /**
     * Case-insensitive lookup; {@code null} if the text is not a keyword.
     */
    static Keyword lookup(String text) {
        return bySpelling.get(text.toUpperCase(Locale.ROOT));
    }
}
