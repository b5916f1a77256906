package cir.lang;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps CIR type names to C types. Structure names map to themselves, as the
 * generator emits a typedef for each.
 */
final class TypeTable {

    private final Map<String, String> types = new LinkedHashMap<>(Map.of(
        "Int", "int",
        "Byte", "uint8_t"));

    void addStructure(String name) {
        types.put(name, name);
    }

    String resolve(Token at, String name) {
        var type = types.get(name);
        if (type == null) {
            throw new CompileException(CompileException.Phase.SEMANTIC, at, "Unknown type " + name);
        }
        return type;
    }

    /**
     * C declarator for {@code name} of the given type, with array dimensions
     * as bracket suffixes.
     */
    String declare(Token at, Node.TypeRef type, String name) {
        var base = resolve(at, type.name());
        var dimensions = type.dimensions().stream()
            .map(d -> "[" + d + "]")
            .collect(Collectors.joining());
        return base + " " + name + dimensions;
    }
}
