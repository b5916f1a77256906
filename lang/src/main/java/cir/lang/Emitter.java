package cir.lang;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects generated C in three streams that are joined, in order, when the
 * walk is complete: includes, header declarations, and code.
 */
final class Emitter {

    private final int indentWidth;

    private final List<String> includes = new ArrayList<>(List.of("#include <stdint.h>"));

    private final List<String> header = new ArrayList<>();

    private final List<String> code = new ArrayList<>();

    private int level = 0;

    Emitter(int indentWidth) {
        this.indentWidth = indentWidth;
    }

    void openGroup() {
        level++;
    }

    void closeGroup() {
        if (level == 0) {
            throw new CompileException(CompileException.Phase.INTERNAL, "No open group to end");
        }
        level--;
    }

    /** A code line at the current indentation. */
    void emit(String line) {
        code.add(" ".repeat(level * indentWidth) + line);
    }

    /** A preprocessor line in the code stream; always starts at column 0. */
    void directive(String line) {
        code.add(line);
    }

    void header(String line) {
        header.add(line);
    }

    String render() {
        if (level != 0) {
            throw new CompileException(CompileException.Phase.INTERNAL, level + " group(s) left open");
        }
        var lines = new ArrayList<String>(includes);
        lines.add("");
        lines.addAll(header);
        lines.add("");
        lines.addAll(code);
        return String.join("\n", lines);
    }
}
