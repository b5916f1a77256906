package cir.lang;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Mutable state of one generation run, passed explicitly through the walk so
 * that each run starts clean.
 */
@Getter
final class Context {

    private final Emitter emitter;
    private final TypeTable types = new TypeTable();
    private final TypeEnvironment variables = new TypeEnvironment();
    private final ModeRegistry modes = new ModeRegistry();
    private final TemporaryPool temporaries;

    // macros defined inside the current method body, undefined when it ends
    private final List<String> localMacros = new ArrayList<>();

    // 0 at top level, +1 inside each body
    private int depth = 0;

    Context(Options options) {
        this.emitter = new Emitter(options.indentWidth());
        this.temporaries = new TemporaryPool(options.temporaryCount(), options.temporaryPrefix());
    }

    boolean isTopLevel() {
        return depth == 0;
    }

    void enter() {
        depth++;
    }

    void leave() {
        if (depth == 0) {
            throw new CompileException(CompileException.Phase.INTERNAL, "left the top level");
        }
        depth--;
    }
}
