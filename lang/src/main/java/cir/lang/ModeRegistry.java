package cir.lang;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Modes declared by {@code SETMODE}, with their options and the option most
 * recently selected by {@code DEFAULT} or {@code DEFINE}.
 */
final class ModeRegistry {

    @Getter
    @RequiredArgsConstructor
    static final class Mode {
        private final String name;
        private final Set<String> options;
        private String selection;

        String macro(String option) {
            return macroName(name, option);
        }

        Optional<String> currentMacro() {
            return Optional.ofNullable(selection).map(this::macro);
        }

        void select(String option) {
            selection = option;
        }

        String describeOptions() {
            return String.join(" | ", options);
        }
    }

    private final Map<String, Mode> modes = new HashMap<>();

    static String macroName(String mode, String option) {
        return mode + "_" + option;
    }

    Mode register(Token name, List<Token> options) {
        if (modes.containsKey(name.lexeme())) {
            throw new CompileException(CompileException.Phase.SEMANTIC, name,
                "Mode " + name.lexeme() + " is already set");
        }
        var names = new LinkedHashSet<String>();
        for (var option : options) {
            names.add(option.lexeme());
        }
        var mode = new Mode(name.lexeme(), names);
        modes.put(mode.getName(), mode);
        return mode;
    }

    Mode lookup(Token name) {
        var mode = modes.get(name.lexeme());
        if (mode == null) {
            throw new CompileException(CompileException.Phase.SEMANTIC, name,
                "Undefined mode " + name.lexeme() + ". Did you forget a SETMODE?");
        }
        return mode;
    }

    /**
     * The mode named by {@code name}, after checking {@code option} is one of
     * its registered options.
     */
    Mode validate(Token name, Token option) {
        var mode = lookup(name);
        if (!mode.getOptions().contains(option.lexeme())) {
            throw new CompileException(CompileException.Phase.SEMANTIC, option,
                option.lexeme() + " is not a valid mode for " + mode.getName()
                    + ". Valid options include: " + mode.describeOptions());
        }
        return mode;
    }
}
