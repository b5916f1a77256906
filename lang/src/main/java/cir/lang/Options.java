package cir.lang;

/**
 * Generator settings.
 *
 * @param indentWidth     spaces per nesting level in generated C
 * @param temporaryCount  capacity of the loop-counter pool
 * @param temporaryPrefix name prefix of pooled loop counters
 */
public record Options(int indentWidth, int temporaryCount, String temporaryPrefix) {

    public static final int DEFAULT_INDENT_WIDTH = 4;
    public static final int DEFAULT_TEMPORARY_COUNT = 8;
    public static final String DEFAULT_TEMPORARY_PREFIX = "_temp_";

    public Options {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indent width must not be negative: " + indentWidth);
        }
        if (temporaryCount <= 0) {
            throw new IllegalArgumentException("temporary pool needs at least one slot: " + temporaryCount);
        }
        if (temporaryPrefix == null || temporaryPrefix.isBlank()) {
            throw new IllegalArgumentException("temporary prefix must not be blank");
        }
    }

    public static Options defaults() {
        return new Options(DEFAULT_INDENT_WIDTH, DEFAULT_TEMPORARY_COUNT, DEFAULT_TEMPORARY_PREFIX);
    }

    public Options withIndentWidth(int indentWidth) {
        return new Options(indentWidth, temporaryCount, temporaryPrefix);
    }

    public Options withTemporaryCount(int temporaryCount) {
        return new Options(indentWidth, temporaryCount, temporaryPrefix);
    }
}
