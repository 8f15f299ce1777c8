package io.github.eutro.irhtml.api.support;

import org.jetbrains.annotations.Nullable;

/**
 * Picks where rendered documents go, given the input they came from.
 * <p>
 * {@link #STDOUT} stands for standard output on either side.
 */
public final class OutputNaming {
    public static final String STDOUT = "-";
    public static final String INPUT_EXTENSION = ".bc";
    public static final String OUTPUT_EXTENSION = ".html";

    private OutputNaming() {
    }

    /**
     * Name the output of one module of an input.
     * <p>
     * With no override, the input extension is replaced by the output extension, with the module
     * index inserted before it if the input holds several modules, and standard input goes to
     * standard output. An override is used as is, with the module index appended if there are
     * several modules.
     *
     * @param input    The input file name, or {@link #STDOUT} for standard input.
     * @param override The output name asked for, or null/empty to derive one.
     * @param index    The index of the module in the input.
     * @param count    The number of modules in the input.
     * @return The output file name, or {@link #STDOUT}.
     */
    public static String outputName(String input, @Nullable String override, int index, int count) {
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException("module " + index + " of " + count);
        }
        String suffix = count > 1 ? "." + index : "";
        if (override != null && !override.isEmpty()) {
            return override + suffix;
        }
        if (STDOUT.equals(input)) {
            return STDOUT;
        }
        String stem = input.endsWith(INPUT_EXTENSION)
                ? input.substring(0, input.length() - INPUT_EXTENSION.length())
                : input;
        return stem + suffix + OUTPUT_EXTENSION;
    }
}
