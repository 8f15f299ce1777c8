package io.github.eutro.irhtml.core.render;

import io.github.eutro.irhtml.core.ir.Function;
import io.github.eutro.irhtml.core.ir.Use;
import io.github.eutro.irhtml.core.ir.Value;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Supplies trailing commentary for the rendered text.
 * <p>
 * Returned text is written as a comment; null or empty text writes nothing.
 */
public interface AnnotationHook {
    /**
     * Annotate a function. The text is written at the end of the signature line.
     *
     * @param function The function.
     * @param ctx      The render in progress.
     * @return The annotation, or null.
     */
    @Nullable String functionAnnotation(Function function, Context ctx);

    /**
     * Annotate a value with a result. The text is written at the end of its definition,
     * aligned to the annotation column.
     *
     * @param value The instruction or global.
     * @param ctx   The render in progress.
     * @return The annotation, or null.
     */
    @Nullable String valueAnnotation(Value value, Context ctx);

    /**
     * What a hook can ask of the render it is called from.
     */
    interface Context {
        /**
         * Spell a reference to a value the way operands are spelled, e.g. {@code %x}, {@code %3},
         * {@code @g} or {@code !2}. Unnamed values that haven't been seen yet are numbered by this.
         *
         * @param value The value.
         * @return The spelling.
         */
        String nameOf(Value value);

        /**
         * Spell the type of a value, or a placeholder if it has none.
         *
         * @param value The value.
         * @return The spelling.
         */
        String typeOf(Value value);

        /**
         * Get the uses of a value, in recorded order if use-list order is being preserved,
         * and in the order the users appear in the module otherwise.
         *
         * @param value The value.
         * @return The uses.
         */
        List<Use> usesOf(Value value);

        RenderOptions getOptions();
    }
}
