package io.github.eutro.irhtml.api.annotations;

import io.github.eutro.irhtml.core.ir.Function;
import io.github.eutro.irhtml.core.ir.Use;
import io.github.eutro.irhtml.core.ir.Value;
import io.github.eutro.irhtml.core.ir.ValueKind;
import io.github.eutro.irhtml.core.render.AnnotationHook;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.StringJoiner;

/**
 * Annotates functions with their use count, and values with their use count and type:
 * <pre>{@code
 * define i32 @f(i32 %x) { ; [#uses=2]
 *   %1 = add i32 %x, 1                       ; [#uses=1 type=i32]
 * }
 * }</pre>
 * Optionally, values local to a function also list their users.
 */
public class CommentAnnotations implements AnnotationHook {
    public static final CommentAnnotations INSTANCE = new CommentAnnotations(false);
    public static final CommentAnnotations WITH_USERS = new CommentAnnotations(true);

    private final boolean listUsers;

    public CommentAnnotations(boolean listUsers) {
        this.listUsers = listUsers;
    }

    @Override
    public String functionAnnotation(Function function, Context ctx) {
        return "; [#uses=" + function.getValue().getNumUses() + "]";
    }

    @Override
    public @Nullable String valueAnnotation(Value value, Context ctx) {
        StringBuilder sb = new StringBuilder()
                .append("; [#uses=").append(value.getNumUses())
                .append(" type=").append(ctx.typeOf(value))
                .append(']');
        // users of globals can be in any function, where they can't be named
        if (listUsers && value.getKind().scope == ValueKind.Scope.FUNCTION) {
            List<Use> uses = ctx.usesOf(value);
            if (!uses.isEmpty()) {
                StringJoiner users = new StringJoiner(", ", " [users=", "]");
                for (Use use : uses) {
                    users.add(ctx.nameOf(use.user));
                }
                sb.append(users);
            }
        }
        return sb.toString();
    }
}
