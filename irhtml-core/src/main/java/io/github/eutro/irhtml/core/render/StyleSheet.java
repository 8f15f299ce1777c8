package io.github.eutro.irhtml.core.render;

import java.util.EnumSet;
import java.util.Set;

/**
 * The style stream. Holds the rules for the classes used in the content stream,
 * each written the first time the class is used.
 */
public final class StyleSheet {
    private final StringBuilder sb = new StringBuilder();
    private final Set<StyleClass> used = EnumSet.noneOf(StyleClass.class);

    public StyleSheet() {
        rule("pre.module", "font-family:monospace;");
        rule(":target", "background:#ffef9e;");
        rule("a", "text-decoration:none;");
    }

    /**
     * Note that {@code cls} is used, writing its rule if this is the first use.
     *
     * @param cls The class.
     */
    public void use(StyleClass cls) {
        if (used.add(cls)) {
            rule("." + cls.cssClass, cls.declarations);
        }
    }

    public boolean isUsed(StyleClass cls) {
        return used.contains(cls);
    }

    private void rule(String selector, String declarations) {
        sb.append(selector).append('{').append(declarations).append("}\n");
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
