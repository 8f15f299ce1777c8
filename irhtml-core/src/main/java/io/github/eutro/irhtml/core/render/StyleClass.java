package io.github.eutro.irhtml.core.render;

/**
 * The kinds of text the renderer marks up, with the CSS class and declarations of each.
 */
public enum StyleClass {
    KEYWORD("kw", "color:#0033b3;font-weight:bold;"),
    OPCODE("op", "color:#0033b3;"),
    TYPE("ty", "color:#008080;"),
    LOCAL("lv", "color:#871094;"),
    GLOBAL("gv", "color:#00627a;"),
    LABEL("lbl", "color:#9e880d;"),
    METADATA("md", "color:#7a7a43;"),
    CONSTANT("cst", "color:#1750eb;"),
    COMMENT("cm", "color:#8c8c8c;font-style:italic;"),
    PLACEHOLDER("bad", "color:#ffffff;background:#c00000;"),
    ;

    public final String cssClass;
    public final String declarations;

    StyleClass(String cssClass, String declarations) {
        this.cssClass = cssClass;
        this.declarations = declarations;
    }
}
