package io.github.eutro.irhtml.core.ir;

public enum Linkage {
    EXTERNAL(""),
    INTERNAL("internal"),
    PRIVATE("private"),
    LINKONCE_ODR("linkonce_odr"),
    WEAK("weak"),
    ;

    /**
     * The keyword printed before the definition, empty for the default linkage.
     */
    public final String keyword;

    Linkage(String keyword) {
        this.keyword = keyword;
    }
}
