package io.github.eutro.irhtml.core.render;

import org.jetbrains.annotations.Nullable;

/**
 * Options for one render.
 */
public final class RenderOptions {
    public static final int DEFAULT_ANNOTATION_COLUMN = 50;
    public static final RenderOptions DEFAULT = builder().build();

    public final boolean preserveUseListOrder;
    public final boolean includeAnnotations;
    public final int annotationColumn;
    /**
     * The document title, or null to use the module id.
     */
    public final @Nullable String title;

    private RenderOptions(Builder builder) {
        this.preserveUseListOrder = builder.preserveUseListOrder;
        this.includeAnnotations = builder.includeAnnotations;
        this.annotationColumn = builder.annotationColumn;
        this.title = builder.title;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .preserveUseListOrder(preserveUseListOrder)
                .includeAnnotations(includeAnnotations)
                .annotationColumn(annotationColumn)
                .title(title);
    }

    @Override
    public String toString() {
        return "RenderOptions{" +
                "preserveUseListOrder=" + preserveUseListOrder +
                ", includeAnnotations=" + includeAnnotations +
                ", annotationColumn=" + annotationColumn +
                ", title=" + title +
                '}';
    }

    public static class Builder {
        private boolean preserveUseListOrder = false;
        private boolean includeAnnotations = false;
        private int annotationColumn = DEFAULT_ANNOTATION_COLUMN;
        private @Nullable String title = null;

        private Builder() {
        }

        /**
         * Whether to list uses in the order they are recorded on the graph, and write
         * {@code uselistorder} directives where that order is not the default one.
         *
         * @param preserveUseListOrder Whether to preserve use-list order.
         * @return This builder.
         */
        public Builder preserveUseListOrder(boolean preserveUseListOrder) {
            this.preserveUseListOrder = preserveUseListOrder;
            return this;
        }

        /**
         * Whether to write annotations: those of the hook, debug locations and debug variables.
         *
         * @param includeAnnotations Whether to include annotations.
         * @return This builder.
         */
        public Builder includeAnnotations(boolean includeAnnotations) {
            this.includeAnnotations = includeAnnotations;
            return this;
        }

        public Builder annotationColumn(int annotationColumn) {
            if (annotationColumn < 0) {
                throw new IllegalArgumentException("negative annotation column: " + annotationColumn);
            }
            this.annotationColumn = annotationColumn;
            return this;
        }

        public Builder title(@Nullable String title) {
            this.title = title;
            return this;
        }

        public RenderOptions build() {
            return new RenderOptions(this);
        }
    }
}
