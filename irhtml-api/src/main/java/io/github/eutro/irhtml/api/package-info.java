/**
 * The entry point for rendering modules, {@link io.github.eutro.irhtml.api.IrHtmlPrinter}.
 */
package io.github.eutro.irhtml.api;
