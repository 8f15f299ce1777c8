/**
 * Optional, typed data attached to graph nodes.
 *
 * <pre>{@code
 * Value load = ib.load(Type.I32, ptr);
 * load.attachExt(CommonExts.DEBUG_LOCATION, new DebugLocation(3, 10));
 *
 * load.getExt(CommonExts.DEBUG_LOCATION); // => Optional[3:10]
 * }</pre>
 * <p>
 * This keeps the node classes flat: there is no subclass for instructions that carry
 * a predicate, any node can carry one, and code that cares asks for the ext it needs.
 * <p>
 * Hot exts, like the owning containers of values, are stored directly in fields by
 * the classes that override {@link io.github.eutro.irhtml.core.ext.ExtHolder#getNullable(Ext)}.
 */
package io.github.eutro.irhtml.core.ext;
