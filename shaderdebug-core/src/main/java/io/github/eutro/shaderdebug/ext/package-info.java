/**
 * Exts associate typed data with IR objects without changing their classes.
 *
 * <pre>{@code
 * Ext<Integer> DEPTH = Ext.create(Integer.class, "DEPTH");
 *
 * block.attachExt(DEPTH, 3);
 * block.getExtOrThrow(DEPTH); // => 3
 * }</pre>
 * <p>
 * Analyses store their results this way (see {@link io.github.eutro.shaderdebug.ext.CommonExts#CONVERGENCE}),
 * and op keys carry their behaviour as exts, which the debugger looks up through
 * {@link io.github.eutro.shaderdebug.ext.DelegatingExtHolder} chains from each instruction.
 * <p>
 * Classes with frequently used exts store them in fields instead of the backing map.
 */
package io.github.eutro.shaderdebug.ext;
