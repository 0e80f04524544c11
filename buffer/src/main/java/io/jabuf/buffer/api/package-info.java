/**
 * Contracts shared by buffers, their views and the sources they consume.
 *
 * <p>
 * {@link io.jabuf.buffer.api.ElementSource} and {@link io.jabuf.buffer.api.IndexedView} describe
 * what a buffer can read from; {@link io.jabuf.buffer.api.GrowableSeq} and
 * {@link io.jabuf.buffer.api.Builder} describe what it offers. Index and capacity failures are
 * reported through {@link io.jabuf.buffer.api.IndexOutOfRangeException} and
 * {@link io.jabuf.buffer.api.CapacityExceededException}.
 * </p>
 */
package io.jabuf.buffer.api;
