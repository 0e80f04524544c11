package io.jabuf.buffer.internal_api;

import io.jabuf.buffer.api.CapacityExceededException;
import io.jabuf.buffer.api.Internal;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Capacity management for {@code Object[]} storage blocks.
 *
 * <p>Storage grows by doubling until the requested minimum fits, which keeps appends amortized
 * O(1). The arithmetic runs on {@code long} so doubling a large block cannot wrap around, and the
 * result is clamped to {@link #MAX_CAPACITY}.
 */
@Internal
public final class GrowthPolicy {
  private static final Logger log = LoggerFactory.getLogger(GrowthPolicy.class);

  /** Largest array length the JVM reliably allocates; a few header words are reserved. */
  public static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

  private GrowthPolicy() {}

  /**
   * Computes the capacity a block of {@code currentCapacity} slots grows to so that it holds at
   * least {@code minRequired} slots. Returns {@code currentCapacity} when it already suffices.
   *
   * @throws CapacityExceededException if {@code minRequired > MAX_CAPACITY}
   */
  public static int newCapacity(int currentCapacity, long minRequired) {
    if (minRequired <= currentCapacity) {
      return currentCapacity;
    }
    checkMaximum(minRequired);
    // an empty block has nothing to double
    long newSize = Math.max(1L, currentCapacity);
    while (newSize < minRequired) {
      newSize *= 2;
    }
    return (int) Math.min(newSize, MAX_CAPACITY);
  }

  /**
   * Rejects a slot count no storage block can have.
   *
   * @throws CapacityExceededException if {@code requested > MAX_CAPACITY}
   */
  public static void checkMaximum(long requested) {
    if (requested > MAX_CAPACITY) {
      log.warn("Requested capacity {} exceeds the maximum of {} slots", requested, MAX_CAPACITY);
      throw new CapacityExceededException(requested, MAX_CAPACITY);
    }
  }

  /**
   * Returns a block with at least {@code minRequired} slots whose first {@code currentLength}
   * slots hold the same elements as {@code storage}. The original block is returned untouched
   * when it is already large enough.
   *
   * @throws CapacityExceededException if the block cannot grow that far
   */
  public static Object[] ensureCapacity(Object[] storage, int currentLength, long minRequired) {
    if (minRequired <= storage.length) {
      return storage;
    }
    int capacity = newCapacity(storage.length, minRequired);
    log.debug(
        "Growing storage from {} to {} slots, copying {} live elements",
        storage.length,
        capacity,
        currentLength);
    Object[] grown = new Object[capacity];
    System.arraycopy(storage, 0, grown, 0, currentLength);
    return grown;
  }

  /** Nulls out slots {@code [from, to)}, never touching indices past the end of the block. */
  public static void clearRange(Object[] storage, int from, int to) {
    int end = Math.min(to, storage.length);
    if (from < end) {
      Arrays.fill(storage, Math.max(0, from), end, null);
    }
  }
}
