package io.jabuf.buffer.internal_api;

import io.jabuf.buffer.api.Internal;

/**
 * Capability of sources whose elements sit in a contiguous {@code Object[]} block and can be moved
 * into another block with a single {@link System#arraycopy} call.
 *
 * <p>Buffers check for this capability to pick the block-copy path for bulk append and insert.
 */
@Internal
public interface BlockCopySource {

  /** Number of elements available for copying. */
  int blockLength();

  /**
   * Copies {@code length} elements starting at {@code srcPos} into {@code dest} at {@code destPos}.
   * The caller guarantees {@code srcPos + length <= blockLength()} and enough room in {@code dest}.
   */
  void copyBlock(int srcPos, Object[] dest, int destPos, int length);

  /** Whether this source reads from {@code storage} itself rather than from a separate block. */
  boolean sharesBlock(Object[] storage);
}
