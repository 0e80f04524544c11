package io.jabuf.buffer.api;

/**
 * Thrown when an indexed read, write, insertion point or removal range falls outside the bound
 * that is valid for the buffer at the time of the call.
 *
 * <p>The check always happens before any mutation, so a buffer that threw this exception is left
 * exactly as it was.
 */
public class IndexOutOfRangeException extends IndexOutOfBoundsException {
  private static final long serialVersionUID = 1L;

  private final long index;
  private final int bound;

  public IndexOutOfRangeException(long index, int bound) {
    this(index, bound, null);
  }

  public IndexOutOfRangeException(long index, int bound, String context) {
    super(formatMessage(index, bound, context));
    this.index = index;
    this.bound = bound;
  }

  private static String formatMessage(long index, int bound, String context) {
    StringBuilder sb = new StringBuilder("Index ").append(index);
    sb.append(" out of range [0, ").append(bound).append(")");
    if (context != null) {
      sb.append(" [Context: ").append(context).append("]");
    }
    return sb.toString();
  }

  /** Index (or end of range) that failed the check. */
  public long getIndex() {
    return index;
  }

  /** Exclusive upper bound that was in force when the check failed. */
  public int getBound() {
    return bound;
  }

  /**
   * Builds the exception for a range {@code [from, from + count)} that does not fit inside a
   * sequence of {@code length} elements. The reported index is {@code from} when it is negative,
   * otherwise the exclusive end of the range.
   */
  public static IndexOutOfRangeException forRange(int from, int count, int length) {
    long end = (long) from + count;
    return new IndexOutOfRangeException(
        from < 0 ? from : end,
        length + 1,
        String.format("range [%d, %d) of length %d", from, end, length));
  }
}
