package io.jabuf.buffer.api;

/**
 * Utility class for the argument checks shared by buffers and views.
 */
public final class BufferValidation {

  private BufferValidation() {
    // Utility class - no instantiation
  }

  /**
   * Validates an element index: {@code 0 <= index < length}.
   *
   * @param index the index to check
   * @param length the current logical length
   * @throws IndexOutOfRangeException if the index is outside the live range
   */
  public static void checkElementIndex(int index, int length) {
    if (index < 0 || index >= length) {
      throw new IndexOutOfRangeException(index, length);
    }
  }

  /**
   * Validates an insertion point: {@code 0 <= index <= length}.
   *
   * @param index the position to insert at
   * @param length the current logical length
   * @throws IndexOutOfRangeException if the position is outside the valid insertion points
   */
  public static void checkPositionIndex(int index, int length) {
    if (index < 0 || index > length) {
      throw new IndexOutOfRangeException(index, length + 1, "insertion point");
    }
  }

  /**
   * Validates a non-empty range {@code [from, from + count)} against a sequence of {@code length}
   * elements. Callers skip this check when {@code count <= 0}.
   *
   * @throws IndexOutOfRangeException if the range does not fit
   */
  public static void checkRange(int from, int count, int length) {
    if (from < 0 || (long) from + count > length) {
      throw IndexOutOfRangeException.forRange(from, count, length);
    }
  }

  /**
   * Validates that a capacity argument is not negative.
   *
   * @throws IllegalArgumentException if {@code capacity} is negative
   */
  public static void checkCapacity(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException(
          String.format("Initial capacity cannot be negative: %d", capacity));
    }
  }

  /**
   * Validates that required parameters are not null.
   *
   * @param value the value to check
   * @param parameterName the name of the parameter for error reporting
   * @return {@code value}
   * @throws NullPointerException if value is null
   */
  public static <T> T requireNonNull(T value, String parameterName) {
    if (value == null) {
      throw new NullPointerException(
          String.format("Required parameter '%s' cannot be null", parameterName));
    }
    return value;
  }
}
