package io.jabuf.buffer.api;

/**
 * Thrown when storage cannot grow to the requested number of slots because the index space is
 * exhausted.
 *
 * <p>This is fatal to the operation that asked for the capacity. It is raised before anything is
 * allocated or copied, so the buffer keeps its previous content and length.
 */
public class CapacityExceededException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final long requested;
  private final int maximum;

  public CapacityExceededException(long requested, int maximum) {
    super(
        String.format(
            "Cannot grow storage to %d slots; maximum capacity is %d", requested, maximum));
    this.requested = requested;
    this.maximum = maximum;
  }

  public long getRequested() {
    return requested;
  }

  public int getMaximum() {
    return maximum;
  }
}
