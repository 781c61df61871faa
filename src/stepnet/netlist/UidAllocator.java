package stepnet.netlist;

/**
 * Monotonic identifier source. Identifiers are handed out at element construction and never reused.
 */
public class UidAllocator {
  private int nextId;

  public UidAllocator() { this(0); }
  public UidAllocator(int startId) {
    if (startId < 0)
      throw new IllegalArgumentException("start id must not be negative");
    this.nextId = startId;
  }

  public int next() { return nextId++; }
  /** The identifier the next call to {@link #next()} returns. */
  public int peek() { return nextId; }
}
