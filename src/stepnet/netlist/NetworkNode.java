package stepnet.netlist;

/** Something a wire can connect to: a part or a memory/constant access. */
public abstract class NetworkNode extends NetlistComponent {
  protected final int id;

  protected NetworkNode(UidAllocator uids) { this.id = uids.next(); }

  public int getId() { return id; }
}
