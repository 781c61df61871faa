package stepnet.netlist;

import stepnet.util.XmlElement;

/**
 * Connection from a node (optionally a named output port) to a named input port.
 * A source without port is an identity connection, as used for accesses.
 */
public class Wire extends NetlistComponent {
  private final int id;
  private final int fromId;
  private final String fromPort;
  private final int toId;
  private final String toPort;

  public Wire(UidAllocator uids, int fromId, String fromPort, int toId, String toPort) {
    this.id = uids.next();
    this.fromId = fromId;
    this.fromPort = fromPort;
    this.toId = toId;
    this.toPort = toPort;
  }

  public int getId() { return id; }
  public int getFromId() { return fromId; }
  public String getFromPort() { return fromPort; }
  public int getToId() { return toId; }
  public String getToPort() { return toPort; }

  @Override
  public XmlElement toXml() {
    XmlElement wire = new XmlElement("Wire").attr("UId", id);
    if (fromPort != null && !fromPort.isEmpty())
      wire.add(new XmlElement("NameCon").attr("UId", fromId).attr("Name", fromPort));
    else
      wire.add(new XmlElement("IdentCon").attr("UId", fromId));
    wire.add(new XmlElement("NameCon").attr("UId", toId).attr("Name", toPort));
    return wire;
  }
}
