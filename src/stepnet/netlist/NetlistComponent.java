package stepnet.netlist;

import stepnet.util.XmlElement;

/** A netlist element that renders itself as an XML subtree. */
public abstract class NetlistComponent {
  public abstract XmlElement toXml();
}
