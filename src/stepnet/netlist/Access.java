package stepnet.netlist;

import stepnet.util.XmlElement;

/** Read access to an element of a local array variable, or a Bool literal. */
public class Access extends NetworkNode {
  private final String variable;
  private final int index;
  private final Boolean literal;

  private Access(UidAllocator uids, String variable, int index, Boolean literal) {
    super(uids);
    this.variable = variable;
    this.index = index;
    this.literal = literal;
  }

  /** {@code variable[index]} */
  public static Access arrayElement(UidAllocator uids, String variable, int index) { return new Access(uids, variable, index, null); }
  public static Access literalBool(UidAllocator uids, boolean value) { return new Access(uids, "", 0, value); }

  public boolean isLiteral() { return literal != null; }
  public String getVariable() { return variable; }
  public int getIndex() { return index; }

  @Override
  public XmlElement toXml() {
    if (literal != null) {
      XmlElement constant = new XmlElement("Constant")
                                .add(new XmlElement("ConstantType", "Bool"))
                                .add(new XmlElement("ConstantValue", String.valueOf(literal.booleanValue())));
      return new XmlElement("Access").attr("Scope", "LiteralConstant").attr("UId", id).add(constant);
    }
    XmlElement constant = new XmlElement("Constant")
                              .add(new XmlElement("ConstantType", "DInt"))
                              .add(new XmlElement("ConstantValue", String.valueOf(index)));
    XmlElement component = new XmlElement("Component")
                               .attr("Name", variable)
                               .attr("AccessModifier", "Array")
                               .add(new XmlElement("Access").attr("Scope", "LiteralConstant").add(constant));
    return new XmlElement("Access").attr("Scope", "LocalVariable").attr("UId", id).add(new XmlElement("Symbol").add(component));
  }
}
