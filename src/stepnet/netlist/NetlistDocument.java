package stepnet.netlist;

import java.util.Optional;
import stepnet.util.XmlElement;

/** Root of the export: engineering version, the function block and optionally its instance data block. */
public class NetlistDocument extends NetlistComponent {
  public static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"utf-8\"?>\n";

  private final String engineeringVersion;
  private final UidAllocator uids;
  private FunctionBlock functionBlock = null;
  private InstanceDataBlock instanceDataBlock = null;

  public NetlistDocument(String engineeringVersion) {
    this.engineeringVersion = engineeringVersion;
    this.uids = new UidAllocator(0);
  }

  /** The document-wide identifier source. */
  public UidAllocator getUids() { return uids; }

  public FunctionBlock getFunctionBlock() { return functionBlock; }
  public void setFunctionBlock(FunctionBlock functionBlock) { this.functionBlock = functionBlock; }
  public Optional<InstanceDataBlock> getInstanceDataBlock() { return Optional.ofNullable(instanceDataBlock); }
  public void setInstanceDataBlock(InstanceDataBlock instanceDataBlock) { this.instanceDataBlock = instanceDataBlock; }

  @Override
  public XmlElement toXml() {
    XmlElement document = new XmlElement("Document").add(new XmlElement("Engineering").attr("version", engineeringVersion));
    if (functionBlock != null)
      document.add(functionBlock.toXml());
    if (instanceDataBlock != null)
      document.add(instanceDataBlock.toXml());
    return document;
  }

  /**
   * Serializes the document with the XML declaration.
   * @param pretty indent nested elements
   * @return the XML text
   */
  public String toXml(boolean pretty) { return DECLARATION + toXml().toString(pretty, 0); }
}
