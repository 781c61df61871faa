package stepnet.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import stepnet.util.XmlElement;

/** The generated FBD function block: interface plus one compile unit per network. */
public class FunctionBlock extends NetlistComponent {
  private final int id;
  private final String name;
  private final int number;
  private final MultilingualText comment;
  private final MultilingualText title;
  private final BlockInterface blockInterface = new BlockInterface();
  private final List<Network> networks = new ArrayList<>();

  public FunctionBlock(UidAllocator uids, String name, int number, List<String> cultures) {
    this.id = uids.next();
    this.name = name;
    this.number = number;
    this.comment = new MultilingualText(uids, "Comment", "", cultures);
    this.title = new MultilingualText(uids, "Title", "", cultures);
  }

  public int getId() { return id; }
  public String getName() { return name; }
  public int getNumber() { return number; }
  public BlockInterface getInterface() { return blockInterface; }
  public List<Network> getNetworks() { return Collections.unmodifiableList(networks); }

  public void addNetwork(Network network) { networks.add(network); }

  @Override
  public XmlElement toXml() {
    XmlElement attributeList = new XmlElement("AttributeList")
                                   .add(new XmlElement("AutoNumber", "false"))
                                   .add(blockInterface.toXml())
                                   .add(new XmlElement("IsRetainMemResEnabled", "true"))
                                   .add(new XmlElement("MemoryLayout", "Optimized"))
                                   .add(new XmlElement("MemoryReserve", "4000"))
                                   .add(new XmlElement("Name", name))
                                   .add(new XmlElement("Namespace"))
                                   .add(new XmlElement("Number", String.valueOf(number)))
                                   .add(new XmlElement("ProgrammingLanguage", "FBD"))
                                   .add(new XmlElement("RetainMemoryReserve", "4000"))
                                   .add(new XmlElement("SetENOAutomatically", "true"));
    XmlElement objectList = new XmlElement("ObjectList").add(comment.toXml());
    networks.forEach(network -> objectList.add(network.toXml()));
    objectList.add(title.toXml());
    return new XmlElement("SW.Blocks.FB").attr("ID", id).add(attributeList).add(objectList);
  }
}
