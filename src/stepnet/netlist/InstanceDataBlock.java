package stepnet.netlist;

import java.util.List;
import stepnet.util.XmlElement;

/**
 * Instance data block of the function block. Its interface is a fixed fragment, inserted as-is.
 */
public class InstanceDataBlock extends NetlistComponent {
  static final String INTERFACE_FRAGMENT = String.join(
      "\n", "<Interface><Sections xmlns=\"" + BlockInterface.INTERFACE_NAMESPACE + "\">", "  <Section Name=\"Input\" />",
      "  <Section Name=\"Output\">", "    <Member Name=\"Uit_Stap_Tekst\" Datatype=\"Int\" />", "  </Section>", "  <Section Name=\"InOut\" />",
      "  <Section Name=\"Static\">", "    <Member Name=\"Stap\" Datatype=\"Array[0..31] of Bool\" Remanence=\"Retain\" />",
      "    <Member Name=\"Stap_A\" Datatype=\"Array[0..31] of Bool\" Remanence=\"Retain\" />",
      "    <Member Name=\"Stap_B\" Datatype=\"Array[0..31] of Bool\" Remanence=\"Retain\" />",
      "    <Member Name=\"Stap_C\" Datatype=\"Array[0..31] of Bool\" Remanence=\"Retain\" />",
      "    <Member Name=\"Hulp\" Datatype=\"Array[1..32] of Bool\" Remanence=\"Retain\" />",
      "    <Member Name=\"Tijd\" Datatype=\"Array[1..10] of IEC_TIMER\" Version=\"1.0\" Remanence=\"Retain\">", "      <AttributeList>",
      "        <BooleanAttribute Name=\"SetPoint\" SystemDefined=\"true\">true</BooleanAttribute>", "      </AttributeList>", "    </Member>",
      "    <Member Name=\"Teller\" Datatype=\"Array[1..10] of Int\" Remanence=\"Retain\" />",
      "    <Member Name=\"Melding\" Datatype=\"Array[0..2] of &quot;Program Alarm Message&quot;\" />", "  </Section>",
      "</Sections></Interface>");

  private final int id;
  private final String name;
  private final int number;
  private final String instanceOfName;
  private final MultilingualText comment;
  private final MultilingualText title;

  /**
   * @param uids document allocator
   * @param name the instance name
   * @param number the data block number
   * @param instanceOfName name of the function block this is an instance of
   * @param cultures cultures of comment and title
   */
  public InstanceDataBlock(UidAllocator uids, String name, int number, String instanceOfName, List<String> cultures) {
    this.id = uids.next();
    this.name = name;
    this.number = number;
    this.instanceOfName = instanceOfName;
    this.comment = new MultilingualText(uids, "Comment", "", cultures);
    this.title = new MultilingualText(uids, "Title", "", cultures);
  }

  public int getId() { return id; }
  public String getName() { return name; }
  public int getNumber() { return number; }
  public String getInstanceOfName() { return instanceOfName; }

  @Override
  public XmlElement toXml() {
    XmlElement attributeList = new XmlElement("AttributeList")
                                   .add(new XmlElement("AutoNumber", "false"))
                                   .add(new XmlElement("InstanceOfName", instanceOfName))
                                   .add(new XmlElement("InstanceOfType", "FB"))
                                   .addRaw(INTERFACE_FRAGMENT)
                                   .add(new XmlElement("Name", name))
                                   .add(new XmlElement("Namespace"))
                                   .add(new XmlElement("Number", String.valueOf(number)))
                                   .add(new XmlElement("ProgrammingLanguage", "DB"));
    XmlElement objectList = new XmlElement("ObjectList").add(comment.toXml()).add(title.toXml());
    return new XmlElement("SW.Blocks.InstanceDB").attr("ID", id).add(attributeList).add(objectList);
  }
}
