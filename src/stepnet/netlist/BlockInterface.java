package stepnet.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import stepnet.util.XmlElement;

/** Block interface: members grouped by section. Empty sections still appear, as empty elements. */
public class BlockInterface extends NetlistComponent {
  public static final String INTERFACE_NAMESPACE = "http://www.siemens.com/automation/Openness/SW/Interface/v5";

  private final EnumMap<InterfaceSection, List<Member>> sections = new EnumMap<>(InterfaceSection.class);

  public BlockInterface() {
    for (InterfaceSection section : InterfaceSection.values())
      sections.put(section, new ArrayList<>());
  }

  public Member addMember(InterfaceSection section, String name, String datatype, String remanence) {
    Member member = new Member(name, datatype, remanence);
    sections.get(section).add(member);
    return member;
  }

  public List<Member> getMembers(InterfaceSection section) { return Collections.unmodifiableList(sections.get(section)); }

  @Override
  public XmlElement toXml() {
    XmlElement sectionsElement = new XmlElement("Sections").attr("xmlns", INTERFACE_NAMESPACE);
    for (var entry : sections.entrySet()) {
      XmlElement section = new XmlElement("Section").attr("Name", entry.getKey().name());
      entry.getValue().forEach(member -> section.add(member.toXml()));
      sectionsElement.add(section);
    }
    return new XmlElement("Interface").add(sectionsElement);
  }
}
