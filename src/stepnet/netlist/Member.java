package stepnet.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import stepnet.util.XmlElement;

/** A typed interface member. */
public class Member extends NetlistComponent {
  private final String name;
  private final String datatype;
  private final String remanence;
  private final List<Subelement> subelements = new ArrayList<>();

  /**
   * @param name member name
   * @param datatype e.g. {@code Array[0..31] of Bool}
   * @param remanence e.g. Retain, or empty for none
   */
  public Member(String name, String datatype, String remanence) {
    this.name = name;
    this.datatype = datatype;
    this.remanence = remanence;
  }

  public String getName() { return name; }
  public String getDatatype() { return datatype; }
  public List<Subelement> getSubelements() { return Collections.unmodifiableList(subelements); }

  public Member addSubelement(String path, String comment, String culture) {
    subelements.add(new Subelement(path, comment, culture));
    return this;
  }

  @Override
  public XmlElement toXml() {
    XmlElement member = new XmlElement("Member").attr("Name", name).attr("Datatype", datatype);
    if (remanence != null && !remanence.isEmpty())
      member.attr("Remanence", remanence);
    subelements.forEach(sub -> member.add(sub.toXml()));
    return member;
  }
}
