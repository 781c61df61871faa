package stepnet.netlist;

import stepnet.util.XmlElement;

/** Per-index comment of an array member, e.g. the description of step bit 3. */
public class Subelement extends NetlistComponent {
  private final String path;
  private final String comment;
  private final String culture;

  public Subelement(String path, String comment, String culture) {
    this.path = path;
    this.comment = comment;
    this.culture = culture;
  }

  public String getPath() { return path; }
  public String getComment() { return comment; }

  @Override
  public XmlElement toXml() {
    XmlElement text = new XmlElement("MultiLanguageText", comment).attr("Lang", culture);
    return new XmlElement("Subelement").attr("Path", path).add(new XmlElement("Comment").add(text));
  }
}
