package stepnet.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import stepnet.util.XmlElement;

/** A Comment or Title object with one text item per culture. */
public class MultilingualText extends NetlistComponent {
  public record Item(int id, String culture, String text) {}

  private final int id;
  private final String compositionName;
  private final List<Item> items = new ArrayList<>();

  /**
   * @param uids identifier source; the text takes one id, each item one more
   * @param compositionName "Comment" or "Title"
   * @param text the text, the same for every culture
   * @param cultures culture codes, e.g. nl-NL
   */
  public MultilingualText(UidAllocator uids, String compositionName, String text, List<String> cultures) {
    this.id = uids.next();
    this.compositionName = compositionName;
    for (String culture : cultures)
      items.add(new Item(uids.next(), culture, text == null ? "" : text));
  }

  public int getId() { return id; }
  public String getCompositionName() { return compositionName; }
  public List<Item> getItems() { return Collections.unmodifiableList(items); }

  @Override
  public XmlElement toXml() {
    XmlElement objectList = new XmlElement("ObjectList");
    for (Item item : items) {
      XmlElement attributeList =
          new XmlElement("AttributeList").add(new XmlElement("Culture", item.culture())).add(new XmlElement("Text", item.text()));
      objectList.add(new XmlElement("MultilingualTextItem").attr("ID", item.id()).attr("CompositionName", "Items").add(attributeList));
    }
    return new XmlElement("MultilingualText").attr("ID", id).attr("CompositionName", compositionName).add(objectList);
  }
}
