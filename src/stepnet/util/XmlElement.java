package stepnet.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generic XML element tree used for every emitted netlist fragment.
 * Children are other elements, escaped text leaves, or pre-rendered raw fragments that are inserted verbatim.
 */
public class XmlElement {
  private enum ChildKind { Element, Text, Raw }

  private static class Child {
    final ChildKind kind;
    final XmlElement element;
    final String text;
    Child(XmlElement element) {
      this.kind = ChildKind.Element;
      this.element = element;
      this.text = null;
    }
    Child(ChildKind kind, String text) {
      this.kind = kind;
      this.element = null;
      this.text = text;
    }
  }

  private final String name;
  private final LinkedHashMap<String, String> attributes = new LinkedHashMap<>();
  private final List<Child> children = new ArrayList<>();

  public XmlElement(String name) { this.name = name; }

  /**
   * Creates an element with a single text child. An empty string still counts as a child, so it renders as an open/close pair.
   * @param name the element name
   * @param text the text content, escaped on output
   */
  public XmlElement(String name, String text) {
    this(name);
    add(text);
  }

  public String getName() { return name; }

  public XmlElement add(XmlElement child) {
    children.add(new Child(child));
    return this;
  }
  public XmlElement add(String text) {
    children.add(new Child(ChildKind.Text, text));
    return this;
  }
  /**
   * Adds a pre-rendered fragment. The fragment is emitted as-is: no escaping, no re-indentation.
   * @param xml the rendered fragment
   * @return this
   */
  public XmlElement addRaw(String xml) {
    children.add(new Child(ChildKind.Raw, xml));
    return this;
  }

  /**
   * Sets an attribute. Null values are skipped, all other values are stored through {@link String#valueOf(Object)}.
   * @param key attribute name
   * @param value a String, Number or Boolean, or null
   * @return this
   */
  public XmlElement attr(String key, Object value) {
    if (value != null)
      attributes.put(key, String.valueOf(value));
    return this;
  }

  public String getAttribute(String key) { return attributes.get(key); }

  /** Child elements, in order. Text and raw children are not included. */
  public List<XmlElement> getChildElements() {
    List<XmlElement> ret = new ArrayList<>();
    for (Child child : children)
      if (child.kind == ChildKind.Element)
        ret.add(child.element);
    return ret;
  }

  public static String escape(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 16);
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
      case '&':
        sb.append("&amp;");
        break;
      case '<':
        sb.append("&lt;");
        break;
      case '>':
        sb.append("&gt;");
        break;
      case '"':
        sb.append("&quot;");
        break;
      case '\'':
        sb.append("&apos;");
        break;
      default:
        sb.append(c);
      }
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return toString(true, 0);
  }

  /**
   * Renders the element.
   * In pretty mode, each level is indented by two spaces and an element whose only child is a text leaf stays on one line.
   * In compact mode no whitespace is added at all.
   * @param pretty pretty-print flag
   * @param level the indentation depth of this element
   * @return the rendered XML
   */
  public String toString(boolean pretty, int level) {
    StringBuilder sb = new StringBuilder();
    render(sb, pretty, level);
    return sb.toString();
  }

  private void render(StringBuilder sb, boolean pretty, int level) {
    String indent = pretty ? "  ".repeat(level) : "";
    sb.append(indent).append('<').append(name);
    for (Map.Entry<String, String> attribute : attributes.entrySet())
      sb.append(' ').append(attribute.getKey()).append("=\"").append(escape(attribute.getValue())).append('"');

    if (children.isEmpty()) {
      sb.append(" />");
      return;
    }
    sb.append('>');

    boolean isSimpleText = children.size() == 1 && children.get(0).kind == ChildKind.Text;
    if (isSimpleText && pretty) {
      sb.append(escape(children.get(0).text)).append("</").append(name).append('>');
      return;
    }

    if (pretty)
      sb.append('\n');
    for (int i = 0; i < children.size(); i++) {
      Child child = children.get(i);
      if (i > 0 && pretty)
        sb.append('\n');
      switch (child.kind) {
      case Raw:
        sb.append(child.text);
        break;
      case Text:
        if (pretty)
          sb.append(indent).append("  ");
        sb.append(escape(child.text));
        break;
      case Element:
        child.element.render(sb, pretty, level + 1);
        break;
      }
    }
    if (pretty)
      sb.append('\n').append(indent);
    sb.append("</").append(name).append('>');
  }
}
