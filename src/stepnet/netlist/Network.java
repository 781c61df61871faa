package stepnet.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import stepnet.util.XmlElement;

/**
 * One FBD compile unit: parts and accesses plus the wires between them.
 * The compile unit's own id comes from the document allocator, while its contents use the network allocator. Both are the same
 * allocator unless fixed identifier bands are requested.
 */
public class Network extends NetlistComponent {
  public static final String FLGNET_NAMESPACE = "http://www.siemens.com/automation/Openness/SW/NetworkSource/FlgNet/v4";

  private final int id;
  private final UidAllocator uids;
  private final MultilingualText title;
  private final MultilingualText comment;
  private final List<NetworkNode> nodes = new ArrayList<>();
  private final List<Wire> wires = new ArrayList<>();

  /**
   * @param documentUids allocator for the compile unit id
   * @param networkUids allocator for everything inside the network
   * @param title the network title
   * @param cultures cultures of title and comment
   */
  public Network(UidAllocator documentUids, UidAllocator networkUids, String title, List<String> cultures) {
    this.id = documentUids.next();
    this.uids = networkUids;
    this.title = new MultilingualText(networkUids, "Title", title, cultures);
    this.comment = new MultilingualText(networkUids, "Comment", "", cultures);
  }

  public int getId() { return id; }
  public MultilingualText getTitle() { return title; }
  public List<NetworkNode> getNodes() { return Collections.unmodifiableList(nodes); }
  public List<Wire> getWires() { return Collections.unmodifiableList(wires); }

  public List<Part> getParts(PartType type) {
    List<Part> ret = new ArrayList<>();
    for (NetworkNode node : nodes)
      if (node instanceof Part && ((Part)node).getType() == type)
        ret.add((Part)node);
    return ret;
  }

  public Part addPart(PartType type) { return addPart(type, PartType.DEFAULT_INPUT_COUNT); }

  /**
   * Adds a part.
   * @param type the part type
   * @param inputCount number of inputs of a variable-arity gate
   * @return the part
   */
  public Part addPart(PartType type, int inputCount) {
    Part part = new Part(uids, type, inputCount);
    nodes.add(part);
    return part;
  }

  public Access addAccess(String variable, int index) {
    Access access = Access.arrayElement(uids, variable, index);
    nodes.add(access);
    return access;
  }

  public Access addLiteralBool(boolean value) {
    Access access = Access.literalBool(uids, value);
    nodes.add(access);
    return access;
  }

  public Network connect(NetworkNode from, String fromPort, Part to, String toPort) { return connect(from, fromPort, to, toPort, false); }

  /**
   * Adds a wire.
   * @param from the source node
   * @param fromPort the source output port, null for an access
   * @param to the target part
   * @param toPort the target input port
   * @param negated whether the target input is negated
   * @return this
   * @throws IllegalArgumentException if the target part has no such input
   */
  public Network connect(NetworkNode from, String fromPort, Part to, String toPort, boolean negated) {
    to.checkInput(toPort);
    wires.add(new Wire(uids, from.getId(), fromPort, to.getId(), toPort));
    if (negated)
      to.negateInput(toPort);
    return this;
  }

  /** Number of wires per target node id. */
  public Map<Integer, Integer> countIncomingWires() {
    Map<Integer, Integer> ret = new HashMap<>();
    for (Wire wire : wires)
      ret.merge(wire.getToId(), 1, Integer::sum);
    return ret;
  }

  /**
   * Second pass after wiring: sets each gate's cardinality to the number of wires that end at it, then checks the result.
   * @throws IllegalStateException if a gate's cardinality does not match its wiring
   */
  public void resolveCardinality() {
    Map<Integer, Integer> incoming = countIncomingWires();
    List<Part> gates = new ArrayList<>();
    for (NetworkNode node : nodes)
      if (node instanceof Part && ((Part)node).getType().hasCardinality())
        gates.add((Part)node);
    gates.forEach(gate -> gate.setCardinality(incoming.getOrDefault(gate.getId(), 0)));
    for (Part gate : gates) {
      int wired = incoming.getOrDefault(gate.getId(), 0);
      if (gate.getCardinality() == null || gate.getCardinality() != wired)
        throw new IllegalStateException("cardinality " + gate.getCardinality() + " of part " + gate.getId() + " does not match " + wired +
                                        " wires");
    }
  }

  @Override
  public XmlElement toXml() {
    XmlElement parts = new XmlElement("Parts");
    nodes.forEach(node -> parts.add(node.toXml()));
    XmlElement wireList = new XmlElement("Wires");
    wires.forEach(wire -> wireList.add(wire.toXml()));

    XmlElement flgNet = new XmlElement("FlgNet").attr("xmlns", FLGNET_NAMESPACE).add(parts).add(wireList);
    XmlElement attributeList =
        new XmlElement("AttributeList").add(new XmlElement("NetworkSource").add(flgNet)).add(new XmlElement("ProgrammingLanguage", "FBD"));
    XmlElement objectList = new XmlElement("ObjectList").add(comment.toXml()).add(title.toXml());
    return new XmlElement("SW.Blocks.CompileUnit").attr("ID", id).attr("CompositionName", "CompileUnits").add(attributeList).add(objectList);
  }
}
