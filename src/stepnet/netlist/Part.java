package stepnet.netlist;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import stepnet.util.XmlElement;

/** A gate, latch or coil. */
public class Part extends NetworkNode {
  private final PartType type;
  private final List<String> inputs;
  private Integer cardinality = null;
  private final LinkedHashSet<String> negatedInputs = new LinkedHashSet<>();

  /**
   * @param uids identifier source
   * @param type the part type
   * @param inputCount number of inputs of a variable-arity gate, ignored for other types
   */
  public Part(UidAllocator uids, PartType type, int inputCount) {
    super(uids);
    this.type = type;
    this.inputs = type.getInputs(inputCount);
  }

  public PartType getType() { return type; }
  public List<String> getInputs() { return inputs; }

  /** The declared input count, null until cardinality resolution ran. */
  public Integer getCardinality() { return cardinality; }
  void setCardinality(int cardinality) { this.cardinality = cardinality; }

  public Set<String> getNegatedInputs() { return Collections.unmodifiableSet(negatedInputs); }

  /**
   * Marks an input as negated.
   * @param port the input port name
   * @throws IllegalArgumentException if the part has no such input
   */
  public void negateInput(String port) {
    checkInput(port);
    negatedInputs.add(port);
  }

  void checkInput(String port) {
    if (!inputs.contains(port))
      throw new IllegalArgumentException("part " + type + " (" + id + ") has no input " + port + ", inputs are " + inputs);
  }

  @Override
  public XmlElement toXml() {
    XmlElement part = new XmlElement("Part").attr("Name", type.name()).attr("UId", id);
    if (cardinality != null && cardinality > 0)
      part.add(new XmlElement("TemplateValue", String.valueOf(cardinality)).attr("Name", "Card").attr("Type", "Cardinality"));
    for (String port : negatedInputs)
      part.add(new XmlElement("Negated").attr("Name", port));
    return part;
  }
}
