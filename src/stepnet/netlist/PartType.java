package stepnet.netlist;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Logic parts used in generated networks, with their port names. */
public enum PartType {
  /** AND gate, inputs in1..inN with N chosen per part */
  A(null, List.of("out")),
  /** set/reset latch */
  Sr(List.of("s", "r1", "operand"), List.of("q")),
  Coil(List.of("in", "operand"), List.of());

  /** Input count of a variable-arity gate created without an explicit count. */
  public static final int DEFAULT_INPUT_COUNT = 2;

  private final List<String> inputs;
  private final List<String> outputs;

  private PartType(List<String> inputs, List<String> outputs) {
    this.inputs = inputs == null ? null : List.copyOf(inputs);
    this.outputs = List.copyOf(outputs);
  }

  /**
   * Input ports of a part of this type.
   * @param count number of inputs, only used for variable-arity gates
   * @return the port names
   */
  public List<String> getInputs(int count) {
    if (inputs != null)
      return inputs;
    if (count < 1)
      throw new IllegalArgumentException("a " + name() + " gate needs at least one input");
    return IntStream.rangeClosed(1, count).mapToObj(i -> "in" + i).collect(Collectors.toList());
  }

  public List<String> getOutputs() { return outputs; }
  /** Gates whose input count is declared as a cardinality template value. */
  public boolean hasCardinality() { return this == A; }
}
