package stepnet.netlist;

import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import stepnet.frontend.BlockTag;
import stepnet.frontend.Program;
import stepnet.frontend.Step;
import stepnet.ui.StepNetConfig;

/**
 * Builds the FBD netlist of a parsed program: one latch network that holds the REST step while no sequential step is active,
 * and one set/reset network per sequential step in declaration order. The last step drives a plain coil.
 */
public class NetlistGenerator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String STEP_ARRAY = "Stap";
  public static final int REST_NETWORK_BASE = 500;
  public static final int STEP_NETWORK_BASE = 1000;
  public static final int STEP_NETWORK_STRIDE = 100;

  private static final String DEFAULT_FB_NAME = "FB1";
  private static final String DEFAULT_CULTURE = "nl-NL";

  private final StepNetConfig config;

  public NetlistGenerator(StepNetConfig config) { this.config = config; }

  /**
   * Generates the document.
   * @param program the parsed program, diagnostics are not consulted
   * @return the netlist document
   * @throws GenerationException if the program has no steps, or a fixed identifier band overflows
   */
  public NetlistDocument generate(Program program) throws GenerationException {
    if (program.getSteps().isEmpty())
      throw new GenerationException("program '" + program.getName() + "' has no steps to compile");

    List<String> cultures = config.cultures.isEmpty() ? List.of(DEFAULT_CULTURE) : config.cultures;
    NetlistDocument document = new NetlistDocument(config.engineeringVersion);
    UidAllocator documentUids = document.getUids();

    Optional<BlockTag> tag = program.getFunctionBlockTag();
    String blockName = tag.map(BlockTag::toString).orElse(DEFAULT_FB_NAME);
    int blockNumber = tag.map(BlockTag::number).filter(number -> number > 0).orElse(1);
    FunctionBlock functionBlock = new FunctionBlock(documentUids, blockName, blockNumber, cultures);
    document.setFunctionBlock(functionBlock);
    BuildInterface(functionBlock, program, cultures.get(0));

    List<Step> sequential = program.getSequentialSteps();
    Optional<Step> rest = program.getRestStep();
    if (rest.isPresent()) {
      UidAllocator networkUids = config.legacyNetworkIdRanges ? new UidAllocator(REST_NETWORK_BASE) : documentUids;
      functionBlock.addNetwork(BuildRestNetwork(documentUids, networkUids, rest.get(), sequential, cultures));
      if (config.legacyNetworkIdRanges)
        CheckBand(networkUids, REST_NETWORK_BASE, STEP_NETWORK_BASE, "REST network");
    }
    for (int i = 0; i < sequential.size(); i++) {
      int bandStart = STEP_NETWORK_BASE + STEP_NETWORK_STRIDE * i;
      UidAllocator networkUids = config.legacyNetworkIdRanges ? new UidAllocator(bandStart) : documentUids;
      functionBlock.addNetwork(BuildStepNetwork(documentUids, networkUids, sequential, i, cultures));
      if (config.legacyNetworkIdRanges)
        CheckBand(networkUids, bandStart, bandStart + STEP_NETWORK_STRIDE, "network of " + sequential.get(i));
    }

    if (config.emitInstanceDb && !program.getSymbolicInstanceName().isEmpty()) {
      int number = config.instanceDbNumber > 0 ? config.instanceDbNumber : blockNumber;
      document.setInstanceDataBlock(new InstanceDataBlock(documentUids, program.getSymbolicInstanceName(), number, blockName, cultures));
    }
    if (config.legacyNetworkIdRanges)
      CheckBand(documentUids, 0, REST_NETWORK_BASE, "document");

    logger.debug("generator: {} networks for {} ({} steps)", functionBlock.getNetworks().size(), blockName, program.getSteps().size());
    return document;
  }

  /**
   * Fixed identifier bands must not spill into the next band.
   * @param uids the allocator that filled the band
   * @param bandStart first identifier of the band
   * @param bandEnd first identifier past the band
   * @param owner what the band belongs to, for the message
   * @throws GenerationException if the band overflowed
   */
  private static void CheckBand(UidAllocator uids, int bandStart, int bandEnd, String owner) throws GenerationException {
    if (uids.peek() > bandEnd)
      throw new GenerationException(owner + " needs identifiers " + bandStart + ".." + (uids.peek() - 1) + ", its band ends at " +
                                    (bandEnd - 1) + "; use a single identifier range for programs this large");
  }

  private void BuildInterface(FunctionBlock functionBlock, Program program, String culture) {
    BlockInterface blockInterface = functionBlock.getInterface();
    int highestStep = program.getSteps().stream().mapToInt(Step::getNumber).max().orElse(0);
    String stepArrayType = "Array[0.." + Math.max(31, highestStep) + "] of Bool";

    Member stepMember = blockInterface.addMember(InterfaceSection.Static, STEP_ARRAY, stepArrayType, "Retain");
    for (Step step : program.getSteps())
      stepMember.addSubelement(String.valueOf(step.getNumber()), step.label(config.restLabel, config.stepLabel).strip(), culture);
    blockInterface.addMember(InterfaceSection.Static, "Stap_A", "Array[0..31] of Bool", "Retain");
    blockInterface.addMember(InterfaceSection.Static, "Stap_B", "Array[0..31] of Bool", "Retain");
    blockInterface.addMember(InterfaceSection.Static, "Stap_C", "Array[0..31] of Bool", "Retain");
    blockInterface.addMember(InterfaceSection.Static, "Hulp", "Array[1..32] of Bool", "Retain");
    blockInterface.addMember(InterfaceSection.Static, "Tijd", "Array[1..10] of IEC_TIMER", "Retain");
    blockInterface.addMember(InterfaceSection.Static, "Teller", "Array[1..10] of Int", "Retain");
    blockInterface.addMember(InterfaceSection.Output, "Uit_Stap_Tekst", "Int", "");
  }

  /**
   * REST is set while none of the sequential steps is active and reset by the first step.
   */
  private Network BuildRestNetwork(UidAllocator documentUids, UidAllocator networkUids, Step rest, List<Step> sequential,
                                   List<String> cultures) {
    String title = rest.getDescription().isEmpty() ? config.restLabel + " Logic" : rest.getDescription();
    Network network = new Network(documentUids, networkUids, title, cultures);

    List<Access> stepAccesses = sequential.stream().map(step -> network.addAccess(STEP_ARRAY, step.getNumber())).toList();
    Part andGate = network.addPart(PartType.A, Math.max(1, stepAccesses.size()));
    for (int i = 0; i < stepAccesses.size(); i++)
      network.connect(stepAccesses.get(i), null, andGate, "in" + (i + 1), true);

    Part latch = network.addPart(PartType.Sr);
    if (!sequential.isEmpty()) {
      Access firstStep = network.addAccess(STEP_ARRAY, sequential.get(0).getNumber());
      network.connect(firstStep, null, latch, "r1");
    }
    network.connect(andGate, "out", latch, "s");
    Access operand = network.addAccess(STEP_ARRAY, 0);
    network.connect(operand, null, latch, "operand");

    network.resolveCardinality();
    return network;
  }

  /**
   * Step i is set when its predecessor is active and it is not, and reset by its successor. The extra input is a constant
   * placeholder for the step's own conditions.
   */
  private Network BuildStepNetwork(UidAllocator documentUids, UidAllocator networkUids, List<Step> sequential, int index,
                                   List<String> cultures) {
    Step step = sequential.get(index);
    Network network = new Network(documentUids, networkUids, step.label(config.restLabel, config.stepLabel), cultures);

    int previous = index == 0 ? 0 : sequential.get(index - 1).getNumber();
    Access previousStep = network.addAccess(STEP_ARRAY, previous);
    Access currentStep = network.addAccess(STEP_ARRAY, step.getNumber());
    Access placeholder = network.addLiteralBool(false);
    Part andGate = network.addPart(PartType.A, 3);
    network.connect(previousStep, null, andGate, "in1");
    network.connect(currentStep, null, andGate, "in2", true);
    network.connect(placeholder, null, andGate, "in3");

    if (index == sequential.size() - 1) {
      Part coil = network.addPart(PartType.Coil);
      Access operand = network.addAccess(STEP_ARRAY, step.getNumber());
      network.connect(andGate, "out", coil, "in");
      network.connect(operand, null, coil, "operand");
    } else {
      Part latch = network.addPart(PartType.Sr);
      Access resetStep = network.addAccess(STEP_ARRAY, sequential.get(index + 1).getNumber());
      Access operand = network.addAccess(STEP_ARRAY, step.getNumber());
      network.connect(andGate, "out", latch, "s");
      network.connect(resetStep, null, latch, "r1");
      network.connect(operand, null, latch, "operand");
    }

    network.resolveCardinality();
    return network;
  }
}
