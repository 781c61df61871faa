package stepnet.netlist;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import stepnet.frontend.BlockTag;
import stepnet.frontend.Program;
import stepnet.frontend.Step;
import stepnet.frontend.StepKind;
import stepnet.ui.StepNetConfig;
import stepnet.util.XmlElement;

class NetlistGeneratorTest {

  private static Program program(boolean withRest, int... stepNumbers) {
    Program program = new Program();
    program.setName("Vullen");
    if (withRest)
      program.addStep(new Step(StepKind.REST, "RUST", "Wachten", 1));
    for (int number : stepNumbers)
      program.addStep(new Step(new StepKind.Sequential(number), "STAP", number == 2 ? "" : "Stap " + number, number + 1));
    return program;
  }

  private static List<Integer> accessIndices(Network network) {
    List<Integer> ret = new ArrayList<>();
    for (NetworkNode node : network.getNodes())
      if (node instanceof Access && !((Access)node).isLiteral()) {
        Assertions.assertEquals(NetlistGenerator.STEP_ARRAY, ((Access)node).getVariable());
        ret.add(((Access)node).getIndex());
      }
    return ret;
  }

  private static void collectIds(XmlElement element, List<String> ids) {
    if (!element.getName().equals("NameCon") && !element.getName().equals("IdentCon")) {
      if (element.getAttribute("ID") != null)
        ids.add(element.getAttribute("ID"));
      if (element.getAttribute("UId") != null)
        ids.add(element.getAttribute("UId"));
    }
    element.getChildElements().forEach(child -> collectIds(child, ids));
  }

  @Test
  void testUidAllocator() {
    UidAllocator uids = new UidAllocator(500);
    Assertions.assertEquals(500, uids.peek());
    Assertions.assertEquals(500, uids.next());
    Assertions.assertEquals(501, uids.next());
    Assertions.assertEquals(502, uids.peek());
    Assertions.assertEquals(0, new UidAllocator().next());
    Assertions.assertThrows(IllegalArgumentException.class, () -> new UidAllocator(-1));
  }

  @Test
  void testEmptyProgramIsRejected() {
    Assertions.assertThrows(GenerationException.class, () -> new NetlistGenerator(new StepNetConfig()).generate(new Program()));
  }

  @Test
  void testNetworkLayout() throws GenerationException {
    NetlistDocument document = new NetlistGenerator(new StepNetConfig()).generate(program(true, 1, 2, 3));
    List<Network> networks = document.getFunctionBlock().getNetworks();
    Assertions.assertEquals(4, networks.size());

    Network rest = networks.get(0);
    Assertions.assertEquals("Title", rest.getTitle().getCompositionName());
    Assertions.assertEquals("Wachten", rest.getTitle().getItems().get(0).text());
    Part restGate = rest.getParts(PartType.A).get(0);
    Assertions.assertEquals(3, restGate.getCardinality());
    Assertions.assertEquals(Set.of("in1", "in2", "in3"), restGate.getNegatedInputs());
    Assertions.assertEquals(1, rest.getParts(PartType.Sr).size());
    Assertions.assertEquals(List.of(1, 2, 3, 1, 0), accessIndices(rest));

    Network first = networks.get(1);
    Assertions.assertEquals("STAP 1: Stap 1", first.getTitle().getItems().get(0).text());
    Assertions.assertEquals(List.of(0, 1, 2, 1), accessIndices(first));
    Part firstGate = first.getParts(PartType.A).get(0);
    Assertions.assertEquals(3, firstGate.getCardinality());
    Assertions.assertEquals(Set.of("in2"), firstGate.getNegatedInputs());
    Assertions.assertEquals(1, first.getParts(PartType.Sr).size());

    Network second = networks.get(2);
    Assertions.assertEquals("STAP 2: ", second.getTitle().getItems().get(0).text());
    Assertions.assertEquals(1, second.getParts(PartType.Sr).size());
    Assertions.assertEquals(List.of(1, 2, 3, 2), accessIndices(second));

    Network last = networks.get(3);
    Assertions.assertTrue(last.getParts(PartType.Sr).isEmpty());
    Assertions.assertEquals(1, last.getParts(PartType.Coil).size());
    Assertions.assertEquals(List.of(2, 3, 3), accessIndices(last));
  }

  @Test
  void testWithoutRest() throws GenerationException {
    NetlistDocument document = new NetlistGenerator(new StepNetConfig()).generate(program(false, 5));
    List<Network> networks = document.getFunctionBlock().getNetworks();
    Assertions.assertEquals(1, networks.size());
    Assertions.assertEquals(List.of(0, 5, 5), accessIndices(networks.get(0)));
    Assertions.assertEquals(1, networks.get(0).getParts(PartType.Coil).size());
  }

  @Test
  void testInterface() throws GenerationException {
    FunctionBlock block = new NetlistGenerator(new StepNetConfig()).generate(program(true, 1, 2)).getFunctionBlock();
    List<Member> statics = block.getInterface().getMembers(InterfaceSection.Static);
    Assertions.assertEquals(List.of("Stap", "Stap_A", "Stap_B", "Stap_C", "Hulp", "Tijd", "Teller"), statics.stream().map(Member::getName).toList());
    Member stepMember = statics.get(0);
    Assertions.assertEquals("Array[0..31] of Bool", stepMember.getDatatype());
    Assertions.assertEquals(List.of("RUST: Wachten", "STAP 1: Stap 1", "STAP 2:"),
                            stepMember.getSubelements().stream().map(Subelement::getComment).toList());
    Assertions.assertEquals(List.of("0", "1", "2"), stepMember.getSubelements().stream().map(Subelement::getPath).toList());
    Assertions.assertEquals("Uit_Stap_Tekst", block.getInterface().getMembers(InterfaceSection.Output).get(0).getName());
    Assertions.assertTrue(block.getInterface().getMembers(InterfaceSection.Input).isEmpty());

    FunctionBlock large = new NetlistGenerator(new StepNetConfig()).generate(program(false, 1, 40)).getFunctionBlock();
    Assertions.assertEquals("Array[0..40] of Bool", large.getInterface().getMembers(InterfaceSection.Static).get(0).getDatatype());
  }

  @Test
  void testBlockName() throws GenerationException {
    NetlistGenerator generator = new NetlistGenerator(new StepNetConfig());
    FunctionBlock unnamed = generator.generate(program(true, 1)).getFunctionBlock();
    Assertions.assertEquals("FB1", unnamed.getName());
    Assertions.assertEquals(1, unnamed.getNumber());

    Program tagged = program(true, 1);
    tagged.setFunctionBlockTag(new BlockTag("FB", 12));
    FunctionBlock block = generator.generate(tagged).getFunctionBlock();
    Assertions.assertEquals("FB12", block.getName());
    Assertions.assertEquals(12, block.getNumber());
  }

  @Test
  void testIdentifiersAreUnique() throws GenerationException {
    StepNetConfig cfg = new StepNetConfig();
    cfg.emitInstanceDb = true;
    Program program = program(true, 1, 2, 3, 4);
    program.setSymbolicInstanceName("Vul_DB");
    NetlistDocument document = new NetlistGenerator(cfg).generate(program);

    List<String> ids = new ArrayList<>();
    collectIds(document.toXml(), ids);
    Assertions.assertEquals(ids.size(), new HashSet<>(ids).size(), "duplicate identifiers: " + ids);
    Assertions.assertEquals("0", ids.get(0));

    FunctionBlock block = document.getFunctionBlock();
    Network rest = block.getNetworks().get(0);
    // FB id, then comment and title with one item per culture
    Assertions.assertEquals(7, rest.getId());
    Assertions.assertEquals(8, rest.getTitle().getId());
  }

  @Test
  void testLegacyIdentifierBands() throws GenerationException {
    StepNetConfig cfg = new StepNetConfig();
    cfg.legacyNetworkIdRanges = true;
    List<Network> networks = new NetlistGenerator(cfg).generate(program(true, 1, 2, 3)).getFunctionBlock().getNetworks();
    Assertions.assertEquals(List.of(7, 8, 9, 10), networks.stream().map(Network::getId).toList());
    Assertions.assertEquals(NetlistGenerator.REST_NETWORK_BASE, networks.get(0).getTitle().getId());
    Assertions.assertEquals(NetlistGenerator.STEP_NETWORK_BASE, networks.get(1).getTitle().getId());
    Assertions.assertEquals(NetlistGenerator.STEP_NETWORK_BASE + NetlistGenerator.STEP_NETWORK_STRIDE * 2, networks.get(3).getTitle().getId());
  }

  @Test
  void testLegacyBandOverflow() throws GenerationException {
    StepNetConfig cfg = new StepNetConfig();
    cfg.legacyNetworkIdRanges = true;
    NetlistGenerator generator = new NetlistGenerator(cfg);

    NetlistDocument fits = generator.generate(program(true, IntStream.rangeClosed(1, 200).toArray()));
    List<String> ids = new ArrayList<>();
    collectIds(fits.toXml(), ids);
    Assertions.assertEquals(ids.size(), new HashSet<>(ids).size());

    GenerationException e =
        Assertions.assertThrows(GenerationException.class, () -> generator.generate(program(true, IntStream.rangeClosed(1, 250).toArray())));
    Assertions.assertTrue(e.getMessage().startsWith("REST network"), e.getMessage());

    cfg.legacyNetworkIdRanges = false;
    NetlistDocument single = new NetlistGenerator(cfg).generate(program(true, IntStream.rangeClosed(1, 250).toArray()));
    ids.clear();
    collectIds(single.toXml(), ids);
    Assertions.assertEquals(ids.size(), new HashSet<>(ids).size());
  }

  @Test
  void testWideRestGate() throws GenerationException {
    int[] numbers = IntStream.rangeClosed(1, 40).toArray();
    Network rest = new NetlistGenerator(new StepNetConfig()).generate(program(true, numbers)).getFunctionBlock().getNetworks().get(0);
    Part gate = rest.getParts(PartType.A).get(0);
    Assertions.assertEquals(40, gate.getCardinality());
    Assertions.assertEquals(40, gate.getInputs().size());
    Assertions.assertEquals(gate.getCardinality(), gate.getNegatedInputs().size());
    Assertions.assertTrue(gate.getNegatedInputs().contains("in31"));
    Assertions.assertTrue(gate.getNegatedInputs().contains("in40"));
  }

  @Test
  void testUnknownPortIsRejected() {
    UidAllocator uids = new UidAllocator();
    Network network = new Network(uids, uids, "Test", List.of("nl-NL"));
    Access access = network.addAccess(NetlistGenerator.STEP_ARRAY, 1);
    Part gate = network.addPart(PartType.A);
    Assertions.assertEquals(List.of("in1", "in2"), gate.getInputs());
    Assertions.assertThrows(IllegalArgumentException.class, () -> network.connect(access, null, gate, "in3", true));
    Assertions.assertTrue(gate.getNegatedInputs().isEmpty());
    Assertions.assertThrows(IllegalArgumentException.class, () -> network.connect(access, null, network.addPart(PartType.Coil), "s"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> network.addPart(PartType.A, 0));
  }

  @Test
  void testInstanceDataBlock() throws GenerationException {
    StepNetConfig cfg = new StepNetConfig();
    cfg.emitInstanceDb = true;
    Program program = program(true, 1);
    program.setFunctionBlockTag(new BlockTag("FB", 3));
    Assertions.assertTrue(new NetlistGenerator(cfg).generate(program).getInstanceDataBlock().isEmpty());

    program.setSymbolicInstanceName("Vul_DB");
    InstanceDataBlock instance = new NetlistGenerator(cfg).generate(program).getInstanceDataBlock().get();
    Assertions.assertEquals("Vul_DB", instance.getName());
    Assertions.assertEquals(3, instance.getNumber());
    Assertions.assertEquals("FB3", instance.getInstanceOfName());

    cfg.instanceDbNumber = 103;
    Assertions.assertEquals(103, new NetlistGenerator(cfg).generate(program).getInstanceDataBlock().get().getNumber());

    cfg.emitInstanceDb = false;
    Assertions.assertTrue(new NetlistGenerator(cfg).generate(program).getInstanceDataBlock().isEmpty());
  }

  @Test
  void testSerializedDocument() throws GenerationException {
    StepNetConfig cfg = new StepNetConfig();
    cfg.emitInstanceDb = true;
    Program program = program(true, 1, 2);
    program.setSymbolicInstanceName("Vul_DB");
    String xml = new NetlistGenerator(cfg).generate(program).toXml(true);

    Assertions.assertTrue(xml.startsWith("<?xml version=\"1.0\" encoding=\"utf-8\"?>\n<Document>\n  <Engineering version=\"V18\" />\n"));
    Assertions.assertTrue(xml.contains("<Sections xmlns=\"http://www.siemens.com/automation/Openness/SW/Interface/v5\">"));
    Assertions.assertTrue(xml.contains("<Section Name=\"InOut\" />"));
    Assertions.assertTrue(xml.contains("<MultiLanguageText Lang=\"nl-NL\">RUST: Wachten</MultiLanguageText>"));
    Assertions.assertTrue(xml.contains("<FlgNet xmlns=\"http://www.siemens.com/automation/Openness/SW/NetworkSource/FlgNet/v4\">"));
    Assertions.assertTrue(xml.contains("<TemplateValue Name=\"Card\" Type=\"Cardinality\">2</TemplateValue>"));
    Assertions.assertTrue(xml.contains("<TemplateValue Name=\"Card\" Type=\"Cardinality\">3</TemplateValue>"));
    Assertions.assertTrue(xml.contains("<Negated Name=\"in2\" />"));
    Assertions.assertTrue(xml.contains("<ConstantType>Bool</ConstantType>"));
    Assertions.assertTrue(xml.contains("<Culture>en-GB</Culture>"));
    Assertions.assertTrue(xml.contains("<SW.Blocks.InstanceDB ID="));
    Assertions.assertTrue(xml.contains("Array[0..2] of &quot;Program Alarm Message&quot;"));
    Assertions.assertTrue(xml.indexOf("<SW.Blocks.FB ") < xml.indexOf("<SW.Blocks.InstanceDB "));

    String compact = new NetlistGenerator(cfg).generate(program).toXml(false);
    Assertions.assertTrue(compact.startsWith(NetlistDocument.DECLARATION + "<Document><Engineering version=\"V18\" /><SW.Blocks.FB ID=\"0\">"));
  }

  @RepeatedTest(64)
  void testCardinality_random() {
    long seed = new Random().nextLong();
    try {
      testCardinality(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testCardinality with seed " + seed);
      throw t;
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {3, 1234, 5893163784830298700L})
  void testCardinality(long seed) {
    var rand = new Random(seed);
    int count = 1 + rand.nextInt(15);
    int[] numbers = new int[count];
    int next = 0;
    for (int i = 0; i < count; i++) {
      next += 1 + rand.nextInt(3);
      numbers[i] = next;
    }
    boolean withRest = rand.nextBoolean();
    StepNetConfig cfg = new StepNetConfig();
    cfg.legacyNetworkIdRanges = rand.nextBoolean();

    NetlistDocument document;
    try {
      document = new NetlistGenerator(cfg).generate(program(withRest, numbers));
    } catch (GenerationException e) {
      throw new AssertionError(e);
    }
    List<Network> networks = document.getFunctionBlock().getNetworks();
    Assertions.assertEquals(count + (withRest ? 1 : 0), networks.size());
    for (int i = 0; i < networks.size(); i++) {
      Network network = networks.get(i);
      Map<Integer, NetworkNode> byId = new HashMap<>();
      network.getNodes().forEach(node -> byId.put(node.getId(), node));
      Map<Integer, Integer> incoming = network.countIncomingWires();
      for (Part gate : network.getParts(PartType.A)) {
        Assertions.assertEquals(incoming.getOrDefault(gate.getId(), 0), gate.getCardinality());
        int expected = (withRest && i == 0) ? count : 3;
        Assertions.assertEquals(expected, gate.getCardinality());
      }
      for (Wire wire : network.getWires()) {
        NetworkNode target = byId.get(wire.getToId());
        Assertions.assertTrue(target instanceof Part, "wire must end at a part");
        Assertions.assertTrue(((Part)target).getInputs().contains(wire.getToPort()), wire.getToPort());
        NetworkNode source = byId.get(wire.getFromId());
        Assertions.assertNotNull(source, "wire source must be in the same network");
        if (wire.getFromPort() != null)
          Assertions.assertTrue(((Part)source).getType().getOutputs().contains(wire.getFromPort()), wire.getFromPort());
        else
          Assertions.assertTrue(source instanceof Access);
      }
    }
  }
}
