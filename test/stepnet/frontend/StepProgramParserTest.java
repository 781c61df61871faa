package stepnet.frontend;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import stepnet.config.SyntaxRules;
import stepnet.frontend.strategy.LineStrategies;
import stepnet.frontend.strategy.LineStrategy;
import stepnet.util.PatternCache;

class StepProgramParserTest {
  private static final String program = String.join("\n", "Vulprogramma FB12", "Symbolik IDB: Vul_DB", "", "RUST: Wachten op start",
                                                    "  - Startknop ingedrukt", "", "STAP 1: Vullen", "  - Klep open", "  + Handbediening", "",
                                                    "  - Niveau hoog", "Pomp = AAN", "", "STAP 2: Mengen", "  - TIJD 30 sek", "VON STAP 1",
                                                    "  - Noodstop vrij", "STAP 3: Legen", "  - Pomp aan (Filler STAP 3+4)", "KLAAR:", "",
                                                    "STORING: Motor =", "  - Motor Fault");

  private StepProgramParser parser;

  @BeforeEach
  void setUp() {
    parser = new StepProgramParser(new StepKeywordScanner(SyntaxRules.defaults(), new PatternCache(64)));
  }

  private static List<DiagnosticType> types(List<Diagnostic> diagnostics) { return diagnostics.stream().map(Diagnostic::type).toList(); }

  @Test
  void testProgramStructure() {
    Program parsed = parser.parse(program, null);
    Assertions.assertEquals(List.of(), parsed.getErrors());
    Assertions.assertEquals(List.of(), parsed.getWarnings());

    Assertions.assertEquals("Vulprogramma", parsed.getName());
    Assertions.assertEquals(new BlockTag("FB", 12), parsed.getFunctionBlockTag().get());
    Assertions.assertEquals("Vul_DB", parsed.getSymbolicInstanceName());

    List<Step> steps = parsed.getSteps();
    Assertions.assertEquals(4, steps.size());
    Assertions.assertTrue(steps.get(0).isRest());
    Assertions.assertEquals("Wachten op start", steps.get(0).getDescription());
    Assertions.assertEquals(List.of(1, 2, 3), parsed.getSequentialSteps().stream().map(Step::getNumber).toList());
    Assertions.assertEquals(4, steps.get(0).getLineNumber());
    Assertions.assertEquals(7, steps.get(1).getLineNumber());
  }

  @Test
  void testEntryAndExitConditions() {
    Step fill = parser.parse(program, null).findSequentialStep(1).get();
    List<ConditionGroup> entry = fill.getEntryConditions();
    Assertions.assertEquals(2, entry.size());
    Assertions.assertEquals(GroupOperator.AND, entry.get(0).getOperator());
    Assertions.assertEquals("Klep open", entry.get(0).getConditions().get(0).text());
    Assertions.assertEquals(GroupOperator.OR, entry.get(1).getOperator());
    Assertions.assertEquals("Handbediening", entry.get(1).getConditions().get(0).text());

    Assertions.assertEquals(1, fill.getExitConditions().size());
    Assertions.assertEquals("Niveau hoog", fill.getExitConditions().get(0).getConditions().get(0).text());
    Assertions.assertEquals(3, fill.getConditionCount());

    Assertions.assertEquals(1, fill.getAssignments().size());
    Assertions.assertEquals(new Assignment("Pomp", "AAN", 12), fill.getAssignments().get(0));
  }

  @Test
  void testLeadingOrStartsAndGroup() {
    Step step = parser.parse("STAP 1: Vullen\n  + Klep open\n  + Handbediening", null).getSteps().get(0);
    List<ConditionGroup> entry = step.getEntryConditions();
    Assertions.assertEquals(2, entry.size());
    Assertions.assertEquals(GroupOperator.AND, entry.get(0).getOperator());
    Assertions.assertEquals(List.of("Klep open"), entry.get(0).getConditions().stream().map(Condition::text).toList());
    Assertions.assertEquals(GroupOperator.OR, entry.get(1).getOperator());
    Assertions.assertEquals(List.of("Handbediening"), entry.get(1).getConditions().stream().map(Condition::text).toList());
  }

  @Test
  void testTransitionsAndCrossReferences() {
    Program parsed = parser.parse(program, null);
    Step mix = parsed.findSequentialStep(2).get();
    Assertions.assertTrue(mix.getTransitions().isEmpty());
    Assertions.assertEquals(List.of("TIJD"), List.copyOf(mix.getTimerNames()));
    Assertions.assertEquals(ConditionKind.TIMER, mix.getEntryConditions().get(0).getConditions().get(0).kind());

    Step drain = parsed.findSequentialStep(3).get();
    Assertions.assertEquals(1, drain.getTransitions().size());
    Transition transition = drain.getTransitions().get(0);
    Assertions.assertEquals(1, transition.getFromStep());
    Assertions.assertEquals(16, transition.getLineNumber());
    Assertions.assertEquals("Noodstop vrij", transition.getConditions().get(0).getConditions().get(0).text());
    // transition conditions are not step conditions
    Assertions.assertEquals(1, drain.getEntryConditions().size());

    Assertions.assertEquals(1, parsed.getCrossReferences().size());
    Assertions.assertEquals(new CrossReference("Filler", List.of(3, 4), 19), parsed.getCrossReferences().get(0));
  }

  @Test
  void testStandaloneVariableAfterEnd() {
    Program parsed = parser.parse(program, null);
    Assertions.assertEquals(1, parsed.getVariables().size());
    Variable fault = parsed.getVariables().get(0);
    Assertions.assertEquals("STORING: Motor", fault.getName());
    Assertions.assertEquals(VariableKind.Fault, fault.getKind());
    Assertions.assertEquals("STORING: Motor =", fault.getDeclarationText());
    Assertions.assertEquals(1, fault.getConditionCount());
    Assertions.assertNull(fault.getGroup());
  }

  @Test
  void testMetadata() {
    Program parsed = parser.parse("STAP 1: Vullen\n  - Klep open",
                                  Map.of(StepProgramParser.META_PROGRAM_NAME, " Meng ", StepProgramParser.META_FUNCTION_BLOCK, "fb7",
                                         StepProgramParser.META_SYMBOLIC_INSTANCE, "IDB_7"));
    Assertions.assertEquals("Meng", parsed.getName());
    Assertions.assertEquals(new BlockTag("FB", 7), parsed.getFunctionBlockTag().get());
    Assertions.assertEquals("IDB_7", parsed.getSymbolicInstanceName());
  }

  @Test
  void testMissingStepNumber() {
    Program parsed = parser.parse("STAP: Vullen\n  - Klep open", null);
    Assertions.assertEquals(List.of(DiagnosticType.MISSING_STEP_NUMBER), types(parsed.getWarnings()));
    Assertions.assertEquals(1, parsed.getSteps().get(0).getNumber());
  }

  @Test
  void testDanglingTransition() {
    Program parsed = parser.parse("STAP 1: Vullen\n  - Klep open\nVON STAP 1", null);
    Assertions.assertEquals(List.of(DiagnosticType.INVALID_TRANSITION), types(parsed.getErrors()));
    Assertions.assertEquals(3, parsed.getErrors().get(0).lineNumber());
  }

  @Test
  void testUnrecognizedLines() {
    Program parsed = parser.parse("  - los\nSTAP 1: Vullen\nZomaar tekst", null);
    Assertions.assertEquals(List.of(DiagnosticType.UNRECOGNIZED_LINE, DiagnosticType.UNRECOGNIZED_LINE), types(parsed.getWarnings()));
    Assertions.assertEquals("Zomaar tekst", parsed.getWarnings().get(1).sourceText());
    Assertions.assertEquals(0, parsed.getSteps().get(0).getConditionCount());
  }

  @Test
  void testEmbeddedDeclarationInCondition() {
    Program parsed = parser.parse("STAP 1: Vullen\n  - Klep open STAP 2: Mengen\n  - Roerder aan", null);
    Assertions.assertEquals(2, parsed.getSteps().size());
    Assertions.assertEquals("Klep open", parsed.getSteps().get(0).getEntryConditions().get(0).getConditions().get(0).text());
    Assertions.assertEquals("Roerder aan", parsed.getSteps().get(1).getEntryConditions().get(0).getConditions().get(0).text());
  }

  @Test
  void testImplicitConditions() {
    Step step = parser.parse("STAP 1: Vullen\nNIET Pomp aan", null).getSteps().get(0);
    Assertions.assertEquals(1, step.getConditionCount());
    Assertions.assertTrue(step.getEntryConditions().get(0).getConditions().get(0).negated());

    SyntaxRules syntax = SyntaxRules.defaults();
    syntax.implicitConditionSignals = 0;
    StepProgramParser strictParser = new StepProgramParser(new StepKeywordScanner(syntax, new PatternCache(64)));
    Program parsed = strictParser.parse("STAP 1: Vullen\nNIET Pomp aan", null);
    Assertions.assertEquals(0, parsed.getSteps().get(0).getConditionCount());
    Assertions.assertEquals(List.of(DiagnosticType.UNRECOGNIZED_LINE), types(parsed.getWarnings()));
  }

  @ParameterizedTest
  @ValueSource(strings = {"Pomp aan", "NIET Pomp aan", "Druk > 3", "TIJD 5 s", "Wacht (Filler STAP 2)", "Melding *HMI*"})
  void testMarkedLineIsAlwaysCondition(String line) {
    for (String marked : List.of("- " + line, "+ " + line, "  " + line)) {
      Program parsed = parser.parse("STAP 1: Vullen\n" + marked, null);
      Assertions.assertEquals(1, parsed.getSteps().get(0).getConditionCount(), marked);
      Assertions.assertEquals(List.of(), parsed.getWarnings(), marked);
    }
  }

  @Test
  void testCustomStrategyOrder() {
    List<LineStrategy> strategies = new ArrayList<>();
    strategies.add(LineStrategy.fromFunction("comment", (context, line) -> line.trimmed().startsWith("//")));
    strategies.addAll(LineStrategies.defaultOrder());
    StepProgramParser commentParser = new StepProgramParser(new StepKeywordScanner(SyntaxRules.defaults(), new PatternCache(64)), strategies);
    Assertions.assertEquals("comment", commentParser.getStrategies().get(0).getName());

    Program parsed = commentParser.parse("STAP 1: Vullen\n// Klep open\n  - Niveau laag", null);
    Assertions.assertEquals(List.of(), parsed.getWarnings());
    Assertions.assertEquals(1, parsed.getSteps().get(0).getConditionCount());
    Assertions.assertEquals("Niveau laag", parsed.getSteps().get(0).getEntryConditions().get(0).getConditions().get(0).text());
  }

  @Test
  void testEmptyText() {
    Program parsed = parser.parse("", null);
    Assertions.assertTrue(parsed.getSteps().isEmpty());
    Assertions.assertFalse(parsed.hasErrors());
  }
}
