package stepnet.frontend;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import stepnet.config.SyntaxRules;
import stepnet.util.PatternCache;

class ConditionExtractorTest {
  private ConditionExtractor extractor;
  private List<Diagnostic> diagnostics;

  @BeforeEach
  void setUp() {
    extractor = new ConditionExtractor(new StepKeywordScanner(SyntaxRules.defaults(), new PatternCache(64)));
    diagnostics = new ArrayList<>();
  }

  private Condition extract(String line) { return extractor.extract(line, 7, diagnostics::add); }

  @Test
  void testMarkersAndNegation() {
    Condition and = extract("- NIET Niveau hoog");
    Assertions.assertEquals(GroupOperator.AND, and.operator());
    Assertions.assertTrue(and.negated());
    Assertions.assertEquals("Niveau hoog", and.text());
    Assertions.assertEquals(ConditionKind.PLAIN, and.kind());
    Assertions.assertEquals(7, and.lineNumber());

    Condition or = extract("+ Handbediening");
    Assertions.assertEquals(GroupOperator.OR, or.operator());
    Assertions.assertFalse(or.negated());
    Assertions.assertEquals("Handbediening", or.text());
    Assertions.assertTrue(diagnostics.isEmpty());
  }

  @ParameterizedTest
  @CsvSource({"TIJD 30 sek, 30", "ZEIT 2 min, 120", "TIME 1 h, 3600", "Wacht TIJD=5s, 5"})
  void testTimer(String line, long seconds) {
    Condition condition = extract(line);
    Assertions.assertEquals(ConditionKind.TIMER, condition.kind());
    Assertions.assertEquals(seconds, condition.getTimerSpec().get().seconds());
  }

  @Test
  void testComparison() {
    Condition condition = extract("- Druk >= 5");
    Assertions.assertEquals(ConditionKind.COMPARISON, condition.kind());
    Comparison comparison = condition.getComparison().get();
    Assertions.assertEquals("Druk", comparison.variable());
    Assertions.assertEquals(">=", comparison.operator());
    Assertions.assertEquals("5", comparison.value());

    Assertions.assertEquals("AAN", extract("Status == 'AAN'").getComparison().get().value());
  }

  @Test
  void testCrossReference() {
    Condition condition = extract("- Pomp aan (Filler STAP 3+4)");
    Assertions.assertEquals(ConditionKind.CROSS_REFERENCE, condition.kind());
    CrossReference reference = condition.getCrossReference().get();
    Assertions.assertEquals("Filler", reference.programName());
    Assertions.assertEquals(List.of(3, 4), reference.stepNumbers());
    Assertions.assertEquals(7, reference.lineNumber());
    Assertions.assertTrue(diagnostics.isEmpty());
  }

  @Test
  void testCrossReferenceWithoutProgramName() {
    Condition condition = extract("Klaar (STAP 2)");
    Assertions.assertEquals("", condition.getCrossReference().get().programName());
    Assertions.assertEquals(1, diagnostics.size());
    Assertions.assertEquals(DiagnosticType.EMPTY_IDENTIFIER, diagnostics.get(0).type());
    Assertions.assertTrue(diagnostics.get(0).isError());
  }

  @Test
  void testAmbiguousKeepsFirstDetector() {
    Condition condition = extract("TIJD 5 s (Filler STAP 2)");
    Assertions.assertEquals(ConditionKind.CROSS_REFERENCE, condition.kind());
    Assertions.assertNull(condition.timerSpec());
    Assertions.assertEquals(1, diagnostics.size());
    Assertions.assertEquals(DiagnosticType.AMBIGUOUS_CONDITION, diagnostics.get(0).type());
    Assertions.assertFalse(diagnostics.get(0).isError());
  }

  @Test
  void testExternalReference() {
    Condition condition = extract("- Melding *HMI knop* actief");
    Assertions.assertTrue(condition.hasExternalReference());
    Assertions.assertEquals("HMI knop", condition.externalReference());
    Assertions.assertFalse(extract("- Pomp aan").hasExternalReference());
  }

  @ParameterizedTest
  @CsvSource({"NIET Pomp aan, 1", "Pomp aan, 0", "NIET TIJD 5 s, 2", "Druk > 3, 1", "Vrij (Filler STAP 1), 1"})
  void testConditionSignals(String line, int signals) {
    Assertions.assertEquals(signals, extractor.countConditionSignals(line));
  }

  @ParameterizedTest
  @CsvSource({"STORING motor, Fault", "Wachttijd, Timer", "Hulp vullen, Marker", "Snelheid, General"})
  void testVariableKind(String name, VariableKind kind) {
    Assertions.assertEquals(kind, extractor.detectVariableKind(name));
  }

  @Test
  void testAssociatedNames() {
    Step step = new Step(new StepKind.Sequential(1), "STAP", "Vullen", 1);
    extractor.associateNames(step, extract("- TIJD 10 sek"));
    extractor.associateNames(step, extract("- NIET Hulp vullen"));
    extractor.associateNames(step, extract("- STORING pomp"));
    extractor.associateNames(step, extract("- TIJD 10 sek"));
    Assertions.assertEquals(List.of("TIJD"), new ArrayList<>(step.getTimerNames()));
    Assertions.assertEquals(List.of("Hulp"), new ArrayList<>(step.getMarkerNames()));
    Assertions.assertEquals(List.of("STORING"), new ArrayList<>(step.getFaultNames()));
  }
}
