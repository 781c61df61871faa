package stepnet.drc;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import stepnet.frontend.CrossReference;
import stepnet.frontend.Program;
import stepnet.frontend.Step;
import stepnet.frontend.StepKind;

class ProgramRegistryTest {

  private static Program program(String name, int... stepNumbers) {
    Program program = new Program();
    program.setName(name);
    program.addStep(new Step(StepKind.REST, "RUST", "Wachten", 1));
    for (int number : stepNumbers)
      program.addStep(new Step(new StepKind.Sequential(number), "STAP", "Stap " + number, number + 1));
    return program;
  }

  @Test
  void testSnapshotsAreIndependent() {
    ProgramRegistry empty = ProgramRegistry.empty();
    ProgramRegistry first = empty.with(program("Filler", 1, 2));
    ProgramRegistry second = first.with(program("Menger", 1));

    Assertions.assertEquals(0, empty.size());
    Assertions.assertEquals(1, first.size());
    Assertions.assertEquals(2, second.size());
    Assertions.assertEquals(2, second.getProgramNames().size());
    Assertions.assertFalse(first.contains("Menger"));
    Assertions.assertEquals(Set.of(0, 1, 2), second.getStepNumbers("Filler").get());
  }

  @Test
  void testReplaceProgramOfSameName() {
    ProgramRegistry registry = ProgramRegistry.empty().with(program("Filler", 1)).with(program("Filler", 1, 2, 3));
    Assertions.assertEquals(1, registry.size());
    Assertions.assertEquals(Set.of(0, 1, 2, 3), registry.getStepNumbers("Filler").get());
  }

  @Test
  void testResolves() {
    ProgramRegistry registry = ProgramRegistry.of(Map.of("Filler", Set.of(0, 3, 4)));
    Assertions.assertTrue(registry.resolves(new CrossReference("Filler", List.of(3, 4), 1)));
    Assertions.assertFalse(registry.resolves(new CrossReference("Filler", List.of(3, 5), 1)));
    Assertions.assertFalse(registry.resolves(new CrossReference("Menger", List.of(1), 1)));
  }

  @Test
  void testUnnamedProgramIsRejected() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> ProgramRegistry.empty().with(program("", 1)));
  }

  @Test
  void testRegistryIsReadOnly() {
    ProgramRegistry registry = ProgramRegistry.of(Map.of("Filler", Set.of(1)));
    Assertions.assertThrows(UnsupportedOperationException.class, () -> registry.getStepNumbers("Filler").get().add(2));
  }
}
