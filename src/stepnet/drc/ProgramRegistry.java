package stepnet.drc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import stepnet.frontend.CrossReference;
import stepnet.frontend.Program;
import stepnet.frontend.Step;

/**
 * Read-only snapshot of previously parsed programs (name to step numbers, REST as 0) used to resolve cross-references.
 * Registering a program returns a new snapshot; a snapshot never changes while a parse uses it.
 */
public final class ProgramRegistry {
  private static final ProgramRegistry EMPTY = new ProgramRegistry(Map.of());

  private final Map<String, Set<Integer>> programs;

  private ProgramRegistry(Map<String, Set<Integer>> programs) { this.programs = programs; }

  public static ProgramRegistry empty() { return EMPTY; }

  public static ProgramRegistry of(Map<String, ? extends Set<Integer>> programs) {
    LinkedHashMap<String, Set<Integer>> copy = new LinkedHashMap<>();
    programs.forEach((name, steps) -> copy.put(name, Collections.unmodifiableSet(new TreeSet<>(steps))));
    return new ProgramRegistry(Collections.unmodifiableMap(copy));
  }

  /**
   * @param program a parsed program with a non-empty name
   * @return a new snapshot containing this registry's programs plus the given one, replacing an entry of the same name
   */
  public ProgramRegistry with(Program program) {
    if (program.getName().isEmpty())
      throw new IllegalArgumentException("cannot register a program without a name");
    LinkedHashMap<String, Set<Integer>> copy = new LinkedHashMap<>(programs);
    copy.put(program.getName(), stepNumbers(program));
    return new ProgramRegistry(Collections.unmodifiableMap(copy));
  }

  static Set<Integer> stepNumbers(Program program) {
    TreeSet<Integer> numbers = new TreeSet<>();
    for (Step step : program.getSteps())
      numbers.add(step.getNumber());
    return Collections.unmodifiableSet(numbers);
  }

  public boolean contains(String programName) { return programs.containsKey(programName); }
  public Optional<Set<Integer>> getStepNumbers(String programName) { return Optional.ofNullable(programs.get(programName)); }
  public Set<String> getProgramNames() { return programs.keySet(); }
  public int size() { return programs.size(); }

  /** True if the referenced program is registered and has every referenced step. */
  public boolean resolves(CrossReference reference) {
    Set<Integer> steps = programs.get(reference.programName());
    return steps != null && steps.containsAll(reference.stepNumbers());
  }

  @Override
  public String toString() {
    return "ProgramRegistry" + programs;
  }
}
