package stepnet.frontend;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** Derived counts over a program, including a complexity score and diagnostic distributions. */
public class ProgramStatistics {
  public final int totalSteps;
  public final int restSteps;
  public final int sequentialSteps;
  public final int totalConditions;
  public final int totalVariables;
  public final Map<VariableKind, Integer> variablesPerKind;
  public final Map<String, Integer> variablesPerGroup;
  public final int crossReferences;
  public final int nonSequentialTransitions;
  public final int externalReferences;
  public final long complexityScore;
  public final Map<DiagnosticType, Integer> errorCounts;
  public final Map<DiagnosticType, Integer> warningCounts;

  private ProgramStatistics(Program program) {
    totalSteps = program.getSteps().size();
    restSteps = (int)program.getSteps().stream().filter(Step::isRest).count();
    sequentialSteps = totalSteps - restSteps;

    int conditions = 0;
    int external = 0;
    int transitions = 0;
    for (Step step : program.getSteps()) {
      conditions += step.getConditionCount();
      external += (int)step.allConditions().filter(Condition::hasExternalReference).count();
      transitions += step.getTransitions().size();
    }
    for (Variable variable : program.getVariables()) {
      conditions += variable.getConditionCount();
      external += (int)variable.getConditions()
                      .stream()
                      .flatMap(group -> group.getConditions().stream())
                      .filter(Condition::hasExternalReference)
                      .count();
    }
    totalConditions = conditions;
    externalReferences = external;
    nonSequentialTransitions = transitions;

    totalVariables = program.getVariables().size();
    EnumMap<VariableKind, Integer> perKind = new EnumMap<>(VariableKind.class);
    for (VariableKind kind : VariableKind.values())
      perKind.put(kind, 0);
    LinkedHashMap<String, Integer> perGroup = new LinkedHashMap<>();
    for (Variable variable : program.getVariables()) {
      perKind.merge(variable.getKind(), 1, Integer::sum);
      if (variable.getGroup() != null)
        perGroup.merge(variable.getGroup(), 1, Integer::sum);
    }
    variablesPerKind = Collections.unmodifiableMap(perKind);
    variablesPerGroup = Collections.unmodifiableMap(perGroup);
    crossReferences = program.getCrossReferences().size();

    complexityScore = Math.round(2.0 * totalSteps + 1.5 * totalConditions + 1.2 * totalVariables + 3.0 * externalReferences);

    errorCounts = Collections.unmodifiableMap(countByType(program, true));
    warningCounts = Collections.unmodifiableMap(countByType(program, false));
  }

  private static Map<DiagnosticType, Integer> countByType(Program program, boolean errors) {
    EnumMap<DiagnosticType, Integer> ret = new EnumMap<>(DiagnosticType.class);
    (errors ? program.getErrors() : program.getWarnings()).forEach(diagnostic -> ret.merge(diagnostic.type(), 1, Integer::sum));
    return ret;
  }

  public static ProgramStatistics of(Program program) { return new ProgramStatistics(program); }

  public int getErrorCount() { return errorCounts.values().stream().mapToInt(Integer::intValue).sum(); }
  public int getWarningCount() { return warningCounts.values().stream().mapToInt(Integer::intValue).sum(); }

  @Override
  public String toString() {
    return String.format("steps=%d (rest=%d, sequential=%d), conditions=%d, variables=%d, crossReferences=%d, transitions=%d, "
                             + "externalReferences=%d, complexity=%d, errors=%d, warnings=%d",
                         totalSteps, restSteps, sequentialSteps, totalConditions, totalVariables, crossReferences,
                         nonSequentialTransitions, externalReferences, complexityScore, getErrorCount(), getWarningCount());
  }
}
