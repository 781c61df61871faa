package stepnet.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** Root of the parsed program model. */
public class Program {
  private String name = "";
  private BlockTag functionBlockTag = null;
  private String symbolicInstanceName = "";

  private final List<Step> steps = new ArrayList<>();
  private final List<Variable> variables = new ArrayList<>();
  private final List<CrossReference> crossReferences = new ArrayList<>();
  private final List<Diagnostic> errors = new ArrayList<>();
  private final List<Diagnostic> warnings = new ArrayList<>();
  private ProgramStatistics statistics = null;

  public String getName() { return name; }
  public void setName(String name) { this.name = name; }
  public Optional<BlockTag> getFunctionBlockTag() { return Optional.ofNullable(functionBlockTag); }
  public void setFunctionBlockTag(BlockTag functionBlockTag) { this.functionBlockTag = functionBlockTag; }
  public String getSymbolicInstanceName() { return symbolicInstanceName; }
  public void setSymbolicInstanceName(String symbolicInstanceName) { this.symbolicInstanceName = symbolicInstanceName; }

  public List<Step> getSteps() { return Collections.unmodifiableList(steps); }
  public void addStep(Step step) { steps.add(step); }

  public Optional<Step> getRestStep() { return steps.stream().filter(Step::isRest).findFirst(); }
  /** Sequential steps in declaration order. */
  public List<Step> getSequentialSteps() { return steps.stream().filter(step -> !step.isRest()).toList(); }
  public Optional<Step> findSequentialStep(int number) {
    return steps.stream().filter(step -> !step.isRest() && step.getNumber() == number).findFirst();
  }

  public List<Variable> getVariables() { return Collections.unmodifiableList(variables); }
  public List<Variable> getVariables(VariableKind kind) { return variables.stream().filter(v -> v.getKind() == kind).toList(); }
  public void addVariable(Variable variable) { variables.add(variable); }

  public List<CrossReference> getCrossReferences() { return Collections.unmodifiableList(crossReferences); }
  public void addCrossReference(CrossReference crossReference) { crossReferences.add(crossReference); }

  public List<Diagnostic> getErrors() { return Collections.unmodifiableList(errors); }
  public List<Diagnostic> getWarnings() { return Collections.unmodifiableList(warnings); }
  public boolean hasErrors() { return !errors.isEmpty(); }
  public void addDiagnostic(Diagnostic diagnostic) {
    if (diagnostic.isError())
      errors.add(diagnostic);
    else
      warnings.add(diagnostic);
  }

  public ProgramStatistics getStatistics() {
    if (statistics == null)
      statistics = ProgramStatistics.of(this);
    return statistics;
  }
  /** Recomputes the derived statistics, to be called once all diagnostics are in. */
  public ProgramStatistics updateStatistics() {
    statistics = ProgramStatistics.of(this);
    return statistics;
  }

  @Override
  public String toString() {
    return String.format("%s %s (%d steps, %d variables, %d errors, %d warnings)", name,
                         getFunctionBlockTag().map(BlockTag::toString).orElse("-"), steps.size(), variables.size(), errors.size(),
                         warnings.size());
  }
}
