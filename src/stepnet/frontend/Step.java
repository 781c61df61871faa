package stepnet.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A REST or sequential step with its conditions.
 * Entry conditions are the block directly under the declaration, exit conditions the block after it that leads to the following step.
 */
public class Step {
  private final StepKind kind;
  private final String keyword;
  private final String description;
  private final int lineNumber;

  private final List<ConditionGroup> entryConditions = new ArrayList<>();
  private final List<ConditionGroup> exitConditions = new ArrayList<>();
  private final List<Transition> transitions = new ArrayList<>();
  private final List<Assignment> assignments = new ArrayList<>();

  private final LinkedHashSet<String> timerNames = new LinkedHashSet<>();
  private final LinkedHashSet<String> markerNames = new LinkedHashSet<>();
  private final LinkedHashSet<String> faultNames = new LinkedHashSet<>();

  /**
   * @param kind REST or sequential with number
   * @param keyword the declaration keyword as written, upper case
   * @param description the text after the colon, trimmed
   * @param lineNumber 1-based declaration line
   */
  public Step(StepKind kind, String keyword, String description, int lineNumber) {
    this.kind = kind;
    this.keyword = keyword;
    this.description = description;
    this.lineNumber = lineNumber;
  }

  public StepKind getKind() { return kind; }
  public boolean isRest() { return kind.isRest(); }
  public int getNumber() { return kind.number(); }
  public String getKeyword() { return keyword; }
  public String getDescription() { return description; }
  public int getLineNumber() { return lineNumber; }

  public List<ConditionGroup> getEntryConditions() { return Collections.unmodifiableList(entryConditions); }
  public List<ConditionGroup> getExitConditions() { return Collections.unmodifiableList(exitConditions); }
  public List<Transition> getTransitions() { return Collections.unmodifiableList(transitions); }
  public List<Assignment> getAssignments() { return Collections.unmodifiableList(assignments); }
  public Set<String> getTimerNames() { return Collections.unmodifiableSet(timerNames); }
  public Set<String> getMarkerNames() { return Collections.unmodifiableSet(markerNames); }
  public Set<String> getFaultNames() { return Collections.unmodifiableSet(faultNames); }

  public void addEntryCondition(Condition condition) { ConditionGroup.append(entryConditions, condition); }
  public void addExitCondition(Condition condition) { ConditionGroup.append(exitConditions, condition); }
  public void addTransition(Transition transition) { transitions.add(transition); }
  public void addAssignment(Assignment assignment) { assignments.add(assignment); }
  public void addTimerName(String name) { timerNames.add(name); }
  public void addMarkerName(String name) { markerNames.add(name); }
  public void addFaultName(String name) { faultNames.add(name); }

  /** Entry, exit and transition conditions, in that order. */
  public Stream<Condition> allConditions() {
    return Stream.of(entryConditions.stream(), exitConditions.stream(), transitions.stream().flatMap(t -> t.getConditions().stream()))
        .flatMap(groups -> groups)
        .flatMap(group -> group.getConditions().stream());
  }

  public int getConditionCount() { return (int)allConditions().count(); }

  /**
   * Label with a configurable keyword, e.g. {@code STAP 3: Vullen} or {@code RUST: Wachten}.
   * @param restLabel keyword used for the REST step
   * @param stepLabel keyword used for sequential steps
   * @return the label
   */
  public String label(String restLabel, String stepLabel) {
    return (isRest() ? restLabel : stepLabel + " " + getNumber()) + ": " + description;
  }

  @Override
  public String toString() {
    return (isRest() ? keyword : keyword + " " + getNumber()) + ": " + description;
  }
}
