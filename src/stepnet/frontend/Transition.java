package stepnet.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Explicit non-sequential predecessor of a step, declared with {@code VON STEP n}. */
public class Transition {
  private final int fromStep;
  private final int lineNumber;
  private final List<ConditionGroup> conditions = new ArrayList<>();

  public Transition(int fromStep, int lineNumber) {
    this.fromStep = fromStep;
    this.lineNumber = lineNumber;
  }

  public int getFromStep() { return fromStep; }
  public int getLineNumber() { return lineNumber; }
  public List<ConditionGroup> getConditions() { return Collections.unmodifiableList(conditions); }
  public void addCondition(Condition condition) { ConditionGroup.append(conditions, condition); }

  @Override
  public String toString() {
    return "VON " + fromStep + (conditions.isEmpty() ? "" : " " + conditions);
  }
}
