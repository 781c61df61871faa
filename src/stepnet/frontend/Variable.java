package stepnet.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A standalone {@code name =[ value]} declaration and the conditions that drive it. */
public class Variable {
  private final String name;
  private final String value;
  private final VariableKind kind;
  private final int lineNumber;
  private final List<ConditionGroup> conditions = new ArrayList<>();
  /** Set by the validator's group classification, null before. */
  private String group = null;

  public Variable(String name, String value, VariableKind kind, int lineNumber) {
    this.name = name;
    this.value = value;
    this.kind = kind;
    this.lineNumber = lineNumber;
  }

  public String getName() { return name; }
  public String getValue() { return value; }
  public VariableKind getKind() { return kind; }
  public int getLineNumber() { return lineNumber; }
  public List<ConditionGroup> getConditions() { return Collections.unmodifiableList(conditions); }
  public int getConditionCount() { return ConditionGroup.count(conditions); }
  public void addCondition(Condition condition) { ConditionGroup.append(conditions, condition); }

  public String getGroup() { return group; }
  public void setGroup(String group) { this.group = group; }

  /** The declaration in canonical form, {@code name = value} or {@code name =}. */
  public String getDeclarationText() { return value.isEmpty() ? name + " =" : name + " = " + value; }

  @Override
  public String toString() {
    return getDeclarationText() + (group == null ? "" : " [" + group + "]");
  }
}
