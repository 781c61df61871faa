package stepnet.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Ordered conditions combined with AND, tagged with the operator that joins the group to its predecessors. */
public class ConditionGroup {
  private final GroupOperator operator;
  private final List<Condition> conditions = new ArrayList<>();

  public ConditionGroup(GroupOperator operator) { this.operator = operator; }

  public GroupOperator getOperator() { return operator; }
  public List<Condition> getConditions() { return Collections.unmodifiableList(conditions); }

  /**
   * Appends a condition to a group list.
   * An OR condition opens a new OR group if there is a prior group; with no groups yet, any condition opens a new AND group;
   * otherwise the condition joins the last group.
   * @param groups the group list to extend
   * @param condition the condition
   */
  public static void append(List<ConditionGroup> groups, Condition condition) {
    ConditionGroup target;
    if (condition.operator() == GroupOperator.OR && !groups.isEmpty()) {
      target = new ConditionGroup(GroupOperator.OR);
      groups.add(target);
    } else if (groups.isEmpty()) {
      target = new ConditionGroup(GroupOperator.AND);
      groups.add(target);
    } else {
      target = groups.get(groups.size() - 1);
    }
    target.conditions.add(condition);
  }

  public static int count(List<ConditionGroup> groups) {
    return groups.stream().mapToInt(group -> group.conditions.size()).sum();
  }

  @Override
  public String toString() {
    return operator + conditions.toString();
  }
}
