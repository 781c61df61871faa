package stepnet.frontend;

import java.util.Optional;

/**
 * One parsed condition line. At most one of comparison, crossReference and timerSpec is set.
 * @param text the condition text without group marker and negation keyword
 * @param negated whether the line started with a negation keyword
 * @param operator OR for a line starting with the OR prefix, AND otherwise
 * @param comparison relational comparison or null
 * @param crossReference cross-program step reference or null
 * @param timerSpec timer duration or null
 * @param externalReference text between asterisks, or null
 * @param lineNumber 1-based source line
 */
public record Condition(String text, boolean negated, GroupOperator operator, Comparison comparison, CrossReference crossReference,
                        TimerSpec timerSpec, String externalReference, int lineNumber) {

  public ConditionKind kind() {
    if (crossReference != null)
      return ConditionKind.CROSS_REFERENCE;
    if (timerSpec != null)
      return ConditionKind.TIMER;
    if (comparison != null)
      return ConditionKind.COMPARISON;
    return ConditionKind.PLAIN;
  }

  public Optional<Comparison> getComparison() { return Optional.ofNullable(comparison); }
  public Optional<CrossReference> getCrossReference() { return Optional.ofNullable(crossReference); }
  public Optional<TimerSpec> getTimerSpec() { return Optional.ofNullable(timerSpec); }
  public boolean hasExternalReference() { return externalReference != null; }

  @Override
  public String toString() {
    return (operator == GroupOperator.OR ? "+ " : "- ") + (negated ? "NOT " : "") + text;
  }
}
