package stepnet.frontend;

import java.util.Optional;
import java.util.stream.Stream;

/** What a condition tests, derived from which detector matched its text. */
public enum ConditionKind {
  PLAIN("plain"),
  CROSS_REFERENCE("crossReference"),
  TIMER("timer"),
  COMPARISON("comparison");

  public final String serialName;

  private ConditionKind(String serialName) { this.serialName = serialName; }

  public static Optional<ConditionKind> fromSerialName(String serialName) {
    return Stream.of(ConditionKind.values())
        .filter(kind -> kind.serialName.equalsIgnoreCase(serialName) || kind.name().equalsIgnoreCase(serialName))
        .findAny();
  }
}
