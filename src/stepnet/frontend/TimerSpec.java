package stepnet.frontend;

import java.util.Locale;

/** Timer duration found in a condition, e.g. {@code TIJD 5 Sek}. */
public record TimerSpec(String keyword, int value, String unit) {

  /** The duration in seconds. Unknown units are treated as seconds. */
  public long seconds() {
    String lowerUnit = unit.toLowerCase(Locale.ROOT);
    if (lowerUnit.startsWith("h"))
      return value * 3600L;
    if (lowerUnit.startsWith("m"))
      return value * 60L;
    return value;
  }
}
