package stepnet.config;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword and syntax configuration of the step program notation.
 * All keyword lists are matched case-insensitively. Lists are locale synonyms (Dutch, German, English).
 */
public class SyntaxRules {

  public List<String> restKeywords = new ArrayList<>(List.of("RUST", "RUHE", "IDLE", "REST"));
  public List<String> stepKeywords = new ArrayList<>(List.of("STAP", "SCHRITT", "STEP"));
  public List<String> endKeywords = new ArrayList<>(List.of("KLAAR", "FERTIG", "END"));
  public String transitionKeyword = "VON";

  public List<String> negationKeywords = new ArrayList<>(List.of("NIET", "NICHT", "NOT"));
  public List<String> timerKeywords = new ArrayList<>(List.of("TIJD", "ZEIT", "TIME"));
  public List<String> markerKeywords = new ArrayList<>(List.of("MARKER", "FLAG", "MERKER", "HULP"));
  public List<String> faultKeywords = new ArrayList<>(List.of("STORING", "STÖRUNG", "FAULT"));
  public List<String> timerUnits = new ArrayList<>(List.of("Sek", "sek", "sec", "Min", "min", "s", "m", "h"));

  /** Prefix of a condition line that continues the current group */
  public String andPrefix = "-";
  /** Prefix of a condition line that opens a new OR group */
  public String orPrefix = "+";

  /**
   * Minimum number of heuristic signals (negation keyword, timer, comparison, cross reference) that make a line without
   * explicit markers or indentation a condition. 0 disables the heuristic.
   */
  public int implicitConditionSignals = 1;

  public static SyntaxRules defaults() { return new SyntaxRules(); }

  public SyntaxRules copy() {
    SyntaxRules ret = new SyntaxRules();
    ret.restKeywords = new ArrayList<>(restKeywords);
    ret.stepKeywords = new ArrayList<>(stepKeywords);
    ret.endKeywords = new ArrayList<>(endKeywords);
    ret.transitionKeyword = transitionKeyword;
    ret.negationKeywords = new ArrayList<>(negationKeywords);
    ret.timerKeywords = new ArrayList<>(timerKeywords);
    ret.markerKeywords = new ArrayList<>(markerKeywords);
    ret.faultKeywords = new ArrayList<>(faultKeywords);
    ret.timerUnits = new ArrayList<>(timerUnits);
    ret.andPrefix = andPrefix;
    ret.orPrefix = orPrefix;
    ret.implicitConditionSignals = implicitConditionSignals;
    return ret;
  }

  public boolean isRestKeyword(String word) { return containsIgnoreCase(restKeywords, word); }
  public boolean isStepKeyword(String word) { return containsIgnoreCase(stepKeywords, word); }

  /** Whether a trimmed line starts with the AND or OR condition prefix. */
  public boolean startsWithGroupMarker(String text) {
    return (!andPrefix.isEmpty() && text.startsWith(andPrefix)) || (!orPrefix.isEmpty() && text.startsWith(orPrefix));
  }

  /**
   * Builds a regex alternation group body of the quoted keywords, longest first so that a keyword is never cut short by a prefix of it.
   * @param keywords the keywords
   * @return e.g. {@code \QSCHRITT\E|\QSTAP\E}, or a never matching group for an empty list
   */
  public static String alternation(List<String> keywords) {
    String ret = keywords.stream()
                     .filter(keyword -> keyword != null && !keyword.isEmpty())
                     .sorted(Comparator.comparingInt(String::length).reversed())
                     .map(Pattern::quote)
                     .collect(Collectors.joining("|"));
    return ret.isEmpty() ? "(?!)" : ret;
  }

  private static boolean containsIgnoreCase(List<String> keywords, String word) {
    if (word == null)
      return false;
    String upper = word.toUpperCase(Locale.ROOT);
    return keywords.stream().anyMatch(keyword -> keyword.toUpperCase(Locale.ROOT).equals(upper));
  }
}
