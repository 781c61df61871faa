package stepnet.frontend;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import stepnet.config.SyntaxRules;

/**
 * Turns the text of a condition line into a {@link Condition}: group marker, negation, cross-reference, timer, comparison and
 * external reference detection.
 */
public class ConditionExtractor {
  private static final List<String> connectiveWords = List.of("EN", "AND", "UND", "OF", "OR", "ODER");

  private final StepKeywordScanner scanner;
  private final SyntaxRules syntax;

  private final String negationRegex;
  private final String crossReferenceRegex;
  private final String timerRegex;
  private final String timerSignalRegex;
  private static final String comparisonRegex = "^([A-Za-z0-9_.\\[\\]]+)\\s*(==|!=|<>|>=|<=|>|<)\\s*(.+)$";
  private static final String externalRegex = "\\*([^*]+)\\*";

  public ConditionExtractor(StepKeywordScanner scanner) {
    this.scanner = scanner;
    this.syntax = scanner.getSyntax();
    String boundary = "(?<![\\p{L}\\p{N}_])";
    negationRegex = "^(" + SyntaxRules.alternation(syntax.negationKeywords) + ")\\s+";
    crossReferenceRegex = "^(.*?)\\s*\\(\\s*([^()]*?)\\s*" + boundary + "(" + SyntaxRules.alternation(syntax.stepKeywords) +
                          ")\\s+(\\d+(?:\\s*\\+\\s*\\d+)*)\\s*\\)\\s*$";
    timerRegex = boundary + "(" + SyntaxRules.alternation(syntax.timerKeywords) + ")\\s*[~=]?\\s*(\\d+)\\s*(" +
                 SyntaxRules.alternation(syntax.timerUnits) + ")(?!\\p{L})";
    timerSignalRegex = boundary + "(" + SyntaxRules.alternation(syntax.timerKeywords) + ")\\s+\\d+";
  }

  /**
   * Extracts a condition from a trimmed line.
   * @param line the trimmed line, possibly starting with a group marker
   * @param lineNumber 1-based line number
   * @param diagnostics receives AMBIGUOUS_CONDITION and EMPTY_IDENTIFIER diagnostics
   * @return the condition
   */
  public Condition extract(String line, int lineNumber, Consumer<Diagnostic> diagnostics) {
    String text = line.strip();
    GroupOperator operator = GroupOperator.AND;
    if (!syntax.orPrefix.isEmpty() && text.startsWith(syntax.orPrefix)) {
      operator = GroupOperator.OR;
      text = text.substring(syntax.orPrefix.length()).strip();
    } else if (!syntax.andPrefix.isEmpty() && text.startsWith(syntax.andPrefix)) {
      text = text.substring(syntax.andPrefix.length()).strip();
    }

    boolean negated = false;
    Matcher negation = scanner.pattern(negationRegex).matcher(text);
    if (negation.find()) {
      negated = true;
      text = text.substring(negation.end()).strip();
    }

    List<ConditionKind> detected = new ArrayList<>();
    CrossReference crossReference = null;
    TimerSpec timerSpec = null;
    Comparison comparison = null;

    Matcher crossMatcher = scanner.pattern(crossReferenceRegex).matcher(text);
    if (crossMatcher.matches()) {
      detected.add(ConditionKind.CROSS_REFERENCE);
      String programName = crossMatcher.group(2).strip();
      if (programName.isEmpty())
        diagnostics.accept(Diagnostic.of(DiagnosticType.EMPTY_IDENTIFIER, "cross-reference without program name", lineNumber, line));
      crossReference = new CrossReference(programName, parseStepNumbers(crossMatcher.group(4)), lineNumber);
    }

    Matcher timerMatcher = scanner.pattern(timerRegex).matcher(text);
    if (timerMatcher.find()) {
      detected.add(ConditionKind.TIMER);
      try {
        timerSpec = new TimerSpec(timerMatcher.group(1).toUpperCase(Locale.ROOT), Integer.parseInt(timerMatcher.group(2)),
                                  timerMatcher.group(3));
      } catch (NumberFormatException e) {
        timerSpec = new TimerSpec(timerMatcher.group(1).toUpperCase(Locale.ROOT), Integer.MAX_VALUE, timerMatcher.group(3));
      }
    }

    Matcher comparisonMatcher = scanner.pattern(comparisonRegex).matcher(text);
    if (comparisonMatcher.matches()) {
      detected.add(ConditionKind.COMPARISON);
      comparison = new Comparison(comparisonMatcher.group(1), comparisonMatcher.group(2),
                                  comparisonMatcher.group(3).strip().replaceAll("[\"']", ""));
    }

    if (detected.size() > 1) {
      diagnostics.accept(Diagnostic.of(DiagnosticType.AMBIGUOUS_CONDITION,
                                       "condition matches several detectors " + detected + ", using " + detected.get(0), lineNumber, line));
      // keep only the first detector in extraction order
      if (detected.get(0) == ConditionKind.CROSS_REFERENCE) {
        timerSpec = null;
        comparison = null;
      } else {
        comparison = null;
      }
    }

    String externalReference = null;
    Matcher externalMatcher = scanner.pattern(externalRegex).matcher(text);
    if (externalMatcher.find())
      externalReference = externalMatcher.group(1).strip();

    return new Condition(text, negated, operator, comparison, crossReference, timerSpec, externalReference, lineNumber);
  }

  private static List<Integer> parseStepNumbers(String numbers) {
    LinkedHashSet<Integer> ret = new LinkedHashSet<>();
    for (String number : numbers.split("\\+")) {
      String trimmed = number.strip();
      if (trimmed.isEmpty())
        continue;
      try {
        ret.add(Integer.valueOf(trimmed));
      } catch (NumberFormatException e) {
        // digits only, so the value is out of int range
        ret.add(Integer.MAX_VALUE);
      }
    }
    return new ArrayList<>(ret);
  }

  /**
   * Counts the signals that make an unmarked, unindented line look like a condition:
   * a leading negation keyword, a timer duration, a relational comparison and a parenthesized cross-reference.
   * @param line the trimmed line
   * @return the number of signals present, 0 to 4
   */
  public int countConditionSignals(String line) {
    String text = line.strip();
    int signals = 0;
    Matcher negation = scanner.pattern(negationRegex).matcher(text);
    if (negation.find()) {
      ++signals;
      text = text.substring(negation.end()).strip();
    }
    if (scanner.pattern(timerSignalRegex).matcher(text).find())
      ++signals;
    if (scanner.pattern(comparisonRegex).matcher(text).matches())
      ++signals;
    if (scanner.pattern(crossReferenceRegex).matcher(text).matches())
      ++signals;
    return signals;
  }

  /**
   * Classifies a standalone variable by its name: fault keywords as prefix, timer or marker keywords anywhere in the name.
   * @param name the variable name
   * @return the kind
   */
  public VariableKind detectVariableKind(String name) {
    String lowerName = name.toLowerCase(Locale.ROOT);
    if (syntax.faultKeywords.stream().anyMatch(keyword -> lowerName.startsWith(keyword.toLowerCase(Locale.ROOT))))
      return VariableKind.Fault;
    if (syntax.timerKeywords.stream().anyMatch(keyword -> lowerName.contains(keyword.toLowerCase(Locale.ROOT))))
      return VariableKind.Timer;
    if (syntax.markerKeywords.stream().anyMatch(keyword -> lowerName.contains(keyword.toLowerCase(Locale.ROOT))))
      return VariableKind.Marker;
    return VariableKind.General;
  }

  /**
   * Records the timer, marker and fault names referenced by a condition on its step.
   * @param step the step the condition belongs to
   * @param condition the condition
   */
  public void associateNames(Step step, Condition condition) {
    String lowerText = condition.text().toLowerCase(Locale.ROOT);
    if (condition.timerSpec() != null || containsAny(lowerText, syntax.timerKeywords))
      step.addTimerName(extractName(condition.text(), "timer"));
    if (containsAny(lowerText, syntax.markerKeywords))
      step.addMarkerName(extractName(condition.text(), "marker"));
    if (containsAny(lowerText, syntax.faultKeywords))
      step.addFaultName(extractName(condition.text(), "storing"));
  }

  private static boolean containsAny(String lowerText, List<String> keywords) {
    return keywords.stream().anyMatch(keyword -> lowerText.contains(keyword.toLowerCase(Locale.ROOT)));
  }

  private String extractName(String text, String fallbackPrefix) {
    for (String word : text.split("\\s+")) {
      if (word.length() <= 2 || !Character.isLetter(word.charAt(0)))
        continue;
      String upper = word.toUpperCase(Locale.ROOT);
      if (connectiveWords.contains(upper) || syntax.negationKeywords.stream().anyMatch(keyword -> keyword.equalsIgnoreCase(upper)))
        continue;
      return word;
    }
    return fallbackPrefix + "_variabele";
  }
}
