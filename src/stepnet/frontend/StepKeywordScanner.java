package stepnet.frontend;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import stepnet.config.SyntaxRules;
import stepnet.util.PatternCache;

/**
 * Keyword-driven line patterns shared by the normalizer and the parser, built from the configured keyword sets.
 */
public class StepKeywordScanner {
  public static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

  /**
   * A REST or step declaration.
   * @param keyword the keyword, upper case
   * @param rest whether the keyword is a REST keyword
   * @param number the step number, null if not written
   * @param description the trimmed description
   */
  public record Declaration(String keyword, boolean rest, Integer number, String description) {}

  /**
   * A {@code VON STEP n} line.
   * @param orPrefixed whether the line starts with the OR prefix
   * @param keyword the step keyword, upper case
   * @param fromStep the referenced step number
   */
  public record TransitionRef(boolean orPrefixed, String keyword, int fromStep) {}

  private final SyntaxRules syntax;
  private final PatternCache patterns;

  private final String restAlt;
  private final String stepAlt;
  private final String endAlt;

  public StepKeywordScanner(SyntaxRules syntax, PatternCache patterns) {
    this.syntax = syntax;
    this.patterns = patterns;
    this.restAlt = SyntaxRules.alternation(syntax.restKeywords);
    this.stepAlt = SyntaxRules.alternation(syntax.stepKeywords);
    this.endAlt = SyntaxRules.alternation(syntax.endKeywords);
  }

  public SyntaxRules getSyntax() { return syntax; }

  public Pattern pattern(String regex) { return patterns.get(regex, FLAGS); }

  /**
   * Matches a declaration at the start of a trimmed line: {@code KEYWORD[ n]: description}.
   * @param line the trimmed line
   * @return the declaration, or empty
   */
  public Optional<Declaration> matchDeclaration(String line) {
    Matcher matcher = pattern("^(" + restAlt + "|" + stepAlt + ")(?:\\s*(\\d+))?\\s*:\\s*(.*)$").matcher(line);
    if (!matcher.matches())
      return Optional.empty();
    String keyword = matcher.group(1);
    Integer number = null;
    if (matcher.group(2) != null) {
      try {
        number = Integer.valueOf(matcher.group(2));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    return Optional.of(new Declaration(keyword.toUpperCase(), syntax.isRestKeyword(keyword), number, matcher.group(3).trim()));
  }

  /**
   * Matches an end declaration, {@code KLAAR:} optionally followed by text.
   * @param line the trimmed line
   * @return the end keyword, upper case, or empty
   */
  public Optional<String> matchEnd(String line) {
    if (syntax.endKeywords.isEmpty())
      return Optional.empty();
    Matcher matcher = pattern("^(" + endAlt + ")\\s*:\\s*(.*)$").matcher(line);
    return matcher.matches() ? Optional.of(matcher.group(1).toUpperCase()) : Optional.empty();
  }

  /**
   * Matches {@code [+ ]VON STEP n}.
   * @param line the trimmed line
   * @return the transition reference, or empty
   */
  public Optional<TransitionRef> matchTransition(String line) {
    Matcher matcher = pattern("^(" + Pattern.quote(syntax.orPrefix) + ")?\\s*" + Pattern.quote(syntax.transitionKeyword) + "\\s+(" + stepAlt +
                              ")\\s+(\\d+)\\s*$")
                          .matcher(line);
    if (!matcher.matches())
      return Optional.empty();
    try {
      return Optional.of(new TransitionRef(matcher.group(1) != null, matcher.group(2).toUpperCase(), Integer.parseInt(matcher.group(3))));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  /**
   * Finds a REST or step declaration embedded after other text on the same line.
   * Occurrences inside an open parenthesis, after the OR prefix or a transition keyword, after a parenthesized program reference,
   * or after nothing but a group marker are not declarations.
   * @param line the trimmed line
   * @return the index where the embedded declaration starts, or -1
   */
  public int findEmbeddedDeclaration(String line) {
    Matcher matcher = pattern("(?<![\\p{L}\\p{N}_])(" + restAlt + "|" + stepAlt + ")(?:\\s*\\d+)?\\s*:").matcher(line);
    while (matcher.find()) {
      int start = matcher.start();
      if (start == 0)
        continue;
      String prefix = line.substring(0, start);
      if (isReferenceContext(prefix))
        continue;
      return start;
    }
    return -1;
  }

  private boolean isReferenceContext(String prefix) {
    String trimmed = prefix.trim();
    if (trimmed.isEmpty())
      return true;
    if (trimmed.equals(syntax.andPrefix) || trimmed.endsWith(syntax.orPrefix))
      return true;
    int depth = 0;
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (c == '(')
        ++depth;
      else if (c == ')' && depth > 0)
        --depth;
    }
    if (depth > 0)
      return true;
    if (pattern("(?<![\\p{L}\\p{N}_])" + Pattern.quote(syntax.transitionKeyword) + "$").matcher(trimmed).find())
      return true;
    return pattern("\\([^)]*:[^)]*\\)").matcher(trimmed).find();
  }
}
