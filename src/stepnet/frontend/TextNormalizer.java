package stepnet.frontend;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import stepnet.config.SyntaxRules;

/**
 * Best-effort canonicalization of raw program text. Every declaration, transition, variable and condition ends up on its own line
 * with upper case keywords and uniform spacing. Never fails; normalizing normalized text returns it unchanged.
 */
public class TextNormalizer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final String INDENT = "  ";
  private static final Pattern loneEquals = Pattern.compile("(?<![<>!=])=(?!=)");
  private static final Pattern bulletItem = Pattern.compile("^[•·▪▫]\\s*");
  private static final Pattern numberedItem = Pattern.compile("^\\d+[.)]\\s+");

  private final StepKeywordScanner scanner;
  private final SyntaxRules syntax;

  public TextNormalizer(StepKeywordScanner scanner) {
    this.scanner = scanner;
    this.syntax = scanner.getSyntax();
  }

  public String normalize(String text, SourceKind source) {
    if (text == null || text.isEmpty())
      return "";
    String working = text.replace("\r\n", "\n").replace('\r', '\n');
    working = replaceTypography(working);
    if (source == SourceKind.DocumentImport)
      working = working.replace("\f", "").replace('\u000B', '\n');

    List<String> out = new ArrayList<>();
    for (String rawLine : working.split("\n", -1)) {
      String line = rawLine.replace("\t", INDENT);
      String trimmed = line.strip();
      if (trimmed.isEmpty()) {
        out.add("");
        continue;
      }
      boolean indented = Character.isWhitespace(line.charAt(0));
      trimmed = trimmed.replaceAll("\\s{2,}", " ");
      if (source == SourceKind.DocumentImport)
        trimmed = convertListItem(trimmed);

      // split off embedded declarations, the remainder starts with the keyword
      int embedded;
      while ((embedded = scanner.findEmbeddedDeclaration(trimmed)) > 0) {
        out.add(canonicalize(trimmed.substring(0, embedded).strip(), indented));
        logger.trace("normalizer: split embedded declaration off '{}'", trimmed);
        trimmed = trimmed.substring(embedded);
        indented = false;
      }
      out.add(canonicalize(trimmed, indented));
    }

    int first = 0;
    int last = out.size();
    while (first < last && out.get(first).isEmpty())
      ++first;
    while (last > first && out.get(last - 1).isEmpty())
      --last;
    String ret = String.join("\n", out.subList(first, last));
    logger.debug("normalizer: {} input lines, {} normalized lines ({})", text.split("\n", -1).length, last - first, source);
    return ret;
  }

  private static String replaceTypography(String text) {
    return text.replace('\u201C', '"')
        .replace('\u201D', '"')
        .replace('\u201E', '"')
        .replace('\u2018', '\'')
        .replace('\u2019', '\'')
        .replace('\u2013', '-')
        .replace('\u2014', '-')
        .replace("\u2026", "...")
        .replace('\u00A0', ' ');
  }

  private String convertListItem(String trimmed) {
    Matcher bullet = bulletItem.matcher(trimmed);
    if (bullet.find())
      return syntax.andPrefix + " " + trimmed.substring(bullet.end());
    Matcher numbered = numberedItem.matcher(trimmed);
    if (numbered.find())
      return syntax.andPrefix + " " + trimmed.substring(numbered.end());
    return trimmed;
  }

  /**
   * Canonical form of one trimmed, space-collapsed line.
   * @param trimmed the line content
   * @param indented whether the line was indented
   * @return the canonical line
   */
  String canonicalize(String trimmed, boolean indented) {
    if (trimmed.isEmpty())
      return "";
    Optional<String> declaration = canonicalDeclaration(trimmed);
    if (declaration.isPresent())
      return declaration.get();

    Optional<StepKeywordScanner.TransitionRef> transition = scanner.matchTransition(trimmed);
    if (transition.isPresent()) {
      StepKeywordScanner.TransitionRef ref = transition.get();
      return (ref.orPrefixed() ? syntax.orPrefix + " " : "") + syntax.transitionKeyword.toUpperCase() + " " + ref.keyword() + " " +
          ref.fromStep();
    }

    String indent = indented ? INDENT : "";
    for (String marker : List.of(syntax.andPrefix, syntax.orPrefix)) {
      if (!marker.isEmpty() && trimmed.startsWith(marker)) {
        String rest = trimmed.substring(marker.length()).strip();
        return indent + (rest.isEmpty() ? marker : marker + " " + rest);
      }
    }

    if (!indented) {
      Matcher equals = loneEquals.matcher(trimmed);
      if (equals.find()) {
        int position = equals.start();
        if (!equals.find()) {
          String name = trimmed.substring(0, position).strip();
          String value = trimmed.substring(position + 1).strip();
          return value.isEmpty() ? name + " =" : name + " = " + value;
        }
      }
    }
    return indent + trimmed;
  }

  private Optional<String> canonicalDeclaration(String trimmed) {
    String restAlt = SyntaxRules.alternation(syntax.restKeywords);
    String stepAlt = SyntaxRules.alternation(syntax.stepKeywords);
    String endAlt = SyntaxRules.alternation(syntax.endKeywords);

    Matcher step = scanner.pattern("^(" + stepAlt + ")\\s*[-.(]?\\s*(\\d+)(?:\\s*[:.)]+\\s*(.*)|\\s*$)").matcher(trimmed);
    if (step.matches())
      return Optional.of(joinDeclaration(step.group(1).toUpperCase() + " " + step.group(2).replaceFirst("^0+(?=\\d)", ""), step.group(3)));

    Matcher unnumbered = scanner.pattern("^(" + stepAlt + ")\\s*[:.](?!\\s*\\d)\\s*(.*)$").matcher(trimmed);
    if (unnumbered.matches())
      return Optional.of(joinDeclaration(unnumbered.group(1).toUpperCase(), unnumbered.group(2)));

    Matcher rest = scanner.pattern("^(" + restAlt + ")(?:\\s*[:.]\\s*(.*)|\\s*$)").matcher(trimmed);
    if (rest.matches())
      return Optional.of(joinDeclaration(rest.group(1).toUpperCase(), rest.group(2)));

    Matcher end = scanner.pattern("^(" + endAlt + ")\\s*:\\s*(.*)$").matcher(trimmed);
    if (end.matches())
      return Optional.of(joinDeclaration(end.group(1).toUpperCase(), end.group(2)));
    return Optional.empty();
  }

  private static String joinDeclaration(String head, String description) {
    if (description == null || description.isBlank())
      return head + ":";
    return head + ": " + description.strip();
  }
}
