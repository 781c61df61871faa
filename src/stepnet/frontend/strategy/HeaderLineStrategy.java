package stepnet.frontend.strategy;

import java.util.regex.Matcher;
import stepnet.frontend.BlockTag;
import stepnet.frontend.ParseContext;
import stepnet.frontend.SourceLine;
import stepnet.frontend.StepKeywordScanner;

/** Program identity from the first non-empty, unindented line: {@code <name> FB<n>}, or a bare name without colon or assignment. */
public class HeaderLineStrategy extends LineStrategy {
  public HeaderLineStrategy() { super("header"); }

  @Override
  public boolean apply(ParseContext context, SourceLine line) {
    if (!context.isHeaderWindowOpen() || line.indented())
      return false;
    StepKeywordScanner scanner = context.getScanner();
    Matcher matcher = scanner.pattern("^(.+?)\\s+((?:FB|FC)\\d+)$").matcher(line.trimmed());
    if (matcher.matches()) {
      context.getProgram().setName(matcher.group(1).strip());
      BlockTag.parse(matcher.group(2)).ifPresent(context.getProgram()::setFunctionBlockTag);
      logger.trace("parser: line {} header '{}' {}", line.number(), matcher.group(1).strip(), matcher.group(2));
      return true;
    }
    String text = line.trimmed();
    boolean plainName = !text.contains(":") && !text.contains("=") && !scanner.getSyntax().startsWithGroupMarker(text);
    if (plainName && scanner.matchTransition(text).isEmpty()) {
      context.getProgram().setName(text);
      logger.trace("parser: line {} header '{}' without block tag", line.number(), text);
      return true;
    }
    return false;
  }
}
