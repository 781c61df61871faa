package stepnet.frontend.strategy;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import stepnet.config.SyntaxRules;
import stepnet.frontend.Assignment;
import stepnet.frontend.Diagnostic;
import stepnet.frontend.DiagnosticType;
import stepnet.frontend.ParseContext;
import stepnet.frontend.SourceLine;
import stepnet.frontend.Variable;

/**
 * Unindented {@code name =[ value]} lines. Inside an open step they assign a target while the step is active; otherwise they declare
 * a standalone variable whose condition block follows.
 */
public class VariableLineStrategy extends LineStrategy {
  private static final Pattern loneEquals = Pattern.compile("(?<![<>!=])=(?!=)");

  public VariableLineStrategy() { super("variable"); }

  @Override
  public boolean apply(ParseContext context, SourceLine line) {
    SyntaxRules syntax = context.getScanner().getSyntax();
    String text = line.trimmed();
    if (line.indented() || syntax.startsWithGroupMarker(text))
      return false;
    Matcher matcher = loneEquals.matcher(text);
    if (!matcher.find())
      return false;
    String name = text.substring(0, matcher.start()).strip();
    String value = text.substring(matcher.end()).strip();
    if (name.isEmpty()) {
      context.report(Diagnostic.of(DiagnosticType.EMPTY_IDENTIFIER, "assignment without a name", line.number(), line.raw()));
      return true;
    }
    if (context.isStepOpen()) {
      context.getCurrentStep().addAssignment(new Assignment(name, value, line.number()));
      logger.trace("parser: line {} assignment '{}' in {}", line.number(), name, context.getCurrentStep());
    } else {
      Variable variable = new Variable(name, value, context.getExtractor().detectVariableKind(name), line.number());
      context.openVariable(variable);
      logger.trace("parser: line {} variable {} ({})", line.number(), variable, variable.getKind());
    }
    return true;
  }
}
