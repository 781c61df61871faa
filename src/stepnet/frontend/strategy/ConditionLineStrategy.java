package stepnet.frontend.strategy;

import stepnet.config.SyntaxRules;
import stepnet.frontend.Condition;
import stepnet.frontend.ParseContext;
import stepnet.frontend.SourceLine;

/**
 * Condition lines, once a step, variable or transition collects conditions: indented lines, lines with a group marker, and
 * unmarked lines with enough condition signals.
 */
public class ConditionLineStrategy extends LineStrategy {
  public ConditionLineStrategy() { super("condition"); }

  @Override
  public boolean apply(ParseContext context, SourceLine line) {
    if (!context.hasConditionTarget())
      return false;
    SyntaxRules syntax = context.getScanner().getSyntax();
    String text = line.trimmed();
    if (!line.indented() && !syntax.startsWithGroupMarker(text)) {
      if (syntax.implicitConditionSignals <= 0)
        return false;
      int signals = context.getExtractor().countConditionSignals(text);
      if (signals < syntax.implicitConditionSignals)
        return false;
      logger.trace("parser: line {} unmarked condition with {} signals", line.number(), signals);
    }
    Condition condition = context.getExtractor().extract(text, line.number(), context::report);
    context.addCondition(condition);
    logger.trace("parser: line {} condition {}", line.number(), condition);
    return true;
  }
}
