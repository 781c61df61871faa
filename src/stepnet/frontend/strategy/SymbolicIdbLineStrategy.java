package stepnet.frontend.strategy;

import java.util.regex.Matcher;
import stepnet.frontend.ParseContext;
import stepnet.frontend.SourceLine;

/** {@code Symbol IDB: <name>} and its spelling variants set the symbolic instance data block name. */
public class SymbolicIdbLineStrategy extends LineStrategy {
  public SymbolicIdbLineStrategy() { super("symbolic IDB"); }

  @Override
  public boolean apply(ParseContext context, SourceLine line) {
    Matcher matcher = context.getScanner().pattern("^Symbo(?:l|ol|lik|lic)\\s+IDB\\s*:\\s*(.*)$").matcher(line.trimmed());
    if (!matcher.matches())
      return false;
    context.getProgram().setSymbolicInstanceName(matcher.group(1).strip());
    logger.trace("parser: line {} symbolic IDB '{}'", line.number(), matcher.group(1).strip());
    return true;
  }
}
