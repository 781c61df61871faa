package stepnet.frontend.strategy;

import java.util.function.BiPredicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import stepnet.frontend.ParseContext;
import stepnet.frontend.SourceLine;

/**
 * One line classifier of the parser. Strategies are tried in a fixed priority order; the first one that accepts a line consumes it.
 */
public abstract class LineStrategy {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final String name;

  protected LineStrategy(String name) { this.name = name; }

  public String getName() { return name; }

  /**
   * Tries to consume a non-blank line.
   * @param context the parse state to update
   * @param line the line
   * @return true if the line was recognized and consumed, false to pass it on to the next strategy
   */
  public abstract boolean apply(ParseContext context, SourceLine line);

  public static LineStrategy fromFunction(String name, BiPredicate<ParseContext, SourceLine> fn) {
    return new LineStrategy(name) {
      @Override
      public boolean apply(ParseContext context, SourceLine line) {
        return fn.test(context, line);
      }
    };
  }

  @Override
  public String toString() {
    return name;
  }
}
