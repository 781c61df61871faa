package stepnet.frontend.strategy;

import java.util.Optional;
import stepnet.frontend.ParseContext;
import stepnet.frontend.SourceLine;
import stepnet.frontend.StepKeywordScanner.TransitionRef;
import stepnet.frontend.Transition;

/** {@code [+ ]VON STEP n} records a predecessor for the next declared step. */
public class TransitionLineStrategy extends LineStrategy {
  public TransitionLineStrategy() { super("transition"); }

  @Override
  public boolean apply(ParseContext context, SourceLine line) {
    Optional<TransitionRef> ref = context.getScanner().matchTransition(line.trimmed());
    if (ref.isEmpty())
      return false;
    context.addPendingTransition(new Transition(ref.get().fromStep(), line.number()));
    logger.trace("parser: line {} transition from step {}", line.number(), ref.get().fromStep());
    return true;
  }
}
