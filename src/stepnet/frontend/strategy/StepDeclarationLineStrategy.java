package stepnet.frontend.strategy;

import java.util.Optional;
import stepnet.frontend.Diagnostic;
import stepnet.frontend.DiagnosticType;
import stepnet.frontend.ParseContext;
import stepnet.frontend.SourceLine;
import stepnet.frontend.Step;
import stepnet.frontend.StepKeywordScanner.Declaration;
import stepnet.frontend.StepKind;

/**
 * REST and step declarations open a new step; an end keyword closes the open one.
 */
public class StepDeclarationLineStrategy extends LineStrategy {
  public StepDeclarationLineStrategy() { super("step declaration"); }

  @Override
  public boolean apply(ParseContext context, SourceLine line) {
    Optional<Declaration> opt_declaration = context.getScanner().matchDeclaration(line.trimmed());
    if (opt_declaration.isEmpty()) {
      Optional<String> endKeyword = context.getScanner().matchEnd(line.trimmed());
      if (endKeyword.isEmpty())
        return false;
      logger.trace("parser: line {} {} closes {}", line.number(), endKeyword.get(), context.getCurrentStep());
      context.finish();
      return true;
    }
    Declaration declaration = opt_declaration.get();
    StepKind kind;
    if (declaration.rest()) {
      kind = StepKind.REST;
    } else {
      int number = 1;
      if (declaration.number() == null)
        context.report(Diagnostic.of(DiagnosticType.MISSING_STEP_NUMBER, declaration.keyword() + " without number, using 1", line.number(),
                                     line.raw()));
      else
        number = declaration.number();
      kind = new StepKind.Sequential(number);
    }
    Step step = new Step(kind, declaration.keyword(), declaration.description(), line.number());
    context.openStep(step);
    logger.trace("parser: line {} declares {}", line.number(), step);
    return true;
  }
}
