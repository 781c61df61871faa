package stepnet.frontend;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Mutable state of a single parse: the program under construction and which step, transition or variable collects conditions.
 * <p>
 * Conditions directly under a step declaration are entry conditions. A blank line after at least one entry condition switches to
 * exit conditions, which are buffered and handed to the step when the next declaration or the end of input closes it.
 * Conditions after a {@code VON} line belong to that transition; transitions wait for the next step declaration.
 */
public class ParseContext {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Program program;
  private final StepKeywordScanner scanner;
  private final ConditionExtractor extractor;

  private boolean headerWindowOpen = true;

  private Step currentStep = null;
  private boolean collectingExit = false;
  private final List<Condition> pendingExit = new ArrayList<>();
  private final List<Transition> pendingTransitions = new ArrayList<>();
  private Variable currentVariable = null;

  public ParseContext(Program program, StepKeywordScanner scanner, ConditionExtractor extractor) {
    this.program = program;
    this.scanner = scanner;
    this.extractor = extractor;
  }

  public Program getProgram() { return program; }
  public StepKeywordScanner getScanner() { return scanner; }
  public ConditionExtractor getExtractor() { return extractor; }

  public void report(Diagnostic diagnostic) {
    logger.debug("parser: {}", diagnostic);
    program.addDiagnostic(diagnostic);
  }

  /** Whether the current line is still the first non-empty line, where a header may appear. */
  public boolean isHeaderWindowOpen() { return headerWindowOpen; }
  public void closeHeaderWindow() { headerWindowOpen = false; }

  public Step getCurrentStep() { return currentStep; }
  public boolean isStepOpen() { return currentStep != null; }

  /** True if a condition line would have somewhere to go. */
  public boolean hasConditionTarget() { return currentStep != null || currentVariable != null || !pendingTransitions.isEmpty(); }

  /**
   * Closes the open step, variable and transition contexts and opens a new step.
   * Transitions declared since the previous step declaration become predecessors of the new step.
   * @param step the newly declared step
   */
  public void openStep(Step step) {
    finalizeStep();
    currentVariable = null;
    program.addStep(step);
    pendingTransitions.forEach(step::addTransition);
    pendingTransitions.clear();
    currentStep = step;
    collectingExit = false;
  }

  /** Hands buffered exit conditions to the open step and closes it. */
  public void finalizeStep() {
    if (currentStep != null) {
      pendingExit.forEach(currentStep::addExitCondition);
      if (!pendingExit.isEmpty())
        logger.trace("parser: {} exit conditions for {}", pendingExit.size(), currentStep);
    }
    pendingExit.clear();
    currentStep = null;
    collectingExit = false;
  }

  /** Closes everything at an end keyword or the end of input. Transitions that never reached a step are reported. */
  public void finish() {
    finalizeStep();
    currentVariable = null;
    for (Transition transition : pendingTransitions)
      report(Diagnostic.of(DiagnosticType.INVALID_TRANSITION, "transition from step " + transition.getFromStep() + " is not followed by a step",
                           transition.getLineNumber()));
    pendingTransitions.clear();
  }

  public void addPendingTransition(Transition transition) { pendingTransitions.add(transition); }

  public void openVariable(Variable variable) {
    program.addVariable(variable);
    currentVariable = variable;
  }

  /** A blank line ends a variable's condition block and, after the first entry conditions, switches a step to exit conditions. */
  public void blankLine() {
    currentVariable = null;
    if (currentStep != null && !collectingExit && !currentStep.getEntryConditions().isEmpty())
      collectingExit = true;
  }

  /**
   * Routes a condition to the pending transition, the open variable, or the open step.
   * @param condition the condition
   */
  public void addCondition(Condition condition) {
    if (condition.crossReference() != null)
      program.addCrossReference(condition.crossReference());
    if (!pendingTransitions.isEmpty()) {
      pendingTransitions.get(pendingTransitions.size() - 1).addCondition(condition);
    } else if (currentVariable != null) {
      currentVariable.addCondition(condition);
    } else if (currentStep != null) {
      if (collectingExit)
        pendingExit.add(condition);
      else
        currentStep.addEntryCondition(condition);
      extractor.associateNames(currentStep, condition);
    } else {
      throw new IllegalStateException("no condition target for line " + condition.lineNumber());
    }
  }
}
