package stepnet.drc;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import stepnet.config.ValidationRules;
import stepnet.config.ValidationRules.CrossReferenceMode;
import stepnet.config.ValidationRules.GroupRule;
import stepnet.config.ValidationRules.StepRule;
import stepnet.frontend.Condition;
import stepnet.frontend.ConditionGroup;
import stepnet.frontend.CrossReference;
import stepnet.frontend.Diagnostic;
import stepnet.frontend.DiagnosticType;
import stepnet.frontend.Program;
import stepnet.frontend.Severity;
import stepnet.frontend.Step;
import stepnet.frontend.TimerSpec;
import stepnet.frontend.Transition;
import stepnet.frontend.Variable;
import stepnet.util.PatternCache;

/**
 * Semantic checks on a parsed program. All findings are appended to the program's diagnostics; nothing is thrown.
 * The only model change is the group annotation of each variable.
 */
public class ProgramValidator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final ValidationRules rules;
  private final VariableGroupClassifier classifier;

  public ProgramValidator(ValidationRules rules, PatternCache patterns) {
    this.rules = rules;
    this.classifier = new VariableGroupClassifier(rules, patterns);
  }

  /** Validates without a program registry: cross-references are only checked in strict mode. */
  public void validate(Program program) { validate(program, null); }

  /**
   * Runs all checks.
   * @param program the parsed program
   * @param registry previously parsed programs, or null if none is available
   */
  public void validate(Program program, ProgramRegistry registry) {
    int errorsBefore = program.getErrors().size();
    int warningsBefore = program.getWarnings().size();

    CheckStepNumbers(program);
    CheckSequenceGaps(program);
    CheckTransitions(program);
    for (Step step : program.getSteps())
      CheckStep(program, step);
    for (Variable variable : program.getVariables())
      CheckVariable(program, variable);
    CheckCrossReferences(program, registry);

    logger.debug("validator: {} new errors, {} new warnings for '{}'", program.getErrors().size() - errorsBefore,
                 program.getWarnings().size() - warningsBefore, program.getName());
  }

  /** Duplicate sequential numbers and duplicate REST steps, reported at each duplicate. Step 0 is reserved for REST. */
  private void CheckStepNumbers(Program program) {
    Set<Integer> seen = new HashSet<>();
    boolean restSeen = false;
    for (Step step : program.getSteps()) {
      if (step.isRest()) {
        if (restSeen)
          program.addDiagnostic(Diagnostic.of(DiagnosticType.DUPLICATE_REST, "REST declared more than once", step.getLineNumber()));
        restSeen = true;
      } else if (step.getNumber() == 0) {
        program.addDiagnostic(Diagnostic.of(DiagnosticType.INVALID_STEP_NUMBER, step + " uses number 0, which belongs to REST",
                                            step.getLineNumber()));
      } else if (!seen.add(step.getNumber())) {
        program.addDiagnostic(Diagnostic.of(DiagnosticType.DUPLICATE_STEP, "step " + step.getNumber() + " declared more than once",
                                            step.getLineNumber()));
      }
    }
  }

  /** A jump in sequential numbering is fine only if the later step declares an explicit predecessor. */
  private void CheckSequenceGaps(Program program) {
    TreeMap<Integer, Step> byNumber = new TreeMap<>();
    for (Step step : program.getSequentialSteps())
      byNumber.putIfAbsent(step.getNumber(), step);
    Integer previous = null;
    for (var entry : byNumber.entrySet()) {
      int number = entry.getKey();
      if (previous != null && number > previous + 1 && entry.getValue().getTransitions().isEmpty()) {
        program.addDiagnostic(Diagnostic.of(DiagnosticType.SEQUENCE_GAP,
                                            "gap between step " + previous + " and step " + number + " without VON transition",
                                            entry.getValue().getLineNumber()));
      }
      previous = number;
    }
  }

  private void CheckTransitions(Program program) {
    for (Step step : program.getSteps()) {
      StepRule stepRule = ruleFor(step);
      for (Transition transition : step.getTransitions()) {
        if (!stepRule.allowsTransitions) {
          program.addDiagnostic(Diagnostic.of(DiagnosticType.INVALID_TRANSITION, "transitions are not allowed on " + step,
                                              transition.getLineNumber()));
          continue;
        }
        int from = transition.getFromStep();
        boolean exists = (from == 0) ? program.getRestStep().isPresent() : program.findSequentialStep(from).isPresent();
        if (!exists)
          program.addDiagnostic(Diagnostic.of(DiagnosticType.INVALID_TRANSITION, "VON references missing step " + from,
                                              transition.getLineNumber()));
      }
    }
  }

  private void CheckStep(Program program, Step step) {
    StepRule stepRule = ruleFor(step);
    if (step.getDescription().isEmpty())
      program.addDiagnostic(Diagnostic.of(DiagnosticType.EMPTY_STEP_DESCRIPTION, step + " has no description", step.getLineNumber()));
    if (!step.getEntryConditions().isEmpty() && !stepRule.allowsEntryConditions)
      program.addDiagnostic(Diagnostic.of(DiagnosticType.INVALID_ENTRY_CONDITIONS, step + " must not have entry conditions",
                                          step.getLineNumber()));
    if (!step.getExitConditions().isEmpty() && !stepRule.allowsExitConditions)
      program.addDiagnostic(Diagnostic.of(DiagnosticType.INVALID_EXIT_CONDITIONS, step + " must not have exit conditions",
                                          step.getLineNumber()));

    int count = step.getConditionCount();
    if (stepRule.requiresConditions && count == 0)
      program.addDiagnostic(Diagnostic.of(DiagnosticType.MISSING_CONDITIONS, step + " requires conditions", step.getLineNumber()));
    if (count > stepRule.maxConditions)
      program.addDiagnostic(Diagnostic.of(DiagnosticType.TOO_MANY_CONDITIONS,
                                          step + " has " + count + " conditions, maximum is " + stepRule.maxConditions,
                                          step.getLineNumber()));

    step.allConditions().forEach(condition -> {
      if (!stepRule.allowedConditionKinds.contains(condition.kind()))
        program.addDiagnostic(Diagnostic.of(DiagnosticType.DISALLOWED_CONDITION,
                                            condition.kind().serialName + " condition not allowed in " + step, condition.lineNumber()));
      CheckTimer(program, condition);
    });
  }

  private void CheckVariable(Program program, Variable variable) {
    String group = classifier.classify(variable.getDeclarationText());
    variable.setGroup(group);
    logger.trace("validator: {} classified as {}", variable.getName(), group);

    var opt_groupRule = rules.getGroup(group);
    if (opt_groupRule.isEmpty()) {
      logger.warn("validator: group '{}' of {} has no rule, skipping constraint checks", group, variable.getName());
      return;
    }
    GroupRule groupRule = opt_groupRule.get();
    int count = variable.getConditionCount();
    if (groupRule.requiresConditions && count == 0)
      program.addDiagnostic(Diagnostic.of(DiagnosticType.MISSING_CONDITIONS,
                                          "variable " + variable.getName() + " of group " + group + " requires conditions",
                                          variable.getLineNumber()));
    if (count > groupRule.maxConditions)
      program.addDiagnostic(Diagnostic.of(DiagnosticType.TOO_MANY_CONDITIONS,
                                          "variable " + variable.getName() + " has " + count + " conditions, maximum is " +
                                              groupRule.maxConditions,
                                          variable.getLineNumber()));
    conditionsOf(variable.getConditions()).forEach(condition -> CheckTimer(program, condition));
  }

  private void CheckTimer(Program program, Condition condition) {
    TimerSpec timer = condition.timerSpec();
    if (timer != null && timer.seconds() > rules.maxTimerSeconds)
      program.addDiagnostic(Diagnostic.of(DiagnosticType.TIMER_OUT_OF_RANGE,
                                          "timer of " + timer.seconds() + " s exceeds " + rules.maxTimerSeconds + " s",
                                          condition.lineNumber()));
  }

  /**
   * Lenient mode reports unresolved references as warnings, and only when a registry is available.
   * Strict mode reports them as errors, and without a registry no reference can be resolved.
   * References to the program itself resolve against its own steps.
   */
  private void CheckCrossReferences(Program program, ProgramRegistry registry) {
    boolean strict = rules.crossReferenceMode == CrossReferenceMode.STRICT;
    if (registry == null && !strict)
      return;
    Set<Integer> ownSteps = ProgramRegistry.stepNumbers(program);
    for (CrossReference reference : program.getCrossReferences()) {
      if (reference.programName().isEmpty())
        continue;
      boolean resolved;
      if (!program.getName().isEmpty() && reference.programName().equals(program.getName()))
        resolved = ownSteps.containsAll(reference.stepNumbers());
      else
        resolved = registry != null && registry.resolves(reference);
      if (resolved)
        continue;
      String message = "cannot resolve " + reference.programName() + " step " + reference.stepNumbers();
      program.addDiagnostic(new Diagnostic(DiagnosticType.UNRESOLVED_CROSS_REFERENCE, strict ? Severity.ERROR : Severity.WARNING,
                                           message, reference.lineNumber(), ""));
    }
  }

  private StepRule ruleFor(Step step) { return step.isRest() ? rules.restRule : rules.sequentialRule; }

  private static Stream<Condition> conditionsOf(List<ConditionGroup> groups) {
    return groups.stream().flatMap(group -> group.getConditions().stream());
  }
}
