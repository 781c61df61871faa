package stepnet.frontend.strategy;

import java.util.List;

/** The parser's classification order. */
public class LineStrategies {
  private LineStrategies() {}

  /**
   * Header, symbolic IDB, step declaration, transition, variable, condition. Anything left over is unrecognized.
   * @return a new list of the default strategies in priority order
   */
  public static List<LineStrategy> defaultOrder() {
    return List.of(new HeaderLineStrategy(), new SymbolicIdbLineStrategy(), new StepDeclarationLineStrategy(), new TransitionLineStrategy(),
                   new VariableLineStrategy(), new ConditionLineStrategy());
  }
}
