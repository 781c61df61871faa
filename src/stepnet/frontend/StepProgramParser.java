package stepnet.frontend;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import stepnet.frontend.strategy.LineStrategies;
import stepnet.frontend.strategy.LineStrategy;

/**
 * Scans normalized program text line by line and builds the {@link Program} model.
 * Each line goes through the line strategies in priority order; a line no strategy accepts is kept as an UNRECOGNIZED_LINE warning.
 * Never aborts: every problem is collected on the program.
 */
public class StepProgramParser {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String META_PROGRAM_NAME = "programName";
  public static final String META_FUNCTION_BLOCK = "functionBlock";
  public static final String META_SYMBOLIC_INSTANCE = "symbolicInstanceName";

  private final StepKeywordScanner scanner;
  private final ConditionExtractor extractor;
  private final List<LineStrategy> strategies;

  public StepProgramParser(StepKeywordScanner scanner) { this(scanner, LineStrategies.defaultOrder()); }

  /**
   * @param scanner keyword patterns
   * @param strategies line strategies in priority order
   */
  public StepProgramParser(StepKeywordScanner scanner, List<LineStrategy> strategies) {
    this.scanner = scanner;
    this.extractor = new ConditionExtractor(scanner);
    this.strategies = List.copyOf(strategies);
  }

  public List<LineStrategy> getStrategies() { return strategies; }

  /**
   * Parses normalized text.
   * @param text the normalized program text
   * @param metadata optional defaults for the program identity (programName, functionBlock, symbolicInstanceName); may be null
   * @return the program with all parser diagnostics
   */
  public Program parse(String text, Map<String, String> metadata) {
    Program program = new Program();
    applyMetadata(program, metadata);
    ParseContext context = new ParseContext(program, scanner, extractor);

    String[] lines = text.isEmpty() ? new String[0] : text.split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      SourceLine line = SourceLine.of(i + 1, lines[i]);
      if (line.isBlank()) {
        context.blankLine();
        continue;
      }
      for (SourceLine segment : splitEmbedded(line))
        dispatch(context, segment);
      context.closeHeaderWindow();
    }
    context.finish();

    logger.debug("parser: {} lines, {} steps, {} variables, {} errors, {} warnings", lines.length, program.getSteps().size(),
                 program.getVariables().size(), program.getErrors().size(), program.getWarnings().size());
    return program;
  }

  private static void applyMetadata(Program program, Map<String, String> metadata) {
    if (metadata == null)
      return;
    String name = metadata.get(META_PROGRAM_NAME);
    if (name != null)
      program.setName(name.strip());
    String functionBlock = metadata.get(META_FUNCTION_BLOCK);
    if (functionBlock != null)
      BlockTag.parse(functionBlock).ifPresent(program::setFunctionBlockTag);
    String symbolicInstance = metadata.get(META_SYMBOLIC_INSTANCE);
    if (symbolicInstance != null)
      program.setSymbolicInstanceName(symbolicInstance.strip());
  }

  /**
   * Splits declarations embedded after other text off into their own segments, since normalization may not have done so.
   * The text before a declaration keeps the line's indentation.
   */
  private List<SourceLine> splitEmbedded(SourceLine line) {
    List<SourceLine> ret = new ArrayList<>();
    String remaining = line.trimmed();
    boolean indented = line.indented();
    int embedded;
    while ((embedded = scanner.findEmbeddedDeclaration(remaining)) > 0) {
      String prefix = remaining.substring(0, embedded).strip();
      ret.add(new SourceLine(line.number(), line.raw(), prefix, indented));
      remaining = remaining.substring(embedded);
      indented = false;
    }
    ret.add(ret.isEmpty() ? line : new SourceLine(line.number(), line.raw(), remaining, false));
    return ret;
  }

  private void dispatch(ParseContext context, SourceLine line) {
    for (LineStrategy strategy : strategies) {
      if (strategy.apply(context, line))
        return;
    }
    logger.trace("parser: line {} unrecognized", line.number());
    context.report(Diagnostic.of(DiagnosticType.UNRECOGNIZED_LINE, "unrecognized line", line.number(), line.raw()));
  }
}
