package stepnet;

import java.time.Instant;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import stepnet.config.SyntaxRules;
import stepnet.config.ValidationRules;
import stepnet.config.ValidationRules.CrossReferenceMode;
import stepnet.drc.ProgramRegistry;
import stepnet.drc.ProgramValidator;
import stepnet.frontend.ParseResult;
import stepnet.frontend.Program;
import stepnet.frontend.SourceKind;
import stepnet.frontend.StepKeywordScanner;
import stepnet.frontend.StepProgramParser;
import stepnet.frontend.TextNormalizer;
import stepnet.netlist.GenerationException;
import stepnet.netlist.NetlistDocument;
import stepnet.netlist.NetlistGenerator;
import stepnet.ui.StepNetConfig;
import stepnet.util.PatternCache;

/**
 * Compilation pipeline: normalize, parse, validate, generate.
 * An instance keeps no state between calls apart from the compiled pattern cache.
 */
public class StepNet {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final StepNetConfig cfg;
  private final PatternCache patterns;
  private final TextNormalizer normalizer;
  private final StepProgramParser parser;
  private final ProgramValidator validator;
  private final NetlistGenerator generator;

  public StepNet() { this(SyntaxRules.defaults(), ValidationRules.defaults(), new StepNetConfig()); }

  /**
   * @param syntax keyword configuration
   * @param rules validation rules; strict cross-reference checking in {@code cfg} overrides their mode
   * @param cfg tool options
   */
  public StepNet(SyntaxRules syntax, ValidationRules rules, StepNetConfig cfg) {
    this.cfg = cfg;
    this.patterns = new PatternCache(cfg.patternCacheCapacity);
    StepKeywordScanner scanner = new StepKeywordScanner(syntax, patterns);
    this.normalizer = new TextNormalizer(scanner);
    this.parser = new StepProgramParser(scanner);
    ValidationRules effectiveRules = rules;
    if (cfg.strictCrossReferences && rules.crossReferenceMode != CrossReferenceMode.STRICT) {
      effectiveRules = rules.copy();
      effectiveRules.crossReferenceMode = CrossReferenceMode.STRICT;
    }
    this.validator = new ProgramValidator(effectiveRules, patterns);
    this.generator = new NetlistGenerator(cfg);
  }

  public PatternCache getPatternCache() { return patterns; }

  public ParseResult parse(String text, SourceKind source, Map<String, String> metadata) { return parse(text, source, metadata, null); }

  /**
   * Normalizes, parses and validates a program text.
   * @param text raw program text
   * @param source how the text was obtained
   * @param metadata optional program name, function block tag and symbolic instance name; may be empty
   * @param registry previously parsed programs for cross-reference checks, or null
   * @return the parse result with all diagnostics
   */
  public ParseResult parse(String text, SourceKind source, Map<String, String> metadata, ProgramRegistry registry) {
    String raw = text == null ? "" : text;
    String normalized = normalizer.normalize(raw, source);
    Program program = parser.parse(normalized, metadata == null ? Map.of() : metadata);
    validator.validate(program, registry);
    program.updateStatistics();

    int originalLines = raw.isEmpty() ? 0 : raw.split("\r\n|\r|\n", -1).length;
    int normalizedLines = normalized.isEmpty() ? 0 : normalized.split("\n", -1).length;
    ParseResult result = new ParseResult(program, normalized, new ParseResult.Metadata(source, originalLines, normalizedLines, Instant.now()));
    logger.debug("stepnet: parsed '{}' with {} steps, {} errors, {} warnings", program.getName(), program.getSteps().size(),
                 result.getErrors().size(), result.getWarnings().size());
    return result;
  }

  public NetlistDocument generateDocument(Program program) throws GenerationException { return generator.generate(program); }

  /**
   * Generates the netlist XML of a parsed program.
   * @param program the program
   * @return the XML document text
   * @throws GenerationException if the program has no steps
   */
  public String generate(Program program) throws GenerationException { return generateDocument(program).toXml(cfg.pretty); }

  /** Parses and generates in one go; the program is generated even if it has errors. */
  public String compile(String text, SourceKind source, Map<String, String> metadata) throws GenerationException {
    return generate(parse(text, source, metadata).getProgram());
  }
}
