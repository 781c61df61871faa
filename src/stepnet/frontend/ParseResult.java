package stepnet.frontend;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one parse: the program with every diagnostic of the full scan, its statistics, and how the input was processed.
 */
public class ParseResult {
  /**
   * @param source where the text came from
   * @param originalLineCount lines of the raw input
   * @param normalizedLineCount lines after normalization
   * @param parsedAt time the parse finished
   */
  public record Metadata(SourceKind source, int originalLineCount, int normalizedLineCount, Instant parsedAt) {}

  private final Program program;
  private final String normalizedText;
  private final Metadata metadata;

  public ParseResult(Program program, String normalizedText, Metadata metadata) {
    this.program = program;
    this.normalizedText = normalizedText;
    this.metadata = metadata;
  }

  public Program getProgram() { return program; }
  public String getNormalizedText() { return normalizedText; }
  public Metadata getMetadata() { return metadata; }
  public List<Diagnostic> getErrors() { return program.getErrors(); }
  public List<Diagnostic> getWarnings() { return program.getWarnings(); }
  public ProgramStatistics getStatistics() { return program.getStatistics(); }
  public boolean hasErrors() { return program.hasErrors(); }
}
