package stepnet.frontend;

/**
 * One line (or one split-off segment of a line) handed to the line strategies.
 * @param number 1-based line number in the normalized text
 * @param raw the line as written
 * @param trimmed the line without surrounding whitespace
 * @param indented whether the line starts with whitespace
 */
public record SourceLine(int number, String raw, String trimmed, boolean indented) {
  public static SourceLine of(int number, String raw) {
    String trimmed = raw.strip();
    boolean indented = !raw.isEmpty() && Character.isWhitespace(raw.charAt(0)) && !trimmed.isEmpty();
    return new SourceLine(number, raw, trimmed, indented);
  }

  public boolean isBlank() { return trimmed.isEmpty(); }
}
