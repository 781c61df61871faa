package stepnet.frontend;

/**
 * An error or warning about the input program. Diagnostics are collected, never thrown.
 * @param type the code
 * @param severity ERROR or WARNING
 * @param message human readable description
 * @param lineNumber 1-based source line, 0 if not bound to a line
 * @param sourceText the offending raw line, or empty
 */
public record Diagnostic(DiagnosticType type, Severity severity, String message, int lineNumber, String sourceText) {

  public static Diagnostic of(DiagnosticType type, String message, int lineNumber) {
    return new Diagnostic(type, type.defaultSeverity, message, lineNumber, "");
  }
  public static Diagnostic of(DiagnosticType type, String message, int lineNumber, String sourceText) {
    return new Diagnostic(type, type.defaultSeverity, message, lineNumber, sourceText == null ? "" : sourceText);
  }

  public boolean isError() { return severity == Severity.ERROR; }

  @Override
  public String toString() {
    return (lineNumber > 0 ? "line " + lineNumber + ": " : "") + type + ": " + message + (sourceText.isEmpty() ? "" : " [" + sourceText + "]");
  }
}
