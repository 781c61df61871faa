package stepnet.frontend;

/** Diagnostic codes with their default severity. */
public enum DiagnosticType {
  DUPLICATE_STEP(Severity.ERROR),
  DUPLICATE_REST(Severity.ERROR),
  /** A sequential step numbered 0, the index of the REST bit. */
  INVALID_STEP_NUMBER(Severity.ERROR),
  INVALID_TRANSITION(Severity.ERROR),
  EMPTY_IDENTIFIER(Severity.ERROR),
  MISSING_CONDITIONS(Severity.ERROR),
  INVALID_ENTRY_CONDITIONS(Severity.ERROR),
  INVALID_EXIT_CONDITIONS(Severity.ERROR),
  DISALLOWED_CONDITION(Severity.ERROR),
  SEQUENCE_GAP(Severity.WARNING),
  TOO_MANY_CONDITIONS(Severity.WARNING),
  TIMER_OUT_OF_RANGE(Severity.WARNING),
  EMPTY_STEP_DESCRIPTION(Severity.WARNING),
  MISSING_STEP_NUMBER(Severity.WARNING),
  AMBIGUOUS_CONDITION(Severity.WARNING),
  UNRECOGNIZED_LINE(Severity.WARNING),
  /** Severity depends on the cross-reference mode. */
  UNRESOLVED_CROSS_REFERENCE(Severity.WARNING);

  public final Severity defaultSeverity;

  private DiagnosticType(Severity defaultSeverity) { this.defaultSeverity = defaultSeverity; }
}
