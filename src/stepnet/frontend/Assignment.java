package stepnet.frontend;

/** A {@code name =[ value]} line inside an open step, setting a target while the step is active. */
public record Assignment(String target, String value, int lineNumber) {}
