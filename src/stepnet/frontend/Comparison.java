package stepnet.frontend;

/** Relational comparison found in a condition, e.g. {@code Teller >= 3}. */
public record Comparison(String variable, String operator, String value) {}
