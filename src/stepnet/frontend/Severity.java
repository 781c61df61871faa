package stepnet.frontend;

/** ERROR marks a structural problem that blocks confident generation, WARNING is advisory. */
public enum Severity { ERROR, WARNING }
