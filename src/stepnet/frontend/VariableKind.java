package stepnet.frontend;

/** Partition of standalone variables by the keywords found in their names. */
public enum VariableKind {
  General("variable"),
  Timer("timer"),
  Marker("marker"),
  Fault("storing");

  public final String serialName;

  private VariableKind(String serialName) { this.serialName = serialName; }
}
