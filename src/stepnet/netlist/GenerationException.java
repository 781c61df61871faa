package stepnet.netlist;

/** The program cannot be turned into a netlist. */
public class GenerationException extends Exception {
  private static final long serialVersionUID = 1L;

  public GenerationException(String message) { super(message); }
}
