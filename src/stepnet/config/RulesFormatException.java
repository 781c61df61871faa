package stepnet.config;

/** A syntax or validation rule file cannot be read or does not have the expected structure. */
public class RulesFormatException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String key;

  public RulesFormatException(String key, String message) {
    super(key.isEmpty() ? message : key + ": " + message);
    this.key = key;
  }
  public RulesFormatException(String key, String message, Throwable cause) {
    super(key.isEmpty() ? message : key + ": " + message, cause);
    this.key = key;
  }

  /** The offending key, dotted for nested entries (e.g. {@code groups[2].patterns}); empty for the file as a whole. */
  public String getKey() { return key; }
}
