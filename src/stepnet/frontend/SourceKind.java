package stepnet.frontend;

import java.util.Optional;
import java.util.stream.Stream;

/** Where the program text came from; document conversion leaves more artifacts to clean up. */
public enum SourceKind {
  DocumentImport("document-import"),
  DirectEntry("direct-entry");

  public final String serialName;

  private SourceKind(String serialName) { this.serialName = serialName; }

  public static Optional<SourceKind> fromSerialName(String serialName) {
    return Stream.of(SourceKind.values()).filter(kind -> kind.serialName.equalsIgnoreCase(serialName)).findAny();
  }

  @Override
  public String toString() {
    return serialName;
  }
}
