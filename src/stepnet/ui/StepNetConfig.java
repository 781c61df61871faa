package stepnet.ui;

import java.util.ArrayList;
import java.util.List;

/**
 * Data-Class to hold tool options.
 */
public class StepNetConfig {

  public boolean pretty = true;
  public boolean strictCrossReferences = false;
  public int patternCacheCapacity = 256;

  /** Per-network identifier bands (REST from 500, step network i from 1000+100*i) instead of one document-wide counter. */
  public boolean legacyNetworkIdRanges = false;
  public boolean emitInstanceDb = false;
  /** Number of the instance data block; 0 uses the function block number. */
  public int instanceDbNumber = 0;

  public String engineeringVersion = "V18";
  public List<String> cultures = new ArrayList<>(List.of("nl-NL", "en-GB"));
  public String restLabel = "RUST";
  public String stepLabel = "STAP";
}
