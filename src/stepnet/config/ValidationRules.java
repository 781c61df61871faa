package stepnet.config;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;
import stepnet.frontend.ConditionKind;

/**
 * Validation rule configuration: variable groups with their classification patterns and constraints, per step type constraints,
 * and cross-reference resolution mode.
 */
public class ValidationRules {

  public enum CrossReferenceMode {
    /** Unresolved references are reported as warnings, and only when a registry is available. */
    LENIENT,
    /** Unresolved references are errors. */
    STRICT;

    public static Optional<CrossReferenceMode> fromSerialName(String serialName) {
      return Stream.of(values()).filter(mode -> mode.name().equalsIgnoreCase(serialName)).findAny();
    }
  }

  /** A variable group. Patterns are Java regular expressions matched (find) against the variable's declaration text. */
  public static class GroupRule {
    public String name;
    public String description = "";
    public List<String> patterns = new ArrayList<>();
    public List<String> excludePatterns = new ArrayList<>();
    public boolean requiresConditions = false;
    public int maxConditions = 0;

    public String implementationType = "coil";
    public String dataType = "Bool";
    public String arrayName = "";
    public int arrayLow = 1;
    public int arrayHigh = 32;

    public GroupRule() {}
    public GroupRule(String name, String description) {
      this.name = name;
      this.description = description;
    }

    GroupRule implementation(String implementationType, String dataType, String arrayName, int arrayLow, int arrayHigh) {
      this.implementationType = implementationType;
      this.dataType = dataType;
      this.arrayName = arrayName;
      this.arrayLow = arrayLow;
      this.arrayHigh = arrayHigh;
      return this;
    }
    GroupRule constraints(boolean requiresConditions, int maxConditions) {
      this.requiresConditions = requiresConditions;
      this.maxConditions = maxConditions;
      return this;
    }
    GroupRule include(String... regexes) {
      patterns.addAll(List.of(regexes));
      return this;
    }
    GroupRule exclude(String... regexes) {
      excludePatterns.addAll(List.of(regexes));
      return this;
    }

    public GroupRule copy() {
      GroupRule ret = new GroupRule(name, description);
      ret.patterns = new ArrayList<>(patterns);
      ret.excludePatterns = new ArrayList<>(excludePatterns);
      ret.requiresConditions = requiresConditions;
      ret.maxConditions = maxConditions;
      ret.implementationType = implementationType;
      ret.dataType = dataType;
      ret.arrayName = arrayName;
      ret.arrayLow = arrayLow;
      ret.arrayHigh = arrayHigh;
      return ret;
    }
  }

  /** Constraints for one step type (REST or sequential steps). */
  public static class StepRule {
    public boolean allowsEntryConditions = true;
    public boolean allowsExitConditions = true;
    public boolean allowsTransitions = true;
    public boolean requiresConditions = false;
    public int maxConditions = 20;
    public EnumSet<ConditionKind> allowedConditionKinds = EnumSet.allOf(ConditionKind.class);

    public StepRule copy() {
      StepRule ret = new StepRule();
      ret.allowsEntryConditions = allowsEntryConditions;
      ret.allowsExitConditions = allowsExitConditions;
      ret.allowsTransitions = allowsTransitions;
      ret.requiresConditions = requiresConditions;
      ret.maxConditions = maxConditions;
      ret.allowedConditionKinds = EnumSet.copyOf(allowedConditionKinds);
      return ret;
    }
  }

  /** Groups in evaluation order. */
  public LinkedHashMap<String, GroupRule> groups = new LinkedHashMap<>();
  /** Group assigned when no group pattern matches. */
  public String defaultGroup = "hulpmerker";

  public StepRule restRule = new StepRule();
  public StepRule sequentialRule = new StepRule();

  public CrossReferenceMode crossReferenceMode = CrossReferenceMode.LENIENT;
  /** Upper limit for timer durations, in seconds. */
  public int maxTimerSeconds = 3600;

  public static ValidationRules defaults() {
    ValidationRules rules = new ValidationRules();
    rules.putGroup(new GroupRule("hulpmerker", "Standard auxiliary markers (Bool type)")
                       .include("^[a-zA-Z][a-zA-Z0-9_]*\\s*=\\s*$", "^[^:]+\\s*=\\s*$",
                                "^(Freigabe|Start|Aktuell|Aktuelle)\\s+(.+)\\s*=$",
                                "^(Einfuhr|Ausfuhr|Füllen|Entleeren|Umschwimmen)\\s+(.+)\\s*=$",
                                "^(Wartereihe|Beschäftigt|Gestartet|Fertig|Aktiv)\\s+(.+)\\s*=$",
                                "^[^=]*\\b(Freigabe|Release|Enable|Enabled)\\b[^=]*\\s*=\\s*$",
                                "^[^=]*\\b(Bereit|Ready|Aktiv|Active|Available|Besetzt|Occupied)\\b[^=]*\\s*=\\s*$")
                       .exclude("^STORING:", "^MELDING:", "^TIJD\\s*=", "^Teller\\s*=", "^Variabele\\s*=",
                                "(?iu)\\b(Störung|Fault|Alarm|Error|Fehler)\\b", "(?iu)\\b(Melding|Meldung|Message|Nachricht)\\b")
                       .constraints(true, 20)
                       .implementation("coil", "Bool", "Hulp", 1, 32));
    rules.putGroup(new GroupRule("storing", "Fault/alarm variables (Bool type)")
                       .include("^STORING:\\s*[^=]+\\s*=\\s*$", "^STÖRUNG:\\s*[^=]+\\s*=\\s*$", "^FAULT:\\s*[^=]+\\s*=\\s*$",
                                "(?iu)^[^=]*\\b(Störung|Fault|Alarm|Error|Fehler)\\b[^=]*\\s*(=\\s*)?$")
                       .constraints(true, 10)
                       .implementation("coil", "Bool", "Storing", 1, 32));
    rules.putGroup(new GroupRule("melding", "Notification/message variables (Bool type)")
                       .include("^MELDING:\\s*[^=]+\\s*=\\s*$", "^MELDUNG:\\s*[^=]+\\s*=\\s*$", "^MESSAGE:\\s*[^=]+\\s*=\\s*$",
                                "(?iu)^[^=]*\\b(Melding|Meldung|Message|Nachricht)\\b[^=]*\\s*(=\\s*)?$")
                       .constraints(true, 10)
                       .implementation("coil", "Bool", "Melding", 1, 32));
    rules.putGroup(new GroupRule("tijd", "Timer variables (Time type)")
                       .include("^TIJD\\s*=\\s*[^=]+$", "^ZEIT\\s*=\\s*[^=]+$", "^TIME\\s*=\\s*[^=]+$")
                       .constraints(false, 0)
                       .implementation("timer", "IEC_TIMER", "Tijd", 1, 10));
    rules.putGroup(new GroupRule("teller", "Counter variables (Int type)")
                       .include("^Teller\\s*=\\s*[^=]+$", "^TELLER\\s*=\\s*[^=]+$", "^COUNTER\\s*=\\s*[^=]+$",
                                "^ZÄHLER\\s*=\\s*[^=]+$")
                       .constraints(false, 0)
                       .implementation("counter", "Int", "Teller", 1, 10));
    rules.putGroup(new GroupRule("variabele", "General integer variables (Int type)")
                       .include("^Variabele\\s*=\\s*[^=]+$", "^VARIABLE\\s*=\\s*[^=]+$", "^VARIABELE\\s*=\\s*[^=]+$")
                       .constraints(false, 0)
                       .implementation("variable", "Int", "Variable", 1, 32));

    rules.restRule.allowsTransitions = false;
    rules.restRule.maxConditions = 10;
    rules.sequentialRule.maxConditions = 20;
    return rules;
  }

  /**
   * Adds a group or replaces the group with the same name, keeping its position.
   * @param group the group rule
   */
  public void putGroup(GroupRule group) {
    if (group.name == null || group.name.isEmpty())
      throw new IllegalArgumentException("group name must not be empty");
    groups.put(group.name.toLowerCase(Locale.ROOT), group);
  }

  public Optional<GroupRule> getGroup(String name) {
    if (name == null)
      return Optional.empty();
    return Optional.ofNullable(groups.get(name.toLowerCase(Locale.ROOT)));
  }

  public ValidationRules copy() {
    ValidationRules ret = new ValidationRules();
    groups.values().forEach(group -> ret.putGroup(group.copy()));
    ret.defaultGroup = defaultGroup;
    ret.restRule = restRule.copy();
    ret.sequentialRule = sequentialRule.copy();
    ret.crossReferenceMode = crossReferenceMode;
    ret.maxTimerSeconds = maxTimerSeconds;
    return ret;
  }
}
