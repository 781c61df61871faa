package stepnet.drc;

import java.util.regex.Pattern;
import stepnet.config.ValidationRules;
import stepnet.config.ValidationRules.GroupRule;
import stepnet.util.PatternCache;

/**
 * Assigns a variable group from the ordered group rules. A group is skipped if any of its exclude patterns matches; otherwise the
 * first group with a matching include pattern wins. Without a match, the default group is used.
 */
public class VariableGroupClassifier {
  private final ValidationRules rules;
  private final PatternCache patterns;

  public VariableGroupClassifier(ValidationRules rules, PatternCache patterns) {
    this.rules = rules;
    this.patterns = patterns;
  }

  /**
   * @param declarationText the declaration in canonical form, e.g. {@code STORING: Motor =}
   * @return the group name
   */
  public String classify(String declarationText) {
    for (GroupRule group : rules.groups.values()) {
      if (group.excludePatterns.stream().anyMatch(regex -> find(regex, declarationText)))
        continue;
      if (group.patterns.stream().anyMatch(regex -> find(regex, declarationText)))
        return group.name;
    }
    return rules.defaultGroup;
  }

  private boolean find(String regex, String text) {
    Pattern pattern = patterns.get(regex);
    return pattern.matcher(text).find();
  }
}
