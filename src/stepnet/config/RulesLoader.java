package stepnet.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import stepnet.config.ValidationRules.CrossReferenceMode;
import stepnet.config.ValidationRules.GroupRule;
import stepnet.config.ValidationRules.StepRule;
import stepnet.frontend.ConditionKind;

/**
 * Reads {@link SyntaxRules} and {@link ValidationRules} from YAML. Every file is applied on top of the built-in defaults, so keys
 * that are missing keep their default value. Groups are merged by name unless {@code replaceGroups: true} is given.
 */
public class RulesLoader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public SyntaxRules loadSyntax(File file) {
    try (InputStream in = new FileInputStream(file)) {
      return loadSyntax(in);
    } catch (IOException e) {
      throw new RulesFormatException("", "cannot read syntax file " + file, e);
    }
  }

  public SyntaxRules loadSyntax(InputStream in) {
    SyntaxRules syntax = SyntaxRules.defaults();
    for (var entry : readMap(in).entrySet()) {
      String key = entry.getKey().toString();
      Object value = entry.getValue();
      if (key.equals("restKeywords"))
        syntax.restKeywords = stringList(key, value);
      else if (key.equals("stepKeywords"))
        syntax.stepKeywords = stringList(key, value);
      else if (key.equals("endKeywords"))
        syntax.endKeywords = stringList(key, value);
      else if (key.equals("transitionKeyword"))
        syntax.transitionKeyword = string(key, value);
      else if (key.equals("negationKeywords"))
        syntax.negationKeywords = stringList(key, value);
      else if (key.equals("timerKeywords"))
        syntax.timerKeywords = stringList(key, value);
      else if (key.equals("markerKeywords"))
        syntax.markerKeywords = stringList(key, value);
      else if (key.equals("faultKeywords"))
        syntax.faultKeywords = stringList(key, value);
      else if (key.equals("timerUnits"))
        syntax.timerUnits = stringList(key, value);
      else if (key.equals("andPrefix"))
        syntax.andPrefix = string(key, value);
      else if (key.equals("orPrefix"))
        syntax.orPrefix = string(key, value);
      else if (key.equals("implicitConditionSignals"))
        syntax.implicitConditionSignals = integer(key, value);
      else
        logger.warn("Ignoring unknown syntax key {}", key);
    }
    if (syntax.transitionKeyword.isBlank())
      throw new RulesFormatException("transitionKeyword", "must not be empty");
    if (syntax.stepKeywords.isEmpty())
      throw new RulesFormatException("stepKeywords", "at least one step keyword is required");
    logger.debug("rules: loaded syntax with {} step keywords, {} rest keywords", syntax.stepKeywords.size(), syntax.restKeywords.size());
    return syntax;
  }

  public ValidationRules loadValidation(File file) {
    try (InputStream in = new FileInputStream(file)) {
      return loadValidation(in);
    } catch (IOException e) {
      throw new RulesFormatException("", "cannot read validation rule file " + file, e);
    }
  }

  public ValidationRules loadValidation(InputStream in) {
    ValidationRules rules = ValidationRules.defaults();
    Map<Object, Object> data = readMap(in);
    if (data.containsKey("replaceGroups") && bool("replaceGroups", data.get("replaceGroups")))
      rules.groups.clear();

    for (var entry : data.entrySet()) {
      String key = entry.getKey().toString();
      Object value = entry.getValue();
      if (key.equals("replaceGroups"))
        continue;
      if (key.equals("defaultGroup")) {
        rules.defaultGroup = string(key, value);
      } else if (key.equals("crossReferenceMode")) {
        var opt_mode = CrossReferenceMode.fromSerialName(string(key, value));
        if (opt_mode.isEmpty())
          throw new RulesFormatException(key, "expected lenient or strict, got " + value);
        rules.crossReferenceMode = opt_mode.get();
      } else if (key.equals("maxTimerSeconds")) {
        rules.maxTimerSeconds = integer(key, value);
      } else if (key.equals("restStep")) {
        applyStepRule(key, map(key, value), rules.restRule);
      } else if (key.equals("sequentialStep")) {
        applyStepRule(key, map(key, value), rules.sequentialRule);
      } else if (key.equals("groups")) {
        List<?> groups = list(key, value);
        for (int i = 0; i < groups.size(); i++)
          mergeGroup(key + "[" + i + "]", map(key + "[" + i + "]", groups.get(i)), rules);
      } else {
        logger.warn("Ignoring unknown validation rule key {}", key);
      }
    }
    if (rules.getGroup(rules.defaultGroup).isEmpty())
      logger.warn("Default group {} has no rule", rules.defaultGroup);
    logger.debug("rules: loaded {} variable groups", rules.groups.size());
    return rules;
  }

  private void mergeGroup(String path, Map<?, ?> data, ValidationRules rules) {
    if (!data.containsKey("name"))
      throw new RulesFormatException(path + ".name", "missing group name");
    String name = string(path + ".name", data.get("name"));
    if (name.isBlank())
      throw new RulesFormatException(path + ".name", "group name must not be empty");
    GroupRule group = rules.getGroup(name).map(GroupRule::copy).orElseGet(() -> new GroupRule(name, ""));

    for (var entry : data.entrySet()) {
      String key = path + "." + entry.getKey();
      Object value = entry.getValue();
      String setting = entry.getKey().toString();
      if (setting.equals("name"))
        continue;
      if (setting.equals("description"))
        group.description = string(key, value);
      else if (setting.equals("patterns"))
        group.patterns = regexList(key, value);
      else if (setting.equals("excludePatterns"))
        group.excludePatterns = regexList(key, value);
      else if (setting.equals("requiresConditions"))
        group.requiresConditions = bool(key, value);
      else if (setting.equals("maxConditions"))
        group.maxConditions = integer(key, value);
      else if (setting.equals("implementationType"))
        group.implementationType = string(key, value);
      else if (setting.equals("dataType"))
        group.dataType = string(key, value);
      else if (setting.equals("arrayName"))
        group.arrayName = string(key, value);
      else if (setting.equals("arrayLow"))
        group.arrayLow = integer(key, value);
      else if (setting.equals("arrayHigh"))
        group.arrayHigh = integer(key, value);
      else
        logger.warn("Ignoring unknown group key {}", key);
    }
    if (group.arrayLow > group.arrayHigh)
      throw new RulesFormatException(path + ".arrayLow", "array range " + group.arrayLow + ".." + group.arrayHigh + " is empty");
    rules.putGroup(group);
  }

  private void applyStepRule(String path, Map<?, ?> data, StepRule rule) {
    for (var entry : data.entrySet()) {
      String key = path + "." + entry.getKey();
      Object value = entry.getValue();
      String setting = entry.getKey().toString();
      if (setting.equals("allowsEntryConditions")) {
        rule.allowsEntryConditions = bool(key, value);
      } else if (setting.equals("allowsExitConditions")) {
        rule.allowsExitConditions = bool(key, value);
      } else if (setting.equals("allowsTransitions")) {
        rule.allowsTransitions = bool(key, value);
      } else if (setting.equals("requiresConditions")) {
        rule.requiresConditions = bool(key, value);
      } else if (setting.equals("maxConditions")) {
        rule.maxConditions = integer(key, value);
      } else if (setting.equals("allowedConditionKinds")) {
        EnumSet<ConditionKind> kinds = EnumSet.noneOf(ConditionKind.class);
        for (String kindName : stringList(key, value)) {
          var opt_kind = ConditionKind.fromSerialName(kindName);
          if (opt_kind.isEmpty())
            throw new RulesFormatException(key, "unknown condition kind " + kindName);
          kinds.add(opt_kind.get());
        }
        rule.allowedConditionKinds = kinds;
      } else {
        logger.warn("Ignoring unknown step rule key {}", key);
      }
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<Object, Object> readMap(InputStream in) {
    Object data;
    try {
      data = new Yaml().load(in);
    } catch (YAMLException e) {
      throw new RulesFormatException("", "malformed YAML: " + e.getMessage(), e);
    }
    if (data == null)
      return Map.of();
    if (!(data instanceof Map))
      throw new RulesFormatException("", "expected a mapping at top level");
    return (Map<Object, Object>)data;
  }

  private static Map<?, ?> map(String key, Object value) {
    if (value instanceof Map)
      return (Map<?, ?>)value;
    throw new RulesFormatException(key, "expected a mapping");
  }

  private static List<?> list(String key, Object value) {
    if (value instanceof List)
      return (List<?>)value;
    throw new RulesFormatException(key, "expected a list");
  }

  private static List<String> stringList(String key, Object value) {
    List<String> ret = new ArrayList<>();
    for (Object element : list(key, value))
      ret.add(string(key, element));
    return ret;
  }

  private static List<String> regexList(String key, Object value) {
    List<String> ret = stringList(key, value);
    for (String regex : ret) {
      try {
        Pattern.compile(regex);
      } catch (PatternSyntaxException e) {
        throw new RulesFormatException(key, "invalid regular expression '" + regex + "'", e);
      }
    }
    return ret;
  }

  private static String string(String key, Object value) {
    if (value instanceof String || value instanceof Number || value instanceof Boolean)
      return value.toString();
    throw new RulesFormatException(key, "expected a string");
  }

  private static int integer(String key, Object value) {
    if (value instanceof Integer)
      return (Integer)value;
    throw new RulesFormatException(key, "expected an integer");
  }

  private static boolean bool(String key, Object value) {
    if (value instanceof Boolean)
      return (Boolean)value;
    throw new RulesFormatException(key, "expected true or false");
  }
}
