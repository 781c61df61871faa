package stepnet.frontend;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Block type and number of the program header, e.g. {@code FB102}.
 * @param type "FB" or "FC"
 * @param number the block number
 */
public record BlockTag(String type, int number) {
  private static final Pattern tagPattern = Pattern.compile("^(FB|FC)(\\d+)$", Pattern.CASE_INSENSITIVE);

  public static Optional<BlockTag> parse(String text) {
    if (text == null)
      return Optional.empty();
    Matcher matcher = tagPattern.matcher(text.trim());
    if (!matcher.matches())
      return Optional.empty();
    try {
      return Optional.of(new BlockTag(matcher.group(1).toUpperCase(), Integer.parseInt(matcher.group(2))));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  @Override
  public String toString() {
    return type + number;
  }
}
