package com.gentoro.onepress.datasource.attributes;

import com.gentoro.onepress.datasource.item.AttributeValue;
import com.gentoro.onepress.datasource.item.Item;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises date-prefixed file names such as {@code 2020-05-01-hello-world}. The whole name must
 * match; {@code notes-2020-05-01-x} is not dated.
 */
public class FilenameConventionParser {
  private static final Pattern DATED_NAME = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})-(.+)$");

  /**
   * @param name file name without its extension.
   */
  public Optional<DatedFilename> parse(String name) {
    Matcher matcher = DATED_NAME.matcher(name);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    return Optional.of(
        new DatedFilename(matcher.group(1), matcher.group(2), matcher.group(3), matcher.group(4)));
  }

  /**
   * Adds {@code title_path} for a dated name, and {@code title} and {@code date} unless the
   * attributes already define them.
   */
  public void apply(String name, Map<String, AttributeValue> attributes) {
    parse(name)
        .ifPresent(
            dated -> {
              attributes.put(Item.ATTR_TITLE_PATH, AttributeValue.of(dated.titlePath()));
              attributes.putIfAbsent(Item.ATTR_TITLE, AttributeValue.of(dated.title()));
              attributes.putIfAbsent(Item.ATTR_DATE, AttributeValue.of(dated.date()));
            });
  }
}
