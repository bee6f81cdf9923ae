package com.gentoro.onepress.datasource.attributes;

import com.gentoro.onepress.datasource.item.AttributeValue;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of attribute extraction for one file.
 *
 * @param attributes parsed attributes in declaration order; empty if none were found.
 * @param body text with the frontmatter removed, or {@code null} when frontmatter was not looked
 *     at (sidecar present, or binary file).
 * @param source where the attributes came from.
 */
public record ExtractedAttributes(
    Map<String, AttributeValue> attributes, String body, Source source) {

  public enum Source {
    SIDECAR,
    FRONTMATTER,
    NONE
  }

  public Optional<String> bodyIfStripped() {
    return Optional.ofNullable(body);
  }
}
