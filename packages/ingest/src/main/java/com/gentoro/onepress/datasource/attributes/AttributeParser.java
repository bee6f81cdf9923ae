package com.gentoro.onepress.datasource.attributes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.gentoro.onepress.datasource.AttributeSyntax;
import com.gentoro.onepress.datasource.item.AttributeValue;
import com.gentoro.onepress.exception.AttributeParseException;
import com.gentoro.onepress.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses attribute documents in the configured syntax and locates frontmatter blocks.
 *
 * <p>A frontmatter block starts on the very first line of a file with {@code ---} and ends at the
 * next line consisting of {@code ---}. The same delimiters are used for YAML and JSON documents.
 *
 * <p>A document holds exactly one value: text after a JSON object, or a second YAML document in a
 * sidecar, makes it malformed.
 */
public class AttributeParser {
  private static final Pattern FRONTMATTER_PATTERN =
      Pattern.compile(
          "\\A---[ \\t]*\\R(.*?)^---[ \\t]*(?:\\R|\\z)", Pattern.DOTALL | Pattern.MULTILINE);

  private final AttributeSyntax syntax;
  private final ObjectReader reader;

  public AttributeParser(AttributeSyntax syntax) {
    this.syntax = syntax;
    ObjectMapper mapper =
        switch (syntax) {
          case YAML -> JacksonUtility.getYamlMapper();
          case JSON -> JacksonUtility.getJsonMapper();
        };
    this.reader =
        mapper.readerFor(JsonNode.class).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  public AttributeSyntax syntax() {
    return syntax;
  }

  /**
   * Parses a whole document into an ordered attribute map. A blank document yields an empty map.
   *
   * @param document the document text.
   * @param origin file the document comes from, reported on failure.
   * @throws AttributeParseException if the document is malformed or its root is not a mapping.
   */
  public Map<String, AttributeValue> parse(String document, String origin) {
    Map<String, AttributeValue> attributes = new LinkedHashMap<>();
    if (document == null || document.isBlank()) {
      return attributes;
    }

    JsonNode root;
    try {
      root = reader.readTree(document);
    } catch (JsonProcessingException | RuntimeException e) {
      // the YAML engine may surface its own unchecked exceptions
      throw new AttributeParseException(
          origin, "Malformed %s attributes in %s".formatted(syntax.name(), origin), e);
    }

    // YAML made only of comments parses to nothing
    if (root == null || root.isMissingNode() || root.isNull()) {
      return attributes;
    }
    if (!root.isObject()) {
      throw new AttributeParseException(
          origin,
          "Attributes in %s must be a mapping, found %s".formatted(origin, root.getNodeType()));
    }
    root.fields()
        .forEachRemaining(e -> attributes.put(e.getKey(), AttributeValue.fromJson(e.getValue())));
    return attributes;
  }

  /** Splits {@code content} into frontmatter document and body, if it starts with a block. */
  public Optional<Frontmatter> findFrontmatter(String content) {
    Matcher matcher = FRONTMATTER_PATTERN.matcher(content);
    if (!matcher.find()) {
      return Optional.empty();
    }
    return Optional.of(new Frontmatter(matcher.group(1), content.substring(matcher.end())));
  }

  /**
   * A frontmatter block split from its file.
   *
   * @param document the text between the delimiters.
   * @param body the text following the closing delimiter line.
   */
  public record Frontmatter(String document, String body) {}
}
