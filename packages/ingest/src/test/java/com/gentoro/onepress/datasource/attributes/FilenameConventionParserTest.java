package com.gentoro.onepress.datasource.attributes;

import static org.assertj.core.api.Assertions.assertThat;

import com.gentoro.onepress.datasource.item.AttributeValue;
import com.gentoro.onepress.datasource.item.Item;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FilenameConventionParserTest {

  private final FilenameConventionParser parser = new FilenameConventionParser();

  @Test
  void parsesDatedName() {
    DatedFilename dated = parser.parse("2020-05-01-hello-world").orElseThrow();

    assertThat(dated.date()).isEqualTo("2020-05-01");
    assertThat(dated.titlePath()).isEqualTo("hello-world");
    assertThat(dated.title()).isEqualTo("hello world");
  }

  @Test
  void matchIsAnchoredAtBothEnds() {
    assertThat(parser.parse("notes-2020-05-01-hello")).isEmpty();
    assertThat(parser.parse("v2020-05-01-x")).isEmpty();
  }

  @Test
  void requiresNonEmptyRemainder() {
    assertThat(parser.parse("2020-05-01-")).isEmpty();
    assertThat(parser.parse("2020-05-01")).isEmpty();
    assertThat(parser.parse("2020-5-01-short-month")).isEmpty();
  }

  @Test
  void applyAddsDerivedAttributes() {
    Map<String, AttributeValue> attrs = new LinkedHashMap<>();

    parser.apply("2019-12-31-new-year", attrs);

    assertThat(attrs)
        .containsEntry(Item.ATTR_TITLE_PATH, AttributeValue.of("new-year"))
        .containsEntry(Item.ATTR_TITLE, AttributeValue.of("new year"))
        .containsEntry(Item.ATTR_DATE, AttributeValue.of("2019-12-31"));
  }

  @Test
  void explicitTitleAndDateWin() {
    Map<String, AttributeValue> attrs = new LinkedHashMap<>();
    attrs.put(Item.ATTR_TITLE, AttributeValue.of("Explicit"));
    attrs.put(Item.ATTR_DATE, AttributeValue.of("2001-01-01"));

    parser.apply("2019-12-31-new-year", attrs);

    assertThat(attrs)
        .containsEntry(Item.ATTR_TITLE, AttributeValue.of("Explicit"))
        .containsEntry(Item.ATTR_DATE, AttributeValue.of("2001-01-01"))
        .containsEntry(Item.ATTR_TITLE_PATH, AttributeValue.of("new-year"));
  }

  @Test
  void plainNameAddsNothing() {
    Map<String, AttributeValue> attrs = new LinkedHashMap<>();

    parser.apply("about", attrs);

    assertThat(attrs).isEmpty();
  }
}
