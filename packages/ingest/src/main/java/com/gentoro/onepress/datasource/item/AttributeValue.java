package com.gentoro.onepress.datasource.item;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value of an item attribute.
 *
 * <p>Attribute documents are free-form, so a value is one of: string, number, boolean, null, an
 * ordered list of values or an ordered map of values. Lists and maps keep the order in which
 * entries were declared, which the rendering stage relies on.
 */
public interface AttributeValue {

  /** Converts back to plain Java objects (String, Number, Boolean, null, List, Map). */
  Object toPlain();

  static AttributeValue of(String value) {
    return new StringValue(value);
  }

  static AttributeValue of(List<String> values) {
    List<AttributeValue> out = new ArrayList<>(values.size());
    values.forEach(v -> out.add(new StringValue(v)));
    return new ListValue(out);
  }

  /** Converts a parsed Jackson tree (JSON or YAML) into an attribute value. */
  static AttributeValue fromJson(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return NullValue.INSTANCE;
    }
    if (node.isObject()) {
      Map<String, AttributeValue> entries = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        entries.put(field.getKey(), fromJson(field.getValue()));
      }
      return new MapValue(entries);
    }
    if (node.isArray()) {
      List<AttributeValue> values = new ArrayList<>(node.size());
      node.forEach(child -> values.add(fromJson(child)));
      return new ListValue(values);
    }
    if (node.isBoolean()) {
      return new BooleanValue(node.booleanValue());
    }
    if (node.isNumber()) {
      return new NumberValue(node.numberValue());
    }
    return new StringValue(node.asText());
  }

  record StringValue(String value) implements AttributeValue {
    public StringValue {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Object toPlain() {
      return value;
    }
  }

  record NumberValue(Number value) implements AttributeValue {
    public NumberValue {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Object toPlain() {
      return value;
    }
  }

  record BooleanValue(boolean value) implements AttributeValue {
    @Override
    public Object toPlain() {
      return value;
    }
  }

  enum NullValue implements AttributeValue {
    INSTANCE;

    @Override
    public Object toPlain() {
      return null;
    }
  }

  record ListValue(List<AttributeValue> values) implements AttributeValue {
    public ListValue {
      values = List.copyOf(values);
    }

    @Override
    public Object toPlain() {
      List<Object> out = new ArrayList<>(values.size());
      values.forEach(v -> out.add(v.toPlain()));
      return out;
    }
  }

  record MapValue(Map<String, AttributeValue> entries) implements AttributeValue {
    public MapValue {
      // Map.copyOf would lose declaration order
      entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    @Override
    public Object toPlain() {
      Map<String, Object> out = new LinkedHashMap<>();
      entries.forEach((k, v) -> out.put(k, v.toPlain()));
      return out;
    }
  }
}
