package com.gentoro.onepress.datasource.item;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One ingested file: its text snapshots, its paths and its attributes.
 *
 * <p>Items are built once through {@link Builder} and never change afterwards. Reserved attribute
 * keys are listed as constants on this class.
 */
public final class Item {
  public static final String ATTR_MTIME = "mtime";
  public static final String ATTR_FILENAME = "filename";
  public static final String ATTR_EXTENSION = "extension";
  public static final String ATTR_TITLE = "title";
  public static final String ATTR_TITLE_PATH = "title_path";
  public static final String ATTR_DATE = "date";
  public static final String ATTR_CATEGORIES = "categories";

  private final String id;
  private final ItemRole role;
  private final boolean binary;
  private final Map<ContentSnapshot, String> contents;
  private final Map<PathSnapshot, String> paths;
  private final Map<String, AttributeValue> attributes;

  private Item(Builder builder) {
    this.id = Objects.requireNonNull(builder.id, "id");
    this.role = Objects.requireNonNull(builder.role, "role");
    this.binary = builder.binary;
    this.contents = Collections.unmodifiableMap(new EnumMap<>(builder.contents));
    this.paths = Collections.unmodifiableMap(new EnumMap<>(builder.paths));
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    if (!paths.containsKey(PathSnapshot.RELATIVE)) {
      throw new IllegalArgumentException("Item " + id + " has no relative path");
    }
  }

  public static Builder builder(String id, ItemRole role) {
    return new Builder(id, role);
  }

  /** Forward-slash path relative to the scan root; the key in the owning collection. */
  public String id() {
    return id;
  }

  public ItemRole role() {
    return role;
  }

  public boolean isBinary() {
    return binary;
  }

  /**
   * Effective text: {@link ContentSnapshot#BODY} when present, {@link ContentSnapshot#RAW}
   * otherwise.
   */
  public String content() {
    String body = contents.get(ContentSnapshot.BODY);
    return body != null ? body : contents.getOrDefault(ContentSnapshot.RAW, "");
  }

  public Optional<String> content(ContentSnapshot snapshot) {
    return Optional.ofNullable(contents.get(snapshot));
  }

  public Optional<String> path(PathSnapshot snapshot) {
    return Optional.ofNullable(paths.get(snapshot));
  }

  public String relativePath() {
    return paths.get(PathSnapshot.RELATIVE);
  }

  /** Absolute source path, set for binary items so their bytes can be streamed later. */
  public Optional<String> sourcePath() {
    return path(PathSnapshot.SOURCE);
  }

  /** Attributes in insertion order. */
  public Map<String, AttributeValue> attributes() {
    return attributes;
  }

  public Optional<AttributeValue> attribute(String key) {
    return Optional.ofNullable(attributes.get(key));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Item other)) return false;
    return binary == other.binary
        && id.equals(other.id)
        && role == other.role
        && contents.equals(other.contents)
        && paths.equals(other.paths)
        && attributes.equals(other.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, role, binary, contents, paths, attributes);
  }

  @Override
  public String toString() {
    return "Item{"
        + "id='"
        + id
        + '\''
        + ", role="
        + role
        + ", binary="
        + binary
        + ", contentLength="
        + content().length()
        + ", attributes="
        + attributes.keySet()
        + '}';
  }

  public static final class Builder {
    private final String id;
    private final ItemRole role;
    private boolean binary;
    private final Map<ContentSnapshot, String> contents = new EnumMap<>(ContentSnapshot.class);
    private final Map<PathSnapshot, String> paths = new EnumMap<>(PathSnapshot.class);
    private final Map<String, AttributeValue> attributes = new LinkedHashMap<>();

    private Builder(String id, ItemRole role) {
      this.id = id;
      this.role = role;
    }

    public Builder binary(boolean binary) {
      this.binary = binary;
      return this;
    }

    public Builder content(ContentSnapshot snapshot, String content) {
      contents.put(snapshot, Objects.requireNonNull(content, "content"));
      return this;
    }

    public Builder path(PathSnapshot snapshot, String path) {
      paths.put(snapshot, Objects.requireNonNull(path, "path"));
      return this;
    }

    public Builder attributes(Map<String, AttributeValue> values) {
      attributes.putAll(values);
      return this;
    }

    public Item build() {
      return new Item(this);
    }
  }
}
