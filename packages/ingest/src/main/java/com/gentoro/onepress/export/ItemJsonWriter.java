package com.gentoro.onepress.export;

import com.gentoro.onepress.datasource.item.ContentSnapshot;
import com.gentoro.onepress.datasource.item.Item;
import com.gentoro.onepress.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Renders items as JSON documents, mainly for inspecting what an ingestion run produced. */
public class ItemJsonWriter {

  /** Plain-object view of one item; attribute values keep their declared order and types. */
  public Map<String, Object> toPlain(Item item) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("id", item.id());
    out.put("role", item.role().name().toLowerCase(Locale.ROOT));
    out.put("binary", item.isBinary());
    out.put("relativePath", item.relativePath());
    item.sourcePath().ifPresent(p -> out.put("sourcePath", p));

    Map<String, Object> attributes = new LinkedHashMap<>();
    item.attributes().forEach((k, v) -> attributes.put(k, v.toPlain()));
    out.put("attributes", attributes);

    item.content(ContentSnapshot.BODY).ifPresent(body -> out.put("body", body));
    out.put("raw", item.content(ContentSnapshot.RAW).orElse(""));
    return out;
  }

  /**
   * @throws com.gentoro.onepress.exception.SerializationException if Jackson fails.
   */
  public String write(Map<String, Item> items) {
    List<Map<String, Object>> docs = new ArrayList<>(items.size());
    items.values().forEach(item -> docs.add(toPlain(item)));
    return JacksonUtility.toJson(docs);
  }
}
