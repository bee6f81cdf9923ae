package com.gentoro.onepress;

import com.gentoro.onepress.datasource.item.Item;
import java.util.Map;

/**
 * Counts describing one ingestion run.
 *
 * @param datedItems content items whose file name follows the {@code yyyy-mm-dd-title} pattern.
 */
public record IngestionSummary(
    int contentItems, int layouts, int includes, int binaryItems, int datedItems) {

  public static IngestionSummary of(
      Map<String, Item> items, Map<String, Item> layouts, Map<String, Item> includes) {
    int binary = 0;
    int dated = 0;
    for (Item item : items.values()) {
      if (item.isBinary()) binary++;
      if (item.attributes().containsKey(Item.ATTR_TITLE_PATH)) dated++;
    }
    return new IngestionSummary(items.size(), layouts.size(), includes.size(), binary, dated);
  }
}
