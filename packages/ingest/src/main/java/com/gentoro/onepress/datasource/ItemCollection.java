package com.gentoro.onepress.datasource;

import com.gentoro.onepress.datasource.item.Item;
import com.gentoro.onepress.datasource.item.ItemRole;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Items of one role keyed by id, in the order they were first added.
 *
 * <p>Replacement policy: adding an item whose id is already present replaces the earlier item
 * (last write wins) and keeps the original position. This happens when an {@code include}
 * directory or file yields the same relative path as the regular content scan; the later source
 * in walk order wins.
 */
public final class ItemCollection {
  private static final org.slf4j.Logger log =
      com.gentoro.onepress.logging.LoggingService.getLogger(ItemCollection.class);

  private final ItemRole role;
  private final Map<String, Item> items = new LinkedHashMap<>();

  public ItemCollection(ItemRole role) {
    this.role = role;
  }

  /**
   * Adds {@code item}, replacing any item with the same id.
   *
   * @return the replaced item, if any.
   */
  public Optional<Item> put(Item item) {
    if (item.role() != role) {
      throw new IllegalArgumentException(
          "Cannot add %s item %s to the %s collection".formatted(item.role(), item.id(), role));
    }
    Item previous = items.put(item.id(), item);
    if (previous != null) {
      log.debug("{} item '{}' replaced by a later file with the same id", role, item.id());
    }
    return Optional.ofNullable(previous);
  }

  public ItemRole role() {
    return role;
  }

  public int size() {
    return items.size();
  }

  /** Read-only view of the items keyed by id. */
  public Map<String, Item> asMap() {
    return Collections.unmodifiableMap(items);
  }
}
