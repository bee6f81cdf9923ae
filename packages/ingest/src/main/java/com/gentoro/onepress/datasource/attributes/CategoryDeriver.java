package com.gentoro.onepress.datasource.attributes;

import com.gentoro.onepress.datasource.item.AttributeValue;
import com.gentoro.onepress.datasource.item.Item;
import com.gentoro.onepress.datasource.item.ItemRole;
import com.gentoro.onepress.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Turns the folders below {@code posts/} into the {@code categories} of a content item. */
public class CategoryDeriver {
  static final String POSTS = "posts";

  /**
   * @param relativeDirectory forward-slash directory of the item relative to its scan root.
   * @return the categories, empty for a post directly under {@code posts/}; nothing when the item
   *     is not a post.
   */
  public Optional<List<String>> derive(String relativeDirectory) {
    if (!relativeDirectory.equals(POSTS) && !relativeDirectory.startsWith(POSTS + "/")) {
      return Optional.empty();
    }
    List<String> categories = new ArrayList<>();
    for (String segment : StringUtility.deletePrefix(relativeDirectory, POSTS).split("/")) {
      if (!segment.isEmpty()) {
        categories.add(segment);
      }
    }
    return Optional.of(categories);
  }

  /** Sets {@code categories} on content items under {@code posts/} that do not define them. */
  public void apply(
      ItemRole role, String relativeDirectory, Map<String, AttributeValue> attributes) {
    if (role != ItemRole.CONTENT || attributes.containsKey(Item.ATTR_CATEGORIES)) {
      return;
    }
    derive(relativeDirectory)
        .ifPresent(
            categories -> attributes.put(Item.ATTR_CATEGORIES, AttributeValue.of(categories)));
  }
}
