package com.gentoro.onepress.datasource.item;

/** Named states of an item's text. */
public enum ContentSnapshot {
  /** Text as read from disk. Empty for binary items. */
  RAW,
  /** Text with the frontmatter block removed; present only when frontmatter extraction ran. */
  BODY
}
