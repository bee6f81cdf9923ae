package com.gentoro.onepress.datasource.item;

/** Named paths of an item. Both always use {@code /} as separator. */
public enum PathSnapshot {
  /** Path relative to the scan root; always present. */
  RELATIVE,
  /** Absolute filesystem path; present only for binary items. */
  SOURCE
}
