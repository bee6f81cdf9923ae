package com.gentoro.onepress.datasource.item;

/** Which source root an item comes from, and so which collection it lands in. */
public enum ItemRole {
  CONTENT("content"),
  LAYOUT("layouts"),
  INCLUDE("includes");

  private final String directory;

  ItemRole(String directory) {
    this.directory = directory;
  }

  /** Name of the directory under the source root that holds items of this role. */
  public String directory() {
    return directory;
  }
}
