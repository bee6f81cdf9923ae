package com.gentoro.onepress.datasource.attributes;

/**
 * Components of a {@code yyyy-mm-dd-title} file name.
 *
 * @param titlePath the part after the date, as written.
 */
public record DatedFilename(String year, String month, String day, String titlePath) {

  /** {@code yyyy-mm-dd}. */
  public String date() {
    return year + "-" + month + "-" + day;
  }

  /** The title path with dashes turned into spaces. */
  public String title() {
    return titlePath.replace('-', ' ');
  }
}
