package com.gentoro.onepress.datasource.fs;

import java.util.Locale;
import java.util.Set;

/**
 * Splits a file name into name and extension.
 *
 * <p>Text extensions may span several dots ({@code html.twig}); the longest configured extension
 * the name ends with wins. Otherwise the extension is whatever follows the last dot. Extensions
 * are always reported lower-cased.
 *
 * @param fileName the full file name.
 * @param name file name without its extension.
 * @param extension lower-cased extension without leading dot; empty if none.
 * @param textExtension whether {@code extension} is one of the configured text extensions.
 */
public record FileInfo(String fileName, String name, String extension, boolean textExtension) {

  public static FileInfo of(String fileName, Set<String> textExtensions) {
    String lower = fileName.toLowerCase(Locale.ROOT);

    String matched = null;
    for (String ext : textExtensions) {
      if (lower.length() > ext.length() + 1
          && lower.endsWith("." + ext)
          && (matched == null || ext.length() > matched.length())) {
        matched = ext;
      }
    }
    if (matched != null) {
      String name = fileName.substring(0, fileName.length() - matched.length() - 1);
      return new FileInfo(fileName, name, matched, true);
    }

    int dot = fileName.lastIndexOf('.');
    if (dot <= 0 || dot == fileName.length() - 1) {
      return new FileInfo(fileName, fileName, "", false);
    }
    // a configured extension would have matched above
    return new FileInfo(fileName, fileName.substring(0, dot), lower.substring(dot + 1), false);
  }
}
