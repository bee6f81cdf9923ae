package com.gentoro.onepress.utility;

import java.io.File;

public class StringUtility {

  /** Replaces the host directory separator with {@code /}. */
  public static String normalizeSeparators(String path) {
    if (path == null) return "";
    if (File.separatorChar == '/') {
      return path;
    }
    return path.replace(File.separatorChar, '/');
  }

  /** Returns {@code input} without {@code prefix}, or {@code input} unchanged if absent. */
  public static String deletePrefix(String input, String prefix) {
    if (input.startsWith(prefix)) {
      return input.substring(prefix.length());
    }
    return input;
  }

  /** Directory portion of a forward-slash path; empty for a bare file name. */
  public static String parentOf(String relativePath) {
    int idx = relativePath.lastIndexOf('/');
    return idx < 0 ? "" : relativePath.substring(0, idx);
  }

  /** Last segment of a forward-slash path. */
  public static String baseName(String relativePath) {
    int idx = relativePath.lastIndexOf('/');
    return idx < 0 ? relativePath : relativePath.substring(idx + 1);
  }
}
