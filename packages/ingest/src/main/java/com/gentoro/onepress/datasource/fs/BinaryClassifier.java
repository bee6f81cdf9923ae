package com.gentoro.onepress.datasource.fs;

import java.util.Set;

/** A file is binary unless its extension is one of the configured text extensions. */
public class BinaryClassifier {
  private final Set<String> textExtensions;

  public BinaryClassifier(Set<String> textExtensions) {
    this.textExtensions = Set.copyOf(textExtensions);
  }

  public FileInfo describe(String fileName) {
    return FileInfo.of(fileName, textExtensions);
  }

  public boolean isBinary(String fileName) {
    return !describe(fileName).textExtension();
  }
}
