package com.gentoro.onepress.datasource.fs;

import com.gentoro.onepress.datasource.item.ItemRole;
import com.gentoro.onepress.utility.StringUtility;
import java.nio.file.Path;

/**
 * A file selected by the {@link FileWalker}.
 *
 * @param file path of the file itself.
 * @param scanRoot directory the file was found under; sidecars are resolved against it.
 * @param relativePath forward-slash path relative to {@code scanRoot}; becomes the item id.
 * @param role collection the file belongs to.
 */
public record SourceFile(Path file, Path scanRoot, String relativePath, ItemRole role) {

  public static final String SIDECAR_SUFFIX = ".meta";

  /** Name of the file, extension included. */
  public String fileName() {
    return StringUtility.baseName(relativePath);
  }

  /** Forward-slash directory of the file relative to its scan root; empty at the top level. */
  public String relativeDirectory() {
    return StringUtility.parentOf(relativePath);
  }

  /** Location of the sidecar attribute file for this file, whether or not it exists. */
  public Path sidecar() {
    return scanRoot.resolve(relativePath + SIDECAR_SUFFIX);
  }
}
