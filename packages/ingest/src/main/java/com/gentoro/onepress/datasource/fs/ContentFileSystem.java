package com.gentoro.onepress.datasource.fs;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Filesystem operations needed by the ingestion pipeline. Implementations throw {@link
 * com.gentoro.onepress.exception.IoException} on access failures.
 */
public interface ContentFileSystem {

  boolean isDirectory(Path path);

  boolean isRegularFile(Path path);

  /**
   * Lists every regular file below {@code directory}, recursively. Order is unspecified.
   *
   * @param directory an existing directory.
   * @return absolute or root-anchored paths of the files found.
   */
  List<Path> listFiles(Path directory);

  /**
   * Reads the whole file as UTF-8 text. Byte sequences that are not valid UTF-8 become U+FFFD;
   * they do not make the read fail.
   */
  String readString(Path file);

  Instant lastModified(Path file);

  /** Absolute path with symbolic links resolved, used as the source path of binary items. */
  Path toRealPath(Path file);
}
