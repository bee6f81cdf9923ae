package com.gentoro.onepress.datasource.fs;

import com.gentoro.onepress.exception.ExceptionUtil;
import com.gentoro.onepress.exception.IoException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** {@link ContentFileSystem} backed by the default NIO filesystem. */
public class LocalContentFileSystem implements ContentFileSystem {

  @Override
  public boolean isDirectory(Path path) {
    return Files.isDirectory(path);
  }

  @Override
  public boolean isRegularFile(Path path) {
    return Files.isRegularFile(path);
  }

  @Override
  public List<Path> listFiles(Path directory) {
    try (Stream<Path> paths = Files.walk(directory)) {
      return paths.filter(Files::isRegularFile).collect(Collectors.toList());
    } catch (Exception e) {
      // Files.walk reports errors met while iterating as UncheckedIOException
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          ex ->
              new IoException(
                  "Failed to list files under: " + directory,
                  Map.of("path", directory.toString()),
                  ex));
    }
  }

  @Override
  public String readString(Path file) {
    try {
      // malformed UTF-8 decodes to U+FFFD instead of failing the read
      return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to read file: " + file, Map.of("path", file.toString()), e);
    }
  }

  @Override
  public Instant lastModified(Path file) {
    try {
      return Files.getLastModifiedTime(file).toInstant();
    } catch (IOException e) {
      throw new IoException(
          "Failed to read modification time of: " + file, Map.of("path", file.toString()), e);
    }
  }

  @Override
  public Path toRealPath(Path file) {
    try {
      return file.toRealPath();
    } catch (IOException e) {
      throw new IoException(
          "Failed to resolve real path of: " + file, Map.of("path", file.toString()), e);
    }
  }
}
