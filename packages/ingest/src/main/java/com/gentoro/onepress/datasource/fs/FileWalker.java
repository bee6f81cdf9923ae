package com.gentoro.onepress.datasource.fs;

import com.gentoro.onepress.datasource.DataSourceConfig;
import com.gentoro.onepress.datasource.item.ItemRole;
import com.gentoro.onepress.exception.IoException;
import com.gentoro.onepress.utility.StringUtility;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Enumerates the files of the three source roots.
 *
 * <p>Content: every file under {@code content/} and under each directory listed in {@code
 * include}, minus sidecar files and minus anything whose relative path contains an {@code exclude}
 * entry. Files listed individually in {@code include} are appended as they are. Layouts and
 * includes: every file of their directory; a missing directory yields nothing.
 *
 * <p>Within a scan root files are returned sorted by relative path so that runs are repeatable.
 */
public class FileWalker {
  private static final org.slf4j.Logger log =
      com.gentoro.onepress.logging.LoggingService.getLogger(FileWalker.class);

  private final DataSourceConfig config;
  private final ContentFileSystem fileSystem;

  public FileWalker(DataSourceConfig config, ContentFileSystem fileSystem) {
    this.config = config;
    this.fileSystem = fileSystem;
  }

  public List<SourceFile> walk(ItemRole role) {
    return switch (role) {
      case CONTENT -> walkContent();
      case LAYOUT, INCLUDE -> walkOptionalRoot(role);
    };
  }

  private List<SourceFile> walkContent() {
    Path contentRoot = rootOf(ItemRole.CONTENT);
    if (!fileSystem.isDirectory(contentRoot)) {
      throw new IoException(
          "Content directory not found: " + contentRoot, Map.of("path", contentRoot.toString()));
    }

    List<Path> scanRoots = new ArrayList<>();
    List<SourceFile> forced = new ArrayList<>();
    scanRoots.add(contentRoot);

    for (String entry : config.include()) {
      Path path = resolveIncluded(entry);
      if (path == null) continue;
      if (fileSystem.isDirectory(path)) {
        scanRoots.add(path);
      } else if (fileSystem.isRegularFile(path)) {
        forced.add(
            new SourceFile(
                path, path.getParent(), path.getFileName().toString(), ItemRole.CONTENT));
      } else {
        log.debug("Include entry '{}' is neither a file nor a directory, skipping", entry);
      }
    }

    List<SourceFile> out = new ArrayList<>();
    for (Path scanRoot : scanRoots) {
      out.addAll(scan(scanRoot, ItemRole.CONTENT, true));
    }
    out.addAll(forced);
    return out;
  }

  private List<SourceFile> walkOptionalRoot(ItemRole role) {
    Path root = rootOf(role);
    if (!fileSystem.isDirectory(root)) {
      log.debug("No {} directory at {}, nothing to load", role.directory(), root);
      return List.of();
    }
    return scan(root, role, false);
  }

  private List<SourceFile> scan(Path scanRoot, ItemRole role, boolean contentRules) {
    List<SourceFile> found = new ArrayList<>();
    for (Path file : fileSystem.listFiles(scanRoot)) {
      String relative = StringUtility.normalizeSeparators(scanRoot.relativize(file).toString());
      if (contentRules) {
        if (relative.endsWith(SourceFile.SIDECAR_SUFFIX)) continue;
        if (isExcluded(relative)) {
          log.trace("Excluding {}", relative);
          continue;
        }
      }
      found.add(new SourceFile(file, scanRoot, relative, role));
    }
    found.sort(Comparator.comparing(SourceFile::relativePath));
    return found;
  }

  private boolean isExcluded(String relativePath) {
    for (String entry : config.exclude()) {
      String pattern = StringUtility.normalizeSeparators(entry);
      if (relativePath.contains(pattern)) {
        return true;
      }
    }
    return false;
  }

  private Path resolveIncluded(String entry) {
    try {
      Path path = Path.of(entry);
      return path.isAbsolute() ? path : config.sourceRoot().resolve(path);
    } catch (InvalidPathException e) {
      log.warn("Include entry '{}' is not a valid path, skipping", entry);
      return null;
    }
  }

  private Path rootOf(ItemRole role) {
    return config.sourceRoot().resolve(role.directory());
  }
}
