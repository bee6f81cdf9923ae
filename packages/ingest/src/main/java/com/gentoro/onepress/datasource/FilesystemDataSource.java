package com.gentoro.onepress.datasource;

import com.gentoro.onepress.datasource.attributes.AttributeExtractor;
import com.gentoro.onepress.datasource.attributes.AttributeParser;
import com.gentoro.onepress.datasource.attributes.CategoryDeriver;
import com.gentoro.onepress.datasource.attributes.FilenameConventionParser;
import com.gentoro.onepress.datasource.fs.BinaryClassifier;
import com.gentoro.onepress.datasource.fs.ContentFileSystem;
import com.gentoro.onepress.datasource.fs.FileWalker;
import com.gentoro.onepress.datasource.fs.LocalContentFileSystem;
import com.gentoro.onepress.datasource.fs.SourceFile;
import com.gentoro.onepress.datasource.item.Item;
import com.gentoro.onepress.datasource.item.ItemRole;
import com.gentoro.onepress.exception.StateException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Filesystem data source: reads a site source root into three collections of {@link Item}s.
 *
 * <p>Source-root structure:
 *
 * <pre>
 * |- content
 * | |- posts
 * | |- index.html
 * | |- index.html.meta   (optional attributes of index.html)
 * |- layouts
 * |- includes
 * </pre>
 *
 * <p>Usage is configure, then process, then read: {@link #configure()} prepares the pipeline,
 * {@link #process()} performs one full pass, and {@link #items()}, {@link #layouts()} and {@link
 * #includes()} return what the pass produced. Binary items do not have their content loaded;
 * their source path points at the file instead.
 *
 * <p>Every item receives {@code mtime}, {@code filename} and {@code extension}. Content and layout
 * items also get their explicit attributes (sidecar or frontmatter), {@code title}, {@code
 * title_path} and {@code date} for {@code yyyy-mm-dd-title} file names, and content items below
 * {@code posts/} get {@code categories}.
 *
 * <p>Not thread-safe. A failed pass leaves no readable collections.
 */
public class FilesystemDataSource {
  private static final org.slf4j.Logger log =
      com.gentoro.onepress.logging.LoggingService.getLogger(FilesystemDataSource.class);

  private final DataSourceConfig config;
  private final ContentFileSystem fileSystem;

  private FileWalker walker;
  private ItemAssembler assembler;
  private Map<ItemRole, ItemCollection> collections;
  private boolean processed;

  public FilesystemDataSource(DataSourceConfig config) {
    this(config, new LocalContentFileSystem());
  }

  public FilesystemDataSource(DataSourceConfig config, ContentFileSystem fileSystem) {
    this.config = config;
    this.fileSystem = fileSystem;
  }

  public DataSourceConfig config() {
    return config;
  }

  /** Builds the pipeline for the configured attribute syntax and clears previous results. */
  public void configure() {
    log.info(
        "Configuring data source at {} (syntax={}, text extensions={})",
        config.sourceRoot(),
        config.attributeSyntax(),
        config.textExtensions());
    AttributeParser parser = new AttributeParser(config.attributeSyntax());
    this.walker = new FileWalker(config, fileSystem);
    this.assembler =
        new ItemAssembler(
            fileSystem,
            new BinaryClassifier(config.textExtensions()),
            new AttributeExtractor(parser, fileSystem),
            new FilenameConventionParser(),
            new CategoryDeriver(),
            config.timezone());
    this.collections = null;
    this.processed = false;
  }

  /**
   * Walks content, layouts and includes and assembles their items. Each call starts from empty
   * collections.
   *
   * @throws StateException if {@link #configure()} was not called.
   * @throws com.gentoro.onepress.exception.AttributeParseException on a malformed attribute
   *     document.
   * @throws com.gentoro.onepress.exception.IoException on filesystem failures.
   */
  public void process() {
    if (walker == null) {
      throw new StateException("configure() must be called before process()");
    }
    processed = false;
    collections = null;

    Map<ItemRole, ItemCollection> result = new EnumMap<>(ItemRole.class);
    for (ItemRole role : ItemRole.values()) {
      ItemCollection collection = new ItemCollection(role);
      List<SourceFile> files = walker.walk(role);
      for (SourceFile file : files) {
        collection.put(assembler.assemble(file));
      }
      log.info(
          "Loaded {} {} item(s) from {} file(s)",
          collection.size(),
          role.directory(),
          files.size());
      result.put(role, collection);
    }

    this.collections = result;
    this.processed = true;
  }

  /** Content items keyed by id. */
  public Map<String, Item> items() {
    return collection(ItemRole.CONTENT);
  }

  /** Layout items keyed by id. */
  public Map<String, Item> layouts() {
    return collection(ItemRole.LAYOUT);
  }

  /** Include items keyed by id. */
  public Map<String, Item> includes() {
    return collection(ItemRole.INCLUDE);
  }

  private Map<String, Item> collection(ItemRole role) {
    if (!processed) {
      throw new StateException("Items are only available after a successful process()");
    }
    return collections.get(role).asMap();
  }
}
