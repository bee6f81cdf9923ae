package com.gentoro.onepress.datasource.attributes;

import com.gentoro.onepress.datasource.fs.ContentFileSystem;
import com.gentoro.onepress.datasource.fs.SourceFile;
import com.gentoro.onepress.datasource.item.AttributeValue;
import com.gentoro.onepress.datasource.item.ItemRole;
import com.gentoro.onepress.utility.StringUtility;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Obtains the explicit attributes of a content or layout file.
 *
 * <p>A sidecar {@code <file>.meta} next to a content file wins: its whole text is the attribute
 * document and the content file is left untouched, frontmatter included. Without a sidecar, text
 * files are checked for a frontmatter block, which is parsed and cut from the body. Binary files
 * never have frontmatter.
 */
public class AttributeExtractor {
  private static final org.slf4j.Logger log =
      com.gentoro.onepress.logging.LoggingService.getLogger(AttributeExtractor.class);

  private final AttributeParser parser;
  private final ContentFileSystem fileSystem;

  public AttributeExtractor(AttributeParser parser, ContentFileSystem fileSystem) {
    this.parser = parser;
    this.fileSystem = fileSystem;
  }

  /**
   * @param file the file being ingested; must not be an include.
   * @param binary whether the file was classified as binary.
   * @param raw the file text, empty for binary files.
   */
  public ExtractedAttributes extract(SourceFile file, boolean binary, String raw) {
    if (file.role() == ItemRole.INCLUDE) {
      throw new IllegalArgumentException("Includes carry no attributes: " + file.relativePath());
    }

    if (file.role() == ItemRole.CONTENT) {
      Path sidecar = file.sidecar();
      if (fileSystem.isRegularFile(sidecar)) {
        log.trace("Reading attributes of {} from {}", file.relativePath(), sidecar);
        String document = fileSystem.readString(sidecar);
        return new ExtractedAttributes(
            parser.parse(document, display(sidecar)), null, ExtractedAttributes.Source.SIDECAR);
      }
    }

    if (binary) {
      return new ExtractedAttributes(new LinkedHashMap<>(), null, ExtractedAttributes.Source.NONE);
    }

    Optional<AttributeParser.Frontmatter> frontmatter = parser.findFrontmatter(raw);
    if (frontmatter.isEmpty()) {
      return new ExtractedAttributes(new LinkedHashMap<>(), raw, ExtractedAttributes.Source.NONE);
    }
    Map<String, AttributeValue> attributes =
        parser.parse(frontmatter.get().document(), display(file.file()));
    return new ExtractedAttributes(
        attributes, frontmatter.get().body(), ExtractedAttributes.Source.FRONTMATTER);
  }

  private static String display(Path path) {
    return StringUtility.normalizeSeparators(path.toString());
  }
}
