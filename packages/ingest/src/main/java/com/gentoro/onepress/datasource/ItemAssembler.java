package com.gentoro.onepress.datasource;

import com.gentoro.onepress.datasource.attributes.AttributeExtractor;
import com.gentoro.onepress.datasource.attributes.CategoryDeriver;
import com.gentoro.onepress.datasource.attributes.ExtractedAttributes;
import com.gentoro.onepress.datasource.attributes.FilenameConventionParser;
import com.gentoro.onepress.datasource.fs.BinaryClassifier;
import com.gentoro.onepress.datasource.fs.ContentFileSystem;
import com.gentoro.onepress.datasource.fs.FileInfo;
import com.gentoro.onepress.datasource.fs.SourceFile;
import com.gentoro.onepress.datasource.item.AttributeValue;
import com.gentoro.onepress.datasource.item.ContentSnapshot;
import com.gentoro.onepress.datasource.item.Item;
import com.gentoro.onepress.datasource.item.ItemRole;
import com.gentoro.onepress.datasource.item.PathSnapshot;
import com.gentoro.onepress.utility.StringUtility;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/** Builds one {@link Item} from one walked file. */
public class ItemAssembler {
  private static final org.slf4j.Logger log =
      com.gentoro.onepress.logging.LoggingService.getLogger(ItemAssembler.class);

  private final ContentFileSystem fileSystem;
  private final BinaryClassifier classifier;
  private final AttributeExtractor extractor;
  private final FilenameConventionParser filenameParser;
  private final CategoryDeriver categoryDeriver;
  private final ZoneId timezone;

  public ItemAssembler(
      ContentFileSystem fileSystem,
      BinaryClassifier classifier,
      AttributeExtractor extractor,
      FilenameConventionParser filenameParser,
      CategoryDeriver categoryDeriver,
      ZoneId timezone) {
    this.fileSystem = fileSystem;
    this.classifier = classifier;
    this.extractor = extractor;
    this.filenameParser = filenameParser;
    this.categoryDeriver = categoryDeriver;
    this.timezone = timezone;
  }

  public Item assemble(SourceFile file) {
    FileInfo info = classifier.describe(file.fileName());
    boolean binary = !info.textExtension();
    String raw = binary ? "" : fileSystem.readString(file.file());
    log.trace("Assembling {} item {} (binary={})", file.role(), file.relativePath(), binary);

    Item.Builder builder =
        Item.builder(file.relativePath(), file.role())
            .binary(binary)
            .content(ContentSnapshot.RAW, raw)
            .path(PathSnapshot.RELATIVE, file.relativePath());
    if (binary) {
      String source = fileSystem.toRealPath(file.file()).toString();
      builder.path(PathSnapshot.SOURCE, StringUtility.normalizeSeparators(source));
    }

    Map<String, AttributeValue> attributes = new LinkedHashMap<>();
    if (file.role() != ItemRole.INCLUDE) {
      ExtractedAttributes extracted = extractor.extract(file, binary, raw);
      attributes.putAll(extracted.attributes());
      extracted.bodyIfStripped().ifPresent(body -> builder.content(ContentSnapshot.BODY, body));
    }

    String mtime = formatTime(fileSystem.lastModified(file.file()));
    attributes.put(Item.ATTR_MTIME, AttributeValue.of(mtime));
    attributes.put(Item.ATTR_FILENAME, AttributeValue.of(info.name()));
    attributes.put(Item.ATTR_EXTENSION, AttributeValue.of(info.extension()));

    if (file.role() != ItemRole.INCLUDE) {
      filenameParser.apply(info.name(), attributes);
      categoryDeriver.apply(file.role(), file.relativeDirectory(), attributes);
    }

    return builder.attributes(attributes).build();
  }

  private String formatTime(Instant instant) {
    return OffsetDateTime.ofInstant(instant, timezone)
        .truncatedTo(ChronoUnit.SECONDS)
        .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
  }
}
