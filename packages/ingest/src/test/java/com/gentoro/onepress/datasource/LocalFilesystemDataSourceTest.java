package com.gentoro.onepress.datasource;

import static org.assertj.core.api.Assertions.assertThat;

import com.gentoro.onepress.datasource.item.AttributeValue;
import com.gentoro.onepress.datasource.item.Item;
import com.gentoro.onepress.utility.StringUtility;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Runs the data source against a real directory tree. */
class LocalFilesystemDataSourceTest {

  @TempDir Path site;

  private Path write(String relative, String content) throws Exception {
    Path file = site.resolve(relative);
    Files.createDirectories(file.getParent());
    Files.writeString(file, content, StandardCharsets.UTF_8);
    Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2020-05-01T10:00:00Z")));
    return file;
  }

  @Test
  void ingestsSiteFromDisk() throws Exception {
    write("content/posts/news/2020-05-01-hello-world.md", "---\ntags: [a]\n---\nHello\n");
    write("content/posts/news/2020-05-01-hello-world.md.meta", "tags: [b]\n");
    Path image = site.resolve("content/images/photo.jpg");
    Files.createDirectories(image.getParent());
    Files.write(image, new byte[] {(byte) 0xFF, (byte) 0xD8, 0x00});
    write("layouts/post.html", "<article/>");

    FilesystemDataSource dataSource =
        new FilesystemDataSource(
            DataSourceConfig.builder()
                .sourceRoot(site)
                .textExtensions(List.of("md", "html"))
                .timezone("UTC")
                .build());
    dataSource.configure();
    dataSource.process();

    Map<String, Item> items = dataSource.items();
    assertThat(items.keySet())
        .containsExactly("images/photo.jpg", "posts/news/2020-05-01-hello-world.md");

    Item post = items.get("posts/news/2020-05-01-hello-world.md");
    assertThat(post.attributes())
        .containsEntry("tags", AttributeValue.of(List.of("b")))
        .containsEntry(Item.ATTR_MTIME, AttributeValue.of("2020-05-01T10:00:00Z"))
        .containsEntry(Item.ATTR_CATEGORIES, AttributeValue.of(List.of("news")));
    assertThat(post.content()).startsWith("---\ntags: [a]");

    Item photo = items.get("images/photo.jpg");
    assertThat(photo.isBinary()).isTrue();
    assertThat(photo.content()).isEmpty();
    assertThat(photo.sourcePath())
        .contains(StringUtility.normalizeSeparators(image.toRealPath().toString()));

    assertThat(dataSource.layouts()).containsOnlyKeys("post.html");
    assertThat(dataSource.includes()).isEmpty();
  }

  @Test
  void invalidUtf8DoesNotAbortTheRun() throws Exception {
    Path latin1 = site.resolve("content/cafe.md");
    Files.createDirectories(latin1.getParent());
    Files.write(latin1, new byte[] {'c', 'a', 'f', (byte) 0xE9});
    write("content/index.md", "home");

    FilesystemDataSource dataSource =
        new FilesystemDataSource(
            DataSourceConfig.builder()
                .sourceRoot(site)
                .textExtensions(List.of("md"))
                .timezone("UTC")
                .build());
    dataSource.configure();
    dataSource.process();

    assertThat(dataSource.items()).containsOnlyKeys("cafe.md", "index.md");
    assertThat(dataSource.items().get("cafe.md").content()).isEqualTo("caf\uFFFD");
    assertThat(dataSource.items().get("index.md").content()).isEqualTo("home");
  }
}
