package com.gentoro.onepress.datasource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import com.gentoro.onepress.datasource.fs.ContentFileSystem;
import com.gentoro.onepress.datasource.fs.InMemoryContentFileSystem;
import com.gentoro.onepress.datasource.item.AttributeValue;
import com.gentoro.onepress.datasource.item.ContentSnapshot;
import com.gentoro.onepress.datasource.item.Item;
import com.gentoro.onepress.exception.AttributeParseException;
import com.gentoro.onepress.exception.ConfigException;
import com.gentoro.onepress.exception.IoException;
import com.gentoro.onepress.exception.StateException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FilesystemDataSourceTest {

  private InMemoryContentFileSystem fs;

  @BeforeEach
  void setUp() {
    fs =
        new InMemoryContentFileSystem()
            .file("/site/content/index.md", "---\ntitle: Home\n---\nWelcome\n")
            .file("/site/content/about.md", "---\ntitle: Ignored\n---\nAbout\n")
            .file("/site/content/about.md.meta", "title: About us\nauthor: jane\n")
            .file("/site/content/posts/2020-05-01-hello-world.md", "Hello")
            .file(
                "/site/content/posts/tech/2021-02-03-java-records.md",
                "---\ntitle: Records\ndate: \"2021-02-04\"\ncategories: [jvm]\n---\nbody")
            .file("/site/content/posts/tech/2021-03-01-streams.md", "streams")
            .file("/site/content/assets/logo.png", "\u0089PNG")
            .file("/site/content/assets/logo.png.meta", "alt: Logo\n")
            .file("/site/layouts/default.html", "---\nname: base\n---\n<html></html>")
            .file("/site/layouts/page.html.twig", "{{ content }}")
            .file("/site/includes/nav.html", "---\nx: 1\n---\n<nav/>");
  }

  private DataSourceConfig.Builder config() {
    return DataSourceConfig.builder()
        .sourceRoot("/site")
        .textExtensions(List.of("md", "html", "html.twig"))
        .timezone("UTC");
  }

  private FilesystemDataSource process(DataSourceConfig config) {
    FilesystemDataSource dataSource = new FilesystemDataSource(config, fs);
    dataSource.configure();
    dataSource.process();
    return dataSource;
  }

  @Test
  void buildsThreeCollections() {
    FilesystemDataSource dataSource = process(config().build());

    assertThat(dataSource.items().keySet())
        .containsExactly(
            "about.md",
            "assets/logo.png",
            "index.md",
            "posts/2020-05-01-hello-world.md",
            "posts/tech/2021-02-03-java-records.md",
            "posts/tech/2021-03-01-streams.md");
    assertThat(dataSource.layouts().keySet()).containsExactly("default.html", "page.html.twig");
    assertThat(dataSource.includes().keySet()).containsExactly("nav.html");
  }

  @Test
  void everyItemHasReservedAttributes() {
    FilesystemDataSource dataSource = process(config().build());

    Item index = dataSource.items().get("index.md");
    assertThat(index.attributes())
        .containsEntry(Item.ATTR_MTIME, AttributeValue.of("2020-05-01T10:00:00Z"))
        .containsEntry(Item.ATTR_FILENAME, AttributeValue.of("index"))
        .containsEntry(Item.ATTR_EXTENSION, AttributeValue.of("md"));
    for (Map<String, Item> collection :
        List.of(dataSource.items(), dataSource.layouts(), dataSource.includes())) {
      assertThat(collection.values())
          .allSatisfy(
              item ->
                  assertThat(item.attributes())
                      .containsKeys(Item.ATTR_MTIME, Item.ATTR_FILENAME, Item.ATTR_EXTENSION));
    }
  }

  @Test
  void binaryItemsAreNotRead() {
    FilesystemDataSource dataSource = process(config().build());

    Item logo = dataSource.items().get("assets/logo.png");
    assertThat(logo.isBinary()).isTrue();
    assertThat(logo.content(ContentSnapshot.RAW)).contains("");
    assertThat(logo.content(ContentSnapshot.BODY)).isEmpty();
    assertThat(logo.sourcePath()).contains("/site/content/assets/logo.png");
    assertThat(logo.attributes()).containsEntry("alt", AttributeValue.of("Logo"));
    assertThat(fs.reads()).doesNotContain(Path.of("/site/content/assets/logo.png"));
  }

  @Test
  void textItemsHaveNoSourcePath() {
    FilesystemDataSource dataSource = process(config().build());

    assertThat(dataSource.items().get("index.md").sourcePath()).isEmpty();
    assertThat(dataSource.items().get("index.md").isBinary()).isFalse();
  }

  @Test
  void frontmatterIsStripped() {
    Item index = process(config().build()).items().get("index.md");

    assertThat(index.attribute(Item.ATTR_TITLE)).contains(AttributeValue.of("Home"));
    assertThat(index.content()).isEqualTo("Welcome\n");
    assertThat(index.content(ContentSnapshot.RAW)).contains("---\ntitle: Home\n---\nWelcome\n");
  }

  @Test
  void sidecarTakesPrecedenceOverFrontmatter() {
    Item about = process(config().build()).items().get("about.md");

    assertThat(about.attribute(Item.ATTR_TITLE)).contains(AttributeValue.of("About us"));
    assertThat(about.attribute("author")).contains(AttributeValue.of("jane"));
    assertThat(about.content()).isEqualTo("---\ntitle: Ignored\n---\nAbout\n");
    assertThat(about.content(ContentSnapshot.BODY)).isEmpty();
  }

  @Test
  void datedPostGetsTitleDateAndCategories() {
    Item post = process(config().build()).items().get("posts/2020-05-01-hello-world.md");

    assertThat(post.attributes())
        .containsEntry(Item.ATTR_TITLE, AttributeValue.of("hello world"))
        .containsEntry(Item.ATTR_TITLE_PATH, AttributeValue.of("hello-world"))
        .containsEntry(Item.ATTR_DATE, AttributeValue.of("2020-05-01"))
        .containsEntry(Item.ATTR_CATEGORIES, AttributeValue.of(List.of()))
        .containsEntry(Item.ATTR_FILENAME, AttributeValue.of("2020-05-01-hello-world"));
  }

  @Test
  void nestedPostGetsSubdirectoryCategories() {
    Item post = process(config().build()).items().get("posts/tech/2021-03-01-streams.md");

    assertThat(post.attribute(Item.ATTR_CATEGORIES))
        .contains(AttributeValue.of(List.of("tech")));
  }

  @Test
  void explicitAttributesWinOverDerivedOnes() {
    Item post = process(config().build()).items().get("posts/tech/2021-02-03-java-records.md");

    assertThat(post.attributes())
        .containsEntry(Item.ATTR_TITLE, AttributeValue.of("Records"))
        .containsEntry(Item.ATTR_DATE, AttributeValue.of("2021-02-04"))
        .containsEntry(Item.ATTR_CATEGORIES, AttributeValue.of(List.of("jvm")))
        .containsEntry(Item.ATTR_TITLE_PATH, AttributeValue.of("java-records"));
  }

  @Test
  void pagesOutsidePostsHaveNoCategories() {
    Item index = process(config().build()).items().get("index.md");

    assertThat(index.attributes()).doesNotContainKeys(Item.ATTR_CATEGORIES, Item.ATTR_TITLE_PATH);
  }

  @Test
  void layoutsUseFrontmatterAndCompoundExtensions() {
    FilesystemDataSource dataSource = process(config().build());

    Item layout = dataSource.layouts().get("default.html");
    assertThat(layout.attribute("name")).contains(AttributeValue.of("base"));
    assertThat(layout.content()).isEqualTo("<html></html>");

    Item twig = dataSource.layouts().get("page.html.twig");
    assertThat(twig.isBinary()).isFalse();
    assertThat(twig.attributes())
        .containsEntry(Item.ATTR_FILENAME, AttributeValue.of("page"))
        .containsEntry(Item.ATTR_EXTENSION, AttributeValue.of("html.twig"));
  }

  @Test
  void includesKeepRawTextAndOnlyReservedAttributes() {
    Item nav = process(config().build()).includes().get("nav.html");

    assertThat(nav.attributes())
        .containsOnlyKeys(Item.ATTR_MTIME, Item.ATTR_FILENAME, Item.ATTR_EXTENSION);
    assertThat(nav.content()).isEqualTo("---\nx: 1\n---\n<nav/>");
    assertThat(nav.content(ContentSnapshot.BODY)).isEmpty();
  }

  @Test
  void missingLayoutsAndIncludesYieldEmptyCollections() {
    fs = new InMemoryContentFileSystem().file("/site/content/index.md", "home");

    FilesystemDataSource dataSource = process(config().build());

    assertThat(dataSource.items()).hasSize(1);
    assertThat(dataSource.layouts()).isEmpty();
    assertThat(dataSource.includes()).isEmpty();
  }

  @Test
  void missingContentDirectoryFails() {
    fs = new InMemoryContentFileSystem().file("/site/layouts/default.html", "x");
    FilesystemDataSource dataSource = new FilesystemDataSource(config().build(), fs);
    dataSource.configure();

    assertThatThrownBy(dataSource::process).isInstanceOf(IoException.class);
  }

  @Test
  void repeatedRunsProduceEqualItems() {
    FilesystemDataSource dataSource = process(config().build());
    Map<String, Item> first = Map.copyOf(dataSource.items());

    dataSource.process();

    assertThat(dataSource.items()).isEqualTo(first);
    assertThat(process(config().build()).items()).isEqualTo(first);
  }

  @Test
  void includedDirectoryReplacesContentWithSameId() {
    fs.file("/site/extra/index.md", "---\ntitle: Override\n---\nOther\n");

    Map<String, Item> items = process(config().include(List.of("extra")).build()).items();

    assertThat(items.get("index.md").attribute(Item.ATTR_TITLE))
        .contains(AttributeValue.of("Override"));
    assertThat(items.keySet()).first().isEqualTo("about.md");
  }

  @Test
  void includedFileUsesItsName() {
    fs.file("/elsewhere/notes.md", "notes").file("/elsewhere/notes.md.meta", "title: Notes");

    Map<String, Item> items =
        process(config().include(List.of("/elsewhere/notes.md")).build()).items();

    assertThat(items.get("notes.md").attribute(Item.ATTR_TITLE))
        .contains(AttributeValue.of("Notes"));
  }

  @Test
  void excludedPathsAreSkipped() {
    Map<String, Item> items = process(config().exclude(List.of("posts/tech")).build()).items();

    assertThat(items.keySet())
        .containsExactly(
            "about.md", "assets/logo.png", "index.md", "posts/2020-05-01-hello-world.md");
  }

  @Test
  void jsonAttributes() {
    fs =
        new InMemoryContentFileSystem()
            .file("/site/content/page.md", "---\n{\"title\": \"Json\", \"weight\": 3}\n---\nText")
            .file("/site/content/side.md", "side")
            .file("/site/content/side.md.meta", "{\"tags\": [\"a\", \"b\"]}");

    Map<String, Item> items = process(config().attributeSyntax("json").build()).items();

    assertThat(items.get("page.md").attributes())
        .containsEntry(Item.ATTR_TITLE, AttributeValue.of("Json"))
        .containsEntry("weight", new AttributeValue.NumberValue(3));
    assertThat(items.get("page.md").content()).isEqualTo("Text");
    assertThat(items.get("side.md").attribute("tags"))
        .contains(AttributeValue.of(List.of("a", "b")));
  }

  @Test
  void malformedFrontmatterAbortsTheRun() {
    fs.file("/site/content/broken.md", "---\ntitle: [unclosed\n---\nbody");
    FilesystemDataSource dataSource = new FilesystemDataSource(config().build(), fs);
    dataSource.configure();

    assertThatThrownBy(dataSource::process)
        .isInstanceOfSatisfying(
            AttributeParseException.class,
            e -> assertThat(e.getFile()).endsWith("content/broken.md"));
    assertThatThrownBy(dataSource::items).isInstanceOf(StateException.class);
  }

  @Test
  void accessorsRequireProcess() {
    FilesystemDataSource dataSource = new FilesystemDataSource(config().build(), fs);

    assertThatThrownBy(dataSource::process).isInstanceOf(StateException.class);
    dataSource.configure();
    assertThatThrownBy(dataSource::items).isInstanceOf(StateException.class);
    assertThatThrownBy(dataSource::layouts).isInstanceOf(StateException.class);
    assertThatThrownBy(dataSource::includes).isInstanceOf(StateException.class);
  }

  @Test
  void invalidSettingsFailBeforeFilesystemAccess() {
    ContentFileSystem fileSystem = mock(ContentFileSystem.class);

    assertThatThrownBy(
            () ->
                new FilesystemDataSource(config().attributeSyntax("toml").build(), fileSystem)
                    .configure())
        .isInstanceOf(ConfigException.class);
    verifyNoInteractions(fileSystem);
  }
}
