package com.flamingo.ai.linkextractor.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.flamingo.ai.linkextractor.config.LinkExtractorConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LinkParserTest {

  private static final SourceFile NOTE =
      new SourceFile(Path.of("notes", "2025-01-15.md"), LocalDate.of(2025, 1, 15));

  private LinkParser parser;

  @BeforeEach
  void setUp() {
    parser = new LinkParser(new LinkExtractorConfig());
  }

  @Test
  @DisplayName("should parse inline links with title and description")
  void shouldParseInlineLink_whenMarkdownLinkPresent() {
    String content =
        """
        # Wednesday

        ## Links
        - [Spring Boot](https://spring.io/projects/spring-boot) - framework docs
        """;

    List<ExtractedLink> links = parser.parse(content, NOTE);

    assertThat(links).hasSize(1);
    ExtractedLink link = links.get(0);
    assertThat(link.url()).isEqualTo("https://spring.io/projects/spring-boot");
    assertThat(link.title()).isEqualTo("Spring Boot");
    assertThat(link.description()).isEqualTo("framework docs");
    assertThat(link.sourceDate()).isEqualTo(LocalDate.of(2025, 1, 15));
    assertThat(link.sourceFile()).isEqualTo(NOTE.path().toString());
    assertThat(link.indentLevel()).isZero();
    assertThat(link.parentUrl()).isNull();
  }

  @Test
  @DisplayName("should use text before a bare URL as description")
  void shouldUseLeadingText_whenBareUrl() {
    String content =
        """
        ## Links
        - Great talk on GC tuning https://example.com/gc-talk
        - https://example.com/plain
        """;

    List<ExtractedLink> links = parser.parse(content, NOTE);

    assertThat(links).hasSize(2);
    assertThat(links.get(0).url()).isEqualTo("https://example.com/gc-talk");
    assertThat(links.get(0).title()).isNull();
    assertThat(links.get(0).description()).isEqualTo("Great talk on GC tuning");
    assertThat(links.get(1).url()).isEqualTo("https://example.com/plain");
    assertThat(links.get(1).description()).isNull();
  }

  @Test
  @DisplayName("should record parent URL for nested items indented with tabs or spaces")
  void shouldRecordParent_whenItemsNested() {
    String content =
        "## Links\n"
            + "- [Parent](https://a.example.com)\n"
            + "\t- [Child](https://b.example.com)\n"
            + "\t\t- [Grandchild](https://c.example.com)\n"
            + "    - [Spaced child](https://d.example.com)\n"
            + "- [Second root](https://e.example.com)\n";

    List<ExtractedLink> links = parser.parse(content, NOTE);

    assertThat(links)
        .extracting(ExtractedLink::url, ExtractedLink::indentLevel, ExtractedLink::parentUrl)
        .containsExactly(
            tuple("https://a.example.com", 0, null),
            tuple("https://b.example.com", 1, "https://a.example.com"),
            tuple("https://c.example.com", 2, "https://b.example.com"),
            tuple("https://d.example.com", 1, "https://a.example.com"),
            tuple("https://e.example.com", 0, null));
  }

  @Test
  @DisplayName("should stop at the next level-two heading")
  void shouldStopAtNextSection_whenAnotherHeadingFollows() {
    String content =
        """
        ## Links
        - [Kept](https://kept.example.com)

        ## Reading
        - [Ignored](https://ignored.example.com)
        """;

    List<ExtractedLink> links = parser.parse(content, NOTE);

    assertThat(links).extracting(ExtractedLink::url).containsExactly("https://kept.example.com");
  }

  @Test
  @DisplayName("should return empty list when heading is missing")
  void shouldReturnEmpty_whenNoLinksHeading() {
    String content =
        """
        ## Tasks
        - [Something](https://example.com)
        """;

    assertThat(parser.parse(content, NOTE)).isEmpty();
  }

  @Test
  @DisplayName("should not treat a longer heading as the links heading")
  void shouldIgnoreHeading_whenHeadingHasExtraWords() {
    String content =
        """
        ## Links to read later
        - [Something](https://example.com)
        """;

    assertThat(parser.parse(content, NOTE)).isEmpty();
  }

  @Test
  @DisplayName("should skip list items without URLs and keep duplicates")
  void shouldSkipItemsWithoutUrl_whenTextOnly() {
    String content =
        """
        ## Links
        - just a thought
        - [Dup](https://dup.example.com)
        not a list item https://not-listed.example.com
        - [Dup again](https://dup.example.com)
        """;

    List<ExtractedLink> links = parser.parse(content, NOTE);

    assertThat(links)
        .extracting(ExtractedLink::url)
        .containsExactly("https://dup.example.com", "https://dup.example.com");
  }

  @Test
  @DisplayName("should read note files from disk")
  void shouldParseFile_whenFileExists(@TempDir Path dir) throws IOException {
    Path path = dir.resolve("2025-01-15.md");
    Files.writeString(path, "## Links\n- [Café](https://café.example.com/ü)\n");

    List<ExtractedLink> links =
        parser.parseFile(new SourceFile(path, LocalDate.of(2025, 1, 15)));

    assertThat(links).extracting(ExtractedLink::title).containsExactly("Café");
  }

  @Test
  @DisplayName("should compute indent levels")
  void shouldComputeIndentLevel() {
    assertThat(LinkParser.indentLevel("")).isZero();
    assertThat(LinkParser.indentLevel("\t\t")).isEqualTo(2);
    assertThat(LinkParser.indentLevel("        ")).isEqualTo(2);
    assertThat(LinkParser.indentLevel("  ")).isZero();
    assertThat(LinkParser.indentLevel("\t    ")).isEqualTo(2);
  }

  @Test
  @DisplayName("should trim spaces and dashes from both ends")
  void shouldTrimDashes() {
    assertThat(LinkParser.trimDashes(" - note - ")).isEqualTo("note");
    assertThat(LinkParser.trimDashes("--")).isEmpty();
  }
}
