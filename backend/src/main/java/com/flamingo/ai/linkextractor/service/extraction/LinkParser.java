package com.flamingo.ai.linkextractor.service.extraction;

import com.flamingo.ai.linkextractor.config.LinkExtractorConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Parses the links section of a note into {@link ExtractedLink}s.
 *
 * <p>The section is a bullet list. Nested items record the URL of their closest enclosing item as
 * {@code parentUrl}. An item is either an inline link {@code [title](url)} with optional words
 * around it, or free text followed by a bare URL.
 */
@Component
public class LinkParser {

  private static final Pattern MARKDOWN_LINK =
      Pattern.compile("\\[([^\\]]+)\\]\\((https?://[^)]+)\\)");
  private static final Pattern BARE_URL = Pattern.compile("(https?://[^\\s)]+)");
  private static final Pattern NEXT_SECTION = Pattern.compile("^## ", Pattern.MULTILINE);
  private static final Pattern LIST_ITEM = Pattern.compile("^(\\s*)-\\s+(.+)$");

  private static final int SPACES_PER_LEVEL = 4;

  private final Pattern sectionHeading;

  public LinkParser(LinkExtractorConfig config) {
    this.sectionHeading =
        Pattern.compile(
            "^" + Pattern.quote(config.getSource().getSectionHeading()) + "[ \\t]*$",
            Pattern.MULTILINE);
  }

  /** Reads a note as UTF-8 and parses it. */
  public List<ExtractedLink> parseFile(SourceFile file) throws IOException {
    return parse(Files.readString(file.path(), StandardCharsets.UTF_8), file);
  }

  public List<ExtractedLink> parse(String content, SourceFile file) {
    String section = linksSection(content);
    if (section == null) {
      return List.of();
    }

    List<ExtractedLink> links = new ArrayList<>();
    Deque<ParentEntry> parents = new ArrayDeque<>();

    for (String line : section.split("\n", -1)) {
      Matcher item = LIST_ITEM.matcher(line);
      if (!item.matches()) {
        continue;
      }

      int indentLevel = indentLevel(item.group(1));
      String text = item.group(2).strip();

      while (!parents.isEmpty() && parents.peek().indentLevel() >= indentLevel) {
        parents.pop();
      }
      String parentUrl = parents.isEmpty() ? null : parents.peek().url();

      ExtractedLink link = parseItem(text, file, indentLevel, parentUrl);
      if (link != null) {
        links.add(link);
        parents.push(new ParentEntry(indentLevel, link.url()));
      }
    }
    return links;
  }

  /** Text between the heading and the next level-two heading, or {@code null} without heading. */
  private String linksSection(String content) {
    Matcher heading = sectionHeading.matcher(content);
    if (!heading.find()) {
      return null;
    }
    int start = heading.end();
    Matcher next = NEXT_SECTION.matcher(content);
    int end = next.find(start) ? next.start() : content.length();
    return content.substring(start, end).strip();
  }

  /** Tabs count one level each, every four other whitespace characters one more. */
  static int indentLevel(String indent) {
    int tabs = 0;
    int others = 0;
    for (int i = 0; i < indent.length(); i++) {
      if (indent.charAt(i) == '\t') {
        tabs++;
      } else {
        others++;
      }
    }
    return tabs + others / SPACES_PER_LEVEL;
  }

  private ExtractedLink parseItem(
      String text, SourceFile file, int indentLevel, String parentUrl) {
    Matcher inline = MARKDOWN_LINK.matcher(text);
    if (inline.find()) {
      String description = trimDashes(MARKDOWN_LINK.matcher(text).replaceAll(""));
      return new ExtractedLink(
          inline.group(2),
          inline.group(1),
          emptyToNull(description),
          file.date(),
          file.path().toString(),
          indentLevel,
          parentUrl);
    }

    Matcher bare = BARE_URL.matcher(text);
    if (bare.find()) {
      String description = trimDashes(text.substring(0, bare.start()));
      return new ExtractedLink(
          bare.group(1),
          null,
          emptyToNull(description),
          file.date(),
          file.path().toString(),
          indentLevel,
          parentUrl);
    }
    return null;
  }

  /** Strips spaces and dashes from both ends. */
  static String trimDashes(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && isTrimmable(value.charAt(start))) {
      start++;
    }
    while (end > start && isTrimmable(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(start, end);
  }

  private static boolean isTrimmable(char c) {
    return c == ' ' || c == '-';
  }

  private static String emptyToNull(String value) {
    return value.isEmpty() ? null : value;
  }

  private record ParentEntry(int indentLevel, String url) {}
}
