package com.flamingo.ai.linkextractor.service.enrichment;

import com.flamingo.ai.linkextractor.domain.enums.TagCategory;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** The closed set of tag names the tagger may assign, grouped by category. */
public final class TagVocabulary {

  private static final Map<TagCategory, List<String>> TAGS = new EnumMap<>(TagCategory.class);

  static {
    TAGS.put(
        TagCategory.PROGRAMMING_LANGUAGE,
        List.of(
            "python",
            "rust",
            "typescript",
            "javascript",
            "lisp",
            "common-lisp",
            "clojure",
            "scheme",
            "haskell",
            "go",
            "c",
            "cpp",
            "nix",
            "sql",
            "swift",
            "java",
            "ruby",
            "elixir",
            "zig"));
    TAGS.put(
        TagCategory.TECHNICAL_TOPIC,
        List.of(
            "ai",
            "llm",
            "compilers",
            "github-repo",
            "database",
            "devops",
            "web-dev",
            "academic-paper",
            "tutorial",
            "cli-tool",
            "distributed-systems",
            "security",
            "emulator"));
    TAGS.put(
        TagCategory.CULTURE,
        List.of(
            "tv",
            "movie",
            "fiction-book",
            "nonfiction-book",
            "music",
            "news",
            "politics",
            "podcast",
            "video",
            "gaming",
            "social-media"));
  }

  private TagVocabulary() {}

  public static boolean contains(TagCategory category, String name) {
    return TAGS.get(category).contains(name);
  }

  /** The vocabulary as an indented list per category, for prompts. */
  public static String describe() {
    StringBuilder sb = new StringBuilder();
    TAGS.forEach(
        (category, names) -> {
          sb.append(category.getValue()).append(":\n");
          names.forEach(name -> sb.append("  - ").append(name).append('\n'));
        });
    return sb.toString().strip();
  }
}
