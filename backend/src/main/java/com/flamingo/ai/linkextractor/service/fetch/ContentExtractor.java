package com.flamingo.ai.linkextractor.service.fetch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.springframework.stereotype.Component;

/**
 * Pulls the main readable text out of an HTML page.
 *
 * <p>Non-content elements are dropped first. Candidate containers are then tried in order:
 * {@code <article>}, {@code <main>}, every element whose class mentions content, article or post,
 * and finally {@code <body>}. The first candidate with at least {@value #MIN_TEXT_LENGTH}
 * characters of normalized text wins, so an almost empty wrapper does not hide a richer fallback.
 */
@Component
@Slf4j
public class ContentExtractor {

  static final int MIN_TEXT_LENGTH = 50;

  private static final String REMOVED_ELEMENTS =
      "script, style, nav, header, footer, aside, form, noscript";
  private static final String CONTENT_CLASS_SELECTOR = "[class~=(?i)(content|article|post)]";
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /**
   * Extracts readable text from HTML.
   *
   * @param html the raw markup
   * @param maxLength maximum number of characters returned
   * @return normalized text, or an empty string when no candidate has enough text
   */
  public String extract(String html, int maxLength) {
    if (html == null || html.isBlank()) {
      return "";
    }

    Document document = Jsoup.parse(html);
    document.select(REMOVED_ELEMENTS).remove();

    for (Element candidate : candidates(document)) {
      String text = visibleText(candidate);
      if (text.length() >= MIN_TEXT_LENGTH) {
        return text.length() > maxLength ? text.substring(0, maxLength) : text;
      }
    }

    log.debug("No content candidate reached {} characters", MIN_TEXT_LENGTH);
    return "";
  }

  private List<Element> candidates(Document document) {
    List<Element> candidates = new ArrayList<>();
    Element article = document.selectFirst("article");
    if (article != null) {
      candidates.add(article);
    }
    Element main = document.selectFirst("main");
    if (main != null) {
      candidates.add(main);
    }
    candidates.addAll(document.select(CONTENT_CLASS_SELECTOR));
    if (document.body() != null) {
      candidates.add(document.body());
    }
    return candidates;
  }

  private String visibleText(Element element) {
    List<String> parts = new ArrayList<>();
    NodeTraversor.traverse(
        (node, depth) -> {
          if (node instanceof TextNode textNode && !textNode.isBlank()) {
            parts.add(textNode.getWholeText());
          }
        },
        element);
    String joined = String.join(" ", parts).replace('\u00A0', ' ');
    return WHITESPACE.matcher(joined).replaceAll(" ").trim();
  }
}
