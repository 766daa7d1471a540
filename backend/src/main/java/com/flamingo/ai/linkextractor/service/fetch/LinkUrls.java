package com.flamingo.ai.linkextractor.service.fetch;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** URL helpers shared by the fetchers and the store. */
public final class LinkUrls {

  private static final Pattern AUTHORITY = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://([^/?#]*)");
  private static final Pattern PATH = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://[^/?#]*([^?#]*)");

  private static final Set<String> MEDIA_EXTENSIONS =
      Set.of(".jpg", ".jpeg", ".png", ".gif", ".webp", ".mp4", ".mp3", ".wav");

  private LinkUrls() {}

  /**
   * Lower-cased host of a URL, or an empty string when there is none. User info and port are
   * dropped. Matching is lenient so URLs with characters {@link java.net.URI} rejects still work.
   */
  public static String host(String url) {
    Matcher matcher = AUTHORITY.matcher(url);
    if (!matcher.find()) {
      return "";
    }
    String authority = matcher.group(1);
    authority = authority.substring(authority.lastIndexOf('@') + 1);
    int port = authority.lastIndexOf(':');
    if (port > 0 && !authority.endsWith("]")) {
      authority = authority.substring(0, port);
    }
    return authority.toLowerCase(Locale.ROOT);
  }

  /** Lower-cased path of a URL without query or fragment. */
  public static String path(String url) {
    Matcher matcher = PATH.matcher(url);
    return matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : "";
  }

  public static boolean isPdf(String url) {
    return path(url).endsWith(".pdf");
  }

  public static boolean isMediaFile(String url) {
    String path = path(url);
    return MEDIA_EXTENSIONS.stream().anyMatch(path::endsWith);
  }
}
