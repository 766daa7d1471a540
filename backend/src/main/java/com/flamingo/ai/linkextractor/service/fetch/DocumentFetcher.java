package com.flamingo.ai.linkextractor.service.fetch;

import com.flamingo.ai.linkextractor.config.LinkExtractorConfig;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.timeout.ReadTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.parser.Parser;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

/**
 * Fetches an HTML page for a link and extracts its readable text.
 *
 * <p>Media files and PDFs are recognised by URL path and never requested here. Requests to the
 * same host are spaced by {@link HostRateLimiter}. Every outcome, including transport errors, is
 * reported as a {@link FetchResult}; this class never throws.
 */
@Component
@Slf4j
public class DocumentFetcher {

  static final String MEDIA_SKIP_REASON = "Non-HTML content type (media file)";
  static final String PDF_SKIP_REASON = "PDF - use pdf extractor";
  static final String TIMEOUT_MESSAGE = "Request timed out";

  private static final Pattern TITLE =
      Pattern.compile("<title[^>]*>([^<]+)</title>", Pattern.CASE_INSENSITIVE);

  private final WebClient webClient;
  private final HostRateLimiter rateLimiter;
  private final ContentExtractor contentExtractor;
  private final Duration timeout;
  private final int maxContentLength;
  private final int extractedTextMaxLength;

  public DocumentFetcher(
      @Qualifier("linkFetchWebClient") WebClient webClient,
      HostRateLimiter rateLimiter,
      ContentExtractor contentExtractor,
      LinkExtractorConfig config) {
    this.webClient = webClient;
    this.rateLimiter = rateLimiter;
    this.contentExtractor = contentExtractor;
    this.timeout = Duration.ofSeconds(config.getFetch().getTimeoutSeconds());
    this.maxContentLength = config.getFetch().getMaxContentLength();
    this.extractedTextMaxLength = config.getFetch().getExtractedTextMaxLength();
  }

  public boolean isPdf(String url) {
    return LinkUrls.isPdf(url);
  }

  public boolean isMediaFile(String url) {
    return LinkUrls.isMediaFile(url);
  }

  /**
   * Fetches a URL.
   *
   * @param url absolute http(s) URL
   * @return the outcome; content holds the extracted text on success
   */
  public FetchResult fetch(String url) {
    if (isMediaFile(url)) {
      return FetchResult.skipped(MEDIA_SKIP_REASON, null);
    }
    if (isPdf(url)) {
      return FetchResult.skipped(PDF_SKIP_REASON, MediaType.APPLICATION_PDF_VALUE);
    }

    try {
      rateLimiter.acquire(LinkUrls.host(url));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return FetchResult.failed("Interrupted while waiting for rate limit");
    }

    try {
      FetchResult result =
          webClient.get().uri(url).exchangeToMono(this::handleResponse).timeout(timeout).block();
      return result != null ? result : FetchResult.failed("Empty response");
    } catch (RuntimeException e) {
      Throwable cause = Exceptions.unwrap(e);
      if (isTimeout(cause)) {
        log.debug("Timed out fetching {}", url);
        return FetchResult.timeout(TIMEOUT_MESSAGE);
      }
      log.debug("Failed to fetch {}: {}", url, cause.toString());
      return FetchResult.failed(messageOf(cause));
    }
  }

  private Mono<FetchResult> handleResponse(ClientResponse response) {
    int status = response.statusCode().value();
    if (status != 200) {
      return response.releaseBody().thenReturn(FetchResult.failed("HTTP " + status));
    }

    String contentType =
        response.headers().header(HttpHeaders.CONTENT_TYPE).stream().findFirst().orElse("");
    if (!contentType.toLowerCase(Locale.ROOT).contains("text/html")) {
      return response
          .releaseBody()
          .thenReturn(FetchResult.skipped("Non-HTML content: " + contentType, contentType));
    }

    Charset charset = charsetOf(contentType);
    return DataBufferUtils.join(
            DataBufferUtils.takeUntilByteCount(
                response.bodyToFlux(DataBuffer.class), maxContentLength))
        .map(buffer -> decode(buffer, charset, maxContentLength))
        .defaultIfEmpty("")
        .map(html -> toResult(html, contentType));
  }

  private FetchResult toResult(String html, String contentType) {
    String text = contentExtractor.extract(html, extractedTextMaxLength);
    return FetchResult.success(text, extractTitle(html), contentType);
  }

  /** Text of the first {@code <title>} element with HTML entities decoded. */
  static String extractTitle(String html) {
    Matcher matcher = TITLE.matcher(html);
    if (!matcher.find()) {
      return null;
    }
    String title = Parser.unescapeEntities(matcher.group(1).strip(), false);
    return title.isEmpty() ? null : title;
  }

  /**
   * Decodes the body. When the body reached {@code byteLimit}, the cut may have split a multi-byte
   * character, so trailing replacement characters are dropped.
   */
  static String decode(DataBuffer buffer, Charset charset, int byteLimit) {
    try {
      boolean truncated = buffer.readableByteCount() >= byteLimit;
      String text = buffer.toString(charset);
      if (!truncated) {
        return text;
      }
      int end = text.length();
      while (end > 0 && text.charAt(end - 1) == '\uFFFD') {
        end--;
      }
      return text.substring(0, end);
    } finally {
      DataBufferUtils.release(buffer);
    }
  }

  static Charset charsetOf(String contentType) {
    try {
      Charset charset = MediaType.parseMediaType(contentType).getCharset();
      return charset != null ? charset : StandardCharsets.UTF_8;
    } catch (IllegalArgumentException e) {
      log.debug("Unusable content type '{}', decoding as UTF-8", contentType);
      return StandardCharsets.UTF_8;
    }
  }

  static boolean isTimeout(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof TimeoutException
          || t instanceof ConnectTimeoutException
          || t instanceof ReadTimeoutException) {
        return true;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return false;
  }

  static String messageOf(Throwable error) {
    String message = error.getMessage();
    return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
  }
}
