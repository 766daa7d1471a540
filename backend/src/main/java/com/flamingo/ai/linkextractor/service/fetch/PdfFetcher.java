package com.flamingo.ai.linkextractor.service.fetch;

import com.flamingo.ai.linkextractor.config.LinkExtractorConfig;
import com.flamingo.ai.linkextractor.exception.ContentFetchException;
import java.io.IOException;
import java.time.Duration;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

/** Downloads PDF documents and extracts their text with PDFBox. Never throws. */
@Component
@Slf4j
public class PdfFetcher {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final WebClient webClient;
  private final HostRateLimiter rateLimiter;
  private final Duration timeout;
  private final int maxPages;
  private final int maxContentLength;

  public PdfFetcher(
      @Qualifier("linkFetchWebClient") WebClient webClient,
      HostRateLimiter rateLimiter,
      LinkExtractorConfig config) {
    this.webClient = webClient;
    this.rateLimiter = rateLimiter;
    this.timeout = Duration.ofSeconds(config.getPdf().getTimeoutSeconds());
    this.maxPages = config.getPdf().getMaxPages();
    this.maxContentLength = config.getPdf().getMaxContentLength();
  }

  public FetchResult fetch(String url) {
    byte[] pdf;
    try {
      rateLimiter.acquire(LinkUrls.host(url));
      pdf = download(url);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return FetchResult.failed("Interrupted while waiting for rate limit");
    } catch (RuntimeException e) {
      Throwable cause = Exceptions.unwrap(e);
      if (DocumentFetcher.isTimeout(cause)) {
        log.debug("Timed out downloading PDF {}", url);
        return FetchResult.timeout(DocumentFetcher.TIMEOUT_MESSAGE);
      }
      log.debug("Failed to download PDF {}: {}", url, cause.toString());
      return FetchResult.failed("Failed to download PDF: " + DocumentFetcher.messageOf(cause));
    }

    try {
      PdfText text = extractText(pdf);
      return FetchResult.success(text.content(), text.title(), MediaType.APPLICATION_PDF_VALUE);
    } catch (ContentFetchException e) {
      log.warn("Failed to extract text from PDF {}: {}", url, e.getMessage());
      return FetchResult.failed(e.getMessage());
    }
  }

  private byte[] download(String url) {
    byte[] body =
        webClient
            .get()
            .uri(url)
            .exchangeToMono(
                response -> {
                  int status = response.statusCode().value();
                  if (status != 200) {
                    return response
                        .releaseBody()
                        .then(
                            Mono.<byte[]>error(
                                new ContentFetchException(url, "HTTP " + status, null)));
                  }
                  return response.bodyToMono(byte[].class).defaultIfEmpty(new byte[0]);
                })
            .timeout(timeout)
            .block();
    return body != null ? body : new byte[0];
  }

  /**
   * Extracts the title and the text of the first pages of a PDF.
   *
   * @throws ContentFetchException if the bytes are not a readable PDF
   */
  PdfText extractText(byte[] pdf) {
    try (PDDocument document = Loader.loadPDF(pdf)) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setStartPage(1);
      stripper.setEndPage(maxPages);
      String text = WHITESPACE.matcher(stripper.getText(document)).replaceAll(" ").strip();
      if (text.length() > maxContentLength) {
        text = text.substring(0, maxContentLength);
      }
      return new PdfText(text, titleOf(document));
    } catch (IOException e) {
      throw new ContentFetchException(null, "Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  private static String titleOf(PDDocument document) {
    PDDocumentInformation info = document.getDocumentInformation();
    String title = info != null ? info.getTitle() : null;
    return title == null || title.isBlank() ? null : title.strip();
  }

  record PdfText(String content, String title) {}
}
