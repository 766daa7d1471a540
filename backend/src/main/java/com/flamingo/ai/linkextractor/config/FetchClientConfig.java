package com.flamingo.ai.linkextractor.config;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * HTTP client used to download pages and PDFs referenced by links.
 *
 * <p>Redirects are followed. Per-request timeouts are applied by the fetchers; only the connect
 * timeout is fixed here.
 */
@Configuration
@Slf4j
public class FetchClientConfig {

  @Bean
  @Qualifier("linkFetchWebClient")
  public WebClient linkFetchWebClient(LinkExtractorConfig config) {
    LinkExtractorConfig.Fetch fetch = config.getFetch();
    HttpClient httpClient =
        HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, fetch.getTimeoutSeconds() * 1000);

    log.info(
        "Link fetch client initialized: userAgent={}, timeout={}s, maxContentLength={}",
        fetch.getUserAgent(),
        fetch.getTimeoutSeconds(),
        fetch.getMaxContentLength());

    return WebClient.builder()
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .defaultHeader(HttpHeaders.USER_AGENT, fetch.getUserAgent())
        // PDFs are buffered whole; HTML bodies are capped by DocumentFetcher itself
        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(-1))
        .build();
  }
}
