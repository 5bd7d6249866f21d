package dev.bulletin.snapshot;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to download the remote knowledge-base export.
 *
 * <p>Timeouts come from {@code bulletin.kb.fetch.*}. The client is qualified as {@code
 * "knowledgeBaseRestClient"}.
 */
@Configuration
public class KnowledgeBaseFetchConfig {

  /**
   * Creates the REST client for {@link KnowledgeBaseFetcher}.
   *
   * @param builder Spring-provided builder with common defaults
   * @param properties knowledge-base settings holding the fetch timeouts
   * @return a named REST client bean
   */
  @Bean
  public RestClient knowledgeBaseRestClient(
      RestClient.Builder builder, KnowledgeBaseProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(
        Duration.ofMillis(properties.getFetch().getConnectTimeoutMs()));
    requestFactory.setReadTimeout(Duration.ofMillis(properties.getFetch().getReadTimeoutMs()));

    return builder
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.ACCEPT, "application/x-ndjson, application/json, text/plain")
        .build();
  }
}
