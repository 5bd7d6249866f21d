package dev.bulletin.snapshot;

import jakarta.annotation.PostConstruct;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Externalised configuration for the knowledge-base source.
 *
 * <p>Properties are bound from {@code bulletin.kb.*}:
 *
 * <ul>
 *   <li>{@code path} - local JSONL file (default {@code data/kb.jsonl})
 *   <li>{@code url} - optional remote JSONL location downloaded before each reload; must be an
 *       absolute {@code http} or {@code https} URL
 *   <li>{@code synonyms-path} - synonym CSV (default {@code data/synonyms.csv})
 *   <li>{@code load-on-startup} - load asynchronously once the application is ready (default true)
 *   <li>{@code fold-body-limit} - body prefix length that is kana-folded (default 20000)
 *   <li>{@code fetch.*} - timeouts and retry policy for the remote download
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "bulletin.kb")
public class KnowledgeBaseProperties {

  private String path = "data/kb.jsonl";
  private @Nullable String url;
  private String synonymsPath = "data/synonyms.csv";
  private boolean loadOnStartup = true;
  private int foldBodyLimit = 20_000;
  private final Fetch fetch = new Fetch();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (!StringUtils.hasText(path)) {
      throw new IllegalStateException("bulletin.kb.path must not be blank");
    }
    if (hasRemoteSource() && !isHttpUrl(url)) {
      throw new IllegalStateException(
          "bulletin.kb.url must be an absolute http(s) URL, got: " + url);
    }
    if (foldBodyLimit < 1) {
      throw new IllegalStateException(
          "bulletin.kb.fold-body-limit must be positive, got: " + foldBodyLimit);
    }
    if (fetch.connectTimeoutMs < 1 || fetch.readTimeoutMs < 1) {
      throw new IllegalStateException("bulletin.kb.fetch timeouts must be positive");
    }
    if (fetch.maxAttempts < 1 || fetch.maxAttempts > 10) {
      throw new IllegalStateException(
          "bulletin.kb.fetch.max-attempts must be in [1, 10], got: " + fetch.maxAttempts);
    }
  }

  private static boolean isHttpUrl(@Nullable String value) {
    if (value == null) {
      return false;
    }
    try {
      URI uri = new URI(value.strip());
      String scheme = uri.getScheme();
      return uri.getHost() != null
          && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
    } catch (URISyntaxException e) {
      return false;
    }
  }

  public Path sourcePath() {
    return Path.of(path);
  }

  public @Nullable Path synonymsFile() {
    return StringUtils.hasText(synonymsPath) ? Path.of(synonymsPath) : null;
  }

  public boolean hasRemoteSource() {
    return StringUtils.hasText(url);
  }

  public String getPath() {
    return path;
  }

  public void setPath(String path) {
    this.path = path;
  }

  public @Nullable String getUrl() {
    return url;
  }

  public void setUrl(@Nullable String url) {
    this.url = url;
  }

  public String getSynonymsPath() {
    return synonymsPath;
  }

  public void setSynonymsPath(String synonymsPath) {
    this.synonymsPath = synonymsPath;
  }

  public boolean isLoadOnStartup() {
    return loadOnStartup;
  }

  public void setLoadOnStartup(boolean loadOnStartup) {
    this.loadOnStartup = loadOnStartup;
  }

  public int getFoldBodyLimit() {
    return foldBodyLimit;
  }

  public void setFoldBodyLimit(int foldBodyLimit) {
    this.foldBodyLimit = foldBodyLimit;
  }

  public Fetch getFetch() {
    return fetch;
  }

  /** Remote download settings, bound from {@code bulletin.kb.fetch.*}. */
  public static class Fetch {

    private int connectTimeoutMs = 5_000;
    private int readTimeoutMs = 30_000;
    private int maxAttempts = 3;
    private long delayMs = 1_000;
    private double multiplier = 2.0;

    public int getConnectTimeoutMs() {
      return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
      this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
      return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
      this.readTimeoutMs = readTimeoutMs;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getDelayMs() {
      return delayMs;
    }

    public void setDelayMs(long delayMs) {
      this.delayMs = delayMs;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }
  }
}
