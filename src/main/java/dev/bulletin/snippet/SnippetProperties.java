package dev.bulletin.snippet;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Excerpt sizing, bound from {@code bulletin.snippet.*}. All values are in characters.
 *
 * <ul>
 *   <li>{@code head-budget} - excerpt length for the top result (default 300)
 *   <li>{@code side} - context kept on each side of the first hit (default 80)
 *   <li>{@code fallback-budget} - head excerpt length when no hit is found (default 160)
 *   <li>{@code slack} - tolerated overshoot of a budget before hard truncation (default 40)
 *   <li>{@code boundary-lookaround} - how far a window edge may move to a safe boundary
 *       (default 20)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "bulletin.snippet")
public class SnippetProperties {

  private int headBudget = 300;
  private int side = 80;
  private int fallbackBudget = 160;
  private int slack = 40;
  private int boundaryLookaround = 20;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (headBudget < 1 || side < 1 || fallbackBudget < 1) {
      throw new IllegalStateException("bulletin.snippet budgets must be positive");
    }
    if (slack < 2) {
      throw new IllegalStateException("bulletin.snippet.slack must be at least 2, got: " + slack);
    }
    if (boundaryLookaround < 0 || boundaryLookaround > slack / 2) {
      throw new IllegalStateException(
          "bulletin.snippet.boundary-lookaround must be in [0, slack / 2], got: "
              + boundaryLookaround);
    }
  }

  public int getHeadBudget() {
    return headBudget;
  }

  public void setHeadBudget(int headBudget) {
    this.headBudget = headBudget;
  }

  public int getSide() {
    return side;
  }

  public void setSide(int side) {
    this.side = side;
  }

  public int getFallbackBudget() {
    return fallbackBudget;
  }

  public void setFallbackBudget(int fallbackBudget) {
    this.fallbackBudget = fallbackBudget;
  }

  public int getSlack() {
    return slack;
  }

  public void setSlack(int slack) {
    this.slack = slack;
  }

  public int getBoundaryLookaround() {
    return boundaryLookaround;
  }

  public void setBoundaryLookaround(int boundaryLookaround) {
    this.boundaryLookaround = boundaryLookaround;
  }
}
