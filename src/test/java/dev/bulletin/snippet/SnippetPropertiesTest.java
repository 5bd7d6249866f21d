package dev.bulletin.snippet;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SnippetPropertiesTest {

  @Test
  void defaultsAreValid() {
    assertThatCode(new SnippetProperties()::validate).doesNotThrowAnyException();
  }

  @Test
  void zeroBudgetIsRejected() {
    SnippetProperties properties = new SnippetProperties();
    properties.setSide(0);

    assertThatThrownBy(properties::validate).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void lookaroundIsBoundedByHalfTheSlack() {
    SnippetProperties properties = new SnippetProperties();
    properties.setSlack(10);
    properties.setBoundaryLookaround(6);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("boundary-lookaround");
  }
}
