package dev.bulletin.search;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FuzzyMatcherTest {

  @Test
  void exactSubstringMatches() {
    assertThat(FuzzyMatcher.containsWithinOneEdit("盆栽展示会", "展示会")).isTrue();
  }

  @Test
  void oneSubstitutionMatches() {
    assertThat(FuzzyMatcher.containsWithinOneEdit("ぼんさつてん", "ぼんさい")).isTrue();
  }

  @Test
  void oneInsertionOrDeletionMatches() {
    assertThat(FuzzyMatcher.containsWithinOneEdit("xxabcxdefyy", "abcdef")).isTrue();
    assertThat(FuzzyMatcher.containsWithinOneEdit("xxabdefyy", "abcdef")).isTrue();
  }

  @Test
  void twoEditsDoNotMatch() {
    assertThat(FuzzyMatcher.containsWithinOneEdit("abxyef", "abcdef")).isFalse();
    assertThat(FuzzyMatcher.containsWithinOneEdit("", "abc")).isFalse();
  }

  @Test
  void singleCharacterPatternAlwaysMatches() {
    assertThat(FuzzyMatcher.containsWithinOneEdit("", "a")).isTrue();
  }
}
