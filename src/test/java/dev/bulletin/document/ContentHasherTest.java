package dev.bulletin.document;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ContentHasherTest {

  @Test
  void hashOfKnownInputMatchesExpected() {
    String result = ContentHasher.sha256("hello".getBytes(StandardCharsets.UTF_8));

    assertThat(result)
        .isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
  }

  @Test
  void emptyInputProducesValidHash() {
    assertThat(ContentHasher.sha256(new byte[0]))
        .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
  }

  @Test
  void fieldBoundariesAffectTheHash() {
    assertThat(ContentHasher.sha256Fields("ab", "c"))
        .isNotEqualTo(ContentHasher.sha256Fields("a", "bc"));
  }

  @Test
  void sameFieldsProduceSameHash() {
    assertThat(ContentHasher.sha256Fields("総会", "2021-05-01", "山田"))
        .isEqualTo(ContentHasher.sha256Fields("総会", "2021-05-01", "山田"));
  }
}
