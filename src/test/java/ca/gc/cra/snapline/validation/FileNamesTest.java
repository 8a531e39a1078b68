package ca.gc.cra.snapline.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class FileNamesTest {

  @Test
  void keepsSafeCharacters() {
    assertEquals("User.Test_1-a", FileNames.sanitize("User.Test_1-a"));
  }

  @Test
  void replacesEverythingElse() {
    assertEquals("a_b_c__", FileNames.sanitize("a/b cé$"));
  }

  @Test
  void emptyNameBecomesPlaceholder() {
    assertEquals("x", FileNames.sanitize(""));
  }

  @Test
  void sanitizeStemAlsoReplacesHyphen() {
    assertEquals("User.Test_1_a", FileNames.sanitizeStem("User.Test_1-a"));
  }
}
