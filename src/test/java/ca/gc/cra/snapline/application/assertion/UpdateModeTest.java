package ca.gc.cra.snapline.application.assertion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class UpdateModeTest {

  @Test
  void parsesAllSpellings() {
    for (String off : new String[] {"off", "no", "FALSE", "0"}) {
      assertEquals(UpdateMode.OFF, UpdateMode.parse(off));
    }
    for (String on : new String[] {"on", "always", "Yes", "true", "1", "overwrite"}) {
      assertEquals(UpdateMode.ON, UpdateMode.parse(on));
    }
  }

  @Test
  void rejectsUnknownValues() {
    assertThrows(IllegalArgumentException.class, () -> UpdateMode.parse("sometimes"));
    assertThrows(IllegalArgumentException.class, () -> UpdateMode.parse(null));
  }
}
