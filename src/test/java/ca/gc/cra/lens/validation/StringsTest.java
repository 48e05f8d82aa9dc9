package ca.gc.cra.lens.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("export.json", Strings.requireNonBlank("in", "  export.json "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControl() {
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("in", "   "));
    assertEquals("in must not be blank", blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("in", "a\u0000b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("in", null));
  }

  @Test
  void splitListDropsEmptyEntries() {
    assertEquals(List.of("a.yaml", "b.yaml"), Strings.splitList("patterns", " a.yaml,, b.yaml ,"));
    assertEquals(List.of(), Strings.splitList("patterns", null));
    assertEquals(List.of(), Strings.splitList("patterns", "  "));
  }

  @Test
  void splitListKeepsFirstOfRepeatedEntries() {
    assertEquals(List.of("b.yaml", "a.yaml"), Strings.splitList("patterns", "b.yaml, a.yaml, b.yaml"));
  }

  @Test
  void splitListRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.splitList("patterns", "a.yaml,b\u0007"));
  }
}
