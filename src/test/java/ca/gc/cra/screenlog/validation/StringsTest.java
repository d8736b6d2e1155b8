package ca.gc.cra.screenlog.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireKeyAllowsDottedSettingNames() {
    assertEquals("retention.policy", Strings.requireKey("key", "retention.policy"));
  }

  @Test
  void requireKeyRejectsSpaces() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireKey("key", "retention policy"));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("attrs", "env=☃", 64));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abc", 2));
  }
}
