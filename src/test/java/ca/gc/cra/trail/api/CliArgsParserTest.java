package ca.gc.cra.trail.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsAndLaterDuplicatesWin() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"language=ja", "model=gpt", "language= en "});
    assertEquals("en", map.get("language"));
    assertEquals("gpt", map.get("model"));
  }

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"prompt=a=b"});
    assertEquals("a=b", map.get("prompt"));
  }

  @Test
  void freeTextKeepsWhitespaceAndNewlines() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"prompt=  line one\nline two"});
    assertEquals("  line one\nline two", map.get("prompt"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"model="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9key=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"model=a\tb"}));
  }

  @Test
  void nullAndBlankArgumentsAreIgnored() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, " "}).isEmpty());
  }
}
