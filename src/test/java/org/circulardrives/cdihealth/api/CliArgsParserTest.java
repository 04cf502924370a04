package org.circulardrives.cdihealth.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "workers=8", " policy.availableSpareMin = 95 ", "out=", "workers=4"});

    assertEquals(Map.of("workers", "4", "policy.availableSpareMin", "95", "out", ""), map);
  }

  @Test
  void valueMayContainEquals() {
    assertEquals("service.version=1,site=lab",
        CliArgsParser.toMap(new String[] {"otelResourceAttributes=service.version=1,site=lab"})
            .get("otelResourceAttributes"));
  }

  @Test
  void nullAndBlankTokensAreIgnored() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, "  "}).isEmpty());
  }

  @Test
  void rejectsTokensWithoutKey() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"workers"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=8"}));
  }

  @Test
  void rejectsInvalidKeysAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9workers=8"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"out=a\u0001b"}));
  }
}
