package org.circulardrives.cdihealth.application.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TelemetryJsonParserTest {
  private final TelemetryJsonParser parser = new TelemetryJsonParser();

  @Test
  void parsesNestedStructuresPreservingOrder() {
    Map<String, Object> doc = parser.parseObject(
        "{\"b\":1,\"a\":{\"list\":[true,null,\"x\"]},\"big\":12345678901234,\"ratio\":1.50}");

    assertEquals(List.of("b", "a", "big", "ratio"), List.copyOf(doc.keySet()));
    assertEquals(1, ((Number) doc.get("b")).intValue());
    assertEquals(12345678901234L, ((Number) doc.get("big")).longValue());
    assertEquals(new BigDecimal("1.50"), doc.get("ratio"));
    @SuppressWarnings("unchecked")
    List<Object> list = (List<Object>) ((Map<String, Object>) doc.get("a")).get("list");
    assertEquals(Boolean.TRUE, list.get(0));
    assertNull(list.get(1));
    assertEquals("x", list.get(2));
  }

  @Test
  void rejectsNonObjectRoot() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> parser.parseObject("[1]"));
    assertTrue(ex.getMessage().contains("must be an object"));
  }

  @Test
  void rejectsEmptyAndTruncatedDocuments() {
    assertThrows(IllegalArgumentException.class, () -> parser.parseObject("   "));
    assertThrows(IllegalArgumentException.class, () -> parser.parseObject("{\"a\": [1, 2"));
  }

  @Test
  void malformedTokensAreReportedAsInvalidPayload() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> parser.parseObject("{\"a\": tru}"));
    assertTrue(ex.getMessage().startsWith("Invalid JSON payload"), ex.getMessage());
  }

  @Test
  void rejectsTrailingContent() {
    assertThrows(IllegalArgumentException.class, () -> parser.parseObject("{} {}"));
  }
}
