package ca.gc.cra.lumen.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSupportTest {

  private final JsonSupport json = new JsonSupport();

  @Test
  void parsesNestedObjects() {
    Map<String, Object> parsed = json.parseObject(
        "{\"cmd\":\"eval\",\"info\":{\"varRef\":10001,\"list\":[1,true,null,\"x\"]}}");

    assertEquals("eval", parsed.get("cmd"));
    @SuppressWarnings("unchecked")
    Map<String, Object> info = (Map<String, Object>) parsed.get("info");
    assertEquals(10001, ((Number) info.get("varRef")).intValue());
    assertEquals(4, ((List<?>) info.get("list")).size());
  }

  @Test
  void emptyDocumentIsEmptyMap() {
    assertTrue(json.parseObject("").isEmpty());
  }

  @Test
  void rejectsMalformedAndNonObjectDocuments() {
    assertThrows(IllegalArgumentException.class, () -> json.parse("{\"a\":"));
    assertThrows(IllegalArgumentException.class, () -> json.parseObject("[1,2]"));
    assertThrows(IllegalArgumentException.class, () -> json.parse("{} {}"));
  }

  @Test
  void parseErrorNamesTheJacksonProblem() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> json.parse("{\"cmd\":\"output\",\"info\":{}"));

    assertTrue(ex.getMessage().startsWith("Invalid JSON payload: "));
    assertTrue(ex.getCause() instanceof JsonProcessingException);
    assertFalse(ex.getMessage().contains("[Source:"), ex.getMessage());
  }

  @Test
  void writesCompactJsonPreservingOrder() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("seq", 7L);
    body.put("path", "a\\b.lua");
    body.put("flags", List.of(true, 1.5));
    body.put("none", null);

    assertEquals("{\"seq\":7,\"path\":\"a\\\\b.lua\",\"flags\":[true,1.5],\"none\":null}", json.write(body));
  }
}
