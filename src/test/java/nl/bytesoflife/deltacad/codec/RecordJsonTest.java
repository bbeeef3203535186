package nl.bytesoflife.deltacad.codec;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecordJsonTest {

    @Test
    void parsesNestedStructure() {
        Map<String, Object> root = RecordJson.parseObject("""
                {
                  "type": "spline",
                  "closed": true,
                  "style": null,
                  "control_points": [ {"x": 1, "y": -2.5}, {"x": 3e2, "y": 0} ]
                }
                """);
        assertEquals("spline", root.get("type"));
        assertEquals(Boolean.TRUE, root.get("closed"));
        assertTrue(root.containsKey("style"));
        assertNull(root.get("style"));
        List<?> points = (List<?>) root.get("control_points");
        assertEquals(2, points.size());
        assertEquals(1, ((Map<?, ?>) points.get(0)).get("x"));
        assertEquals(-2.5, ((Map<?, ?>) points.get(0)).get("y"));
        assertEquals(300.0, ((Map<?, ?>) points.get(1)).get("x"));
    }

    @Test
    void parsesEscapes() {
        Object value = RecordJson.parse("\"a\\\"b\\\\c\\n\\u0041\"");
        assertEquals("a\"b\\c\nA", value);
    }

    @Test
    void largeIntegersBecomeLongs() {
        assertEquals(12345678901L, RecordJson.parse("12345678901"));
        assertEquals(42, RecordJson.parse(" 42 "));
    }

    @Test
    void writesCompactJson() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("type", "circle");
        record.put("radius", 2.5);
        record.put("sides", 6);
        record.put("closed", false);
        record.put("style", null);
        record.put("list", List.of(1, "two"));
        record.put("text", "quote\" tab\t");
        assertEquals("{\"type\":\"circle\",\"radius\":2.5,\"sides\":6,\"closed\":false,\"style\":null,"
                + "\"list\":[1,\"two\"],\"text\":\"quote\\\" tab\\t\"}", RecordJson.write(record));
    }

    @Test
    void writeThenParseKeepsValues() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("a", 0.1);
        record.put("b", -1e-7);
        record.put("c", 10.0);
        record.put("d", List.of(Map.of("x", 1.0)));
        assertEquals(record, RecordJson.parseObject(RecordJson.write(record)));
    }

    @Test
    void rejectsMalformedText() {
        assertThrows(DecodeException.class, () -> RecordJson.parse("{\"a\": 1"));
        assertThrows(DecodeException.class, () -> RecordJson.parse("{\"a\" 1}"));
        assertThrows(DecodeException.class, () -> RecordJson.parse("[1, 2] extra"));
        assertThrows(DecodeException.class, () -> RecordJson.parse("tru"));
        assertThrows(DecodeException.class, () -> RecordJson.parse("@"));
        assertThrows(DecodeException.class, () -> RecordJson.parse("1.2.3"));
        assertThrows(DecodeException.class, () -> RecordJson.parseObject("[1]"));
        assertThrows(DecodeException.class, () -> RecordJson.parse(null));
    }

    @Test
    void refusesNonFiniteNumbers() {
        assertThrows(IllegalArgumentException.class, () -> RecordJson.write(List.of(Double.NaN)));
    }

    @Test
    void deepNestingFailsAsDecodeError() {
        DecodeException e = assertThrows(DecodeException.class, () -> RecordJson.parse("[".repeat(200_000)));
        assertTrue(e.getMessage().contains("Nesting"), e.getMessage());
        assertThrows(DecodeException.class,
                () -> RecordJson.parse("{\"a\":".repeat(RecordJson.MAX_DEPTH + 1) + "1" + "}".repeat(RecordJson.MAX_DEPTH + 1)));
        assertThrows(DecodeException.class, () -> ProjectRecord.fromJson("{\"objects\":" + "[".repeat(5_000), false));
    }

    @Test
    void nestingUpToTheLimitIsAccepted() {
        String json = "[".repeat(RecordJson.MAX_DEPTH) + "]".repeat(RecordJson.MAX_DEPTH);
        Object value = RecordJson.parse(json);
        for (int i = 1; i < RecordJson.MAX_DEPTH; i++) {
            value = ((List<?>) value).get(0);
        }
        assertEquals(List.of(), value);
    }
}
