package nl.bytesoflife.deltacad.codec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON text form of data records. Objects read as {@code LinkedHashMap}, arrays as {@code ArrayList},
 * integral numbers as {@code Integer}/{@code Long} and all other numbers as {@code Double}.
 */
public final class RecordJson {

    public static final int MAX_DEPTH = 512;

    private RecordJson() {
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> parseObject(String json) throws DecodeException {
        Object result = parse(json);
        if (result instanceof Map) {
            return (Map<String, Object>) result;
        }
        throw new DecodeException("Expected JSON object at root");
    }

    public static Object parse(String json) throws DecodeException {
        if (json == null) {
            throw new DecodeException("JSON text is null");
        }
        Cursor c = new Cursor(json);
        Object value = readValue(c);
        c.skipWhitespace();
        if (c.hasMore()) {
            throw c.error("Trailing content");
        }
        return value;
    }

    private static Object readValue(Cursor c) {
        c.skipWhitespace();
        char ch = c.peek();
        switch (ch) {
            case '{':
                return readObject(c);
            case '[':
                return readArray(c);
            case '"':
                return readString(c);
            case 't':
                c.expectWord("true");
                return Boolean.TRUE;
            case 'f':
                c.expectWord("false");
                return Boolean.FALSE;
            case 'n':
                c.expectWord("null");
                return null;
            default:
                return readNumber(c);
        }
    }

    private static Map<String, Object> readObject(Cursor c) {
        c.expect('{');
        c.enter();
        Map<String, Object> map = new LinkedHashMap<>();
        c.skipWhitespace();
        if (c.peek() == '}') {
            c.advance();
            c.leave();
            return map;
        }
        do {
            c.skipWhitespace();
            String key = readString(c);
            c.expect(':');
            map.put(key, readValue(c));
            c.skipWhitespace();
        } while (c.consumeIf(','));
        c.expect('}');
        c.leave();
        return map;
    }

    private static List<Object> readArray(Cursor c) {
        c.expect('[');
        c.enter();
        List<Object> list = new ArrayList<>();
        c.skipWhitespace();
        if (c.peek() == ']') {
            c.advance();
            c.leave();
            return list;
        }
        do {
            list.add(readValue(c));
            c.skipWhitespace();
        } while (c.consumeIf(','));
        c.expect(']');
        c.leave();
        return list;
    }

    private static String readString(Cursor c) {
        c.expect('"');
        StringBuilder sb = new StringBuilder();
        while (c.peek() != '"') {
            char ch = c.advance();
            if (ch != '\\') {
                sb.append(ch);
                continue;
            }
            char esc = c.advance();
            switch (esc) {
                case '"', '\\', '/' -> sb.append(esc);
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'u' -> {
                    String hex = "" + c.advance() + c.advance() + c.advance() + c.advance();
                    try {
                        sb.append((char) Integer.parseInt(hex, 16));
                    } catch (NumberFormatException e) {
                        throw c.error("Bad unicode escape '" + hex + "'");
                    }
                }
                default -> throw c.error("Bad escape '\\" + esc + "'");
            }
        }
        c.advance();
        return sb.toString();
    }

    private static Number readNumber(Cursor c) {
        int start = c.pos;
        while (c.hasMore() && isNumberChar(c.peek())) {
            c.advance();
        }
        String s = c.input.substring(start, c.pos);
        if (s.isEmpty()) {
            throw c.error("Unexpected character '" + c.peek() + "'");
        }
        try {
            if (s.contains(".") || s.contains("e") || s.contains("E")) {
                return Double.parseDouble(s);
            }
            long value = Long.parseLong(s);
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return (int) value;
            }
            return value;
        } catch (NumberFormatException e) {
            throw new DecodeException("Malformed number '" + s + "' at position " + start, e);
        }
    }

    private static boolean isNumberChar(char c) {
        return (c >= '0' && c <= '9') || c == '-' || c == '+' || c == '.' || c == 'e' || c == 'E';
    }

    // --- writing ---

    public static String write(Object value) {
        StringBuilder sb = new StringBuilder();
        writeValue(sb, value);
        return sb.toString();
    }

    private static void writeValue(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String s) {
            writeString(sb, s);
        } else if (value instanceof Boolean b) {
            sb.append(b.booleanValue());
        } else if (value instanceof Integer || value instanceof Long) {
            sb.append(value);
        } else if (value instanceof Number n) {
            double d = n.doubleValue();
            if (!Double.isFinite(d)) {
                throw new IllegalArgumentException("Cannot write non-finite number " + d);
            }
            sb.append(d);
        } else if (value instanceof Map<?, ?> map) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (!first) sb.append(',');
                first = false;
                writeString(sb, String.valueOf(e.getKey()));
                sb.append(':');
                writeValue(sb, e.getValue());
            }
            sb.append('}');
        } else if (value instanceof Iterable<?> items) {
            sb.append('[');
            boolean first = true;
            for (Object item : items) {
                if (!first) sb.append(',');
                first = false;
                writeValue(sb, item);
            }
            sb.append(']');
        } else if (value instanceof Enum<?> e) {
            writeString(sb, e.name());
        } else {
            throw new IllegalArgumentException("Cannot write " + value.getClass().getSimpleName() + " as JSON");
        }
    }

    private static void writeString(StringBuilder sb, String s) {
        sb.append('"');
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 32) {
                        sb.append(String.format(Locale.US, "\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    private static final class Cursor {
        private final String input;
        private int pos;
        private int depth;

        Cursor(String input) {
            this.input = input;
        }

        void skipWhitespace() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }

        boolean hasMore() {
            return pos < input.length();
        }

        char peek() {
            if (pos >= input.length()) throw error("Unexpected end of JSON");
            return input.charAt(pos);
        }

        char advance() {
            char c = peek();
            pos++;
            return c;
        }

        boolean consumeIf(char c) {
            if (pos < input.length() && input.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }

        void expect(char c) {
            skipWhitespace();
            if (pos >= input.length() || input.charAt(pos) != c) {
                throw error("Expected '" + c + "' but got "
                        + (pos < input.length() ? "'" + input.charAt(pos) + "'" : "EOF"));
            }
            pos++;
        }

        void enter() {
            if (++depth > MAX_DEPTH) {
                throw error("Nesting deeper than " + MAX_DEPTH + " levels");
            }
        }

        void leave() {
            depth--;
        }

        void expectWord(String word) {
            if (!input.startsWith(word, pos)) {
                throw error("Expected '" + word + "'");
            }
            pos += word.length();
        }

        DecodeException error(String message) {
            return new DecodeException(message + " at position " + pos);
        }
    }
}
