package nl.bytesoflife.deltacad.codec;

import nl.bytesoflife.deltacad.geometry.Point;
import nl.bytesoflife.deltacad.model.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts primitives to and from tagged data records ({@code Map<String, Object>} trees).
 * Field names are the persisted contract:
 * <pre>
 * line      {type, start:{x,y}, end:{x,y}, style}
 * circle    {type, center, radius, style}
 * arc       {type, center, radius, start_angle, span_angle, style}
 * rectangle {type, p1, p2, style, corner_radius, chamfer_size}
 * ellipse   {type, center, radius_x, radius_y, style}
 * polygon   {type, center, radius, num_sides, polygon_type, rotation, style}
 * spline    {type, control_points:[...], closed, style}
 * </pre>
 * A missing {@code style} decodes as {@link Primitive#DEFAULT_STYLE}.
 */
public final class PrimitiveCodec {

    public static final String TYPE = "type";
    public static final String STYLE = "style";

    private PrimitiveCodec() {
    }

    public static Map<String, Object> encode(Primitive primitive) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(TYPE, primitive.getType().getTag());

        if (primitive instanceof Segment segment) {
            record.put("start", encodePoint(segment.getStart()));
            record.put("end", encodePoint(segment.getEnd()));
        } else if (primitive instanceof Circle circle) {
            record.put("center", encodePoint(circle.getCenter()));
            record.put("radius", circle.getRadius());
        } else if (primitive instanceof Arc arc) {
            record.put("center", encodePoint(arc.getCenter()));
            record.put("radius", arc.getRadius());
            record.put("start_angle", arc.getStartAngle());
            record.put("span_angle", arc.getSpanAngle());
        } else if (primitive instanceof Rectangle rect) {
            record.put("p1", encodePoint(rect.getP1()));
            record.put("p2", encodePoint(rect.getP2()));
            record.put("corner_radius", rect.getCornerRadius());
            record.put("chamfer_size", rect.getChamferSize());
        } else if (primitive instanceof Ellipse ellipse) {
            record.put("center", encodePoint(ellipse.getCenter()));
            record.put("radius_x", ellipse.getRadiusX());
            record.put("radius_y", ellipse.getRadiusY());
        } else if (primitive instanceof RegularPolygon polygon) {
            record.put("center", encodePoint(polygon.getCenter()));
            record.put("radius", polygon.getRadius());
            record.put("num_sides", polygon.getNumSides());
            record.put("polygon_type", polygon.getVariant().getRecordName());
            record.put("rotation", polygon.getRotation());
        } else if (primitive instanceof Spline spline) {
            List<Object> points = new ArrayList<>();
            for (Point p : spline.getControlPointList()) {
                points.add(encodePoint(p));
            }
            record.put("control_points", points);
            record.put("closed", spline.isClosed());
        }

        record.put(STYLE, primitive.getStyleName());
        return record;
    }

    public static Primitive decode(Map<String, ?> record) throws DecodeException {
        if (record == null) {
            throw new DecodeException("Record is null");
        }
        Object tag = record.get(TYPE);
        PrimitiveType type = tag instanceof String s ? PrimitiveType.fromTag(s) : null;
        if (type == null) {
            throw new DecodeException("Unknown primitive type: " + tag, tag != null ? tag.toString() : null, TYPE);
        }

        Fields f = new Fields(record, type.getTag());
        String style = f.optionalString(STYLE, Primitive.DEFAULT_STYLE);

        return switch (type) {
            case SEGMENT -> new Segment(f.point("start"), f.point("end"), style);
            case CIRCLE -> new Circle(f.point("center"), f.number("radius"), style);
            case ARC -> new Arc(f.point("center"), f.number("radius"),
                    f.number("start_angle"), f.number("span_angle"), style);
            case RECTANGLE -> new Rectangle(f.point("p1"), f.point("p2"), style,
                    f.optionalNumber("corner_radius", 0), f.optionalNumber("chamfer_size", 0));
            case ELLIPSE -> new Ellipse(f.point("center"), f.number("radius_x"), f.number("radius_y"), style);
            case POLYGON -> decodePolygon(f, style);
            case SPLINE -> decodeSpline(f, style);
        };
    }

    private static RegularPolygon decodePolygon(Fields f, String style) {
        String variantName = f.optionalString("polygon_type", PolygonVariant.INSCRIBED.getRecordName());
        PolygonVariant variant = PolygonVariant.fromRecordName(variantName);
        if (variant == null) {
            throw f.error("polygon_type", "unknown polygon type '" + variantName + "'");
        }
        double sidesValue = f.optionalNumber("num_sides", RegularPolygon.DEFAULT_SIDES);
        if (sidesValue != Math.rint(sidesValue)) {
            throw f.error("num_sides", "expected a whole number, got " + sidesValue);
        }
        if (sidesValue > RegularPolygon.MAX_RECORD_SIDES) {
            throw f.error("num_sides", "more than " + RegularPolygon.MAX_RECORD_SIDES + " sides");
        }
        // below the minimum is coerced by the constructor
        int sides = (int) sidesValue;
        return new RegularPolygon(f.point("center"), f.number("radius"), sides, variant,
                f.optionalNumber("rotation", 0), style);
    }

    private static Spline decodeSpline(Fields f, String style) {
        Object raw = f.record.get("control_points");
        if (!(raw instanceof List<?> list)) {
            throw f.error("control_points", "missing or not a list");
        }
        if (list.size() < Spline.MIN_POINTS) {
            throw f.error("control_points", "needs at least " + Spline.MIN_POINTS + " points, got " + list.size());
        }
        List<Point> points = new ArrayList<>(list.size());
        for (Object item : list) {
            points.add(f.toPoint("control_points", item));
        }
        return new Spline(points, f.optionalBoolean("closed", false), style);
    }

    public static Map<String, Object> encodePoint(Point p) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("x", p.x());
        map.put("y", p.y());
        return map;
    }

    /**
     * Typed access to one record's fields, failing with the record type and field name.
     */
    static final class Fields {
        private final Map<String, ?> record;
        private final String type;

        Fields(Map<String, ?> record, String type) {
            this.record = record;
            this.type = type;
        }

        DecodeException error(String field, String problem) {
            return new DecodeException("Invalid " + type + " record, field '" + field + "': " + problem, type, field);
        }

        double number(String field) {
            Object value = record.get(field);
            if (value == null) {
                throw error(field, "missing");
            }
            return toDouble(field, value);
        }

        double optionalNumber(String field, double defaultValue) {
            Object value = record.get(field);
            return value == null ? defaultValue : toDouble(field, value);
        }

        String optionalString(String field, String defaultValue) {
            Object value = record.get(field);
            if (value == null) return defaultValue;
            if (value instanceof String s) return s;
            throw error(field, "expected a string");
        }

        boolean optionalBoolean(String field, boolean defaultValue) {
            Object value = record.get(field);
            if (value == null) return defaultValue;
            if (value instanceof Boolean b) return b;
            throw error(field, "expected a boolean");
        }

        Point point(String field) {
            Object value = record.get(field);
            if (value == null) {
                throw error(field, "missing");
            }
            return toPoint(field, value);
        }

        Point toPoint(String field, Object value) {
            if (!(value instanceof Map<?, ?> map)) {
                throw error(field, "expected an {x, y} object");
            }
            Object x = map.get("x");
            Object y = map.get("y");
            if (x == null || y == null) {
                throw error(field, "point needs both x and y");
            }
            return new Point(toDouble(field, x), toDouble(field, y));
        }

        private double toDouble(String field, Object value) {
            double d;
            if (value instanceof Number n) {
                d = n.doubleValue();
            } else if (value instanceof String s) {
                try {
                    d = Double.parseDouble(s.trim());
                } catch (NumberFormatException e) {
                    throw error(field, "not a number: '" + s + "'");
                }
            } else {
                throw error(field, "expected a number");
            }
            if (!Double.isFinite(d)) {
                throw error(field, "not finite");
            }
            return d;
        }
    }
}
