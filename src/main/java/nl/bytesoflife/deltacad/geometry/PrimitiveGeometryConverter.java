package nl.bytesoflife.deltacad.geometry;

import nl.bytesoflife.deltacad.model.*;
import org.locationtech.jts.geom.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Tessellates primitives into JTS geometries: open outlines become {@link LineString}s, closed
 * outlines {@link LinearRing}s. Rounded and chamfered rectangle corners are traced.
 */
public class PrimitiveGeometryConverter {

    public static final int DEFAULT_CURVE_SEGMENTS = 64;

    private final GeometryFactory factory;
    private final int curveSegments;

    public PrimitiveGeometryConverter() {
        this(new GeometryFactory(), DEFAULT_CURVE_SEGMENTS);
    }

    /**
     * @param curveSegments segments used for a full circle or ellipse; arcs and corners use a share
     *                      proportional to their sweep
     */
    public PrimitiveGeometryConverter(GeometryFactory factory, int curveSegments) {
        this.factory = factory;
        this.curveSegments = Math.max(8, curveSegments);
    }

    public List<Geometry> convert(List<? extends Primitive> primitives) {
        List<Geometry> geometries = new ArrayList<>();
        for (Primitive p : primitives) {
            Geometry geom = convertPrimitive(p);
            if (geom != null && !geom.isEmpty()) {
                geometries.add(geom);
            }
        }
        return geometries;
    }

    public LineString convertPrimitive(Primitive primitive) {
        if (primitive instanceof Segment segment) {
            return line(List.of(segment.getStart(), segment.getEnd()));
        } else if (primitive instanceof Arc arc) {
            int n = Math.max(2, (int) Math.ceil(curveSegments * Math.abs(arc.getSpanAngle()) / 360.0));
            return line(arc.curvePoints(n));
        } else if (primitive instanceof Circle circle) {
            return ring(circleCoordinates(circle));
        } else if (primitive instanceof Ellipse ellipse) {
            return ring(ellipseCoordinates(ellipse));
        } else if (primitive instanceof Rectangle rect) {
            return ring(rectangleCoordinates(rect));
        } else if (primitive instanceof RegularPolygon polygon) {
            return ring(polygon.getVertices());
        } else if (primitive instanceof Spline spline) {
            List<Point> pts = spline.curvePoints();
            return spline.isClosed() && pts.size() >= 4 ? ring(pts) : line(pts);
        }
        return null;
    }

    /**
     * Area enclosed by a closed primitive, or null for open ones.
     */
    public Polygon toPolygon(Primitive primitive) {
        LineString outline = convertPrimitive(primitive);
        if (outline instanceof LinearRing ring) {
            return factory.createPolygon(ring);
        }
        return null;
    }

    public Envelope envelopeOf(List<? extends Primitive> primitives) {
        BoundingBox bbox = new BoundingBox();
        for (Primitive p : primitives) {
            bbox.extend(p.getBoundingBox());
        }
        return bbox.toEnvelope();
    }

    private List<Point> circleCoordinates(Circle circle) {
        List<Point> pts = new ArrayList<>(curveSegments);
        for (int i = 0; i < curveSegments; i++) {
            pts.add(circle.pointAtAngle(GeometryMath.TWO_PI * i / curveSegments));
        }
        return pts;
    }

    private List<Point> ellipseCoordinates(Ellipse ellipse) {
        List<Point> pts = new ArrayList<>(curveSegments);
        for (int i = 0; i < curveSegments; i++) {
            pts.add(ellipse.pointAtAngle(GeometryMath.TWO_PI * i / curveSegments));
        }
        return pts;
    }

    private List<Point> rectangleCoordinates(Rectangle rect) {
        List<Point> corners = rect.getCorners();
        double limit = Math.min(rect.getWidth(), rect.getHeight()) / 2;
        double radius = Math.min(rect.getCornerRadius(), limit);
        double chamfer = Math.min(rect.getChamferSize(), limit);
        if (radius <= 0 && chamfer <= 0) {
            return corners;
        }

        List<Point> pts = new ArrayList<>();
        int cornerSegments = Math.max(2, curveSegments / 4);
        // corners are counter-clockwise from bottom-left; corner i turns from direction (i-1) to i
        for (int i = 0; i < 4; i++) {
            Point corner = corners.get(i);
            Point prev = corners.get((i + 3) % 4);
            Point next = corners.get((i + 1) % 4);
            Point in = unit(prev, corner);
            Point out = unit(corner, next);
            if (radius > 0) {
                Point center = corner.minus(in.times(radius)).plus(out.times(radius));
                double startAngle = Math.atan2(-out.y(), -out.x());
                for (int s = 0; s <= cornerSegments; s++) {
                    pts.add(center.movePolar(radius, startAngle + (Math.PI / 2) * s / cornerSegments));
                }
            } else {
                pts.add(corner.minus(in.times(chamfer)));
                pts.add(corner.plus(out.times(chamfer)));
            }
        }
        return pts;
    }

    private static Point unit(Point from, Point to) {
        double len = from.distanceTo(to);
        return len == 0 ? Point.ORIGIN : to.minus(from).dividedBy(len);
    }

    private LineString line(List<Point> pts) {
        return factory.createLineString(toCoordinates(pts, false));
    }

    private LinearRing ring(List<Point> pts) {
        return factory.createLinearRing(toCoordinates(pts, true));
    }

    private static Coordinate[] toCoordinates(List<Point> pts, boolean close) {
        List<Coordinate> coords = new ArrayList<>(pts.size() + 1);
        for (Point p : pts) {
            coords.add(new Coordinate(p.x(), p.y()));
        }
        if (close && !coords.isEmpty() && !coords.get(0).equals2D(coords.get(coords.size() - 1))) {
            coords.add(new Coordinate(coords.get(0)));
        }
        return coords.toArray(new Coordinate[0]);
    }
}
