package nl.bytesoflife.deltacad.snap;

import nl.bytesoflife.deltacad.geometry.Point;
import nl.bytesoflife.deltacad.model.*;
import org.locationtech.jts.algorithm.LineIntersector;
import org.locationtech.jts.algorithm.RobustLineIntersector;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * Pairwise boundary intersections between primitives.
 * <p>
 * Each primitive is first broken into elementary pieces: segments (a segment, rectangle and polygon
 * sides), circles (circles and arcs, with the arc's sweep as a filter) and axis-aligned ellipses.
 * Splines contribute no pieces. Supported piece pairs are segment/segment, segment/circle,
 * segment/ellipse and circle/circle; other pairs yield nothing.
 */
public final class Intersections {

    private Intersections() {
    }

    sealed interface Piece permits LinePiece, CirclePiece, EllipsePiece {
    }

    record LinePiece(Point start, Point end) implements Piece {
    }

    /**
     * {@code arc} is null for a full circle.
     */
    record CirclePiece(Point center, double radius, Arc arc) implements Piece {
        boolean accepts(double x, double y) {
            if (arc == null) return true;
            return arc.containsAngle(Math.toDegrees(Math.atan2(y - center.y(), x - center.x())));
        }
    }

    record EllipsePiece(Point center, double radiusX, double radiusY) implements Piece {
    }

    /**
     * All intersection points of the two primitives' boundaries, tagged INTERSECTION with
     * {@code first} as source. Order: pieces of {@code first}, then pieces of {@code second}.
     */
    public static List<SnapPoint> between(Primitive first, Primitive second) {
        List<SnapPoint> result = new ArrayList<>();
        List<Piece> piecesA = piecesOf(first);
        List<Piece> piecesB = piecesOf(second);
        for (Piece a : piecesA) {
            for (Piece b : piecesB) {
                for (Point p : intersect(a, b)) {
                    result.add(new SnapPoint(p.x(), p.y(), SnapType.INTERSECTION, first));
                }
            }
        }
        return result;
    }

    static List<Piece> piecesOf(Primitive primitive) {
        List<Piece> pieces = new ArrayList<>();
        if (primitive instanceof Segment segment) {
            pieces.add(new LinePiece(segment.getStart(), segment.getEnd()));
        } else if (primitive instanceof Rectangle rect) {
            addRing(pieces, rect.getCorners());
        } else if (primitive instanceof RegularPolygon polygon) {
            addRing(pieces, polygon.getVertices());
        } else if (primitive instanceof Circle circle) {
            pieces.add(new CirclePiece(circle.getCenter(), circle.getRadius(), null));
        } else if (primitive instanceof Arc arc) {
            pieces.add(new CirclePiece(arc.getCenter(), arc.getRadius(), arc));
        } else if (primitive instanceof Ellipse ellipse) {
            pieces.add(new EllipsePiece(ellipse.getCenter(), ellipse.getRadiusX(), ellipse.getRadiusY()));
        }
        return pieces;
    }

    private static void addRing(List<Piece> pieces, List<Point> ring) {
        int n = ring.size();
        for (int i = 0; i < n; i++) {
            pieces.add(new LinePiece(ring.get(i), ring.get((i + 1) % n)));
        }
    }

    static List<Point> intersect(Piece a, Piece b) {
        if (a instanceof LinePiece la && b instanceof LinePiece lb) {
            return lineLine(la, lb);
        } else if (a instanceof LinePiece la && b instanceof CirclePiece cb) {
            return lineCircle(la, cb);
        } else if (a instanceof CirclePiece ca && b instanceof LinePiece lb) {
            return lineCircle(lb, ca);
        } else if (a instanceof LinePiece la && b instanceof EllipsePiece eb) {
            return lineEllipse(la, eb);
        } else if (a instanceof EllipsePiece ea && b instanceof LinePiece lb) {
            return lineEllipse(lb, ea);
        } else if (a instanceof CirclePiece ca && b instanceof CirclePiece cb) {
            return circleCircle(ca, cb);
        }
        return List.of();
    }

    /**
     * Single crossing point of two segments; collinear overlaps produce no point.
     */
    static List<Point> lineLine(LinePiece a, LinePiece b) {
        LineIntersector li = new RobustLineIntersector();
        li.computeIntersection(
                new Coordinate(a.start().x(), a.start().y()), new Coordinate(a.end().x(), a.end().y()),
                new Coordinate(b.start().x(), b.start().y()), new Coordinate(b.end().x(), b.end().y()));
        if (li.getIntersectionNum() != LineIntersector.POINT_INTERSECTION) {
            return List.of();
        }
        Coordinate c = li.getIntersection(0);
        return List.of(new Point(c.x, c.y));
    }

    static List<Point> lineCircle(LinePiece line, CirclePiece circle) {
        double x1 = line.start().x();
        double y1 = line.start().y();
        double dx = line.end().x() - x1;
        double dy = line.end().y() - y1;
        double fx = x1 - circle.center().x();
        double fy = y1 - circle.center().y();
        double r = circle.radius();

        double a = dx * dx + dy * dy;
        double b = 2 * (fx * dx + fy * dy);
        double c = fx * fx + fy * fy - r * r;

        List<Point> points = new ArrayList<>(2);
        for (double t : solveQuadratic(a, b, c)) {
            if (t < 0 || t > 1) continue;
            double x = x1 + t * dx;
            double y = y1 + t * dy;
            if (circle.accepts(x, y)) {
                points.add(new Point(x, y));
            }
        }
        return points;
    }

    static List<Point> lineEllipse(LinePiece line, EllipsePiece ellipse) {
        double rx = ellipse.radiusX();
        double ry = ellipse.radiusY();
        double x1 = line.start().x();
        double y1 = line.start().y();
        double dx = line.end().x() - x1;
        double dy = line.end().y() - y1;
        double xp = x1 - ellipse.center().x();
        double yp = y1 - ellipse.center().y();

        // b²(xp + t·dx)² + a²(yp + t·dy)² = a²b²
        double qa = (ry * dx) * (ry * dx) + (rx * dy) * (rx * dy);
        double qb = 2 * (ry * ry * xp * dx + rx * rx * yp * dy);
        double qc = (ry * xp) * (ry * xp) + (rx * yp) * (rx * yp) - (rx * ry) * (rx * ry);

        List<Point> points = new ArrayList<>(2);
        for (double t : solveQuadratic(qa, qb, qc)) {
            if (t >= 0 && t <= 1) {
                points.add(new Point(x1 + t * dx, y1 + t * dy));
            }
        }
        return points;
    }

    static List<Point> circleCircle(CirclePiece c1, CirclePiece c2) {
        double x1 = c1.center().x();
        double y1 = c1.center().y();
        double r1 = c1.radius();
        double r2 = c2.radius();
        double ex = c2.center().x() - x1;
        double ey = c2.center().y() - y1;
        double dSq = ex * ex + ey * ey;
        double d = Math.sqrt(dSq);

        if (d == 0 || d > r1 + r2 || d < Math.abs(r1 - r2)) {
            return List.of();
        }

        double a = (r1 * r1 - r2 * r2 + dSq) / (2 * d);
        double h = Math.sqrt(Math.max(0, r1 * r1 - a * a));
        double mx = x1 + a * ex / d;
        double my = y1 + a * ey / d;

        List<Point> points = new ArrayList<>(2);
        double[][] candidates = h == 0
                ? new double[][]{{mx, my}}
                : new double[][]{
                        {mx + h * ey / d, my - h * ex / d},
                        {mx - h * ey / d, my + h * ex / d}
                };
        for (double[] p : candidates) {
            if (c1.accepts(p[0], p[1]) && c2.accepts(p[0], p[1])) {
                points.add(new Point(p[0], p[1]));
            }
        }
        return points;
    }

    /**
     * Distinct real roots of a·t² + b·t + c = 0 in ascending order; a degenerate (a == 0) equation
     * has none.
     */
    private static double[] solveQuadratic(double a, double b, double c) {
        if (a == 0) {
            return new double[0];
        }
        double disc = b * b - 4 * a * c;
        if (disc < 0) {
            return new double[0];
        }
        if (disc == 0) {
            return new double[]{-b / (2 * a)};
        }
        double sqrt = Math.sqrt(disc);
        return new double[]{(-b - sqrt) / (2 * a), (-b + sqrt) / (2 * a)};
    }
}
