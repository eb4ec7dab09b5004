package helios.panelcal.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Immutable, ring-closed polygon in pixel space, as handed out by a closed
 * {@link PolygonCaptureSession}.
 *
 * <p>The stored vertex list keeps the closing vertex: the last stored vertex equals either
 * the first one (closed by snapping) or the last drawn one (closed by commit). Edges are
 * taken between consecutive stored vertices plus the implicit edge from the last vertex
 * back to the first, so both closing styles describe the same ring.</p>
 *
 * <p>Containment uses pixel-fill semantics: a point belongs to the region when it lies
 * strictly inside the ring (even-odd rule) or on one of its edges.</p>
 *
 * @author helios-panelcal contributors
 */
public final class PanelPolygon {

    /** Tolerance, in pixels, for a point to count as lying on an edge. */
    private static final double EDGE_EPSILON = 1e-9;

    private final List<PixelPoint> vertices;
    private final double minX;
    private final double minY;
    private final double maxX;
    private final double maxY;

    /**
     * Creates a polygon from its stored vertex sequence.
     *
     * @param vertices vertex sequence including the closing vertex; must not be empty
     */
    public PanelPolygon(List<PixelPoint> vertices) {
        if (vertices == null || vertices.isEmpty()) {
            throw new IllegalArgumentException("Polygon needs at least one vertex");
        }
        this.vertices = Collections.unmodifiableList(new ArrayList<>(vertices));

        double x0 = Double.POSITIVE_INFINITY, y0 = Double.POSITIVE_INFINITY;
        double x1 = Double.NEGATIVE_INFINITY, y1 = Double.NEGATIVE_INFINITY;
        for (PixelPoint p : this.vertices) {
            x0 = Math.min(x0, p.x());
            y0 = Math.min(y0, p.y());
            x1 = Math.max(x1, p.x());
            y1 = Math.max(y1, p.y());
        }
        this.minX = x0;
        this.minY = y0;
        this.maxX = x1;
        this.maxY = y1;
    }

    public List<PixelPoint> getVertices() {
        return vertices;
    }

    public int getVertexCount() {
        return vertices.size();
    }

    /**
     * Number of distinct vertex positions, ignoring the closing duplicate.
     */
    public int getDistinctVertexCount() {
        return new LinkedHashSet<>(vertices).size();
    }

    /**
     * A ring needs three distinct vertices to enclose an area.
     */
    public boolean isUsable() {
        return getDistinctVertexCount() >= 3;
    }

    public double getMinX() { return minX; }
    public double getMinY() { return minY; }
    public double getMaxX() { return maxX; }
    public double getMaxY() { return maxY; }

    /**
     * Tests whether a pixel-space point lies inside the ring or on its boundary.
     *
     * @param x column coordinate
     * @param y row coordinate
     * @return true when the point is inside or on an edge
     */
    public boolean contains(double x, double y) {
        if (x < minX - EDGE_EPSILON || x > maxX + EDGE_EPSILON
                || y < minY - EDGE_EPSILON || y > maxY + EDGE_EPSILON) {
            return false;
        }

        int n = vertices.size();
        boolean inside = false;
        for (int i = 0, j = n - 1; i < n; j = i++) {
            PixelPoint a = vertices.get(i);
            PixelPoint b = vertices.get(j);

            if (onSegment(x, y, a, b)) {
                return true;
            }
            if ((a.y() > y) != (b.y() > y)) {
                double crossX = (b.x() - a.x()) * (y - a.y()) / (b.y() - a.y()) + a.x();
                if (x < crossX) {
                    inside = !inside;
                }
            }
        }
        return inside;
    }

    private static boolean onSegment(double x, double y, PixelPoint a, PixelPoint b) {
        double cross = (b.x() - a.x()) * (y - a.y()) - (b.y() - a.y()) * (x - a.x());
        if (Math.abs(cross) > EDGE_EPSILON) {
            return false;
        }
        return x >= Math.min(a.x(), b.x()) - EDGE_EPSILON
                && x <= Math.max(a.x(), b.x()) + EDGE_EPSILON
                && y >= Math.min(a.y(), b.y()) - EDGE_EPSILON
                && y <= Math.max(a.y(), b.y()) + EDGE_EPSILON;
    }

    @Override
    public String toString() {
        return "PanelPolygon" + vertices;
    }
}
