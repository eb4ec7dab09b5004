package helios.panelcal.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PanelPolygonTest {

    private static PanelPolygon square(double x0, double y0, double x1, double y1) {
        return new PanelPolygon(List.of(
                new PixelPoint(x0, y0), new PixelPoint(x1, y0),
                new PixelPoint(x1, y1), new PixelPoint(x0, y1),
                new PixelPoint(x0, y0)));
    }

    @Test
    void testContains_InteriorAndExterior() {
        PanelPolygon polygon = square(2, 2, 6, 6);
        assertTrue(polygon.contains(4, 4));
        assertTrue(polygon.contains(2.5, 5.5));
        assertFalse(polygon.contains(1.5, 4));
        assertFalse(polygon.contains(4, 6.5));
    }

    @Test
    void testContains_BoundaryCountsAsInside() {
        PanelPolygon polygon = square(2, 2, 6, 6);
        assertTrue(polygon.contains(2, 4));
        assertTrue(polygon.contains(6, 6));
        assertTrue(polygon.contains(4, 2));
    }

    @Test
    void testContains_Triangle() {
        PanelPolygon triangle = new PanelPolygon(List.of(
                new PixelPoint(0, 0), new PixelPoint(10, 0), new PixelPoint(0, 10), new PixelPoint(0, 0)));
        assertTrue(triangle.contains(2, 2));
        assertTrue(triangle.contains(5, 5));
        assertFalse(triangle.contains(6, 6));
    }

    @Test
    void testBounds() {
        PanelPolygon polygon = square(1.5, 2.5, 7.25, 3.75);
        assertEquals(1.5, polygon.getMinX());
        assertEquals(2.5, polygon.getMinY());
        assertEquals(7.25, polygon.getMaxX());
        assertEquals(3.75, polygon.getMaxY());
    }

    @Test
    void testUsability() {
        assertTrue(square(0, 0, 4, 4).isUsable());
        assertEquals(4, square(0, 0, 4, 4).getDistinctVertexCount());

        PanelPolygon line = new PanelPolygon(List.of(
                new PixelPoint(0, 0), new PixelPoint(5, 5), new PixelPoint(5, 5)));
        assertFalse(line.isUsable());
    }

    @Test
    void testVerticesAreImmutable() {
        PanelPolygon polygon = square(0, 0, 4, 4);
        assertThrows(UnsupportedOperationException.class,
                () -> polygon.getVertices().add(new PixelPoint(1, 1)));
        assertThrows(IllegalArgumentException.class, () -> new PanelPolygon(List.of()));
    }
}
