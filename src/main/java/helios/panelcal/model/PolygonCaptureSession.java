package helios.panelcal.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Finite-state machine that turns a stream of click and commit events into one closed
 * polygon in pixel coordinates.
 *
 * <p>States are {@code EMPTY -> DRAWING -> CLOSED}:</p>
 * <ul>
 *   <li>A click inside the raster frame appends a vertex. Once at least two vertices exist,
 *       a click closer than the snap distance to the first vertex instead appends a copy of
 *       the first vertex and closes the ring. Before that, a click near the first vertex is
 *       appended like any other.</li>
 *   <li>A commit while drawing appends a copy of the last vertex and closes the ring.
 *       A commit with no vertices is ignored.</li>
 *   <li>Clicks outside {@code [0, width] x [0, height]} are ignored.</li>
 *   <li>{@code CLOSED} is terminal. The event source is released on entering it and no
 *       further events are consumed.</li>
 * </ul>
 *
 * <p>The session owns its vertex list until closure and only hands out immutable
 * snapshots. One session captures one polygon; create a new session per file.</p>
 *
 * @author helios-panelcal contributors
 * @since 0.1.0
 */
public class PolygonCaptureSession {
    private static final Logger logger = LoggerFactory.getLogger(PolygonCaptureSession.class);

    private final double snapDistance;
    private final double frameWidth;
    private final double frameHeight;

    private final List<PixelPoint> vertices = new ArrayList<>();
    private CaptureState state = CaptureState.EMPTY;
    private PanelPolygon polygon;

    private CaptureEventSource source;
    private boolean sourceReleased;

    /**
     * @param snapDistance distance in pixels below which a click snaps to the first vertex
     * @param frameWidth   raster width in pixels; clicks beyond it are rejected
     * @param frameHeight  raster height in pixels; clicks beyond it are rejected
     */
    public PolygonCaptureSession(double snapDistance, double frameWidth, double frameHeight) {
        if (!(snapDistance > 0)) {
            throw new IllegalArgumentException("Snap distance must be positive, got " + snapDistance);
        }
        if (!(frameWidth > 0) || !(frameHeight > 0)) {
            throw new IllegalArgumentException("Frame size must be positive, got " + frameWidth + "x" + frameHeight);
        }
        this.snapDistance = snapDistance;
        this.frameWidth = frameWidth;
        this.frameHeight = frameHeight;
    }

    /**
     * Consumes events from the source until the polygon closes or the stream ends.
     *
     * <p>Blocks for as long as the source blocks; there is no timeout. The source is closed
     * exactly once on every exit path, including exceptions thrown by the source.</p>
     *
     * @param eventSource stream of capture events
     * @return the closed polygon, or empty when the stream ended before closure
     */
    public Optional<PanelPolygon> capture(CaptureEventSource eventSource) {
        if (eventSource == null) {
            throw new IllegalArgumentException("Event source must not be null");
        }
        if (this.source != null) {
            throw new IllegalStateException("Capture session has already been used");
        }
        this.source = eventSource;
        try {
            while (state != CaptureState.CLOSED && eventSource.hasNext()) {
                accept(eventSource.next());
            }
        } finally {
            releaseSource();
        }

        if (state != CaptureState.CLOSED) {
            logger.info("Event stream ended in state {} with {} vertices; no polygon produced",
                    state, vertices.size());
            return Optional.empty();
        }
        return Optional.of(polygon);
    }

    /**
     * Applies a single event to the state machine.
     *
     * @param event the event
     * @return true if the event changed the recorded vertices
     */
    public boolean accept(CaptureEvent event) {
        if (state == CaptureState.CLOSED) {
            logger.debug("Ignoring {} after polygon closed", event.kind());
            return false;
        }

        return switch (event.kind()) {
            case POINT_CLICK -> handleClick(event.point());
            case COMMIT -> handleCommit();
        };
    }

    private boolean handleClick(PixelPoint point) {
        if (!insideFrame(point)) {
            logger.debug("Rejecting click {} outside raster frame {}x{}", point, frameWidth, frameHeight);
            return false;
        }

        // a snap needs two drawn vertices, so the stored ring has at least three
        if (vertices.size() >= 2 && point.distanceTo(vertices.get(0)) < snapDistance) {
            logger.debug("Click {} snapped to first vertex {}", point, vertices.get(0));
            vertices.add(vertices.get(0));
            close();
            return true;
        }

        vertices.add(point);
        state = CaptureState.DRAWING;
        logger.debug("Vertex {} added at {}", vertices.size(), point);
        notifyProgress();
        return true;
    }

    private boolean handleCommit() {
        if (state == CaptureState.EMPTY) {
            logger.debug("Ignoring commit with no vertices");
            return false;
        }
        vertices.add(vertices.get(vertices.size() - 1));
        close();
        return true;
    }

    private void close() {
        state = CaptureState.CLOSED;
        polygon = new PanelPolygon(vertices);
        logger.info("Polygon closed with {} stored vertices", vertices.size());
        notifyProgress();
        releaseSource();
    }

    private void notifyProgress() {
        if (source != null && !sourceReleased) {
            source.onProgress(state, getVertices());
        }
    }

    private void releaseSource() {
        if (source != null && !sourceReleased) {
            sourceReleased = true;
            source.close();
        }
    }

    private boolean insideFrame(PixelPoint p) {
        return p.x() >= 0 && p.x() <= frameWidth && p.y() >= 0 && p.y() <= frameHeight;
    }

    public CaptureState getState() {
        return state;
    }

    public boolean isClosed() {
        return state == CaptureState.CLOSED;
    }

    /**
     * @return snapshot of the vertices recorded so far, including a closing vertex once closed
     */
    public List<PixelPoint> getVertices() {
        return Collections.unmodifiableList(new ArrayList<>(vertices));
    }

    /**
     * Returns the closed polygon.
     *
     * @return the immutable polygon
     * @throws IncompletePolygonException if the session is not closed
     */
    public PanelPolygon getPolygon() throws IncompletePolygonException {
        if (state != CaptureState.CLOSED) {
            throw new IncompletePolygonException("Polygon is not closed (state " + state + ")", state);
        }
        return polygon;
    }
}
