package helios.panelcal.model;

import java.util.Iterator;
import java.util.List;

/**
 * Ordered stream of capture events backed by some delivery mechanism (a window's mouse and
 * key handlers, a script, a test list).
 *
 * <p>{@link #hasNext()} may block until the next event arrives; it returns false once the
 * stream has ended without further events. {@link #close()} releases the underlying
 * subscription. A {@link PolygonCaptureSession} calls it exactly once, when the polygon
 * closes or when the stream ends, and never reads from the source afterwards.</p>
 */
public interface CaptureEventSource extends Iterator<CaptureEvent>, AutoCloseable {

    /**
     * Called by the capture session every time its vertex list changes, so interactive
     * sources can draw feedback. The default does nothing.
     *
     * @param state    state after the change
     * @param polygon  snapshot of the recorded vertices
     */
    default void onProgress(CaptureState state, List<PixelPoint> polygon) {
    }

    /**
     * Releases the event subscription. Must not throw checked exceptions.
     */
    @Override
    void close();
}
