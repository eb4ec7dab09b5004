package helios.panelcal.service;

import helios.panelcal.model.CaptureEvent;
import helios.panelcal.model.CaptureEventSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Capture event source that replays a fixed list of events, for headless runs and tests.
 *
 * <p>Once closed the source reports no further events. {@link #getCloseCount()} and
 * {@link #getConsumedCount()} expose how the capture session used it.</p>
 */
public class ScriptedCaptureEvents implements CaptureEventSource {
    private static final Logger logger = LoggerFactory.getLogger(ScriptedCaptureEvents.class);

    private final List<CaptureEvent> events;
    private final Iterator<CaptureEvent> iterator;
    private int consumed;
    private int closeCount;

    public ScriptedCaptureEvents(List<CaptureEvent> events) {
        this.events = List.copyOf(events);
        this.iterator = this.events.iterator();
    }

    public static ScriptedCaptureEvents of(CaptureEvent... events) {
        return new ScriptedCaptureEvents(List.of(events));
    }

    /**
     * Clicks at each {@code (x, y)} pair in order, then snaps back to the first one.
     *
     * @param xy alternating x and y coordinates of at least three vertices
     */
    public static ScriptedCaptureEvents closedRing(double... xy) {
        if (xy.length < 6 || xy.length % 2 != 0) {
            throw new IllegalArgumentException("Need x/y pairs for at least three vertices");
        }
        List<CaptureEvent> events = new ArrayList<>();
        for (int i = 0; i < xy.length; i += 2) {
            events.add(CaptureEvent.click(xy[i], xy[i + 1]));
        }
        events.add(CaptureEvent.click(xy[0], xy[1]));
        return new ScriptedCaptureEvents(events);
    }

    @Override
    public boolean hasNext() {
        return closeCount == 0 && iterator.hasNext();
    }

    @Override
    public CaptureEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more scripted events");
        }
        consumed++;
        return iterator.next();
    }

    @Override
    public void close() {
        closeCount++;
        logger.debug("Scripted event source closed after {} of {} events", consumed, events.size());
    }

    public int getCloseCount() {
        return closeCount;
    }

    public int getConsumedCount() {
        return consumed;
    }
}
