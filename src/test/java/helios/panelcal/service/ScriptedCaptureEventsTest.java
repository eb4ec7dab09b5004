package helios.panelcal.service;

import helios.panelcal.model.CaptureEvent;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class ScriptedCaptureEventsTest {

    @Test
    void testClosedRing_AppendsSnapClick() {
        ScriptedCaptureEvents events = ScriptedCaptureEvents.closedRing(1, 2, 8, 2, 8, 9);

        int count = 0;
        CaptureEvent last = null;
        while (events.hasNext()) {
            last = events.next();
            count++;
        }
        assertEquals(4, count);
        assertEquals(CaptureEvent.click(1, 2), last);
    }

    @Test
    void testClose_StopsIteration() {
        ScriptedCaptureEvents events = ScriptedCaptureEvents.of(CaptureEvent.click(1, 1), CaptureEvent.commit());
        events.next();
        events.close();

        assertFalse(events.hasNext());
        assertThrows(NoSuchElementException.class, events::next);
        assertEquals(1, events.getCloseCount());
        assertEquals(1, events.getConsumedCount());
    }

    @Test
    void testClosedRing_RejectsTooFewVertices() {
        assertThrows(IllegalArgumentException.class, () -> ScriptedCaptureEvents.closedRing(1, 2, 3, 4));
        assertThrows(IllegalArgumentException.class, () -> ScriptedCaptureEvents.closedRing(1, 2, 3, 4, 5));
    }
}
