package work.stepweave.engine.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class FinishReasonTest {
    @Test
    void mapsProviderSpellings() {
        assertEquals(FinishReason.STOP, FinishReason.from("stop"));
        assertEquals(FinishReason.STOP, FinishReason.from("end_turn"));
        assertEquals(FinishReason.LENGTH, FinishReason.from("length"));
        assertEquals(FinishReason.LENGTH, FinishReason.from(" MAX_TOKENS "));
        assertEquals(FinishReason.CONTENT_FILTER, FinishReason.from("content_filter"));
        assertEquals(FinishReason.OTHER, FinishReason.from("tool_calls"));
    }

    @Test
    void missingReasonMeansStop() {
        assertEquals(FinishReason.STOP, FinishReason.from(null));
        assertEquals(FinishReason.STOP, FinishReason.from(""));
    }

    @Test
    void onlyLengthIsTruncated() {
        assertTrue(FinishReason.LENGTH.isTruncated());
        assertFalse(FinishReason.STOP.isTruncated());
        assertFalse(FinishReason.CONTENT_FILTER.isTruncated());
    }
}
