package com.relaybot.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CursorTest {
    private static final Instant EARLY = Instant.parse("2026-10-19T08:00:00Z");
    private static final Instant LATE = Instant.parse("2026-10-19T09:00:00Z");

    @Test
    void mergeForwardShouldTakeFieldWiseMaximum() {
        Cursor merged = new Cursor(50L, EARLY).mergeForward(new Cursor(45L, LATE));

        assertEquals(new Cursor(50L, LATE), merged);
    }

    @Test
    void mergeForwardShouldKeepKnownFields() {
        assertEquals(new Cursor(3L, EARLY), Cursor.ofMessageId(3L).mergeForward(new Cursor(null, EARLY)));
        assertEquals(Cursor.ofMessageId(3L), Cursor.ofMessageId(3L).mergeForward(null));
        assertTrue(Cursor.empty().mergeForward(Cursor.empty()).isEmpty());
    }

    @Test
    void advanceToShouldNeverGoBackward() {
        ChatMessage older = ChatMessage.builder().id(10L).chatId(-1L).date(EARLY).build();

        Cursor cursor = new Cursor(12L, LATE).advanceTo(older);

        assertEquals(new Cursor(12L, LATE), cursor);
    }
}
