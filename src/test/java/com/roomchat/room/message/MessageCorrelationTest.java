package com.roomchat.room.message;

import com.roomchat.protocol.AuthUser;
import com.roomchat.protocol.ChatMessagePlain;
import com.roomchat.protocol.ServerMessageNew;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class MessageCorrelationTest {

    private static final ChatMessagePlain MESSAGE = new ChatMessagePlain("id-1",
            new AuthUser("1", "alice", null, "https://avatars.example.com/1", Set.of()),
            "hello", Instant.parse("2026-01-01T00:00:00Z"));

    @Test
    public void senderVariantCarriesCorrelationIdOnly() {
        CorrelatedMessageEvents events = MessageCorrelation.createCorrelatedServerMessageNewEvents(MESSAGE, "m-1");

        assertTrue(events.getPublicEvent().getClientMessageId().isEmpty());
        assertEquals("m-1", events.getSenderEvent().getClientMessageId().orElseThrow());
        assertSame(events.getPublicEvent().getMessage(), events.getSenderEvent().getMessage());
    }

    @Test
    public void withoutCorrelationIdBothVariantsAreSame() {
        CorrelatedMessageEvents events = MessageCorrelation.createCorrelatedServerMessageNewEvents(MESSAGE, null);

        assertSame(events.getPublicEvent(), events.getSenderEvent());
    }

    @Test
    public void pickDependsOnRecipientIdentity() {
        CorrelatedMessageEvents events = MessageCorrelation.createCorrelatedServerMessageNewEvents(MESSAGE, "m-1");

        ServerMessageNew forSender = MessageCorrelation.pickCorrelatedServerMessageNewEvent("1", "1", events);
        ServerMessageNew forOther = MessageCorrelation.pickCorrelatedServerMessageNewEvent("2", "1", events);

        assertSame(events.getSenderEvent(), forSender);
        assertSame(events.getPublicEvent(), forOther);
    }
}
