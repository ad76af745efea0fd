package com.roomchat.room.message;

import com.roomchat.protocol.AuthUser;
import com.roomchat.protocol.ChatMessagePlain;
import com.roomchat.protocol.ProtocolCodec;
import com.roomchat.room.RoomConstants;
import com.roomchat.room.storage.InMemoryRoomStorageProvider;
import com.roomchat.room.storage.RoomStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

public class RoomHistoryTest {

    private static final AuthUser ALICE = new AuthUser("1", "alice", null, "https://avatars.example.com/1", Set.of());

    private RoomStorage storage;

    @BeforeEach
    public void setup() {
        storage = new InMemoryRoomStorageProvider().forRoom("global");
    }

    private static ChatMessagePlain message(int n) {
        return new ChatMessagePlain("id-" + n, ALICE, "text " + n, Instant.parse("2026-01-01T00:00:00Z").plusSeconds(n));
    }

    @Test
    public void keepsOnlyTailWithinLimit() {
        RoomHistory<ChatMessagePlain> history = RoomHistory.chat("global", storage, 3, 1);
        for (int i = 1; i <= 5; i++) {
            history.append(message(i));
        }

        assertEquals(List.of(message(3), message(4), message(5)), history.snapshot());
    }

    @Test
    public void persistedHistorySurvivesReload() throws Exception {
        RoomHistory<ChatMessagePlain> history = RoomHistory.chat("global", storage, 10, 1);
        history.append(message(1));
        history.append(message(2));

        String stored = storage.get(RoomConstants.HISTORY_KEY).orElseThrow();
        assertEquals(2, ProtocolCodec.decodeHistory(stored).size());

        RoomHistory<ChatMessagePlain> reloaded = RoomHistory.chat("global", storage, 1, 1);
        assertEquals(List.of(message(2)), reloaded.snapshot());
    }

    @Test
    public void persistsEveryNMessagesAndFlushesRest() {
        RoomStorage recording = mock(RoomStorage.class);
        RoomHistory<ChatMessagePlain> history = RoomHistory.chat("global", recording, 10, 2);

        history.append(message(1));
        verify(recording, never()).put(anyString(), anyString());
        history.append(message(2));
        verify(recording, times(1)).put(eq(RoomConstants.HISTORY_KEY), anyString());

        history.append(message(3));
        history.flush();
        verify(recording, times(2)).put(eq(RoomConstants.HISTORY_KEY), anyString());
    }

    @Test
    public void zeroLimitDisablesHistory() {
        RoomHistory<ChatMessagePlain> history = RoomHistory.chat("global", storage, 0, 1);
        history.append(message(1));

        assertEquals(0, history.size());
        assertTrue(storage.get(RoomConstants.HISTORY_KEY).isEmpty());
    }

    @Test
    public void storageFailuresDoNotPropagate() {
        RoomStorage broken = mock(RoomStorage.class);
        when(broken.get(anyString())).thenThrow(new IllegalStateException("down"));
        doThrow(new IllegalStateException("down")).when(broken).put(anyString(), anyString());

        RoomHistory<ChatMessagePlain> history = RoomHistory.chat("global", broken, 10, 1);
        assertDoesNotThrow(() -> history.append(message(1)));
        assertEquals(1, history.size());
    }

    @Test
    public void corruptStoredValueStartsEmpty() {
        RoomStorage corrupt = mock(RoomStorage.class);
        when(corrupt.get(RoomConstants.HISTORY_KEY)).thenReturn(Optional.of("{\"not\":\"an array\"}"));

        assertEquals(0, RoomHistory.chat("global", corrupt, 10, 1).size());
    }
}
