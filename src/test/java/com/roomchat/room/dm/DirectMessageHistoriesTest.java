package com.roomchat.room.dm;

import com.roomchat.protocol.AuthUser;
import com.roomchat.protocol.DmIdentity;
import com.roomchat.protocol.DmMessageCipher;
import com.roomchat.room.RoomConstants;
import com.roomchat.room.storage.InMemoryRoomStorageProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DirectMessageHistoriesTest {

    private static final AuthUser ALICE = new AuthUser("1", "alice", null, "https://avatars.example.com/1", Set.of());
    private static final DmIdentity IDENTITY = new DmIdentity(DmIdentity.CIPHER_SUITE_NACL_BOX_V1, "A".repeat(43) + "=");

    private InMemoryRoomStorageProvider storageProvider;

    @BeforeEach
    public void setup() {
        storageProvider = new InMemoryRoomStorageProvider();
    }

    private static DmMessageCipher message(String id, String dmId, String recipient) {
        return DmMessageCipher.builder()
                .id(id)
                .dmId(dmId)
                .sender(ALICE)
                .recipientGithubUserId(recipient)
                .senderIdentity(IDENTITY)
                .recipientIdentity(IDENTITY)
                .nonce("C".repeat(32))
                .ciphertext("Y2lwaGVy")
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();
    }

    @Test
    public void historyIsStoredPerConversationAndReloaded() {
        DirectMessageHistories histories = new DirectMessageHistories(storageProvider, 10, 1, 16);
        histories.append(message("m-1", "dm:v1:1:2", "2"));
        histories.append(message("m-2", "dm:v1:1:3", "3"));

        assertTrue(storageProvider.forRoom("dm:v1:1:2").get(RoomConstants.DM_HISTORY_KEY).isPresent());

        DirectMessageHistories reloaded = new DirectMessageHistories(storageProvider, 10, 1, 16);
        assertEquals(1, reloaded.snapshot("dm:v1:1:2").size());
        assertEquals("m-1", reloaded.snapshot("dm:v1:1:2").get(0).getId());
        assertEquals("m-2", reloaded.snapshot("dm:v1:1:3").get(0).getId());
        assertTrue(reloaded.snapshot("dm:v1:2:3").isEmpty());
    }

    @Test
    public void historyKeepsOnlyTail() {
        DirectMessageHistories histories = new DirectMessageHistories(storageProvider, 2, 1, 16);
        for (int i = 1; i <= 3; i++) {
            histories.append(message("m-" + i, "dm:v1:1:2", "2"));
        }

        assertEquals("m-2", histories.snapshot("dm:v1:1:2").get(0).getId());
        assertEquals(2, histories.snapshot("dm:v1:1:2").size());
    }

    @Test
    public void leastRecentlyUsedConversationIsFlushedWhenUnloaded() {
        DirectMessageHistories histories = new DirectMessageHistories(storageProvider, 10, 100, 1);
        histories.append(message("m-1", "dm:v1:1:2", "2"));
        assertTrue(storageProvider.forRoom("dm:v1:1:2").get(RoomConstants.DM_HISTORY_KEY).isEmpty());

        histories.snapshot("dm:v1:1:3");

        assertEquals(1, histories.cachedConversationCount());
        assertTrue(storageProvider.forRoom("dm:v1:1:2").get(RoomConstants.DM_HISTORY_KEY).orElseThrow().contains("m-1"));
    }

    @Test
    public void flushAllPersistsPendingMessages() {
        DirectMessageHistories histories = new DirectMessageHistories(storageProvider, 10, 100, 16);
        histories.append(message("m-1", "dm:v1:1:2", "2"));

        histories.flushAll();

        assertTrue(storageProvider.forRoom("dm:v1:1:2").get(RoomConstants.DM_HISTORY_KEY).orElseThrow().contains("m-1"));
    }
}
