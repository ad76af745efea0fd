package com.roomchat.room.dm;

import com.roomchat.protocol.DmMessageCipher;
import com.roomchat.room.RoomConstants;
import com.roomchat.room.core.RoomGuardrails;
import com.roomchat.room.message.RoomHistory;
import com.roomchat.room.storage.RoomStorageProvider;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @class DirectMessageHistories
 * @brief dmId → DM 히스토리. 대화는 방에 속하지 않으므로 모든 방 엔진이 이 빈 하나를 공유한다.
 *
 * @details
 * - 저장소 scope 는 dmId 자체다 (방 ID 형식과 겹치지 않음). key 는 "dm_history".
 * - 제한값(limit, N건마다 저장)은 방 히스토리와 같은 설정을 쓴다.
 * - 최근에 쓴 대화만 메모리에 둔다. 한도를 넘으면 가장 오래 안 쓴 대화를 flush 후 내린다.
 * - 모든 메서드는 이 객체 모니터로 직렬화된다.
 */
@Component
public class DirectMessageHistories {

    private static final Logger logger = LoggerFactory.getLogger(DirectMessageHistories.class);

    private final RoomStorageProvider storageProvider;
    private final int historyLimit;
    private final int persistEveryNMessages;
    private final Map<String, RoomHistory<DmMessageCipher>> conversations;

    public DirectMessageHistories(RoomStorageProvider storageProvider, RoomGuardrails guardrails) {
        this(storageProvider, guardrails.getHistoryLimit(), guardrails.getHistoryPersistEveryNMessages(),
                RoomConstants.DM_HISTORY_MAX_CACHED_CONVERSATIONS);
    }

    public DirectMessageHistories(RoomStorageProvider storageProvider, int historyLimit,
                                  int persistEveryNMessages, int maxCachedConversations) {
        this.storageProvider = storageProvider;
        this.historyLimit = historyLimit;
        this.persistEveryNMessages = persistEveryNMessages;
        this.conversations = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, RoomHistory<DmMessageCipher>> eldest) {
                if (size() <= maxCachedConversations) {
                    return false;
                }
                eldest.getValue().flush();
                logger.debug("[DM 히스토리 내림] dmId={}", eldest.getKey());
                return true;
            }
        };
    }

    public synchronized List<DmMessageCipher> snapshot(String dmId) {
        return conversation(dmId).snapshot();
    }

    public synchronized void append(DmMessageCipher message) {
        conversation(message.getDmId()).append(message);
    }

    @PreDestroy
    public synchronized void flushAll() {
        logger.info("[DM 히스토리 저장] conversations={}", conversations.size());
        for (RoomHistory<DmMessageCipher> history : conversations.values()) {
            history.flush();
        }
    }

    synchronized int cachedConversationCount() {
        return conversations.size();
    }

    private RoomHistory<DmMessageCipher> conversation(String dmId) {
        RoomHistory<DmMessageCipher> history = conversations.get(dmId);
        if (history == null) {
            history = RoomHistory.directMessages(dmId, storageProvider.forRoom(dmId), historyLimit, persistEveryNMessages);
            conversations.put(dmId, history);
        }
        return history;
    }
}
