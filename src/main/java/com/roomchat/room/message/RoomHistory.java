package com.roomchat.room.message;

import com.roomchat.protocol.ChatMessagePlain;
import com.roomchat.protocol.DmMessageCipher;
import com.roomchat.protocol.InvalidPayloadException;
import com.roomchat.protocol.ProtocolCodec;
import com.roomchat.room.RoomConstants;
import com.roomchat.room.storage.RoomStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * @class RoomHistory
 * @brief 최근 메시지 N건 (메모리 + 저장소 스냅샷). 방 채팅(key "history")과 DM 대화(key "dm_history")가 같이 쓴다.
 *
 * @details
 * - 생성 시 저장소의 key 값을 읽는다. 형식이 틀린 항목은 버리고, 뒤에서부터 limit 건만 유지한다.
 * - append 는 메모리 반영 후 persistEveryNMessages 건마다 전체 스냅샷을 저장한다.
 * - 저장 실패는 기록만 하고 삼킨다. 다음 저장 시점에 전체 스냅샷이 다시 쓰인다.
 * - 스레드 안전하지 않음: 소유자(방 엔진 lock, DirectMessageHistories 모니터) 안에서만 호출한다.
 */
public class RoomHistory<T> {

    private static final Logger logger = LoggerFactory.getLogger(RoomHistory.class);

    /** 저장 포맷 → 항목 목록. 최상위 형식이 틀리면 InvalidPayloadException */
    @FunctionalInterface
    public interface Decoder<T> {
        List<T> decode(String raw) throws InvalidPayloadException;
    }

    private final String scopeId;
    private final RoomStorage storage;
    private final String key;
    private final Function<List<T>, String> encoder;
    private final Decoder<T> decoder;
    private final int limit;
    private final int persistEveryNMessages;

    private final Deque<T> entries = new ArrayDeque<>();
    private int pendingPersistCount;

    public static RoomHistory<ChatMessagePlain> chat(String roomId, RoomStorage storage,
                                                     int limit, int persistEveryNMessages) {
        return new RoomHistory<>(roomId, storage, RoomConstants.HISTORY_KEY,
                ProtocolCodec::encodeHistory, ProtocolCodec::decodeHistory, limit, persistEveryNMessages);
    }

    public static RoomHistory<DmMessageCipher> directMessages(String dmId, RoomStorage storage,
                                                              int limit, int persistEveryNMessages) {
        return new RoomHistory<>(dmId, storage, RoomConstants.DM_HISTORY_KEY,
                ProtocolCodec::encodeDmHistory, ProtocolCodec::decodeDmHistory, limit, persistEveryNMessages);
    }

    public RoomHistory(String scopeId, RoomStorage storage, String key,
                       Function<List<T>, String> encoder, Decoder<T> decoder,
                       int limit, int persistEveryNMessages) {
        if (limit < 0) {
            throw new IllegalArgumentException("history limit 는 0 이상이어야 함: " + limit);
        }
        if (persistEveryNMessages < 1) {
            throw new IllegalArgumentException("persistEveryNMessages 는 1 이상이어야 함: " + persistEveryNMessages);
        }
        this.scopeId = scopeId;
        this.storage = storage;
        this.key = key;
        this.encoder = encoder;
        this.decoder = decoder;
        this.limit = limit;
        this.persistEveryNMessages = persistEveryNMessages;
        load();
    }

    public List<T> snapshot() {
        return new ArrayList<>(entries);
    }

    public int size() {
        return entries.size();
    }

    public void append(T message) {
        if (limit == 0) {
            return;
        }
        entries.addLast(message);
        while (entries.size() > limit) {
            entries.removeFirst();
        }

        pendingPersistCount++;
        if (pendingPersistCount >= persistEveryNMessages) {
            persist();
        }
    }

    /**
     * 아직 저장되지 않은 append 가 있으면 즉시 저장 (방 종료 시).
     */
    public void flush() {
        if (pendingPersistCount > 0) {
            persist();
        }
    }

    private void persist() {
        try {
            storage.put(key, encoder.apply(snapshot()));
            pendingPersistCount = 0;
        } catch (RuntimeException e) {
            logger.error("[히스토리 저장 실패] scopeId={}, pending={}", scopeId, pendingPersistCount, e);
        }
    }

    private void load() {
        Optional<String> saved;
        try {
            saved = storage.get(key);
        } catch (RuntimeException e) {
            logger.error("[히스토리 로드 실패] scopeId={} - 빈 히스토리로 시작", scopeId, e);
            return;
        }
        if (saved.isEmpty()) {
            return;
        }

        List<T> messages;
        try {
            messages = decoder.decode(saved.get());
        } catch (InvalidPayloadException e) {
            logger.warn("[히스토리 로드] scopeId={} - 저장값이 배열이 아님, 무시", scopeId);
            return;
        }

        int from = Math.max(0, messages.size() - limit);
        for (T message : messages.subList(from, messages.size())) {
            entries.addLast(message);
        }
        logger.info("[히스토리 로드] scopeId={}, count={}", scopeId, entries.size());
    }
}
