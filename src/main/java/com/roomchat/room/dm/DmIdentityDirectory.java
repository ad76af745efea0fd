package com.roomchat.room.dm;

import com.roomchat.protocol.DmIdentity;
import com.roomchat.protocol.InvalidPayloadException;
import com.roomchat.protocol.ProtocolCodec;
import com.roomchat.room.RoomConstants;
import com.roomchat.room.storage.RoomStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * @class DmIdentityDirectory
 * @brief 방 1개에서 사용자들이 등록한 DM 공개키 (사용자 ID → DmIdentity). 변경 즉시 "dm_identities" 로 저장한다.
 * @note 스레드 안전하지 않음: 방 엔진 lock 안에서만 호출한다.
 */
public class DmIdentityDirectory {

    private static final Logger logger = LoggerFactory.getLogger(DmIdentityDirectory.class);

    private final String roomId;
    private final RoomStorage storage;
    private final Map<String, DmIdentity> identities = new TreeMap<>();

    public DmIdentityDirectory(String roomId, RoomStorage storage) {
        this.roomId = roomId;
        this.storage = storage;
        load();
    }

    public Optional<DmIdentity> find(String githubUserId) {
        return Optional.ofNullable(identities.get(githubUserId));
    }

    public void publish(String githubUserId, DmIdentity identity) {
        identities.put(githubUserId, identity);
        try {
            storage.put(RoomConstants.DM_IDENTITIES_KEY, ProtocolCodec.encodeDmIdentities(identities));
        } catch (RuntimeException e) {
            logger.error("[DM 공개키 저장 실패] roomId={}, userId={}", roomId, githubUserId, e);
        }
    }

    public int size() {
        return identities.size();
    }

    private void load() {
        Optional<String> saved;
        try {
            saved = storage.get(RoomConstants.DM_IDENTITIES_KEY);
        } catch (RuntimeException e) {
            logger.error("[DM 공개키 로드 실패] roomId={} - 빈 목록으로 시작", roomId, e);
            return;
        }
        if (saved.isEmpty()) {
            return;
        }
        try {
            identities.putAll(ProtocolCodec.decodeDmIdentities(saved.get()));
        } catch (InvalidPayloadException e) {
            logger.warn("[DM 공개키 로드] roomId={} - 저장값이 객체가 아님, 무시", roomId);
        }
    }
}
