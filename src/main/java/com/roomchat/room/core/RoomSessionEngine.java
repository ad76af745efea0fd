package com.roomchat.room.core;

import com.roomchat.contentpolicy.ContentPolicy;
import com.roomchat.contentpolicy.ContentPolicyMode;
import com.roomchat.presence.PresenceBroadcastCoalescer;
import com.roomchat.presence.PresenceDerivation;
import com.roomchat.protocol.AuthUser;
import com.roomchat.protocol.ChatMessagePlain;
import com.roomchat.protocol.ClientDmIdentityPublish;
import com.roomchat.protocol.ClientDmMessageSend;
import com.roomchat.protocol.ClientDmOpen;
import com.roomchat.protocol.ClientEvent;
import com.roomchat.protocol.ClientMessageSend;
import com.roomchat.protocol.ClientModerationUserAllow;
import com.roomchat.protocol.ClientModerationUserDeny;
import com.roomchat.protocol.DmIds;
import com.roomchat.protocol.DmMessageCipher;
import com.roomchat.protocol.HandshakeRejection;
import com.roomchat.protocol.InvalidPayloadException;
import com.roomchat.protocol.PresenceSnapshot;
import com.roomchat.protocol.ProtocolCodec;
import com.roomchat.protocol.ServerDmMessageNew;
import com.roomchat.protocol.ServerDmWelcome;
import com.roomchat.protocol.ServerError;
import com.roomchat.protocol.ServerErrorCode;
import com.roomchat.protocol.ServerEvent;
import com.roomchat.protocol.ServerModerationUserAllowed;
import com.roomchat.protocol.ServerModerationUserDenied;
import com.roomchat.protocol.ServerPresence;
import com.roomchat.protocol.ServerWelcome;
import com.roomchat.ratelimit.FixedWindowRateLimiter;
import com.roomchat.ratelimit.RateLimitDecision;
import com.roomchat.room.RoomConstants;
import com.roomchat.room.dm.DirectMessageHistories;
import com.roomchat.room.dm.DmIdentityDirectory;
import com.roomchat.room.message.CorrelatedMessageEvents;
import com.roomchat.room.message.MessageCorrelation;
import com.roomchat.room.message.RoomHistory;
import com.roomchat.room.model.ConnectionAttachment;
import com.roomchat.room.model.ConnectionChannel;
import com.roomchat.room.model.OutboundQueue;
import com.roomchat.room.model.RoomState;
import com.roomchat.room.moderation.RoomModeration;
import com.roomchat.room.storage.RoomStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * @class RoomSessionEngine
 * @brief 방 1개의 실시간 세션 엔진. 연결 관리, presence 병합 브로드캐스트, 콘텐츠 정책, 전송 빈도 제한,
 *        발신자/공개 메시지 분리 전달, DM 중계를 모두 이 객체가 순서대로 처리한다.
 *
 * @responsibility
 * - 입장 심사(admit) → 연결(connect) → 수신(receive) → 퇴장(disconnect) 흐름
 * - 방 상태(연결, 히스토리, 차단 목록, 전송 빈도 윈도우) 변경은 전부 방 lock 안에서 일어난다
 * - 전송 실패한 연결은 끊긴 것으로 처리하고 나머지 수신자에게는 영향을 주지 않는다
 *
 * [송신]
 * lock 안에서는 수신자별 OutboundQueue 에 적재만 한다. 실제 소켓 쓰기는 lock 을 놓은 뒤 outbound executor 가
 * 연결별로 순서대로 처리하므로, 느린 연결 하나가 방의 다른 연결 처리를 막지 않는다.
 * 쓰기 실패는 OutboundQueue 가 handleSendFailure 로 알려 오고, 그때 lock 을 다시 잡아 연결을 제거한다.
 *
 * @details
 * [상태]
 * - IDLE    : 연결 0
 * - ACTIVE  : 연결 1개 이상
 * - RETIRED : 유휴 상태로 레지스트리에서 내려감. 이후 connect 는 RoomRetiredException
 *
 * [연결 제거 순서]
 * arena 에서 먼저 제거 → presence 요청(exclude = 제거된 연결 ID). 제거 이후에 만들어지는 presence 는
 * 해당 연결을 절대 포함하지 않는다.
 *
 * @called_by RoomRegistry
 */
public class RoomSessionEngine {

    private static final Logger logger = LoggerFactory.getLogger(RoomSessionEngine.class);

    // =========================================================================
    // 1. [상태/의존성]
    // =========================================================================

    private final String roomId;
    private final RoomGuardrails guardrails;
    private final Clock clock;

    /** 핸드셰이크 빈도 제한 (클라이언트 IP 기준, 모든 방 공유) */
    private final FixedWindowRateLimiter connectRateLimiter;
    /** 채팅 전송 빈도 제한 (사용자 ID 기준, 방 단위) */
    private final FixedWindowRateLimiter messageRateLimiter;

    private final RoomHistory<ChatMessagePlain> history;
    private final RoomModeration moderation;
    private final PresenceBroadcastCoalescer<String> presence;
    private final ConnectionRegistry connections = new ConnectionRegistry();

    private final DmIdentityDirectory dmIdentities;
    private final DirectMessageHistories dmHistories;

    private final Executor outboundExecutor;
    /** lock 을 놓을 때 flush 할 송신 대기열 (lock 안에서만 접근) */
    private final Set<OutboundQueue> pendingFlush = new LinkedHashSet<>();

    private final ReentrantLock lock = new ReentrantLock();
    private RoomState state = RoomState.IDLE;
    private Instant lastActivityAt;

    // =========================================================================
    // 2. [생성자]
    // =========================================================================

    public RoomSessionEngine(String roomId,
                             RoomGuardrails guardrails,
                             RoomStorage storage,
                             TaskScheduler taskScheduler,
                             Clock clock,
                             FixedWindowRateLimiter connectRateLimiter,
                             Executor outboundExecutor,
                             DirectMessageHistories dmHistories) {
        this.roomId = roomId;
        this.guardrails = guardrails;
        this.clock = clock;
        this.connectRateLimiter = connectRateLimiter;
        this.outboundExecutor = outboundExecutor;
        this.dmHistories = dmHistories;
        this.messageRateLimiter = new FixedWindowRateLimiter(
                "message:" + roomId,
                guardrails.getMessageRateWindow(),
                guardrails.getMessageRateMaxCount(),
                RoomConstants.ROOM_RATE_LIMIT_MAX_TRACKED_KEYS);
        this.history = RoomHistory.chat(roomId, storage,
                guardrails.getHistoryLimit(), guardrails.getHistoryPersistEveryNMessages());
        this.moderation = new RoomModeration(roomId, guardrails.getOperatorDeniedGithubUserIds(), storage);
        this.dmIdentities = new DmIdentityDirectory(roomId, storage);
        this.presence = new PresenceBroadcastCoalescer<>(
                RoomConstants.PRESENCE_BROADCAST_COALESCE_WINDOW, taskScheduler, clock, this::broadcastPresence);
        this.lastActivityAt = clock.instant();
        logger.info("[방 생성] roomId={}, history={}", roomId, history.size());
    }

    // =========================================================================
    // 3. [외부 진입점: 입장 심사/연결/퇴장/수신]
    // =========================================================================

    /**
     * @method admit
     * @brief 업그레이드 전 입장 심사. 순서: IP 빈도 제한 → 차단 사용자 → 방 정원 → 사용자별 연결 수
     * @param user     검증된 사용자
     * @param clientIp 클라이언트 IP (모르면 null, 빈도 제한 생략)
     * @return 거절 사유. 비어 있으면 입장 허용
     */
    public Optional<HandshakeRejection> admit(AuthUser user, String clientIp) {
        lock.lock();
        try {
            if (clientIp != null) {
                RateLimitDecision decision = connectRateLimiter.check(clientIp, clock.millis());
                if (decision.isLimited()) {
                    logger.warn("[입장 거부 - 연결 빈도 초과] roomId={}, retryAfterMs={}", roomId, decision.getRetryAfterMs());
                    return Optional.of(HandshakeRejection.rateLimited(decision.getRetryAfterMs()));
                }
            }

            String githubUserId = user.getGithubUserId();
            if (moderation.isDenied(githubUserId)) {
                logger.warn("[입장 거부 - 차단 사용자] roomId={}, userId={}", roomId, githubUserId);
                return Optional.of(HandshakeRejection.forbidden());
            }

            Integer maxConnectionsPerRoom = guardrails.getMaxConnectionsPerRoom();
            if (maxConnectionsPerRoom != null && connections.size() >= maxConnectionsPerRoom) {
                logger.warn("[입장 거부 - 방 정원 초과] roomId={}, max={}", roomId, maxConnectionsPerRoom);
                return Optional.of(HandshakeRejection.roomFull());
            }

            if (connections.countForUser(githubUserId) >= guardrails.getMaxConnectionsPerUser()) {
                logger.warn("[입장 거부 - 사용자 연결 수 초과] roomId={}, userId={}", roomId, githubUserId);
                return Optional.of(HandshakeRejection.tooManyConnections());
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @method connect
     * @brief 연결 등록 → welcome 전송 → presence 요청 → (모더레이터) 차단 목록 전송
     * @throws RoomRetiredException 이미 내려간 방
     */
    public void connect(ConnectionChannel channel, AuthUser user) {
        lock.lock();
        try {
            if (state == RoomState.RETIRED) {
                throw new RoomRetiredException(roomId);
            }

            OutboundQueue outbound = new OutboundQueue(channel, outboundExecutor, this::handleSendFailure,
                    RoomConstants.OUTBOUND_MAX_PENDING_FRAMES);

            // admit 이후 업그레이드 사이에 상태가 바뀌었을 수 있으므로 차단/연결 수를 다시 확인
            if (moderation.isDenied(user.getGithubUserId())) {
                logger.warn("[입장 취소 - 차단 사용자] roomId={}, userId={}", roomId, user.getGithubUserId());
                close(outbound, RoomConstants.CLOSE_POLICY_VIOLATION, RoomConstants.CLOSE_REASON_BANNED);
                return;
            }
            if (connections.countForUser(user.getGithubUserId()) >= guardrails.getMaxConnectionsPerUser()) {
                logger.warn("[입장 취소 - 사용자 연결 수 초과] roomId={}, userId={}", roomId, user.getGithubUserId());
                close(outbound, RoomConstants.CLOSE_POLICY_VIOLATION, RoomConstants.CLOSE_REASON_TOO_MANY_CONNECTIONS);
                return;
            }

            ConnectionAttachment attachment = new ConnectionAttachment(user, clock.instant(), channel, outbound);
            connections.add(attachment);
            state = RoomState.ACTIVE;
            lastActivityAt = clock.instant();
            logger.info("[입장] roomId={}, userId={}, connectionId={}, connections={}",
                    roomId, user.getGithubUserId(), attachment.getConnectionId(), connections.size());

            if (!sendTo(attachment, new ServerWelcome(user, clock.instant(), history.snapshot()))) {
                return;
            }
            presence.request();

            if (user.isModerator()) {
                sendTo(attachment, moderation.snapshot());
            }
        } finally {
            unlockAndFlush();
        }
    }

    /**
     * @method disconnect
     * @brief 연결 제거 후 presence 요청. 이미 없는 연결이면 아무 일도 하지 않는다.
     */
    public void disconnect(String connectionId) {
        lock.lock();
        try {
            ConnectionAttachment removed = removeConnection(connectionId);
            if (removed != null) {
                logger.info("[퇴장] roomId={}, userId={}, connectionId={}, connections={}",
                        roomId, removed.getGithubUserId(), connectionId, connections.size());
            }
        } finally {
            unlockAndFlush();
        }
    }

    /**
     * @method receive
     * @brief 인바운드 텍스트 프레임 1개 처리
     *
     * [흐름]
     * 1. 크기 검사(UTF-8 bytes) → 초과 시 invalid payload
     * 2. JSON/스키마 검사 → 실패 시 invalid payload
     * 3. 정상 payload 면 연속 실패 횟수 초기화 후 type 별 처리
     */
    public void receive(String connectionId, String rawFrame) {
        lock.lock();
        try {
            ConnectionAttachment sender = connections.get(connectionId);
            if (sender == null) {
                logger.debug("[수신 무시] 등록되지 않은 연결: roomId={}, connectionId={}", roomId, connectionId);
                return;
            }

            if (exceedsInboundLimit(rawFrame)) {
                handleInvalidPayload(sender, "Payload too large");
                return;
            }

            ClientEvent event;
            try {
                event = ProtocolCodec.decodeClientEvent(rawFrame);
            } catch (InvalidPayloadException e) {
                handleInvalidPayload(sender, e.getMessage());
                return;
            }
            connections.resetStrikes(connectionId);

            switch (event.getType()) {
                case HELLO -> {
                    // 신원은 핸드셰이크에서 이미 결정됨
                }
                case MESSAGE_SEND -> handleMessageSend(sender, (ClientMessageSend) event);
                case DM_IDENTITY_PUBLISH -> handleDmIdentityPublish(sender, (ClientDmIdentityPublish) event);
                case DM_OPEN -> handleDmOpen(sender, (ClientDmOpen) event);
                case DM_MESSAGE_SEND -> handleDmMessageSend(sender, (ClientDmMessageSend) event);
                case MODERATION_USER_DENY -> handleUserDeny(sender, (ClientModerationUserDeny) event);
                case MODERATION_USER_ALLOW -> handleUserAllow(sender, (ClientModerationUserAllow) event);
            }
        } finally {
            unlockAndFlush();
        }
    }

    /**
     * @method shutdown
     * @brief 서버 종료: 미전송 히스토리 저장, 모든 연결 종료(1001), RETIRED 전환
     */
    public void shutdown() {
        lock.lock();
        try {
            presence.cancel();
            for (ConnectionAttachment attachment : connections.all()) {
                close(attachment.getOutbound(), RoomConstants.CLOSE_GOING_AWAY, RoomConstants.CLOSE_REASON_SHUTDOWN);
            }
            connections.clear();
            history.flush();
            state = RoomState.RETIRED;
            logger.info("[방 종료] roomId={}", roomId);
        } finally {
            unlockAndFlush();
        }
    }

    /**
     * @method tryRetire
     * @brief 연결 0 상태로 idleTtl 이상 지났으면 RETIRED 로 전환
     * @return 전환했으면 true (호출 측은 레지스트리에서 이 엔진을 제거)
     */
    boolean tryRetire(Instant now, Duration idleTtl) {
        lock.lock();
        try {
            if (state != RoomState.IDLE) {
                return false;
            }
            if (lastActivityAt.plus(idleTtl).isAfter(now)) {
                return false;
            }
            presence.cancel();
            history.flush();
            state = RoomState.RETIRED;
            logger.info("[방 정리 - 유휴] roomId={}, lastActivityAt={}", roomId, lastActivityAt);
            return true;
        } finally {
            lock.unlock();
        }
    }

    // =========================================================================
    // 4. [조회]
    // =========================================================================

    public String getRoomId() {
        return roomId;
    }

    public RoomState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int connectionCount() {
        lock.lock();
        try {
            return connections.size();
        } finally {
            lock.unlock();
        }
    }

    public PresenceSnapshot currentPresence() {
        lock.lock();
        try {
            return PresenceDerivation.derivePresenceSnapshotFromConnections(connections.view());
        } finally {
            lock.unlock();
        }
    }

    public List<ChatMessagePlain> historySnapshot() {
        lock.lock();
        try {
            return history.snapshot();
        } finally {
            lock.unlock();
        }
    }

    // =========================================================================
    // 5. [이벤트별 처리]
    // =========================================================================

    private void handleMessageSend(ConnectionAttachment sender, ClientMessageSend event) {
        AuthUser user = sender.getUser();

        RateLimitDecision decision = messageRateLimiter.check(user.getGithubUserId(), clock.millis());
        if (decision.isLimited()) {
            logger.info("[채팅 제한 - 전송 빈도] roomId={}, userId={}, retryAfterMs={}",
                    roomId, user.getGithubUserId(), decision.getRetryAfterMs());
            sendTo(sender, new ServerError(ServerErrorCode.RATE_LIMITED, "Too many messages", decision.getRetryAfterMs()));
            return;
        }

        if (guardrails.getContentPolicyMode() == ContentPolicyMode.REJECT
                && ContentPolicy.violatesDenylist(event.getText(), guardrails.getCompiledDenylist())) {
            logger.info("[채팅 거부 - 콘텐츠 정책] roomId={}, userId={}", roomId, user.getGithubUserId());
            sendTo(sender, ServerError.of(ServerErrorCode.CONTENT_POLICY_VIOLATION, "Message violates content policy"));
            return;
        }

        ChatMessagePlain message = new ChatMessagePlain(UUID.randomUUID().toString(), user, event.getText(), clock.instant());
        history.append(message);
        lastActivityAt = message.getCreatedAt();

        CorrelatedMessageEvents events = MessageCorrelation.createCorrelatedServerMessageNewEvents(
                message, event.getClientMessageId().orElse(null));
        broadcastMessage(user.getGithubUserId(), events);
    }

    private void handleDmIdentityPublish(ConnectionAttachment sender, ClientDmIdentityPublish event) {
        dmIdentities.publish(sender.getGithubUserId(), event.getIdentity());
        logger.info("[DM 공개키 등록] roomId={}, userId={}", roomId, sender.getGithubUserId());
    }

    private void handleDmOpen(ConnectionAttachment sender, ClientDmOpen event) {
        String self = sender.getGithubUserId();
        String target = event.getTargetGithubUserId();
        if (self.equals(target)) {
            sendTo(sender, ServerError.of(ServerErrorCode.INVALID_PAYLOAD, "Cannot DM self"));
            return;
        }

        String dmId = DmIds.fromParticipants(self, target);
        sendTo(sender, new ServerDmWelcome(dmId, target,
                dmIdentities.find(target).orElse(null), dmHistories.snapshot(dmId)));
    }

    /**
     * DM 중계: 빈도 제한(채팅과 같은 윈도우) → dmId 검사 → 참여자 검사 → 수신자 일치 검사 → 히스토리 저장 → 두 참여자 연결로 전달.
     * ciphertext 는 열어 보지 않는다.
     */
    private void handleDmMessageSend(ConnectionAttachment sender, ClientDmMessageSend event) {
        AuthUser user = sender.getUser();

        RateLimitDecision decision = messageRateLimiter.check(user.getGithubUserId(), clock.millis());
        if (decision.isLimited()) {
            logger.info("[DM 제한 - 전송 빈도] roomId={}, userId={}, retryAfterMs={}",
                    roomId, user.getGithubUserId(), decision.getRetryAfterMs());
            sendTo(sender, new ServerError(ServerErrorCode.RATE_LIMITED, "Too many messages", decision.getRetryAfterMs()));
            return;
        }

        Optional<String[]> participants = DmIds.participants(event.getDmId());
        if (participants.isEmpty()) {
            sendTo(sender, ServerError.of(ServerErrorCode.INVALID_PAYLOAD, "Invalid dmId"));
            return;
        }

        String self = user.getGithubUserId();
        String[] pair = participants.get();
        String peer = self.equals(pair[0]) ? pair[1] : self.equals(pair[1]) ? pair[0] : null;
        if (peer == null) {
            sendTo(sender, ServerError.of(ServerErrorCode.FORBIDDEN, "Not a DM participant"));
            return;
        }
        if (!peer.equals(event.getRecipientGithubUserId())) {
            sendTo(sender, ServerError.of(ServerErrorCode.INVALID_PAYLOAD, "DM recipient mismatch"));
            return;
        }

        DmMessageCipher message = DmMessageCipher.builder()
                .id(UUID.randomUUID().toString())
                .dmId(event.getDmId())
                .sender(user)
                .recipientGithubUserId(peer)
                .senderIdentity(event.getSenderIdentity())
                .recipientIdentity(event.getRecipientIdentity())
                .nonce(event.getNonce())
                .ciphertext(event.getCiphertext())
                .createdAt(clock.instant())
                .build();
        dmHistories.append(message);
        lastActivityAt = message.getCreatedAt();

        logger.debug("[DM 중계] roomId={}, dmId={}", roomId, event.getDmId());
        sendToUsers(Set.of(self, peer), new ServerDmMessageNew(message));
    }

    private void handleUserDeny(ConnectionAttachment actorConnection, ClientModerationUserDeny event) {
        AuthUser actor = actorConnection.getUser();
        String target = event.getTargetGithubUserId();
        if (!guardModeratorAction(actorConnection, target, "Self-ban is not allowed.")) {
            return;
        }

        boolean added = moderation.deny(target);
        kickUser(target);

        logger.info("[모더레이션 - 차단] roomId={}, actor={}, target={}, newlyDenied={}",
                roomId, actor.getGithubUserId(), target, added);
        sendToModerators(new ServerModerationUserDenied(actor.getGithubUserId(), target));
    }

    private void handleUserAllow(ConnectionAttachment actorConnection, ClientModerationUserAllow event) {
        AuthUser actor = actorConnection.getUser();
        String target = event.getTargetGithubUserId();
        if (!guardModeratorAction(actorConnection, target, "Self-unban is not applicable.")) {
            return;
        }

        if (moderation.isOperatorDenied(target)) {
            sendTo(actorConnection, ServerError.of(ServerErrorCode.FORBIDDEN,
                    "Operator deny cannot be overridden by moderator unban."));
            return;
        }

        boolean removed = moderation.allow(target);
        logger.info("[모더레이션 - 해제] roomId={}, actor={}, target={}, removed={}",
                roomId, actor.getGithubUserId(), target, removed);
        sendToModerators(new ServerModerationUserAllowed(actor.getGithubUserId(), target));
    }

    private boolean guardModeratorAction(ConnectionAttachment actorConnection, String target, String selfActionMessage) {
        AuthUser actor = actorConnection.getUser();
        if (!actor.isModerator()) {
            sendTo(actorConnection, ServerError.of(ServerErrorCode.FORBIDDEN, "Moderator role required."));
            return false;
        }
        if (actor.getGithubUserId().equals(target)) {
            sendTo(actorConnection, ServerError.of(ServerErrorCode.FORBIDDEN, selfActionMessage));
            return false;
        }
        return true;
    }

    private void kickUser(String githubUserId) {
        for (ConnectionAttachment attachment : connections.byUser(githubUserId)) {
            enqueue(attachment, ProtocolCodec.encode(
                    ServerError.of(ServerErrorCode.FORBIDDEN, "You have been banned from the room.")));
            close(attachment.getOutbound(), RoomConstants.CLOSE_POLICY_VIOLATION, RoomConstants.CLOSE_REASON_BANNED);
            removeConnection(attachment.getConnectionId());
            logger.info("[강퇴] roomId={}, userId={}, connectionId={}", roomId, githubUserId, attachment.getConnectionId());
        }
    }

    /**
     * 연속 invalid payload 처리: 오류 알림 후 횟수 누적, 한도에 닿으면 1008 로 닫고 즉시 제거
     */
    private void handleInvalidPayload(ConnectionAttachment sender, String reason) {
        String connectionId = sender.getConnectionId();
        int strikes = connections.recordStrike(connectionId);
        logger.warn("[invalid payload] roomId={}, connectionId={}, strikes={}, reason={}",
                roomId, connectionId, strikes, reason);

        if (!sendTo(sender, ServerError.of(ServerErrorCode.INVALID_PAYLOAD, reason))) {
            return;
        }

        if (strikes >= RoomConstants.WS_MAX_CONSECUTIVE_INVALID_PAYLOADS) {
            logger.warn("[연결 종료 - invalid payload 한도] roomId={}, connectionId={}", roomId, connectionId);
            close(sender.getOutbound(), RoomConstants.CLOSE_POLICY_VIOLATION, RoomConstants.CLOSE_REASON_INVALID_PAYLOAD);
            removeConnection(connectionId);
        }
    }

    // =========================================================================
    // 6. [전송]
    // =========================================================================

    /**
     * presence coalescer flush 콜백 (스케줄러 스레드)
     */
    private void broadcastPresence(Set<String> excludeConnectionIds) {
        lock.lock();
        try {
            if (state == RoomState.RETIRED) {
                return;
            }
            PresenceSnapshot snapshot = PresenceDerivation.derivePresenceSnapshotFromConnections(
                    connections.view(), excludeConnectionIds);
            logger.debug("[presence] roomId={}, users={}, excluded={}", roomId, snapshot.size(), excludeConnectionIds.size());
            broadcast(new ServerPresence(snapshot));
        } finally {
            unlockAndFlush();
        }
    }

    private void broadcastMessage(String senderGithubUserId, CorrelatedMessageEvents events) {
        String publicPayload = ProtocolCodec.encode(events.getPublicEvent());
        String senderPayload = events.getSenderEvent() == events.getPublicEvent()
                ? publicPayload
                : ProtocolCodec.encode(events.getSenderEvent());

        List<ConnectionAttachment> failed = new ArrayList<>();
        for (ConnectionAttachment recipient : connections.all()) {
            String payload = MessageCorrelation.pickCorrelatedServerMessageNewEvent(
                    recipient.getGithubUserId(), senderGithubUserId, events) == events.getPublicEvent()
                    ? publicPayload
                    : senderPayload;
            if (!enqueue(recipient, payload)) {
                failed.add(recipient);
            }
        }
        failed.forEach(this::handleDeliveryFailure);
    }

    private void broadcast(ServerEvent event) {
        String payload = ProtocolCodec.encode(event);
        List<ConnectionAttachment> failed = new ArrayList<>();
        for (ConnectionAttachment recipient : connections.all()) {
            if (!enqueue(recipient, payload)) {
                failed.add(recipient);
            }
        }
        failed.forEach(this::handleDeliveryFailure);
    }

    private void sendToModerators(ServerEvent event) {
        String payload = ProtocolCodec.encode(event);
        List<ConnectionAttachment> failed = new ArrayList<>();
        for (ConnectionAttachment recipient : connections.all()) {
            if (!recipient.getUser().isModerator()) {
                continue;
            }
            if (!enqueue(recipient, payload)) {
                failed.add(recipient);
            }
        }
        failed.forEach(this::handleDeliveryFailure);
    }

    private void sendToUsers(Set<String> githubUserIds, ServerEvent event) {
        String payload = ProtocolCodec.encode(event);
        List<ConnectionAttachment> failed = new ArrayList<>();
        for (ConnectionAttachment recipient : connections.all()) {
            if (!githubUserIds.contains(recipient.getGithubUserId())) {
                continue;
            }
            if (!enqueue(recipient, payload)) {
                failed.add(recipient);
            }
        }
        failed.forEach(this::handleDeliveryFailure);
    }

    /**
     * @return 적재 성공 여부. 실패하면 이미 연결 제거까지 끝난 상태
     */
    private boolean sendTo(ConnectionAttachment recipient, ServerEvent event) {
        if (enqueue(recipient, ProtocolCodec.encode(event))) {
            return true;
        }
        handleDeliveryFailure(recipient);
        return false;
    }

    // lock 안: 적재만 하고 flush 대상으로 표시
    private boolean enqueue(ConnectionAttachment recipient, String payload) {
        OutboundQueue outbound = recipient.getOutbound();
        pendingFlush.add(outbound);
        return outbound.offer(payload);
    }

    private void close(OutboundQueue outbound, int code, String reason) {
        pendingFlush.add(outbound);
        outbound.offerClose(code, reason);
    }

    // 적재 실패(대기 한도 초과) 또는 쓰기 실패 = 끊긴 연결
    private void handleDeliveryFailure(ConnectionAttachment recipient) {
        if (removeConnection(recipient.getConnectionId()) == null) {
            return;
        }
        close(recipient.getOutbound(), RoomConstants.CLOSE_SERVER_ERROR, "send_failed");
        logger.info("[퇴장 - 전송 실패] roomId={}, userId={}, connectionId={}",
                roomId, recipient.getGithubUserId(), recipient.getConnectionId());
    }

    /**
     * OutboundQueue 쓰기 실패 콜백 (outbound executor 스레드, lock 밖)
     */
    private void handleSendFailure(String connectionId) {
        lock.lock();
        try {
            ConnectionAttachment recipient = connections.get(connectionId);
            if (recipient != null) {
                handleDeliveryFailure(recipient);
            }
        } finally {
            unlockAndFlush();
        }
    }

    /**
     * lock 을 놓고, 가장 바깥 lock 이었으면 이번에 적재된 송신 대기열을 flush 한다.
     * 소켓 쓰기가 lock 밖에서 일어나도록 모든 상태 변경 진입점은 이 메서드로 lock 을 놓는다.
     */
    private void unlockAndFlush() {
        List<OutboundQueue> toFlush = null;
        if (lock.getHoldCount() == 1 && !pendingFlush.isEmpty()) {
            toFlush = new ArrayList<>(pendingFlush);
            pendingFlush.clear();
        }
        lock.unlock();
        if (toFlush != null) {
            toFlush.forEach(OutboundQueue::flush);
        }
    }

    private ConnectionAttachment removeConnection(String connectionId) {
        ConnectionAttachment removed = connections.remove(connectionId);
        if (removed == null) {
            return null;
        }
        if (connections.isEmpty() && state == RoomState.ACTIVE) {
            state = RoomState.IDLE;
        }
        lastActivityAt = clock.instant();
        presence.request(connectionId);
        return removed;
    }

    private static boolean exceedsInboundLimit(String rawFrame) {
        // UTF-16 1 code unit 은 UTF-8 로 최대 3 bytes
        if (rawFrame.length() * 3L <= RoomConstants.WS_MAX_INBOUND_MESSAGE_BYTES) {
            return false;
        }
        return rawFrame.getBytes(StandardCharsets.UTF_8).length > RoomConstants.WS_MAX_INBOUND_MESSAGE_BYTES;
    }
}
