package com.roomchat.protocol;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * @class ProtocolCodec
 * @brief 와이어 JSON ↔ 프로토콜 타입 변환 (org.json).
 *
 * @details
 * - encode: 서버 이벤트는 type 별 switch 식으로 직렬화한다. variant 가 추가되면 여기서 컴파일 오류가 난다.
 * - decode: 클라이언트 프레임은 JSON 파싱 → version → type → 필드 스키마 순으로 검사하고,
 *   어느 단계에서든 실패하면 InvalidPayloadException 을 던진다.
 * - 히스토리 저장 포맷도 같은 메시지 직렬화를 쓴다.
 */
public final class ProtocolCodec {

    private static final Logger logger = LoggerFactory.getLogger(ProtocolCodec.class);

    static final String INVALID_JSON = "Invalid JSON";
    static final String INVALID_SCHEMA = "Invalid event schema";

    // DM 필드 제약 (base64 길이는 디코딩 후 bytes)
    private static final int DM_PUBLIC_KEY_MAX_LEN = 64;
    private static final int DM_PUBLIC_KEY_BYTES = 32;
    private static final int DM_NONCE_MAX_LEN = 64;
    private static final int DM_NONCE_BYTES = 24;
    private static final int DM_CIPHERTEXT_MAX_LEN = 4096;
    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/]*={0,2}$");

    private ProtocolCodec() {
    }

    // =========================================================================
    // 서버 이벤트 직렬화
    // =========================================================================

    public static String encode(ServerEvent event) {
        return toJson(event).toString();
    }

    static JSONObject toJson(ServerEvent event) {
        JSONObject json = new JSONObject();
        json.put("version", event.getVersion());
        json.put("type", event.getType().getWireName());

        return switch (event.getType()) {
            case WELCOME -> {
                ServerWelcome welcome = (ServerWelcome) event;
                json.put("user", toJson(welcome.getUser()));
                json.put("serverTime", welcome.getServerTime().toString());
                json.put("history", toJsonArray(welcome.getHistory()));
                yield json;
            }
            case MESSAGE_NEW -> {
                ServerMessageNew messageNew = (ServerMessageNew) event;
                json.put("message", toJson(messageNew.getMessage()));
                messageNew.getClientMessageId().ifPresent(id -> json.put("clientMessageId", id));
                yield json;
            }
            case DM_WELCOME -> {
                ServerDmWelcome welcome = (ServerDmWelcome) event;
                json.put("dmId", welcome.getDmId());
                json.put("peerGithubUserId", welcome.getPeerGithubUserId());
                welcome.getPeerIdentity().ifPresent(identity -> json.put("peerIdentity", toJson(identity)));
                json.put("history", toDmJsonArray(welcome.getHistory()));
                yield json;
            }
            case DM_MESSAGE_NEW -> {
                json.put("message", toJson(((ServerDmMessageNew) event).getMessage()));
                yield json;
            }
            case PRESENCE -> {
                ServerPresence presence = (ServerPresence) event;
                JSONArray snapshot = new JSONArray();
                for (PresenceEntry entry : presence.getSnapshot()) {
                    JSONObject item = new JSONObject();
                    item.put("user", toJson(entry.getUser()));
                    item.put("connections", entry.getConnections());
                    snapshot.put(item);
                }
                json.put("snapshot", snapshot);
                yield json;
            }
            case ERROR -> {
                ServerError error = (ServerError) event;
                json.put("code", error.getCode().getWireName());
                error.getMessage().ifPresent(message -> json.put("message", message));
                error.getRetryAfterMs().ifPresent(retryAfterMs -> json.put("retryAfterMs", retryAfterMs));
                yield json;
            }
            case MODERATION_SNAPSHOT -> {
                ServerModerationSnapshot snapshot = (ServerModerationSnapshot) event;
                json.put("operatorDeniedGithubUserIds", new JSONArray(snapshot.getOperatorDeniedGithubUserIds()));
                json.put("roomDeniedGithubUserIds", new JSONArray(snapshot.getRoomDeniedGithubUserIds()));
                yield json;
            }
            case MODERATION_USER_DENIED -> {
                ServerModerationUserDenied denied = (ServerModerationUserDenied) event;
                json.put("actorGithubUserId", denied.getActorGithubUserId());
                json.put("targetGithubUserId", denied.getTargetGithubUserId());
                yield json;
            }
            case MODERATION_USER_ALLOWED -> {
                ServerModerationUserAllowed allowed = (ServerModerationUserAllowed) event;
                json.put("actorGithubUserId", allowed.getActorGithubUserId());
                json.put("targetGithubUserId", allowed.getTargetGithubUserId());
                yield json;
            }
        };
    }

    public static String encodeHandshakeRejection(HandshakeRejection rejection) {
        JSONObject json = new JSONObject();
        json.put("code", rejection.getCode().getWireName());
        json.put("message", rejection.getMessage());
        rejection.getRetryAfterMs().ifPresent(retryAfterMs -> json.put("retryAfterMs", retryAfterMs));
        return json.toString();
    }

    static JSONObject toJson(AuthUser user) {
        JSONObject json = new JSONObject();
        json.put("githubUserId", user.getGithubUserId());
        json.put("login", user.getLogin());
        json.put("displayName", user.getDisplayName());
        json.put("avatarUrl", user.getAvatarUrl());
        JSONArray roles = new JSONArray();
        for (UserRole role : user.getRoles()) {
            roles.put(role.getWireName());
        }
        json.put("roles", roles);
        return json;
    }

    static JSONObject toJson(ChatMessagePlain message) {
        JSONObject json = new JSONObject();
        json.put("id", message.getId());
        json.put("user", toJson(message.getUser()));
        json.put("text", message.getText());
        json.put("createdAt", message.getCreatedAt().toString());
        return json;
    }

    static JSONObject toJson(DmIdentity identity) {
        JSONObject json = new JSONObject();
        json.put("cipherSuite", identity.getCipherSuite());
        json.put("publicKey", identity.getPublicKey());
        return json;
    }

    static JSONObject toJson(DmMessageCipher message) {
        JSONObject json = new JSONObject();
        json.put("id", message.getId());
        json.put("dmId", message.getDmId());
        json.put("sender", toJson(message.getSender()));
        json.put("recipientGithubUserId", message.getRecipientGithubUserId());
        json.put("senderIdentity", toJson(message.getSenderIdentity()));
        json.put("recipientIdentity", toJson(message.getRecipientIdentity()));
        json.put("nonce", message.getNonce());
        json.put("ciphertext", message.getCiphertext());
        json.put("createdAt", message.getCreatedAt().toString());
        return json;
    }

    private static JSONArray toDmJsonArray(List<DmMessageCipher> messages) {
        JSONArray array = new JSONArray();
        for (DmMessageCipher message : messages) {
            array.put(toJson(message));
        }
        return array;
    }

    private static JSONArray toJsonArray(List<ChatMessagePlain> messages) {
        JSONArray array = new JSONArray();
        for (ChatMessagePlain message : messages) {
            array.put(toJson(message));
        }
        return array;
    }

    // =========================================================================
    // 클라이언트 이벤트 역직렬화
    // =========================================================================

    /**
     * @method decodeClientEvent
     * @param raw 텍스트 프레임 (크기 제한은 호출 측에서 먼저 검사)
     * @return 검증된 ClientEvent
     * @throws InvalidPayloadException JSON 오류("Invalid JSON") 또는 스키마 위반("Invalid event schema")
     */
    public static ClientEvent decodeClientEvent(String raw) throws InvalidPayloadException {
        JSONObject json;
        try {
            json = new JSONObject(raw);
        } catch (JSONException e) {
            throw new InvalidPayloadException(INVALID_JSON, e);
        }

        // version 은 생략 가능, 있으면 현재 버전과 같아야 함
        if (json.has("version")) {
            Object version = json.get("version");
            if (!(version instanceof Number) || ((Number) version).doubleValue() != ProtocolConstants.PROTOCOL_VERSION) {
                throw new InvalidPayloadException(INVALID_SCHEMA);
            }
        }

        ClientEventType type = ClientEventType.fromWireName(requireString(json, "type", 1, 64));
        if (type == null) {
            throw new InvalidPayloadException(INVALID_SCHEMA);
        }

        return switch (type) {
            case HELLO -> {
                JSONObject client = json.optJSONObject("client");
                if (client == null) {
                    throw new InvalidPayloadException(INVALID_SCHEMA);
                }
                yield new ClientHello(requireString(client, "name", 1, 64), optionalString(client, "version", 1, 64));
            }
            case MESSAGE_SEND -> new ClientMessageSend(
                    requireString(json, "text", 1, ProtocolConstants.CHAT_MESSAGE_TEXT_MAX_LEN),
                    optionalString(json, "clientMessageId", 1, ProtocolConstants.CLIENT_MESSAGE_ID_MAX_LEN));
            case DM_IDENTITY_PUBLISH -> new ClientDmIdentityPublish(requireIdentity(json, "identity"));
            case DM_OPEN -> new ClientDmOpen(requireGithubUserId(json, "targetGithubUserId"));
            case DM_MESSAGE_SEND -> ClientDmMessageSend.builder()
                    .dmId(requireDmId(json, "dmId"))
                    .recipientGithubUserId(requireGithubUserId(json, "recipientGithubUserId"))
                    .senderIdentity(requireIdentity(json, "senderIdentity"))
                    .recipientIdentity(requireIdentity(json, "recipientIdentity"))
                    .nonce(requireBase64(json, "nonce", DM_NONCE_MAX_LEN, DM_NONCE_BYTES))
                    .ciphertext(requireBase64(json, "ciphertext", DM_CIPHERTEXT_MAX_LEN, -1))
                    .build();
            case MODERATION_USER_DENY -> new ClientModerationUserDeny(
                    requireGithubUserId(json, "targetGithubUserId"),
                    optionalString(json, "reason", 1, ProtocolConstants.CHAT_MESSAGE_TEXT_MAX_LEN));
            case MODERATION_USER_ALLOW -> new ClientModerationUserAllow(
                    requireGithubUserId(json, "targetGithubUserId"));
        };
    }

    // =========================================================================
    // 히스토리 저장 포맷
    // =========================================================================

    public static String encodeHistory(List<ChatMessagePlain> messages) {
        return toJsonArray(messages).toString();
    }

    /**
     * 저장된 히스토리를 읽는다. 형식이 맞지 않는 항목은 건너뛴다.
     *
     * @throws InvalidPayloadException 최상위가 JSON 배열이 아닐 때
     */
    public static List<ChatMessagePlain> decodeHistory(String raw) throws InvalidPayloadException {
        JSONArray array;
        try {
            array = new JSONArray(raw);
        } catch (JSONException e) {
            throw new InvalidPayloadException(INVALID_JSON, e);
        }
        List<ChatMessagePlain> messages = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.optJSONObject(i);
            if (item == null) {
                logger.warn("[히스토리 로드] 객체가 아닌 항목 건너뜀 index={}", i);
                continue;
            }
            try {
                messages.add(decodeMessage(item));
            } catch (InvalidPayloadException e) {
                // 손상된 항목 1건 때문에 전체 히스토리를 버리지 않는다
                logger.warn("[히스토리 로드] 형식 오류 항목 건너뜀 index={}, reason={}", i, e.getMessage());
            }
        }
        return messages;
    }

    public static String encodeDmHistory(List<DmMessageCipher> messages) {
        return toDmJsonArray(messages).toString();
    }

    /**
     * 저장된 DM 히스토리를 읽는다. 형식이 맞지 않는 항목은 건너뛴다.
     *
     * @throws InvalidPayloadException 최상위가 JSON 배열이 아닐 때
     */
    public static List<DmMessageCipher> decodeDmHistory(String raw) throws InvalidPayloadException {
        JSONArray array;
        try {
            array = new JSONArray(raw);
        } catch (JSONException e) {
            throw new InvalidPayloadException(INVALID_JSON, e);
        }
        List<DmMessageCipher> messages = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.optJSONObject(i);
            if (item == null) {
                continue;
            }
            try {
                messages.add(decodeDmMessage(item));
            } catch (InvalidPayloadException e) {
                logger.warn("[DM 히스토리 로드] 형식 오류 항목 건너뜀 index={}, reason={}", i, e.getMessage());
            }
        }
        return messages;
    }

    /** 사용자 ID → DM 공개키 맵 (JSON 객체) */
    public static String encodeDmIdentities(Map<String, DmIdentity> identities) {
        JSONObject json = new JSONObject();
        identities.forEach((githubUserId, identity) -> json.put(githubUserId, toJson(identity)));
        return json.toString();
    }

    /**
     * 저장된 DM 공개키 맵을 읽는다. key 가 사용자 ID 가 아니거나 값 형식이 틀린 항목은 건너뛴다.
     *
     * @throws InvalidPayloadException 최상위가 JSON 객체가 아닐 때
     */
    public static Map<String, DmIdentity> decodeDmIdentities(String raw) throws InvalidPayloadException {
        JSONObject json;
        try {
            json = new JSONObject(raw);
        } catch (JSONException e) {
            throw new InvalidPayloadException(INVALID_JSON, e);
        }
        Map<String, DmIdentity> identities = new TreeMap<>();
        for (String githubUserId : json.keySet()) {
            if (!GithubUserIds.isValid(githubUserId)) {
                continue;
            }
            try {
                identities.put(githubUserId, requireIdentity(json, githubUserId));
            } catch (InvalidPayloadException e) {
                logger.warn("[DM 공개키 로드] 형식 오류 항목 건너뜀 userId={}", githubUserId);
            }
        }
        return identities;
    }

    public static String encodeIdList(Iterable<String> ids) {
        JSONArray array = new JSONArray();
        for (String id : ids) {
            array.put(id);
        }
        return array.toString();
    }

    /**
     * 저장된 사용자 ID 배열을 읽는다. 문자열이 아니거나 형식이 틀린 항목은 건너뛴다.
     *
     * @throws InvalidPayloadException 최상위가 JSON 배열이 아닐 때
     */
    public static List<String> decodeIdList(String raw) throws InvalidPayloadException {
        JSONArray array;
        try {
            array = new JSONArray(raw);
        } catch (JSONException e) {
            throw new InvalidPayloadException(INVALID_JSON, e);
        }
        List<String> ids = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            Object item = array.opt(i);
            if (!(item instanceof String)) {
                continue;
            }
            String trimmed = ((String) item).trim();
            if (GithubUserIds.isValid(trimmed)) {
                ids.add(trimmed);
            }
        }
        return ids;
    }

    static ChatMessagePlain decodeMessage(JSONObject json) throws InvalidPayloadException {
        String id = requireString(json, "id", 1, 128);
        JSONObject userJson = json.optJSONObject("user");
        if (userJson == null) {
            throw new InvalidPayloadException(INVALID_SCHEMA);
        }
        AuthUser user = decodeUser(userJson);
        String text = requireString(json, "text", 1, ProtocolConstants.CHAT_MESSAGE_TEXT_MAX_LEN);
        return new ChatMessagePlain(id, user, text, requireInstant(json, "createdAt"));
    }

    static DmMessageCipher decodeDmMessage(JSONObject json) throws InvalidPayloadException {
        JSONObject senderJson = json.optJSONObject("sender");
        if (senderJson == null) {
            throw new InvalidPayloadException(INVALID_SCHEMA);
        }
        return DmMessageCipher.builder()
                .id(requireString(json, "id", 1, 128))
                .dmId(requireDmId(json, "dmId"))
                .sender(decodeUser(senderJson))
                .recipientGithubUserId(requireGithubUserId(json, "recipientGithubUserId"))
                .senderIdentity(requireIdentity(json, "senderIdentity"))
                .recipientIdentity(requireIdentity(json, "recipientIdentity"))
                .nonce(requireBase64(json, "nonce", DM_NONCE_MAX_LEN, DM_NONCE_BYTES))
                .ciphertext(requireBase64(json, "ciphertext", DM_CIPHERTEXT_MAX_LEN, -1))
                .createdAt(requireInstant(json, "createdAt"))
                .build();
    }

    static AuthUser decodeUser(JSONObject json) throws InvalidPayloadException {
        String githubUserId = requireGithubUserId(json, "githubUserId");
        String login = requireString(json, "login", 1, 256);
        String displayName = optionalString(json, "displayName", 1, 256);
        String avatarUrl = requireString(json, "avatarUrl", 1, 2048);

        Set<UserRole> roles = EnumSet.noneOf(UserRole.class);
        JSONArray rolesJson = json.optJSONArray("roles");
        if (rolesJson != null) {
            for (int i = 0; i < rolesJson.length(); i++) {
                try {
                    roles.add(UserRole.fromWireName(rolesJson.optString(i, "")));
                } catch (IllegalArgumentException e) {
                    throw new InvalidPayloadException(INVALID_SCHEMA, e);
                }
            }
        }
        return new AuthUser(githubUserId, login, displayName, avatarUrl, roles);
    }

    private static String requireString(JSONObject json, String key, int minLength, int maxLength)
            throws InvalidPayloadException {
        Object value = json.opt(key);
        if (!(value instanceof String)) {
            throw new InvalidPayloadException(INVALID_SCHEMA);
        }
        String text = (String) value;
        if (text.length() < minLength || text.length() > maxLength) {
            throw new InvalidPayloadException(INVALID_SCHEMA);
        }
        return text;
    }

    // 키가 없으면 null. 키가 있는데 null/비문자열이면 스키마 위반.
    private static String optionalString(JSONObject json, String key, int minLength, int maxLength)
            throws InvalidPayloadException {
        if (!json.has(key)) {
            return null;
        }
        return requireString(json, key, minLength, maxLength);
    }

    private static Instant requireInstant(JSONObject json, String key) throws InvalidPayloadException {
        try {
            return Instant.parse(requireString(json, key, 1, 64));
        } catch (DateTimeParseException e) {
            throw new InvalidPayloadException(INVALID_SCHEMA, e);
        }
    }

    private static String requireDmId(JSONObject json, String key) throws InvalidPayloadException {
        String value = requireString(json, key, 1, DmIds.DM_ID_MAX_LEN);
        if (!DmIds.isValid(value)) {
            throw new InvalidPayloadException(INVALID_SCHEMA);
        }
        return value;
    }

    private static DmIdentity requireIdentity(JSONObject json, String key) throws InvalidPayloadException {
        JSONObject identity = json.optJSONObject(key);
        if (identity == null) {
            throw new InvalidPayloadException(INVALID_SCHEMA);
        }
        String cipherSuite = requireString(identity, "cipherSuite", 1, 32);
        if (!DmIdentity.CIPHER_SUITE_NACL_BOX_V1.equals(cipherSuite)) {
            throw new InvalidPayloadException(INVALID_SCHEMA);
        }
        return new DmIdentity(cipherSuite,
                requireBase64(identity, "publicKey", DM_PUBLIC_KEY_MAX_LEN, DM_PUBLIC_KEY_BYTES));
    }

    /**
     * @param expectedBytes 디코딩 후 길이. 음수면 길이는 보지 않고 형식만 검사
     */
    private static String requireBase64(JSONObject json, String key, int maxLength, int expectedBytes)
            throws InvalidPayloadException {
        String value = requireString(json, key, 1, maxLength);
        int decodedBytes = base64DecodedLength(value);
        if (decodedBytes < 0 || (expectedBytes >= 0 && decodedBytes != expectedBytes)) {
            throw new InvalidPayloadException(INVALID_SCHEMA);
        }
        return value;
    }

    // 패딩 포함 표준 base64 인지 검사. 아니면 -1
    static int base64DecodedLength(String value) {
        if (value.length() % 4 != 0 || !BASE64.matcher(value).matches()) {
            return -1;
        }
        int padding = value.endsWith("==") ? 2 : value.endsWith("=") ? 1 : 0;
        return value.length() / 4 * 3 - padding;
    }

    private static String requireGithubUserId(JSONObject json, String key) throws InvalidPayloadException {
        String value = requireString(json, key, 1, ProtocolConstants.GITHUB_USER_ID_MAX_LEN);
        if (!GithubUserIds.isValid(value)) {
            throw new InvalidPayloadException(INVALID_SCHEMA);
        }
        return value;
    }
}
