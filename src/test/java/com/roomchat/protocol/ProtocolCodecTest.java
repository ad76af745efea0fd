package com.roomchat.protocol;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ProtocolCodecTest {

    private static final AuthUser ALICE = new AuthUser("1", "alice", "Alice", "https://avatars.example.com/1",
            EnumSet.of(UserRole.MODERATOR));

    private static InvalidPayloadException decodeFails(String raw) {
        return assertThrows(InvalidPayloadException.class, () -> ProtocolCodec.decodeClientEvent(raw));
    }

    @Test
    public void decodesMessageSendWithOptionalCorrelationId() throws Exception {
        ClientEvent event = ProtocolCodec.decodeClientEvent(
                "{\"version\":4,\"type\":\"client/message.send\",\"text\":\"hi\",\"clientMessageId\":\"m-1\"}");

        ClientMessageSend send = assertInstanceOf(ClientMessageSend.class, event);
        assertEquals("hi", send.getText());
        assertEquals("m-1", send.getClientMessageId().orElseThrow());

        ClientMessageSend withoutId = (ClientMessageSend) ProtocolCodec.decodeClientEvent(
                "{\"type\":\"client/message.send\",\"text\":\"hi\"}");
        assertTrue(withoutId.getClientMessageId().isEmpty());
    }

    @Test
    public void decodesHelloAndModerationEvents() throws Exception {
        ClientHello hello = (ClientHello) ProtocolCodec.decodeClientEvent(
                "{\"type\":\"client/hello\",\"client\":{\"name\":\"vscode\",\"version\":\"1.2.3\"}}");
        assertEquals("vscode", hello.getClientName());
        assertEquals("1.2.3", hello.getClientVersion());

        ClientModerationUserDeny deny = (ClientModerationUserDeny) ProtocolCodec.decodeClientEvent(
                "{\"type\":\"client/moderation.user.deny\",\"targetGithubUserId\":\"42\",\"reason\":\"spam\"}");
        assertEquals("42", deny.getTargetGithubUserId());
        assertEquals("spam", deny.getReason());

        ClientModerationUserAllow allow = (ClientModerationUserAllow) ProtocolCodec.decodeClientEvent(
                "{\"type\":\"client/moderation.user.allow\",\"targetGithubUserId\":\"42\"}");
        assertEquals("42", allow.getTargetGithubUserId());
    }

    @Test
    public void rejectsMalformedJson() {
        assertEquals("Invalid JSON", decodeFails("{not json").getMessage());
    }

    @Test
    public void rejectsSchemaViolations() {
        assertEquals("Invalid event schema", decodeFails("{\"type\":\"client/unknown\"}").getMessage());
        decodeFails("{\"version\":3,\"type\":\"client/message.send\",\"text\":\"hi\"}");
        decodeFails("{\"version\":\"4\",\"type\":\"client/message.send\",\"text\":\"hi\"}");
        decodeFails("{\"type\":\"client/message.send\",\"text\":\"\"}");
        decodeFails("{\"type\":\"client/message.send\",\"text\":\"" + "a".repeat(501) + "\"}");
        decodeFails("{\"type\":\"client/message.send\",\"text\":\"hi\",\"clientMessageId\":null}");
        decodeFails("{\"type\":\"client/message.send\",\"text\":\"hi\",\"clientMessageId\":\"" + "x".repeat(129) + "\"}");
        decodeFails("{\"type\":\"client/hello\"}");
        decodeFails("{\"type\":\"client/moderation.user.deny\",\"targetGithubUserId\":\"01\"}");
        decodeFails("{\"type\":\"client/moderation.user.allow\",\"targetGithubUserId\":42}");
    }

    @Test
    public void encodesErrorWithoutMessageFields() {
        JSONObject json = new JSONObject(ProtocolCodec.encode(
                new ServerError(ServerErrorCode.RATE_LIMITED, "Too many messages", 1500L)));

        assertEquals(4, json.getInt("version"));
        assertEquals("server/error", json.getString("type"));
        assertEquals("rate_limited", json.getString("code"));
        assertEquals(1500L, json.getLong("retryAfterMs"));
        assertEquals("Too many messages", json.getString("message"));
        assertFalse(json.has("text"));
        assertFalse(json.has("id"));
    }

    @Test
    public void encodesMessageVariants() {
        ChatMessagePlain message = new ChatMessagePlain("id-1", ALICE, "hello", Instant.parse("2026-01-01T00:00:00Z"));

        JSONObject publicJson = new JSONObject(ProtocolCodec.encode(ServerMessageNew.publicVariant(message)));
        JSONObject senderJson = new JSONObject(ProtocolCodec.encode(ServerMessageNew.senderVariant(message, "m-1")));

        assertEquals("server/message.new", publicJson.getString("type"));
        assertFalse(publicJson.has("clientMessageId"));
        assertEquals("m-1", senderJson.getString("clientMessageId"));
        assertEquals("hello", senderJson.getJSONObject("message").getString("text"));
        assertEquals("moderator", senderJson.getJSONObject("message").getJSONObject("user").getJSONArray("roles").getString(0));
    }

    @Test
    public void encodesModerationSnapshot() {
        JSONObject json = new JSONObject(ProtocolCodec.encode(
                new ServerModerationSnapshot(List.of("7"), List.of("10", "9"))));

        assertEquals("server/moderation.snapshot", json.getString("type"));
        assertEquals(1, json.getJSONArray("operatorDeniedGithubUserIds").length());
        assertEquals("10", json.getJSONArray("roomDeniedGithubUserIds").getString(0));
    }

    @Test
    public void historySkipsCorruptEntries() throws Exception {
        ChatMessagePlain message = new ChatMessagePlain("id-1", ALICE, "hello", Instant.parse("2026-01-01T00:00:00Z"));
        JSONArray stored = new JSONArray(ProtocolCodec.encodeHistory(List.of(message)));
        stored.put("garbage");
        stored.put(new JSONObject().put("id", "broken"));

        List<ChatMessagePlain> decoded = ProtocolCodec.decodeHistory(stored.toString());

        assertEquals(List.of(message), decoded);
        assertThrows(InvalidPayloadException.class, () -> ProtocolCodec.decodeHistory("{}"));
    }

    @Test
    public void idListKeepsOnlyValidIds() throws Exception {
        assertEquals(List.of("1", "22"), ProtocolCodec.decodeIdList("[\"1\", \" 22 \", \"x\", 5, \"007\"]"));
        assertEquals("[\"1\",\"2\"]", ProtocolCodec.encodeIdList(List.of("1", "2")));
    }

    @Test
    public void handshakeRejectionCarriesRetryAfter() {
        JSONObject json = new JSONObject(ProtocolCodec.encodeHandshakeRejection(HandshakeRejection.rateLimited(2500)));

        assertEquals("rate_limited", json.getString("code"));
        assertEquals(2500L, json.getLong("retryAfterMs"));
        assertFalse(new JSONObject(ProtocolCodec.encodeHandshakeRejection(HandshakeRejection.forbidden())).has("retryAfterMs"));
    }

    private static final String PUBLIC_KEY = "A".repeat(43) + "=";

    private static JSONObject identityJson(String publicKey) {
        return new JSONObject().put("cipherSuite", "nacl.box.v1").put("publicKey", publicKey);
    }

    private static JSONObject dmSendJson() {
        return new JSONObject()
                .put("version", 4)
                .put("type", "client/dm.message.send")
                .put("dmId", "dm:v1:2:10")
                .put("recipientGithubUserId", "10")
                .put("senderIdentity", identityJson(PUBLIC_KEY))
                .put("recipientIdentity", identityJson(PUBLIC_KEY))
                .put("nonce", "C".repeat(32))
                .put("ciphertext", "Y2lwaGVy");
    }

    @Test
    public void decodesDirectMessageEvents() throws Exception {
        ClientDmMessageSend send = assertInstanceOf(ClientDmMessageSend.class,
                ProtocolCodec.decodeClientEvent(dmSendJson().toString()));
        assertEquals("dm:v1:2:10", send.getDmId());
        assertEquals(PUBLIC_KEY, send.getSenderIdentity().getPublicKey());

        ClientDmOpen open = assertInstanceOf(ClientDmOpen.class,
                ProtocolCodec.decodeClientEvent("{\"type\":\"client/dm.open\",\"targetGithubUserId\":\"7\"}"));
        assertEquals("7", open.getTargetGithubUserId());

        ClientDmIdentityPublish publish = assertInstanceOf(ClientDmIdentityPublish.class, ProtocolCodec.decodeClientEvent(
                new JSONObject().put("type", "client/dm.identity.publish").put("identity", identityJson(PUBLIC_KEY)).toString()));
        assertEquals("nacl.box.v1", publish.getIdentity().getCipherSuite());
    }

    @Test
    public void rejectsMalformedDirectMessageFields() {
        // dmId 는 숫자 크기 순으로 정렬돼 있어야 한다 (10 > 2)
        decodeFails(dmSendJson().put("dmId", "dm:v1:10:2").toString());
        decodeFails(dmSendJson().put("dmId", "dm:v2:1:2").toString());
        // 공개키는 32 bytes, nonce 는 24 bytes
        decodeFails(dmSendJson().put("senderIdentity", identityJson("AAAA")).toString());
        decodeFails(dmSendJson().put("nonce", "C".repeat(28)).toString());
        decodeFails(dmSendJson().put("ciphertext", "not base64!").toString());
        decodeFails(dmSendJson().put("recipientIdentity", identityJson(PUBLIC_KEY).put("cipherSuite", "rsa")).toString());
    }

    @Test
    public void dmIdsAreCanonical() {
        assertEquals("dm:v1:2:10", DmIds.fromParticipants("10", "2"));
        assertEquals("dm:v1:2:10", DmIds.fromParticipants("2", "10"));
        assertArrayEquals(new String[]{"2", "10"}, DmIds.participants("dm:v1:2:10").orElseThrow());
        assertFalse(DmIds.isValid("dm:v1:02:10"));
    }

    @Test
    public void encodesDmWelcomeWithoutMissingPeerIdentity() {
        JSONObject json = new JSONObject(ProtocolCodec.encode(new ServerDmWelcome("dm:v1:1:2", "2", null, List.of())));

        assertEquals("server/dm.welcome", json.getString("type"));
        assertEquals("2", json.getString("peerGithubUserId"));
        assertFalse(json.has("peerIdentity"));
        assertEquals(0, json.getJSONArray("history").length());
    }

    @Test
    public void dmIdentitiesSkipInvalidEntries() throws Exception {
        String stored = new JSONObject()
                .put("1", identityJson(PUBLIC_KEY))
                .put("abc", identityJson(PUBLIC_KEY))
                .put("2", new JSONObject().put("cipherSuite", "nacl.box.v1"))
                .toString();

        assertEquals(Set.of("1"), ProtocolCodec.decodeDmIdentities(stored).keySet());
    }
}
