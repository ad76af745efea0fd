package com.roomchat.room.model;

import org.json.JSONObject;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 테스트용 ConnectionChannel: 보낸 프레임과 close 호출을 기록한다.
 */
public class RecordingChannel implements ConnectionChannel {

    private final String id;
    private final List<String> sent = new ArrayList<>();
    private boolean open = true;
    private boolean failOnSend;
    private Integer closeCode;
    private String closeReason;

    public RecordingChannel(String id) {
        this.id = id;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void send(String payload) throws IOException {
        if (failOnSend) {
            throw new IOException("broken pipe");
        }
        sent.add(payload);
    }

    @Override
    public void close(int code, String reason) {
        if (!open) {
            return;
        }
        open = false;
        closeCode = code;
        closeReason = reason;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public void failOnSend() {
        this.failOnSend = true;
    }

    public List<JSONObject> frames() {
        return sent.stream().map(JSONObject::new).collect(Collectors.toList());
    }

    public List<JSONObject> framesOfType(String type) {
        return frames().stream().filter(frame -> type.equals(frame.optString("type"))).collect(Collectors.toList());
    }

    public JSONObject lastFrame() {
        return new JSONObject(sent.get(sent.size() - 1));
    }

    public void clear() {
        sent.clear();
    }

    public Integer getCloseCode() {
        return closeCode;
    }

    public String getCloseReason() {
        return closeReason;
    }
}
