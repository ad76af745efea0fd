package com.roomchat.protocol;

/**
 * 인바운드 프레임이 JSON 이 아니거나 스키마를 만족하지 않을 때.
 * 메시지는 클라이언트에게 그대로 돌려줘도 되는 수준으로만 작성한다.
 */
public class InvalidPayloadException extends Exception {

    public InvalidPayloadException(String message) {
        super(message);
    }

    public InvalidPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
