package com.roomchat.contentpolicy;

/**
 * off : 검사하지 않음 / reject : 금칙어 포함 메시지 거부
 */
public enum ContentPolicyMode {
    OFF,
    REJECT
}
