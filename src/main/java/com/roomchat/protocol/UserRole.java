package com.roomchat.protocol;

public enum UserRole {
    MODERATOR("moderator");

    private final String wireName;

    UserRole(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static UserRole fromWireName(String wireName) {
        for (UserRole role : values()) {
            if (role.wireName.equals(wireName)) {
                return role;
            }
        }
        throw new IllegalArgumentException("알 수 없는 role: " + wireName);
    }
}
