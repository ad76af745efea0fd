package com.roomchat.room.storage;

/**
 * 방 ID → 해당 방 전용 RoomStorage
 */
public interface RoomStorageProvider {

    RoomStorage forRoom(String roomId);
}
