package com.roomchat.scheduler;

import com.roomchat.room.core.RoomRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class RoomMaintenanceSchedulerTest {

    @Test
    public void evictsIdleRooms() {
        RoomRegistry roomRegistry = mock(RoomRegistry.class);
        when(roomRegistry.evictIdleRooms()).thenReturn(2);

        new RoomMaintenanceScheduler(roomRegistry).evictIdleRooms();

        verify(roomRegistry).evictIdleRooms();
    }

    @Test
    public void failureIsContainedToOneRun() {
        RoomRegistry roomRegistry = mock(RoomRegistry.class);
        when(roomRegistry.evictIdleRooms()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> new RoomMaintenanceScheduler(roomRegistry).evictIdleRooms());
    }
}
