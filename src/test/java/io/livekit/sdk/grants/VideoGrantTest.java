package io.livekit.sdk.grants;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VideoGrantTest {

    @Test
    void joinRoomDefaultsAdministrativeFlagsToFalse() {
        VideoGrant grant = VideoGrant.joinRoom("my-room");

        assertEquals("my-room", grant.room());
        assertTrue(grant.roomJoin());
        assertFalse(grant.roomList());
        assertFalse(grant.roomRecord());
        assertFalse(grant.roomAdmin());
        assertFalse(grant.roomCreate());
        assertFalse(grant.ingressAdmin());
        assertNull(grant.canPublish());
        assertNull(grant.canSubscribe());
    }

    @Test
    void joinRoomWithPublishAndSubscribeFlags() {
        VideoGrant grant = VideoGrant.joinRoom("my-room", true, false);

        assertTrue(grant.canPublish());
        assertFalse(grant.canSubscribe());
    }

    @Test
    void singlePermissionFactories() {
        assertTrue(VideoGrant.adminRoom().roomAdmin());
        assertFalse(VideoGrant.adminRoom().roomJoin());
        assertTrue(VideoGrant.recordRoom().roomRecord());
        assertTrue(VideoGrant.createRoom().roomCreate());
        assertTrue(VideoGrant.adminIngress().ingressAdmin());
        assertNull(VideoGrant.adminIngress().room());
    }

    @Test
    void toBuilderPreservesEveryField() {
        VideoGrant grant = VideoGrant.builder()
            .roomJoin(true)
            .room("a")
            .canPublishSources(List.of("camera", "microphone"))
            .hidden(true)
            .destinationRoom("b")
            .canSubscribeMetrics(false)
            .build();

        assertEquals(grant, grant.toBuilder().build());
        assertEquals("c", grant.toBuilder().room("c").build().room());
    }

    @Test
    void publishSourcesAreCopied() {
        List<String> sources = new ArrayList<>(List.of("camera"));
        VideoGrant grant = VideoGrant.builder().canPublishSources(sources).build();
        sources.add("screen_share");

        assertEquals(List.of("camera"), grant.canPublishSources());
        assertThrows(UnsupportedOperationException.class, () -> grant.canPublishSources().add("microphone"));
    }
}
