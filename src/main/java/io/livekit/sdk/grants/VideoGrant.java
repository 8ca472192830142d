package io.livekit.sdk.grants;

import java.util.ArrayList;
import java.util.List;

/**
 * Room-level permissions of a participant.
 *
 * <p>Every component is nullable: an unset permission is left out of the token entirely rather than written as
 * {@code false}. The static factories are the exception, see {@link #defaults()}.
 */
public record VideoGrant(
    Boolean roomCreate,
    Boolean roomList,
    Boolean roomRecord,
    Boolean roomAdmin,
    Boolean roomJoin,
    String room,
    Boolean canPublish,
    Boolean canSubscribe,
    Boolean canPublishData,
    List<String> canPublishSources,
    Boolean canUpdateOwnMetadata,
    Boolean ingressAdmin,
    Boolean hidden,
    Boolean recorder,
    Boolean agent,
    Boolean canSubscribeMetrics,
    String destinationRoom
) {

    public VideoGrant {
        canPublishSources = Copies.list(canPublishSources);
    }

    /**
     * Grant with the room administration flags ({@code roomJoin}, {@code roomList}, {@code roomRecord},
     * {@code roomAdmin}, {@code roomCreate}, {@code ingressAdmin}) explicitly set to {@code false}.
     */
    public static VideoGrant defaults() {
        return builder()
            .roomJoin(false)
            .roomList(false)
            .roomRecord(false)
            .roomAdmin(false)
            .roomCreate(false)
            .ingressAdmin(false)
            .build();
    }

    public static VideoGrant joinRoom(String room) {
        return defaults().toBuilder()
            .room(room)
            .roomJoin(true)
            .build();
    }

    public static VideoGrant joinRoom(String room, boolean canPublish, boolean canSubscribe) {
        return defaults().toBuilder()
            .room(room)
            .roomJoin(true)
            .canPublish(canPublish)
            .canSubscribe(canSubscribe)
            .build();
    }

    public static VideoGrant adminRoom() {
        return defaults().toBuilder().roomAdmin(true).build();
    }

    public static VideoGrant recordRoom() {
        return defaults().toBuilder().roomRecord(true).build();
    }

    public static VideoGrant createRoom() {
        return defaults().toBuilder().roomCreate(true).build();
    }

    public static VideoGrant adminIngress() {
        return defaults().toBuilder().ingressAdmin(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .roomCreate(roomCreate)
            .roomList(roomList)
            .roomRecord(roomRecord)
            .roomAdmin(roomAdmin)
            .roomJoin(roomJoin)
            .room(room)
            .canPublish(canPublish)
            .canSubscribe(canSubscribe)
            .canPublishData(canPublishData)
            .canPublishSources(canPublishSources)
            .canUpdateOwnMetadata(canUpdateOwnMetadata)
            .ingressAdmin(ingressAdmin)
            .hidden(hidden)
            .recorder(recorder)
            .agent(agent)
            .canSubscribeMetrics(canSubscribeMetrics)
            .destinationRoom(destinationRoom);
    }

    public static final class Builder {
        private Boolean roomCreate;
        private Boolean roomList;
        private Boolean roomRecord;
        private Boolean roomAdmin;
        private Boolean roomJoin;
        private String room;
        private Boolean canPublish;
        private Boolean canSubscribe;
        private Boolean canPublishData;
        private List<String> canPublishSources;
        private Boolean canUpdateOwnMetadata;
        private Boolean ingressAdmin;
        private Boolean hidden;
        private Boolean recorder;
        private Boolean agent;
        private Boolean canSubscribeMetrics;
        private String destinationRoom;

        public Builder roomCreate(Boolean roomCreate) {
            this.roomCreate = roomCreate;
            return this;
        }

        public Builder roomList(Boolean roomList) {
            this.roomList = roomList;
            return this;
        }

        public Builder roomRecord(Boolean roomRecord) {
            this.roomRecord = roomRecord;
            return this;
        }

        public Builder roomAdmin(Boolean roomAdmin) {
            this.roomAdmin = roomAdmin;
            return this;
        }

        public Builder roomJoin(Boolean roomJoin) {
            this.roomJoin = roomJoin;
            return this;
        }

        public Builder room(String room) {
            this.room = room;
            return this;
        }

        public Builder canPublish(Boolean canPublish) {
            this.canPublish = canPublish;
            return this;
        }

        public Builder canSubscribe(Boolean canSubscribe) {
            this.canSubscribe = canSubscribe;
            return this;
        }

        public Builder canPublishData(Boolean canPublishData) {
            this.canPublishData = canPublishData;
            return this;
        }

        /**
         * Track sources the participant may publish, e.g. {@code camera}, {@code microphone},
         * {@code screen_share}.
         */
        public Builder canPublishSources(List<String> canPublishSources) {
            this.canPublishSources = canPublishSources == null ? null : new ArrayList<>(canPublishSources);
            return this;
        }

        public Builder canUpdateOwnMetadata(Boolean canUpdateOwnMetadata) {
            this.canUpdateOwnMetadata = canUpdateOwnMetadata;
            return this;
        }

        public Builder ingressAdmin(Boolean ingressAdmin) {
            this.ingressAdmin = ingressAdmin;
            return this;
        }

        public Builder hidden(Boolean hidden) {
            this.hidden = hidden;
            return this;
        }

        public Builder recorder(Boolean recorder) {
            this.recorder = recorder;
            return this;
        }

        public Builder agent(Boolean agent) {
            this.agent = agent;
            return this;
        }

        public Builder canSubscribeMetrics(Boolean canSubscribeMetrics) {
            this.canSubscribeMetrics = canSubscribeMetrics;
            return this;
        }

        public Builder destinationRoom(String destinationRoom) {
            this.destinationRoom = destinationRoom;
            return this;
        }

        public VideoGrant build() {
            return new VideoGrant(
                roomCreate,
                roomList,
                roomRecord,
                roomAdmin,
                roomJoin,
                room,
                canPublish,
                canSubscribe,
                canPublishData,
                canPublishSources,
                canUpdateOwnMetadata,
                ingressAdmin,
                hidden,
                recorder,
                agent,
                canSubscribeMetrics,
                destinationRoom
            );
        }
    }
}
