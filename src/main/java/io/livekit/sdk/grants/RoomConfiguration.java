package io.livekit.sdk.grants;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings applied when the room named in the token is created by the joining participant.
 *
 * <p>Timeouts are in seconds, playout delays in milliseconds.
 */
public record RoomConfiguration(
    String name,
    Integer emptyTimeout,
    Integer departureTimeout,
    Integer maxParticipants,
    String metadata,
    RoomEgress egress,
    Integer minPlayoutDelay,
    Integer maxPlayoutDelay,
    Boolean syncStreams,
    List<RoomAgentDispatch> agents
) {

    public RoomConfiguration {
        agents = Copies.list(agents);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private Integer emptyTimeout;
        private Integer departureTimeout;
        private Integer maxParticipants;
        private String metadata;
        private RoomEgress egress;
        private Integer minPlayoutDelay;
        private Integer maxPlayoutDelay;
        private Boolean syncStreams;
        private List<RoomAgentDispatch> agents;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder emptyTimeout(Integer emptyTimeout) {
            this.emptyTimeout = emptyTimeout;
            return this;
        }

        public Builder departureTimeout(Integer departureTimeout) {
            this.departureTimeout = departureTimeout;
            return this;
        }

        public Builder maxParticipants(Integer maxParticipants) {
            this.maxParticipants = maxParticipants;
            return this;
        }

        public Builder metadata(String metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder egress(RoomEgress egress) {
            this.egress = egress;
            return this;
        }

        public Builder minPlayoutDelay(Integer minPlayoutDelay) {
            this.minPlayoutDelay = minPlayoutDelay;
            return this;
        }

        public Builder maxPlayoutDelay(Integer maxPlayoutDelay) {
            this.maxPlayoutDelay = maxPlayoutDelay;
            return this;
        }

        public Builder syncStreams(Boolean syncStreams) {
            this.syncStreams = syncStreams;
            return this;
        }

        public Builder agents(List<RoomAgentDispatch> agents) {
            this.agents = agents == null ? null : new ArrayList<>(agents);
            return this;
        }

        public RoomConfiguration build() {
            return new RoomConfiguration(
                name,
                emptyTimeout,
                departureTimeout,
                maxParticipants,
                metadata,
                egress,
                minPlayoutDelay,
                maxPlayoutDelay,
                syncStreams,
                agents
            );
        }
    }
}
