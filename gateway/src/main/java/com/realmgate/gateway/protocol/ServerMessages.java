package com.realmgate.gateway.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Frames the gateway sends to clients.
 */
public final class ServerMessages {
    private ServerMessages() {
    }

    /**
     * Reply to a successful auth: the backend the session is routed to.
     */
    @Value
    @Builder
    public static class Welcome {
        @JsonProperty("type")
        @Builder.Default
        String type = "welcome";

        @JsonProperty("connectionId")
        String connectionId;

        @JsonProperty("serverId")
        String serverId;

        @JsonProperty("host")
        String host;

        @JsonProperty("port")
        int port;
    }

    @Value
    public static class Pong {
        @JsonProperty("type")
        String type = "pong";
    }

    /**
     * Refusal of a client frame. The connection stays open.
     */
    @Value
    public static class ErrorReply {
        public static final String NO_HEALTHY_SERVER = "no_healthy_server";
        public static final String CAPACITY_EXCEEDED = "capacity_exceeded";
        public static final String NOT_ADMITTED = "not_admitted";
        public static final String UNKNOWN_TYPE = "unknown_type";
        public static final String MALFORMED = "malformed";

        @JsonProperty("type")
        String type = "error";

        @JsonProperty("reason")
        String reason;
    }
}
