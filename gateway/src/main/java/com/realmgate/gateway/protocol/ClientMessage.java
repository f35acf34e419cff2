package com.realmgate.gateway.protocol;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Text frame sent by a game client: {@code {"type": "...", ...}}.
 * <p>
 * Unknown fields are ignored so clients may attach their own metadata.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ClientMessage {
    public static final String AUTH = "auth";
    public static final String PING = "ping";

    /**
     * Message type: {@value #AUTH} or {@value #PING}.
     */
    String type;

    /**
     * User identity presented with {@value #AUTH}.
     */
    String userId;
}
