package com.realmgate.gateway.protocol;

import com.realmgate.core.util.JsonUtils;
import com.realmgate.gateway.protocol.ServerMessages.ErrorReply;
import com.realmgate.gateway.session.ConnectionRecord;
import com.realmgate.gateway.session.IConnectionManager;
import com.realmgate.loadbalancer.balancer.ILoadBalancer;
import com.realmgate.loadbalancer.node.AssignmentResult;
import com.realmgate.loadbalancer.node.ServerNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Client protocol.
 * <p>
 * Protocol (client → server):
 * <ul>
 *   <li>auth: {userId} - authenticates and routes the session to a backend</li>
 *   <li>ping: {}</li>
 * </ul>
 * </p>
 * <p>
 * Protocol (server → client):
 * <ul>
 *   <li>welcome: {connectionId, serverId, host, port}</li>
 *   <li>pong: {}</li>
 *   <li>error: {reason}</li>
 * </ul>
 * </p>
 * Every client frame gets exactly one reply.
 */
public class GatewayMessageHandler {
    private static final Logger log = LoggerFactory.getLogger(GatewayMessageHandler.class);

    private final IConnectionManager connectionManager;
    private final ILoadBalancer loadBalancer;

    public GatewayMessageHandler(IConnectionManager connectionManager, ILoadBalancer loadBalancer) {
        this.connectionManager = connectionManager;
        this.loadBalancer = loadBalancer;
    }

    /**
     * Handles one text frame.
     *
     * @return the JSON reply for the client
     */
    public String handle(String connectionId, String text) {
        ClientMessage message;
        try {
            message = JsonUtils.readValue(text, ClientMessage.class);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed frame from {}: {}", connectionId, e.getMessage());
            return error(ErrorReply.MALFORMED);
        }

        if (message == null || message.getType() == null) {
            log.warn("Frame without type from {}: {}", connectionId, text);
            return error(ErrorReply.MALFORMED);
        }

        return switch (message.getType()) {
            case ClientMessage.AUTH -> handleAuth(connectionId, message.getUserId());
            case ClientMessage.PING -> JsonUtils.writeValueAsString(new ServerMessages.Pong());
            default -> {
                log.warn("Unknown message type '{}' from {}", message.getType(), connectionId);
                yield error(ErrorReply.UNKNOWN_TYPE);
            }
        };
    }

    private String handleAuth(String connectionId, String userId) {
        if (userId == null || userId.isBlank()) {
            log.warn("Auth without userId from {}", connectionId);
            return error(ErrorReply.MALFORMED);
        }
        if (!connectionManager.authenticate(connectionId, userId)) {
            return error(ErrorReply.NOT_ADMITTED);
        }

        // Re-auth keeps the session on its current backend
        Optional<ServerNode> existing = loadBalancer.assignedServer(connectionId)
            .flatMap(loadBalancer::getServer);
        if (existing.isPresent()) {
            log.debug("Connection {} re-authenticated as {}, keeping server {}",
                connectionId, userId, existing.get().getId());
            return welcome(connectionId, existing.get());
        }

        String clientIp = connectionManager.get(connectionId)
            .map(ConnectionRecord::getClientIp)
            .orElse(null);
        Optional<String> selected = loadBalancer.select(clientIp);
        if (selected.isEmpty()) {
            return error(ErrorReply.NO_HEALTHY_SERVER);
        }

        String serverId = selected.get();
        AssignmentResult result = loadBalancer.assign(serverId, connectionId);
        return switch (result) {
            case ASSIGNED, ALREADY_ASSIGNED -> loadBalancer.assignedServer(connectionId)
                .flatMap(loadBalancer::getServer)
                .map(node -> welcome(connectionId, node))
                .orElseGet(() -> error(ErrorReply.NO_HEALTHY_SERVER));
            case CAPACITY_EXCEEDED -> error(ErrorReply.CAPACITY_EXCEEDED);
            // removed between select and assign
            case UNKNOWN_SERVER -> error(ErrorReply.NO_HEALTHY_SERVER);
        };
    }

    private static String welcome(String connectionId, ServerNode node) {
        return JsonUtils.writeValueAsString(ServerMessages.Welcome.builder()
            .connectionId(connectionId)
            .serverId(node.getId())
            .host(node.getHost())
            .port(node.getPort())
            .build());
    }

    private static String error(String reason) {
        return JsonUtils.writeValueAsString(new ErrorReply(reason));
    }
}
