package com.realmgate.gateway.transport;

import com.realmgate.core.error.InitializationException;
import com.realmgate.gateway.config.GatewayConfig;
import com.realmgate.gateway.metrics.TransportMetrics;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.WebsocketServerSpec;
import reactor.netty.resources.LoopResources;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiPredicate;

/**
 * WebSocket endpoint owning every live {@link TransportConnection}.
 * <p>
 * Each upgrade request gets a fresh id ({@code conn_<n>}, never reused), is registered,
 * then passes the admission gate before the handshake; a refused request is answered with
 * 503 and leaves no trace in the registry. Connections publish their events onto one
 * queue, drained by a single dispatcher thread that fans out to the listeners, so each
 * connection's events keep their order.
 * </p>
 * <p>
 * The queue is unbounded but cannot grow without limit: a connection does not read its
 * next frame until the listeners have handled the previous one, so each connection has at
 * most one message in flight besides its connect and disconnect events. No event is ever
 * dropped while the server runs.
 * </p>
 */
public class TransportServer {
    private static final Logger log = LoggerFactory.getLogger(TransportServer.class);

    private static final Duration BIND_TIMEOUT = Duration.ofSeconds(45);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final GatewayConfig config;
    private final TransportMetrics metrics;
    private final BiPredicate<String, String> admissionGate;

    private final Map<String, TransportConnection> connections = new ConcurrentHashMap<>();
    private final List<TransportListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong nextId = new AtomicLong();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final Sinks.Many<TransportEvent> observed = Sinks.many().multicast().directBestEffort();
    private final Object publishLock = new Object();

    private LoopResources loops;
    private Sinks.Many<PendingEvent> dispatchQueue;
    private Scheduler dispatcherScheduler;
    private Mono<Void> dispatcherDrained;
    private Disposable dispatcher;
    private DisposableServer server;

    /**
     * @param admissionGate called with {@code (connectionId, remoteAddress)} before the
     *                      handshake; returning false refuses the connection
     */
    public TransportServer(GatewayConfig config, TransportMetrics metrics, BiPredicate<String, String> admissionGate) {
        this.config = config;
        this.metrics = metrics;
        this.admissionGate = admissionGate;
        metrics.bindConnectionCount(connections::size);
    }

    public void addListener(TransportListener listener) {
        listeners.add(listener);
    }

    /**
     * Stream of every transport event, in dispatch order, emitted after the listeners have
     * seen it. A subscriber that falls more than {@code eventBufferSize} events behind loses
     * the oldest ones; listener delivery is unaffected.
     */
    public Flux<TransportEvent> events() {
        return observed.asFlux()
            .onBackpressureBuffer(config.getEventBufferSize(),
                dropped -> log.debug("Event stream subscriber lagging, dropped {} for {}",
                    dropped.type(), dropped.connectionId()),
                BufferOverflowStrategy.DROP_OLDEST);
    }

    // ==================== Lifecycle ====================

    /**
     * Binds the listening socket.
     *
     * @throws InitializationException if the port cannot be bound
     */
    public synchronized void start() {
        if (running.get()) {
            log.warn("Transport server already running on port {}", server.port());
            return;
        }

        loops = LoopResources.create("gateway-ws", config.getWorkerThreads(), true);
        startDispatcher();

        WebsocketServerSpec wsSpec = WebsocketServerSpec.builder()
            .maxFramePayloadLength(config.getMaxFramePayload())
            .build();

        try {
            server = HttpServer.create()
                .runOn(loops)
                .port(config.getWsPort())
                .option(ChannelOption.SO_REUSEADDR, true)
                .route(routes -> routes.get(config.getWsPath(), (req, res) -> handleUpgrade(req, res, wsSpec)))
                .bind()
                .doOnError(err -> log.error("Failed to bind WebSocket server on port {}", config.getWsPort(), err))
                .block(BIND_TIMEOUT);
        } catch (RuntimeException e) {
            releaseResources(false);
            throw new InitializationException("Failed to bind WebSocket server on port " + config.getWsPort(), e);
        }

        running.set(true);
        log.info("WebSocket server listening on port {} at {} ({} workers)",
            server.port(), config.getWsPath(), config.getWorkerThreads());
    }

    /**
     * Force-closes every live connection and releases the socket and worker threads.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping WebSocket server ({} live connections)", connections.size());

        for (TransportConnection connection : connections.values()) {
            connection.close(CloseReason.LOCAL);
        }
        server.disposeNow(SHUTDOWN_TIMEOUT);
        releaseResources(true);
        log.info("WebSocket server stopped");
    }

    private void startDispatcher() {
        Sinks.Many<PendingEvent> queue = Sinks.many().unicast().onBackpressureBuffer();
        dispatcherScheduler = Schedulers.newSingle("gateway-events");
        dispatcherDrained = queue.asFlux()
            .publishOn(dispatcherScheduler)
            .doOnNext(this::dispatch)
            .then()
            .cache();
        dispatcher = dispatcherDrained.subscribe(null, err -> log.error("Event dispatcher terminated", err));
        synchronized (publishLock) {
            dispatchQueue = queue;
        }
    }

    /**
     * @param drain whether to let the dispatcher deliver the events already queued, such as
     *              the DISCONNECTED events of the connections closed by {@link #stop()}
     */
    private void releaseResources(boolean drain) {
        Sinks.Many<PendingEvent> queue;
        synchronized (publishLock) {
            queue = dispatchQueue;
            dispatchQueue = null;
        }
        if (queue != null) {
            queue.tryEmitComplete();
            if (drain) {
                try {
                    dispatcherDrained.block(SHUTDOWN_TIMEOUT);
                } catch (IllegalStateException e) {
                    log.warn("Event dispatcher did not drain within {}", SHUTDOWN_TIMEOUT);
                }
            }
        }
        if (dispatcher != null) {
            dispatcher.dispose();
        }
        if (dispatcherScheduler != null) {
            dispatcherScheduler.dispose();
        }
        if (loops != null) {
            loops.disposeLater(Duration.ZERO, SHUTDOWN_TIMEOUT).block(SHUTDOWN_TIMEOUT);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port; useful when configured with port 0
     */
    public int port() {
        return server.port();
    }

    // ==================== Connection API ====================

    public boolean sendTo(String connectionId, String text) {
        TransportConnection connection = connections.get(connectionId);
        if (connection == null) {
            log.debug("sendTo unknown connection {}", connectionId);
            return false;
        }
        return connection.send(text);
    }

    /**
     * Queues {@code text} on every open connection.
     *
     * @return number of connections the frame was queued on
     */
    public int broadcast(String text) {
        int sent = 0;
        for (TransportConnection connection : connections.values()) {
            if (connection.isOpen() && connection.send(text)) {
                sent++;
            }
        }
        return sent;
    }

    public boolean closeConnection(String connectionId) {
        TransportConnection connection = connections.get(connectionId);
        if (connection == null) {
            return false;
        }
        connection.close(CloseReason.LOCAL);
        return true;
    }

    public int connectionCount() {
        return connections.size();
    }

    public boolean hasConnection(String connectionId) {
        return connections.containsKey(connectionId);
    }

    public Set<String> connectionIds() {
        return Set.copyOf(connections.keySet());
    }

    // ==================== Upgrade ====================

    private Mono<Void> handleUpgrade(HttpServerRequest req, HttpServerResponse res, WebsocketServerSpec wsSpec) {
        if (!running.get()) {
            return res.status(503).sendString(Mono.just("Service unavailable - server stopping")).then();
        }

        String connectionId = "conn_" + nextId.incrementAndGet();
        String remoteAddress = remoteIp(req.remoteAddress());
        TransportConnection connection = new TransportConnection(
            connectionId,
            remoteAddress,
            config.getOutboundBufferSize(),
            config.getMaxFramePayload(),
            metrics,
            this::onConnectionMessage,
            this::onConnectionClosed
        );
        connections.put(connectionId, connection);

        boolean admitted;
        try {
            admitted = admissionGate.test(connectionId, remoteAddress);
        } catch (RuntimeException e) {
            log.error("Admission gate failed for {}", connectionId, e);
            admitted = false;
        }
        if (!admitted) {
            connections.remove(connectionId);
            metrics.recordRejected();
            log.debug("Connection {} from {} refused by admission gate", connectionId, remoteAddress);
            return res.status(503).sendString(Mono.just("Service unavailable - connection refused")).then();
        }

        metrics.recordAccepted();
        return res.sendWebsocket((inbound, outbound) -> {
                MDC.put("connectionId", connectionId);
                try {
                    publish(TransportEvent.connected(connectionId, remoteAddress));
                    return connection.open(inbound, outbound);
                } finally {
                    MDC.remove("connectionId");
                }
            }, wsSpec)
            .onErrorResume(err -> {
                log.warn("WebSocket handshake failed for {}: {}", connectionId, err.toString());
                connection.close(CloseReason.ERROR);
                return Mono.empty();
            });
    }

    private static String remoteIp(SocketAddress address) {
        if (address instanceof InetSocketAddress inet) {
            return inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
        }
        return String.valueOf(address);
    }

    // ==================== Events ====================

    /**
     * @return completes once every listener has handled the message
     */
    private Mono<Void> onConnectionMessage(String connectionId, String text) {
        return publish(TransportEvent.message(connectionId, text));
    }

    private void onConnectionClosed(String connectionId, CloseReason reason) {
        connections.remove(connectionId);
        metrics.recordClosed(reason);
        publish(TransportEvent.disconnected(connectionId, reason));
    }

    private Mono<Void> publish(TransportEvent event) {
        Sinks.Empty<Void> handled = Sinks.empty();
        Sinks.EmitResult result;
        synchronized (publishLock) {
            result = dispatchQueue != null
                ? dispatchQueue.tryEmitNext(new PendingEvent(event, handled))
                : Sinks.EmitResult.FAIL_TERMINATED;
        }
        if (result.isFailure()) {
            log.debug("{} event for {} not dispatched, server stopped ({})",
                event.type(), event.connectionId(), result);
            return Mono.empty();
        }
        return handled.asMono();
    }

    private void dispatch(PendingEvent pending) {
        try {
            notifyListeners(pending.event());
            observed.tryEmitNext(pending.event());
        } finally {
            pending.handled().tryEmitEmpty();
        }
    }

    private void notifyListeners(TransportEvent event) {
        for (TransportListener listener : listeners) {
            try {
                switch (event.type()) {
                    case CONNECTED -> listener.onConnected(event.connectionId(), event.payload());
                    case MESSAGE -> listener.onMessage(event.connectionId(), event.payload());
                    case DISCONNECTED -> listener.onDisconnected(event.connectionId(), event.closeReason());
                }
            } catch (RuntimeException e) {
                log.error("Listener failed on {} event for {}", event.type(), event.connectionId(), e);
            }
        }
    }

    private record PendingEvent(TransportEvent event, Sinks.Empty<Void> handled) {
    }
}
