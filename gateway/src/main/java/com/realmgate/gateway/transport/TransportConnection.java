package com.realmgate.gateway.transport;

import com.realmgate.core.util.BytesUtils;
import com.realmgate.gateway.metrics.TransportMetrics;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;
import reactor.util.concurrent.Queues;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;

/**
 * One client WebSocket connection.
 * <p>
 * State machine: {@code CONNECTING -> OPEN -> CLOSING -> CLOSED}. While open, inbound
 * frames are read one at a time: the next frame is requested only once the {@code Mono}
 * returned by the message callback completes. Outbound text goes through a bounded queue drained by the socket writer; a
 * full queue closes the connection.
 * </p>
 * <p>
 * The close callback fires exactly once, whichever side closed first. Callbacks receive
 * the connection id only; the owning server resolves it against its registry.
 * </p>
 */
public class TransportConnection {
    private static final Logger log = LoggerFactory.getLogger(TransportConnection.class);

    @Getter
    private final String id;
    @Getter
    private final String remoteAddress;
    private final int maxFramePayload;
    private final TransportMetrics metrics;
    private final BiFunction<String, String, Mono<Void>> onMessage;
    private final BiConsumer<String, CloseReason> onClose;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final AtomicBoolean closeFired = new AtomicBoolean(false);
    private final Sinks.Many<String> outboundQueue;
    private volatile WebsocketOutbound outbound;

    public TransportConnection(
        String id,
        String remoteAddress,
        int outboundBufferSize,
        int maxFramePayload,
        TransportMetrics metrics,
        BiFunction<String, String, Mono<Void>> onMessage,
        BiConsumer<String, CloseReason> onClose
    ) {
        this.id = id;
        this.remoteAddress = remoteAddress;
        this.maxFramePayload = maxFramePayload;
        this.metrics = metrics;
        this.onMessage = onMessage;
        this.onClose = onClose;
        this.outboundQueue = Sinks.many().unicast()
            .onBackpressureBuffer(Queues.<String>get(outboundBufferSize).get());
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN;
    }

    /**
     * Completes the handshake and runs the read and write loops until the connection closes.
     *
     * @return completes once both loops have finished
     */
    Mono<Void> open(WebsocketInbound inbound, WebsocketOutbound outbound) {
        if (!state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.OPEN)) {
            log.warn("Connection {} is {} and cannot be opened", id, state.get());
            return outbound.sendClose();
        }
        this.outbound = outbound;
        log.debug("Connection {} open ({})", id, remoteAddress);

        inbound.withConnection(connection -> connection.onDispose(() -> close(CloseReason.PEER)));

        Mono<Void> reads = inbound.aggregateFrames(maxFramePayload)
            .receive()
            .asString()
            .concatMap(this::deliver, 0)
            .then()
            .doOnSuccess(v -> close(CloseReason.PEER))
            .onErrorResume(err -> {
                if (!(err instanceof AbortedException)) {
                    log.warn("Read failed on connection {}: {}", id, err.toString());
                }
                close(CloseReason.ERROR);
                return Mono.empty();
            });

        Mono<Void> writes = outbound.sendString(outboundQueue.asFlux()
                .doOnNext(text -> metrics.recordOutbound(BytesUtils.utf8Length(text))))
            .then()
            .onErrorResume(err -> {
                if (!(err instanceof AbortedException)) {
                    log.warn("Write failed on connection {}: {}", id, err.toString());
                }
                close(CloseReason.ERROR);
                return Mono.empty();
            });

        return Mono.when(reads, writes);
    }

    private Mono<Void> deliver(String text) {
        metrics.recordInbound(BytesUtils.utf8Length(text));
        return Mono.defer(() -> onMessage.apply(id, text))
            .onErrorResume(err -> {
                log.error("Message callback failed for connection {}", id, err);
                return Mono.empty();
            });
    }

    /**
     * Queues a text frame for sending.
     *
     * @return false if the connection is not open or its outbound queue is full
     */
    public boolean send(String text) {
        Sinks.EmitResult result;
        synchronized (this) {
            if (state.get() != ConnectionState.OPEN) {
                log.debug("Dropping send on connection {} in state {}", id, state.get());
                return false;
            }
            result = outboundQueue.tryEmitNext(text);
        }

        if (result.isFailure()) {
            log.warn("Outbound queue rejected frame on connection {} ({}), closing", id, result);
            close(CloseReason.OVERFLOW);
            return false;
        }
        return true;
    }

    /**
     * Closes the connection. Safe to call any number of times from any thread.
     */
    public void close(CloseReason reason) {
        ConnectionState previous = state.getAndUpdate(current ->
            current == ConnectionState.CONNECTING || current == ConnectionState.OPEN
                ? ConnectionState.CLOSING
                : current);
        if (previous == ConnectionState.CLOSING || previous == ConnectionState.CLOSED) {
            return;
        }

        synchronized (this) {
            outboundQueue.tryEmitComplete();
        }

        WebsocketOutbound out = outbound;
        if (out != null && reason != CloseReason.PEER) {
            out.sendClose().subscribe(
                null,
                err -> log.debug("Close frame not delivered on connection {}: {}", id, err.toString())
            );
        }

        state.set(ConnectionState.CLOSED);
        if (closeFired.compareAndSet(false, true)) {
            log.debug("Connection {} closed ({})", id, reason.tagValue());
            onClose.accept(id, reason);
        }
    }
}
