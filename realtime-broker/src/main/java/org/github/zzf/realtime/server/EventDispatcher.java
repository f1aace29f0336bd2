package org.github.zzf.realtime.server;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.EventExecutorGroup;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.model.Envelope;
import org.github.zzf.realtime.protocol.model.ErrorCode;
import org.github.zzf.realtime.protocol.model.MessageType;
import org.github.zzf.realtime.protocol.server.Connection;
import org.github.zzf.realtime.protocol.server.EventHandler;
import org.github.zzf.realtime.server.metric.MetricUtil;

/**
 * Routes inbound envelopes by type.
 * <p>
 * Built-in control types run inline on the connection's event loop so the handshake is ordered before
 * anything the client sent after it. Application handlers run on the handler executors; every connection
 * is pinned to one executor, so its messages start in arrival order.
 */
@Slf4j
public class EventDispatcher {

    private final Map<MessageType, EventHandler> controlHandlers;
    private final ConcurrentMap<String, EventHandler> handlers = new ConcurrentHashMap<>();
    private final ImmutableList<EventExecutor> executors;

    public EventDispatcher(Map<MessageType, EventHandler> controlHandlers, EventExecutorGroup handlerExecutor) {
        checkNotNull(controlHandlers);
        checkNotNull(handlerExecutor);
        this.controlHandlers = new EnumMap<>(controlHandlers);
        for (MessageType t : MessageType.values()) {
            checkArgument(!t.inbound() || this.controlHandlers.containsKey(t), "no handler for %s", t);
        }
        this.executors = ImmutableList.copyOf(handlerExecutor);
    }

    /**
     * register the handler for an application type, replacing any previous one
     */
    public void register(String type, EventHandler handler) {
        checkNotNull(type);
        checkNotNull(handler);
        checkArgument(MessageType.inbound(type) == null, "%s is a built-in type", type);
        EventHandler previous = handlers.put(type, handler);
        log.info("EventHandler registered for type: {}, replaced: {}", type, previous != null);
    }

    public void unregister(String type) {
        if (handlers.remove(type) != null) {
            log.info("EventHandler unregistered for type: {}", type);
        }
    }

    public void dispatch(Connection connection, Envelope envelope) {
        String type = envelope.type();
        if (MessageType.requiresAuthentication(type) && !connection.authenticated()) {
            log.debug("Connection({}) sent {} before authentication", connection.id(), type);
            connection.send(Envelope.error(ErrorCode.AUTHENTICATION_REQUIRED,
                    "Authentication required", envelope.requestId()));
            return;
        }
        MessageType control = MessageType.inbound(type);
        if (control != null) {
            invoke(controlHandlers.get(control), connection, envelope);
            return;
        }
        EventHandler handler = handlers.get(type);
        if (handler == null) {
            log.debug("Connection({}) sent unknown type: {}", connection.id(), type);
            MetricUtil.count("realtime.dispatch.unknown");
            connection.send(Envelope.error(ErrorCode.UNKNOWN_EVENT,
                    "Unknown event type: " + type, envelope.requestId()));
            return;
        }
        executorOf(connection).execute(() -> invoke(handler, connection, envelope));
    }

    private EventExecutor executorOf(Connection connection) {
        return executors.get(Math.floorMod(connection.id().hashCode(), executors.size()));
    }

    private void invoke(EventHandler handler, Connection connection, Envelope envelope) {
        long start = System.nanoTime();
        CompletionStage<?> stage;
        try {
            stage = handler.handle(connection, envelope);
        } catch (Exception e) {
            handlerFailed(connection, envelope, e);
            return;
        }
        if (stage == null) {
            return;
        }
        stage.whenComplete((r, t) -> {
            MetricUtil.nanoTime("realtime.dispatch.handle", System.nanoTime() - start, "type", envelope.type());
            if (t != null) {
                handlerFailed(connection, envelope, unwrap(t));
            }
        });
    }

    private void handlerFailed(Connection connection, Envelope envelope, Throwable cause) {
        log.error("Connection({}) handler for {} failed", connection.id(), envelope.type(), cause);
        MetricUtil.count("realtime.dispatch.failed", "type", envelope.type());
        String message = cause.getMessage() != null ? cause.getMessage() : "Error processing request";
        connection.send(Envelope.error(ErrorCode.HANDLER_ERROR, message, envelope.requestId()));
    }

    private static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

}
