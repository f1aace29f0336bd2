package org.github.zzf.realtime.client;

import static com.google.common.base.Preconditions.checkNotNull;

import com.alibaba.fastjson.JSONObject;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.model.AuthenticationException;
import org.github.zzf.realtime.protocol.model.Envelope;
import org.github.zzf.realtime.protocol.model.ErrorCode;
import org.github.zzf.realtime.protocol.model.MessageType;

/**
 * Client side of one logical connection.
 * <p>
 * Keeps a transport open while the application wants one: reconnects with bounded exponential backoff,
 * queues outbound envelopes while no transport is up and flushes them FIFO, right after the handshake,
 * on the next successful connect.
 * <pre>
 * DISCONNECTED -> CONNECTING -> CONNECTED -> DISCONNECTED ...
 *                                         -> CLOSED (disconnect())
 *                                         -> FAILED (gave up after maxAttempts)
 * </pre>
 * Every state transition happens under the instance lock.
 */
@Slf4j
public class ConnectionManager implements AutoCloseable {

    public static final int DEFAULT_MAX_QUEUE_SIZE = 1000;

    public enum State {
        DISCONNECTED,
        CONNECTING,
        CONNECTED,
        CLOSED,
        FAILED,
    }

    private final Connector connector;
    private final ReconnectPolicy policy;
    private final ScheduledExecutorService scheduler;
    private final int maxQueueSize;
    private final Deque<Envelope> outbound = new ArrayDeque<>();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    private State state = State.DISCONNECTED;
    private boolean shouldConnect;
    private boolean credentialRejected;
    private int attempt;
    private long dropped;
    // bumped on every connect / disconnect; callbacks of an older transport are ignored
    private long generation;
    @Nullable
    private Transport transport;
    @Nullable
    private ScheduledFuture<?> reconnectTask;
    @Nullable
    private String credential;
    @Nullable
    private Throwable lastError;

    public ConnectionManager(Connector connector, ReconnectPolicy policy, ScheduledExecutorService scheduler) {
        this(connector, policy, scheduler, DEFAULT_MAX_QUEUE_SIZE, null);
    }

    public ConnectionManager(Connector connector,
            ReconnectPolicy policy,
            ScheduledExecutorService scheduler,
            int maxQueueSize,
            @Nullable String credential) {
        checkNotNull(connector);
        checkNotNull(policy);
        checkNotNull(scheduler);
        this.connector = connector;
        this.policy = policy;
        this.scheduler = scheduler;
        this.maxQueueSize = maxQueueSize;
        this.credential = credential;
    }

    public ConnectionManager addListener(ConnectionListener listener) {
        listeners.add(listener);
        return this;
    }

    public void removeListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    /**
     * start connecting. no-op while connecting or connected; restarts the backoff after FAILED.
     */
    public synchronized void connect() {
        if (state == State.CLOSED) {
            throw new IllegalStateException("ConnectionManager is closed");
        }
        if (state == State.CONNECTING || state == State.CONNECTED) {
            return;
        }
        if (state == State.FAILED) {
            attempt = 0;
        }
        shouldConnect = true;
        doConnect();
    }

    private void doConnect() {
        cancelReconnectTask();
        transition(State.CONNECTING);
        long gen = ++generation;
        log.debug("ConnectionManager connecting, attempt: {}", attempt);
        try {
            connector.connect(new TransportListener(gen)).whenComplete((t, cause) -> {
                if (cause != null) {
                    onConnectFailed(gen, cause);
                }
                else {
                    onConnected(gen, t);
                }
            });
        } catch (RuntimeException e) {
            onConnectFailed(gen, e);
        }
    }

    private synchronized void onConnected(long gen, Transport t) {
        if (gen != generation || !shouldConnect) {
            log.debug("ConnectionManager got a stale transport, now close it");
            t.close();
            return;
        }
        this.transport = t;
        this.attempt = 0;
        this.lastError = null;
        transition(State.CONNECTED);
        if (credential != null) {
            t.send(authenticate(credential));
        }
        int flushed = outbound.size();
        while (!outbound.isEmpty()) {
            t.send(outbound.poll());
        }
        log.info("ConnectionManager connected, flushed {} queued envelopes", flushed);
    }

    private synchronized void onConnectFailed(long gen, Throwable cause) {
        if (gen != generation) {
            return;
        }
        log.warn("ConnectionManager connect failed, attempt: {} -> {}", attempt, cause.toString());
        lastError = cause;
        transition(State.DISCONNECTED);
        scheduleReconnect();
    }

    private synchronized void onClosed(long gen, @Nullable Throwable cause) {
        if (gen != generation) {
            return;
        }
        log.info("ConnectionManager transport closed -> {}", cause == null ? "normal" : cause.toString());
        transport = null;
        // the credential rejection stays the error to report, not the close that follows it
        if (cause != null && !credentialRejected) {
            lastError = cause;
        }
        transition(State.DISCONNECTED);
        scheduleReconnect();
    }

    private void onEnvelope(long gen, Envelope envelope) {
        synchronized (this) {
            if (gen != generation) {
                return;
            }
            if (envelope.is(MessageType.ERROR)) {
                RemoteErrorException error = RemoteErrorException.from(envelope);
                if (ErrorCode.AUTHENTICATION_FAILED.code().equals(error.code())) {
                    log.warn("ConnectionManager credential rejected, reconnect paused until a new credential");
                    credentialRejected = true;
                    lastError = new AuthenticationException(envelope.dataString("message"), error);
                }
                else {
                    lastError = error;
                }
            }
        }
        for (ConnectionListener l : listeners) {
            l.onEnvelope(envelope);
        }
    }

    private void scheduleReconnect() {
        if (!shouldConnect) {
            return;
        }
        if (credentialRejected) {
            log.info("ConnectionManager will not reconnect with a rejected credential");
            return;
        }
        if (policy.exhausted(attempt)) {
            log.warn("ConnectionManager gave up after {} attempts", attempt);
            transition(State.FAILED);
            return;
        }
        long delay = policy.delay(attempt);
        attempt += 1;
        log.info("ConnectionManager reconnect in {}ms, attempt: {}", delay, attempt);
        reconnectTask = scheduler.schedule(this::reconnect, delay, TimeUnit.MILLISECONDS);
    }

    private synchronized void reconnect() {
        reconnectTask = null;
        if (shouldConnect && state == State.DISCONNECTED && !credentialRejected) {
            doConnect();
        }
    }

    /**
     * write the envelope now if connected, otherwise queue it. A full queue drops its oldest entry.
     */
    public synchronized void send(Envelope envelope) {
        checkNotNull(envelope);
        if (state == State.CLOSED) {
            throw new IllegalStateException("ConnectionManager is closed");
        }
        if (state == State.CONNECTED && transport != null) {
            transport.send(envelope);
            return;
        }
        if (outbound.size() >= maxQueueSize) {
            Envelope oldest = outbound.poll();
            dropped += 1;
            log.warn("ConnectionManager queue is full({}), drop the oldest -> {}", maxQueueSize, oldest);
        }
        outbound.offer(envelope);
    }

    /**
     * replace the credential. re-authenticates on the open transport, or reconnects now if there is none.
     */
    public synchronized void updateCredential(String credential) {
        checkNotNull(credential);
        this.credential = credential;
        this.credentialRejected = false;
        if (state == State.CONNECTED && transport != null) {
            log.info("ConnectionManager re-authenticate on the open transport");
            transport.send(authenticate(credential));
            return;
        }
        if (state == State.CLOSED || state == State.CONNECTING) {
            return;
        }
        // DISCONNECTED or FAILED
        if (shouldConnect || state == State.FAILED) {
            shouldConnect = true;
            attempt = 0;
            doConnect();
        }
    }

    /**
     * stop for good: cancel the pending reconnect and close the transport
     */
    public synchronized void disconnect() {
        if (state == State.CLOSED) {
            return;
        }
        shouldConnect = false;
        generation += 1;
        cancelReconnectTask();
        Transport t = transport;
        transport = null;
        transition(State.CLOSED);
        if (t != null) {
            t.close();
        }
        log.info("ConnectionManager disconnected, {} envelopes left in queue", outbound.size());
    }

    @Override
    public void close() {
        disconnect();
    }

    private void cancelReconnectTask() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    private void transition(State to) {
        State from = state;
        if (from == to) {
            return;
        }
        state = to;
        log.debug("ConnectionManager state {} -> {}", from, to);
        for (ConnectionListener l : listeners) {
            l.onStateChanged(from, to);
        }
    }

    private static Envelope authenticate(String credential) {
        JSONObject data = new JSONObject(true);
        data.put("token", credential);
        return Envelope.of(MessageType.AUTHENTICATE, data);
    }

    public synchronized State state() {
        return state;
    }

    public synchronized boolean isConnected() {
        return state == State.CONNECTED;
    }

    @Nullable
    public synchronized Throwable lastError() {
        return lastError;
    }

    public synchronized int attempt() {
        return attempt;
    }

    public synchronized int queued() {
        return outbound.size();
    }

    public synchronized long dropped() {
        return dropped;
    }

    private class TransportListener implements Connector.Listener {

        private final long gen;

        TransportListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onEnvelope(Envelope envelope) {
            ConnectionManager.this.onEnvelope(gen, envelope);
        }

        @Override
        public void onClosed(@Nullable Throwable cause) {
            ConnectionManager.this.onClosed(gen, cause);
        }

    }

}
