package org.github.zzf.realtime.server;

import static org.assertj.core.api.BDDAssertions.then;

import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.concurrent.ImmediateEventExecutor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.github.zzf.realtime.protocol.model.Envelope;
import org.github.zzf.realtime.protocol.server.Connection;
import org.github.zzf.realtime.protocol.server.EventHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DefaultBrokerTest {

    DefaultBroker broker;

    @BeforeEach
    public void beforeEach() {
        // a new Broker for every UT
        broker = new DefaultBroker(new DefaultConnectionRegistry(new StubAuthenticator()), ImmediateEventExecutor.INSTANCE);
    }

    private Connection accept(EmbeddedChannel ch) {
        Connection c = broker.accept(ch);
        Envelope established = ch.readOutbound();
        then(established.type()).isEqualTo("connection:established");
        then(established.dataString("clientId")).isEqualTo(c.id());
        return c;
    }

    private Connection authenticated(EmbeddedChannel ch, String userId, String... roles) {
        Connection c = accept(ch);
        then(broker.authenticate(c.id(), StubAuthenticator.token(userId, roles))).isTrue();
        drain(ch);
        return c;
    }

    private static void drain(EmbeddedChannel ch) {
        while (ch.readOutbound() != null) {
            // discard
        }
    }

    private static Envelope subscribe(String channel, String requestId) {
        return Envelope.of("channel:subscribe", Map.of("channel", channel), requestId);
    }

    @Test
    void givenNewChannel_whenAccept_thenUnauthenticatedAndSubscribedToPublic() {
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = accept(ch);
        then(c.authenticated()).isFalse();
        then(c.channels()).containsExactly(DefaultConnectionRegistry.PUBLIC_CHANNEL);
        then(broker.registry().connection(c.id())).isSameAs(c);
    }

    @Test
    void givenValidToken_whenAuthenticate_thenAuthenticatedAndSubscribedToUserChannel() {
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = accept(ch);
        boolean ok = broker.authenticate(c.id(), StubAuthenticator.token("u1", "customer"));
        then(ok).isTrue();
        Envelope ack = ch.readOutbound();
        then(ack.type()).isEqualTo("channel:subscribed");
        then(ack.dataString("channel")).isEqualTo("user:u1");
        Envelope authenticated = ch.readOutbound();
        then(authenticated.type()).isEqualTo("auth:authenticated");
        then(authenticated.dataString("userId")).isEqualTo("u1");
        then(authenticated.dataAsObject().getJSONArray("roles")).containsExactly("customer");
        then(c.authenticated()).isTrue();
        then(c.identity().userId()).isEqualTo("u1");
        then(c.channels()).containsExactlyInAnyOrder("public", "user:u1");
        then(broker.isUserConnected("u1")).isTrue();
    }

    @Test
    void givenAuthenticateMessage_whenDispatch_thenHandshakeRuns() {
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = accept(ch);
        broker.onEnvelope(c, Envelope.of("auth:authenticate", Map.of("token", StubAuthenticator.token("u1"))));
        then(c.authenticated()).isTrue();
        then(c.subscribed("user:u1")).isTrue();
    }

    @Test
    void givenInvalidToken_whenAuthenticate_thenAuthenticationFailedAndClosedAndRemoved() {
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = accept(ch);
        boolean ok = broker.authenticate(c.id(), "garbage");
        then(ok).isFalse();
        Envelope error = ch.readOutbound();
        then(error.type()).isEqualTo("error");
        then(error.errorCode()).isEqualTo("authentication_failed");
        then(ch.isActive()).isFalse();
        then(broker.registry().connection(c.id())).isNull();
        then(broker.registry().size()).isZero();
    }

    @Test
    void givenMissingToken_whenAuthenticateMessage_thenAuthenticationFailed() {
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = accept(ch);
        broker.onEnvelope(c, Envelope.of("auth:authenticate", Map.of()));
        Envelope error = ch.readOutbound();
        then(error.errorCode()).isEqualTo("authentication_failed");
        then(broker.registry().connection(c.id())).isNull();
    }

    @Test
    void givenUnauthenticated_whenSubscribe_thenExactlyOneAuthenticationRequiredAndStaysOpen() {
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = accept(ch);
        broker.onEnvelope(c, subscribe("order:1", "r1"));
        Envelope error = ch.readOutbound();
        then(error.errorCode()).isEqualTo("authentication_required");
        then(error.requestId()).isEqualTo("r1");
        then((Object) ch.readOutbound()).isNull();
        then(ch.isActive()).isTrue();
        then(c.subscribed("order:1")).isFalse();
    }

    @Test
    void givenUnauthenticated_whenApplicationType_thenAuthenticationRequiredAndHandlerNotCalled() {
        AtomicInteger calls = new AtomicInteger();
        broker.register("order:location", EventHandler.of((c, e) -> calls.incrementAndGet()));
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = accept(ch);
        broker.onEnvelope(c, Envelope.of("order:location", Map.of("orderId", "1"), "r2"));
        Envelope error = ch.readOutbound();
        then(error.errorCode()).isEqualTo("authentication_required");
        then(calls.get()).isZero();
    }

    @Test
    void givenThreeConnections_whenPublish_thenOnlySubscribersReceive() {
        EmbeddedChannel a = new EmbeddedChannel();
        EmbeddedChannel b = new EmbeddedChannel();
        EmbeddedChannel c = new EmbeddedChannel();
        Connection ca = authenticated(a, "a");
        Connection cb = authenticated(b, "b");
        authenticated(c, "c");
        broker.subscribe(ca.id(), "order:1");
        broker.subscribe(cb.id(), "order:1");
        drain(a);
        drain(b);
        int delivered = broker.publish("order:1", Envelope.of("order:status", Map.of("status", "ready")));
        then(delivered).isEqualTo(2);
        Envelope ea = a.readOutbound();
        then(ea.type()).isEqualTo("order:status");
        then(ea.channel()).isEqualTo("order:1");
        Envelope eb = b.readOutbound();
        then(eb.type()).isEqualTo("order:status");
        then((Object) c.readOutbound()).isNull();
    }

    @Test
    void givenSubscribed_whenSubscribeAgain_thenIdempotent() {
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = authenticated(ch, "u1");
        broker.onEnvelope(c, subscribe("order:1", "r1"));
        broker.onEnvelope(c, subscribe("order:1", "r2"));
        Envelope ack1 = ch.readOutbound();
        Envelope ack2 = ch.readOutbound();
        then(ack1.type()).isEqualTo("channel:subscribed");
        then(ack1.requestId()).isEqualTo("r1");
        then(ack2.type()).isEqualTo("channel:subscribed");
        then(ack2.requestId()).isEqualTo("r2");
        then(c.channels()).containsExactlyInAnyOrder("public", "user:u1", "order:1");
        then(broker.publish("order:1", Envelope.of("order:status", null))).isEqualTo(1);
        then(((Envelope) ch.readOutbound()).type()).isEqualTo("order:status");
        then((Object) ch.readOutbound()).isNull();
    }

    @Test
    void givenSubscribed_whenUnsubscribe_thenNoLongerReceives() {
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = authenticated(ch, "u1");
        broker.subscribe(c.id(), "order:1");
        broker.onEnvelope(c, Envelope.of("channel:unsubscribe", Map.of("channel", "order:1")));
        then(broker.unsubscribe(c.id(), "order:1")).isFalse();
        drain(ch);
        then(broker.publish("order:1", Envelope.of("order:status", null))).isZero();
        then((Object) ch.readOutbound()).isNull();
    }

    @Test
    void givenOtherUsersChannel_whenSubscribe_thenForbidden() {
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = authenticated(ch, "u1");
        broker.onEnvelope(c, subscribe("user:u2", "r1"));
        Envelope error = ch.readOutbound();
        then(error.errorCode()).isEqualTo("forbidden");
        then(error.requestId()).isEqualTo("r1");
        then(c.subscribed("user:u2")).isFalse();
    }

    @Test
    void givenEmptyChannel_whenSubscribe_thenInvalidRequest() {
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = authenticated(ch, "u1");
        broker.onEnvelope(c, subscribe("", "r1"));
        Envelope error = ch.readOutbound();
        then(error.errorCode()).isEqualTo("invalid_request");
    }

    @Test
    void givenUnknownType_whenDispatch_thenUnknownEventWithRequestId() {
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = authenticated(ch, "u1");
        broker.onEnvelope(c, Envelope.of("foo:bar", null, "r9"));
        Envelope error = ch.readOutbound();
        then(error.errorCode()).isEqualTo("unknown_event");
        then(error.requestId()).isEqualTo("r9");
        then(ch.isActive()).isTrue();
    }

    @Test
    void givenHandlerThrows_whenDispatch_thenHandlerErrorAndOthersUnaffected() {
        broker.register("order:cancel", (c, e) -> {
            throw new IllegalArgumentException("order not found");
        });
        EmbeddedChannel ch = new EmbeddedChannel();
        EmbeddedChannel other = new EmbeddedChannel();
        Connection c = authenticated(ch, "u1");
        authenticated(other, "u2");
        broker.onEnvelope(c, Envelope.of("order:cancel", Map.of("orderId", "1"), "r3"));
        Envelope error = ch.readOutbound();
        then(error.errorCode()).isEqualTo("handler_error");
        then(error.dataString("message")).isEqualTo("order not found");
        then(error.requestId()).isEqualTo("r3");
        then((Object) other.readOutbound()).isNull();
        then(ch.isActive()).isTrue();
        then(other.isActive()).isTrue();
    }

    @Test
    void givenHandlerFutureFails_whenDispatch_thenHandlerError() {
        broker.register("order:rate", (c, e) -> CompletableFuture.failedFuture(new IllegalStateException("rating closed")));
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = authenticated(ch, "u1");
        broker.onEnvelope(c, Envelope.of("order:rate", null, "r4"));
        Envelope error = ch.readOutbound();
        then(error.errorCode()).isEqualTo("handler_error");
        then(error.dataString("message")).isEqualTo("rating closed");
        then(error.requestId()).isEqualTo("r4");
    }

    @Test
    void givenUnregisteredHandler_whenDispatch_thenUnknownEvent() {
        broker.register("order:rate", EventHandler.of((c, e) -> {
        }));
        broker.unregister("order:rate");
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = authenticated(ch, "u1");
        broker.onEnvelope(c, Envelope.of("order:rate", null));
        then(((Envelope) ch.readOutbound()).errorCode()).isEqualTo("unknown_event");
    }

    @Test
    void givenPing_whenDispatch_thenPongWithRequestId() {
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = authenticated(ch, "u1");
        broker.onEnvelope(c, Envelope.of("ping", null, "p1"));
        Envelope pong = ch.readOutbound();
        then(pong.type()).isEqualTo("pong");
        then(pong.requestId()).isEqualTo("p1");
    }

    @Test
    void givenAuthenticated_whenReAuthenticate_thenSubscriptionsKept() {
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = authenticated(ch, "u1");
        broker.subscribe(c.id(), "order:1");
        drain(ch);
        then(broker.authenticate(c.id(), StubAuthenticator.token("u1", "customer"))).isTrue();
        then(c.channels()).containsExactlyInAnyOrder("public", "user:u1", "order:1");
        then(c.identity().roles()).containsExactly("customer");
        then(ch.isActive()).isTrue();
    }

    @Test
    void givenAuthenticated_whenReAuthenticateAsAnotherUser_thenFormerUserChannelDropped() {
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = authenticated(ch, "u1");
        broker.subscribe(c.id(), "order:1");
        drain(ch);
        then(broker.authenticate(c.id(), StubAuthenticator.token("u2"))).isTrue();
        Envelope unsubscribed = ch.readOutbound();
        then(unsubscribed.type()).isEqualTo("channel:unsubscribed");
        then(unsubscribed.dataString("channel")).isEqualTo("user:u1");
        drain(ch);
        then(c.identity().userId()).isEqualTo("u2");
        then(c.channels()).containsExactlyInAnyOrder("public", "user:u2", "order:1");
        then(broker.publish("user:u1", Envelope.of("notification", null))).isZero();
        then((Object) ch.readOutbound()).isNull();
        then(broker.isUserConnected("u1")).isFalse();
        then(broker.publish("user:u2", Envelope.of("notification", null))).isEqualTo(1);
    }

    @Test
    void givenSubscribeRequest_whenAcked_thenRequestIdEchoedAndListenerCalled() {
        List<String> subscribed = new ArrayList<>();
        broker.addSubscriptionListener((conn, channel) -> subscribed.add(conn.id() + "@" + channel));
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = authenticated(ch, "u1");
        broker.onEnvelope(c, Envelope.of("channel:unsubscribe", Map.of("channel", "public"), "u-1"));
        then(((Envelope) ch.readOutbound()).requestId()).isEqualTo("u-1");
        broker.onEnvelope(c, subscribe("order:9", "s-1"));
        Envelope ack = ch.readOutbound();
        then(ack.type()).isEqualTo("channel:subscribed");
        then(ack.requestId()).isEqualTo("s-1");
        then(subscribed).containsExactly(c.id() + "@user:u1", c.id() + "@order:9");
    }

    @Test
    void givenFailingListener_whenSubscribe_thenStillSubscribed() {
        broker.addSubscriptionListener((conn, channel) -> {
            throw new IllegalStateException("boom");
        });
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = authenticated(ch, "u1");
        then(broker.subscribe(c.id(), "order:1")).isTrue();
        then(c.subscribed("order:1")).isTrue();
    }

    @Test
    void givenRoles_whenBroadcastWithPredicate_thenOnlyMatchingReceive() {
        EmbeddedChannel partner = new EmbeddedChannel();
        EmbeddedChannel customer = new EmbeddedChannel();
        authenticated(partner, "p1", "delivery_partner");
        authenticated(customer, "c1", "customer");
        int delivered = broker.broadcast(Envelope.of("system:maintenance", null),
                c -> c.identity() != null && c.identity().hasRole("delivery_partner"));
        then(delivered).isEqualTo(1);
        then(((Envelope) partner.readOutbound()).type()).isEqualTo("system:maintenance");
        then((Object) customer.readOutbound()).isNull();
        then(broker.broadcast(Envelope.of("system:maintenance", null))).isEqualTo(2);
    }

    @Test
    void givenUnknownConnection_whenSend_thenFutureFails() {
        CompletableFuture<Void> f = broker.send("nope", Envelope.of("x", null));
        then(f).isCompletedExceptionally();
    }

    @Test
    void givenConnection_whenSend_thenDelivered() {
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = authenticated(ch, "u1");
        CompletableFuture<Void> f = broker.send(c.id(), Envelope.of("direct", null));
        then(f).isCompleted();
        then(((Envelope) ch.readOutbound()).type()).isEqualTo("direct");
    }

    @Test
    void givenDeadTransport_whenPublish_thenNoExceptionAndLeftForHeartbeat() {
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = authenticated(ch, "u1");
        broker.subscribe(c.id(), "order:1");
        // the transport dies without the handler noticing
        ch.close();
        then(broker.publish("order:1", Envelope.of("order:status", null))).isEqualTo(1);
        then(broker.registry().connection(c.id())).isNotNull();
    }

    @Test
    void givenConnections_whenClose_thenAllRemoved() {
        EmbeddedChannel a = new EmbeddedChannel();
        EmbeddedChannel b = new EmbeddedChannel();
        authenticated(a, "a");
        authenticated(b, "b");
        broker.close();
        then(broker.registry().size()).isZero();
        then(a.isActive()).isFalse();
        then(b.isActive()).isFalse();
        then(broker.isUserConnected("a")).isFalse();
    }

    @Test
    void givenHandshakeTimeout_whenNotAuthenticatedInTime_thenClosedAndRemoved() throws InterruptedException {
        DefaultBroker timed = new DefaultBroker(new DefaultConnectionRegistry(new StubAuthenticator()),
                ImmediateEventExecutor.INSTANCE, 1);
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = timed.accept(ch);
        ch.readOutbound();
        Thread.sleep(20);
        ch.runScheduledPendingTasks();
        Envelope error = ch.readOutbound();
        then(error.errorCode()).isEqualTo("authentication_required");
        then(ch.isActive()).isFalse();
        then(timed.registry().connection(c.id())).isNull();
    }

    @Test
    void givenHandshakeTimeout_whenAuthenticatedInTime_thenTimerCancelled() throws InterruptedException {
        DefaultBroker timed = new DefaultBroker(new DefaultConnectionRegistry(new StubAuthenticator()),
                ImmediateEventExecutor.INSTANCE, 50);
        EmbeddedChannel ch = new EmbeddedChannel();
        Connection c = timed.accept(ch);
        then(timed.authenticate(c.id(), StubAuthenticator.token("u1"))).isTrue();
        drain(ch);
        Thread.sleep(80);
        ch.runScheduledPendingTasks();
        then(ch.<Object>readOutbound()).isNull();
        then(ch.isActive()).isTrue();
        then(c.authenticated()).isTrue();
    }

}
