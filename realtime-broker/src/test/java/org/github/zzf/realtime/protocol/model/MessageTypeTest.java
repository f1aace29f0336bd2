package org.github.zzf.realtime.protocol.model;

import static org.assertj.core.api.BDDAssertions.then;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class MessageTypeTest {

    @ParameterizedTest
    @CsvSource({
            "auth:authenticate, false",
            "auth:refresh, false",
            "channel:subscribe, true",
            "ping, true",
            "order:location, true",
            "author:x, true",
    })
    void givenType_whenRequiresAuthentication_thenOnlyHandshakeTypesExempt(String type, boolean required) {
        then(MessageType.requiresAuthentication(type)).isEqualTo(required);
    }

    @Test
    void givenWireType_whenInbound_thenOnlyClientControlTypesFound() {
        then(MessageType.inbound("channel:subscribe")).isEqualTo(MessageType.SUBSCRIBE);
        then(MessageType.inbound("auth:authenticate")).isEqualTo(MessageType.AUTHENTICATE);
        then(MessageType.inbound("auth:authenticated")).isNull();
        then(MessageType.inbound("order:location")).isNull();
    }

    @Test
    void givenError_whenCreate_thenCarriesCodeAndRequestId() {
        Envelope e = Envelope.error(ErrorCode.HANDLER_ERROR, "boom", "r1");
        then(e.is(MessageType.ERROR)).isTrue();
        then(e.errorCode()).isEqualTo("handler_error");
        then(e.dataString("message")).isEqualTo("boom");
        then(e.requestId()).isEqualTo("r1");
        then(ErrorCode.of("handler_error")).isEqualTo(ErrorCode.HANDLER_ERROR);
    }

}
