package org.github.zzf.realtime.client;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.model.Envelope;

@Slf4j
@RequiredArgsConstructor
public class NettyTransport implements Transport {

    private static final ChannelFutureListener LOG_ON_FAILURE = future -> {
        if (!future.isSuccess()) {
            log.warn("Channel(" + future.channel() + ").writeAndFlush failed.", future.cause());
        }
    };

    private final Channel channel;

    @Override
    public void send(Envelope envelope) {
        channel.writeAndFlush(envelope).addListener(LOG_ON_FAILURE);
    }

    @Override
    public void close() {
        if (channel.isActive()) {
            channel.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
        }
        else {
            channel.close();
        }
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

}
