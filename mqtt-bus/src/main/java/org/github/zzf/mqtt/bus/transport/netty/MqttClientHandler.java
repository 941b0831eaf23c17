package org.github.zzf.mqtt.bus.transport.netty;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.mqtt.MqttConnAckMessage;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttMessageIdVariableHeader;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttPublishMessage;
import io.netty.handler.codec.mqtt.MqttSubAckMessage;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.ReferenceCountUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqtt.bus.transport.TransportException;

@Slf4j
@RequiredArgsConstructor
public class MqttClientHandler extends ChannelInboundHandlerAdapter {

    public static final String HANDLER_NAME = MqttClientHandler.class.getSimpleName();

    private final NettyConnection connection;

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (!(msg instanceof MqttMessage)) {
            super.channelRead(ctx, msg);
            return;
        }
        MqttMessage m = (MqttMessage) msg;
        try {
            if (m.decoderResult().isFailure()) {
                throw new TransportException("illegal packet from the broker", m.decoderResult().cause());
            }
            MqttMessageType type = m.fixedHeader().messageType();
            switch (type) {
                case CONNACK:
                    MqttConnAckMessage connAck = (MqttConnAckMessage) m;
                    if (connAck.variableHeader().connectReturnCode().byteValue() == 0) {
                        addKeepAliveIdleStateHandler(ctx);
                    }
                    connection.connAck(ctx.channel(), connAck);
                    break;
                case PUBLISH:
                    connection.publishReceived(ctx.channel(), (MqttPublishMessage) m);
                    break;
                case PUBACK:
                case PUBCOMP:
                case UNSUBACK:
                    connection.ackPackets(packetIdentifier(m), type);
                    break;
                case PUBREC:
                    connection.pubRec(ctx.channel(), packetIdentifier(m));
                    break;
                case PUBREL:
                    connection.pubRel(ctx.channel(), packetIdentifier(m));
                    break;
                case SUBACK:
                    MqttSubAckMessage subAck = (MqttSubAckMessage) m;
                    connection.ackPackets(subAck.variableHeader().messageId(), subAck.payload().grantedQoSLevels());
                    break;
                case PINGRESP:
                    log.debug("Client({}) receive PingResp", connection.clientIdentifier());
                    break;
                default:
                    throw new TransportException("unexpected packet from the broker: " + type);
            }
        } finally {
            ReferenceCountUtil.release(m);
        }
    }

    private static int packetIdentifier(MqttMessage m) {
        return ((MqttMessageIdVariableHeader) m.variableHeader()).messageId();
    }

    private void addKeepAliveIdleStateHandler(ChannelHandlerContext ctx) {
        int keepAlive = connection.keepAlive();
        if (keepAlive <= 0) {
            return;
        }
        // no packet from the broker in 1.5 times the Keep Alive means the connection is broken
        IdleStateHandler idle = new IdleStateHandler(keepAlive * 3 / 2, keepAlive, 0);
        ctx.pipeline().addBefore(HANDLER_NAME, "keepAliveIdleStateHandler", idle);
        log.debug("keepAliveIdleStateHandler added: {}", keepAlive);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.debug("Client({}) channelInactive", connection.clientIdentifier());
        connection.channelInactive(ctx.channel());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Client({}) exceptionCaught, now close the Channel", connection.clientIdentifier(), cause);
        connection.exceptionCaught(ctx.channel(), cause);
        ctx.close();
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            if (e.state() == IdleState.READER_IDLE) {
                log.warn("Client({}) no packet from the broker, now close the Channel", connection.clientIdentifier());
                ctx.close();
            }
            else if (e.state() == IdleState.WRITER_IDLE) {
                log.debug("Client({}) send PingReq", connection.clientIdentifier());
                ctx.writeAndFlush(NettyConnection.headerOnlyMessage(MqttMessageType.PINGREQ))
                    .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
            }
        }
        super.userEventTriggered(ctx, evt);
    }

}
