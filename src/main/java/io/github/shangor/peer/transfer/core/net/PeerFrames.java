package io.github.shangor.peer.transfer.core.net;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.channel.ChannelHandler;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

import java.nio.charset.StandardCharsets;

/**
 * Helpers for framing peer traffic over TCP.
 *
 * <p>Every frame is a 4-byte length followed by a kind byte. A {@code HELLO} frame carries the
 * sender's peer id as UTF-8 and is the first frame on each connection; {@code DATA} frames carry
 * one encoded protocol message.
 */
public final class PeerFrames {
    public static final byte HELLO = 0;
    public static final byte DATA = 1;

    // Allow up to 64MB per frame.
    public static final int MAX_FRAME_LENGTH = 64 * 1024 * 1024;
    private static final int MAX_PEER_ID_LENGTH = 256;

    private PeerFrames() {
    }

    public static ChannelHandler newFrameDecoder() {
        return new LengthFieldBasedFrameDecoder(MAX_FRAME_LENGTH, 0, 4, 0, 4);
    }

    public static ChannelHandler newFramePrepender() {
        return new LengthFieldPrepender(4);
    }

    public static ByteBuf hello(ByteBufAllocator alloc, String peerId) {
        byte[] id = peerId.getBytes(StandardCharsets.UTF_8);
        ByteBuf buf = alloc.buffer(1 + id.length);
        buf.writeByte(HELLO);
        buf.writeBytes(id);
        return buf;
    }

    public static ByteBuf data(ByteBufAllocator alloc, byte[] payload) {
        ByteBuf buf = alloc.buffer(1 + payload.length);
        buf.writeByte(DATA);
        buf.writeBytes(payload);
        return buf;
    }

    /**
     * Reads the peer id of a {@code HELLO} frame whose kind byte was already consumed.
     *
     * @return the id, or null if it is empty or too long
     */
    public static String readPeerId(ByteBuf frame) {
        int len = frame.readableBytes();
        if (len == 0 || len > MAX_PEER_ID_LENGTH) {
            return null;
        }
        return frame.readCharSequence(len, StandardCharsets.UTF_8).toString();
    }

    public static byte[] readPayload(ByteBuf frame) {
        byte[] data = new byte[frame.readableBytes()];
        frame.readBytes(data);
        return data;
    }
}
