package io.github.shangor.peer.transfer.core.net;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link PeerTransport} over TCP. Each connection starts with a hello exchange that tells both
 * ends the other's peer id; only then is the peer reported as connected.
 */
public class NettyPeerTransport implements PeerTransport {
    private static final Logger log = LoggerFactory.getLogger(NettyPeerTransport.class);

    private static final AttributeKey<String> PEER_ID = AttributeKey.valueOf("peerId");
    private static final AttributeKey<CompletableFuture<String>> HANDSHAKE = AttributeKey.valueOf("handshake");
    private static final AttributeKey<ChannelFuture> LAST_WRITE = AttributeKey.valueOf("lastWrite");
    private static final WriteBufferWaterMark WATER_MARK = new WriteBufferWaterMark(1024 * 1024, 8 * 1024 * 1024);

    private final String localPeerId;
    private final MultiThreadIoEventLoopGroup bossGroup = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
    private final MultiThreadIoEventLoopGroup workerGroup = new MultiThreadIoEventLoopGroup(NioIoHandler.newFactory());
    private final Map<String, Channel> peers = new ConcurrentHashMap<>();
    private volatile PeerTransportListener listener;
    private Channel serverChannel;

    public NettyPeerTransport(String localPeerId) {
        this.localPeerId = Objects.requireNonNull(localPeerId, "localPeerId");
    }

    @Override
    public String localPeerId() {
        return localPeerId;
    }

    @Override
    public void setListener(PeerTransportListener listener) {
        this.listener = listener;
    }

    /**
     * Accepts incoming peers on {@code port} (0 picks a free port).
     *
     * @return the bound port
     */
    public synchronized int listen(int port) throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Already listening on " + serverChannel.localAddress());
        }
        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.WRITE_BUFFER_WATER_MARK, WATER_MARK)
                .childHandler(new PeerChannelInitializer());
        serverChannel = b.bind(port).sync().channel();
        int bound = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("Peer {} listening on port {}", localPeerId, bound);
        return bound;
    }

    /**
     * Connects to a listening peer.
     *
     * @return completes with the remote peer id once the hello exchange is done
     */
    public CompletableFuture<String> connect(String host, int port) {
        CompletableFuture<String> handshake = new CompletableFuture<>();
        Bootstrap b = new Bootstrap();
        b.group(workerGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.WRITE_BUFFER_WATER_MARK, WATER_MARK)
                .attr(HANDSHAKE, handshake)
                .handler(new PeerChannelInitializer());
        log.info("Connecting to {}:{}", host, port);
        ChannelFuture f = b.connect(new InetSocketAddress(host, port));
        f.addListener(future -> {
            if (!future.isSuccess()) {
                handshake.completeExceptionally(new IOException("Failed to connect to " + host + ":" + port,
                        future.cause()));
            }
        });
        return handshake;
    }

    @Override
    public boolean send(String peerId, byte[] frame) {
        Channel ch = peers.get(peerId);
        if (ch == null || !ch.isActive()) {
            return false;
        }
        ChannelFuture write = ch.writeAndFlush(PeerFrames.data(ch.alloc(), frame));
        ch.attr(LAST_WRITE).set(write);
        write.addListener(future -> {
            if (!future.isSuccess()) {
                log.warn("Failed to write frame to peer {}", peerId, future.cause());
            }
        });
        return true;
    }

    /**
     * Completes once every frame sent to the peer so far has been written to the socket.
     */
    public CompletableFuture<Void> drain(String peerId) {
        CompletableFuture<Void> drained = new CompletableFuture<>();
        Channel ch = peers.get(peerId);
        ChannelFuture last = ch == null ? null : ch.attr(LAST_WRITE).get();
        if (last == null) {
            drained.complete(null);
            return drained;
        }
        last.addListener(future -> {
            if (future.isSuccess()) {
                drained.complete(null);
            } else {
                drained.completeExceptionally(future.cause());
            }
        });
        return drained;
    }

    @Override
    public boolean isWritable(String peerId) {
        Channel ch = peers.get(peerId);
        return ch != null && ch.isWritable();
    }

    @Override
    public boolean isConnected(String peerId) {
        Channel ch = peers.get(peerId);
        return ch != null && ch.isActive();
    }

    @Override
    public Set<String> connectedPeers() {
        return Collections.unmodifiableSet(new HashSet<>(peers.keySet()));
    }

    @Override
    public void disconnect(String peerId) {
        Channel ch = peers.get(peerId);
        if (ch != null) {
            log.info("Disconnecting peer {}", peerId);
            ch.close();
        }
    }

    @Override
    public void close() {
        peers.values().forEach(Channel::close);
        synchronized (this) {
            if (serverChannel != null) {
                serverChannel.close();
            }
        }
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
    }

    private class PeerChannelInitializer extends ChannelInitializer<SocketChannel> {
        @Override
        protected void initChannel(SocketChannel ch) {
            ch.pipeline()
                    .addLast(PeerFrames.newFrameDecoder())
                    .addLast(PeerFrames.newFramePrepender())
                    .addLast(new InboundHandler());
        }
    }

    private class InboundHandler extends SimpleChannelInboundHandler<ByteBuf> {
        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception {
            ctx.writeAndFlush(PeerFrames.hello(ctx.alloc(), localPeerId));
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
            if (!msg.isReadable()) {
                log.warn("Dropping empty frame from {}", ctx.channel().remoteAddress());
                return;
            }
            byte kind = msg.readByte();
            Channel channel = ctx.channel();
            String peerId = channel.attr(PEER_ID).get();
            switch (kind) {
                case PeerFrames.HELLO -> onHello(ctx, msg, peerId);
                case PeerFrames.DATA -> {
                    if (peerId == null) {
                        log.warn("Dropping data frame before hello from {}", channel.remoteAddress());
                        return;
                    }
                    PeerTransportListener l = listener;
                    if (l != null) {
                        l.onMessage(peerId, PeerFrames.readPayload(msg));
                    }
                }
                default -> log.warn("Dropping frame of unknown kind {} from {}", kind, channel.remoteAddress());
            }
        }

        private void onHello(ChannelHandlerContext ctx, ByteBuf msg, String knownId) {
            Channel channel = ctx.channel();
            if (knownId != null) {
                log.warn("Ignoring repeated hello from peer {}", knownId);
                return;
            }
            String peerId = PeerFrames.readPeerId(msg);
            if (peerId == null || peerId.equals(localPeerId)) {
                log.warn("Rejecting connection from {} with invalid peer id", channel.remoteAddress());
                channel.close();
                return;
            }
            Channel previous = peers.putIfAbsent(peerId, channel);
            if (previous != null && previous.isActive()) {
                log.warn("Peer {} is already connected, closing duplicate connection from {}", peerId,
                        channel.remoteAddress());
                channel.close();
                return;
            }
            if (previous != null) {
                peers.put(peerId, channel);
            }
            channel.attr(PEER_ID).set(peerId);
            log.info("Peer {} connected from {}", peerId, channel.remoteAddress());
            PeerTransportListener l = listener;
            if (l != null) {
                l.onPeerConnected(peerId);
            }
            CompletableFuture<String> handshake = channel.attr(HANDSHAKE).get();
            if (handshake != null) {
                handshake.complete(peerId);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            Channel channel = ctx.channel();
            String peerId = channel.attr(PEER_ID).get();
            CompletableFuture<String> handshake = channel.attr(HANDSHAKE).get();
            if (handshake != null) {
                handshake.completeExceptionally(new ClosedChannelException());
            }
            if (peerId != null && peers.remove(peerId, channel)) {
                log.info("Peer {} disconnected", peerId);
                PeerTransportListener l = listener;
                if (l != null) {
                    l.onPeerDisconnected(peerId);
                }
            }
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.warn("Connection error with {}", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }
}
