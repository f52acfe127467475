package promptgrid.coordinator.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server for the read-only status API.
 */
public final class GridHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GridHttpServer.class);

    private final String host;
    private final int port;
    private final RouterHandler router;

    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private volatile boolean running = false;

    public GridHttpServer(String host, int port, RouterHandler router) {
        this.host = host;
        this.port = port;
        this.router = router;
    }

    public synchronized void start() throws InterruptedException {
        if (running)
            return;

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(1024 * 1024));
                            p.addLast(router);
                        }
                    });

            serverChannel = b.bind(host, port).sync().channel();
            running = true;
            log.info("HTTP server listening on {}:{}", host, boundPort());
        } catch (InterruptedException | RuntimeException e) {
            shutdownGroups();
            throw e;
        }
    }

    /** Actual port, useful when started on port 0 */
    public int boundPort() {
        if (serverChannel == null)
            return port;
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    /**
     * Block until the server channel closes.
     */
    public void awaitTermination() throws InterruptedException {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.closeFuture().sync();
        }
    }

    public synchronized void stop() {
        if (!running)
            return;
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            shutdownGroups();
            running = false;
            log.info("HTTP server stopped");
        }
    }

    private void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        stop();
    }
}
