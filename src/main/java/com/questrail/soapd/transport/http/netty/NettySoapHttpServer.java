package com.questrail.soapd.transport.http.netty;

import com.questrail.soapd.config.HttpDaemonConfig;
import com.questrail.soapd.dispatch.SoapDispatcher;
import com.questrail.soapd.transport.SoapTransport;
import com.questrail.soapd.transport.http.SoapHttpService;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * NettySoapHttpServer
 * =============================================================================
 * Netty-backed implementation of the {@link SoapTransport} port: SOAP over
 * HTTP/1.1.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. HTTP parsing is
 * Netty's {@link HttpServerCodec}; request gating and rendering live in
 * {@link SoapHttpService}. It MUST NOT inspect envelopes or pick operations.
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li>one acceptor thread and Netty's default number of I/O threads;</li>
 *   <li>{@code workerThreads} threads running the dispatcher, since operation
 *       handlers may block and must not stall the I/O loop.</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package.
 */
public final class NettySoapHttpServer implements SoapTransport
{
    private static final Logger log = LoggerFactory.getLogger(NettySoapHttpServer.class);

    private final HttpDaemonConfig config;
    private final SoapHttpService service;

    private EventLoopGroup bossGroup;
    private EventLoopGroup ioGroup;
    private EventExecutorGroup workers;
    private volatile Channel channel;

    public NettySoapHttpServer(SoapDispatcher dispatcher, HttpDaemonConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.service = new SoapHttpService(Objects.requireNonNull(dispatcher, "dispatcher"),
                config.serverName(), config.wsdlDocument());
    }

    @Override
    public synchronized void start()
    {
        if (channel != null) {
            throw new IllegalStateException("server already started");
        }

        bossGroup = new NioEventLoopGroup(1);
        ioGroup = new NioEventLoopGroup();
        workers = new DefaultEventExecutorGroup(config.workerThreads());

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, ioGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast("http", new HttpServerCodec());
                        p.addLast("aggregator", new HttpObjectAggregator(config.maxContentLength()));
                        p.addLast(workers, "soap", newRequestHandler());
                    }
                });

        ChannelFuture bound = bootstrap.bind(config.bindAddress()).awaitUninterruptibly();
        if (!bound.isSuccess()) {
            shutdownGroups();
            throw new IllegalStateException("cannot bind " + config.bindAddress(), bound.cause());
        }
        channel = bound.channel();
        log.info("{} listening on {}", config.serverName(), channel.localAddress());
    }

    @Override
    public synchronized void stop()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
            log.info("{} stopped", config.serverName());
        }
        shutdownGroups();
    }

    @Override
    public Optional<InetSocketAddress> localAddress()
    {
        Channel ch = channel;
        return ch == null ? Optional.empty() : Optional.of((InetSocketAddress) ch.localAddress());
    }

    SoapHttpRequestHandler newRequestHandler()
    {
        return new SoapHttpRequestHandler(service, config.clientTimeout(),
                config.clientRequestBonus(), config.clientMaxRequests());
    }

    private void shutdownGroups()
    {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
        if (ioGroup != null) {
            ioGroup.shutdownGracefully();
            ioGroup = null;
        }
        if (workers != null) {
            workers.shutdownGracefully();
            workers = null;
        }
    }
}
