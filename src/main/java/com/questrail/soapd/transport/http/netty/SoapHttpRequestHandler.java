package com.questrail.soapd.transport.http.netty;

import com.questrail.soapd.api.RequestMetadata;
import com.questrail.soapd.transport.http.HttpReply;
import com.questrail.soapd.transport.http.SoapHttpService;

import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * SoapHttpRequestHandler
 * =============================================================================
 * One instance per connection. Converts aggregated Netty requests into
 * {@link RequestMetadata} plus body bytes for {@link SoapHttpService}, and the
 * {@link HttpReply} back into a Netty response.
 *
 * <h2>Connection lifetime</h2>
 * <ul>
 *   <li>the connection is closed {@code clientTimeout} after it was
 *       accepted; every request pushes that deadline back by
 *       {@code clientRequestBonus};</li>
 *   <li>the response to request number {@code clientMaxRequests} carries
 *       {@code Connection: close} and the connection is closed after it.</li>
 * </ul>
 * The deadline is kept on the channel's I/O event loop, not on the worker, so
 * it also fires while a handler is still running: the client is disconnected,
 * the handler finishes on its worker and its answer is dropped.
 *
 * <p>The handler runs on the worker group it was added with, so requests of
 * one connection are handled one after the other.</p>
 */
final class SoapHttpRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest>
{
    private static final Logger log = LoggerFactory.getLogger(SoapHttpRequestHandler.class);

    private final SoapHttpService service;
    private final long timeoutNanos;
    private final long bonusNanos;
    private final int maxRequests;

    private long deadlineNanos;
    private volatile int served;
    private ScheduledFuture<?> expiry;

    SoapHttpRequestHandler(SoapHttpService service, Duration clientTimeout, Duration clientRequestBonus, int maxRequests)
    {
        this.service = Objects.requireNonNull(service, "service");
        this.timeoutNanos = clientTimeout.toNanos();
        this.bonusNanos = clientRequestBonus.toNanos();
        this.maxRequests = maxRequests;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception
    {
        deadlineNanos = System.nanoTime() + timeoutNanos;
        scheduleExpiry(ctx);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        cancelExpiry();
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request)
    {
        served++;
        if (bonusNanos > 0) {
            deadlineNanos += bonusNanos;
            scheduleExpiry(ctx);
        }

        FullHttpResponse response;
        if (!request.decoderResult().isSuccess()) {
            response = badRequest(request);
        } else {
            RequestMetadata meta = toMetadata(request, ctx.channel().remoteAddress());
            byte[] body = ByteBufUtil.getBytes(request.content());
            response = toResponse(request, service.handle(meta, body));
        }

        boolean close = served >= maxRequests || !HttpUtil.isKeepAlive(request);
        if (close) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        } else {
            HttpUtil.setKeepAlive(response, true);
            ctx.writeAndFlush(response);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        log.warn("closing connection from {} after error", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }

    int served()
    {
        return served;
    }

    // ---------------------------------------------------------------------

    static RequestMetadata toMetadata(FullHttpRequest request, SocketAddress remote)
    {
        RequestMetadata.Builder b = RequestMetadata.builder()
                .withMethod(request.method().name());

        String contentType = request.headers().get(HttpHeaderNames.CONTENT_TYPE);
        if (contentType != null) {
            b.withContentType(contentType);
        }

        String rawQuery = new QueryStringDecoder(request.uri()).rawQuery();
        if (!rawQuery.isEmpty()) {
            b.withQueryString(rawQuery);
        }

        if (remote instanceof InetSocketAddress inet) {
            b.withRemoteAddress(inet.getHostString());
        } else if (remote != null) {
            b.withRemoteAddress(remote.toString());
        }

        for (Map.Entry<String, String> h : request.headers()) {
            b.addHeader(h.getKey(), h.getValue());
        }
        return b.build();
    }

    static FullHttpResponse toResponse(FullHttpRequest request, HttpReply reply)
    {
        FullHttpResponse response = new DefaultFullHttpResponse(
                request.protocolVersion(),
                new HttpResponseStatus(reply.status(), reply.reasonPhrase()),
                Unpooled.wrappedBuffer(reply.body()));

        response.headers().set(HttpHeaderNames.CONTENT_TYPE, reply.contentType());
        reply.headers().forEach((name, value) -> response.headers().set(name, value));
        HttpUtil.setContentLength(response, reply.body().length);
        return response;
    }

    private static FullHttpResponse badRequest(FullHttpRequest request)
    {
        byte[] body = "[400] malformed HTTP request\n".getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(request.protocolVersion(),
                HttpResponseStatus.BAD_REQUEST, Unpooled.wrappedBuffer(body));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=utf-8");
        HttpUtil.setContentLength(response, body.length);
        return response;
    }

    private void scheduleExpiry(ChannelHandlerContext ctx)
    {
        cancelExpiry();
        long delay = Math.max(0, deadlineNanos - System.nanoTime());
        Channel ch = ctx.channel();
        expiry = ch.eventLoop().schedule(() -> {
            log.info("connection from {} expired after {} requests", ch.remoteAddress(), served);
            ch.close();
        }, delay, TimeUnit.NANOSECONDS);
    }

    private void cancelExpiry()
    {
        if (expiry != null) {
            expiry.cancel(false);
            expiry = null;
        }
    }
}
