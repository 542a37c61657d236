package com.kvmcloud.app.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kvmcloud.app.web.ApiError;
import com.kvmcloud.common.logging.LogRedact;
import com.kvmcloud.gateway.auth.BearerTokens;
import com.kvmcloud.gateway.auth.ClientAuthentication;
import com.kvmcloud.gateway.auth.ClientIdentity;
import com.kvmcloud.gateway.auth.IdentityService;
import com.kvmcloud.gateway.bridge.BridgeRequest;
import com.kvmcloud.gateway.bridge.SessionBridge;
import com.kvmcloud.gateway.error.InvalidRequestException;
import com.kvmcloud.gateway.error.SignalingException;
import com.kvmcloud.gateway.exchange.AbortSignal;
import com.kvmcloud.gateway.websocket.RemoteAddresses;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletionException;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Standalone Netty HTTP listener for {@code POST /webrtc/session}.
 * <p>
 * The session bridge holds the device lock while the caller waits, so the
 * listener has to notice when the caller goes away. Netty reports the closed
 * connection through {@code channelInactive}, which raises the exchange's
 * {@link AbortSignal} and frees the device immediately.
 * </p>
 */
@Slf4j
@Component
public class SessionBridgeServer {

    public static final String SESSION_PATH = "/webrtc/session";

    /** Request bodies carry one SDP blob; 1MB is plenty. */
    private static final int MAX_BODY_BYTES = 1048576;

    private final SessionBridge sessionBridge;
    private final IdentityService identityService;
    private final ObjectMapper mapper;

    @Value("${kvmcloud.bridge.host:0.0.0.0}")
    private String host;

    @Value("${kvmcloud.bridge.port:3001}")
    private int configuredPort;

    @Value("${kvmcloud.bridge.worker-threads:4}")
    private int workerThreads;

    @Value("${kvmcloud.signaling.real-ip-header:}")
    private String realIpHeader;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public SessionBridgeServer(SessionBridge sessionBridge, IdentityService identityService, ObjectMapper mapper) {
        this.sessionBridge = sessionBridge;
        this.identityService = identityService;
        this.mapper = mapper;
    }

    @PostConstruct
    public void start() {
        start(host, configuredPort);
    }

    public synchronized void start(String bindHost, int port) {
        if (serverChannel != null) {
            log.debug("Session bridge listener already running");
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(workerThreads);
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline().addLast(
                                    new HttpServerCodec(),
                                    new HttpObjectAggregator(MAX_BODY_BYTES),
                                    new SessionHandler());
                        }
                    });
            serverChannel = b.bind(bindHost, port).sync().channel();
            log.info("Session bridge listening on http://{}:{}{}", bindHost, port(), SESSION_PATH);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown();
            throw new IllegalStateException("Interrupted while binding session bridge to " + bindHost + ":" + port, e);
        } catch (Exception e) {
            // sync() rethrows bind failures such as BindException unchecked
            log.error("Session bridge failed to bind {}:{}: {}", bindHost, port, e.getMessage());
            shutdown();
            throw new IllegalStateException("Session bridge failed to bind " + bindHost + ":" + port, e);
        }
    }

    /**
     * Port actually bound; differs from the configured one when that is 0.
     */
    public int port() {
        Channel channel = serverChannel;
        if (channel == null) {
            throw new IllegalStateException("Session bridge listener is not running");
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    @PreDestroy
    public synchronized void stop() {
        shutdown();
        log.info("Session bridge listener stopped");
    }

    private void shutdown() {
        if (serverChannel != null) {
            serverChannel.close();
            serverChannel = null;
        }
        if (workerGroup != null)
            workerGroup.shutdownGracefully();
        if (bossGroup != null)
            bossGroup.shutdownGracefully();
    }

    // =========================================================================
    // Netty handler, one instance per connection
    // =========================================================================

    private class SessionHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

        /** Abort signal of the exchange this connection is waiting on, if any. */
        private volatile AbortSignal inFlight;

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
            boolean keepAlive = HttpUtil.isKeepAlive(request);
            String path = new QueryStringDecoder(request.uri()).path();

            if (!SESSION_PATH.equals(path)) {
                sendJson(ctx, HttpResponseStatus.NOT_FOUND,
                        new ApiError("NotFound", "not_found", "No route for " + path), keepAlive);
                return;
            }
            if (!HttpMethod.POST.equals(request.method())) {
                sendJson(ctx, HttpResponseStatus.METHOD_NOT_ALLOWED,
                        new ApiError("MethodNotAllowed", "method_not_allowed", "Use POST " + SESSION_PATH), keepAlive);
                return;
            }

            try {
                startExchange(ctx, request, keepAlive);
            } catch (SignalingException e) {
                log.warn("http:reject {} {} status={} code={}: {}", request.method(), SESSION_PATH,
                        e.getStatus().value(), e.getCode(), e.getMessage());
                sendJson(ctx, HttpResponseStatus.valueOf(e.getStatus().value()), ApiError.of(e), keepAlive);
            }
        }

        private void startExchange(ChannelHandlerContext ctx, FullHttpRequest request, boolean keepAlive) {
            String token = BearerTokens.fromAuthorizationHeader(request.headers().get(HttpHeaderNames.AUTHORIZATION));
            ClientIdentity identity = ClientAuthentication.authenticate(identityService, token);

            JsonNode body = readBody(request);
            JsonNode id = body.get("id");
            JsonNode sd = body.get("sd");
            if (id == null || !id.isTextual() || id.asText().isBlank() || sd == null || sd.isNull()) {
                throw new InvalidRequestException("Missing required fields: id and sd");
            }
            String deviceId = id.asText();
            log.debug("http:session device={} subject={} ip={}", deviceId, identity.subject(),
                    remoteAddress(ctx, request));

            AbortSignal abort = new AbortSignal();
            inFlight = abort;
            // Precondition failures throw here and are answered by channelRead0.
            sessionBridge.exchange(new BridgeRequest(identity, deviceId, sd), abort)
                    .whenComplete((answer, error) -> {
                        inFlight = null;
                        if (!ctx.channel().isActive()) {
                            return;
                        }
                        if (error == null) {
                            sendJson(ctx, HttpResponseStatus.OK, answer, keepAlive);
                            return;
                        }
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause()
                                : error;
                        if (cause instanceof SignalingException se) {
                            sendJson(ctx, HttpResponseStatus.valueOf(se.getStatus().value()), ApiError.of(se), keepAlive);
                        } else {
                            log.error("http:session-failed device={}: {}", deviceId, cause.getMessage(), cause);
                            sendJson(ctx, HttpResponseStatus.INTERNAL_SERVER_ERROR,
                                    new ApiError(cause.getClass().getSimpleName(), "internal_error", "Internal error"),
                                    keepAlive);
                        }
                    });
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            AbortSignal abort = inFlight;
            if (abort != null && abort.abort("caller disconnected")) {
                log.info("http:caller-gone remote={}", ctx.channel().remoteAddress());
            }
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.warn("http:channel-error remote={}: {}", ctx.channel().remoteAddress(), cause.getMessage());
            ctx.close();
        }

        private JsonNode readBody(FullHttpRequest request) {
            String content = request.content().toString(StandardCharsets.UTF_8);
            try {
                JsonNode body = mapper.readTree(content);
                if (body == null || !body.isObject()) {
                    throw new InvalidRequestException("Request body must be a JSON object");
                }
                return body;
            } catch (JsonProcessingException e) {
                log.debug("http:unreadable-body: {}", LogRedact.redactSensitiveText(e.getOriginalMessage()));
                throw new InvalidRequestException("Request body is not valid JSON");
            }
        }

        private String remoteAddress(ChannelHandlerContext ctx, FullHttpRequest request) {
            String headerValue = realIpHeader == null || realIpHeader.isBlank() ? null : request.headers().get(realIpHeader);
            String remoteAddr = ctx.channel().remoteAddress() instanceof InetSocketAddress inet && inet.getAddress() != null
                    ? inet.getAddress().getHostAddress()
                    : null;
            return RemoteAddresses.resolve(headerValue, remoteAddr);
        }

        private void sendJson(ChannelHandlerContext ctx, HttpResponseStatus status, Object body, boolean keepAlive) {
            try {
                byte[] bytes = mapper.writeValueAsBytes(body);
                FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
                response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
                response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
                if (keepAlive) {
                    response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
                    ctx.writeAndFlush(response);
                } else {
                    ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
                }
            } catch (JsonProcessingException e) {
                log.error("Failed to serialize response: {}", e.getMessage());
                ctx.close();
            }
        }
    }
}
