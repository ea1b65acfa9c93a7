package com.ctm.server.http;

import com.ctm.common.LatencyStats;
import com.ctm.protocol.JsonMessages;
import com.ctm.protocol.MalformedCommandException;
import com.ctm.server.query.QueryService;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routes plain HTTP requests (everything the WebSocket handshake handler lets through).
 *
 *   GET  /               → 302 /app/tasks
 *   GET  /tasks          → all runs
 *   POST /tasks          → echo of the decoded body
 *   GET  /workers        → all workers
 *   GET  /workers/{id}   → worker details + merged assignments, 404 if unknown
 *   GET  /runs/{id}      → run details + merged assignments + HITs, 404 if unknown
 *   GET  /error/{text}   → always fails with {@code text}
 *   GET  /app/{path}     → dashboard shell for client-side route {@code path}
 *
 * Any exception escaping a route becomes a 500: with a diagnostic page in debug mode,
 * with an empty body otherwise.
 */
@ChannelHandler.Sharable
public final class HttpApiHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(HttpApiHandler.class);

    private static final String JSON = "application/json; charset=UTF-8";
    private static final String HTML = "text/html; charset=UTF-8";

    private final QueryService query;
    private final boolean debug;
    private final LatencyStats latency;

    public HttpApiHandler(QueryService query, boolean debug, LatencyStats latency) {
        this.query   = query;
        this.debug   = debug;
        this.latency = latency;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        long start = System.nanoTime();
        FullHttpResponse resp;
        try {
            resp = route(req, new QueryStringDecoder(req.uri()).path());
        } catch (Exception e) {
            log.error("ERROR: 500 for {} {}", req.method(), req.uri(), e);
            resp = debug
                    ? response(HttpResponseStatus.INTERNAL_SERVER_ERROR, HTML, ErrorPage.render(e, req))
                    : empty(HttpResponseStatus.INTERNAL_SERVER_ERROR);
        }
        write(ctx, req, resp);
        latency.record(System.nanoTime() - start);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("HTTP channel error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }

    // ── Routing ───────────────────────────────────────────────────────────────

    FullHttpResponse route(FullHttpRequest req, String path) {
        HttpMethod method = req.method();
        if (method == HttpMethod.OPTIONS) return empty(HttpResponseStatus.OK);

        if (path.equals("/")) {
            if (method == HttpMethod.GET) return redirect("/app/tasks");
            return notFound("not found");
        }
        if (path.equals("/tasks")) {
            if (method == HttpMethod.GET) return json(HttpResponseStatus.OK, query.listRuns());
            if (method == HttpMethod.POST) return echoTask(req);
            return empty(HttpResponseStatus.METHOD_NOT_ALLOWED);
        }
        if (path.equals("/workers")) {
            if (method == HttpMethod.GET) return json(HttpResponseStatus.OK, query.listWorkers());
            return empty(HttpResponseStatus.METHOD_NOT_ALLOWED);
        }
        if (path.startsWith("/workers/")) {
            if (method != HttpMethod.GET) return empty(HttpResponseStatus.METHOD_NOT_ALLOWED);
            String workerId = path.substring("/workers/".length());
            return query.workerView(workerId)
                    .map(view -> json(HttpResponseStatus.OK, view))
                    .orElseGet(() -> notFound("worker not found"));
        }
        if (path.startsWith("/runs/")) {
            if (method != HttpMethod.GET) return empty(HttpResponseStatus.METHOD_NOT_ALLOWED);
            String runId = path.substring("/runs/".length());
            return query.runView(runId)
                    .map(view -> json(HttpResponseStatus.OK, view))
                    .orElseGet(() -> notFound("run not found"));
        }
        if (path.equals("/error") || path.startsWith("/error/")) {
            String text = path.length() > "/error/".length() ? path.substring("/error/".length()) : "";
            throw new IllegalStateException(text.isEmpty() ? "test error" : text);
        }
        if (path.startsWith("/app/")) {
            if (method != HttpMethod.GET) return empty(HttpResponseStatus.METHOD_NOT_ALLOWED);
            return response(HttpResponseStatus.OK, HTML, DashboardPage.render(path.substring("/app/".length())));
        }
        return notFound("not found");
    }

    private FullHttpResponse echoTask(FullHttpRequest req) {
        JsonNode body;
        try {
            body = JsonMessages.parse(req.content().toString(StandardCharsets.UTF_8));
        } catch (MalformedCommandException e) {
            return json(HttpResponseStatus.BAD_REQUEST, Map.of("error", e.getMessage()));
        }
        Map<String, Object> echo = new LinkedHashMap<>();
        echo.put("t", "testing!");
        echo.put("req", body);
        return json(HttpResponseStatus.OK, echo);
    }

    // ── Responses ─────────────────────────────────────────────────────────────

    private static FullHttpResponse json(HttpResponseStatus status, Object body) {
        return response(status, JSON, JsonMessages.toJson(body));
    }

    private static FullHttpResponse notFound(String message) {
        return json(HttpResponseStatus.NOT_FOUND, Map.of("error", message));
    }

    private static FullHttpResponse redirect(String location) {
        FullHttpResponse resp = empty(HttpResponseStatus.FOUND);
        resp.headers().set(HttpHeaderNames.LOCATION, location);
        return resp;
    }

    private static FullHttpResponse empty(HttpResponseStatus status) {
        return new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.EMPTY_BUFFER);
    }

    private static FullHttpResponse response(HttpResponseStatus status, String contentType, String body) {
        FullHttpResponse resp = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
                Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
        resp.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
        return resp;
    }

    private static void write(ChannelHandlerContext ctx, FullHttpRequest req, FullHttpResponse resp) {
        // CORS: allow any origin (dashboard may be served from a dev server)
        resp.headers()
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*")
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS, "*");
        HttpUtil.setContentLength(resp, resp.content().readableBytes());

        if (HttpUtil.isKeepAlive(req)) {
            HttpUtil.setKeepAlive(resp, true);
            ctx.writeAndFlush(resp);
        } else {
            ctx.writeAndFlush(resp).addListener(ChannelFutureListener.CLOSE);
        }
    }
}
