package com.ctm.server.http;

import com.ctm.common.LatencyStats;
import com.ctm.server.InMemoryRecordStore;
import com.ctm.server.query.QueryService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HttpApiHandlerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final LatencyStats latency = new LatencyStats("http-test");

    private record Reply(HttpResponseStatus status, String contentType, String location, String body) {
        JsonNode json() throws Exception {
            return MAPPER.readTree(body);
        }
    }

    private Reply call(boolean debug, HttpMethod method, String uri, String body) {
        EmbeddedChannel ch = new EmbeddedChannel(
                new HttpApiHandler(new QueryService(InMemoryRecordStore.sample()), debug, latency));
        FullHttpRequest req = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, uri,
                body == null ? Unpooled.EMPTY_BUFFER : Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
        ch.writeInbound(req);

        FullHttpResponse resp = ch.readOutbound();
        try {
            return new Reply(resp.status(),
                    resp.headers().get(HttpHeaderNames.CONTENT_TYPE),
                    resp.headers().get(HttpHeaderNames.LOCATION),
                    resp.content().toString(StandardCharsets.UTF_8));
        } finally {
            resp.release();
        }
    }

    private Reply get(String uri) {
        return call(true, HttpMethod.GET, uri, null);
    }

    @Test
    void tasksListsRuns() throws Exception {
        Reply r = get("/tasks");

        assertEquals(HttpResponseStatus.OK, r.status());
        assertTrue(r.contentType().startsWith("application/json"));
        JsonNode runs = r.json();
        assertEquals(1, runs.size());
        assertEquals("r1", runs.get(0).get("run_id").asText());
        assertEquals(10, runs.get(0).get("maximum").asInt());
    }

    @Test
    void workersListsWorkers() throws Exception {
        JsonNode workers = get("/workers").json();
        assertEquals("w1", workers.get(0).get("worker_id").asText());
    }

    @Test
    void workerDetailIncludesMergedAssignments() throws Exception {
        JsonNode body = get("/workers/w1").json();

        assertEquals("w1", body.get("worker_details").get("worker_id").asText());
        assertEquals(2, body.get("assignments").size());
        assertEquals("done", body.get("assignments").get(0).get("world_status").asText());
    }

    @Test
    void unknownWorkerIsNotFound() throws Exception {
        Reply r = get("/workers/unknown-id");

        assertEquals(HttpResponseStatus.NOT_FOUND, r.status());
        assertEquals("worker not found", r.json().get("error").asText());
    }

    @Test
    void runDetailCarriesStatusSentinelAndHits() throws Exception {
        JsonNode body = get("/runs/r1").json();

        assertEquals("not_computed", body.get("run_details").get("run_status").asText());
        assertEquals(2, body.get("assignments").size());
        assertEquals(1, body.get("hits").size());
        assertEquals(HttpResponseStatus.NOT_FOUND, get("/runs/nope").status());
    }

    @Test
    void errorEndpointRendersDiagnosticsInDebugMode() {
        Reply r = get("/error/boom");

        assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, r.status());
        assertTrue(r.contentType().startsWith("text/html"));
        assertTrue(r.body().contains("boom"));
        assertTrue(r.body().contains("GET /error/boom"));
    }

    @Test
    void errorEndpointHidesDiagnosticsInProduction() {
        Reply r = call(false, HttpMethod.GET, "/error/boom", null);

        assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, r.status());
        assertEquals("", r.body());
    }

    @Test
    void emptyErrorTextFallsBackToDefault() {
        assertTrue(get("/error/").body().contains("test error"));

        Reply bare = get("/error");
        assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, bare.status());
        assertTrue(bare.body().contains("test error"));
        assertEquals(HttpResponseStatus.NOT_FOUND, get("/errors").status());
    }

    @Test
    void rootRedirectsToTaskList() {
        Reply r = get("/");

        assertEquals(HttpResponseStatus.FOUND, r.status());
        assertEquals("/app/tasks", r.location());
        assertEquals(HttpResponseStatus.NOT_FOUND, call(true, HttpMethod.POST, "/", "{}").status());
    }

    @Test
    void postTasksEchoesBody() throws Exception {
        Reply r = call(true, HttpMethod.POST, "/tasks", "{\"x\":[1,2]}");

        assertEquals(HttpResponseStatus.OK, r.status());
        JsonNode body = r.json();
        assertEquals("testing!", body.get("t").asText());
        assertEquals(2, body.get("req").get("x").size());

        assertEquals(HttpResponseStatus.BAD_REQUEST, call(true, HttpMethod.POST, "/tasks", "nope").status());
    }

    @Test
    void appRendersShellForClientRoute() {
        Reply r = get("/app/runs/r1");

        assertEquals(HttpResponseStatus.OK, r.status());
        assertTrue(r.body().contains("data-initial-location=\"runs/r1\""));
        assertFalse(r.body().contains("{{initial_location}}"));
    }

    @Test
    void appEscapesRouteMarkup() {
        Reply r = get("/app/%3Cscript%3E");
        assertTrue(r.body().contains("&lt;script&gt;"));
    }

    @Test
    void unknownPathAndMethodAreRejected() {
        assertEquals(HttpResponseStatus.NOT_FOUND, get("/nowhere").status());
        assertEquals(HttpResponseStatus.METHOD_NOT_ALLOWED, call(true, HttpMethod.DELETE, "/workers", null).status());
    }

    @Test
    void everyResponseAllowsAnyOrigin() {
        EmbeddedChannel ch = new EmbeddedChannel(
                new HttpApiHandler(new QueryService(InMemoryRecordStore.sample()), true, latency));
        ch.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.OPTIONS, "/tasks"));

        FullHttpResponse resp = ch.readOutbound();
        assertEquals(HttpResponseStatus.OK, resp.status());
        assertEquals("*", resp.headers().get(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN));
        resp.release();
    }

    @Test
    void requestsAreTimed() {
        get("/tasks");
        assertEquals(1, latency.count());
    }
}
