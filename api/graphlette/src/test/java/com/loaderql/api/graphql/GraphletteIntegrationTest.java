package com.loaderql.api.graphql;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static com.loaderql.api.graphql.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class GraphletteIntegrationTest {
    private static Server server;
    private static final int PORT = 4580;
    private static final String API_PATH = "/test/graphql";
    private static final Gson gson = new Gson();
    private static final AtomicInteger batches = new AtomicInteger();
    private static HttpClient httpClient;
    private static String BASE_URL;

    @BeforeAll
    static void setUp() throws Exception {
        BASE_URL = "http://localhost:" + PORT + API_PATH;
        httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.ALWAYS).build();

        Graphlette graphlette = dogGraphlette()
                .loader("Dog", "owner", (queries, context) -> {
                    batches.incrementAndGet();
                    String kennel = context.getRequest().getHeader("X-Kennel");
                    context.getResponse().setHeader("X-Owner-Batch-Size", String.valueOf(queries.size()));
                    return CompletableFuture.completedFuture(queries.stream()
                            .map(q -> {
                                String dog = ((Map<?, ?>) q.source()).get("name").toString();
                                return Map.of("name", OWNERS.get(dog).get("name") + (kennel == null ? "" : "@" + kennel));
                            })
                            .toList());
                })
                .build();

        server = new Server(PORT);
        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.SESSIONS);
        context.setContextPath("/");
        server.setHandler(context);

        context.addServlet(new ServletHolder(graphlette), API_PATH);

        server.start();
    }

    @AfterAll
    static void tearDown() throws Exception {
        if (server != null) {
            server.stop();
        }
    }

    private static HttpResponse<String> post(String body, String kennel) throws IOException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(BASE_URL))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (kennel != null) {
            request.header("X-Kennel", kennel);
        }
        return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void loadersBatchOverHttp() throws IOException, InterruptedException {
        int before = batches.get();

        HttpResponse<String> response = post(gson.toJson(Map.of("query", QUERY)), null);

        assertEquals(200, response.statusCode());
        assertEquals(List.of("Jennifer", "Sarah", "Tracy", "Jennifer"), ownerNames(response.body()));
        assertEquals(1, batches.get() - before);
        assertEquals("3", response.headers().firstValue("X-Owner-Batch-Size").orElseThrow());
    }

    @Test
    void batchFunctionSeesTheHttpExchange() throws IOException, InterruptedException {
        HttpResponse<String> response = post(gson.toJson(Map.of("query", QUERY)), "north");

        assertEquals(200, response.statusCode());
        assertEquals(
                List.of("Jennifer@north", "Sarah@north", "Tracy@north", "Jennifer@north"),
                ownerNames(response.body())
        );
    }

    @Test
    void invalidQueryIsReportedInErrors() throws IOException, InterruptedException {
        HttpResponse<String> response = post("{\"query\": \"{ cats { name } }\"}", null);

        assertEquals(200, response.statusCode());

        JsonObject jsonResponse = JsonParser.parseString(response.body()).getAsJsonObject();
        assertNotNull(jsonResponse.get("errors"));
    }

    @Test
    void malformedBodyIsABadRequest() throws IOException, InterruptedException {
        HttpResponse<String> response = post("{not json", null);

        assertEquals(400, response.statusCode());
    }

    @Test
    void missingQueryIsABadRequest() throws IOException, InterruptedException {
        HttpResponse<String> response = post("{\"variables\": {}}", null);

        assertEquals(400, response.statusCode());
        assertEquals("Missing query", JsonParser.parseString(response.body()).getAsJsonObject().get("error").getAsString());
    }
}
