package com.ciro.jluax.standalone;

import com.ciro.jluax.JluaxConfig;
import com.ciro.jluax.LiveApplication;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class JluaxServerTest {

    static final String MANIFEST = """
            return {
              name = "server-test",
              routes = {
                { "/", function() return <h1>Home</h1> end },
                { "/users/:id", function(params) return 200, { id = params.id } end },
                { "/echo", function(params, req) return 201, req.method .. ":" .. req.body, "text" end },
                { "/gone", function() return 404, "custom not found", "text" end },
                { "/boom", function() error("kaput") end },
                { "/tags/:name", function(params) return 200, "name=" .. params.name, "text" end },
                { "/caf%C3%A9", function() return 200, "cafe", "text" end },
              },
            }
            """;

    @TempDir
    Path root;

    private JluaxServer server;
    private final HttpClient http = HttpClient.newHttpClient();

    @BeforeEach
    void start() throws IOException {
        Files.writeString(root.resolve("reluax.luax"), MANIFEST);
        Files.createDirectories(root.resolve("public"));
        Files.writeString(root.resolve("public/app.css"), "body{}");

        JluaxConfig config = JluaxConfig.load(root);
        config.setPort(0);
        server = new JluaxServer(new LiveApplication(config));
        server.start();
    }

    @AfterEach
    void stop() {
        server.stop();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return send(HttpRequest.newBuilder(uri(path)).GET().build());
    }

    private HttpResponse<String> send(HttpRequest request) throws Exception {
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.port() + path);
    }

    @Test
    void servesPages() throws Exception {
        HttpResponse<String> r = get("/");

        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(r.headers().firstValue("Content-Type")).hasValue("text/html; charset=utf-8");
        assertThat(r.body()).isEqualTo("<!DOCTYPE html><h1>Home</h1>");
    }

    @Test
    void servesJson() throws Exception {
        HttpResponse<String> r = get("/users/42");

        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(r.headers().firstValue("Content-Type")).hasValue("application/json");
        assertThat(r.body()).isEqualTo("{\"id\":\"42\"}");
    }

    @Test
    void passesMethodAndBody() throws Exception {
        HttpResponse<String> r = send(HttpRequest.newBuilder(uri("/echo"))
                .POST(HttpRequest.BodyPublishers.ofString("hola"))
                .build());

        assertThat(r.statusCode()).isEqualTo(201);
        assertThat(r.body()).isEqualTo("POST:hola");
    }

    @Test
    void fallsBackToStaticFiles() throws Exception {
        HttpResponse<String> r = get("/app.css");

        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(r.body()).isEqualTo("body{}");
    }

    @Test
    void unknownPathIs404() throws Exception {
        HttpResponse<String> r = get("/nope");

        assertThat(r.statusCode()).isEqualTo(404);
        assertThat(r.body()).isEqualTo("404 Not Found: /nope");
    }

    @Test
    void handler404KeepsItsBodyWhenNoStaticFile() throws Exception {
        HttpResponse<String> r = get("/gone");

        assertThat(r.statusCode()).isEqualTo(404);
        assertThat(r.body()).isEqualTo("custom not found");
    }

    @Test
    void scriptErrorsAre500WithoutDetails() throws Exception {
        HttpResponse<String> r = get("/boom");

        assertThat(r.statusCode()).isEqualTo(500);
        assertThat(r.body()).isEqualTo("500 Internal Server Error").doesNotContain("kaput");
    }

    @Test
    void devModeShowsScriptErrors() throws Exception {
        JluaxConfig config = JluaxConfig.load(root);
        config.setPort(0);
        JluaxServer dev = new JluaxServer(new LiveApplication(config), true);
        dev.start();
        try {
            URI boom = URI.create("http://127.0.0.1:" + dev.port() + "/boom");
            HttpResponse<String> r = send(HttpRequest.newBuilder(boom).GET().build());

            assertThat(r.statusCode()).isEqualTo(500);
            assertThat(r.body()).startsWith("500 Internal Server Error\n").contains("kaput");
        } finally {
            dev.stop();
        }
    }

    @Test
    void namedSegmentsBindTheRawPathText() throws Exception {
        HttpResponse<String> r = get("/tags/a%20b");

        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(r.body()).isEqualTo("name=a%20b");
    }

    @Test
    void literalSegmentsCompareUndecoded() throws Exception {
        HttpResponse<String> r = get("/caf%C3%A9");

        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(r.body()).isEqualTo("cafe");
    }

    @Test
    void postToUnknownPathSkipsStaticFiles() throws Exception {
        HttpResponse<String> r = send(HttpRequest.newBuilder(uri("/app.css"))
                .POST(HttpRequest.BodyPublishers.noBody())
                .build());

        assertThat(r.statusCode()).isEqualTo(404);
    }
}
