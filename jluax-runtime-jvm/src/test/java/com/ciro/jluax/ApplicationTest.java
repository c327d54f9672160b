package com.ciro.jluax;

import com.ciro.jluax.script.ScriptException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApplicationTest {

    static final String MANIFEST = """
            local Home = require("pages.home")

            local function Layout(attrs, children)
              return <html>
                <head><title>{$ attrs.title $}</title></head>
                <body>{$ children $}</body>
              </html>
            end

            return {
              name = "demo",
              routes = {
                { "/", function(params, req)
                    return 200, <Layout title="Home"><Home/></Layout>
                  end },
                { "/users/:id", function(params, req)
                    return 200, <p class="user">User {$ params.id $}</p>, "fragment"
                  end },
                { "/users/new", function() return 200, "never" end },
                { "/api/users/:id", function(params)
                    return 200, { id = params.id, tags = { "a", "b" } }
                  end },
                { "/echo", function(params, req) return 200, req.method .. " " .. req.body, "text" end },
                { "/missing", function() return 404 end },
                { "/nothing", function() return nil end },
                { "/boom", function() error("boom") end },
              },
              route = function(path, method, body)
                if path == "/legacy" then return 301, "moved", "text" end
                return nil
              end,
            }
            """;

    static final String HOME = """
            return function(attrs, children)
              return <main><h1>Welcome</h1></main>
            end
            """;

    @TempDir
    Path root;

    private Application app;

    static void writeProject(Path root) throws IOException {
        Files.createDirectories(root.resolve("pages"));
        Files.writeString(root.resolve("reluax.luax"), MANIFEST);
        Files.writeString(root.resolve("pages/home.luax"), HOME);
    }

    @BeforeEach
    void setUp() throws IOException {
        writeProject(root);
        app = Application.load(JluaxConfig.load(root), new CompileCache(32));
    }

    private Response get(String path) {
        return app.dispatch(Request.get(path)).orElseThrow();
    }

    @Test
    void manifestIsLoaded() {
        assertThat(app.name()).isEqualTo("demo");
        assertThat(app.manifest().routes().size()).isEqualTo(8);
        assertThat(app.manifest().fallback()).isNotNull();
    }

    @Test
    void pageWithLayoutAndComponents() {
        Response r = get("/");

        assertThat(r.status()).isEqualTo(200);
        assertThat(r.contentType()).isEqualTo(Response.HTML);
        assertThat(r.body())
                .startsWith("<!DOCTYPE html><html>")
                .contains("<title>Home</title>")
                .contains("<body><main><h1>Welcome</h1></main></body>")
                .endsWith("</html>");
    }

    @Test
    void paramsReachTheHandler() {
        Response r = get("/users/42");

        assertThat(r.body()).isEqualTo("<p class=\"user\">User 42</p>");
        assertThat(r.contentType()).isEqualTo(Response.HTML);
    }

    @Test
    void firstDeclaredRouteWins() {
        assertThat(get("/users/new").body()).isEqualTo("<p class=\"user\">User new</p>");
    }

    @Test
    void tablesAreJson() {
        Response r = get("/api/users/7");

        assertThat(r.contentType()).isEqualTo(Response.JSON);
        assertThat(r.body()).isEqualTo("{\"id\":\"7\",\"tags\":[\"a\",\"b\"]}");
    }

    @Test
    void requestIsPassedToHandler() {
        Response r = app.dispatch(new Request("POST", "/echo", "hola")).orElseThrow();

        assertThat(r.body()).isEqualTo("POST hola");
        assertThat(r.contentType()).isEqualTo(Response.TEXT);
    }

    @Test
    void statusWithoutPayload() {
        Response r = get("/missing");

        assertThat(r.isNotFound()).isTrue();
        assertThat(r.body()).isEmpty();
    }

    @Test
    void nilMeansNoResponse() {
        assertThat(app.dispatch(Request.get("/nothing"))).isEmpty();
    }

    @Test
    void fallbackHandlesUnmatchedPaths() {
        Response r = get("/legacy");

        assertThat(r.status()).isEqualTo(301);
        assertThat(r.body()).isEqualTo("moved");
        assertThat(app.dispatch(Request.get("/unknown/path"))).isEmpty();
    }

    @Test
    void handlerErrorsAreScriptErrors() {
        assertThatThrownBy(() -> app.dispatch(Request.get("/boom")))
                .isInstanceOf(ScriptException.class)
                .hasMessageContaining("boom");
    }

    @Test
    void manifestWithoutFallback() throws IOException {
        Files.writeString(root.resolve("reluax.luax"), "return { routes = { { '/', function() return 'hi' end } } }");

        Application other = Application.load(JluaxConfig.load(root), new CompileCache(4));

        assertThat(other.name()).isEqualTo("reluax");
        assertThat(other.dispatch(Request.get("/x"))).isEqualTo(Optional.empty());
        assertThat(other.dispatch(Request.get("/")).orElseThrow().body()).isEqualTo("hi");
    }

    @Test
    void malformedManifest() throws IOException {
        Files.writeString(root.resolve("reluax.luax"), "return { routes = { { '/' } } }");

        assertThatThrownBy(() -> Application.load(JluaxConfig.load(root), new CompileCache(4)))
                .isInstanceOf(ScriptException.class)
                .hasMessageContaining("route #1");
    }

    @Test
    void invalidTemplateFailsAtLoad() throws IOException {
        Files.writeString(root.resolve("reluax.luax"),
                "return { routes = { { '/:id/:id', function() return 'x' end } } }");

        assertThatThrownBy(() -> Application.load(JluaxConfig.load(root), new CompileCache(4)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate parameter");
    }
}
