package com.ciro.jluax.standalone;

import com.ciro.jluax.LiveApplication;
import com.ciro.jluax.LuaxException;
import com.ciro.jluax.Request;
import com.ciro.jluax.Response;
import com.ciro.jluax.render.RenderException;
import com.ciro.jluax.script.ScriptException;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.resource.PathResourceManager;
import io.undertow.server.handlers.resource.ResourceHandler;
import io.undertow.util.AttachmentKey;
import io.undertow.util.Headers;
import io.undertow.util.Methods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Todas las peticiones pasan por acá:
 * <ol>
 *   <li>rutas del manifest (y su {@code route} de respaldo)</li>
 *   <li>si nadie responde, o responde 404: archivo estático de {@code public/}</li>
 *   <li>si tampoco existe: 404</li>
 * </ol>
 * Lua corre en un worker thread, nunca en el IO thread de Undertow.
 */
public class DispatchEndpoint implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(DispatchEndpoint.class);

    // El 404 que devolvió el handler, para usarlo si tampoco hay estático
    private static final AttachmentKey<Response> APP_NOT_FOUND = AttachmentKey.create(Response.class);

    private final LiveApplication app;
    private final HttpHandler staticFiles;
    private final boolean showErrors;

    public DispatchEndpoint(LiveApplication app, Path publicDir) {
        this(app, publicDir, false);
    }

    /** @param showErrors incluir el mensaje del error en el cuerpo del 500 (solo en dev) */
    public DispatchEndpoint(LiveApplication app, Path publicDir, boolean showErrors) {
        this.app = app;
        this.showErrors = showErrors;
        HttpHandler notFound = DispatchEndpoint::notFound;
        if (Files.isDirectory(publicDir)) {
            ResourceHandler resources = new ResourceHandler(new PathResourceManager(publicDir), notFound);
            resources.setCacheTime(0);
            this.staticFiles = resources;
        } else {
            log.warn("Public directory {} does not exist, static files disabled", publicDir);
            this.staticFiles = notFound;
        }
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }

        exchange.startBlocking();
        String body = new String(exchange.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

        String path = rawPath(exchange);
        String method = exchange.getRequestMethod().toString();

        Optional<Response> response;
        try {
            response = app.dispatch(new Request(method, path, body));
        } catch (ScriptException | RenderException | LuaxException e) {
            log.error("{} {} failed", method, path, e);
            String message = showErrors ? "500 Internal Server Error\n" + e.getMessage() : "500 Internal Server Error";
            send(exchange, new Response(500, Response.TEXT, message));
            return;
        }

        if (response.isPresent() && !response.get().isNotFound()) {
            send(exchange, response.get());
            return;
        }

        response.ifPresent(r -> exchange.putAttachment(APP_NOT_FOUND, r));
        boolean readOnly = exchange.getRequestMethod().equals(Methods.GET)
                || exchange.getRequestMethod().equals(Methods.HEAD);
        if (readOnly) {
            log.debug("{} {} -> static", method, path);
            staticFiles.handleRequest(exchange);
        } else {
            notFound(exchange);
        }
    }

    private static void notFound(HttpServerExchange exchange) {
        Response r = exchange.getAttachment(APP_NOT_FOUND);
        if (r == null) r = new Response(404, Response.TEXT, "404 Not Found: " + rawPath(exchange));
        send(exchange, r);
    }

    /**
     * Path tal como llegó, sin decodificar: {@code getRequestPath()} ya viene decodificado
     * y las plantillas comparan texto crudo ({@code /users/a%20b} liga {@code a%20b}).
     */
    static String rawPath(HttpServerExchange exchange) {
        String uri = exchange.getRequestURI();
        if (uri == null) return "/";
        if (exchange.isHostIncludedInRequestURI()) {
            int scheme = uri.indexOf("://");
            int slash = uri.indexOf('/', scheme < 0 ? 0 : scheme + 3);
            uri = slash < 0 ? "/" : uri.substring(slash);
        }
        return uri.isEmpty() ? "/" : uri;
    }

    static void send(HttpServerExchange exchange, Response r) {
        exchange.setStatusCode(r.status());
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, r.contentType());
        exchange.getResponseSender().send(r.body());
    }
}
