package com.ciro.jluax;

import com.ciro.jluax.render.HtmlRenderer;
import com.ciro.jluax.render.JsonRenderer;
import com.ciro.jluax.router.RouteMatch;
import com.ciro.jluax.script.LuajScriptHost;
import com.ciro.jluax.script.Manifest;
import com.ciro.jluax.script.ScriptHandler;
import com.ciro.jluax.script.ScriptHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Snapshot inmutable de una aplicación cargada: un intérprete, el manifest y su tabla de rutas.
 * Para recargar se construye un snapshot nuevo (ver {@link LiveApplication}).
 */
public class Application {

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    private final Manifest manifest;
    private final HtmlRenderer html;
    private final JsonRenderer json;

    public Application(Manifest manifest, HtmlRenderer html, JsonRenderer json) {
        this.manifest = manifest;
        this.html = html;
        this.json = json;
    }

    public static Application load(JluaxConfig config, CompileCache compileCache) {
        long t0 = System.nanoTime();
        ScriptHost host = new LuajScriptHost(config.getProjectDir(), compileCache);
        Manifest manifest = Manifest.load(host, config.getManifest());
        log.info("Loaded '{}' ({} routes{}) in {} ms",
                manifest.name(),
                manifest.routes().size(),
                manifest.fallback() != null ? " + fallback" : "",
                (System.nanoTime() - t0) / 1_000_000);
        return new Application(manifest, new HtmlRenderer(config.getVoidElements()), new JsonRenderer());
    }

    /**
     * Primera ruta que coincida (orden de declaración); si ninguna coincide, el
     * {@code route} de respaldo. Vacío si no hay quien responda.
     */
    public Optional<Response> dispatch(Request request) {
        Optional<HandlerResult> result;
        Optional<RouteMatch<ScriptHandler>> match = manifest.routes().resolve(request.path());
        if (match.isPresent()) {
            RouteMatch<ScriptHandler> m = match.get();
            log.debug("{} {} -> {} {}", request.method(), request.path(), m.pattern(), m.params());
            result = m.handler().handle(m.params(), request);
        } else if (manifest.fallback() != null) {
            result = manifest.fallback().handle(Map.of(), request);
        } else {
            result = Optional.empty();
        }
        return result.map(this::render);
    }

    Response render(HandlerResult r) {
        Object payload = r.payload();
        String body = switch (r.kind()) {
            case PAGE -> payload == null ? "" : html.page(payload);
            case FRAGMENT -> payload == null ? "" : html.fragment(payload);
            case JSON -> json.render(payload);
            case TEXT -> payload == null ? "" : String.valueOf(payload);
        };
        return new Response(r.status(), r.kind().contentType(), body);
    }

    public Manifest manifest() {
        return manifest;
    }

    public String name() {
        return manifest.name();
    }
}
