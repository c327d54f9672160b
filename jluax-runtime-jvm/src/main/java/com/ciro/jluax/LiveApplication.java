package com.ciro.jluax;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * La aplicación "viva": una referencia atómica al snapshot actual.
 * Cada petición lee la referencia una sola vez, así que nunca ve dos generaciones mezcladas.
 */
public class LiveApplication {

    private static final Logger log = LoggerFactory.getLogger(LiveApplication.class);

    private final JluaxConfig config;
    private final CompileCache compileCache;
    private final AtomicReference<Application> current = new AtomicReference<>();

    /** La primera carga falla en voz alta; las recargas no. */
    public LiveApplication(JluaxConfig config) {
        this.config = config;
        this.compileCache = new CompileCache(config.getCompileCacheSize());
        this.current.set(Application.load(config, compileCache));
    }

    /**
     * Construye un snapshot nuevo y lo publica. Si falla, se loguea y se sigue
     * sirviendo el anterior.
     *
     * @return true si se publicó una versión nueva
     */
    public boolean reload() {
        Application next;
        try {
            next = Application.load(config, compileCache);
        } catch (RuntimeException e) {
            log.error("Reload failed, still serving the previous version: {}", e.getMessage());
            log.debug("Reload failure", e);
            return false;
        }
        current.set(next);
        return true;
    }

    public Optional<Response> dispatch(Request request) {
        return current.get().dispatch(request);
    }

    public Application current() {
        return current.get();
    }

    public JluaxConfig config() {
        return config;
    }
}
