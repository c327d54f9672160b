package com.ciro.jluax.standalone;

import com.ciro.jluax.JluaxConfig;
import com.ciro.jluax.LiveApplication;
import io.undertow.Undertow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

public class JluaxServer {

    private static final Logger log = LoggerFactory.getLogger(JluaxServer.class);

    private final JluaxConfig config;
    private final LiveApplication app;
    private final boolean dev;
    private Undertow server;

    public JluaxServer(LiveApplication app) {
        this(app, false);
    }

    /** En modo dev los 500 llevan el mensaje del error; en serve solo van al log. */
    public JluaxServer(LiveApplication app, boolean dev) {
        this.app = app;
        this.dev = dev;
        this.config = app.config();
    }

    public void start() {
        DispatchEndpoint endpoint = new DispatchEndpoint(app, config.resolvePublicDir(), dev);

        server = Undertow.builder()
                .addHttpListener(config.getPort(), config.getHost())
                .setHandler(endpoint)
                .build();

        server.start();
        log.info("Serving '{}' from {}", app.current().name(), config.getProjectDir());
        System.out.println("🚀 jluax corriendo en http://" + config.getHost() + ":" + port());
    }

    /** Puerto real (sirve cuando se configuró 0). */
    public int port() {
        if (server == null) return config.getPort();
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    public void stop() {
        if (server != null) {
            server.stop();
            server = null;
        }
    }
}
