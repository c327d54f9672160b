package com.ciro.jluax.standalone;

import com.ciro.jluax.JluaxConfig;
import com.ciro.jluax.LiveApplication;
import com.ciro.jluax.LuaxException;
import com.ciro.jluax.ProjectCompiler;
import com.ciro.jluax.router.RouteTemplateException;
import com.ciro.jluax.script.ScriptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        int code = run(args);
        if (code != 0) System.exit(code);
    }

    /** Ejecuta un comando y devuelve el código de salida. serve/dev bloquean hasta el shutdown. */
    static int run(String[] args) {
        CliArgs cli;
        try {
            cli = CliArgs.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 2;
        }

        try {
            switch (cli.command()) {
                case "build" -> build(cli.dir());
                case "new" -> scaffold(cli.dir(), true);
                case "init" -> scaffold(cli.dir(), false);
                case "serve" -> serve(cli, false);
                case "dev" -> serve(cli, true);
                default -> throw new IllegalStateException(cli.command());
            }
            return 0;
        } catch (LuaxException | ScriptException | RouteTemplateException e) {
            System.err.println("❌ " + e.getMessage());
            return 1;
        } catch (FileAlreadyExistsException e) {
            System.err.println("❌ " + e.getFile() + " already exists and is not empty");
            return 1;
        } catch (IOException | UncheckedIOException e) {
            log.error("I/O failure", e);
            System.err.println("❌ " + e);
            return 1;
        }
    }

    private static void build(Path dir) throws IOException {
        List<Path> out = ProjectCompiler.compileAll(dir);
        System.out.println("✅ " + out.size() + " file(s) compiled in " + dir.toAbsolutePath().normalize());
    }

    private static void scaffold(Path dir, boolean fresh) throws IOException {
        List<Path> written = fresh ? ProjectScaffold.create(dir) : ProjectScaffold.init(dir);
        written.forEach(p -> System.out.println("  + " + p));
        System.out.println("✨ project ready, try: jluax dev -C " + dir);
    }

    private static void serve(CliArgs cli, boolean dev) throws IOException {
        JluaxConfig config = JluaxConfig.load(cli.dir());
        if (cli.port() != null) config.setPort(cli.port());

        System.out.println("⏳ Iniciando jluax" + (dev ? " (dev)" : "") + "...");
        LiveApplication live = new LiveApplication(config);
        JluaxServer server = new JluaxServer(live, dev);
        server.start();

        DevWatcher watcher = null;
        if (dev) {
            watcher = new DevWatcher(config.getProjectDir(), config.getDevDebounceMs(), () -> {
                if (live.reload()) System.out.println("🔄 reloaded");
            });
            watcher.start();
        }

        CountDownLatch stopped = new CountDownLatch(1);
        DevWatcher w = watcher;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                if (w != null) w.close();
            } catch (IOException e) {
                log.warn("Closing watcher failed", e);
            }
            server.stop();
            stopped.countDown();
        }, "jluax-shutdown"));

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
