package com.ciro.jluax;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuración de un proyecto. Se lee de {@code jluax.properties} en la raíz del
 * proyecto (opcional); la CLI pisa lo que haga falta con los setters.
 */
public class JluaxConfig {

    public static final String FILE_NAME = "jluax.properties";

    public static final Set<String> HTML5_VOID_ELEMENTS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input",
            "link", "meta", "source", "track", "wbr");

    private Path projectDir = Path.of(".");
    /** Puerto HTTP */
    private int port = 4310;
    private String host = "127.0.0.1";
    /** Directorio de estáticos, relativo al proyecto */
    private String publicDir = "public";
    /** Módulo que devuelve la tabla de rutas */
    private String manifest = "reluax";
    private Set<String> voidElements = HTML5_VOID_ELEMENTS;
    /** Máximo de módulos compilados en memoria */
    private int compileCacheSize = 256;
    /** Espera tras el último cambio antes de recargar en modo dev */
    private long devDebounceMs = 150;

    public static JluaxConfig load(Path projectDir) {
        JluaxConfig cfg = new JluaxConfig();
        cfg.setProjectDir(projectDir);

        Path file = projectDir.resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) return cfg;

        Properties props = new Properties();
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
        cfg.apply(props);
        return cfg;
    }

    void apply(Properties props) {
        String v;
        if ((v = props.getProperty("jluax.port")) != null) port = parseInt("jluax.port", v);
        if ((v = props.getProperty("jluax.host")) != null) host = v.trim();
        if ((v = props.getProperty("jluax.public-dir")) != null) publicDir = v.trim();
        if ((v = props.getProperty("jluax.manifest")) != null) manifest = v.trim();
        if ((v = props.getProperty("jluax.void-elements")) != null) voidElements = parseList(v);
        if ((v = props.getProperty("jluax.compile-cache-size")) != null) {
            compileCacheSize = parseInt("jluax.compile-cache-size", v);
        }
        if ((v = props.getProperty("jluax.dev.debounce-ms")) != null) {
            devDebounceMs = parseInt("jluax.dev.debounce-ms", v);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", e);
        }
    }

    private static Set<String> parseList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(String::toLowerCase)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Path resolvePublicDir() {
        return projectDir.resolve(publicDir);
    }

    public Path getProjectDir() { return projectDir; }
    public void setProjectDir(Path projectDir) { this.projectDir = projectDir.toAbsolutePath().normalize(); }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public String getPublicDir() { return publicDir; }
    public void setPublicDir(String publicDir) { this.publicDir = publicDir; }

    public String getManifest() { return manifest; }
    public void setManifest(String manifest) { this.manifest = manifest; }

    public Set<String> getVoidElements() { return voidElements; }
    public void setVoidElements(Set<String> voidElements) { this.voidElements = Set.copyOf(voidElements); }

    public int getCompileCacheSize() { return compileCacheSize; }
    public void setCompileCacheSize(int compileCacheSize) { this.compileCacheSize = compileCacheSize; }

    public long getDevDebounceMs() { return devDebounceMs; }
    public void setDevDebounceMs(long devDebounceMs) { this.devDebounceMs = devDebounceMs; }
}
