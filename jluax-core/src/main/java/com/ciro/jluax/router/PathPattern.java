package com.ciro.jluax.router;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plantilla de ruta compilada: "/users/:id/orders/:oid".
 * Aridad fija: sin comodines, sin segmentos opcionales, sin regex.
 */
public final class PathPattern {

    public static final char PARAM_MARKER = ':';

    final String template;
    final List<Segment> segments;

    private PathPattern(String template, List<Segment> segments) {
        this.template = template;
        this.segments = segments;
    }

    public static PathPattern compile(String template) {
        List<Segment> segments = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (String part : split(template)) {
            if (!part.isEmpty() && part.charAt(0) == PARAM_MARKER) {
                String name = part.substring(1);
                if (name.isEmpty()) throw new RouteTemplateException(template, "empty parameter name");
                if (!names.add(name)) throw new RouteTemplateException(template, "duplicate parameter ':" + name + "'");
                segments.add(new Segment.Named(name));
            } else {
                segments.add(new Segment.Literal(part));
            }
        }
        return new PathPattern(template, List.copyOf(segments));
    }

    /**
     * @return parámetros en el orden de la plantilla, o {@code null} si no coincide.
     *         Nunca se observa un resultado parcial.
     */
    public Map<String, String> match(String path) {
        List<String> parts = split(path);
        if (parts.size() != segments.size()) return null;

        Map<String, String> params = null;
        for (int i = 0; i < segments.size(); i++) {
            Segment seg = segments.get(i);
            String part = parts.get(i);
            if (seg instanceof Segment.Literal lit) {
                if (!lit.text().equals(part)) return null;
            } else if (seg instanceof Segment.Named named) {
                if (params == null) params = new LinkedHashMap<>();
                params.put(named.name(), part);
            }
        }
        return params == null ? Map.of() : Collections.unmodifiableMap(params);
    }

    /** "/" y "" no tienen segmentos; "/a/" tiene dos ("a" y ""). */
    static List<String> split(String path) {
        String p = path == null ? "" : path;
        if (p.startsWith("/")) p = p.substring(1);
        if (p.isEmpty()) return List.of();
        return List.of(p.split("/", -1));
    }

    public String template() { return template; }

    public List<Segment> segments() { return segments; }

    @Override
    public String toString() {
        return template;
    }
}
