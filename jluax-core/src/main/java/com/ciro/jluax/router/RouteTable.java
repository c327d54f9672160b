package com.ciro.jluax.router;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Conjunto inmutable de rutas. Gana la primera que coincida en orden de declaración:
 * no se mira cuál es más específica.
 * <p>
 * Al ser inmutable se comparte entre hilos sin locks; para recargar se construye
 * una tabla nueva y se publica cambiando una sola referencia.
 */
public final class RouteTable<H> implements RouteProvider<H> {

    private record Entry<H>(PathPattern pattern, H handler) {}

    private static final RouteTable<?> EMPTY = new RouteTable<>(List.of());

    private final List<Entry<H>> routes;

    private RouteTable(List<Entry<H>> routes) {
        this.routes = routes;
    }

    @SuppressWarnings("unchecked")
    public static <H> RouteTable<H> empty() {
        return (RouteTable<H>) EMPTY;
    }

    public static <H> Builder<H> builder() {
        return new Builder<>();
    }

    @Override
    public Optional<RouteMatch<H>> resolve(String path) {
        for (Entry<H> e : routes) {
            Map<String, String> params = e.pattern().match(path);
            if (params != null) {
                return Optional.of(new RouteMatch<>(e.pattern(), e.handler(), params));
            }
        }
        return Optional.empty();
    }

    public List<PathPattern> patterns() {
        return routes.stream().map(Entry::pattern).toList();
    }

    public int size() {
        return routes.size();
    }

    public static final class Builder<H> {
        private final List<Entry<H>> routes = new ArrayList<>();

        private Builder() {}

        /**
         * Registra una ruta nueva.
         * Ejemplo: builder.add("/users/:id", handler);
         */
        public Builder<H> add(String template, H handler) {
            routes.add(new Entry<>(PathPattern.compile(template), handler));
            return this;
        }

        public RouteTable<H> build() {
            return new RouteTable<>(List.copyOf(routes));
        }
    }
}
