package com.ciro.jluax.router;

import java.util.Optional;

public interface RouteProvider<H> {
    // Devuelve el handler y los params extraídos (ej: id=5); vacío si nada coincide
    Optional<RouteMatch<H>> resolve(String path);
}
