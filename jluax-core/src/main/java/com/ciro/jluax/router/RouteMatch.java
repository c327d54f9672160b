package com.ciro.jluax.router;

import java.util.Map;

/** Resultado de un match: qué plantilla ganó, su handler y los parámetros extraídos. */
public record RouteMatch<H>(PathPattern pattern, H handler, Map<String, String> params) {}
