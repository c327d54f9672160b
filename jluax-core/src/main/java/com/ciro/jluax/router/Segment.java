package com.ciro.jluax.router;

/** Un componente de una plantilla de ruta, entre dos '/'. */
public sealed interface Segment permits Segment.Literal, Segment.Named {

    /** Debe coincidir exactamente (sensible a mayúsculas, sin decodificar %XX). */
    record Literal(String text) implements Segment {}

    /** {@code :id} acepta cualquier componente y lo guarda bajo ese nombre. */
    record Named(String name) implements Segment {}
}
