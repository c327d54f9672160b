package com.ciro.jluax.router;

/** Plantilla de ruta inválida (parámetro vacío o repetido). */
public class RouteTemplateException extends IllegalArgumentException {

    private final String template;

    public RouteTemplateException(String template, String reason) {
        super("Invalid route template '" + template + "': " + reason);
        this.template = template;
    }

    public String getTemplate() { return template; }
}
