package com.ciro.jluax;

/** Petición tal como la ve un handler Lua: {@code { path, method, body }}. */
public record Request(String method, String path, String body) {

    public Request {
        method = method == null ? "GET" : method;
        path = path == null || path.isEmpty() ? "/" : path;
        body = body == null ? "" : body;
    }

    public static Request get(String path) {
        return new Request("GET", path, "");
    }
}
