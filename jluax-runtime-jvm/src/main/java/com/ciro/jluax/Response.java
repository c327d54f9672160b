package com.ciro.jluax;

public record Response(int status, String contentType, String body) {

    public static final String HTML = "text/html; charset=utf-8";
    public static final String JSON = "application/json";
    public static final String TEXT = "text/plain; charset=utf-8";

    public boolean isNotFound() {
        return status == 404;
    }
}
