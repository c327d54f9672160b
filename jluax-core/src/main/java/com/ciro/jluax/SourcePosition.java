package com.ciro.jluax;

import java.nio.charset.StandardCharsets;

/**
 * Posición dentro del código fuente: índice de char, offset en bytes UTF-8,
 * línea y columna (ambas desde 1).
 */
public record SourcePosition(int index, int byteOffset, int line, int column) {

    public static SourcePosition of(String src, int index) {
        int safe = Math.max(0, Math.min(index, src.length()));
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < safe; i++) {
            if (src.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        int bytes = src.substring(0, safe).getBytes(StandardCharsets.UTF_8).length;
        return new SourcePosition(safe, bytes, line, safe - lineStart + 1);
    }

    /** Para errores de decodificación: solo conocemos el offset en bytes. */
    public static SourcePosition ofBytes(byte[] src, int byteOffset) {
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < byteOffset && i < src.length; i++) {
            if (src[i] == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new SourcePosition(-1, byteOffset, line, byteOffset - lineStart + 1);
    }
}
