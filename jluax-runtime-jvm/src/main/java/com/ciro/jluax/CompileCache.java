package com.ciro.jluax;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

/**
 * Caché en memoria de módulos compilados. La clave incluye el fuente completo:
 * si el archivo cambia, la entrada vieja simplemente deja de usarse y Caffeine la desaloja.
 * Un error de compilación no se cachea.
 */
public class CompileCache {

    private record Key(String module, String source) {}

    private final Cache<Key, String> cache;

    public CompileCache(int maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    public String compile(String module, String source) {
        return cache.get(new Key(module, source), k -> LuaxCompiler.compile(k.source(), k.module()));
    }

    public String compile(String module, byte[] utf8) {
        return compile(module, LuaxCompiler.decode(utf8, module));
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
