package com.ciro.jluax.script;

import org.luaj.vm2.LuaValue;
import org.luaj.vm2.Varargs;

import java.util.function.Function;

/**
 * Intérprete donde corre el código generado. Los errores de Lua salen como
 * {@link ScriptException}; los de compilación LuaX como {@link com.ciro.jluax.LuaxException}.
 */
public interface ScriptHost {

    /** Equivale a {@code require(module)}: carga el módulo una vez y devuelve su valor. */
    LuaValue load(String module);

    Varargs call(LuaValue function, Varargs args);

    /**
     * Llama y convierte el resultado sin soltar el intérprete. Las tablas devueltas
     * pueden ser compartidas con otros handlers, así que no se leen fuera del lock.
     */
    <T> T call(LuaValue function, Varargs args, Function<Varargs, T> converter);
}
