package com.ciro.jluax.script;

import com.ciro.jluax.CompileCache;
import org.luaj.vm2.Globals;
import org.luaj.vm2.LuaError;
import org.luaj.vm2.LuaTable;
import org.luaj.vm2.LuaValue;
import org.luaj.vm2.Varargs;
import org.luaj.vm2.lib.VarArgFunction;
import org.luaj.vm2.lib.jse.JsePlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * {@link ScriptHost} sobre LuaJ.
 * <p>
 * Un {@link Globals} de LuaJ no es thread-safe, así que toda entrada a Lua pasa por un
 * único lock. Para paralelismo real se crean varios hosts (uno por snapshot de la app).
 * <p>
 * {@code require("pages.home")} busca, relativo a la raíz del proyecto,
 * {@code pages/home.luax} (compilado al vuelo) y después {@code pages/home.lua}.
 */
public class LuajScriptHost implements ScriptHost {

    private static final Logger log = LoggerFactory.getLogger(LuajScriptHost.class);

    private final Path root;
    private final CompileCache compileCache;
    private final Globals globals;
    private final ReentrantLock lock = new ReentrantLock();

    public LuajScriptHost(Path root, CompileCache compileCache) {
        this.root = root.toAbsolutePath().normalize();
        this.compileCache = compileCache;
        this.globals = JsePlatform.standardGlobals();
        installSearcher();
        installPrint();
    }

    @Override
    public LuaValue load(String module) {
        lock.lock();
        try {
            return globals.get("require").call(LuaValue.valueOf(module));
        } catch (LuaError e) {
            throw ScriptException.translate(e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Varargs call(LuaValue function, Varargs args) {
        lock.lock();
        try {
            return function.invoke(args);
        } catch (LuaError e) {
            throw ScriptException.translate(e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> T call(LuaValue function, Varargs args, Function<Varargs, T> converter) {
        lock.lock();
        try {
            return converter.apply(function.invoke(args));
        } catch (LuaError e) {
            throw ScriptException.translate(e);
        } finally {
            lock.unlock();
        }
    }

    /** Compila y ejecuta un chunk suelto (útil para pruebas y para la consola). */
    public Varargs eval(String luax, String chunkName) {
        lock.lock();
        try {
            String lua = compileCache.compile(chunkName, luax);
            return globals.load(lua, "@" + chunkName).invoke();
        } catch (LuaError e) {
            throw ScriptException.translate(e);
        } finally {
            lock.unlock();
        }
    }

    public Globals globals() {
        return globals;
    }

    // ==============================================================
    // Instalación
    // ==============================================================

    // package.searchers = { preload, proyecto }: sin buscador de clases Java ni package.path
    private void installSearcher() {
        LuaValue pkg = globals.get("package");
        LuaTable searchers = new LuaTable();
        searchers.set(1, pkg.get("searchers").get(1));
        searchers.set(2, new ProjectSearcher());
        pkg.set("searchers", searchers);
    }

    private void installPrint() {
        globals.set("print", new VarArgFunction() {
            @Override
            public Varargs invoke(Varargs args) {
                StringBuilder sb = new StringBuilder();
                for (int i = 1; i <= args.narg(); i++) {
                    if (i > 1) sb.append('\t');
                    sb.append(args.arg(i).tojstring());
                }
                log.info("[lua] {}", sb);
                return NONE;
            }
        });
    }

    private final class ProjectSearcher extends VarArgFunction {
        @Override
        public Varargs invoke(Varargs args) {
            String name = args.checkjstring(1);
            String rel = name.replace('.', '/');

            Path luax = root.resolve(rel + ".luax").normalize();
            Path lua = root.resolve(rel + ".lua").normalize();
            if (!luax.startsWith(root) || !lua.startsWith(root)) {
                return valueOf("\n\tmodule '" + name + "' is outside the project");
            }

            try {
                if (Files.isRegularFile(luax)) {
                    String chunk = rel + ".luax";
                    String code = compileCache.compile(chunk, Files.readAllBytes(luax));
                    log.debug("require('{}') -> {}", name, chunk);
                    return varargsOf(globals.load(code, "@" + chunk), valueOf(chunk));
                }
                if (Files.isRegularFile(lua)) {
                    String chunk = rel + ".lua";
                    log.debug("require('{}') -> {}", name, chunk);
                    return varargsOf(globals.load(Files.readString(lua), "@" + chunk), valueOf(chunk));
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read module '" + name + "'", e);
            }
            return valueOf("\n\tno file '" + rel + ".luax'\n\tno file '" + rel + ".lua'");
        }
    }
}
