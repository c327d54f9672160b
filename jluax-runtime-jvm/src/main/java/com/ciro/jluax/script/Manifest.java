package com.ciro.jluax.script;

import com.ciro.jluax.router.RouteTable;
import org.luaj.vm2.LuaValue;

/**
 * Tabla que devuelve el módulo manifest ({@code reluax.luax} / {@code reluax.lua}):
 * <pre>
 * return {
 *   name = "blog",
 *   routes = {
 *     { "/",          function(params, req) return 200, &lt;Home/&gt; end },
 *     { "/posts/:id", function(params, req) return 200, &lt;Post id={params.id}/&gt; end },
 *   },
 *   route = function(path, method, body) ... end,   -- opcional
 * }
 * </pre>
 *
 * @param fallback puede ser null
 */
public record Manifest(String name, RouteTable<ScriptHandler> routes, ScriptHandler fallback) {

    public static Manifest load(ScriptHost host, String module) {
        LuaValue value = host.load(module);
        if (!value.istable()) {
            throw new ScriptException("manifest '" + module + "' must return a table, got " + value.typename());
        }

        LuaValue nameValue = value.get("name");
        String name = nameValue.isnil() ? module : nameValue.tojstring();

        RouteTable.Builder<ScriptHandler> routes = RouteTable.builder();
        LuaValue list = value.get("routes");
        if (!list.isnil()) {
            if (!list.istable()) throw new ScriptException("manifest 'routes' must be a table");
            for (int i = 1; i <= list.length(); i++) {
                LuaValue entry = list.get(i);
                LuaValue template = entry.istable() ? entry.get(1) : LuaValue.NIL;
                LuaValue fn = entry.istable() ? entry.get(2) : LuaValue.NIL;
                if (template.type() != LuaValue.TSTRING || !fn.isfunction()) {
                    throw new ScriptException("manifest route #" + i + " must be { \"/template\", function }");
                }
                routes.add(template.tojstring(), templated(host, fn));
            }
        }

        LuaValue route = value.get("route");
        ScriptHandler fallback = null;
        if (!route.isnil()) {
            if (!route.isfunction()) throw new ScriptException("manifest 'route' must be a function");
            fallback = fallback(host, route);
        }
        return new Manifest(name, routes.build(), fallback);
    }

    private static ScriptHandler templated(ScriptHost host, LuaValue fn) {
        return (params, request) -> host.call(fn,
                LuaValue.varargsOf(LuaValues.params(params), LuaValues.request(request)),
                LuaValues::toResult);
    }

    private static ScriptHandler fallback(ScriptHost host, LuaValue fn) {
        return (params, request) -> host.call(fn,
                LuaValue.varargsOf(new LuaValue[]{
                        LuaValue.valueOf(request.path()),
                        LuaValue.valueOf(request.method()),
                        LuaValue.valueOf(request.body())}),
                LuaValues::toResult);
    }
}
