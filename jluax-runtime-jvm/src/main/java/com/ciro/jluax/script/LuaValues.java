package com.ciro.jluax.script;

import com.ciro.jluax.HandlerResult;
import com.ciro.jluax.Request;
import com.ciro.jluax.render.ResponseKind;
import org.luaj.vm2.LuaTable;
import org.luaj.vm2.LuaValue;
import org.luaj.vm2.Varargs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Conversión entre valores LuaJ y Java.
 * <pre>
 * nil      → null
 * boolean  → Boolean
 * number   → Integer / Long / Double (enteros sin ".0")
 * string   → String
 * table    → List si sus claves son 1..n, si no Map ordenado por clave
 * </pre>
 * Funciones, userdata y corutinas no se pueden convertir.
 */
public final class LuaValues {

    static final int MAX_DEPTH = 64;

    private LuaValues() {}

    public static Object toJava(LuaValue v) {
        return toJava(v, 0);
    }

    private static Object toJava(LuaValue v, int depth) {
        switch (v.type()) {
            case LuaValue.TNIL:
                return null;
            case LuaValue.TBOOLEAN:
                return v.toboolean();
            case LuaValue.TNUMBER:
                return number(v);
            case LuaValue.TSTRING:
                return v.tojstring();
            case LuaValue.TTABLE:
                if (depth >= MAX_DEPTH) {
                    throw new ScriptException("table nested deeper than " + MAX_DEPTH + " levels (cycle?)");
                }
                return table(v.checktable(), depth);
            default:
                throw new ScriptException("cannot convert Lua " + v.typename() + " to a response value");
        }
    }

    private static Object number(LuaValue v) {
        if (v.isinttype()) return v.toint();
        double d = v.todouble();
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 0x1p53) {
            long l = (long) d;
            return (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) ? (Object) (int) l : (Object) l;
        }
        return d;
    }

    private static Object table(LuaTable t, int depth) {
        int n = t.length();
        int count = 0;
        boolean sequence = true;

        LuaValue k = LuaValue.NIL;
        while (true) {
            Varargs next = t.next(k);
            if ((k = next.arg1()).isnil()) break;
            count++;
            if (!k.isinttype() || k.toint() < 1 || k.toint() > n) sequence = false;
        }

        if (sequence && count == n) {
            List<Object> list = new ArrayList<>(n);
            for (int i = 1; i <= n; i++) list.add(toJava(t.get(i), depth + 1));
            return Collections.unmodifiableList(list);
        }

        Map<String, Object> map = new TreeMap<>();
        k = LuaValue.NIL;
        while (true) {
            Varargs next = t.next(k);
            if ((k = next.arg1()).isnil()) break;
            map.put(k.tojstring(), toJava(next.arg(2), depth + 1));
        }
        return Collections.unmodifiableMap(map);
    }

    // --------------------------------------------------------------------------------
    // Java → Lua (argumentos de los handlers)
    // --------------------------------------------------------------------------------

    public static LuaTable params(Map<String, String> params) {
        LuaTable t = new LuaTable();
        params.forEach((k, v) -> t.set(k, LuaValue.valueOf(v)));
        return t;
    }

    public static LuaTable request(Request request) {
        LuaTable t = new LuaTable();
        t.set("path", LuaValue.valueOf(request.path()));
        t.set("method", LuaValue.valueOf(request.method()));
        t.set("body", LuaValue.valueOf(request.body()));
        return t;
    }

    // --------------------------------------------------------------------------------
    // Valores de retorno de un handler: status, payload[, kind]
    // --------------------------------------------------------------------------------

    /**
     * {@code return nil} → sin ruta (vacío).
     * {@code return 404} → status sin payload.
     * {@code return "<p>hola</p>"} → status 200 implícito.
     */
    public static Optional<HandlerResult> toResult(Varargs ret) {
        LuaValue first = ret.arg1();
        if (first.isnil()) return Optional.empty();

        int status = 200;
        LuaValue payload = first;
        LuaValue kind = ret.arg(2);
        if (first.type() == LuaValue.TNUMBER) {
            double d = first.todouble();
            if (d != Math.rint(d) || d < 100 || d > 599) {
                throw new ScriptException("invalid HTTP status " + first.tojstring());
            }
            status = (int) d;
            payload = ret.arg(2);
            kind = ret.arg(3);
        }
        if (status < 100 || status > 599) throw new ScriptException("invalid HTTP status " + status);

        Object value = toJava(payload);
        return Optional.of(new HandlerResult(status, value, kind(kind, value)));
    }

    private static ResponseKind kind(LuaValue kind, Object payload) {
        if (kind.isnil()) return ResponseKind.infer(payload);
        if (kind.type() != LuaValue.TSTRING) {
            throw new ScriptException("response kind must be a string, got " + kind.typename());
        }
        ResponseKind k = ResponseKind.byName(kind.tojstring());
        if (k == null) throw new ScriptException("unknown response kind '" + kind.tojstring() + "'");
        return k;
    }
}
