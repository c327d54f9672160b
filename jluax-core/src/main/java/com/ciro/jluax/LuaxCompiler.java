package com.ciro.jluax;

import com.ciro.jluax.ast.LuaxNode;
import com.ciro.jluax.ast.LuaxParser;
import com.ciro.jluax.codegen.LuaGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Punto de entrada del compilador: LuaX → Lua.
 * Función pura y sin estado compartido, se puede llamar desde varios hilos a la vez.
 */
public final class LuaxCompiler {

    private static final Logger log = LoggerFactory.getLogger(LuaxCompiler.class);

    private LuaxCompiler() {}

    public static String compile(String source, String module) {
        long t0 = System.nanoTime();
        List<LuaxNode> program = LuaxParser.parse(module, source);
        String lua = LuaGenerator.generate(program);
        if (log.isDebugEnabled()) {
            log.debug("Compiled {} ({} chars -> {} chars) in {} µs",
                    module, source.length(), lua.length(), (System.nanoTime() - t0) / 1_000);
        }
        return lua;
    }

    public static String compile(String source) {
        return compile(source, "<input>");
    }

    /** Igual que {@link #compile(String, String)} pero valida el UTF-8 de entrada. */
    public static String compile(byte[] utf8, String module) {
        return compile(decode(utf8, module), module);
    }

    /** Decodifica UTF-8 estricto; una secuencia inválida es un {@link LexException} con su offset. */
    public static String decode(byte[] utf8, String module) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(utf8);
        CharBuffer out = CharBuffer.allocate(utf8.length);

        CoderResult result = decoder.decode(in, out, true);
        if (result.isError()) {
            throw new LexException(module, SourcePosition.ofBytes(utf8, in.position()), "invalid UTF-8");
        }
        result = decoder.flush(out);
        if (result.isError()) {
            throw new LexException(module, SourcePosition.ofBytes(utf8, in.position()), "invalid UTF-8");
        }
        out.flip();
        return out.toString();
    }
}
