package com.ciro.jluax;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LuaxCompilerTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "return 1",
            "local function lt(a, b) return a < b end\nreturn lt(1, 2)",
            "local s = \"<div>\" -- <span>\nreturn s",
            "--[==[\n<p>no es markup</p>\n]==]\nreturn nil",
            "for i = 1, 10 do if i<5 then print(i) end end"
    })
    void plainLuaPassesThroughUnchanged(String lua) {
        assertThat(LuaxCompiler.compile(lua)).isEqualTo(lua);
    }

    @Test
    void compilationIsDeterministic() {
        String src = "local items = {1, 2}\nreturn <ul class=\"x\">{$ items[1] $}<li data-x={2}>a</li></ul>";

        assertThat(LuaxCompiler.compile(src, "m")).isEqualTo(LuaxCompiler.compile(src, "m"));
    }

    @Test
    void bytesAreDecodedAsUtf8() {
        byte[] src = "return <p>ñ</p>".getBytes(StandardCharsets.UTF_8);

        assertThat(LuaxCompiler.compile(src, "m"))
                .isEqualTo("return { tag=\"p\", attrs={}, children={ \"ñ\", } }");
    }

    @Test
    void invalidUtf8IsALexError() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        buf.writeBytes("return 1 -- ".getBytes(StandardCharsets.US_ASCII));
        buf.write(0xC3);
        buf.write(0x28);

        assertThatThrownBy(() -> LuaxCompiler.compile(buf.toByteArray(), "bad"))
                .isInstanceOfSatisfying(LexException.class, e -> {
                    assertThat(e.getReason()).isEqualTo("invalid UTF-8");
                    assertThat(e.getOffset()).isEqualTo(12);
                    assertThat(e.getModule()).isEqualTo("bad");
                });
    }

    @Test
    void errorsAreUncheckedAndCarryTheModule() {
        assertThatThrownBy(() -> LuaxCompiler.compile("return <div>", "pages/home"))
                .isInstanceOf(RuntimeException.class)
                .isInstanceOf(ParseException.class)
                .hasMessage("pages/home:1:13: expected </div>, found end of input");
    }
}
