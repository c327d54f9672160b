package com.ciro.jluax;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectCompilerTest {

    @TempDir
    Path root;

    private void write(String rel, String content) throws IOException {
        Path file = root.resolve(rel);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void writesLuaNextToEachSource() throws IOException {
        write("reluax.luax", "return { name = 'x', routes = {} }");
        write("pages/home.luax", "return <h1>home</h1>");
        write("lib/util.lua", "return 1");

        List<Path> written = ProjectCompiler.compileAll(root);

        assertThat(written).extracting(p -> root.relativize(p).toString().replace('\\', '/'))
                .containsExactly("pages/home.lua", "reluax.lua");
        assertThat(Files.readString(root.resolve("pages/home.lua")))
                .isEqualTo("return { tag=\"h1\", attrs={}, children={ \"home\", } }");
        assertThat(Files.readString(root.resolve("lib/util.lua"))).isEqualTo("return 1");
    }

    @Test
    void hiddenDirectoriesAreSkipped() throws IOException {
        write(".cache/old.luax", "return <p>");

        assertThat(ProjectCompiler.compileAll(root)).isEmpty();
    }

    @Test
    void firstErrorStopsTheBuildAndNamesTheFile() throws IOException {
        write("pages/bad.luax", "return <div></span>");

        assertThatThrownBy(() -> ProjectCompiler.compileAll(root))
                .isInstanceOfSatisfying(ParseException.class,
                        e -> assertThat(e.getModule()).isEqualTo("pages/bad.luax"))
                .hasMessageStartingWith("pages/bad.luax:1:13:");
        assertThat(root.resolve("pages/bad.lua")).doesNotExist();
    }
}
