package com.ciro.jluax.standalone;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    @TempDir
    Path tmp;

    @Test
    void newThenBuild() throws Exception {
        Path dir = tmp.resolve("demo");

        assertThat(Main.run(new String[]{"new", dir.toString()})).isZero();
        assertThat(Main.run(new String[]{"build", "-C", dir.toString()})).isZero();

        assertThat(dir.resolve("reluax.lua")).exists();
        assertThat(Files.readString(dir.resolve("pages/index.lua"))).contains("tag=\"html\"");
    }

    @Test
    void buildReportsCompileErrors() throws Exception {
        Files.writeString(tmp.resolve("bad.luax"), "return <p>oops</div>");

        assertThat(Main.run(new String[]{"build", "-C", tmp.toString()})).isEqualTo(1);
        assertThat(tmp.resolve("bad.lua")).doesNotExist();
    }

    @Test
    void badArgumentsExitWith2() {
        assertThat(Main.run(new String[]{"launch"})).isEqualTo(2);
    }

    @Test
    void newIntoNonEmptyDirectoryFails() throws Exception {
        Files.writeString(tmp.resolve("x.txt"), "x");

        assertThat(Main.run(new String[]{"new", tmp.toString()})).isEqualTo(1);
    }
}
