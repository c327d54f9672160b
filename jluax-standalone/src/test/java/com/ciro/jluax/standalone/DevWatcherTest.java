package com.ciro.jluax.standalone;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DevWatcherTest {

    @TempDir
    Path root;

    @Test
    void reloadsWhenASourceChanges() throws Exception {
        Files.createDirectories(root.resolve("pages"));
        CountDownLatch changed = new CountDownLatch(1);

        try (DevWatcher watcher = new DevWatcher(root, 50, changed::countDown)) {
            watcher.start();
            Files.writeString(root.resolve("pages/about.luax"), "return <p>about</p>");

            assertThat(changed.await(10, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void onlyLuaSourcesCount() {
        assertThat(DevWatcher.isSource(Path.of("pages/index.luax"))).isTrue();
        assertThat(DevWatcher.isSource(Path.of("lib/util.lua"))).isTrue();
        assertThat(DevWatcher.isSource(Path.of("public/style.css"))).isFalse();
        assertThat(DevWatcher.isSource(Path.of("index.luax.swp"))).isFalse();
    }

    @Test
    void closeStopsTheWatcher() throws IOException {
        DevWatcher watcher = new DevWatcher(root, 10, () -> { });
        watcher.start();
        watcher.close();
    }
}
