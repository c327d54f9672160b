package com.ciro.jluax;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * Compila todos los {@code *.luax} de un proyecto y deja el {@code .lua} al lado
 * ({@code pages/home.luax} → {@code pages/home.lua}). Se detiene en el primer error.
 */
public final class ProjectCompiler {

    private static final Logger log = LoggerFactory.getLogger(ProjectCompiler.class);

    public static final String SOURCE_EXT = ".luax";

    private ProjectCompiler() {}

    /** @return los archivos .lua escritos, en orden de recorrido */
    public static List<Path> compileAll(Path root) throws IOException {
        Path base = root.toAbsolutePath().normalize();
        List<Path> sources = new ArrayList<>();

        Files.walkFileTree(base, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                // .git, .idea, etc.
                if (!dir.equals(base) && dir.getFileName().toString().startsWith(".")) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && file.getFileName().toString().endsWith(SOURCE_EXT)) {
                    sources.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        sources.sort(null);

        List<Path> written = new ArrayList<>(sources.size());
        for (Path src : sources) {
            written.add(compileFile(base, src));
        }
        log.info("Compiled {} file(s) under {}", written.size(), base);
        return written;
    }

    static Path compileFile(Path base, Path src) throws IOException {
        String module = base.relativize(src).toString().replace('\\', '/');
        String lua = LuaxCompiler.compile(Files.readAllBytes(src), module);

        String fileName = src.getFileName().toString();
        Path out = src.resolveSibling(fileName.substring(0, fileName.length() - SOURCE_EXT.length()) + ".lua");
        Files.writeString(out, lua, StandardCharsets.UTF_8);
        log.debug("{} -> {}", module, base.relativize(out));
        return out;
    }
}
