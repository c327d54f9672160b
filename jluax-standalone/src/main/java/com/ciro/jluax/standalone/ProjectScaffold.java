package com.ciro.jluax.standalone;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/** Esqueleto de proyecto para {@code jluax new} / {@code jluax init}. */
public final class ProjectScaffold {

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_.-]+");

    private ProjectScaffold() {}

    /** {@code jluax new <name>}: el directorio no debe existir (o estar vacío). */
    public static List<Path> create(Path dir) throws IOException {
        if (Files.isDirectory(dir)) {
            try (var entries = Files.list(dir)) {
                if (entries.findAny().isPresent()) throw new FileAlreadyExistsException(dir.toString());
            }
        } else if (Files.exists(dir)) {
            throw new FileAlreadyExistsException(dir.toString());
        }
        return init(dir);
    }

    /** {@code jluax init}: completa lo que falte, nunca pisa un archivo existente. */
    public static List<Path> init(Path dir) throws IOException {
        Path abs = dir.toAbsolutePath().normalize();
        Path fileName = abs.getFileName();
        String name = fileName == null ? "app" : fileName.toString();
        if (!SAFE_NAME.matcher(name).matches()) name = "app";

        List<Path> written = new ArrayList<>();
        for (Map.Entry<String, String> file : files(name).entrySet()) {
            Path target = abs.resolve(file.getKey());
            if (Files.exists(target)) continue;
            Files.createDirectories(target.getParent());
            Files.writeString(target, file.getValue());
            written.add(target);
        }
        return written;
    }

    static Map<String, String> files(String name) {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("reluax.luax", """
                local Index = require("pages.index")

                return {
                  name = "%s",
                  routes = {
                    { "/", function(params, req)
                        return 200, <Index title="%s"/>
                      end },
                    { "/hello/:name", function(params, req)
                        return 200, <p>Hello, {$ params.name $}!</p>, "fragment"
                      end },
                  },
                }
                """.formatted(name, name));
        files.put("pages/index.luax", """
                return function(attrs, children)
                  return <html>
                    <head>
                      <meta charset="utf-8"/>
                      <title>{$ attrs.title $}</title>
                      <link rel="stylesheet" href="/style.css"/>
                    </head>
                    <body>
                      <h1>{$ attrs.title $}</h1>
                      <p>Edit <code>pages/index.luax</code> and reload.</p>
                    </body>
                  </html>
                end
                """);
        files.put("public/style.css", """
                body { font-family: system-ui, sans-serif; margin: 2rem; }
                """);
        files.put("jluax.properties", """
                # jluax.port=4310
                # jluax.host=127.0.0.1
                # jluax.public-dir=public
                """);
        return files;
    }
}
