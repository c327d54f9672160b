package com.ciro.jluax.standalone;

import java.nio.file.Path;

/**
 * Argumentos de la línea de comandos ya interpretados.
 *
 * @param command  build | serve | dev | new | init
 * @param dir      directorio del proyecto
 * @param port     puerto pedido con {@code -p}, o null para usar el de la config
 */
public record CliArgs(String command, Path dir, Integer port) {

    public static final String USAGE = """
            usage:
              jluax build [-C dir]
              jluax serve [-C dir] [-p port]
              jluax dev   [-C dir] [-p port]
              jluax new <name>
              jluax init [-C dir]
            """;

    public static CliArgs parse(String[] args) {
        if (args.length == 0) throw usage("missing command");

        String command = args[0];
        Path dir = Path.of(".");
        Integer port = null;

        switch (command) {
            case "new" -> {
                if (args.length != 2 || args[1].startsWith("-")) throw usage("'new' takes exactly one name");
                return new CliArgs(command, Path.of(args[1]), null);
            }
            case "build", "serve", "dev", "init" -> { }
            default -> throw usage("unknown command '" + command + "'");
        }

        boolean portAllowed = command.equals("serve") || command.equals("dev");
        for (int i = 1; i < args.length; i++) {
            String a = args[i];
            if (a.equals("-C")) {
                dir = Path.of(value(args, ++i, a));
            } else if (a.equals("-p") && portAllowed) {
                String v = value(args, ++i, a);
                try {
                    port = Integer.parseInt(v);
                } catch (NumberFormatException e) {
                    throw usage("invalid port '" + v + "'");
                }
                if (port < 0 || port > 65535) throw usage("invalid port '" + v + "'");
            } else {
                throw usage("unexpected argument '" + a + "'");
            }
        }
        return new CliArgs(command, dir, port);
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) throw usage(flag + " needs a value");
        return args[i];
    }

    private static IllegalArgumentException usage(String problem) {
        return new IllegalArgumentException(problem + "\n" + USAGE);
    }
}
