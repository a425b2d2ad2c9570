// file: emulator/src/main/java/io/rowstore/emulator/EmulatorConfig.java
package io.rowstore.emulator;

/**
 * Emulator configuration parsed from CLI args.
 *
 * Supports:
 *  - port:      gRPC port to listen on (0 picks a free port)
 *  - chunkSize: largest value fragment sent in one ReadRows chunk
 */
public record EmulatorConfig(
        int port,
        int chunkSize
) {

    public static final int DEFAULT_PORT = 8086;
    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;

    public EmulatorConfig {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be > 0");
    }

    public static EmulatorConfig defaults() {
        return new EmulatorConfig(DEFAULT_PORT, DEFAULT_CHUNK_SIZE);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --port,       -p <port>
     *   --chunk-size, -c <bytes>
     *   --help,       -h
     *
     * Invalid input throws IllegalArgumentException; Main turns it into a usage error.
     */
    public static EmulatorConfig fromArgs(String[] args) {
        int port = DEFAULT_PORT;
        int chunkSize = DEFAULT_CHUNK_SIZE;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--port", "-p" -> {
                    ensureValue(args, i);
                    port = parseInt("port", args[++i]);
                }

                case "--chunk-size", "-c" -> {
                    ensureValue(args, i);
                    chunkSize = parseInt("chunk-size", args[++i]);
                }

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new EmulatorConfig(port, chunkSize);
    }

    public static boolean wantsHelp(String[] args) {
        for (String a : args) {
            if (a.equals("--help") || a.equals("-h")) {
                return true;
            }
        }
        return false;
    }

    public static String usage() {
        return """
            Usage: rowstore-emulator [options]

            Options:
              --port,       -p   gRPC port (default: 8086, 0 = any free port)
              --chunk-size, -c   Max bytes of a value per ReadRows chunk (default: 65536)
              --help,       -h   Show this help message
            """;
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }

    private static int parseInt(String option, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + option + ": " + raw, e);
        }
    }
}
