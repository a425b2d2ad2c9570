// file: emulator/src/main/java/io/rowstore/emulator/Main.java
package io.rowstore.emulator;

import java.io.IOException;

/**
 * Entry point for the RowStore emulator.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Start the gRPC server with an empty set of in-memory tables.
 *  - Stop it on JVM shutdown.
 */
public final class Main {

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        if (EmulatorConfig.wantsHelp(args)) {
            System.out.println(EmulatorConfig.usage());
            return;
        }

        EmulatorConfig cfg;
        try {
            cfg = EmulatorConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(EmulatorConfig.usage());
            System.exit(2);
            return;
        }

        var emulator = EmulatorServer.start(cfg);
        System.out.printf("RowStore emulator listening on grpc://localhost:%d%n", emulator.port());

        Runtime.getRuntime().addShutdownHook(new Thread(emulator::close));
        emulator.awaitTermination();
    }
}
