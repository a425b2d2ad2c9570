// file: emulator/src/main/java/io/rowstore/emulator/EmulatorServer.java
package io.rowstore.emulator;

import io.grpc.Server;
import io.grpc.ServerBuilder;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * A running emulator: one gRPC server hosting a {@link RowStoreService}.
 */
public final class EmulatorServer implements AutoCloseable {
    private static final Logger log = Logger.getLogger(EmulatorServer.class.getName());

    private final RowStoreService service;
    private final Server server;

    private EmulatorServer(RowStoreService service, Server server) {
        this.service = service;
        this.server = server;
    }

    /** Build and start a server for {@code cfg}. */
    public static EmulatorServer start(EmulatorConfig cfg) throws IOException {
        var service = new RowStoreService(cfg.chunkSize());
        Server server = ServerBuilder
                .forPort(cfg.port())
                .addService(service)
                .build()
                .start();
        log.info(() -> "RowStore emulator listening on port " + server.getPort()
                + " (chunkSize=" + cfg.chunkSize() + ")");
        return new EmulatorServer(service, server);
    }

    public int port() {
        return server.getPort();
    }

    public RowStoreService service() {
        return service;
    }

    public FaultInjector faults() {
        return service.faults();
    }

    public void awaitTermination() throws InterruptedException {
        server.awaitTermination();
    }

    @Override
    public void close() {
        server.shutdown();
        try {
            if (!server.awaitTermination(5, TimeUnit.SECONDS)) {
                server.shutdownNow();
            }
        } catch (InterruptedException e) {
            server.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("RowStore emulator stopped");
    }
}
