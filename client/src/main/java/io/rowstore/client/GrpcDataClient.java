// file: client/src/main/java/io/rowstore/client/GrpcDataClient.java
package io.rowstore.client;

import io.grpc.Context;
import io.grpc.Deadline;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.rowstore.proto.RowStoreGrpc;
import io.rowstore.proto.RowStoreProto;

import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * gRPC-based DataClient implementation.
 * <p>
 * The channel is borrowed unless this instance built it itself
 * ({@link #forAddress}); {@link #close()} only shuts down an owned channel.
 * Each streaming call runs in its own cancellable {@link Context}, which is
 * what {@link ServerStream#cancel()} cancels.
 */
public final class GrpcDataClient implements DataClient, AutoCloseable {

    private final String target; // "host:port" or in-process name
    private final ManagedChannel channel;
    private final boolean ownsChannel;
    private final RowStoreGrpc.RowStoreBlockingStub stub;

    /**
     * Borrow an existing channel (e.g. in-process or shared by the application).
     */
    public GrpcDataClient(String target, ManagedChannel channel) {
        this(target, channel, false);
    }

    private GrpcDataClient(String target, ManagedChannel channel, boolean ownsChannel) {
        this.target = Objects.requireNonNull(target, "target");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.ownsChannel = ownsChannel;
        this.stub = RowStoreGrpc.newBlockingStub(channel);
    }

    /**
     * Plaintext channel to {@code host:port}, owned by the returned client.
     */
    public static GrpcDataClient forAddress(String host, int port) {
        ManagedChannel channel = ManagedChannelBuilder
                .forAddress(host, port)
                .usePlaintext()
                .build();
        return new GrpcDataClient(host + ":" + port, channel, true);
    }

    public String target() {
        return target;
    }

    private RowStoreGrpc.RowStoreBlockingStub stub(Deadline deadline) {
        return deadline == null ? stub : stub.withDeadline(deadline);
    }

    @Override
    public RowStoreProto.MutateRowResponse mutateRow(RowStoreProto.MutateRowRequest request, Deadline deadline) {
        return stub(deadline).mutateRow(request);
    }

    @Override
    public ServerStream<RowStoreProto.MutateRowsResponse> mutateRows(
            RowStoreProto.MutateRowsRequest request, Deadline deadline) {
        return open(() -> stub(deadline).mutateRows(request));
    }

    @Override
    public ServerStream<RowStoreProto.ReadRowsResponse> readRows(
            RowStoreProto.ReadRowsRequest request, Deadline deadline) {
        return open(() -> stub(deadline).readRows(request));
    }

    @Override
    public RowStoreProto.CheckAndMutateRowResponse checkAndMutateRow(
            RowStoreProto.CheckAndMutateRowRequest request, Deadline deadline) {
        return stub(deadline).checkAndMutateRow(request);
    }

    @Override
    public ServerStream<RowStoreProto.SampleRowKeysResponse> sampleRowKeys(
            RowStoreProto.SampleRowKeysRequest request, Deadline deadline) {
        return open(() -> stub(deadline).sampleRowKeys(request));
    }

    private static <T> ServerStream<T> open(Supplier<Iterator<T>> call) {
        Context.CancellableContext ctx = Context.current().withCancellation();
        Context previous = ctx.attach();
        try {
            return new ContextStream<>(call.get(), ctx);
        } finally {
            ctx.detach(previous);
        }
    }

    /** Blocking iterator bound to the context its call was started in. */
    private static final class ContextStream<T> implements ServerStream<T> {
        private final Iterator<T> delegate;
        private final Context.CancellableContext ctx;

        ContextStream(Iterator<T> delegate, Context.CancellableContext ctx) {
            this.delegate = delegate;
            this.ctx = ctx;
        }

        @Override
        public boolean hasNext() {
            try {
                boolean more = delegate.hasNext();
                if (!more) {
                    ctx.cancel(null);
                }
                return more;
            } catch (RuntimeException e) {
                ctx.cancel(null);
                throw e;
            }
        }

        @Override
        public T next() {
            return delegate.next();
        }

        @Override
        public void cancel() {
            ctx.cancel(null);
        }
    }

    /**
     * Shut down the channel if this client created it.
     */
    @Override
    public void close() {
        if (!ownsChannel) {
            return;
        }
        channel.shutdown();
        try {
            channel.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
