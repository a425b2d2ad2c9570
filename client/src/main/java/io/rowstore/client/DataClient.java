// file: client/src/main/java/io/rowstore/client/DataClient.java
package io.rowstore.client;

import io.grpc.Deadline;
import io.rowstore.proto.RowStoreProto;

import java.util.Iterator;

/**
 * Transport seam between the retry logic and the wire.
 * <p>
 * Contract:
 *  - {@code deadline} bounds one attempt; null means none.
 *  - Unary failures and stream failures surface as
 *    {@link io.grpc.StatusRuntimeException}, the latter from the stream's
 *    {@code hasNext()}/{@code next()}.
 *  - Implementations never retry; retrying is the caller's job.
 */
public interface DataClient {

    /** A server stream the caller may abandon early. */
    interface ServerStream<T> extends Iterator<T> {
        /** Cancel the underlying call. Idempotent. */
        void cancel();
    }

    RowStoreProto.MutateRowResponse mutateRow(RowStoreProto.MutateRowRequest request, Deadline deadline);

    ServerStream<RowStoreProto.MutateRowsResponse> mutateRows(
            RowStoreProto.MutateRowsRequest request, Deadline deadline);

    ServerStream<RowStoreProto.ReadRowsResponse> readRows(
            RowStoreProto.ReadRowsRequest request, Deadline deadline);

    RowStoreProto.CheckAndMutateRowResponse checkAndMutateRow(
            RowStoreProto.CheckAndMutateRowRequest request, Deadline deadline);

    ServerStream<RowStoreProto.SampleRowKeysResponse> sampleRowKeys(
            RowStoreProto.SampleRowKeysRequest request, Deadline deadline);
}
