// file: core/src/main/java/io/rowstore/core/RowStoreException.java
package io.rowstore.core;

import io.grpc.Status;

import java.util.Objects;

/**
 * Unchecked failure of a RowStore operation, carrying the gRPC status that
 * ended it (the last attempt's status when retries were involved).
 */
public class RowStoreException extends RuntimeException {

    private final Status status;

    public RowStoreException(Status status) {
        this(status, status.getCause());
    }

    public RowStoreException(Status status, Throwable cause) {
        super(describe(status), cause);
        this.status = Objects.requireNonNull(status, "status");
    }

    public Status status() {
        return status;
    }

    public Status.Code code() {
        return status.getCode();
    }

    private static String describe(Status status) {
        Objects.requireNonNull(status, "status");
        String d = status.getDescription();
        return d == null ? status.getCode().name() : status.getCode() + ": " + d;
    }
}
