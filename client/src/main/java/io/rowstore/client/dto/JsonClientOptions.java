// file: client/src/main/java/io/rowstore/client/dto/JsonClientOptions.java
package io.rowstore.client.dto;

public class JsonClientOptions {
    public JsonRetryPolicy retry;
    public JsonBackoffPolicy backoff;
    public String idempotency;
    public Long attemptTimeoutMillis;
}
