// file: client/src/main/java/io/rowstore/client/dto/JsonRetryPolicy.java
package io.rowstore.client.dto;

public class JsonRetryPolicy {
    /** "errorCount" or "time". */
    public String kind;
    public Integer maxFailures;
    public Long maxDurationMillis;
}
