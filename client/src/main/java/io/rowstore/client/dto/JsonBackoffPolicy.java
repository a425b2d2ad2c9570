// file: client/src/main/java/io/rowstore/client/dto/JsonBackoffPolicy.java
package io.rowstore.client.dto;

public class JsonBackoffPolicy {
    public long initialMillis;
    public long maximumMillis;
}
