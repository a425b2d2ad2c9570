// file: client/src/test/java/io/rowstore/client/TableSampleRowKeysTest.java
package io.rowstore.client;

import com.google.protobuf.ByteString;
import io.grpc.Status;
import io.rowstore.core.RowKeySample;
import io.rowstore.core.RowKeys;
import io.rowstore.core.RowStoreException;
import io.rowstore.core.retry.ExponentialBackoffPolicy;
import io.rowstore.core.retry.LimitedErrorCountRetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static io.rowstore.client.FakeDataClient.sample;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SampleRowKeys retries over a scripted DataClient:
 *  - samples from a broken attempt never leak into the result;
 *  - permanent errors and an exhausted budget surface as RowStoreException.
 */
class TableSampleRowKeysTest {

    private static Table table(FakeDataClient client, int maxFailures) {
        return new Table(client, "t", ClientOptions.defaults()
                .withRetryPolicy(new LimitedErrorCountRetryPolicy(maxFailures))
                .withBackoffPolicy(new ExponentialBackoffPolicy(Duration.ZERO, Duration.ofMillis(1))));
    }

    @Test
    void clean_stream_returns_samples_in_order() {
        var client = new FakeDataClient().onSampleRowKeys(Status.OK, sample("m", 100), sample("", 250));

        List<RowKeySample> samples = table(client, 3).sampleRowKeys();

        assertEquals(List.of(
                new RowKeySample(RowKeys.of("m"), 100),
                new RowKeySample(ByteString.EMPTY, 250)), samples);
        assertEquals("t", client.sampleRowKeysRequests.get(0).getTableName());
    }

    @Test
    void retry_discards_samples_of_the_broken_attempt() {
        var client = new FakeDataClient()
                .onSampleRowKeys(Status.UNAVAILABLE, sample("stale", 10))
                .onSampleRowKeys(Status.OK, sample("fresh", 20), sample("", 40));

        List<RowKeySample> samples = table(client, 3).sampleRowKeys();

        assertEquals(List.of("fresh", ""), samples.stream().map(s -> s.rowKey().toStringUtf8()).toList());
        assertEquals(2, client.sampleRowKeysRequests.size());
        assertTrue(client.streams.get(0).cancelled);
    }

    @Test
    void too_many_failures_throw_the_last_status() {
        var client = new FakeDataClient()
                .onSampleRowKeys(Status.UNAVAILABLE, sample("a", 1))
                .onSampleRowKeys(Status.UNAVAILABLE)
                .onSampleRowKeys(Status.DEADLINE_EXCEEDED);

        var ex = assertThrows(RowStoreException.class, () -> table(client, 2).sampleRowKeys());

        assertEquals(Status.Code.DEADLINE_EXCEEDED, ex.code());
        assertEquals(3, client.sampleRowKeysRequests.size());
    }

    @Test
    void permanent_error_is_not_retried() {
        var client = new FakeDataClient().onSampleRowKeys(Status.PERMISSION_DENIED);

        var ex = assertThrows(RowStoreException.class, () -> table(client, 5).sampleRowKeys());

        assertEquals(Status.Code.PERMISSION_DENIED, ex.code());
        assertEquals(1, client.sampleRowKeysRequests.size());
    }
}
