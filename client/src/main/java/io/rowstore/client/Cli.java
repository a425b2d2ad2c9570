// file: client/src/main/java/io/rowstore/client/Cli.java
package io.rowstore.client;

import io.rowstore.core.BulkMutation;
import io.rowstore.core.Cell;
import io.rowstore.core.ConditionalRowMutation;
import io.rowstore.core.FailedMutation;
import io.rowstore.core.Filter;
import io.rowstore.core.Mutation;
import io.rowstore.core.Row;
import io.rowstore.core.RowKeyRange;
import io.rowstore.core.RowKeySample;
import io.rowstore.core.RowKeySet;
import io.rowstore.core.RowKeys;
import io.rowstore.core.RowStoreException;
import io.rowstore.core.SingleRowMutation;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Simple CLI for interacting with a RowStore server or emulator over gRPC.
 *
 * Usage:
 *   rowstore-cli [options] set <row> <family> <qualifier> <value>
 *   rowstore-cli [options] set-if-absent <row> <family> <qualifier> <value>
 *   rowstore-cli [options] get <row>
 *   rowstore-cli [options] delete <row>
 *   rowstore-cli [options] scan [<start> [<end>]]
 *   rowstore-cli [options] bulk-set <family> <qualifier> <row>=<value>...
 *   rowstore-cli [options] sample
 *
 * Options:
 *   --host <host>     (default: localhost)
 *   --port <port>     (default: 8086)
 *   --table <name>    (default: default)
 *   --config <path>   JSON client options
 *   --limit <n>       rows limit for scan
 *
 * Examples:
 *   rowstore-cli set user#1 info name alice
 *   rowstore-cli scan user# user$
 */
public final class Cli {

    private static final String DEFAULT_HOST = "localhost";
    private static final int DEFAULT_PORT = 8086;
    private static final String DEFAULT_TABLE = "default";

    private final Table table;
    private final PrintStream out;

    Cli(Table table, PrintStream out) {
        this.table = table;
        this.out = out;
    }

    /** Parsed global options plus the remaining command words. */
    record Invocation(String host, int port, String table, Path config, long limit, String[] command) {}

    public static void main(String[] args) {
        try {
            Invocation inv = parse(args);
            if (inv.command().length == 0) {
                usageAndExit("missing command");
            }
            ClientOptions options = inv.config() == null
                    ? ClientOptions.defaults()
                    : ClientOptions.fromJsonFile(inv.config());

            try (GrpcDataClient client = GrpcDataClient.forAddress(inv.host(), inv.port())) {
                new Cli(new Table(client, inv.table(), options), System.out).run(inv.command(), inv.limit());
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (RowStoreException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Invocation parse(String[] args) {
        String host = DEFAULT_HOST;
        int port = DEFAULT_PORT;
        String tableName = DEFAULT_TABLE;
        Path config = null;
        long limit = 0;

        int i = 0;
        while (i < args.length && args[i].startsWith("--")) {
            String flag = args[i];
            if (i + 1 >= args.length) {
                throw new CliException(flag + " requires a value");
            }
            String value = args[i + 1];
            switch (flag) {
                case "--host" -> host = value;
                case "--port" -> port = parseNumber(flag, value).intValue();
                case "--table" -> tableName = value;
                case "--config" -> config = Path.of(value);
                case "--limit" -> limit = parseNumber(flag, value);
                default -> throw new CliException("unknown option: " + flag);
            }
            i += 2;
        }
        return new Invocation(host, port, tableName, config, limit, Arrays.copyOfRange(args, i, args.length));
    }

    private static Long parseNumber(String flag, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new CliException(flag + " expects a number, got " + value);
        }
    }

    void run(String[] rest, long limit) {
        String cmd = rest[0];
        switch (cmd) {
            case "set" -> {
                if (rest.length != 5) {
                    throw new CliException("set requires <row> <family> <qualifier> <value>");
                }
                set(rest[1], rest[2], rest[3], rest[4]);
            }
            case "set-if-absent" -> {
                if (rest.length != 5) {
                    throw new CliException("set-if-absent requires <row> <family> <qualifier> <value>");
                }
                setIfAbsent(rest[1], rest[2], rest[3], rest[4]);
            }
            case "get" -> {
                if (rest.length != 2) {
                    throw new CliException("get requires <row>");
                }
                get(rest[1]);
            }
            case "delete" -> {
                if (rest.length != 2) {
                    throw new CliException("delete requires <row>");
                }
                delete(rest[1]);
            }
            case "scan" -> {
                if (rest.length > 3) {
                    throw new CliException("scan takes at most <start> <end>");
                }
                scan(rest.length > 1 ? rest[1] : null, rest.length > 2 ? rest[2] : null, limit);
            }
            case "bulk-set" -> {
                if (rest.length < 4) {
                    throw new CliException("bulk-set requires <family> <qualifier> <row>=<value>...");
                }
                bulkSet(rest[1], rest[2], Arrays.copyOfRange(rest, 3, rest.length));
            }
            case "sample" -> {
                if (rest.length != 1) {
                    throw new CliException("sample takes no arguments");
                }
                sample();
            }
            default -> throw new CliException("unknown command: " + cmd);
        }
    }

    private void set(String row, String family, String qualifier, String value) {
        long micros = System.currentTimeMillis() * 1000L;
        table.apply(SingleRowMutation.of(row, Mutation.setCell(family, qualifier, micros, value)));
        out.println("OK");
    }

    private void setIfAbsent(String row, String family, String qualifier, String value) {
        long micros = System.currentTimeMillis() * 1000L;
        Filter exists = Filter.chain(Filter.family(family), Filter.column(qualifier));
        boolean present = table.checkAndMutateRow(ConditionalRowMutation.of(row, exists,
                List.of(),
                List.of(Mutation.setCell(family, qualifier, micros, value))));
        out.println(present ? "EXISTS" : "OK");
    }

    private void get(String row) {
        Optional<Row> r = table.readRow(row, Filter.latest(1));
        if (r.isEmpty()) {
            out.println("(not found)");
            return;
        }
        print(r.get());
    }

    private void delete(String row) {
        table.apply(SingleRowMutation.of(row, Mutation.deleteFromRow()));
        out.println("OK");
    }

    private void scan(String start, String end, long limit) {
        RowKeySet set;
        if (start == null) {
            set = RowKeySet.all();
        } else if (end == null) {
            set = RowKeySet.of(RowKeyRange.startingAt(RowKeys.of(start)));
        } else {
            set = RowKeySet.of(RowKeyRange.range(RowKeys.of(start), RowKeys.of(end)));
        }
        long n = 0;
        for (Row row : table.readRows(set, limit, Filter.latest(1))) {
            print(row);
            n++;
        }
        out.println("(" + n + " rows)");
    }

    private void bulkSet(String family, String qualifier, String[] pairs) {
        long micros = System.currentTimeMillis() * 1000L;
        List<SingleRowMutation> entries = new ArrayList<>();
        for (String pair : pairs) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new CliException("expected <row>=<value>, got " + pair);
            }
            entries.add(SingleRowMutation.of(pair.substring(0, eq),
                    Mutation.setCell(family, qualifier, micros, pair.substring(eq + 1))));
        }
        List<FailedMutation> failed = table.bulkApply(new BulkMutation(entries));
        for (FailedMutation f : failed) {
            out.printf("FAILED #%d %s: %s (%s)%n",
                    f.originalIndex(),
                    RowKeys.debugString(f.mutation().rowKey()),
                    f.status().getCode(),
                    f.cause());
        }
        out.println(failed.isEmpty() ? "OK" : failed.size() + " of " + entries.size() + " failed");
    }

    private void sample() {
        for (RowKeySample s : table.sampleRowKeys()) {
            out.printf("%s %d%n", s.isTableEnd() ? "(end)" : RowKeys.debugString(s.rowKey()), s.offsetBytes());
        }
    }

    private void print(Row row) {
        for (Cell c : row.cells()) {
            out.printf("%s %s:%s @%d = %s%n",
                    RowKeys.debugString(row.rowKey()),
                    c.family(),
                    RowKeys.debugString(c.qualifier()),
                    c.timestampMicros(),
                    RowKeys.debugString(c.value()));
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  rowstore-cli [options] set <row> <family> <qualifier> <value>
                  rowstore-cli [options] set-if-absent <row> <family> <qualifier> <value>
                  rowstore-cli [options] get <row>
                  rowstore-cli [options] delete <row>
                  rowstore-cli [options] scan [<start> [<end>]]
                  rowstore-cli [options] bulk-set <family> <qualifier> <row>=<value>...
                  rowstore-cli [options] sample

                Options:
                  --host <host>   --port <port>   --table <name>   --config <path>   --limit <n>
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
