package org.opwire.client;

import java.io.PrintStream;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.bson.BsonDocument;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.opwire.obs.JsonLinesLogger;
import org.opwire.obs.StructuredJsonLinesLogger;
import org.opwire.wire.QueryOption;

/**
 * Command-line entry point that runs one OP_QUERY and prints the returned documents, one relaxed JSON object per
 * stdout line.
 *
 * <p>Failures are reported as a single stderr line: {@code OPWIRE_QUERY_FAILURE=<message>}.
 */
public final class WireClientLauncher {
    private static final String FAILURE_PREFIX = "OPWIRE_QUERY_FAILURE=";
    private static final JsonWriterSettings JSON_SETTINGS =
            JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build();

    private WireClientLauncher() {}

    public static void main(final String[] args) {
        final int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(final String[] args, final PrintStream out, final PrintStream err) {
        final LaunchConfig config;
        try {
            config = LaunchConfig.parse(args, err);
        } catch (final IllegalArgumentException invalidArgument) {
            err.println(FAILURE_PREFIX + invalidArgument.getMessage());
            return 2;
        }

        try (Connection connection = Connection.connect(config.settings())) {
            final List<BsonDocument> documents = connection.query(
                    config.collection(),
                    config.options(),
                    config.skip(),
                    config.limit(),
                    config.selector(),
                    config.fields());
            for (final BsonDocument document : documents) {
                out.println(document.toJson(JSON_SETTINGS));
            }
            out.flush();
            return 0;
        } catch (final RuntimeException failure) {
            err.println(FAILURE_PREFIX + failure.getMessage());
            return 1;
        } finally {
            config.settings().logger().close();
        }
    }

    record LaunchConfig(
            ConnectionSettings settings,
            String collection,
            BsonDocument selector,
            BsonDocument fields,
            Set<QueryOption> options,
            int skip,
            int limit) {
        static LaunchConfig parse(final String[] args, final PrintStream logStream) {
            final ConnectionSettings.Builder settings = ConnectionSettings.builder();
            String collection = null;
            BsonDocument selector = new BsonDocument();
            BsonDocument fields = null;
            final Set<QueryOption> options = EnumSet.noneOf(QueryOption.class);
            int skip = 0;
            int limit = 0;

            for (final String arg : args) {
                if (arg == null || arg.isBlank()) {
                    continue;
                }
                if (arg.startsWith("--host=")) {
                    settings.host(ConnectionSettings.requireValue(arg, "--host="));
                    continue;
                }
                if (arg.startsWith("--port=")) {
                    settings.port(ConnectionSettings.parsePort(ConnectionSettings.requireValue(arg, "--port=")));
                    continue;
                }
                if (arg.startsWith("--collection=")) {
                    collection = ConnectionSettings.requireValue(arg, "--collection=");
                    continue;
                }
                if (arg.startsWith("--selector=")) {
                    selector = parseDocument(ConnectionSettings.requireValue(arg, "--selector="), "--selector=");
                    continue;
                }
                if (arg.startsWith("--fields=")) {
                    fields = parseDocument(ConnectionSettings.requireValue(arg, "--fields="), "--fields=");
                    continue;
                }
                if (arg.startsWith("--skip=")) {
                    skip = parseInt(ConnectionSettings.requireValue(arg, "--skip="), "--skip=");
                    continue;
                }
                if (arg.startsWith("--limit=")) {
                    limit = parseInt(ConnectionSettings.requireValue(arg, "--limit="), "--limit=");
                    continue;
                }
                if (arg.equals("--slave-ok")) {
                    options.add(QueryOption.SLAVE_OK);
                    continue;
                }
                if (arg.equals("--no-cursor-timeout")) {
                    options.add(QueryOption.NO_CURSOR_TIMEOUT);
                    continue;
                }
                if (arg.startsWith("--log=")) {
                    settings.logger(parseLogger(ConnectionSettings.requireValue(arg, "--log="), logStream));
                    continue;
                }
                throw new IllegalArgumentException("unsupported argument: " + arg);
            }

            if (collection == null) {
                throw new IllegalArgumentException("--collection= is required");
            }
            return new LaunchConfig(settings.build(), collection, selector, fields, Set.copyOf(options), skip, limit);
        }

        private static BsonDocument parseDocument(final String json, final String prefix) {
            try {
                return BsonDocument.parse(json);
            } catch (final RuntimeException invalidJson) {
                throw new IllegalArgumentException("invalid JSON document for " + prefix + " " + json, invalidJson);
            }
        }

        private static int parseInt(final String value, final String prefix) {
            try {
                return Integer.parseInt(value);
            } catch (final NumberFormatException numberFormatException) {
                throw new IllegalArgumentException("invalid integer for " + prefix + " " + value, numberFormatException);
            }
        }

        private static JsonLinesLogger parseLogger(final String value, final PrintStream logStream) {
            if (value.equals("none")) {
                return JsonLinesLogger.discarding();
            }
            if (value.equals("stderr")) {
                return new StructuredJsonLinesLogger(logStream, "INFO");
            }
            if (value.equals("stderr-debug")) {
                return new StructuredJsonLinesLogger(logStream, "DEBUG");
            }
            throw new IllegalArgumentException("unsupported --log= value: " + value);
        }
    }
}
