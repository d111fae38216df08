package org.opwire.client;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.bson.BsonDocument;
import org.opwire.obs.CorrelationContext;
import org.opwire.obs.JsonLinesLogger;
import org.opwire.wire.BsonWireDocumentCodec;
import org.opwire.wire.LegacyMessage;
import org.opwire.wire.LegacyMessageEncoder;
import org.opwire.wire.MessageHeader;
import org.opwire.wire.OpReply;
import org.opwire.wire.OpReplyCodec;
import org.opwire.wire.OpReplyReader;
import org.opwire.wire.Opcode;
import org.opwire.wire.QueryOption;
import org.opwire.wire.UpdateFlag;
import org.opwire.wire.WireDocumentCodec;
import org.opwire.wire.WireProtocolException;

/**
 * A client session over one duplex byte stream speaking the legacy OP_INSERT / OP_UPDATE / OP_DELETE / OP_QUERY
 * protocol.
 *
 * <p>Write operations frame a message, send it and return its request id without waiting for any acknowledgement.
 * {@link #query} sends an OP_QUERY and blocks until the matching OP_REPLY has been read and validated.
 *
 * <p>Only one request is in flight at a time: every operation holds the connection's monitor for its whole send (and,
 * for queries, receive) so concurrent callers are serialised. Replies are not demultiplexed. After a transport or
 * protocol failure the connection is marked broken and rejects further use; open a new one.
 *
 * <p>{@link #close} does not take the monitor, so another thread can close a connection whose query is blocked on a
 * read. The blocked query then fails with an {@link UncheckedIOException}.
 */
public final class Connection implements AutoCloseable {
    private final AutoCloseable resource;
    private final InputStream input;
    private final OutputStream output;
    private final RequestIdGenerator requestIds;
    private final LegacyMessageEncoder encoder;
    private final OpReplyReader replyReader;
    private final JsonLinesLogger logger;
    private final String endpoint;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean broken;

    /**
     * Creates a connection over an already connected stream pair. Closing the connection closes both streams.
     */
    public Connection(final InputStream input, final OutputStream output) {
        this(input, output, new RequestIdGenerator(), new BsonWireDocumentCodec(), JsonLinesLogger.discarding());
    }

    public Connection(
            final InputStream input,
            final OutputStream output,
            final RequestIdGenerator requestIds,
            final WireDocumentCodec documentCodec,
            final JsonLinesLogger logger) {
        this(() -> closeBoth(input, output), input, output, requestIds, documentCodec, logger, "stream");
    }

    private Connection(
            final AutoCloseable resource,
            final InputStream input,
            final OutputStream output,
            final RequestIdGenerator requestIds,
            final WireDocumentCodec documentCodec,
            final JsonLinesLogger logger,
            final String endpoint) {
        Objects.requireNonNull(documentCodec, "documentCodec");
        this.resource = Objects.requireNonNull(resource, "resource");
        this.input = Objects.requireNonNull(input, "input");
        this.output = Objects.requireNonNull(output, "output");
        this.requestIds = Objects.requireNonNull(requestIds, "requestIds");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.endpoint = endpoint;
        this.encoder = new LegacyMessageEncoder(documentCodec);
        this.replyReader = new OpReplyReader(new OpReplyCodec(documentCodec));
    }

    public static Connection connect(final String host) {
        return connect(ConnectionSettings.of(host, ConnectionSettings.DEFAULT_PORT));
    }

    public static Connection connect(final String host, final int port) {
        return connect(ConnectionSettings.of(host, port));
    }

    /**
     * Opens a TCP connection.
     *
     * @throws ConnectionEstablishmentException if the host cannot be resolved or the connection is refused
     */
    public static Connection connect(final ConnectionSettings settings) {
        Objects.requireNonNull(settings, "settings");
        final Socket socket = new Socket();
        final Connection connection;
        try {
            socket.connect(new InetSocketAddress(settings.host(), settings.port()));
            socket.setTcpNoDelay(settings.tcpNoDelay());
            connection = new Connection(
                    socket,
                    new BufferedInputStream(socket.getInputStream()),
                    new BufferedOutputStream(socket.getOutputStream()),
                    new RequestIdGenerator(),
                    new BsonWireDocumentCodec(),
                    settings.logger(),
                    settings.host() + ":" + settings.port());
        } catch (final IOException ioException) {
            closeQuietly(socket, ioException);
            throw new ConnectionEstablishmentException(settings.host(), settings.port(), ioException);
        } catch (final RuntimeException failure) {
            closeQuietly(socket, failure);
            throw failure;
        }

        try {
            connection.logger.info("connection opened", CorrelationContext.of(connection.endpoint));
        } catch (final RuntimeException loggingFailure) {
            closeQuietly(socket, loggingFailure);
            throw loggingFailure;
        }
        return connection;
    }

    public String endpoint() {
        return endpoint;
    }

    public boolean isUsable() {
        return !closed.get() && !broken;
    }

    public synchronized int delete(final String collection, final BsonDocument selector) {
        return send(Opcode.DELETE, collection, encoder.deleteBody(collection, selector));
    }

    /**
     * Same as {@link #delete}.
     */
    public int remove(final String collection, final BsonDocument selector) {
        return delete(collection, selector);
    }

    public synchronized int insert(final String collection, final BsonDocument document) {
        return send(Opcode.INSERT, collection, encoder.insertBody(collection, document));
    }

    /**
     * Sends every document in one OP_INSERT. The caller is responsible for staying under the server's message size
     * limit.
     */
    public synchronized int insertMany(final String collection, final List<BsonDocument> documents) {
        return send(Opcode.INSERT, collection, encoder.insertManyBody(collection, documents));
    }

    public synchronized int update(
            final String collection,
            final Set<UpdateFlag> flags,
            final BsonDocument selector,
            final BsonDocument update) {
        return send(Opcode.UPDATE, collection, encoder.updateBody(collection, flags, selector, update));
    }

    public List<BsonDocument> query(
            final String collection,
            final Set<QueryOption> options,
            final int numberToSkip,
            final int numberToReturn,
            final BsonDocument selector) {
        return query(collection, options, numberToSkip, numberToReturn, selector, null);
    }

    /**
     * Sends an OP_QUERY and returns the documents of the first reply batch in wire order.
     *
     * @param fieldSelector projection, or {@code null} to return whole documents
     * @throws WireProtocolException if the reply breaks framing or correlation
     * @throws UncheckedIOException if the stream fails or ends early
     */
    public synchronized List<BsonDocument> query(
            final String collection,
            final Set<QueryOption> options,
            final int numberToSkip,
            final int numberToReturn,
            final BsonDocument selector,
            final BsonDocument fieldSelector) {
        final byte[] body = encoder.queryBody(collection, options, numberToSkip, numberToReturn, selector, fieldSelector);
        final int requestId = send(Opcode.QUERY, collection, body);
        // A rejected reply carries its observed responseTo in the exception, not in this context.
        final CorrelationContext context = CorrelationContext.builder(endpoint)
                .requestId(requestId)
                .opcode(Opcode.REPLY.name())
                .collection(collection)
                .build();

        final OpReply reply;
        try {
            reply = replyReader.read(input, requestId);
        } catch (final IOException ioException) {
            broken = true;
            logger.error("reply read failed", context, Map.of("error", String.valueOf(ioException.getMessage())));
            throw new UncheckedIOException(
                    "failed to read reply for requestId=" + requestId + " from " + endpoint, ioException);
        } catch (final WireProtocolException protocolException) {
            broken = true;
            logger.error("reply rejected", context, Map.of(
                    "violation", protocolException.violation().name(),
                    "expected", protocolException.expected(),
                    "observed", protocolException.observed()));
            throw protocolException;
        } catch (final IllegalArgumentException malformedReply) {
            broken = true;
            logger.error("reply rejected", context, Map.of("error", String.valueOf(malformedReply.getMessage())));
            throw malformedReply;
        }

        if (logger.isEnabled("DEBUG")) {
            final CorrelationContext accepted = CorrelationContext.builder(endpoint)
                    .requestId(reply.requestId())
                    .opcode(Opcode.REPLY.name())
                    .collection(collection)
                    .responseTo(reply.responseTo())
                    .build();
            logger.debug("reply received", accepted, Map.of(
                    "numberReturned", reply.numberReturned(),
                    "cursorId", reply.cursorId(),
                    "startingFrom", reply.startingFrom()));
        }
        return reply.documents();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            resource.close();
        } catch (final Exception exception) {
            throw new IllegalStateException("failed to close connection to " + endpoint, exception);
        } finally {
            logger.info("connection closed", CorrelationContext.of(endpoint));
        }
    }

    private int send(final Opcode opcode, final String collection, final byte[] body) {
        ensureUsable();
        final int requestId = requestIds.next();
        final LegacyMessage message = encoder.frame(requestId, opcode, body);
        final CorrelationContext context = CorrelationContext.builder(endpoint)
                .requestId(requestId)
                .opcode(opcode.name())
                .collection(collection)
                .build();
        try {
            output.write(message.bytes());
            output.flush();
        } catch (final IOException ioException) {
            broken = true;
            logger.error("message send failed", context, Map.of("error", String.valueOf(ioException.getMessage())));
            throw new UncheckedIOException(
                    "failed to send " + opcode + " requestId=" + requestId + " to " + endpoint, ioException);
        }
        if (logger.isEnabled("DEBUG")) {
            logger.debug("message sent", context, sentFields(message, collection));
        }
        return requestId;
    }

    /**
     * Flag words are read back from the framed bytes so the log shows what actually went out.
     */
    private static Map<String, Object> sentFields(final LegacyMessage message, final String collection) {
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("messageLength", message.messageLength());
        final ByteBuffer bytes = ByteBuffer.wrap(message.bytes()).order(ByteOrder.LITTLE_ENDIAN);
        if (message.opcode() == Opcode.QUERY) {
            fields.put("queryOptions", QueryOption.decode(bytes.getInt(MessageHeader.LENGTH)).toString());
        } else if (message.opcode() == Opcode.UPDATE) {
            final int flagsOffset = MessageHeader.LENGTH
                    + Integer.BYTES
                    + LegacyMessageEncoder.encodeCollectionName(collection).length;
            fields.put("updateFlags", UpdateFlag.decode(bytes.getInt(flagsOffset)).toString());
        }
        return fields;
    }

    private void ensureUsable() {
        if (closed.get()) {
            throw new IllegalStateException("connection to " + endpoint + " is closed");
        }
        if (broken) {
            throw new IllegalStateException(
                    "connection to " + endpoint + " failed earlier and must be replaced");
        }
    }

    private static void closeBoth(final InputStream input, final OutputStream output) throws IOException {
        try {
            output.close();
        } finally {
            input.close();
        }
    }

    private static void closeQuietly(final Socket socket, final Exception failure) {
        try {
            socket.close();
        } catch (final IOException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }
}
