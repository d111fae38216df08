package org.opwire.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.junit.jupiter.api.Test;
import org.opwire.obs.StructuredJsonLinesLogger;
import org.opwire.wire.MessageHeader;
import org.opwire.wire.OpReply;
import org.opwire.wire.OpReplyCodec;
import org.opwire.wire.Opcode;
import org.opwire.wire.ProtocolViolation;
import org.opwire.wire.ReplyFixtures;
import org.opwire.wire.WireProtocolException;

class ConnectionLoopbackTest {
    private static final BsonDocument ALICE = BsonDocument.parse("{\"_id\": 1, \"name\": \"alice\"}");
    private static final BsonDocument BOB = BsonDocument.parse("{\"_id\": 2, \"name\": \"bob\"}");

    @Test
    void insertsThenQueriesOverTcp() throws Exception {
        try (LoopbackWireServer server = LoopbackWireServer.answering(List.of(ALICE, BOB));
                Connection connection = Connection.connect(server.host(), server.port())) {
            final int insertId = connection.insertMany("app.users", List.of(ALICE, BOB));
            final List<BsonDocument> found = connection.query("app.users", Set.of(), 0, 10, new BsonDocument());

            final MessageHeader insert = MessageHeader.decode(server.nextRequest());
            assertEquals(Opcode.INSERT, insert.opcode());
            assertEquals(insertId, insert.requestId());

            final MessageHeader query = MessageHeader.decode(server.nextRequest());
            assertEquals(Opcode.QUERY, query.opcode());
            assertEquals(List.of(ALICE, BOB), found);
            assertEquals(server.host() + ":" + server.port(), connection.endpoint());
        }
    }

    @Test
    void sequentialQueriesEachReadTheirOwnReply() throws Exception {
        final OpReplyCodec codec = new OpReplyCodec();
        try (LoopbackWireServer server = LoopbackWireServer.answering(header -> codec.encode(
                        new OpReply(1, header.requestId(), 0, 0L, 0,
                                List.of(new BsonDocument("requestId", new BsonInt32(header.requestId()))))));
                Connection connection = Connection.connect(server.host(), server.port())) {
            for (int round = 0; round < 5; round++) {
                final List<BsonDocument> reply = connection.query("app.users", Set.of(), 0, 1, new BsonDocument());
                final MessageHeader sent = MessageHeader.decode(server.nextRequest());
                assertEquals(sent.requestId(), reply.get(0).getInt32("requestId").getValue());
            }
        }
    }

    @Test
    void serverAnsweringTheWrongRequestIsRejected() throws Exception {
        try (LoopbackWireServer server = LoopbackWireServer.answering(
                        header -> ReplyFixtures.reply(header.requestId() ^ 1, ALICE));
                Connection connection = Connection.connect(server.host(), server.port())) {
            final WireProtocolException failure = assertThrows(
                    WireProtocolException.class,
                    () -> connection.query("app.users", Set.of(), 0, 1, new BsonDocument()));
            assertEquals(ProtocolViolation.RESPONSE_TO_MISMATCH, failure.violation());
        }
    }

    @Test
    void refusedConnectionIsReportedWithEndpoint() throws IOException {
        final int port;
        try (ServerSocket released = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = released.getLocalPort();
        }

        final ConnectionEstablishmentException failure = assertThrows(
                ConnectionEstablishmentException.class, () -> Connection.connect("127.0.0.1", port));
        assertEquals("127.0.0.1", failure.host());
        assertEquals(port, failure.port());
    }

    @Test
    void closeFromAnotherThreadUnblocksAPendingQuery() throws Exception {
        final ExecutorService caller = Executors.newSingleThreadExecutor();
        try (LoopbackWireServer server = LoopbackWireServer.answering(header -> new byte[0]);
                Connection connection = Connection.connect(server.host(), server.port())) {
            final Future<List<BsonDocument>> pending =
                    caller.submit(() -> connection.query("app.users", Set.of(), 0, 1, new BsonDocument()));
            server.nextRequest();

            connection.close();

            final ExecutionException failure =
                    assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
            assertInstanceOf(UncheckedIOException.class, failure.getCause());
            assertFalse(connection.isUsable());
            assertTrue(server.awaitDisconnect());
        } finally {
            caller.shutdownNow();
        }
    }

    @Test
    void socketIsReleasedWhenTheOpenEventCannotBeLogged() throws Exception {
        final StructuredJsonLinesLogger closedLogger = new StructuredJsonLinesLogger(new ByteArrayOutputStream());
        closedLogger.close();

        try (LoopbackWireServer server = LoopbackWireServer.answering(List.of())) {
            final ConnectionSettings settings = ConnectionSettings.builder()
                    .host(server.host())
                    .port(server.port())
                    .logger(closedLogger)
                    .build();

            assertThrows(IllegalStateException.class, () -> Connection.connect(settings));
            assertTrue(server.awaitDisconnect());
        }
    }
}
