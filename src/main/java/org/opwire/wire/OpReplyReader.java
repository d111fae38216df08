package org.opwire.wire;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import org.bson.BsonDocument;

/**
 * Reads one OP_REPLY from a blocking stream: header, reply block, then the document region.
 *
 * <p>Each stage is validated before the next one is read. Exactly {@code messageLength} bytes are consumed on success;
 * after a failure the stream position is undefined.
 */
public final class OpReplyReader {
    private final OpReplyCodec codec;

    public OpReplyReader() {
        this(new OpReplyCodec());
    }

    public OpReplyReader(final OpReplyCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public OpReply read(final InputStream input, final int expectedResponseTo) throws IOException {
        Objects.requireNonNull(input, "input");

        final MessageHeader header = MessageHeader.decode(readExactly(input, MessageHeader.LENGTH, "message header"));
        codec.validateHeader(header);
        codec.validateCorrelation(header, expectedResponseTo);

        final ReplyHeader replyHeader = codec.decodeReplyHeader(readExactly(input, ReplyHeader.LENGTH, "reply header"));

        final byte[] region = readExactly(input, OpReplyCodec.documentRegionLength(header), "reply documents");
        final List<BsonDocument> documents = codec.decodeDocuments(region, replyHeader);
        return OpReplyCodec.toReply(header, replyHeader, documents);
    }

    private static byte[] readExactly(final InputStream input, final int length, final String stage) throws IOException {
        final byte[] target = new byte[length];
        int total = 0;
        while (total < length) {
            final int read = input.read(target, total, length - total);
            if (read == -1) {
                throw new EOFException(
                        "stream ended while reading " + stage + ": " + total + " of " + length + " bytes");
            }
            total += read;
        }
        return target;
    }
}
