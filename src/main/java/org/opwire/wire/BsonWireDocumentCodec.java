package org.opwire.wire;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;
import org.bson.BSONException;
import org.bson.BsonBinaryReader;
import org.bson.BsonBinaryWriter;
import org.bson.BsonDocument;
import org.bson.codecs.BsonDocumentCodec;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.EncoderContext;
import org.bson.io.BasicOutputBuffer;

/**
 * {@link WireDocumentCodec} backed by the BSON library. Documents are decoded eagerly, so a malformed element is
 * reported by {@link #decode} rather than on first access.
 */
public final class BsonWireDocumentCodec implements WireDocumentCodec {
    private static final int MIN_DOCUMENT_LENGTH = 5;

    private final BsonDocumentCodec documentCodec = new BsonDocumentCodec();

    @Override
    public byte[] encode(final BsonDocument document) {
        Objects.requireNonNull(document, "document");
        final BasicOutputBuffer outputBuffer = new BasicOutputBuffer();
        try (BsonBinaryWriter writer = new BsonBinaryWriter(outputBuffer)) {
            documentCodec.encode(writer, document, EncoderContext.builder().isEncodingCollectibleDocument(true).build());
        }
        return outputBuffer.toByteArray();
    }

    @Override
    public DecodedDocument decode(final byte[] source, final int offset, final int limit) {
        Objects.requireNonNull(source, "source");
        if (offset < 0 || limit > source.length || offset > limit) {
            throw new IllegalArgumentException("invalid document bounds offset=" + offset + " limit=" + limit);
        }
        if (offset + Integer.BYTES > limit) {
            throw new IllegalArgumentException("Missing BSON document length.");
        }

        final int documentLength = ByteBuffer.wrap(source, offset, Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN).getInt();
        if (documentLength < MIN_DOCUMENT_LENGTH) {
            throw new IllegalArgumentException("Invalid BSON document length: " + documentLength);
        }
        if (documentLength > limit - offset) {
            throw new IllegalArgumentException("Declared BSON document length exceeds available bytes.");
        }
        if (source[offset + documentLength - 1] != 0) {
            throw new IllegalArgumentException("BSON document is not terminated by a zero byte.");
        }

        final byte[] documentBytes = Arrays.copyOfRange(source, offset, offset + documentLength);
        try (BsonBinaryReader reader = new BsonBinaryReader(ByteBuffer.wrap(documentBytes))) {
            final BsonDocument document = documentCodec.decode(reader, DecoderContext.builder().build());
            return new DecodedDocument(document, documentLength);
        } catch (final BSONException malformed) {
            throw new IllegalArgumentException("Malformed BSON document: " + malformed.getMessage(), malformed);
        }
    }
}
