package de.leipzig.htwk.gitrdf.fixstrategy.repository;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.DenseVector;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.SparseVector;

/**
 * Column formats of the attempt log.
 *
 * Dense vectors are raw little-endian float32 bytes. Sparse vectors are a small JSON
 * document that names its own format and width. Timestamps are fixed-width UTC text so
 * that lexical order in SQL equals time order.
 */
class EmbeddingCodec {

    static final String SPARSE_FORMAT = "sparse-v1";

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;

    EmbeddingCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    byte[] encodeDense(DenseVector vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.dimensions() * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < vector.dimensions(); i++) {
            buffer.putFloat(vector.get(i));
        }
        return buffer.array();
    }

    DenseVector decodeDense(byte[] bytes) {
        if (bytes == null || bytes.length == 0 || bytes.length % Float.BYTES != 0) {
            throw new IllegalArgumentException("Dense embedding blob has invalid length "
                + (bytes == null ? "null" : bytes.length));
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] values = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < values.length; i++) {
            values[i] = buffer.getFloat();
        }
        return new DenseVector(values);
    }

    String encodeSparse(SparseVector vector) {
        try {
            return objectMapper.writeValueAsString(
                new SparsePayload(SPARSE_FORMAT, vector.width(), vector.indices(), vector.values()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize sparse embedding", e);
        }
    }

    SparseVector decodeSparse(String json) {
        SparsePayload payload;
        try {
            payload = objectMapper.readValue(json, SparsePayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Sparse embedding column is not valid JSON", e);
        }
        if (!SPARSE_FORMAT.equals(payload.format())) {
            throw new IllegalArgumentException("Unknown sparse embedding format: " + payload.format());
        }
        return new SparseVector(payload.width(), payload.indices(), payload.values());
    }

    static String formatTimestamp(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant);
    }

    /**
     * Read a stored timestamp. Values without a zone are taken as UTC.
     *
     * @throws IllegalArgumentException when the text is not an ISO-8601 date-time
     */
    static Instant parseTimestamp(String text) {
        if (text == null) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException zoneless) {
                throw new IllegalArgumentException("Unreadable timestamp '" + text + "'", zoneless);
            }
        }
    }

    record SparsePayload(String format, int width, int[] indices, float[] values) {
    }
}
