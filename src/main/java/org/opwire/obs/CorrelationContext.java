package org.opwire.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlation metadata emitted with every structured log event.
 *
 * <p>The endpoint is always present; request-scoped events add the wire request id, the opcode and, when known, the
 * collection and the id a reply answered.
 */
public final class CorrelationContext {
    private final String endpoint;
    private final Integer requestId;
    private final String opcode;
    private final String collection;
    private final Integer responseTo;

    private CorrelationContext(Builder builder) {
        this.endpoint = requireText(builder.endpoint, "endpoint");
        this.requestId = builder.requestId;
        this.opcode = normalize(builder.opcode);
        this.collection = normalize(builder.collection);
        this.responseTo = builder.responseTo;
    }

    public static CorrelationContext of(String endpoint) {
        return builder(endpoint).build();
    }

    public static Builder builder(String endpoint) {
        return new Builder(endpoint);
    }

    public String endpoint() {
        return endpoint;
    }

    public Optional<Integer> requestId() {
        return Optional.ofNullable(requestId);
    }

    public Optional<String> opcode() {
        return Optional.ofNullable(opcode);
    }

    public Optional<String> collection() {
        return Optional.ofNullable(collection);
    }

    public Optional<Integer> responseTo() {
        return Optional.ofNullable(responseTo);
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("endpoint", endpoint);
        if (requestId != null) {
            fields.put("requestId", requestId);
        }
        if (opcode != null) {
            fields.put("opcode", opcode);
        }
        if (collection != null) {
            fields.put("collection", collection);
        }
        if (responseTo != null) {
            fields.put("responseTo", responseTo);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String endpoint;
        private Integer requestId;
        private String opcode;
        private String collection;
        private Integer responseTo;

        private Builder(String endpoint) {
            this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        }

        public Builder requestId(Integer requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder opcode(String opcode) {
            this.opcode = opcode;
            return this;
        }

        public Builder collection(String collection) {
            this.collection = collection;
            return this;
        }

        public Builder responseTo(Integer responseTo) {
            this.responseTo = responseTo;
            return this;
        }

        public CorrelationContext build() {
            return new CorrelationContext(this);
        }
    }
}
