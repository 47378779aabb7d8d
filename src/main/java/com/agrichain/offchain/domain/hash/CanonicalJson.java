package com.agrichain.offchain.domain.hash;

import com.agrichain.offchain.domain.error.SerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;


/**
 * Canonical JSON rendering used for stored records and commit-reveal.  Record
 * properties keep their declared order, map keys (free-form JSON such as model
 * features) are sorted, timestamps are ISO-8601 strings and no whitespace is
 * emitted.  The mapper is private so HTTP-side customisations cannot change a
 * committed byte sequence.
 */
public final class CanonicalJson {

    private final ObjectMapper mapper;

    public CanonicalJson() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public byte[] toBytes(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("cannot canonicalize " + typeOf(value), e);
        }
    }

    public JsonNode toTree(Object value) {
        try {
            return mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("cannot canonicalize " + typeOf(value), e);
        }
    }

    public ObjectNode newObject() {
        return mapper.createObjectNode();
    }

    /**
     * Parses stored bytes back into a JSON tree.
     *
     * @throws IOException if the bytes are not JSON
     */
    public JsonNode parse(byte[] json) throws IOException {
        return mapper.readTree(json);
    }

    private static String typeOf(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
