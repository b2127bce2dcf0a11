package com.hcltech.dawg.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hcltech.dawg.common.errorsor.ErrorsOr;

import java.util.Objects;

public final class JacksonTypedJsonCodec<T> implements Codec<T, String> {
    private final ObjectMapper mapper;
    private final Class<T> klass;

    public JacksonTypedJsonCodec(Class<T> klass) {
        this(new ObjectMapper(), klass);
    }

    public JacksonTypedJsonCodec(ObjectMapper baseMapper, Class<T> klass) {
        this.mapper = Objects.requireNonNull(baseMapper).copy();
        this.mapper.findAndRegisterModules();
        this.klass = Objects.requireNonNull(klass);
    }

    /** Same codec, but encodes with line breaks and indentation. */
    public JacksonTypedJsonCodec<T> pretty() {
        ObjectMapper copy = mapper.copy();
        copy.enable(SerializationFeature.INDENT_OUTPUT);
        return new JacksonTypedJsonCodec<>(copy, klass);
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        try {
            return ErrorsOr.lift(mapper.writeValueAsString(value));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to encode to JSON: " + e.getMessage());
        }
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        try {
            return ErrorsOr.lift(mapper.readValue(json, klass));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to decode from JSON: " + e.getMessage());
        }
    }
}
