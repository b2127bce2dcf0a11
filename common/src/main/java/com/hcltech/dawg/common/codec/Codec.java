package com.hcltech.dawg.common.codec;

import com.hcltech.dawg.common.errorsor.ErrorsOr;

import java.util.List;

public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);

    static Codec<String, String> identity() {
        return new Codec<>() {
            @Override
            public ErrorsOr<String> encode(String s) {
                return ErrorsOr.lift(s);
            }

            @Override
            public ErrorsOr<String> decode(String s) {
                return ErrorsOr.lift(s);
            }
        };
    }

    static <T> Codec<List<T>, String> lines(Codec<T, String> itemCodec) {
        return new LineSeparatedListCodec<>(itemCodec);
    }
}
