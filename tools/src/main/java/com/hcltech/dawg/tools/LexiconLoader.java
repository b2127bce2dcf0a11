package com.hcltech.dawg.tools;

import com.hcltech.dawg.common.codec.Codec;
import com.hcltech.dawg.common.codec.JacksonTypedJsonCodec;
import com.hcltech.dawg.common.errorsor.ErrorsOr;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads word lists in UTF-8. A lexicon whose name ends in {@code .json} holds a JSON array of strings; any other
 * lexicon holds one word per line, where lines starting with {@code #} are comments. Surrounding whitespace is
 * stripped and blank entries are skipped. Failures are returned as errors, never thrown.
 */
public final class LexiconLoader {
    private static final Codec<List<String>, String> LINES = Codec.lines(Codec.identity());
    private static final Codec<String[], String> JSON = new JacksonTypedJsonCodec<>(String[].class);

    private LexiconLoader() {}

    /** From the file system when {@code location} names a regular file, otherwise from the classpath. */
    public static ErrorsOr<List<String>> load(String location) {
        Objects.requireNonNull(location, "location");
        return asFile(location).map(LexiconLoader::loadFile).orElseGet(() -> loadResource(location));
    }

    public static ErrorsOr<List<String>> loadFile(Path path) {
        return ErrorsOr.trying(() -> Files.readString(path, StandardCharsets.UTF_8))
                .flatMap(text -> parse(path.toString(), text))
                .addPrefixIfError(path + ": ");
    }

    public static ErrorsOr<List<String>> loadResource(String resourceName) {
        URL url = LexiconLoader.class.getClassLoader().getResource(resourceName);
        if (url == null) {
            return ErrorsOr.error("Lexicon not found on the file system or classpath: " + resourceName);
        }
        return ErrorsOr.lift(url)
                .mapTry(LexiconLoader::read)
                .flatMap(text -> parse(resourceName, text))
                .addPrefixIfError(resourceName + ": ");
    }

    /** Picks the format from the name of the lexicon. */
    public static ErrorsOr<List<String>> parse(String location, String text) {
        return location.endsWith(".json") ? parseJson(text) : parse(text);
    }

    public static ErrorsOr<List<String>> parse(String text) {
        return LINES.decode(stripBom(text)).map(lines -> clean(lines.stream())
                .filter(line -> !line.startsWith("#"))
                .toList());
    }

    public static ErrorsOr<List<String>> parseJson(String text) {
        return JSON.decode(stripBom(text)).map(words -> clean(Arrays.stream(words)).toList());
    }

    private static Stream<String> clean(Stream<String> entries) {
        return entries.filter(Objects::nonNull).map(String::strip).filter(entry -> !entry.isEmpty());
    }

    private static String read(URL url) throws IOException {
        try (InputStream is = url.openStream()) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static Optional<Path> asFile(String location) {
        try {
            Path path = Path.of(location);
            return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    private static String stripBom(String s) {
        return (s != null && !s.isEmpty() && s.charAt(0) == '\uFEFF') ? s.substring(1) : s;
    }
}
