package com.cusip.refdata.load.source;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * A resolved raw file. {@link #openStream()} may be called more than once; each call starts from
 * the first byte.
 */
public record SourceFile(
    String name,
    String location,
    Opener opener
) {
    public InputStream openStream() throws IOException {
        return opener.open();
    }

    public static SourceFile ofBytes(String name, String location, byte[] content) {
        byte[] copy = content.clone();
        return new SourceFile(name, location, () -> new ByteArrayInputStream(copy));
    }

    @FunctionalInterface
    public interface Opener {
        InputStream open() throws IOException;
    }
}
