package io.cortex.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Memory content taken from {@code --content}, {@code --file} or standard input, with the source it came from.
 */
record ContentInput(String content, String source) {
    static final String SOURCE_FLAG = "flag";
    static final String SOURCE_FILE = "file";
    static final String SOURCE_STDIN = "stdin";

    /**
     * Returns {@code null} when neither flag is set and {@code readStdin} is false.
     *
     * @throws IllegalArgumentException when both {@code --content} and {@code --file} are given
     */
    static ContentInput resolve(String content, Path file, InputStream stdin, boolean readStdin) throws IOException {
        if (content != null && file != null) {
            throw new IllegalArgumentException("Provide either --content or --file, not both");
        }
        if (content != null) {
            return new ContentInput(content, SOURCE_FLAG);
        }
        if (file != null) {
            return new ContentInput(Files.readString(file, StandardCharsets.UTF_8), SOURCE_FILE);
        }
        if (!readStdin || stdin == null) {
            return null;
        }
        return new ContentInput(new String(stdin.readAllBytes(), StandardCharsets.UTF_8), SOURCE_STDIN);
    }
}
