package com.raditha.ompx.extraction;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Raw text of one source file with line/column to offset translation.
 * Lines and columns are 1-based; a column counts characters, tabs included.
 */
public class SourceBuffer {

    private final String name;
    private final String text;
    private final int[] lineStarts;

    private SourceBuffer(String name, String text) {
        this.name = name;
        this.text = text;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public static SourceBuffer of(String name, String text) {
        return new SourceBuffer(name, text);
    }

    public static SourceBuffer read(Path path) throws IOException {
        return new SourceBuffer(path.toString(), Files.readString(path, StandardCharsets.UTF_8));
    }

    public String getName() {
        return name;
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public char charAt(int offset) {
        return text.charAt(offset);
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Offset of a position, empty when it lies outside the text.
     */
    public OptionalInt offsetOf(int line, int column) {
        if (line < 1 || line > lineStarts.length || column < 1) {
            return OptionalInt.empty();
        }
        int offset = lineStarts[line - 1] + column - 1;
        int lineEnd = line < lineStarts.length ? lineStarts[line] : text.length();
        if (offset >= lineEnd || offset >= text.length()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(offset);
    }

    @Override
    public String toString() {
        return name + " (" + lineStarts.length + " lines)";
    }
}
