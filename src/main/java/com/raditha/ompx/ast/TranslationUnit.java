package com.raditha.ompx.ast;

import com.raditha.ompx.extraction.SourceBuffer;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One compiled source file with everything it includes.
 *
 * @param mainFile  the file that was compiled
 * @param functions function declarations in declaration order, across all files
 * @param buffers   raw text of every file that could be read, keyed by file name
 */
public record TranslationUnit(
        String mainFile,
        List<FunctionDecl> functions,
        Map<String, SourceBuffer> buffers) {

    public TranslationUnit {
        functions = List.copyOf(functions);
        buffers = Map.copyOf(buffers);
    }

    public Optional<SourceBuffer> getBuffer(String filename) {
        return Optional.ofNullable(buffers.get(filename));
    }
}
