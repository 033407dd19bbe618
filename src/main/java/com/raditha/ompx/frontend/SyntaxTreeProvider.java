package com.raditha.ompx.frontend;

import com.raditha.ompx.ast.TranslationUnit;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Source of parsed translation units.
 */
public interface SyntaxTreeProvider {

    /**
     * Load one translation unit.
     *
     * @param input location of the unit's serialized tree
     * @throws TreeFormatException if the input is not a well-formed tree
     * @throws IOException         if the input cannot be read
     */
    TranslationUnit load(Path input) throws IOException;
}
