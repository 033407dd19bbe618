package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.Optional;

/**
 * A function declaration as reported by the front end.
 *
 * @param name         function name
 * @param filename     file the declaration is spelled in
 * @param systemHeader true when the declaration comes from a system header
 * @param span         declaration span, may be {@code null}
 * @param body         body, {@code null} for a declaration without definition
 */
public record FunctionDecl(
        String name,
        String filename,
        boolean systemHeader,
        SourceSpan span,
        CompoundStmt body) {

    public Optional<CompoundStmt> getBody() {
        return Optional.ofNullable(body);
    }
}
