package io.legalis.dsl.ast;

/**
 * An {@code IMPORT} line. The path is recorded, never resolved.
 *
 * @param path the imported path
 * @param alias the local alias (may be null)
 */
public record ImportDirective(String path, String alias) {}
