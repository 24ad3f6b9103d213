package io.legalis.dsl.parser;

import io.legalis.dsl.SourceLocation;

/**
 * A statute id named by a REQUIRES, SUPERSEDES or AMENDMENT clause, with where it was written.
 *
 * @param id the referenced statute id
 * @param clause the clause keyword that made the reference
 * @param location the location of the id
 */
record StatuteReference(String id, String clause, SourceLocation location) {}
