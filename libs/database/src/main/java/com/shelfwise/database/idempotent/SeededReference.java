package com.shelfwise.database.idempotent;

/**
 * Identity a seed name resolved to.
 *
 * @param name the seeded name
 * @param id the row identity, new or pre-existing
 * @param wasInserted {@code true} if this call created the row
 */
public record SeededReference(String name, long id, boolean wasInserted) {}
