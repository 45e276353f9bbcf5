/**
 * Idempotent, forward-only categorization engine.
 *
 * <p>Leaf first:
 *
 * <ul>
 *   <li>{@link com.shelfwise.database.idempotent.ExistenceProber}: structural metadata lookups
 *   <li>{@link com.shelfwise.database.idempotent.ConditionalSchemaMutator}: add-if-absent DDL,
 *       tolerant of concurrent creation
 *   <li>{@link com.shelfwise.database.idempotent.ReferenceDataSeeder}: conflict-to-lookup
 *       insertion of reference rows
 *   <li>{@link com.shelfwise.database.idempotent.BackfillRuleEngine}: ordered, case-insensitive
 *       classification of existing rows
 *   <li>{@link com.shelfwise.database.idempotent.MigrationRunner}: the single entry point, one
 *       all-or-nothing unit of work
 * </ul>
 *
 * <p>All failures are subclasses of {@link com.shelfwise.database.idempotent.MigrationException}.
 */
package com.shelfwise.database.idempotent;
