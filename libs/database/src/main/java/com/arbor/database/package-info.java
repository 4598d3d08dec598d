/**
 * Database schema management for Arbor.
 *
 * <p>Migrations live in {@code db/migration/hierarchy} and use only SQL understood by both
 * PostgreSQL (production) and H2 in PostgreSQL mode (tests):
 *
 * <ul>
 *   <li>{@code V1__hierarchy_nodes.sql} creates the node table with its materialized path and
 *       ancestor chain columns
 *   <li>{@code V2__node_occupants.sql} creates the occupant reference table read by the delete guard
 * </ul>
 */
package com.arbor.database;
