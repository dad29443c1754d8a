/**
 * Aggregate snapshots.
 */
package io.eventcore.snapshot;
