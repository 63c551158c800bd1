/**
 * Snapshot storage and the strategies that decide when to take one.
 */
package eventsource.snapshot;
