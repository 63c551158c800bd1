/**
 * Append-only event storage with optimistic concurrency per stream.
 */
package eventsource.store;
