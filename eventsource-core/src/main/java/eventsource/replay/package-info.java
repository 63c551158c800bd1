/**
 * Aggregate rebuilding from snapshot plus tail, and the aggregate helper that raises new events.
 *
 * @see eventsource.replay.ReplayEngine
 * @see eventsource.replay.EventSourcedAggregate
 */
package eventsource.replay;
