/**
 * Durable queue delivery: pollers that redeliver unprocessed rows and a purge scheduler
 * for processed ones.
 *
 * <p>{@link eventsource.queue.QueuePoller} is the recovery sweep for the event queue and
 * the transport for the command queue.
 *
 * @see eventsource.queue.QueuePoller
 * @see eventsource.queue.QueuePurgeScheduler
 */
package eventsource.queue;
