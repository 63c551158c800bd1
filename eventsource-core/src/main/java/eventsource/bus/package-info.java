/**
 * In-process publish/subscribe with topic patterns, priorities, batching and middleware.
 *
 * <p>{@link eventsource.bus.DefaultEventBus} delivers each event to every matching
 * subscription, isolating handler failures and reporting them together. Events of one
 * aggregate are delivered in order; different aggregates are delivered concurrently.
 *
 * @see eventsource.bus.EventBus
 * @see eventsource.bus.IdempotentEventHandler
 */
package eventsource.bus;
