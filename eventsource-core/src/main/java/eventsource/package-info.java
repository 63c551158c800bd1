/**
 * Event-sourcing core: the {@link eventsource.Event} envelope, the {@link eventsource.Result}
 * type returned by domain operations, and the {@link eventsource.EventSourcing} composite.
 *
 * @see eventsource.EventSourcing
 */
package eventsource;
