/**
 * Stock {@link eventsource.bus.EventMiddleware} implementations.
 */
package eventsource.bus.middleware;
