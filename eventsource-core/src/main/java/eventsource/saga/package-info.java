/**
 * Process managers that react to events with commands and compensate completed steps
 * in reverse order when the process fails.
 *
 * @see eventsource.saga.SagaManager
 * @see eventsource.saga.Saga
 */
package eventsource.saga;
