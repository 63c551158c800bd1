/**
 * Append-then-publish coordination.
 *
 * @see eventsource.uow.UnitOfWork
 */
package eventsource.uow;
