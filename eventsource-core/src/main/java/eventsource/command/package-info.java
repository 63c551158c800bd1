/**
 * Command routing with exactly one handler per command type.
 *
 * @see eventsource.command.DefaultCommandBus
 * @see eventsource.command.QueueingCommandBus
 */
package eventsource.command;
