/**
 * Event schema migration chains.
 */
package eventsource.upcast;
