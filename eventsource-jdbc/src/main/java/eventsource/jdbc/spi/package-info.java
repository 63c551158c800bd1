/**
 * Extension point for additional databases.
 */
package eventsource.jdbc.spi;
