/**
 * Built-in dialects and the {@link eventsource.jdbc.dialect.Dialects} registry.
 */
package eventsource.jdbc.dialect;
