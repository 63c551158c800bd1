/**
 * Internal helpers: JSON codec, payload copies, daemon threads.
 */
package eventsource.util;
