/**
 * The closed set of domain errors carried by {@link eventsource.Result}.
 */
package eventsource.error;
