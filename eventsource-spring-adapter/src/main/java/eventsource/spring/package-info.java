/**
 * Spring transaction integration.
 *
 * <p>{@link eventsource.spring.SpringTxContext} lets the JDBC stores and the unit of work
 * take part in transactions driven by a Spring {@code PlatformTransactionManager}.
 */
package eventsource.spring;
