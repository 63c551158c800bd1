/**
 * Micrometer integration for exporting event-sourcing metrics.
 *
 * @see eventsource.micrometer.MicrometerMetricsExporter
 */
package eventsource.micrometer;
