/**
 * Service Provider Interfaces (SPI) for plugging in transactions, connections, durable
 * queues and metrics.
 *
 * @see eventsource.spi.TxContext
 * @see eventsource.spi.ConnectionProvider
 * @see eventsource.spi.MessageQueue
 * @see eventsource.spi.MetricsExporter
 */
package eventsource.spi;
