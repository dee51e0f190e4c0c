/**
 * Service Provider Interfaces implemented by storage and metrics integrations.
 *
 * @see ephemera.spi.ConnectionProvider
 * @see ephemera.spi.ContentRepository
 * @see ephemera.spi.EngagementStore
 * @see ephemera.spi.BlobStore
 * @see ephemera.spi.SweepMetrics
 */
package ephemera.spi;
