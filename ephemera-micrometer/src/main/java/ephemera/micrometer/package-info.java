/**
 * Micrometer integration for sweep metrics.
 *
 * @see ephemera.micrometer.MicrometerSweepMetrics
 */
package ephemera.micrometer;
