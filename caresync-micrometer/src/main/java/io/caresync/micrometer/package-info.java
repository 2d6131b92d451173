/**
 * Micrometer binding for {@link io.caresync.spi.MetricsExporter}.
 */
package io.caresync.micrometer;
