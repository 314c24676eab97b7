/**
 * Micrometer bridge for {@link io.pipeguard.spi.MetricsExporter}.
 */
package io.pipeguard.micrometer;
