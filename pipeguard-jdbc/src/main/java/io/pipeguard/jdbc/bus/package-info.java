/**
 * Durable {@link io.pipeguard.bus.MessageBus} over a relational table, for deployments that
 * run the pipeline without a broker.
 */
package io.pipeguard.jdbc.bus;
