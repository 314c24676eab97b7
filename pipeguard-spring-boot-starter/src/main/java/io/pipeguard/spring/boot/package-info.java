/**
 * Spring Boot auto-configuration for the delivery-reliability core.
 *
 * @see io.pipeguard.spring.boot.PipeguardAutoConfiguration
 * @see io.pipeguard.spring.boot.PipeguardProperties
 */
package io.pipeguard.spring.boot;
