/**
 * Library-neutral JSON service provider interface.
 *
 * <p>The runtime core only talks to these interfaces; a binding such as {@code objection-json-jackson}
 * supplies the implementation, either explicitly or through {@link io.objection.json.spi.JsonCodecProvider}.
 */
package io.objection.json.spi;
