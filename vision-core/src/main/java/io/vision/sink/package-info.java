/**
 * Sink contract, the sink registry and the built-in console and normalizing sinks.
 */
package io.vision.sink;
