/**
 * Service provider interfaces implemented by integration modules.
 */
package io.vision.spi;
