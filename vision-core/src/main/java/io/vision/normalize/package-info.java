/**
 * Key casing conversion for unit data.
 */
package io.vision.normalize;
