/**
 * JSON encoding, error serialization and threading helpers.
 */
package io.vision.util;
