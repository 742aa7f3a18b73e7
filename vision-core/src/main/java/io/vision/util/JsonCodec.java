package io.vision.util;

import java.util.Map;

/**
 * Codec between plain Java values and JSON text, used by sinks that ship units as JSON.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) is a lightweight,
 * zero-dependency encoder/decoder. Applications that already use Jackson, Gson or another
 * JSON library can implement this interface to delegate to it.
 *
 * @see #getDefault()
 * @see DefaultJsonCodec
 */
public interface JsonCodec {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a value as JSON. Maps become objects, iterables and arrays become arrays,
   * numbers, booleans and {@code null} map to their JSON counterparts, throwables are
   * serialized with {@link ErrorSerializer}, and everything else is written as its string
   * form. A container that contains itself is written as {@code "[Circular]"} at the
   * point of recursion.
   *
   * @param value the value to encode
   * @return JSON text (never {@code null})
   */
  String toJson(Object value);

  /**
   * Parses JSON text into maps, lists, strings, numbers ({@link Long} for integral values
   * that fit, {@link Double} otherwise), booleans and {@code null}.
   *
   * @param json the JSON text
   * @return the parsed value
   * @throws IllegalArgumentException if the input is not valid JSON
   */
  Object parse(String json);

  /**
   * Parses a JSON object.
   *
   * @param json the JSON text
   * @return the parsed object, in document order
   * @throws IllegalArgumentException if the input is not a valid JSON object
   */
  @SuppressWarnings("unchecked")
  default Map<String, Object> parseObject(String json) {
    Object value = parse(json);
    if (!(value instanceof Map)) {
      throw new IllegalArgumentException("Expected JSON object");
    }
    return (Map<String, Object>) value;
  }
}
