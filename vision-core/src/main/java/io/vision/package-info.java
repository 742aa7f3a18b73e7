/**
 * Root API of the vision runtime: scoped units of work whose telemetry is fanned out to
 * pluggable sinks.
 *
 * <h2>Core Design</h2>
 * <p>{@link io.vision.Vision#observe(io.vision.UnitConfig, io.vision.UnitWork) observe} creates a
 * {@link io.vision.Unit}, binds it in the {@linkplain io.vision.store.UnitStore unit store} for
 * the extent of the work, and hands the sealed unit to every registered
 * {@linkplain io.vision.sink.Sink sink} once the work finishes. Code anywhere below the
 * call attaches data through {@link io.vision.Vision#set set}, {@link io.vision.Vision#push push}
 * and {@link io.vision.Vision#merge merge}, or directly on the unit it was handed.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>vision-core</b>: units, store, lifecycle, sinks, key normalizer, delivery batcher</li>
 *   <li><b>vision-micrometer</b>: Micrometer bridge for runtime metrics</li>
 *   <li><b>vision-datadog</b>: Datadog sink</li>
 *   <li><b>vision-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * Vision vision = Vision.create();
 *
 * String body = vision.observe("http.request", unit -> {
 *   unit.set("http.method", "GET");
 *   vision.push("events", "cache.miss");
 *   return handle(request);
 * });
 * }</pre>
 *
 * @see io.vision.Vision
 * @see io.vision.Unit
 * @see io.vision.sink.Sink
 */
package io.vision;
