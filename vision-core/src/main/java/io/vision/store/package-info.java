/**
 * Continuation-scoped tracking of the current unit.
 *
 * @see io.vision.store.UnitStore
 * @see io.vision.store.ThreadLocalUnitStore
 */
package io.vision.store;
