/**
 * Protocol-centric core for shape streams.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants and the {@link io.shapestreams.core.LogOffset} position type</li>
 *   <li>Shape identity and definition models, including the row filter</li>
 *   <li>Log items (row changes and control messages) and key construction</li>
 * </ul>
 *
 * <p>Storage, replication and request handling live in the server modules.
 */
package io.shapestreams.core;
