/**
 * Server-side SPI for shape streams.
 *
 * <p>The SPI is blocking and minimal. It names the seams to the upstream database (schema lookup,
 * consistent snapshots, the replication feed), the shape log storage, and response encoding.
 */
package io.shapestreams.server.spi;
