/**
 * Jackson based JSON encoding of shape response batches.
 */
package io.shapestreams.json.jackson;
