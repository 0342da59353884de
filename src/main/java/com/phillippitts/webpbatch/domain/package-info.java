/**
 * Immutable domain model of a conversion run: configuration, scan batches, per-image outcomes
 * and the folder/run summaries handed to collaborators.
 *
 * @since 1.0
 */
package com.phillippitts.webpbatch.domain;
