/**
 * Folder scanning: turns the requested folder list into immutable
 * {@link com.phillippitts.webpbatch.domain.FolderBatch} instances and computes the run's work
 * unit totals.
 */
package com.phillippitts.webpbatch.service.scan;
