/**
 * Encoder invocation: locating the cwebp executable, building its command line, running it as
 * an external process and translating the result into a
 * {@link com.phillippitts.webpbatch.domain.ConversionOutcome}.
 *
 * <p>Failures never leave this package as exceptions; the run coordinator only sees outcomes.
 * The {@link com.phillippitts.webpbatch.service.encoder.ProcessFactory} seam keeps tests
 * hermetic (no real cwebp binary needed).
 *
 * @since 1.0
 */
package com.phillippitts.webpbatch.service.encoder;
