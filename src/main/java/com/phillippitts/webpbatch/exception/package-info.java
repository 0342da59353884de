/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.webpbatch.exception.WebpBatchException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.webpbatch.exception.EncoderNotFoundException} - the cwebp
 *       binary is missing; the only run-fatal condition</li>
 *   <li>{@link com.phillippitts.webpbatch.exception.ConversionException} - one image failed
 *       to encode; always converted into a failed outcome before it leaves the encoder package</li>
 *   <li>{@link com.phillippitts.webpbatch.exception.RunAlreadyActiveException} - a second run
 *       was requested while one is in flight</li>
 *   <li>{@link com.phillippitts.webpbatch.exception.NoRunException} - run state was requested
 *       before any run started</li>
 * </ul>
 *
 * <p>REST mapping lives in {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.webpbatch.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.webpbatch.exception;
