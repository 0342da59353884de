/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.webpbatch.exception.RunAlreadyActiveException} → 409 Conflict</li>
 *   <li>{@link com.phillippitts.webpbatch.exception.NoRunException} → 404 Not Found</li>
 *   <li>Bean validation failures and unreadable bodies → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * @see com.phillippitts.webpbatch.exception
 * @since 1.0
 */
package com.phillippitts.webpbatch.presentation.exception;
