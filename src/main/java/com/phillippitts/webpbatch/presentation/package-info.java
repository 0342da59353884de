/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Controllers are thin adapters;
 * exception handlers map domain exceptions to HTTP status codes.
 *
 * @see com.phillippitts.webpbatch.presentation.controller
 * @since 1.0
 */
package com.phillippitts.webpbatch.presentation;
