/**
 * Logging infrastructure: request correlation values in the Log4j2 ThreadContext.
 */
package com.phillippitts.webpbatch.config.logging;
