/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.webpbatch.config.ThreadPoolConfig} - single-worker executor
 *       running conversions in the background</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.encoder} - external encoder binary settings</li>
 *   <li>{@code config.properties} - conversion defaults, run history, thread pool</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.webpbatch.config;
