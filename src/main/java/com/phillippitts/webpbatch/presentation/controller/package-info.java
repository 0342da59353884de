/**
 * REST API controllers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/runs} - start a run (202, or 409 while another run is active)</li>
 *   <li>{@code GET /api/runs/current} - latest run snapshot (404 before the first run)</li>
 *   <li>{@code POST /api/runs/current/cancel} - request cancellation</li>
 *   <li>{@code GET /api/history}, {@code DELETE /api/history} - finished runs</li>
 * </ul>
 */
package com.phillippitts.webpbatch.presentation.controller;
