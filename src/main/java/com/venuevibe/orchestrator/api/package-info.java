/**
 * REST API layer: controllers and DTOs.
 *
 * <ul>
 *   <li>{@code GeocodeController} - location text to coordinates</li>
 *   <li>{@code VenueSearchController} - planned or explicit queries fanned out to place search</li>
 *   <li>{@code RecommendationController} - ranking of found venues for an occasion</li>
 *   <li>{@code DiagnosticsController} - cache and rate limiter statistics</li>
 * </ul>
 *
 * <p>Every route under {@code /api/**} passes admission control first. Errors are rendered by
 * {@code ApiExceptionHandler} as {@link com.venuevibe.orchestrator.api.ApiError}.
 */
package com.venuevibe.orchestrator.api;
