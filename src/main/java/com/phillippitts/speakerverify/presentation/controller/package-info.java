/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /verify}, {@code POST /verify_batch} - speaker verification</li>
 *   <li>{@code POST /extract_embedding}, {@code POST /compare_embeddings} - embedding access</li>
 *   <li>{@code GET /health} - model state, uptime and request statistics</li>
 *   <li>{@code GET|POST /config}, {@code GET /models} - runtime configuration</li>
 *   <li>{@code DELETE /cache} - cache maintenance</li>
 * </ul>
 *
 * <p>Controllers are thin adapters: they pick the audio source variant from the request shape and
 * delegate. Errors are thrown as domain exceptions and translated by
 * {@link com.phillippitts.speakerverify.presentation.exception.GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.speakerverify.presentation.controller;
