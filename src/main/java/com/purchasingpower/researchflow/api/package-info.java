/**
 * REST API layer: the research controller and its request/response DTOs.
 *
 * <p>Endpoints under {@code /api/v1/research}:
 * <ul>
 *   <li>{@code POST /{threadId}/run} - start a run</li>
 *   <li>{@code POST /{threadId}/resume} - answer a pending interrupt</li>
 *   <li>{@code POST /{threadId}/cancel} - stop an active run at the next checkpoint</li>
 *   <li>{@code GET /{threadId}} and {@code GET /threads} - inspect checkpoints</li>
 *   <li>{@code GET /{threadId}/stream} - step events over SSE</li>
 * </ul>
 */
package com.purchasingpower.researchflow.api;
