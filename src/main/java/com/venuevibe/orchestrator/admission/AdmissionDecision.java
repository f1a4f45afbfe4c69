package com.venuevibe.orchestrator.admission;

/**
 * Combined result of the stacked admission gates for one request.
 *
 * @param reported the decision whose numbers go into the rate-limit headers: the denying gate
 *                 when rejected, otherwise the gate with the fewest admissions left
 * @param scope    scope of the reported gate ({@code "global"} or a route name)
 */
public record AdmissionDecision(boolean allowed, String scope, RateLimitDecision reported) {
}
