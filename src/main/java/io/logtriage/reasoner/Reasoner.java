package io.logtriage.reasoner;

/**
 * External capability that turns heuristic candidates into structured natural-language output.
 * Implementations report problems as {@link ReasonerResult#fail(String)} instead of throwing.
 */
public interface Reasoner {
    ReasonerResult reason(ReasonerRequest request);

    /**
     * Invokes the reasoner and converts anything it throws into a failed result.
     */
    static ReasonerResult call(Reasoner reasoner, ReasonerRequest request) {
        try {
            ReasonerResult result = reasoner.reason(request);
            if (result == null) {
                return ReasonerResult.fail("reasoner returned no result");
            }
            if (result.success() && result.output() == null) {
                return ReasonerResult.fail("reasoner returned success without output");
            }
            return result;
        } catch (RuntimeException e) {
            return ReasonerResult.fail("reasoner call failed: " + e.getMessage());
        }
    }
}
