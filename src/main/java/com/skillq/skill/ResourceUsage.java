package com.skillq.skill;

/**
 * AI provider usage accumulated by one execution.
 */
public record ResourceUsage(int requests, long tokensInput, long tokensOutput, double costUsd) {

    public static final ResourceUsage NONE = new ResourceUsage(0, 0, 0, 0.0);

    public ResourceUsage plus(ResourceUsage other) {
        if (other == null) {
            return this;
        }
        return new ResourceUsage(requests + other.requests, tokensInput + other.tokensInput,
                tokensOutput + other.tokensOutput, costUsd + other.costUsd);
    }
}
