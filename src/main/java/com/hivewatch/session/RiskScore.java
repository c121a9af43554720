package com.hivewatch.session;

import com.hivewatch.domain.SessionSnapshot;

import java.util.Collection;

/**
 * Risk score arithmetic: the capped sum of the weights of every matched rule.
 */
public final class RiskScore {

    public static final int MAX = 100;

    private RiskScore() {
    }

    public static int compute(Collection<Integer> weights) {
        long sum = 0;
        for (Integer weight : weights) {
            sum += Math.max(0, weight);
        }
        return (int) Math.min(MAX, sum);
    }

    /**
     * Recomputes the score of a snapshot from its matched rules.
     */
    public static int recompute(SessionSnapshot session) {
        return compute(session.getRuleWeights().values());
    }
}
