package com.hivewatch.session;

import com.hivewatch.domain.SessionSnapshot;

import java.util.List;

/**
 * Result of applying rule matches to a session.
 */
public final class ScoreUpdate {

    private final int previousScore;
    private final int newScore;
    private final List<String> newlyMatched;
    private final SessionSnapshot session;

    ScoreUpdate(int previousScore, int newScore, List<String> newlyMatched, SessionSnapshot session) {
        this.previousScore = previousScore;
        this.newScore = newScore;
        this.newlyMatched = List.copyOf(newlyMatched);
        this.session = session;
    }

    static ScoreUpdate missing() {
        return new ScoreUpdate(0, 0, List.of(), null);
    }

    public int getPreviousScore() {
        return previousScore;
    }

    public int getNewScore() {
        return newScore;
    }

    /**
     * Rule ids that had not matched this session before, in match order.
     */
    public List<String> getNewlyMatched() {
        return newlyMatched;
    }

    /**
     * Snapshot taken under the same lock as the update; null if the score did not rise or the
     * session is gone.
     */
    public SessionSnapshot getSession() {
        return session;
    }

    public boolean raised() {
        return newScore > previousScore;
    }
}
