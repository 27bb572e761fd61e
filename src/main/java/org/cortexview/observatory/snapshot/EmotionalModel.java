package org.cortexview.observatory.snapshot;

import java.util.List;

/**
 * Derives the emotional state from the parsed thought window. Pure functions only: the same
 * window always yields the same state, so stale inputs produce the same derived values they
 * produced when they were fresh.
 */
public final class EmotionalModel {

    static final Snapshot.Emotional NEUTRAL = of(
        ThoughtParser.DEFAULT_VALENCE,
        ThoughtParser.DEFAULT_AROUSAL,
        ThoughtParser.DEFAULT_DOMINANCE,
        ThoughtParser.DEFAULT_CONNECTION_RELEVANCE);

    private EmotionalModel() {
        // Private constructor to prevent instantiation
    }

    /**
     * Valence, arousal and dominance come from the newest thought. Connection drive is the
     * mean connection relevance over the window.
     *
     * @param thoughts The parsed thoughts, newest first.
     * @return The emotional state.
     */
    public static Snapshot.Emotional derive(final List<ParsedThought> thoughts) {
        if (thoughts.isEmpty()) {
            return NEUTRAL;
        }
        final ParsedThought newest = thoughts.get(0);
        double relevance = 0.0;
        for (final ParsedThought thought : thoughts) {
            relevance += thought.connectionRelevance();
        }
        return of(newest.valence(), newest.arousal(), newest.dominance(), relevance / thoughts.size());
    }

    static Snapshot.Emotional of(final double valence, final double arousal, final double dominance,
                                 final double connectionDrive) {
        return new Snapshot.Emotional(
            valence,
            arousal,
            dominance,
            ThoughtParser.clamp(connectionDrive, 0.0, 1.0),
            intensity(valence, arousal));
    }

    /**
     * @return {@code |valence| * arousal}, in [0, 1] for in-range inputs.
     */
    public static double intensity(final double valence, final double arousal) {
        return ThoughtParser.clamp(Math.abs(valence) * arousal, 0.0, 1.0);
    }
}
