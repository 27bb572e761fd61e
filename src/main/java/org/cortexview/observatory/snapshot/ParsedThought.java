package org.cortexview.observatory.snapshot;

/**
 * A thought stream entry after parsing: the summary shown to observers plus the salience
 * components the emotional state is derived from.
 *
 * @param summary             The observer-facing summary.
 * @param valence             Salience valence in [-1, 1].
 * @param arousal             Salience arousal in [0, 1].
 * @param dominance           Salience dominance in [0, 1].
 * @param connectionRelevance Salience connection relevance in [0, 1].
 */
public record ParsedThought(
    Snapshot.ThoughtSummary summary,
    double valence,
    double arousal,
    double dominance,
    double connectionRelevance
) {
}
