// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.model;

/**
 * Aggregate over the feedback rows that matched a search for one agent.
 *
 * @param count number of matching rows with a usable value
 * @param sum   sum of their values
 */
public record FeedbackStats(long count, double sum) {

    public static final FeedbackStats EMPTY = new FeedbackStats(0, 0.0);

    public FeedbackStats add(double value) {
        return new FeedbackStats(count + 1, sum + value);
    }

    /**
     * @return the mean value, or 0 when there are no rows
     */
    public double average() {
        return count == 0 ? 0.0 : sum / count;
    }
}
