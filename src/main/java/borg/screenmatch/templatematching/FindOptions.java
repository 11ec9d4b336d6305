package borg.screenmatch.templatematching;

/**
 * Per-search options. Unset values fall back to threshold 100, 500 ms timeout and plain MSE scoring.
 */
public class FindOptions {

	public static final double DEFAULT_THRESHOLD = 100.0;
	public static final long DEFAULT_TIMEOUT_MILLIS = 500;

	private double threshold = DEFAULT_THRESHOLD;
	private long timeoutMillis = DEFAULT_TIMEOUT_MILLIS;
	private ScoringMode scoringMode = ScoringMode.PLAIN_MSE;

	public FindOptions() {
		// Defaults
	}

	public FindOptions(FindOptions other) {
		this.threshold = other.threshold;
		this.timeoutMillis = other.timeoutMillis;
		this.scoringMode = other.scoringMode;
	}

	public FindOptions withThreshold(double threshold) {
		if (threshold < 0 || Double.isNaN(threshold)) {
			throw new IllegalArgumentException("Threshold must not be negative, got " + threshold);
		}
		this.threshold = threshold;
		return this;
	}

	public FindOptions withTimeoutMillis(long timeoutMillis) {
		if (timeoutMillis <= 0) {
			throw new IllegalArgumentException("Timeout must be positive, got " + timeoutMillis);
		}
		this.timeoutMillis = timeoutMillis;
		return this;
	}

	public FindOptions withScoringMode(ScoringMode scoringMode) {
		if (scoringMode == null) {
			throw new IllegalArgumentException("Scoring mode must not be null");
		}
		this.scoringMode = scoringMode;
		return this;
	}

	public double getThreshold() {
		return threshold;
	}

	public long getTimeoutMillis() {
		return timeoutMillis;
	}

	public ScoringMode getScoringMode() {
		return scoringMode;
	}

	@Override
	public String toString() {
		return this.scoringMode + " <= " + this.threshold + " within " + this.timeoutMillis + " ms";
	}

}
