package borg.screenmatch.templatematching;

public enum ScoringMode {

	/**
	 * Mean squared difference per band, 0..65025
	 */
	PLAIN_MSE,

	/**
	 * Sum of squared differences divided by the geometric mean of template and window energy. Insensitive to
	 * the absolute brightness of the window.
	 */
	NORMALIZED;

}
