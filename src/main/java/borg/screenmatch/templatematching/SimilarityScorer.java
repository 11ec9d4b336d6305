package borg.screenmatch.templatematching;

import boofcv.struct.image.InterleavedU8;
import borg.screenmatch.raster.IntegralImage;
import borg.screenmatch.raster.NormalizedRaster;

/**
 * Scores how badly the template fits a window of the scan. 0 is a perfect match.
 * <p>
 * Errors are summed row by row and the summation stops as soon as the partial error alone exceeds the
 * limit. A stopped score is a lower bound of the full score, so it is still above the limit and never hides a
 * match.
 */
public class SimilarityScorer {

	/**
	 * Below this denominator the window is considered uniform black and gets the worst score
	 */
	public static final double EPSILON = 1e-6;

	/**
	 * Scores up to threshold / 5 are accepted without verification
	 */
	public static final double HIGH_CONFIDENCE_DIVISOR = 5.0;

	private final PreparedTemplate template;
	private final NormalizedRaster scan;
	private final IntegralImage integralImage;
	private final ScoringMode mode;
	private final double threshold;

	public SimilarityScorer(PreparedTemplate template, NormalizedRaster scan, IntegralImage integralImage, ScoringMode mode, double threshold) {
		if (threshold < 0) {
			throw new IllegalArgumentException("Threshold must not be negative, got " + threshold);
		}
		if (mode == ScoringMode.NORMALIZED && integralImage == null) {
			throw new IllegalArgumentException("Normalized scoring needs the integral image of the scan");
		}
		this.template = template;
		this.scan = scan;
		this.integralImage = integralImage;
		this.mode = mode;
		this.threshold = threshold;
	}

	/**
	 * Score with the template's top-left corner at (x, y) inside the chunk, stopping early above the threshold
	 */
	public double score(Chunk chunk, int x, int y) {
		return this.score(chunk.getPixels(), x, y, chunk.getOriginX() + x, chunk.getOriginY() + y, this.threshold);
	}

	/**
	 * Score with the template's top-left corner at (x, y) of the full scan, stopping early above the limit
	 */
	public double score(int x, int y, double limit) {
		return this.score(this.scan.getPixels(), x, y, x, y, limit);
	}

	/**
	 * @param pixels
	 *            Scan pixels or a copy of a part of them
	 * @param x
	 *            Window position in <code>pixels</code>
	 * @param scanX
	 *            Same window position in scan coordinates, used for the integral image
	 */
	double score(InterleavedU8 pixels, int x, int y, int scanX, int scanY, double limit) {
		final int width = this.template.getWidth();
		final int height = this.template.getHeight();

		final double denominator;
		if (this.mode == ScoringMode.PLAIN_MSE) {
			denominator = (double) width * height * NormalizedRaster.BANDS;
		} else {
			final double windowSumOfSquares = this.integralImage.sumOfSquares(scanX, scanY, width, height);
			denominator = Math.sqrt(this.template.getSumOfSquares() * windowSumOfSquares);
			if (denominator < EPSILON) {
				return Double.MAX_VALUE;
			}
		}

		final double maxError = limit * denominator;
		final InterleavedU8 t = this.template.getPixels().getPixels();
		final int rowBytes = width * NormalizedRaster.BANDS;

		long error = 0;
		for (int row = 0; row < height && error <= maxError; row++) {
			final int windowRowStart = pixels.startIndex + (y + row) * pixels.stride + x * NormalizedRaster.BANDS;
			final int templateRowStart = t.startIndex + row * t.stride;
			for (int i = 0; i < rowBytes; i++) {
				final int diff = (pixels.data[windowRowStart + i] & 0xFF) - (t.data[templateRowStart + i] & 0xFF);
				error += diff * diff;
			}
		}

		return error / denominator;
	}

	/**
	 * Decides whether a score of the window at the absolute scan position (x, y) is a match. Clear matches are
	 * accepted right away. Near-threshold ones must also be a local minimum, i.e. none of the four neighbour
	 * windows may fit better.
	 */
	public boolean accepts(double score, int x, int y) {
		if (score > this.threshold) {
			return false;
		} else if (score <= this.threshold / HIGH_CONFIDENCE_DIVISOR) {
			return true;
		} else {
			return this.isLocalMinimum(score, x, y);
		}
	}

	boolean isLocalMinimum(double score, int x, int y) {
		final int maxX = this.scan.getWidth() - this.template.getWidth();
		final int maxY = this.scan.getHeight() - this.template.getHeight();

		if (x > 0 && this.score(x - 1, y, score) < score) {
			return false;
		}
		if (x < maxX && this.score(x + 1, y, score) < score) {
			return false;
		}
		if (y > 0 && this.score(x, y - 1, score) < score) {
			return false;
		}
		if (y < maxY && this.score(x, y + 1, score) < score) {
			return false;
		}
		return true;
	}

	public PreparedTemplate getTemplate() {
		return template;
	}

}
