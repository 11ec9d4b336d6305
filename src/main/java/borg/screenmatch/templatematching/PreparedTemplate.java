package borg.screenmatch.templatematching;

import borg.screenmatch.raster.NormalizedRaster;
import borg.screenmatch.raster.RasterImage;
import borg.screenmatch.raster.RasterNormalizer;

/**
 * Normalized template pixels plus the template energy used by the normalized score.
 */
public class PreparedTemplate {

	private final NormalizedRaster pixels;
	private final double sumOfSquares;

	private PreparedTemplate(NormalizedRaster pixels, double sumOfSquares) {
		this.pixels = pixels;
		this.sumOfSquares = sumOfSquares;
	}

	public static PreparedTemplate of(RasterImage template) {
		return of(RasterNormalizer.normalize(template));
	}

	public static PreparedTemplate of(NormalizedRaster pixels) {
		double sumOfSquares = 0;
		for (int y = 0; y < pixels.getHeight(); y++) {
			for (int x = 0; x < pixels.getWidth(); x++) {
				sumOfSquares += pixels.squaredSum(x, y);
			}
		}
		return new PreparedTemplate(pixels, sumOfSquares);
	}

	@Override
	public String toString() {
		return "template " + this.getWidth() + "x" + this.getHeight();
	}

	public NormalizedRaster getPixels() {
		return this.pixels;
	}

	/**
	 * Sum of the squared band values over all template pixels
	 */
	public double getSumOfSquares() {
		return this.sumOfSquares;
	}

	public int getWidth() {
		return this.pixels.getWidth();
	}

	public int getHeight() {
		return this.pixels.getHeight();
	}

}
