package borg.screenmatch.raster;

import boofcv.struct.image.InterleavedU8;

/**
 * Top-down raster with exactly three 8 bit bands per pixel.
 */
public class NormalizedRaster {

	public static final int BANDS = 3;

	private final InterleavedU8 pixels;

	public NormalizedRaster(InterleavedU8 pixels) {
		if (pixels.numBands != BANDS) {
			throw new IllegalArgumentException("Expected " + BANDS + " bands, got " + pixels.numBands);
		}
		this.pixels = pixels;
	}

	public InterleavedU8 getPixels() {
		return this.pixels;
	}

	public int getWidth() {
		return this.pixels.width;
	}

	public int getHeight() {
		return this.pixels.height;
	}

	/**
	 * Unsigned value of one band, no bounds checks
	 */
	public int unsafe_get(int x, int y, int band) {
		return this.pixels.data[this.pixels.startIndex + y * this.pixels.stride + x * BANDS + band] & 0xFF;
	}

	/**
	 * Sum of the squared band values of one pixel
	 */
	public int squaredSum(int x, int y) {
		final int index = this.pixels.startIndex + y * this.pixels.stride + x * BANDS;
		final int b0 = this.pixels.data[index] & 0xFF;
		final int b1 = this.pixels.data[index + 1] & 0xFF;
		final int b2 = this.pixels.data[index + 2] & 0xFF;
		return b0 * b0 + b1 * b1 + b2 * b2;
	}

	@Override
	public String toString() {
		return this.getWidth() + "x" + this.getHeight() + " RGB";
	}

}
