package borg.screenmatch.raster;

import boofcv.struct.image.GrayF64;

/**
 * Prefix sums of the per-pixel squared band sum. The table is one row and one column larger than the
 * raster, with row 0 and column 0 all zero, so any rectangle sum is four lookups.
 */
public class IntegralImage {

	private final GrayF64 table;

	private IntegralImage(GrayF64 table) {
		this.table = table;
	}

	public static IntegralImage of(NormalizedRaster raster) {
		final int width = raster.getWidth();
		final int height = raster.getHeight();

		GrayF64 table = new GrayF64(width + 1, height + 1);
		for (int y = 1; y <= height; y++) {
			double rowSum = 0;
			for (int x = 1; x <= width; x++) {
				rowSum += raster.squaredSum(x - 1, y - 1);
				table.unsafe_set(x, y, table.unsafe_get(x, y - 1) + rowSum);
			}
		}

		return new IntegralImage(table);
	}

	/**
	 * Sum of squared band values in the rectangle with top-left (x, y) and the given size
	 */
	public double sumOfSquares(int x, int y, int width, int height) {
		final int x1 = x + width;
		final int y1 = y + height;
		return this.table.unsafe_get(x1, y1) - this.table.unsafe_get(x, y1) - this.table.unsafe_get(x1, y) + this.table.unsafe_get(x, y);
	}

	/**
	 * Width of the underlying raster, not of the table
	 */
	public int getWidth() {
		return this.table.width - 1;
	}

	public int getHeight() {
		return this.table.height - 1;
	}

}
