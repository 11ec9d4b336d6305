package borg.screenmatch.raster;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class IntegralImageTest {

	@Test
	public void rectangleSumsMatchBruteForce() {
		NormalizedRaster raster = RasterNormalizer.normalize(new Canvas(23, 17).noise(42, 0, 255).toRaster());
		IntegralImage integral = IntegralImage.of(raster);

		int[][] rectangles = { { 0, 0, 23, 17 }, { 0, 0, 1, 1 }, { 22, 16, 1, 1 }, { 3, 4, 10, 5 }, { 0, 7, 23, 2 }, { 11, 0, 4, 17 } };
		for (int[] r : rectangles) {
			assertEquals(bruteForce(raster, r[0], r[1], r[2], r[3]), integral.sumOfSquares(r[0], r[1], r[2], r[3]), 0.0, "rectangle " + r[0] + "/" + r[1] + " " + r[2] + "x" + r[3]);
		}
	}

	@Test
	public void uniformBlackHasNoEnergy() {
		IntegralImage integral = IntegralImage.of(RasterNormalizer.normalize(new Canvas(8, 8).toRaster()));

		assertEquals(0.0, integral.sumOfSquares(0, 0, 8, 8), 0.0);
		assertEquals(8, integral.getWidth());
		assertEquals(8, integral.getHeight());
	}

	@Test
	public void whiteSquareEnergy() {
		IntegralImage integral = IntegralImage.of(RasterNormalizer.normalize(new Canvas(20, 20).fill(5, 5, 4, 4, 255, 255, 255).toRaster()));

		assertEquals(16 * 3 * 255.0 * 255.0, integral.sumOfSquares(0, 0, 20, 20), 0.0);
		assertEquals(4 * 3 * 255.0 * 255.0, integral.sumOfSquares(7, 7, 5, 5), 0.0);
		assertEquals(0.0, integral.sumOfSquares(9, 0, 11, 20), 0.0);
	}

	private static double bruteForce(NormalizedRaster raster, int x, int y, int width, int height) {
		double sum = 0;
		for (int yy = y; yy < y + height; yy++) {
			for (int xx = x; xx < x + width; xx++) {
				sum += raster.squaredSum(xx, yy);
			}
		}
		return sum;
	}

}
