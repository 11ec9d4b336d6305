package borg.screenmatch.templatematching;

import boofcv.struct.image.InterleavedU8;
import borg.screenmatch.raster.NormalizedRaster;

/**
 * Rectangular region of the scan with its own copy of the pixels.
 */
public class Chunk {

	private final int originX;
	private final int originY;
	private final InterleavedU8 pixels;

	public Chunk(int originX, int originY, InterleavedU8 pixels) {
		this.originX = originX;
		this.originY = originY;
		this.pixels = pixels;
	}

	public static Chunk extract(NormalizedRaster scan, int x, int y, int width, int height) {
		final InterleavedU8 src = scan.getPixels();
		final int rowBytes = width * NormalizedRaster.BANDS;

		InterleavedU8 pixels = new InterleavedU8(width, height, NormalizedRaster.BANDS);
		for (int row = 0; row < height; row++) {
			System.arraycopy(src.data, src.startIndex + (y + row) * src.stride + x * NormalizedRaster.BANDS, pixels.data, pixels.startIndex + row * pixels.stride, rowBytes);
		}
		return new Chunk(x, y, pixels);
	}

	/**
	 * True if the window of the given size starting at the absolute scan position lies completely inside
	 * this chunk
	 */
	public boolean containsWindow(int x, int y, int windowWidth, int windowHeight) {
		return x >= this.originX && y >= this.originY && x + windowWidth <= this.originX + this.getWidth() && y + windowHeight <= this.originY + this.getHeight();
	}

	public int getOriginX() {
		return originX;
	}

	public int getOriginY() {
		return originY;
	}

	public int getWidth() {
		return this.pixels.width;
	}

	public int getHeight() {
		return this.pixels.height;
	}

	public InterleavedU8 getPixels() {
		return pixels;
	}

	@Override
	public String toString() {
		return this.getWidth() + "x" + this.getHeight() + " @ " + this.originX + "/" + this.originY;
	}

}
