package borg.screenmatch.raster;

/**
 * Raw pixel buffer as handed over by a capture or decode collaborator. Rows are padded to 4 bytes.
 * <p>
 * The buffer is not copied. Callers must not modify it while a search is running on it.
 */
public class RasterImage {

	private final int width;
	private final int height;
	private final int bitsPerPixel;
	private final int rowStride;
	private final byte[] pixelBuffer;
	private final Orientation orientation;

	public RasterImage(int width, int height, int bitsPerPixel, byte[] pixelBuffer, Orientation orientation) {
		if (width <= 0 || height <= 0) {
			throw new IllegalArgumentException("Raster dimensions must be positive, got " + width + "x" + height);
		}
		if (!isSupportedBitDepth(bitsPerPixel)) {
			throw new IllegalArgumentException("Unsupported bit depth " + bitsPerPixel);
		}
		if (pixelBuffer == null) {
			throw new IllegalArgumentException("Pixel buffer must not be null");
		}
		if (orientation == null) {
			throw new IllegalArgumentException("Orientation must not be null");
		}

		final int stride = rowStride(width, bitsPerPixel);
		if (pixelBuffer.length != stride * height) {
			throw new IllegalArgumentException("Pixel buffer has " + pixelBuffer.length + " bytes, expected " + stride + " * " + height + " for a " + width + "x" + height
					+ "x" + bitsPerPixel + " raster");
		}

		this.width = width;
		this.height = height;
		this.bitsPerPixel = bitsPerPixel;
		this.rowStride = stride;
		this.pixelBuffer = pixelBuffer;
		this.orientation = orientation;
	}

	/**
	 * Bytes per row including the padding to the next 4 byte boundary
	 */
	public static int rowStride(int width, int bitsPerPixel) {
		return ((width * bitsPerPixel + 31) / 32) * 4;
	}

	public static boolean isSupportedBitDepth(int bitsPerPixel) {
		switch (bitsPerPixel) {
		case 1:
		case 4:
		case 8:
		case 16:
		case 24:
		case 32:
			return true;
		default:
			return false;
		}
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public int getBitsPerPixel() {
		return bitsPerPixel;
	}

	public int getRowStride() {
		return rowStride;
	}

	public byte[] getPixelBuffer() {
		return pixelBuffer;
	}

	public Orientation getOrientation() {
		return orientation;
	}

	@Override
	public String toString() {
		return this.width + "x" + this.height + "x" + this.bitsPerPixel + " " + this.orientation;
	}

}
