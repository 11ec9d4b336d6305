package borg.screenmatch.util;

import java.awt.image.BufferedImage;

import borg.screenmatch.raster.Orientation;
import borg.screenmatch.raster.RasterImage;

public abstract class ImageUtil {

	/**
	 * Top-down 32 bpp raster with BGRX byte order, the layout of a screen capture DIB. Alpha is dropped.
	 */
	public static RasterImage toRasterImage(BufferedImage image) {
		final int width = image.getWidth();
		final int height = image.getHeight();
		final int stride = RasterImage.rowStride(width, 32);

		byte[] pixelBuffer = new byte[stride * height];
		int[] row = new int[width];
		for (int y = 0; y < height; y++) {
			image.getRGB(0, y, width, 1, row, 0, width);
			int offset = y * stride;
			for (int x = 0; x < width; x++) {
				final int rgb = row[x];
				pixelBuffer[offset++] = (byte) (rgb & 0xFF);
				pixelBuffer[offset++] = (byte) ((rgb >> 8) & 0xFF);
				pixelBuffer[offset++] = (byte) ((rgb >> 16) & 0xFF);
				pixelBuffer[offset++] = (byte) 0xFF;
			}
		}

		return new RasterImage(width, height, 32, pixelBuffer, Orientation.TOP_DOWN);
	}

	/**
	 * Copy of the given area of a larger image as a raster, useful to cut templates out of a screenshot
	 */
	public static RasterImage toRasterImage(BufferedImage image, int x, int y, int width, int height) {
		return toRasterImage(image.getSubimage(x, y, width, height));
	}

}
