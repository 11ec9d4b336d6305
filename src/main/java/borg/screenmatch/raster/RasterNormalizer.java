package borg.screenmatch.raster;

import boofcv.struct.image.InterleavedU8;

/**
 * Converts collaborator rasters into top-down, three band rasters.
 * <p>
 * 24 and 32 bpp keep the first three bytes of every pixel, which is BGR for DIB data. 16 bpp is read as
 * little-endian RGB555 and written in the same BGR band order. 8, 4 and 1 bpp have no palette attached and
 * are treated as gray levels.
 */
public abstract class RasterNormalizer {

	public static NormalizedRaster normalize(RasterImage raster) {
		final int width = raster.getWidth();
		final int height = raster.getHeight();
		final int stride = raster.getRowStride();
		final byte[] src = raster.getPixelBuffer();
		final boolean bottomUp = raster.getOrientation() == Orientation.BOTTOM_UP;

		InterleavedU8 pixels = new InterleavedU8(width, height, NormalizedRaster.BANDS);
		for (int y = 0; y < height; y++) {
			final int srcRowStart = (bottomUp ? height - 1 - y : y) * stride;
			final int dstRowStart = pixels.startIndex + y * pixels.stride;
			switch (raster.getBitsPerPixel()) {
			case 32:
				copyRow(src, srcRowStart, 4, pixels.data, dstRowStart, width);
				break;
			case 24:
				copyRow(src, srcRowStart, 3, pixels.data, dstRowStart, width);
				break;
			case 16:
				decodeRgb555Row(src, srcRowStart, pixels.data, dstRowStart, width);
				break;
			case 8:
				decodeGrayRow(src, srcRowStart, pixels.data, dstRowStart, width);
				break;
			case 4:
				decodeNibbleRow(src, srcRowStart, pixels.data, dstRowStart, width);
				break;
			case 1:
				decodeBitRow(src, srcRowStart, pixels.data, dstRowStart, width);
				break;
			default:
				// Guarded by the RasterImage constructor
				throw new IllegalStateException("Unsupported bit depth " + raster.getBitsPerPixel());
			}
		}

		return new NormalizedRaster(pixels);
	}

	private static void copyRow(byte[] src, int srcRowStart, int bytesPerPixel, byte[] dst, int dstRowStart, int width) {
		if (bytesPerPixel == NormalizedRaster.BANDS) {
			System.arraycopy(src, srcRowStart, dst, dstRowStart, width * NormalizedRaster.BANDS);
		} else {
			for (int x = 0; x < width; x++) {
				final int s = srcRowStart + x * bytesPerPixel;
				final int d = dstRowStart + x * NormalizedRaster.BANDS;
				dst[d] = src[s];
				dst[d + 1] = src[s + 1];
				dst[d + 2] = src[s + 2];
			}
		}
	}

	private static void decodeRgb555Row(byte[] src, int srcRowStart, byte[] dst, int dstRowStart, int width) {
		for (int x = 0; x < width; x++) {
			final int s = srcRowStart + x * 2;
			final int value = (src[s] & 0xFF) | ((src[s + 1] & 0xFF) << 8);
			final int d = dstRowStart + x * NormalizedRaster.BANDS;
			dst[d] = expand5(value & 0x1F);
			dst[d + 1] = expand5((value >> 5) & 0x1F);
			dst[d + 2] = expand5((value >> 10) & 0x1F);
		}
	}

	private static void decodeGrayRow(byte[] src, int srcRowStart, byte[] dst, int dstRowStart, int width) {
		for (int x = 0; x < width; x++) {
			fillGray(dst, dstRowStart + x * NormalizedRaster.BANDS, src[srcRowStart + x]);
		}
	}

	private static void decodeNibbleRow(byte[] src, int srcRowStart, byte[] dst, int dstRowStart, int width) {
		for (int x = 0; x < width; x++) {
			final int packed = src[srcRowStart + x / 2] & 0xFF;
			final int index = (x % 2 == 0) ? (packed >> 4) : (packed & 0x0F);
			fillGray(dst, dstRowStart + x * NormalizedRaster.BANDS, (byte) (index * 17));
		}
	}

	private static void decodeBitRow(byte[] src, int srcRowStart, byte[] dst, int dstRowStart, int width) {
		for (int x = 0; x < width; x++) {
			final int packed = src[srcRowStart + x / 8] & 0xFF;
			final int bit = (packed >> (7 - (x % 8))) & 0x01;
			fillGray(dst, dstRowStart + x * NormalizedRaster.BANDS, (byte) (bit * 255));
		}
	}

	private static void fillGray(byte[] dst, int d, byte gray) {
		dst[d] = gray;
		dst[d + 1] = gray;
		dst[d + 2] = gray;
	}

	private static byte expand5(int value) {
		return (byte) ((value * 255 + 15) / 31);
	}

}
