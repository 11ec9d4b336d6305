package borg.screenmatch.session;

import java.awt.Rectangle;

import borg.screenmatch.raster.RasterImage;

/**
 * Source of scans. Implementations talk to the OS, the matcher only sees the resulting rasters.
 */
public interface ScreenCapturer {

	RasterImage capture(Rectangle area);

	/**
	 * Bounds of the primary screen in virtual screen coordinates
	 */
	Rectangle getPrimaryScreenBounds();

}
