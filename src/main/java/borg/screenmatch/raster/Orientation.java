package borg.screenmatch.raster;

public enum Orientation {

	/**
	 * First row in the buffer is the top row of the image.
	 */
	TOP_DOWN,

	/**
	 * First row in the buffer is the bottom row of the image, as in a DIB with positive height.
	 */
	BOTTOM_UP;

}
