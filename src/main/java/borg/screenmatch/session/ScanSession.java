package borg.screenmatch.session;

import java.awt.Point;
import java.awt.Rectangle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import borg.screenmatch.raster.RasterImage;
import borg.screenmatch.templatematching.FindOptions;
import borg.screenmatch.templatematching.MatchResult;
import borg.screenmatch.templatematching.NoMatchFoundException;
import borg.screenmatch.templatematching.TemplateMatcher;

/**
 * Keeps the last captured screen area together with the matcher searching it, and translates matches into
 * screen coordinates.
 */
public class ScanSession {

	static final Logger logger = LoggerFactory.getLogger(ScanSession.class);

	private final ScreenCapturer screenCapturer;
	private final TemplateMatcher templateMatcher;

	private Rectangle captureArea = null;
	private long lastCaptureMillis = 0;

	public ScanSession(ScreenCapturer screenCapturer, TemplateMatcher templateMatcher) {
		this.screenCapturer = screenCapturer;
		this.templateMatcher = templateMatcher;
	}

	/**
	 * Captures the whole primary screen
	 */
	public void refresh() throws InterruptedException {
		this.refresh(this.screenCapturer.getPrimaryScreenBounds());
	}

	public synchronized void refresh(Rectangle area) throws InterruptedException {
		RasterImage scan = this.screenCapturer.capture(area);
		if (scan.getWidth() != area.width || scan.getHeight() != area.height) {
			throw new IllegalStateException("Captured " + scan + " does not match the requested area " + area.width + "x" + area.height);
		}
		this.templateMatcher.setScan(scan);
		this.captureArea = new Rectangle(area);
		this.lastCaptureMillis = System.currentTimeMillis();
	}

	public Point locate(RasterImage template) throws NoMatchFoundException, InterruptedException {
		return this.locate(template, this.templateMatcher.getDefaultOptions());
	}

	/**
	 * @return Top-left corner of the match in screen coordinates
	 */
	public synchronized Point locate(RasterImage template, FindOptions options) throws NoMatchFoundException, InterruptedException {
		return this.toScreen(this.locateRelative(template, options));
	}

	/**
	 * @return Top-left corner of the match relative to the captured area
	 */
	public synchronized MatchResult locateRelative(RasterImage template, FindOptions options) throws NoMatchFoundException, InterruptedException {
		if (this.captureArea == null) {
			throw new IllegalStateException("Nothing captured yet, call refresh() first");
		}
		return this.templateMatcher.findTemplate(template, options);
	}

	public synchronized Point toScreen(MatchResult match) {
		if (this.captureArea == null) {
			throw new IllegalStateException("Nothing captured yet, call refresh() first");
		}
		return new Point(this.captureArea.x + match.getX(), this.captureArea.y + match.getY());
	}

	public synchronized Rectangle getCaptureArea() {
		return this.captureArea == null ? null : new Rectangle(this.captureArea);
	}

	public synchronized long getLastCaptureMillis() {
		return lastCaptureMillis;
	}

	public TemplateMatcher getTemplateMatcher() {
		return templateMatcher;
	}

}
