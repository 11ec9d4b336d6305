package borg.screenmatch.session;

import java.awt.GraphicsDevice;
import java.awt.GraphicsEnvironment;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.image.BufferedImage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import borg.screenmatch.raster.RasterImage;
import borg.screenmatch.util.ImageUtil;

public class RobotScreenCapturer implements ScreenCapturer {

	static final Logger logger = LoggerFactory.getLogger(RobotScreenCapturer.class);

	private final Robot robot;

	public RobotScreenCapturer(Robot robot) {
		this.robot = robot;
	}

	@Override
	public RasterImage capture(Rectangle area) {
		BufferedImage screenCapture = this.robot.createScreenCapture(area);
		if (logger.isTraceEnabled()) {
			logger.trace("Captured " + screenCapture.getWidth() + "x" + screenCapture.getHeight() + " at " + area.x + "/" + area.y);
		}
		return ImageUtil.toRasterImage(screenCapture);
	}

	@Override
	public Rectangle getPrimaryScreenBounds() {
		GraphicsDevice primaryScreen = GraphicsEnvironment.getLocalGraphicsEnvironment().getDefaultScreenDevice();
		Rectangle bounds = primaryScreen.getDefaultConfiguration().getBounds();
		logger.debug("Primary screen is " + bounds.width + "x" + bounds.height + " at " + bounds.x + "/" + bounds.y);
		return bounds;
	}

}
