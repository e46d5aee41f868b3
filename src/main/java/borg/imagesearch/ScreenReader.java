package borg.imagesearch;

import java.awt.AWTException;
import java.awt.DisplayMode;
import java.awt.GraphicsEnvironment;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.image.BufferedImage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import borg.imagesearch.templatematching.PixelBuffer;
import borg.imagesearch.util.ImageUtil;

/**
 * Captures regions of the primary screen as pixel buffers.
 * <p>
 * The robot is created on the first capture, so instances can be constructed in headless environments.
 */
public class ScreenReader {

	static final Logger logger = LoggerFactory.getLogger(ScreenReader.class);

	private Robot robot = null;

	/**
	 * Resolution of the primary screen as width/height.
	 *
	 * @throws AWTException
	 *             if there is no screen
	 */
	public ScreenCoord getScreenSize() throws AWTException {
		if (GraphicsEnvironment.isHeadless()) {
			throw new AWTException("Headless environment, there is no screen");
		}
		DisplayMode displayMode = GraphicsEnvironment.getLocalGraphicsEnvironment().getDefaultScreenDevice().getDisplayMode();
		return new ScreenCoord(displayMode.getWidth(), displayMode.getHeight());
	}

	/**
	 * @return The captured region, 3 bytes (R, G, B) per pixel
	 * @throws AWTException
	 *             if the screen cannot be captured
	 */
	public PixelBuffer takeScreenshot(int x, int y, int width, int height) throws AWTException {
		if (width <= 0 || height <= 0) {
			throw new IllegalArgumentException("Screenshot size must be positive, but was " + width + "x" + height);
		}

		BufferedImage screenCapture = this.getRobot().createScreenCapture(new Rectangle(x, y, width, height));
		logger.debug("Captured " + width + "x" + height + " at " + x + "/" + y);
		return ImageUtil.toPixelBuffer(screenCapture);
	}

	private synchronized Robot getRobot() throws AWTException {
		if (this.robot == null) {
			this.robot = new Robot();
			ScreenCoord screenSize = this.getScreenSize();
			logger.debug("Primary screen resolution is " + screenSize.x + "x" + screenSize.y);
		}
		return this.robot;
	}

}
