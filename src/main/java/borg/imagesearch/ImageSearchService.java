package borg.imagesearch;

import java.awt.AWTException;
import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import borg.imagesearch.templatematching.InvalidToleranceException;
import borg.imagesearch.templatematching.PixelBuffer;
import borg.imagesearch.templatematching.RgbColor;
import borg.imagesearch.templatematching.TemplateMatcher;
import borg.imagesearch.util.ImageUtil;

/**
 * Runs template searches, image file I/O and screen captures on a worker pool, so callers on an event loop or UI
 * thread are never blocked by a scan.
 * <p>
 * Queries are validated on the calling thread. A started task always runs to completion, there is no cancellation.
 */
public class ImageSearchService {

	static final Logger logger = LoggerFactory.getLogger(ImageSearchService.class);

	private final ExecutorService executor;
	private final ScreenReader screenReader;
	private final ImageSearchSettings settings;

	public ImageSearchService(ExecutorService executor, ScreenReader screenReader, ImageSearchSettings settings) {
		settings.validate();
		this.executor = executor;
		this.screenReader = screenReader;
		this.settings = settings;
	}

	/**
	 * Searches with the configured default tolerance and mask.
	 */
	public CompletableFuture<ScreenCoord> imageSearch(PixelBuffer source, PixelBuffer template) {
		return this.imageSearch(source, template, this.settings.getTolerance(), this.settings.getEffectiveMask());
	}

	/**
	 * @return Completes with the first matching anchor, or with null if there is none
	 * @throws InvalidToleranceException
	 *             if tolerance is negative
	 */
	public CompletableFuture<ScreenCoord> imageSearch(PixelBuffer source, PixelBuffer template, int tolerance, RgbColor mask) {
		checkQuery(source, template, tolerance);

		return CompletableFuture.supplyAsync(() -> {
			final long start = System.currentTimeMillis();
			ScreenCoord match = TemplateMatcher.findFirst(source, template, tolerance, mask);
			if (logger.isDebugEnabled()) {
				logger.debug("Searched " + template + " in " + source + " (tolerance=" + tolerance + ", mask=" + mask + "): " + (match == null ? "not found" : "found at " + match) + " in "
						+ (System.currentTimeMillis() - start) + "ms");
			}
			return match;
		}, this.executor);
	}

	/**
	 * Searches all occurrences with the configured default tolerance and mask.
	 */
	public CompletableFuture<List<ScreenCoord>> multipleImageSearch(PixelBuffer source, PixelBuffer template) {
		return this.multipleImageSearch(source, template, this.settings.getTolerance(), this.settings.getEffectiveMask());
	}

	/**
	 * @return Completes with all matching anchors in row-major order
	 * @throws InvalidToleranceException
	 *             if tolerance is negative
	 */
	public CompletableFuture<List<ScreenCoord>> multipleImageSearch(PixelBuffer source, PixelBuffer template, int tolerance, RgbColor mask) {
		checkQuery(source, template, tolerance);

		return CompletableFuture.supplyAsync(() -> {
			final long start = System.currentTimeMillis();
			List<ScreenCoord> matches = TemplateMatcher.findAll(source, template, tolerance, mask);
			if (logger.isDebugEnabled()) {
				logger.debug("Searched " + template + " in " + source + " (tolerance=" + tolerance + ", mask=" + mask + "): " + matches.size() + " matches in "
						+ (System.currentTimeMillis() - start) + "ms");
			}
			return matches;
		}, this.executor);
	}

	/**
	 * Completes exceptionally with an {@link IOException} if the file cannot be decoded.
	 */
	public CompletableFuture<PixelBuffer> readImage(File file) {
		return CompletableFuture.supplyAsync(() -> {
			try {
				return ImageUtil.readImage(file);
			} catch (IOException e) {
				throw new CompletionException(e);
			}
		}, this.executor);
	}

	/**
	 * Completes exceptionally with an {@link IOException} if the file cannot be written.
	 */
	public CompletableFuture<Void> writeImage(File file, PixelBuffer pixels) {
		return CompletableFuture.runAsync(() -> {
			try {
				ImageUtil.writeImage(file, pixels);
			} catch (IOException e) {
				throw new CompletionException(e);
			}
		}, this.executor);
	}

	/**
	 * Completes exceptionally with an {@link AWTException} if there is no screen.
	 */
	public CompletableFuture<ScreenCoord> getScreenSize() {
		return CompletableFuture.supplyAsync(() -> {
			try {
				return this.screenReader.getScreenSize();
			} catch (AWTException e) {
				throw new CompletionException(e);
			}
		}, this.executor);
	}

	/**
	 * Completes exceptionally with an {@link AWTException} if the screen cannot be captured.
	 */
	public CompletableFuture<PixelBuffer> takeScreenshot(int x, int y, int width, int height) {
		return CompletableFuture.supplyAsync(() -> {
			try {
				return this.screenReader.takeScreenshot(x, y, width, height);
			} catch (AWTException e) {
				throw new CompletionException(e);
			}
		}, this.executor);
	}

	public ImageSearchSettings getSettings() {
		return settings;
	}

	private static void checkQuery(PixelBuffer source, PixelBuffer template, int tolerance) {
		if (source == null || template == null) {
			throw new IllegalArgumentException("Source and template must not be null");
		} else if (tolerance < 0) {
			throw new InvalidToleranceException(tolerance);
		}
	}

}
