package borg.imagesearch;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import borg.imagesearch.templatematching.PixelBuffer;

@Configuration
public class ImageSearchApplication {

	static final Logger logger = LoggerFactory.getLogger(ImageSearchApplication.class);

	private static final String OPTION_ALL = "--all";

	/**
	 * Usage: &lt;template image&gt; [source image] [--all]
	 * <p>
	 * Without a source image the whole primary screen is captured and searched.
	 */
	public static void main(String[] args) throws Exception {
		boolean all = false;
		List<String> files = new ArrayList<>();
		for (String arg : args) {
			if (OPTION_ALL.equals(arg)) {
				all = true;
			} else {
				files.add(arg);
			}
		}
		if (files.isEmpty() || files.size() > 2) {
			logger.error("Usage: ImageSearchApplication <template image> [source image] [" + OPTION_ALL + "]");
			System.exit(1);
		}

		try (AnnotationConfigApplicationContext appctx = new AnnotationConfigApplicationContext(ImageSearchApplication.class)) {
			ImageSearchService imageSearchService = appctx.getBean(ImageSearchService.class);

			PixelBuffer template = imageSearchService.readImage(new File(files.get(0))).join();
			PixelBuffer source = null;
			if (files.size() > 1) {
				source = imageSearchService.readImage(new File(files.get(1))).join();
			} else {
				ScreenCoord screenSize = imageSearchService.getScreenSize().join();
				source = imageSearchService.takeScreenshot(0, 0, screenSize.x, screenSize.y).join();
			}

			if (all) {
				List<ScreenCoord> matches = imageSearchService.multipleImageSearch(source, template).join();
				logger.info("Found " + matches.size() + " matches: " + matches);
			} else {
				ScreenCoord match = imageSearchService.imageSearch(source, template).join();
				if (match != null) {
					logger.info("Found at " + match);
				} else {
					logger.info("Not found");
				}
			}
		}
	}

	@Bean
	public ImageSearchSettings imageSearchSettings() throws IOException {
		ImageSearchSettings settings = ImageSearchSettings.load();
		if (settings == null) {
			logger.debug("No " + ImageSearchSettings.SETTINGS_FILENAME + " found, using defaults");
			settings = new ImageSearchSettings();
		}
		return settings;
	}

	@Bean(destroyMethod = "shutdown")
	public ExecutorService imageSearchExecutor(ImageSearchSettings imageSearchSettings) {
		CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("ImageSearch-");
		threadFactory.setDaemon(true);
		return Executors.newFixedThreadPool(imageSearchSettings.getWorkerThreads(), threadFactory);
	}

	@Bean
	public ScreenReader screenReader() {
		return new ScreenReader();
	}

	@Bean
	public ImageSearchService imageSearchService(ExecutorService imageSearchExecutor, ScreenReader screenReader, ImageSearchSettings imageSearchSettings) {
		return new ImageSearchService(imageSearchExecutor, screenReader, imageSearchSettings);
	}

}
