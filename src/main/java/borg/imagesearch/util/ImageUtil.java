package borg.imagesearch.util;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

import javax.imageio.ImageIO;

import boofcv.io.image.ConvertBufferedImage;
import boofcv.struct.image.InterleavedU8;
import borg.imagesearch.templatematching.PixelBuffer;

public abstract class ImageUtil {

	private static final String DEFAULT_FORMAT = "png";

	/**
	 * Decodes an image file into a pixel buffer with 3 bytes (R, G, B) per pixel. Transparency is dropped.
	 *
	 * @throws IOException
	 *             if the file cannot be read or is not an image format known to ImageIO
	 */
	public static PixelBuffer readImage(File file) throws IOException {
		BufferedImage image = ImageIO.read(file);
		if (image == null) {
			throw new IOException("No image reader for " + file);
		}
		return toPixelBuffer(image);
	}

	/**
	 * Encodes the red, green and blue bytes of a pixel buffer. The format is taken from the file extension and defaults
	 * to PNG. A fourth byte per pixel is not written.
	 *
	 * @throws IOException
	 *             if the file cannot be written or there is no writer for the format
	 */
	public static void writeImage(File file, PixelBuffer pixels) throws IOException {
		if (pixels.isEmpty()) {
			throw new IOException("Cannot write an image of " + pixels.getWidth() + "x" + pixels.getHeight() + " pixels to " + file);
		}
		String format = formatOf(file);
		if (!ImageIO.write(toBufferedImage(pixels), format, file)) {
			throw new IOException("No image writer for format " + format);
		}
	}

	public static PixelBuffer toPixelBuffer(BufferedImage image) {
		BufferedImage rgb = toRgb(image);
		InterleavedU8 interleaved = new InterleavedU8(rgb.getWidth(), rgb.getHeight(), 3);
		ConvertBufferedImage.convertFromInterleaved(rgb, interleaved, true);
		return PixelBuffer.fromInterleaved(interleaved);
	}

	/**
	 * Opaque RGB image of the same size. Not possible for an empty pixel buffer, Java2D images are at least 1x1.
	 */
	public static BufferedImage toBufferedImage(PixelBuffer pixels) {
		InterleavedU8 interleaved = pixels.getStride() == 3 ? pixels.toInterleaved() : dropExtraBands(pixels.toInterleaved());
		BufferedImage image = new BufferedImage(pixels.getWidth(), pixels.getHeight(), BufferedImage.TYPE_INT_RGB);
		return ConvertBufferedImage.convertTo(interleaved, image, true);
	}

	/**
	 * Redraws the image as {@link BufferedImage#TYPE_INT_RGB} unless it already is one.
	 */
	public static BufferedImage toRgb(BufferedImage original) {
		if (original.getType() == BufferedImage.TYPE_INT_RGB) {
			return original;
		} else {
			BufferedImage resultImage = new BufferedImage(original.getWidth(), original.getHeight(), BufferedImage.TYPE_INT_RGB);
			Graphics2D resultGraphics = resultImage.createGraphics();
			try {
				resultGraphics.drawImage(original, 0, 0, null);
			} finally {
				resultGraphics.dispose();
			}
			return resultImage;
		}
	}

	private static InterleavedU8 dropExtraBands(InterleavedU8 original) {
		InterleavedU8 rgb = new InterleavedU8(original.width, original.height, 3);
		for (int y = 0; y < original.height; y++) {
			for (int x = 0; x < original.width; x++) {
				for (int band = 0; band < 3; band++) {
					rgb.setBand(x, y, band, original.getBand(x, y, band));
				}
			}
		}
		return rgb;
	}

	private static String formatOf(File file) {
		String name = file.getName();
		int dot = name.lastIndexOf('.');
		if (dot < 0 || dot == name.length() - 1) {
			return DEFAULT_FORMAT;
		}
		return name.substring(dot + 1).toLowerCase();
	}

}
