package borg.imagesearch.templatematching;

import java.util.Random;

/**
 * Builders for small pixel buffers used by the tests.
 */
final class TestImages {

	private TestImages() {
	}

	static PixelBuffer filled(int width, int height, int stride, RgbColor color) {
		byte[] data = new byte[width * height * stride];
		for (int i = 0; i < width * height; i++) {
			data[i * stride] = (byte) color.getR();
			data[i * stride + 1] = (byte) color.getG();
			data[i * stride + 2] = (byte) color.getB();
			if (stride > 3) {
				data[i * stride + 3] = (byte) 255;
			}
		}
		return new PixelBuffer(width, height, stride, data);
	}

	static PixelBuffer withPixel(PixelBuffer image, int x, int y, RgbColor color) {
		byte[] data = image.getData();
		int index = (y * image.getWidth() + x) * image.getStride();
		data[index] = (byte) color.getR();
		data[index + 1] = (byte) color.getG();
		data[index + 2] = (byte) color.getB();
		return new PixelBuffer(image.getWidth(), image.getHeight(), image.getStride(), data);
	}

	/**
	 * Random image drawing every channel from a small set of values, so that repeated patterns are likely.
	 */
	static PixelBuffer random(Random random, int width, int height, int stride, int[] channelValues) {
		byte[] data = new byte[width * height * stride];
		for (int i = 0; i < data.length; i++) {
			data[i] = (byte) channelValues[random.nextInt(channelValues.length)];
		}
		return new PixelBuffer(width, height, stride, data);
	}

	/**
	 * Copy of a region, with the given stride.
	 */
	static PixelBuffer crop(PixelBuffer image, int x0, int y0, int width, int height, int stride) {
		byte[] data = new byte[width * height * stride];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				for (int k = 0; k < 3; k++) {
					data[(y * width + x) * stride + k] = (byte) image.channel(x0 + x, y0 + y, k);
				}
			}
		}
		return new PixelBuffer(width, height, stride, data);
	}

}
