package borg.imagesearch.templatematching;

import java.util.Arrays;

import boofcv.struct.image.InterleavedU8;

/**
 * Immutable raster of 8 bit pixels, stored row-major (top row first, left pixel first) in one flat byte array.
 * <p>
 * Each pixel takes {@link #getStride()} bytes. The first three bytes of a pixel are red, green and blue. A fourth
 * byte, usually alpha, is carried along but never looked at by the {@link TemplateMatcher}.
 */
public class PixelBuffer {

	private final int width;
	private final int height;
	private final int stride;
	private final byte[] data;

	/**
	 * @param data
	 *            Pixel data, copied. Must hold exactly width * height * stride bytes.
	 * @throws MalformedBufferException
	 *             if the dimensions do not fit the data
	 */
	public PixelBuffer(int width, int height, int stride, byte[] data) {
		this.width = width;
		this.height = height;
		this.stride = stride;
		this.data = data == null ? null : Arrays.copyOf(data, data.length);

		this.validate();
	}

	/**
	 * Copies a BoofCV interleaved image, which may be a sub-image of a larger one.
	 */
	public static PixelBuffer fromInterleaved(InterleavedU8 image) {
		final int rowLength = image.width * image.numBands;
		byte[] data = new byte[rowLength * image.height];
		for (int y = 0; y < image.height; y++) {
			System.arraycopy(image.data, image.startIndex + y * image.stride, data, y * rowLength, rowLength);
		}
		return new PixelBuffer(image.width, image.height, image.numBands, data);
	}

	/**
	 * Copies this buffer into a new BoofCV interleaved image with one band per byte of stride.
	 */
	public InterleavedU8 toInterleaved() {
		InterleavedU8 image = new InterleavedU8(this.width, this.height, this.stride);
		System.arraycopy(this.data, 0, image.data, image.startIndex, this.data.length);
		return image;
	}

	/**
	 * @throws MalformedBufferException
	 *             if width, height or stride are inconsistent with the length of the pixel data
	 */
	public void validate() {
		if (this.data == null) {
			throw new MalformedBufferException("Pixel data must not be null");
		} else if (this.width < 0 || this.height < 0) {
			throw new MalformedBufferException("Dimensions must not be negative, but were " + this.width + "x" + this.height);
		} else if (this.stride < 3) {
			throw new MalformedBufferException("Stride must be at least 3 bytes per pixel, but was " + this.stride);
		}

		long expectedLength = (long) this.width * (long) this.height * (long) this.stride;
		if (this.data.length != expectedLength) {
			throw new MalformedBufferException("Expected " + expectedLength + " bytes for " + this.width + "x" + this.height + "x" + this.stride + ", but got " + this.data.length);
		}
	}

	/**
	 * Channel value of a single pixel, 0..255.
	 *
	 * @param k
	 *            0 = red, 1 = green, 2 = blue
	 */
	public int channel(int x, int y, int k) {
		return this.data[(y * this.width + x) * this.stride + k] & 0xFF;
	}

	public RgbColor pixel(int x, int y) {
		return new RgbColor(this.channel(x, y, 0), this.channel(x, y, 1), this.channel(x, y, 2));
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	/**
	 * Bytes per pixel
	 */
	public int getStride() {
		return stride;
	}

	public boolean isEmpty() {
		return this.width == 0 || this.height == 0;
	}

	/**
	 * A copy of the pixel data
	 */
	public byte[] getData() {
		return Arrays.copyOf(this.data, this.data.length);
	}

	/**
	 * The pixel data itself, for read-only access by the matcher.
	 */
	byte[] data() {
		return this.data;
	}

	@Override
	public String toString() {
		return this.width + "x" + this.height + " (" + this.stride + " bytes per pixel)";
	}

}
