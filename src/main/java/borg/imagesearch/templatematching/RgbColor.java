package borg.imagesearch.templatematching;

import java.io.Serializable;

/**
 * Red, green and blue channel values, each in the range 0..255.
 * <p>
 * Used as the wildcard key of a masked search: template pixels of exactly this color match any source pixel.
 */
public class RgbColor implements Serializable {

	private static final long serialVersionUID = -7318002846127394251L;

	/**
	 * Conventional wildcard color for templates
	 */
	public static final RgbColor MAGENTA = new RgbColor(255, 0, 255);

	private final int r;
	private final int g;
	private final int b;

	public RgbColor(int r, int g, int b) {
		if (r < 0 || r > 255 || g < 0 || g > 255 || b < 0 || b > 255) {
			throw new IllegalArgumentException("Channel values must be in 0..255, but were " + r + "," + g + "," + b);
		}
		this.r = r;
		this.g = g;
		this.b = b;
	}

	public int getR() {
		return r;
	}

	public int getG() {
		return g;
	}

	public int getB() {
		return b;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		RgbColor other = (RgbColor) obj;
		return r == other.r && g == other.g && b == other.b;
	}

	@Override
	public int hashCode() {
		return (r << 16) | (g << 8) | b;
	}

	@Override
	public String toString() {
		return "rgb(" + r + "," + g + "," + b + ")";
	}

}
