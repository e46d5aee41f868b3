package borg.imagesearch.templatematching;

/**
 * Decides whether a single source pixel matches the template pixel it is laid over.
 * <p>
 * Both indexes point at the red byte of the respective pixel; green and blue follow directly.
 */
public interface PixelComparator {

	boolean matches(byte[] source, int sourceIndex, byte[] template, int templateIndex);

	/**
	 * Chooses the comparison rule for a search.
	 *
	 * @param tolerance
	 *            0 for exact comparison, otherwise the maximum per-channel deviation
	 * @param mask
	 *            Template pixels of this color match everything. May be null.
	 */
	static PixelComparator forQuery(int tolerance, RgbColor mask) {
		if (tolerance < 0) {
			throw new InvalidToleranceException(tolerance);
		}

		if (tolerance == 0) {
			return mask == null ? new Exact() : new Masked(mask, new Exact());
		} else {
			return mask == null ? new Tolerant(tolerance) : new Masked(mask, new Tolerant(tolerance));
		}
	}

	static class Exact implements PixelComparator {

		@Override
		public boolean matches(byte[] source, int sourceIndex, byte[] template, int templateIndex) {
			return source[sourceIndex] == template[templateIndex] && source[sourceIndex + 1] == template[templateIndex + 1] && source[sourceIndex + 2] == template[templateIndex + 2];
		}

	}

	/**
	 * Accepts a source channel value within [t - tolerance, t + tolerance] of the template channel value t, clamped to 0..255.
	 */
	static class Tolerant implements PixelComparator {

		private final int tolerance;

		Tolerant(int tolerance) {
			this.tolerance = tolerance;
		}

		@Override
		public boolean matches(byte[] source, int sourceIndex, byte[] template, int templateIndex) {
			return this.withinWindow(source[sourceIndex] & 0xFF, template[templateIndex] & 0xFF) && this.withinWindow(source[sourceIndex + 1] & 0xFF, template[templateIndex + 1] & 0xFF)
					&& this.withinWindow(source[sourceIndex + 2] & 0xFF, template[templateIndex + 2] & 0xFF);
		}

		private boolean withinWindow(int s, int t) {
			final int low = Math.max(0, t - this.tolerance);
			final int high = Math.min(255, t + this.tolerance);
			return s >= low && s <= high;
		}

	}

	/**
	 * Lets template pixels of the mask color pass unconditionally and hands all others to the wrapped comparator.
	 * Only the template pixel is checked against the mask, a source pixel of the mask color is compared as usual.
	 */
	static class Masked implements PixelComparator {

		private final byte maskR;
		private final byte maskG;
		private final byte maskB;
		private final PixelComparator delegate;

		Masked(RgbColor mask, PixelComparator delegate) {
			this.maskR = (byte) mask.getR();
			this.maskG = (byte) mask.getG();
			this.maskB = (byte) mask.getB();
			this.delegate = delegate;
		}

		@Override
		public boolean matches(byte[] source, int sourceIndex, byte[] template, int templateIndex) {
			if (template[templateIndex] == this.maskR && template[templateIndex + 1] == this.maskG && template[templateIndex + 2] == this.maskB) {
				return true;
			}
			return this.delegate.matches(source, sourceIndex, template, templateIndex);
		}

	}

}
