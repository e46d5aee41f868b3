package borg.imagesearch.templatematching;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import borg.imagesearch.ScreenCoord;

/**
 * Finds the positions at which a template image occurs inside a source image.
 * <p>
 * Anchors (top left corner of the template in source coordinates) are visited row by row, left to right. At every
 * anchor where the template fits completely, the template pixels are compared row by row against the source until the
 * first mismatch. The comparison rule depends on the tolerance and the optional mask color, see
 * {@link PixelComparator#forQuery(int, RgbColor)}.
 * <p>
 * Stateless and thread-safe.
 */
public abstract class TemplateMatcher {

	public static ScreenCoord findFirst(PixelBuffer source, PixelBuffer template) {
		return TemplateMatcher.findFirst(source, template, 0, null);
	}

	/**
	 * @param tolerance
	 *            Maximum allowed deviation per channel, 0 for an exact match
	 * @param mask
	 *            Wildcard color of the template, null to compare all template pixels
	 * @return The first matching anchor in row-major order, or null if the template occurs nowhere
	 * @throws InvalidToleranceException
	 *             if tolerance is negative
	 */
	public static ScreenCoord findFirst(PixelBuffer source, PixelBuffer template, int tolerance, RgbColor mask) {
		List<ScreenCoord> matches = TemplateMatcher.scan(source, template, tolerance, mask, true);
		return matches.isEmpty() ? null : matches.get(0);
	}

	public static List<ScreenCoord> findAll(PixelBuffer source, PixelBuffer template) {
		return TemplateMatcher.findAll(source, template, 0, null);
	}

	/**
	 * @param tolerance
	 *            Maximum allowed deviation per channel, 0 for an exact match
	 * @param mask
	 *            Wildcard color of the template, null to compare all template pixels
	 * @return All matching anchors in row-major order, empty if the template occurs nowhere
	 * @throws InvalidToleranceException
	 *             if tolerance is negative
	 */
	public static List<ScreenCoord> findAll(PixelBuffer source, PixelBuffer template, int tolerance, RgbColor mask) {
		return TemplateMatcher.scan(source, template, tolerance, mask, false);
	}

	private static List<ScreenCoord> scan(PixelBuffer source, PixelBuffer template, int tolerance, RgbColor mask, boolean firstOnly) {
		if (source == null || template == null) {
			throw new IllegalArgumentException("Source and template must not be null");
		}
		final PixelComparator comparator = PixelComparator.forQuery(tolerance, mask);

		if (source.isEmpty() || template.isEmpty()) {
			return Collections.emptyList();
		}

		final byte[] sourceData = source.data();
		final byte[] templateData = template.data();
		final int sourceWidth = source.getWidth();
		final int sourceStride = source.getStride();
		final int templateWidth = template.getWidth();
		final int templateHeight = template.getHeight();
		final int templateStride = template.getStride();

		// Anchors beyond these limits would let the template hang over the right or bottom edge
		final int maxX = sourceWidth - templateWidth;
		final int maxY = source.getHeight() - templateHeight;

		List<ScreenCoord> matches = new ArrayList<>();
		for (int yInSource = 0; yInSource <= maxY; yInSource++) {
			for (int xInSource = 0; xInSource <= maxX; xInSource++) {
				boolean found = true;
				for (int yInTemplate = 0; yInTemplate < templateHeight && found; yInTemplate++) {
					int sourceIndex = ((yInSource + yInTemplate) * sourceWidth + xInSource) * sourceStride;
					int templateIndex = yInTemplate * templateWidth * templateStride;
					for (int xInTemplate = 0; xInTemplate < templateWidth; xInTemplate++) {
						if (!comparator.matches(sourceData, sourceIndex, templateData, templateIndex)) {
							found = false;
							break;
						}
						sourceIndex += sourceStride;
						templateIndex += templateStride;
					}
				}
				if (found) {
					matches.add(new ScreenCoord(xInSource, yInSource));
					if (firstOnly) {
						return matches;
					}
				}
			}
		}

		return matches;
	}

}
