package borg.imagesearch.templatematching;

/**
 * Thrown when a search is started with a negative tolerance.
 */
public class InvalidToleranceException extends IllegalArgumentException {

	private static final long serialVersionUID = -2817390055231907144L;

	private final int tolerance;

	public InvalidToleranceException(int tolerance) {
		super("Tolerance must not be negative, but was " + tolerance);
		this.tolerance = tolerance;
	}

	public int getTolerance() {
		return tolerance;
	}

}
