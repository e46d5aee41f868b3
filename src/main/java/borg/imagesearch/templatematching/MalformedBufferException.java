package borg.imagesearch.templatematching;

/**
 * Thrown when the declared width, height and stride of a {@link PixelBuffer} do not fit its pixel data.
 */
public class MalformedBufferException extends IllegalArgumentException {

	private static final long serialVersionUID = 6021348917762236510L;

	public MalformedBufferException(String message) {
		super(message);
	}

}
