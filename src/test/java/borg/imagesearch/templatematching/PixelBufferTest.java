package borg.imagesearch.templatematching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import boofcv.struct.image.InterleavedU8;

public class PixelBufferTest {

	@Test
	@DisplayName("Should read channels row-major with the given stride")
	void channel_RowMajorLayout_ReturnsUnsignedValues() {
		byte[] data = { 1, 2, 3, 0, 4, 5, 6, 0, //
				7, 8, 9, 0, (byte) 200, (byte) 255, (byte) 128, 0 };
		PixelBuffer buffer = new PixelBuffer(2, 2, 4, data);

		assertThat(buffer.channel(1, 0, 2)).isEqualTo(6);
		assertThat(buffer.channel(0, 1, 0)).isEqualTo(7);
		assertThat(buffer.pixel(1, 1)).isEqualTo(new RgbColor(200, 255, 128));
	}

	@Test
	@DisplayName("Should reject data that does not fit the dimensions")
	void constructor_LengthMismatch_Throws() {
		assertThatThrownBy(() -> new PixelBuffer(2, 2, 3, new byte[11])).isInstanceOf(MalformedBufferException.class).hasMessageContaining("12");
		assertThatThrownBy(() -> new PixelBuffer(2, 2, 3, new byte[13])).isInstanceOf(MalformedBufferException.class);
		assertThatThrownBy(() -> new PixelBuffer(1, 1, 4, new byte[3])).isInstanceOf(MalformedBufferException.class);
	}

	@Test
	@DisplayName("Should reject negative dimensions, short strides and missing data")
	void constructor_InvalidShape_Throws() {
		assertThatThrownBy(() -> new PixelBuffer(-1, -3, 3, new byte[9])).isInstanceOf(MalformedBufferException.class);
		assertThatThrownBy(() -> new PixelBuffer(2, 1, 1, new byte[2])).isInstanceOf(MalformedBufferException.class);
		assertThatThrownBy(() -> new PixelBuffer(1, 1, 3, null)).isInstanceOf(MalformedBufferException.class);
	}

	@Test
	@DisplayName("Should not overflow when computing the expected length")
	void constructor_HugeDimensions_Throws() {
		assertThatThrownBy(() -> new PixelBuffer(65536, 65536, 4, new byte[0])).isInstanceOf(MalformedBufferException.class);
	}

	@Test
	@DisplayName("Should accept empty buffers")
	void constructor_ZeroArea_IsEmpty() {
		assertThat(new PixelBuffer(0, 7, 3, new byte[0]).isEmpty()).isTrue();
		assertThat(new PixelBuffer(1, 1, 3, new byte[3]).isEmpty()).isFalse();
	}

	@Test
	@DisplayName("Should not be affected by later changes to the caller's array")
	void constructor_CallerMutatesArray_BufferUnchanged() {
		byte[] data = { 10, 20, 30 };
		PixelBuffer buffer = new PixelBuffer(1, 1, 3, data);
		data[0] = 99;
		buffer.getData()[1] = 99;

		assertThat(buffer.pixel(0, 0)).isEqualTo(new RgbColor(10, 20, 30));
	}

	@Test
	@DisplayName("Should copy interleaved images including sub-images")
	void fromInterleaved_SubImage_CopiesRegion() {
		InterleavedU8 image = new InterleavedU8(4, 3, 3);
		image.set(2, 1, 11, 22, 33);
		image.set(3, 2, 44, 55, 66);
		InterleavedU8 subimage = image.subimage(2, 1, 4, 3);

		PixelBuffer buffer = PixelBuffer.fromInterleaved(subimage);

		assertThat(buffer.getWidth()).isEqualTo(2);
		assertThat(buffer.getHeight()).isEqualTo(2);
		assertThat(buffer.getStride()).isEqualTo(3);
		assertThat(buffer.pixel(0, 0)).isEqualTo(new RgbColor(11, 22, 33));
		assertThat(buffer.pixel(1, 1)).isEqualTo(new RgbColor(44, 55, 66));
		assertThat(buffer.pixel(1, 0)).isEqualTo(new RgbColor(0, 0, 0));
	}

	@Test
	@DisplayName("Should convert to an interleaved image with one band per byte")
	void toInterleaved_FourBytesPerPixel_KeepsAllBands() {
		PixelBuffer buffer = new PixelBuffer(1, 2, 4, new byte[] { 1, 2, 3, 4, 5, 6, 7, 8 });

		InterleavedU8 image = buffer.toInterleaved();

		assertThat(image.getNumBands()).isEqualTo(4);
		assertThat(image.getBand(0, 1, 0)).isEqualTo(5);
		assertThat(image.getBand(0, 1, 3)).isEqualTo(8);
	}

}
