package borg.imagesearch;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class ScreenCoordTest {

	@Test
	@DisplayName("Should sort in scan order, top row first")
	void compareTo_MixedCoords_SortsRowMajor() {
		List<ScreenCoord> coords = new ArrayList<>(Arrays.asList(new ScreenCoord(0, 2), new ScreenCoord(5, 0), new ScreenCoord(1, 2), new ScreenCoord(0, 0)));

		Collections.sort(coords);

		assertThat(coords).containsExactly(new ScreenCoord(0, 0), new ScreenCoord(5, 0), new ScreenCoord(0, 2), new ScreenCoord(1, 2));
	}

	@Test
	@DisplayName("Should print as x/y")
	void toString_Coord_PrintsSlashSeparated() {
		assertThat(new ScreenCoord(13, 4)).hasToString("13/4");
	}

}
