package borg.imagesearch;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import borg.imagesearch.templatematching.InvalidToleranceException;
import borg.imagesearch.templatematching.RgbColor;

public class ImageSearchSettings {

	private static final Gson gson = new GsonBuilder().setPrettyPrinting().registerTypeAdapter(RgbColor.class, new RgbColorDeserializer()).create();

	public static final String SETTINGS_FILENAME = "image-search-settings.json";

	private int tolerance = 0;
	private boolean maskEnabled = false;
	private RgbColor maskColor = RgbColor.MAGENTA;
	private int workerThreads = Runtime.getRuntime().availableProcessors();

	public static File getDefaultFile() {
		return new File(System.getProperty("user.home"), SETTINGS_FILENAME);
	}

	/**
	 * @return The settings from the user's home directory, or null if there are none
	 */
	public static ImageSearchSettings load() throws IOException {
		return load(getDefaultFile());
	}

	/**
	 * @throws IllegalArgumentException
	 *             if the file holds a negative tolerance, a color channel outside 0..255 or enables masking without a
	 *             mask color
	 */
	public static ImageSearchSettings load(File settingsFile) throws IOException {
		if (settingsFile.exists()) {
			try (InputStreamReader reader = new InputStreamReader(new BufferedInputStream(new FileInputStream(settingsFile)), StandardCharsets.UTF_8)) {
				ImageSearchSettings settings = gson.fromJson(reader, ImageSearchSettings.class);
				if (settings != null) {
					settings.validate();
				}
				return settings;
			}
		}
		return null;
	}

	public static void save(ImageSearchSettings settings) throws IOException {
		save(getDefaultFile(), settings);
	}

	public static void save(File settingsFile, ImageSearchSettings settings) throws IOException {
		try (OutputStreamWriter writer = new OutputStreamWriter(new BufferedOutputStream(new FileOutputStream(settingsFile)), StandardCharsets.UTF_8)) {
			gson.toJson(settings, writer);
		}
	}

	/**
	 * @throws InvalidToleranceException
	 *             if the default tolerance is negative
	 * @throws IllegalArgumentException
	 *             if masking is enabled without a mask color
	 */
	public void validate() {
		if (this.tolerance < 0) {
			throw new InvalidToleranceException(this.tolerance);
		} else if (this.maskEnabled && this.maskColor == null) {
			throw new IllegalArgumentException("maskColor is required when maskEnabled is set");
		}
	}

	/**
	 * Default tolerance for searches which do not specify one
	 */
	public int getTolerance() {
		return tolerance;
	}

	public void setTolerance(int tolerance) {
		this.tolerance = tolerance;
	}

	public boolean isMaskEnabled() {
		return maskEnabled;
	}

	public void setMaskEnabled(boolean maskEnabled) {
		this.maskEnabled = maskEnabled;
	}

	public RgbColor getMaskColor() {
		return maskColor;
	}

	public void setMaskColor(RgbColor maskColor) {
		this.maskColor = maskColor;
	}

	/**
	 * The mask color if masking is enabled, otherwise null
	 */
	public RgbColor getEffectiveMask() {
		return this.maskEnabled ? this.maskColor : null;
	}

	public int getWorkerThreads() {
		return Math.max(1, workerThreads);
	}

	public void setWorkerThreads(int workerThreads) {
		this.workerThreads = workerThreads;
	}

	/**
	 * Builds colors through the constructor, so channel values outside 0..255 are rejected.
	 */
	static class RgbColorDeserializer implements JsonDeserializer<RgbColor> {

		@Override
		public RgbColor deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context) {
			if (!json.isJsonObject()) {
				throw new IllegalArgumentException("Color must be an object with r, g and b, but was " + json);
			}
			JsonObject color = json.getAsJsonObject();
			if (!color.has("r") || !color.has("g") || !color.has("b")) {
				throw new IllegalArgumentException("Color needs r, g and b, but was " + json);
			}
			return new RgbColor(color.get("r").getAsInt(), color.get("g").getAsInt(), color.get("b").getAsInt());
		}

	}

}
