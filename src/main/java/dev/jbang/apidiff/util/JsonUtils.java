package dev.jbang.apidiff.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.jbang.apidiff.model.SurfaceResult;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reading and writing the JSON form of surfaces and results */
public class JsonUtils {
	private static final ObjectMapper readMapper = JsonMapper.builder()
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.build();

	private static final ObjectMapper writeMapper = JsonMapper.builder()
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.enable(SerializationFeature.INDENT_OUTPUT)
			.build();

	private JsonUtils() {
		// Utility class
	}

	public static SurfaceResult readSurfaceFile(Path surfaceFile) throws IOException {
		return readMapper.readValue(surfaceFile.toFile(), SurfaceResult.class);
	}

	public static <T> T read(String json, Class<T> type) throws IOException {
		return readMapper.readValue(json, type);
	}

	/** Save a result to file, followed by a newline */
	public static void saveFile(Path file, Object value) throws IOException {
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null) {
			FileUtils.ensureDirectory(parent);
		}
		try (var writer = Files.newBufferedWriter(file)) {
			write(writer, value);
		}
	}

	public static void write(Writer writer, Object value) throws IOException {
		writeMapper.writeValue(writer, value);
		writer.write("\n");
		writer.flush();
	}

	public static String toJson(Object value) throws IOException {
		return writeMapper.writeValueAsString(value);
	}
}
