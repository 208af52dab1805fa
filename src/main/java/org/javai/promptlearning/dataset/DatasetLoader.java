package org.javai.promptlearning.dataset;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.promptlearning.DatasetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads datasets from disk.
 *
 * <ul>
 *   <li>{@code .json}: an array of objects</li>
 *   <li>{@code .jsonl} / {@code .ndjson}: one object per line, blank lines ignored</li>
 *   <li>{@code .csv}: a header row followed by records; every value is a string</li>
 * </ul>
 */
public class DatasetLoader {

	private static final Logger logger = LoggerFactory.getLogger(DatasetLoader.class);
	private static final TypeReference<List<LinkedHashMap<String, Object>>> RECORD_LIST = new TypeReference<>() {};
	private static final TypeReference<LinkedHashMap<String, Object>> RECORD = new TypeReference<>() {};

	private final ObjectMapper jsonMapper;
	private final CsvMapper csvMapper;

	public DatasetLoader() {
		this(new ObjectMapper());
	}

	public DatasetLoader(ObjectMapper jsonMapper) {
		this.jsonMapper = Objects.requireNonNull(jsonMapper, "jsonMapper must not be null");
		this.csvMapper = new CsvMapper();
	}

	public Dataset load(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		if (!Files.isRegularFile(path)) {
			throw new DatasetException("Dataset file not found: " + path);
		}
		String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
		try {
			Dataset dataset;
			if (name.endsWith(".json")) {
				dataset = readJsonArray(path);
			}
			else if (name.endsWith(".jsonl") || name.endsWith(".ndjson")) {
				dataset = readJsonLines(path);
			}
			else if (name.endsWith(".csv")) {
				dataset = readCsv(path);
			}
			else {
				throw new DatasetException("Unsupported dataset format: " + path
						+ " (expected .json, .jsonl, .ndjson or .csv)");
			}
			logger.debug("Loaded {} rows with columns {} from {}", dataset.size(), dataset.columns(), path);
			return dataset;
		}
		catch (IOException e) {
			throw new DatasetException("Failed to load dataset from " + path + ": " + e.getMessage(), e);
		}
	}

	private Dataset readJsonArray(Path path) throws IOException {
		List<LinkedHashMap<String, Object>> records = jsonMapper.readValue(path.toFile(), RECORD_LIST);
		if (records == null) {
			throw new DatasetException("Expected a JSON array of objects in " + path + " but found null");
		}
		int nullIndex = records.indexOf(null);
		if (nullIndex >= 0) {
			throw new DatasetException("Null record at index " + nullIndex + " of " + path);
		}
		return Dataset.of(records);
	}

	private Dataset readJsonLines(Path path) throws IOException {
		List<Map<String, Object>> records = new ArrayList<>();
		List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			if (line.isBlank()) {
				continue;
			}
			Map<String, Object> values;
			try {
				values = jsonMapper.readValue(line, RECORD);
			}
			catch (IOException e) {
				throw new DatasetException("Malformed JSON on line " + (i + 1) + " of " + path, e);
			}
			if (values == null) {
				throw new DatasetException("Null record on line " + (i + 1) + " of " + path);
			}
			records.add(values);
		}
		return Dataset.of(records);
	}

	private Dataset readCsv(Path path) throws IOException {
		CsvSchema schema = CsvSchema.emptySchema().withHeader();
		List<Map<String, Object>> records = new ArrayList<>();
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
				MappingIterator<Map<String, String>> it = csvMapper.readerForMapOf(String.class)
						.with(schema)
						.readValues(reader)) {
			while (it.hasNext()) {
				records.add(new LinkedHashMap<>(it.next()));
			}
		}
		return Dataset.of(records);
	}
}
