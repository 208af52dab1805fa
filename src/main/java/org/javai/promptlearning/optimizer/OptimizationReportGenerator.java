package org.javai.promptlearning.optimizer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.javai.promptlearning.pricing.UsageSummary;
import org.javai.promptlearning.prompt.PromptMessage;
import org.javai.promptlearning.prompt.PromptRepresentation;

/**
 * Writes an {@link OptimizationResult} to a directory. Nothing is written unless the
 * caller asks for it.
 */
public class OptimizationReportGenerator {

	public static final String SUMMARY_FILE = "summary.csv";
	public static final String RESULT_FILE = "optimization_result.json";
	public static final String PROMPT_FILE = "optimized_prompt.txt";

	private final ObjectMapper objectMapper;

	public OptimizationReportGenerator() {
		this(new ObjectMapper());
	}

	public OptimizationReportGenerator(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
	}

	public void generateReport(OptimizationResult result, Path outputDirectory) throws IOException {
		Files.createDirectories(outputDirectory);

		// 1. One line per batch
		generateSummaryCSV(result, outputDirectory.resolve(SUMMARY_FILE));

		// 2. Full result
		generateResultJSON(result, outputDirectory.resolve(RESULT_FILE));

		// 3. The optimized text itself
		generateOptimizedText(result, outputDirectory.resolve(PROMPT_FILE));
	}

	private void generateSummaryCSV(OptimizationResult result, Path path) throws IOException {
		StringBuilder sb = new StringBuilder();
		sb.append("batch,start_row,row_count,token_count,status,attempts,cost,error");
		sb.append(System.lineSeparator());
		for (BatchReport batch : result.batches()) {
			sb.append(batch.index()).append(",");
			sb.append(batch.startRow()).append(",");
			sb.append(batch.rowCount()).append(",");
			sb.append(batch.tokenCount()).append(",");
			sb.append(batch.status()).append(",");
			sb.append(batch.attempts()).append(",");
			sb.append(formatCost(batch.cost())).append(",");
			if (batch.error() != null) {
				sb.append(csvQuote(batch.error()));
			}
			sb.append(System.lineSeparator());
		}
		Files.writeString(path, sb.toString(), StandardCharsets.UTF_8);
	}

	private void generateResultJSON(OptimizationResult result, Path path) throws IOException {
		ObjectNode root = objectMapper.createObjectNode();
		root.put("mode", result.mode().label());
		root.put("stopReason", result.stopReason().name());
		root.set("prompt", promptNode(result.prompt()));
		if (result.ruleset() != null) {
			root.put("ruleset", result.ruleset());
		}
		else {
			root.putNull("ruleset");
		}

		UsageSummary usage = result.usage();
		ObjectNode usageNode = root.putObject("usage");
		usageNode.put("totalCost", usage.totalCost());
		usageNode.put("totalInputTokens", usage.totalInputTokens());
		usageNode.put("totalOutputTokens", usage.totalOutputTokens());
		usageNode.put("totalTokens", usage.totalTokens());

		ArrayNode batches = root.putArray("batches");
		for (BatchReport batch : result.batches()) {
			ObjectNode node = batches.addObject();
			node.put("index", batch.index());
			node.put("startRow", batch.startRow());
			node.put("rowCount", batch.rowCount());
			node.put("tokenCount", batch.tokenCount());
			node.put("status", batch.status().name());
			node.put("attempts", batch.attempts());
			node.put("cost", batch.cost());
			if (batch.error() != null) {
				node.put("error", batch.error());
			}
			else {
				node.putNull("error");
			}
		}
		objectMapper.writeValue(path.toFile(), root);
	}

	private ObjectNode promptNode(PromptRepresentation prompt) {
		ObjectNode node = objectMapper.createObjectNode();
		if (prompt instanceof PromptRepresentation.PlainText plain) {
			node.put("type", "text");
			node.put("text", plain.text());
			return node;
		}
		if (prompt instanceof PromptRepresentation.VersionedPrompt versioned) {
			node.put("type", "versioned");
			node.put("name", versioned.name());
			node.put("modelName", versioned.modelName());
			node.put("modelProvider", versioned.modelProvider());
			node.put("description", versioned.description());
		}
		else {
			node.put("type", "messages");
		}
		ArrayNode messages = node.putArray("messages");
		for (PromptMessage message : prompt.messages()) {
			messages.addObject()
					.put("role", message.role())
					.put("content", message.content());
		}
		return node;
	}

	private void generateOptimizedText(OptimizationResult result, Path path) throws IOException {
		String text;
		if (result.ruleset() != null) {
			text = result.ruleset();
		}
		else if (result.prompt() instanceof PromptRepresentation.PlainText plain) {
			text = plain.text();
		}
		else {
			StringBuilder sb = new StringBuilder();
			List<PromptMessage> messages = result.prompt().messages();
			for (int i = 0; i < messages.size(); i++) {
				if (i > 0) {
					sb.append("\n\n");
				}
				sb.append("[").append(messages.get(i).role()).append("]\n").append(messages.get(i).content());
			}
			text = sb.toString();
		}
		Files.writeString(path, text, StandardCharsets.UTF_8);
	}

	private String formatCost(double cost) {
		return String.format(Locale.ROOT, "%.6f", cost);
	}

	private String csvQuote(String value) {
		String escaped = value.replace("\"", "\"\"");
		return "\"" + escaped + "\"";
	}
}
