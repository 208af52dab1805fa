package org.javai.promptlearning.optimizer;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.javai.promptlearning.ConfigurationException;
import org.javai.promptlearning.llm.RetryPolicy;
import org.javai.promptlearning.prompt.PromptMessage;

/**
 * Settings of an optimization run.
 *
 * <p>Settings are passed explicitly to the components that need them; nothing reads
 * configuration from ambient state.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * OptimizerSettings settings = OptimizerSettings.defaults();
 *
 * // Custom configuration
 * OptimizerSettings settings = OptimizerSettings.builder()
 *         .model("gpt-4o")
 *         .budgetLimit(1.0)
 *         .build();
 *
 * // From environment variables
 * OptimizerSettings settings = OptimizerSettings.fromEnvironment(System.getenv());
 * }</pre>
 *
 * @param model model used for meta-prompt calls; also selects pricing and token encoding
 * @param contextSizeTokens token budget of one batch
 * @param budgetLimit spending limit in currency units; {@code null} disables the check
 * @param maxRetries retries after the first attempt of each call
 * @param initialRetryDelay wait before the first retry
 * @param backoffMultiplier growth factor of the retry delay
 * @param editableRole role of the message that is optimized
 * @param requireTemplateVariables reject rewrites that drop a placeholder of the prompt
 * @param annotationModel model used for annotation calls
 */
public record OptimizerSettings(
		String model,
		int contextSizeTokens,
		Double budgetLimit,
		int maxRetries,
		Duration initialRetryDelay,
		double backoffMultiplier,
		String editableRole,
		boolean requireTemplateVariables,
		String annotationModel
) {

	public static final String DEFAULT_MODEL = "gpt-4";
	public static final int DEFAULT_CONTEXT_SIZE_TOKENS = 128_000;
	public static final double DEFAULT_BUDGET_LIMIT = 5.0;

	public static final String ENV_MODEL = "PROMPT_LEARNING_MODEL";
	public static final String ENV_CONTEXT_SIZE = "PROMPT_LEARNING_CONTEXT_SIZE";
	public static final String ENV_BUDGET_LIMIT = "PROMPT_LEARNING_BUDGET_LIMIT";
	public static final String ENV_MAX_RETRIES = "PROMPT_LEARNING_MAX_RETRIES";

	public OptimizerSettings {
		if (model == null || model.isBlank()) {
			throw new IllegalArgumentException("model must not be blank");
		}
		if (contextSizeTokens <= 0) {
			throw new IllegalArgumentException("contextSizeTokens must be positive");
		}
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must be non-negative");
		}
		Objects.requireNonNull(initialRetryDelay, "initialRetryDelay must not be null");
		if (backoffMultiplier < 1.0) {
			throw new IllegalArgumentException("backoffMultiplier must be >= 1");
		}
		Objects.requireNonNull(editableRole, "editableRole must not be null");
		if (annotationModel == null || annotationModel.isBlank()) {
			annotationModel = model;
		}
	}

	public static OptimizerSettings defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Defaults overridden by whichever {@code PROMPT_LEARNING_*} variables are set.
	 *
	 * @param environment variable map, usually {@code System.getenv()}
	 * @throws ConfigurationException if a variable holds a malformed value
	 */
	public static OptimizerSettings fromEnvironment(Map<String, String> environment) {
		Builder builder = builder();
		String model = environment.get(ENV_MODEL);
		if (model != null && !model.isBlank()) {
			builder.model(model.trim());
		}
		String contextSize = environment.get(ENV_CONTEXT_SIZE);
		if (contextSize != null) {
			int value = parseInt(ENV_CONTEXT_SIZE, contextSize);
			if (value <= 0) {
				throw new ConfigurationException(ENV_CONTEXT_SIZE + " must be positive, was " + value);
			}
			builder.contextSizeTokens(value);
		}
		String budget = environment.get(ENV_BUDGET_LIMIT);
		if (budget != null) {
			builder.budgetLimit(parseDouble(ENV_BUDGET_LIMIT, budget));
		}
		String retries = environment.get(ENV_MAX_RETRIES);
		if (retries != null) {
			int value = parseInt(ENV_MAX_RETRIES, retries);
			if (value < 0) {
				throw new ConfigurationException(ENV_MAX_RETRIES + " must not be negative, was " + value);
			}
			builder.maxRetries(value);
		}
		return builder.build();
	}

	/**
	 * Whether spending is limited at all.
	 */
	public boolean hasBudgetLimit() {
		return budgetLimit != null && budgetLimit > 0;
	}

	public RetryPolicy retryPolicy() {
		return new RetryPolicy(maxRetries, initialRetryDelay, backoffMultiplier);
	}

	public Builder toBuilder() {
		return new Builder()
				.model(model)
				.contextSizeTokens(contextSizeTokens)
				.budgetLimit(budgetLimit)
				.maxRetries(maxRetries)
				.initialRetryDelay(initialRetryDelay)
				.backoffMultiplier(backoffMultiplier)
				.editableRole(editableRole)
				.requireTemplateVariables(requireTemplateVariables)
				.annotationModel(annotationModel);
	}

	private static int parseInt(String name, String value) {
		try {
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e) {
			throw new ConfigurationException(name + " is not an integer: '" + value + "'", e);
		}
	}

	private static double parseDouble(String name, String value) {
		try {
			return Double.parseDouble(value.trim());
		}
		catch (NumberFormatException e) {
			throw new ConfigurationException(name + " is not a number: '" + value + "'", e);
		}
	}

	/**
	 * Builder for {@link OptimizerSettings}.
	 */
	public static class Builder {
		private String model = DEFAULT_MODEL;
		private int contextSizeTokens = DEFAULT_CONTEXT_SIZE_TOKENS;
		private Double budgetLimit = DEFAULT_BUDGET_LIMIT;
		private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;
		private Duration initialRetryDelay = RetryPolicy.DEFAULT_INITIAL_DELAY;
		private double backoffMultiplier = RetryPolicy.DEFAULT_BACKOFF_MULTIPLIER;
		private String editableRole = PromptMessage.USER;
		private boolean requireTemplateVariables = true;
		private String annotationModel;

		private Builder() {}

		public Builder model(String model) {
			this.model = model;
			return this;
		}

		public Builder contextSizeTokens(int contextSizeTokens) {
			this.contextSizeTokens = contextSizeTokens;
			return this;
		}

		/**
		 * @param budgetLimit spending limit; {@code null} or a non-positive value means unlimited
		 */
		public Builder budgetLimit(Double budgetLimit) {
			this.budgetLimit = budgetLimit;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		public Builder initialRetryDelay(Duration initialRetryDelay) {
			this.initialRetryDelay = initialRetryDelay;
			return this;
		}

		public Builder backoffMultiplier(double backoffMultiplier) {
			this.backoffMultiplier = backoffMultiplier;
			return this;
		}

		public Builder editableRole(String editableRole) {
			this.editableRole = editableRole;
			return this;
		}

		public Builder requireTemplateVariables(boolean requireTemplateVariables) {
			this.requireTemplateVariables = requireTemplateVariables;
			return this;
		}

		/**
		 * @param annotationModel model for annotation calls; defaults to the main model
		 */
		public Builder annotationModel(String annotationModel) {
			this.annotationModel = annotationModel;
			return this;
		}

		public OptimizerSettings build() {
			return new OptimizerSettings(model, contextSizeTokens, budgetLimit, maxRetries,
					initialRetryDelay, backoffMultiplier, editableRole, requireTemplateVariables, annotationModel);
		}
	}
}
