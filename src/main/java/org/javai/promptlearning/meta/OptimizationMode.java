package org.javai.promptlearning.meta;

import java.util.Objects;

/**
 * What a batch rewrite mutates. The optimization loop is one state machine with two modes:
 * <ul>
 *   <li>{@link PromptRewrite} - the candidate prompt is rewritten; the result has the
 *       shape of the input prompt</li>
 *   <li>{@link RulesetEdit} - the prompt stays fixed and only the ruleset is rewritten;
 *       the result is the ruleset text</li>
 * </ul>
 */
public sealed interface OptimizationMode {

	/**
	 * Short name for logs and reports.
	 */
	String label();

	static OptimizationMode promptRewrite() {
		return PromptRewrite.INSTANCE;
	}

	static OptimizationMode rulesetEdit(String initialRuleset) {
		return new RulesetEdit(initialRuleset);
	}

	final class PromptRewrite implements OptimizationMode {
		static final PromptRewrite INSTANCE = new PromptRewrite();

		private PromptRewrite() {
		}

		@Override
		public String label() {
			return "prompt";
		}

		@Override
		public String toString() {
			return "PromptRewrite";
		}
	}

	/**
	 * @param initialRuleset the ruleset before the first batch
	 */
	record RulesetEdit(String initialRuleset) implements OptimizationMode {
		public RulesetEdit {
			Objects.requireNonNull(initialRuleset, "initialRuleset must not be null");
		}

		@Override
		public String label() {
			return "ruleset";
		}
	}
}
