package org.javai.promptir.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Selection helpers for the harness, applied to results it has already collected.
 */
public final class SelectionPolicies {

	private SelectionPolicies() {
	}

	/**
	 * Selects the result with the strictly greatest score; on ties the earliest wins.
	 *
	 * @throws EmptyCandidateSetException if {@code results} is empty
	 * @throws IllegalArgumentException if a result has no numeric value at {@code scoreField}
	 */
	public static SelectionOutcome argmax(List<IterationResult> results, String scoreField) {
		if (results.isEmpty()) {
			throw new EmptyCandidateSetException(scoreField);
		}
		int best = -1;
		double bestScore = 0;
		for (IterationResult result : inIterationOrder(results)) {
			double score = score(result, scoreField);
			if (best < 0 || score > bestScore) {
				best = result.index();
				bestScore = score;
			}
		}
		return new SelectionOutcome(best, List.of());
	}

	/**
	 * Evaluates results in iteration order and stops at the first one whose value at
	 * {@code predicatePath} is {@code true}.
	 */
	public static SelectionOutcome firstSuccess(List<IterationResult> results, String predicatePath) {
		return firstSuccess(results, predicatePath, result -> Boolean.TRUE.equals(result.value(predicatePath)));
	}

	public static SelectionOutcome firstSuccess(SelectionPolicy.FirstSuccess policy, List<IterationResult> results) {
		return firstSuccess(results, policy.predicate());
	}

	/**
	 * @param description names the predicate in the failure message
	 * @throws NoSuccessfulIterationException if no result satisfies the predicate
	 */
	public static SelectionOutcome firstSuccess(List<IterationResult> results, String description,
			Predicate<IterationResult> predicate) {
		List<IterationResult> ordered = inIterationOrder(results);
		for (int i = 0; i < ordered.size(); i++) {
			if (predicate.test(ordered.get(i))) {
				List<Integer> skipped = ordered.subList(i + 1, ordered.size()).stream()
						.map(IterationResult::index)
						.toList();
				return new SelectionOutcome(ordered.get(i).index(), skipped);
			}
		}
		throw new NoSuccessfulIterationException(description, results.size());
	}

	private static List<IterationResult> inIterationOrder(List<IterationResult> results) {
		List<IterationResult> ordered = new ArrayList<>(results);
		ordered.sort(Comparator.comparingInt(IterationResult::index));
		return ordered;
	}

	private static double score(IterationResult result, String scoreField) {
		Object value = result.value(scoreField);
		if (value instanceof Number number && Double.isFinite(number.doubleValue())) {
			return number.doubleValue();
		}
		throw new IllegalArgumentException("Iteration " + result.index() + " has no finite numeric '" + scoreField
				+ "' (found " + value + ")");
	}
}
