package org.javai.promptir.tool;

import java.util.ArrayList;
import java.util.List;

/**
 * Line diff based on the longest common subsequence of two texts.
 */
public final class LineDiff {

	private LineDiff() {
	}

	/**
	 * Diffs two texts in unified style: a {@code ---}/{@code +++} header, then every line
	 * prefixed with a space (kept), {@code -} (removed) or {@code +} (added).
	 *
	 * @return the empty string when the texts are equal
	 */
	public static String unified(String left, String right, String leftLabel, String rightLabel) {
		if (left.equals(right)) {
			return "";
		}
		List<String> a = left.lines().toList();
		List<String> b = right.lines().toList();
		int[][] lcs = new int[a.size() + 1][b.size() + 1];
		for (int i = a.size() - 1; i >= 0; i--) {
			for (int j = b.size() - 1; j >= 0; j--) {
				lcs[i][j] = a.get(i).equals(b.get(j))
						? lcs[i + 1][j + 1] + 1
						: Math.max(lcs[i + 1][j], lcs[i][j + 1]);
			}
		}

		List<String> out = new ArrayList<>();
		out.add("--- " + leftLabel);
		out.add("+++ " + rightLabel);
		int i = 0;
		int j = 0;
		while (i < a.size() && j < b.size()) {
			if (a.get(i).equals(b.get(j))) {
				out.add(" " + a.get(i));
				i++;
				j++;
			} else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
				out.add("-" + a.get(i++));
			} else {
				out.add("+" + b.get(j++));
			}
		}
		while (i < a.size()) {
			out.add("-" + a.get(i++));
		}
		while (j < b.size()) {
			out.add("+" + b.get(j++));
		}
		return String.join("\n", out) + "\n";
	}
}
