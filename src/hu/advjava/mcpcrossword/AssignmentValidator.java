package hu.advjava.mcpcrossword;

import java.util.HashSet;
import java.util.List;

/** Checks assignments against the puzzle's constraints; never looks at domains. */
public final class AssignmentValidator {
	private final Crossword crossword;

	public AssignmentValidator(Crossword crossword) {
		this.crossword = crossword;
	}

	// every variable of the puzzle has a word
	public boolean complete(Assignment assignment) {
		return assignment.size() == crossword.variables().size()
				&& assignment.variables().containsAll(crossword.variables());
	}

	/**
	 * Overlapping letters agree, each word fits its slot and no word is used twice,
	 * not even by two slots that do not cross.
	 */
	public boolean consistent(Assignment assignment) {
		var words = assignment.asMap();

		boolean lengthsFit = words.entrySet().stream().allMatch(e -> e.getKey().length() == e.getValue().length());
		if (!lengthsFit) return false;

		boolean distinct = new HashSet<>(words.values()).size() == words.size();
		if (!distinct) return false;

		List<Variable> assigned = List.copyOf(words.keySet());
		return assigned.stream().allMatch(x -> assigned.stream()
				.filter(y -> !x.equals(y))
				.allMatch(y -> crossword.overlap(x, y)
						.map(overlap -> ConsistencyEngine.agree(words.get(x), words.get(y), overlap))
						.orElse(true)));
	}
}
