package hu.advjava.mcpcrossword;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * CrosswordSolver
 * Fills a {@link Crossword} by backtracking search over partial assignments.
 *
 *   1) node consistency (word length), then AC-3 over all arcs
 *   2) pick the unassigned variable with the fewest candidates (MRV),
 *      ties: most neighbours (degree), then puzzle order
 *   3) try its words in least-constraining-value order
 *   4) per word: copy the domains, fix the variable to the word, re-run AC-3 on the
 *      arcs pointing at it, validate, recurse
 *
 * Every candidate starts from its own copy of the parent's domains, so nothing one branch
 * prunes is visible to its siblings or its parent.
 * Not thread-safe; use one instance per thread.
 */
public final class CrosswordSolver {
	public static enum State {
		SOLVED(-1),
		NOSOLUTION(0),
		SOLVEDUNIQUE(1),
		SOLVEDMANY(Long.MAX_VALUE);

		private final long value;

		private State(long value) {
			this.value = value;
		}

		// below 0: solved, uniqueness unknown; 2 or more: many
		public static State stateFromSols(long sols) {
			if (sols < 0) return SOLVED;
			if (sols >= 2) return SOLVEDMANY;
			return Arrays.stream(State.values()).filter(e -> e.value == sols).findAny().get();
		}
	}

	private final Crossword crossword;
	private final SearchStatistics statistics = new SearchStatistics();
	private final ConsistencyEngine engine;
	private final AssignmentValidator validator;
	private SearchListener listener = SearchListener.NONE;

	// counting mode
	private long solutionCount;
	private long solutionLimit;

	public CrosswordSolver(Crossword crossword) {
		this.crossword = crossword;
		this.engine = new ConsistencyEngine(crossword, statistics);
		this.validator = new AssignmentValidator(crossword);
	}

	public CrosswordSolver withListener(SearchListener listener) {
		this.listener = listener == null ? SearchListener.NONE : listener;
		return this;
	}

	/* ===================== Public API ===================== */

	/** A complete consistent assignment, or empty if the puzzle has none. */
	public Optional<Assignment> solve() {
		statistics.reset();
		return initialDomains().flatMap(domains -> backtrack(Assignment.empty(), domains));
	}

	/** Counts solutions up to {@code limit}; {@code limit <= 0} counts all of them. */
	public long countSolutions(long limit) {
		statistics.reset();
		this.solutionCount = 0;
		this.solutionLimit = (limit <= 0) ? Long.MAX_VALUE : limit;

		initialDomains().ifPresent(domains -> enumerate(Assignment.empty(), domains, solution -> ++solutionCount < solutionLimit));
		return solutionCount;
	}

	public State solveCount(long limit) {
		return State.stateFromSols(countSolutions(limit));
	}

	public SearchStatistics statistics() {
		return statistics;
	}

	/** Node- and arc-consistent starting domains, empty if either pass wipes out a domain. */
	Optional<DomainStore> initialDomains() {
		DomainStore domains = DomainStore.initial(crossword);
		if (!domains.enforceNodeConsistency()) return Optional.empty();
		if (!engine.ac3(domains)) return Optional.empty();
		return Optional.of(domains);
	}

	/* ===================== Search ===================== */

	Optional<Assignment> backtrack(Assignment assignment, DomainStore domains) {
		statistics.nodeEntered();
		if (validator.complete(assignment)) return Optional.of(assignment);

		Variable var = selectUnassignedVariable(assignment, domains);
		for (String word : orderDomainValues(var, assignment, domains)) {
			Optional<Assignment> result = branch(assignment, domains, var, word)
					.flatMap(b -> backtrack(b.assignment(), b.domains()));
			if (result.isPresent()) return result;
		}
		return Optional.empty();
	}

	/** Visits every solution below this node; stops once {@code onSolution} returns false. */
	private boolean enumerate(Assignment assignment, DomainStore domains, Predicate<Assignment> onSolution) {
		statistics.nodeEntered();
		if (validator.complete(assignment)) return onSolution.test(assignment);

		Variable var = selectUnassignedVariable(assignment, domains);
		for (String word : orderDomainValues(var, assignment, domains)) {
			Optional<Branch> next = branch(assignment, domains, var, word);
			if (next.isPresent() && !enumerate(next.get().assignment(), next.get().domains(), onSolution)) return false;
		}
		return true;
	}

	private record Branch(Assignment assignment, DomainStore domains) {}

	// the parent's domains are only read here
	private Optional<Branch> branch(Assignment assignment, DomainStore domains, Variable var, String word) {
		int depth = assignment.size();
		statistics.branchTried();
		listener.branchEntered(depth, var, word, domains);

		Assignment extended = assignment.with(var, word);
		DomainStore branchDomains = domains.copy();
		branchDomains.restrict(var, word);

		if (engine.ac3(branchDomains, engine.arcsTowards(var)) && validator.consistent(extended)) {
			return Optional.of(new Branch(extended, branchDomains));
		}
		statistics.branchRejected();
		listener.branchRejected(depth, var, word);
		return Optional.empty();
	}

	/* ===================== Heuristics ===================== */

	Variable selectUnassignedVariable(Assignment assignment, DomainStore domains) {
		// min() keeps the first of equal elements, i.e. the earliest variable in puzzle order
		return crossword.variables().stream()
				.filter(v -> !assignment.contains(v))
				.min(Comparator.<Variable>comparingInt(domains::size)
						.thenComparing(Comparator.<Variable>comparingInt(v -> crossword.neighbors(v).size()).reversed()))
				.orElseThrow(() -> new IllegalStateException("Every variable is assigned"));
	}

	/**
	 * Words of {@code var} ordered by how many candidates they would rule out among the
	 * unassigned neighbours, fewest first. Equal counts keep domain order.
	 */
	List<String> orderDomainValues(Variable var, Assignment assignment, DomainStore domains) {
		List<Variable> open = crossword.neighbors(var).stream().filter(n -> !assignment.contains(n)).toList();
		return domains.domain(var).stream()
				.sorted(Comparator.comparingLong((String word) -> eliminated(var, word, open, domains)))
				.toList();
	}

	private long eliminated(Variable var, String word, List<Variable> neighbours, DomainStore domains) {
		return neighbours.stream()
				.mapToLong(n -> {
					Overlap overlap = crossword.overlap(var, n).orElseThrow();
					return domains.domain(n).stream().filter(nw -> !ConsistencyEngine.agree(word, nw, overlap)).count();
				})
				.sum();
	}
}
