package hu.advjava.mcpcrossword;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Binary constraint propagation over a {@link DomainStore}: revise and AC-3.
 * Domains only shrink here.
 */
public final class ConsistencyEngine {
	private final Crossword crossword;
	private final SearchStatistics statistics;

	public ConsistencyEngine(Crossword crossword) {
		this(crossword, new SearchStatistics());
	}

	ConsistencyEngine(Crossword crossword, SearchStatistics statistics) {
		this.crossword = crossword;
		this.statistics = statistics;
	}

	/**
	 * Removes from the domain of x every word without a supporting word in the domain of y.
	 * @return whether the domain of x changed; always false if x and y do not overlap
	 */
	public boolean revise(DomainStore domains, Variable x, Variable y) {
		statistics.revised();
		return crossword.overlap(x, y).map(overlap -> {
			Set<String> ys = domains.domain(y);
			return domains.removeIf(x, wx -> ys.stream().noneMatch(wy -> agree(wx, wy, overlap)));
		}).orElse(false);
	}

	// words too short for the overlap never agree
	static boolean agree(String wx, String wy, Overlap overlap) {
		return overlap.ix() < wx.length() && overlap.iy() < wy.length()
				&& wx.charAt(overlap.ix()) == wy.charAt(overlap.iy());
	}

	/** AC-3 starting from every arc of the puzzle. */
	public boolean ac3(DomainStore domains) {
		return ac3(domains, allArcs());
	}

	/**
	 * AC-3 starting from the given arcs, processed first in first out.
	 * @return false as soon as a domain becomes empty
	 */
	public boolean ac3(DomainStore domains, Collection<Arc> initialArcs) {
		Deque<Arc> queue = new ArrayDeque<>(initialArcs);
		Set<Arc> queued = new HashSet<>(initialArcs);

		while (!queue.isEmpty()) {
			Arc arc = queue.poll();
			queued.remove(arc);
			Variable x = arc.x(), y = arc.y();

			boolean changed = revise(domains, x, y);
			if (domains.isEmpty(x)) return false;
			if (!changed) continue;

			// x shrank: every other neighbour has to be checked against it again
			crossword.neighbors(x).stream()
					.filter(z -> !z.equals(y))
					.map(z -> new Arc(z, x))
					.filter(queued::add)
					.forEach(queue::add);
		}
		return true;
	}

	public List<Arc> allArcs() {
		return List.copyOf(crossword.overlaps().keySet());
	}

	/** Arcs pointing at {@code v}, one per neighbour. */
	public List<Arc> arcsTowards(Variable v) {
		return crossword.neighbors(v).stream().map(n -> new Arc(n, v)).toList();
	}
}
