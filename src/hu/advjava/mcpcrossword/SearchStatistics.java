package hu.advjava.mcpcrossword;

// Counters of one solve or count run.
public final class SearchStatistics {
	private long nodes;
	private long branches;
	private long rejectedBranches;
	private long revisions;

	void reset() {
		nodes = branches = rejectedBranches = revisions = 0;
	}

	void nodeEntered() { nodes++; }
	void branchTried() { branches++; }
	void branchRejected() { rejectedBranches++; }
	void revised() { revisions++; }

	/** Calls of the backtracking step. */
	public long nodes() { return nodes; }
	/** Candidate words tried for some variable. */
	public long branches() { return branches; }
	/** Candidates dropped because propagation or the validator refused them. */
	public long rejectedBranches() { return rejectedBranches; }
	/** Calls of revise, including the ones before the search. */
	public long revisions() { return revisions; }

	@Override
	public String toString() {
		return "nodes=%d branches=%d rejected=%d revisions=%d".formatted(nodes, branches, rejectedBranches, revisions);
	}
}
