package hu.advjava.mcpcrossword;

/**
 * Observer of the backtracking search. The domains handed to {@link #branchEntered} are the ones
 * the candidate starts from, i.e. the parent's; listeners must not modify them.
 */
public interface SearchListener {
	SearchListener NONE = new SearchListener() {};

	default void branchEntered(int depth, Variable variable, String word, DomainStore domains) {}

	default void branchRejected(int depth, Variable variable, String word) {}
}
