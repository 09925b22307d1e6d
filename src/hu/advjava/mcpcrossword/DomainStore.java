package hu.advjava.mcpcrossword;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Candidate words per variable. Word order follows the word list, so iteration is repeatable.
 * The search never shares a store between branches: each branch works on its own {@link #copy()}.
 */
public final class DomainStore {
	private final Map<Variable, Set<String>> domains;

	private DomainStore(Map<Variable, Set<String>> domains) {
		this.domains = domains;
	}

	/** Every variable starts with the full word list. */
	public static DomainStore initial(Crossword crossword) {
		Map<Variable, Set<String>> domains = new LinkedHashMap<>();
		crossword.variables().forEach(v -> domains.put(v, new LinkedHashSet<>(crossword.words())));
		return new DomainStore(domains);
	}

	public static DomainStore of(Map<Variable, ? extends Collection<String>> candidates) {
		Map<Variable, Set<String>> domains = new LinkedHashMap<>();
		candidates.forEach((v, words) -> domains.put(v, new LinkedHashSet<>(words)));
		return new DomainStore(domains);
	}

	public DomainStore copy() {
		return of(domains);
	}

	/**
	 * Drops every word whose length differs from its variable's length.
	 * @return false if some domain ended up empty
	 */
	public boolean enforceNodeConsistency() {
		domains.forEach((v, words) -> words.removeIf(word -> word.length() != v.length()));
		return domains.values().stream().noneMatch(Set::isEmpty);
	}

	/** Narrows the domain of {@code v} to the single word chosen for it. */
	public void restrict(Variable v, String word) {
		Set<String> words = domainOf(v);
		words.clear();
		words.add(word);
	}

	public boolean removeIf(Variable v, Predicate<String> filter) {
		return domainOf(v).removeIf(filter);
	}

	public Set<String> domain(Variable v) {
		return Collections.unmodifiableSet(domainOf(v));
	}

	public int size(Variable v) {
		return domainOf(v).size();
	}

	public boolean isEmpty(Variable v) {
		return domainOf(v).isEmpty();
	}

	private Set<String> domainOf(Variable v) {
		Set<String> words = domains.get(v);
		if (words == null) throw new IllegalArgumentException("Unknown variable: " + v);
		return words;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof DomainStore other && domains.equals(other.domains);
	}

	@Override
	public int hashCode() {
		return domains.hashCode();
	}

	@Override
	public String toString() {
		return domains.toString();
	}
}
