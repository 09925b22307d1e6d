package hu.advjava.mcpcrossword;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A partial or complete mapping from variables to words.
 * Instances never change: {@link #with(Variable, String)} returns an extended copy,
 * so every search branch owns its assignment.
 */
public final class Assignment {
	private static final Assignment EMPTY = new Assignment(Map.of());

	private final Map<Variable, String> words;

	private Assignment(Map<Variable, String> words) {
		this.words = words;
	}

	public static Assignment empty() {
		return EMPTY;
	}

	public static Assignment of(Map<Variable, String> words) {
		return new Assignment(Collections.unmodifiableMap(new LinkedHashMap<>(words)));
	}

	public Assignment with(Variable variable, String word) {
		if (words.containsKey(variable)) throw new IllegalStateException("Already assigned: " + variable);
		var extended = new LinkedHashMap<>(words);
		extended.put(variable, word);
		return new Assignment(Collections.unmodifiableMap(extended));
	}

	public Optional<String> get(Variable variable) {
		return Optional.ofNullable(words.get(variable));
	}

	public boolean contains(Variable variable) {
		return words.containsKey(variable);
	}

	public Set<Variable> variables() {
		return words.keySet();
	}

	public Map<Variable, String> asMap() {
		return words;
	}

	public int size() {
		return words.size();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Assignment other && words.equals(other.words);
	}

	@Override
	public int hashCode() {
		return words.hashCode();
	}

	@Override
	public String toString() {
		return words.toString();
	}
}
