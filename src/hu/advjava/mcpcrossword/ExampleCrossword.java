package hu.advjava.mcpcrossword;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/** Small puzzles bundled with the server and used by the tests. */
public enum ExampleCrossword {
	SINGLE(List.of("___"), List.of("CAT", "DOG")),
	CROSS(List.of(
			"#_#",
			"___",
			"#_#"),
			List.of("CAT", "HAT", "DOG")),
	CROSS_UNSOLVABLE(List.of(
			"#_#",
			"___",
			"#_#"),
			List.of("CAT", "DOG")),
	GRID_5X5(List.of(
			"_____",
			"_#_#_",
			"_____",
			"_#_#_",
			"_____"),
			List.of("ABOUT", "TREAT", "RANGE", "ACTOR", "OCEAN", "TITLE", "THEME", "THERE", "OFTEN",
					"MEDIA", "THREE", "ADMIT", "ORDER", "TRADE", "MONEY", "HOUSE", "STONE", "EARTH"));

	private final List<String> structure;
	private final List<String> words;

	private ExampleCrossword(List<String> structure, List<String> words) {
		this.structure = structure;
		this.words = words;
	}

	public List<String> getStructure() {
		return structure;
	}

	public List<String> getWords() {
		return words;
	}

	public Crossword toCrossword() {
		return Crossword.fromRows(structure, words);
	}

	// matches a name or uri produced by nameToUri from the constant's name
	public static final BiFunction<String, Function<String, String>, Optional<ExampleCrossword>> findByName = (name, nameToUri) ->
			Arrays.stream(values()).filter(e -> nameToUri.apply(e.name()).equals(name)).findFirst();
}
