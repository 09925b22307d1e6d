package hu.advjava.mcpcrossword;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import hu.advjava.mcpcrossword.Variable.Direction;

/**
 * Crossword
 * Immutable puzzle structure: fillable cells, word slots and their overlaps.
 *
 * Structure rows:
 *   '_'  fillable cell
 *   else blocked cell
 * A variable is every maximal horizontal or vertical run of at least two fillable cells.
 * Variables are found in row-major order of their start cell, ACROSS before DOWN;
 * this is also the order the solver uses to break ties.
 */
public final class Crossword {
	public static final char FILLABLE = '_';

	private final int height;
	private final int width;
	private final boolean[][] structure;
	private final List<String> words;
	private final List<Variable> variables;
	private final Map<Arc, Overlap> overlaps;
	private final Map<Variable, Set<Variable>> neighbors;

	private Crossword(boolean[][] structure, List<String> words) {
		this.height = structure.length;
		this.width = height == 0 ? 0 : structure[0].length;
		this.structure = structure;
		this.words = words;
		this.variables = Collections.unmodifiableList(findVariables());
		this.overlaps = Collections.unmodifiableMap(findOverlaps());
		this.neighbors = Collections.unmodifiableMap(variables.stream().collect(Collectors.toMap(
				v -> v,
				v -> Collections.unmodifiableSet(variables.stream()
						.filter(y -> overlaps.containsKey(new Arc(v, y)))
						.collect(Collectors.<Variable, Set<Variable>>toCollection(LinkedHashSet::new))),
				(a, b) -> a,
				LinkedHashMap::new)));
	}

	/**
	 * Builds a puzzle from text rows and a word list. Shorter rows are padded with blocked cells.
	 * Words are trimmed and upper-cased; blanks are dropped and duplicates keep their first position.
	 */
	public static Crossword fromRows(List<String> rows, Collection<String> words) {
		if (rows == null || rows.isEmpty()) throw new IllegalArgumentException("Structure must have at least one row");
		if (words == null) throw new IllegalArgumentException("Word list must be given");
		if (rows.stream().anyMatch(Objects::isNull)) throw new IllegalArgumentException("Structure rows must not be null");
		if (words.stream().anyMatch(Objects::isNull)) throw new IllegalArgumentException("Words must not be null");

		int width = rows.stream().mapToInt(String::length).max().orElse(0);
		boolean[][] structure = rows.stream()
				.map(row -> {
					boolean[] cells = new boolean[width];
					IntStream.range(0, row.length()).forEach(j -> cells[j] = row.charAt(j) == FILLABLE);
					return cells;
				})
				.toArray(boolean[][]::new);

		List<String> normalized = words.stream()
				.map(w -> w.trim().toUpperCase(Locale.ROOT))
				.filter(w -> !w.isEmpty())
				.distinct()
				.toList();
		return new Crossword(structure, normalized);
	}

	private List<Variable> findVariables() {
		List<Variable> found = new ArrayList<>();
		for (int i = 0; i < height; i++) {
			for (int j = 0; j < width; j++) {
				if (!structure[i][j]) continue;

				boolean startsAcross = j == 0 || !structure[i][j - 1];
				if (startsAcross) {
					int length = runLength(i, j, 0, 1);
					if (length > 1) found.add(new Variable(i, j, Direction.ACROSS, length));
				}
				boolean startsDown = i == 0 || !structure[i - 1][j];
				if (startsDown) {
					int length = runLength(i, j, 1, 0);
					if (length > 1) found.add(new Variable(i, j, Direction.DOWN, length));
				}
			}
		}
		return found;
	}

	private int runLength(int i, int j, int di, int dj) {
		int length = 0;
		while (i < height && j < width && structure[i][j]) {
			length++;
			i += di;
			j += dj;
		}
		return length;
	}

	private Map<Arc, Overlap> findOverlaps() {
		Map<Arc, Overlap> found = new LinkedHashMap<>();
		for (Variable x : variables) {
			List<Cell> xCells = cells(x);
			for (Variable y : variables) {
				if (x.equals(y)) continue;
				Overlap mirrored = found.get(new Arc(y, x));
				if (mirrored != null) {
					found.put(new Arc(x, y), mirrored.swapped());
					continue;
				}
				List<Cell> yCells = cells(y);
				xCells.stream()
						.filter(yCells::contains)
						.findFirst()
						.ifPresent(shared -> found.put(new Arc(x, y), new Overlap(xCells.indexOf(shared), yCells.indexOf(shared))));
			}
		}
		return found;
	}

	public record Cell(int row, int col) {}

	public List<Cell> cells(Variable v) {
		return IntStream.range(0, v.length()).mapToObj(k -> new Cell(v.rowAt(k), v.colAt(k))).toList();
	}

	public Optional<Overlap> overlap(Variable x, Variable y) {
		return Optional.ofNullable(overlaps.get(new Arc(x, y)));
	}

	public Map<Arc, Overlap> overlaps() {
		return overlaps;
	}

	public Set<Variable> neighbors(Variable v) {
		return neighbors.getOrDefault(v, Set.of());
	}

	public List<Variable> variables() {
		return variables;
	}

	public List<String> words() {
		return words;
	}

	public int height() {
		return height;
	}

	public int width() {
		return width;
	}

	public boolean isFillable(int row, int col) {
		return structure[row][col];
	}

	/** Letters placed by an assignment, {@code null} where nothing is placed. */
	public Character[][] letterGrid(Assignment assignment) {
		Character[][] letters = new Character[height][width];
		assignment.asMap().forEach((v, word) -> IntStream.range(0, Math.min(word.length(), v.length()))
				.forEach(k -> letters[v.rowAt(k)][v.colAt(k)] = word.charAt(k)));
		return letters;
	}
}
