package hu.advjava.mcpcrossword;

/**
 * A word slot of the grid: the start cell, the direction the word runs in and its length.
 * Two variables are equal iff all four components match.
 */
public record Variable(int i, int j, Direction direction, int length) {
	public static enum Direction {
		ACROSS,
		DOWN;
	}

	public Variable {
		if (direction == null) throw new IllegalArgumentException("Direction must be given");
		if (i < 0 || j < 0) throw new IllegalArgumentException("Start cell must be on the grid: (" + i + "," + j + ")");
		if (length <= 0) throw new IllegalArgumentException("Length must be positive: " + length);
	}

	/** Row of the k-th cell of this slot. */
	public int rowAt(int k) {
		return i + (direction == Direction.DOWN ? k : 0);
	}

	/** Column of the k-th cell of this slot. */
	public int colAt(int k) {
		return j + (direction == Direction.ACROSS ? k : 0);
	}

	@Override
	public String toString() {
		return "(%d, %d) %s : %d".formatted(i, j, direction, length);
	}
}
