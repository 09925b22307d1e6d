package hu.advjava.mcpcrossword;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import hu.advjava.mcpcrossword.Variable.Direction;

public class AssignmentValidatorTest {
	private static final Crossword GRID = ExampleCrossword.GRID_5X5.toCrossword();
	private static final AssignmentValidator VALIDATOR = new AssignmentValidator(GRID);

	private static final Variable TOP = new Variable(0, 0, Direction.ACROSS, 5);
	private static final Variable MIDDLE = new Variable(2, 0, Direction.ACROSS, 5);
	private static final Variable BOTTOM = new Variable(4, 0, Direction.ACROSS, 5);
	private static final Variable LEFT = new Variable(0, 0, Direction.DOWN, 5);
	private static final Variable CENTER = new Variable(0, 2, Direction.DOWN, 5);
	private static final Variable RIGHT = new Variable(0, 4, Direction.DOWN, 5);

	static Map<Variable, String> validFill() {
		Map<Variable, String> words = new LinkedHashMap<>();
		words.put(TOP, "ABOUT");
		words.put(MIDDLE, "THERE");
		words.put(BOTTOM, "RANGE");
		words.put(LEFT, "ACTOR");
		words.put(CENTER, "OCEAN");
		words.put(RIGHT, "THEME");
		return words;
	}

	@Test
	public void acceptsAValidFill() {
		var assignment = Assignment.of(validFill());
		assertAll(
			() -> assertTrue(VALIDATOR.consistent(assignment)),
			() -> assertTrue(VALIDATOR.complete(assignment))
		);
	}

	@Test
	public void rejectsTheSameWordInSlotsThatDoNotCross() {
		var assignment = Assignment.of(Map.of(TOP, "ABOUT", MIDDLE, "ABOUT"));
		assertTrue(GRID.overlap(TOP, MIDDLE).isEmpty());
		assertFalse(VALIDATOR.consistent(assignment));
	}

	@Test
	public void rejectsMismatchedOverlap() {
		assertFalse(VALIDATOR.consistent(Assignment.of(Map.of(TOP, "ABOUT", LEFT, "OCEAN"))));
	}

	@Test
	public void rejectsWrongLength() {
		assertFalse(VALIDATOR.consistent(Assignment.of(Map.of(TOP, "ABO"))));
	}

	@Test
	public void partialAssignmentsAreConsistentButIncomplete() {
		var partial = Assignment.of(Map.of(TOP, "ABOUT", LEFT, "ACTOR", CENTER, "OCEAN"));
		assertAll(
			() -> assertTrue(VALIDATOR.consistent(partial)),
			() -> assertFalse(VALIDATOR.complete(partial)),
			() -> assertTrue(VALIDATOR.consistent(Assignment.empty())),
			() -> assertFalse(VALIDATOR.complete(Assignment.empty()))
		);
	}

	@Test
	public void assignmentsAreNeverChangedInPlace() {
		var base = Assignment.of(Map.of(TOP, "ABOUT"));
		var extended = base.with(LEFT, "ACTOR");

		assertAll(
			() -> assertEquals(1, base.size()),
			() -> assertEquals(2, extended.size()),
			() -> assertThrows(IllegalStateException.class, () -> extended.with(TOP, "TREAT")),
			() -> assertThrows(UnsupportedOperationException.class, () -> extended.asMap().put(RIGHT, "THEME"))
		);
	}
}
