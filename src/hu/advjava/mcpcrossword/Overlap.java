package hu.advjava.mcpcrossword;

// character ix of the first variable's word must equal character iy of the second's
public record Overlap(int ix, int iy) {
	public Overlap swapped() {
		return new Overlap(iy, ix);
	}
}
