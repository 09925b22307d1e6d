package hu.advjava.mcpcrossword;

/** An ordered pair of variables; revising it makes x consistent with y. */
public record Arc(Variable x, Variable y) {}
