package com.github.micycle1.spatialindex;

import java.util.Objects;

import org.locationtech.jts.geom.Envelope;

/**
 * Static geometry helpers over JTS {@link Envelope}s, as used by the R-tree's
 * insertion and split heuristics.
 * <p>
 * A null envelope (see {@link Envelope#isNull()}) is treated as the empty box:
 * it has zero area and margin and intersects nothing.
 *
 * @author Michael Carleton
 */
public final class Envelopes {

	private Envelopes() {
	}

	/**
	 * Area of the envelope (width * height); 0 for the empty box.
	 */
	public static double area(Envelope env) {
		return env.getArea();
	}

	/**
	 * Margin of the envelope: the sum of its side lengths (half its perimeter).
	 */
	public static double margin(Envelope env) {
		if (env.isNull()) {
			return 0;
		}
		return env.getWidth() + env.getHeight();
	}

	/**
	 * @return a new envelope covering both {@code a} and {@code b}
	 */
	public static Envelope enlarged(Envelope a, Envelope b) {
		Envelope union = new Envelope(a);
		union.expandToInclude(b);
		return union;
	}

	/**
	 * How much the area of {@code env} grows if it is expanded to include
	 * {@code other}.
	 */
	public static double enlargement(Envelope env, Envelope other) {
		return area(enlarged(env, other)) - area(env);
	}

	/**
	 * Area of the intersection of two envelopes; 0 when they are disjoint or only
	 * touch.
	 */
	public static double overlapArea(Envelope a, Envelope b) {
		if (a.isNull() || b.isNull()) {
			return 0;
		}
		double overlapX = Math.max(0, Math.min(a.getMaxX(), b.getMaxX()) - Math.max(a.getMinX(), b.getMinX()));
		double overlapY = Math.max(0, Math.min(a.getMaxY(), b.getMaxY()) - Math.max(a.getMinY(), b.getMinY()));
		return overlapX * overlapY;
	}

	/**
	 * Inclusive intersection test: envelopes sharing only an edge or a corner do
	 * intersect.
	 */
	public static boolean intersects(Envelope a, Envelope b) {
		return a.intersects(b);
	}

	/**
	 * @return true if {@code outer} fully covers {@code inner} (boundaries
	 *         inclusive)
	 */
	public static boolean contains(Envelope outer, Envelope inner) {
		return outer.covers(inner);
	}

	public static double centreX(Envelope env) {
		return (env.getMinX() + env.getMaxX()) / 2.0;
	}

	public static double centreY(Envelope env) {
		return (env.getMinY() + env.getMaxY()) / 2.0;
	}

	/**
	 * Checks that an envelope is non-empty and has only finite bounds.
	 *
	 * @throws IllegalArgumentException if the envelope is empty or has a NaN or
	 *                                  infinite bound
	 */
	static void checkFinite(Envelope env) {
		Objects.requireNonNull(env, "envelope");
		if (env.isNull()) {
			throw new IllegalArgumentException("Envelope is empty.");
		}
		if (!Double.isFinite(env.getMinX()) || !Double.isFinite(env.getMaxX()) || !Double.isFinite(env.getMinY())
				|| !Double.isFinite(env.getMaxY())) {
			throw new IllegalArgumentException("Envelope has non-finite bounds: " + env);
		}
	}

	/**
	 * Checks that a query envelope has no NaN bound. Infinite bounds are allowed.
	 */
	static void checkNotNaN(Envelope env) {
		Objects.requireNonNull(env, "query");
		if (Double.isNaN(env.getMinX()) || Double.isNaN(env.getMaxX()) || Double.isNaN(env.getMinY())
				|| Double.isNaN(env.getMaxY())) {
			throw new IllegalArgumentException("Query envelope has NaN bounds: " + env);
		}
	}
}
