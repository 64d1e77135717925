package com.github.micycle1.spatialindex;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

import org.locationtech.jts.geom.Envelope;

/**
 * Linear split heuristic for overflowing R-tree nodes. Works on either kind of
 * node entry (leaf items or child nodes) through an envelope accessor.
 */
final class NodeSplitter {

	enum Axis {
		X, Y
	}

	private NodeSplitter() {
	}

	/**
	 * Sorts {@code entries} along the better split axis and returns the index at
	 * which to divide them: entries before it stay, entries from it onward move to
	 * a new sibling.
	 *
	 * @param entries    entries of the overflowing node (reordered in place)
	 * @param envelopeOf accessor for an entry's bounding box
	 * @param minEntries minimum entry count of either resulting group
	 * @return the split index, in {@code [minEntries, entries.size() - minEntries]}
	 */
	static <E> int split(List<E> entries, Function<? super E, Envelope> envelopeOf, int minEntries) {
		Axis axis = chooseAxis(entries, envelopeOf);
		entries.sort(byAxis(axis, envelopeOf));
		return chooseIndex(entries, envelopeOf, minEntries);
	}

	/**
	 * Picks the axis whose ordering (by minimum coordinate) gives the smaller sum of
	 * prefix-group margins. X wins ties.
	 */
	static <E> Axis chooseAxis(List<E> entries, Function<? super E, Envelope> envelopeOf) {
		List<E> byX = new ArrayList<>(entries);
		byX.sort(byAxis(Axis.X, envelopeOf));
		List<E> byY = new ArrayList<>(entries);
		byY.sort(byAxis(Axis.Y, envelopeOf));
		return prefixMarginSum(byX, envelopeOf) <= prefixMarginSum(byY, envelopeOf) ? Axis.X : Axis.Y;
	}

	private static <E> double prefixMarginSum(List<E> sorted, Function<? super E, Envelope> envelopeOf) {
		Envelope prefix = new Envelope();
		double sum = 0;
		for (int i = 0; i < sorted.size() - 1; i++) {
			prefix.expandToInclude(envelopeOf.apply(sorted.get(i)));
			sum += Envelopes.margin(prefix);
		}
		return sum;
	}

	/**
	 * Chooses the split index over sorted entries, minimising the overlap of the two
	 * groups first and their combined area second.
	 */
	static <E> int chooseIndex(List<E> entries, Function<? super E, Envelope> envelopeOf, int minEntries) {
		final int total = entries.size();

		// prefix[i] covers entries [0, i); suffix[i] covers entries [i, total)
		Envelope[] prefix = new Envelope[total + 1];
		Envelope[] suffix = new Envelope[total + 1];
		prefix[0] = new Envelope();
		for (int i = 0; i < total; i++) {
			prefix[i + 1] = Envelopes.enlarged(prefix[i], envelopeOf.apply(entries.get(i)));
		}
		suffix[total] = new Envelope();
		for (int i = total - 1; i >= 0; i--) {
			suffix[i] = Envelopes.enlarged(suffix[i + 1], envelopeOf.apply(entries.get(i)));
		}

		double bestOverlap = Double.POSITIVE_INFINITY;
		double bestArea = Double.POSITIVE_INFINITY;
		int bestIndex = minEntries;
		for (int i = minEntries; i <= total - minEntries; i++) {
			double overlap = Envelopes.overlapArea(prefix[i], suffix[i]);
			double area = Envelopes.area(prefix[i]) + Envelopes.area(suffix[i]);
			if (overlap < bestOverlap || (overlap == bestOverlap && area < bestArea)) {
				bestOverlap = overlap;
				bestArea = area;
				bestIndex = i;
			}
		}
		return bestIndex;
	}

	static <E> Comparator<E> byAxis(Axis axis, Function<? super E, Envelope> envelopeOf) {
		if (axis == Axis.X) {
			return Comparator.<E>comparingDouble(e -> envelopeOf.apply(e).getMinX()).thenComparingDouble(e -> envelopeOf.apply(e).getMaxX());
		}
		return Comparator.<E>comparingDouble(e -> envelopeOf.apply(e).getMinY()).thenComparingDouble(e -> envelopeOf.apply(e).getMaxY());
	}
}
