package com.github.micycle1.spatialindex;

import java.util.Arrays;

/**
 * A point returned from a {@link KDTree} query, with its Euclidean distance to
 * the query point.
 *
 * @author Michael Carleton
 */
public final class NearestResult {

	private final String id;
	private final double distance;
	private final double[] point;

	NearestResult(String id, double distance, double[] point) {
		this.id = id;
		this.distance = distance;
		this.point = point;
	}

	public String getId() {
		return id;
	}

	public double getDistance() {
		return distance;
	}

	/**
	 * @return a copy of the point's coordinates
	 */
	public double[] getPoint() {
		return point.clone();
	}

	@Override
	public String toString() {
		return "NearestResult[" + id + ", d=" + distance + ", " + Arrays.toString(point) + "]";
	}
}
