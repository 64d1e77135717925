package com.github.micycle1.spatialindex;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static k-d tree over points in D-dimensional Euclidean space, answering
 * k-nearest-neighbour and radius queries.
 * <p>
 * The tree is built once from a point set by recursive median splitting
 * (cycling the split dimension with depth) and is immutable thereafter; to
 * change the indexed points, build a new tree. A built tree may be queried
 * concurrently from any number of threads.
 *
 * @author Michael Carleton
 */
public final class KDTree {

	private static final Logger log = LoggerFactory.getLogger(KDTree.class);

	private static final Comparator<NearestResult> BY_DISTANCE = Comparator.comparingDouble(NearestResult::getDistance);

	private final Node root;
	private final int dimensions;
	private final int size;

	private KDTree(Node root, int dimensions, int size) {
		this.root = root;
		this.dimensions = dimensions;
		this.size = size;
	}

	/**
	 * Builds a balanced k-d tree. At each level the median point along the split
	 * dimension ({@code depth % dimensions}) is found by quickselect and becomes
	 * the node; the lower half forms its left subtree and the upper half its right.
	 * Expected cost is O(n log n).
	 * <p>
	 * Coordinates are copied; later changes to the input arrays do not affect the
	 * tree.
	 *
	 * @param points     the points, each of length {@code dimensions}
	 * @param ids        identifiers parallel to {@code points}; must be unique
	 * @param dimensions number of spatial dimensions (at least 1)
	 * @return the tree; its root is null when {@code points} is empty
	 * @throws IllegalArgumentException on mismatched array lengths, a point of the
	 *                                  wrong dimension, a non-finite coordinate or
	 *                                  a duplicate id
	 */
	public static KDTree build(double[][] points, String[] ids, int dimensions) {
		Objects.requireNonNull(points, "points");
		Objects.requireNonNull(ids, "ids");
		if (dimensions < 1) {
			throw new IllegalArgumentException("dimensions must be at least 1, was " + dimensions);
		}
		if (points.length != ids.length) {
			throw new IllegalArgumentException("points and ids differ in length: " + points.length + " != " + ids.length);
		}

		final int n = points.length;
		double[][] copies = new double[n][];
		Set<String> seen = new HashSet<>();
		for (int i = 0; i < n; i++) {
			copies[i] = checkPoint(points[i], dimensions, "point " + i).clone();
			if (ids[i] == null) {
				throw new IllegalArgumentException("id " + i + " is null");
			}
			if (!seen.add(ids[i])) {
				throw new IllegalArgumentException("Duplicate id: " + ids[i]);
			}
		}

		int[] indices = new int[n];
		for (int i = 0; i < n; i++) {
			indices[i] = i;
		}
		Node root = build(copies, ids, indices, 0, n, 0, dimensions);
		log.debug("Built k-d tree of {} points in {} dimensions", n, dimensions);
		return new KDTree(root, dimensions, n);
	}

	private static Node build(double[][] points, String[] ids, int[] indices, int lo, int hi, int depth, int dimensions) {
		final int count = hi - lo;
		if (count <= 0) {
			return null;
		}
		final int splitDim = depth % dimensions;
		if (count == 1) {
			int idx = indices[lo];
			return new Node(points[idx], ids[idx], splitDim, null, null);
		}

		final int median = lo + ((count - 1) >> 1);
		select(points, indices, lo, hi, median, splitDim);
		int idx = indices[median];
		Node left = build(points, ids, indices, lo, median, depth + 1, dimensions);
		Node right = build(points, ids, indices, median + 1, hi, depth + 1, dimensions);
		return new Node(points[idx], ids[idx], splitDim, left, right);
	}

	/**
	 * Quickselect: rearranges {@code indices[lo, hi)} so that position
	 * {@code target} holds the element that would be there if the range were
	 * sorted along {@code dim}, with no greater element before it and no smaller
	 * element after it.
	 * <p>
	 * Median-of-three pivoting with a three-way partition, so runs of equal
	 * coordinates are handled in one pass.
	 */
	static void select(double[][] points, int[] indices, int lo, int hi, int target, int dim) {
		int left = lo;
		int right = hi - 1;
		while (left < right) {
			int mid = (left + right) >>> 1;
			double pivot = medianOf(points[indices[left]][dim], points[indices[mid]][dim], points[indices[right]][dim]);

			// [left, lt) < pivot, [lt, i) == pivot, (gt, right] > pivot
			int lt = left;
			int i = left;
			int gt = right;
			while (i <= gt) {
				double v = points[indices[i]][dim];
				if (v < pivot) {
					swap(indices, lt++, i++);
				} else if (v > pivot) {
					swap(indices, i, gt--);
				} else {
					i++;
				}
			}

			if (target < lt) {
				right = lt - 1;
			} else if (target > gt) {
				left = gt + 1;
			} else {
				return;
			}
		}
	}

	private static double medianOf(double a, double b, double c) {
		return Math.max(Math.min(a, b), Math.min(Math.max(a, b), c));
	}

	private static void swap(int[] arr, int i, int j) {
		int tmp = arr[i];
		arr[i] = arr[j];
		arr[j] = tmp;
	}

	/**
	 * Finds the {@code k} points closest to {@code query}.
	 * <p>
	 * Depth-first search that always visits the side of each splitting hyperplane
	 * containing the query first, and visits the other side only while the
	 * hyperplane is closer than the current k-th best distance. When several points
	 * tie with the k-th best distance, the one found first is kept.
	 *
	 * @param query the query point, of length {@link #getDimensions()}
	 * @param k     the number of neighbours wanted (at least 1)
	 * @return up to k results, sorted by ascending distance; empty if the tree is
	 *         empty
	 */
	public List<NearestResult> nearestN(double[] query, int k) {
		checkPoint(query, dimensions, "query");
		if (k < 1) {
			throw new IllegalArgumentException("k must be at least 1, was " + k);
		}
		if (root == null) {
			return new ArrayList<>();
		}

		// max-heap: head is the worst of the best k so far
		PriorityQueue<NearestResult> heap = new PriorityQueue<>(Math.min(k, size) + 1, BY_DISTANCE.reversed());
		nearest(root, query, k, heap);

		List<NearestResult> results = new ArrayList<>(heap);
		results.sort(BY_DISTANCE);
		return results;
	}

	private void nearest(Node node, double[] query, int k, PriorityQueue<NearestResult> heap) {
		if (node == null) {
			return;
		}

		double dist = distance(node.point, query);
		if (heap.size() < k) {
			heap.add(new NearestResult(node.id, dist, node.point));
		} else if (dist < heap.peek().getDistance()) {
			heap.poll();
			heap.add(new NearestResult(node.id, dist, node.point));
		}

		double diff = query[node.splitDimension] - node.point[node.splitDimension];
		Node nearer = diff <= 0 ? node.left : node.right;
		Node farther = diff <= 0 ? node.right : node.left;

		nearest(nearer, query, k, heap);

		double worst = heap.size() < k ? Double.POSITIVE_INFINITY : heap.peek().getDistance();
		if (Math.abs(diff) < worst) {
			nearest(farther, query, k, heap);
		}
	}

	/**
	 * Finds every point within Euclidean distance {@code radius} of
	 * {@code query}, boundary inclusive.
	 *
	 * @param query  the query point, of length {@link #getDimensions()}
	 * @param radius search radius (non-negative)
	 * @return matching points, in no particular order
	 */
	public List<NearestResult> radiusSearch(double[] query, double radius) {
		checkPoint(query, dimensions, "query");
		if (Double.isNaN(radius) || radius < 0) {
			throw new IllegalArgumentException("radius must be non-negative, was " + radius);
		}
		List<NearestResult> results = new ArrayList<>();
		withinRadius(root, query, radius, results);
		return results;
	}

	private void withinRadius(Node node, double[] query, double radius, List<NearestResult> results) {
		if (node == null) {
			return;
		}

		double dist = distance(node.point, query);
		if (dist <= radius) {
			results.add(new NearestResult(node.id, dist, node.point));
		}

		double diff = query[node.splitDimension] - node.point[node.splitDimension];
		Node nearer = diff <= 0 ? node.left : node.right;
		Node farther = diff <= 0 ? node.right : node.left;

		withinRadius(nearer, query, radius, results);
		if (Math.abs(diff) <= radius) {
			withinRadius(farther, query, radius, results);
		}
	}

	private double distance(double[] a, double[] b) {
		double sum = 0;
		for (int d = 0; d < dimensions; d++) {
			double diff = a[d] - b[d];
			sum += diff * diff;
		}
		return Math.sqrt(sum);
	}

	private static double[] checkPoint(double[] point, int dimensions, String what) {
		if (point == null) {
			throw new IllegalArgumentException(what + " is null");
		}
		if (point.length != dimensions) {
			throw new IllegalArgumentException(what + " has " + point.length + " coordinates, expected " + dimensions);
		}
		for (double c : point) {
			if (!Double.isFinite(c)) {
				throw new IllegalArgumentException(what + " has a non-finite coordinate: " + c);
			}
		}
		return point;
	}

	/**
	 * @return the number of points in the tree
	 */
	public int size() {
		return size;
	}

	/**
	 * Counts the nodes of the subtree rooted at {@code node}.
	 *
	 * @return the node count; 0 for null
	 */
	public static int size(Node node) {
		if (node == null) {
			return 0;
		}
		return 1 + size(node.left) + size(node.right);
	}

	public int getDimensions() {
		return dimensions;
	}

	/**
	 * @return the root node, or null for an empty tree
	 */
	public Node getRoot() {
		return root;
	}

	/**
	 * A k-d tree node. Every point in {@code left} has a coordinate along
	 * {@code splitDimension} no greater than this node's, and every point in
	 * {@code right} one no smaller.
	 */
	public static final class Node {
		final double[] point;
		final String id;
		final int splitDimension;
		final Node left;
		final Node right;

		Node(double[] point, String id, int splitDimension, Node left, Node right) {
			this.point = point;
			this.id = id;
			this.splitDimension = splitDimension;
			this.left = left;
			this.right = right;
		}

		/**
		 * @return a copy of this node's point
		 */
		public double[] getPoint() {
			return point.clone();
		}

		public String getId() {
			return id;
		}

		public int getSplitDimension() {
			return splitDimension;
		}

		public Node getLeft() {
			return left;
		}

		public Node getRight() {
			return right;
		}
	}

	@Override
	public String toString() {
		return "KDTree[size=" + size + ", dimensions=" + dimensions + "]";
	}
}
