package com.github.micycle1.spatialindex;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class KDTreeTest {

	// A point with its key, for brute-force comparisons.
	private static class Datum {
		String key;
		double[] point;
		double distance;

		Datum(String key, double[] point) {
			this.key = key;
			this.point = point;
		}
	}

	@Test
	public void testEmptyInput() {
		KDTree tree = KDTree.build(new double[0][], new String[0], 2);
		assertNull(tree.getRoot());
		assertEquals(0, tree.size());
		assertEquals(0, KDTree.size(null));
		assertTrue(tree.nearestN(new double[] { 1, 1 }, 3).isEmpty());
		assertTrue(tree.radiusSearch(new double[] { 1, 1 }, 10).isEmpty());
	}

	@Test
	public void testNearestTwoOnDiagonal() {
		KDTree tree = diagonal();
		List<NearestResult> results = tree.nearestN(new double[] { 2.1, 2.1 }, 2);

		assertEquals(2, results.size());
		assertEquals("c", results.get(0).getId());
		assertEquals("d", results.get(1).getId());
		assertEquals(Math.sqrt(0.02), results.get(0).getDistance(), 1e-9);
		assertEquals(Math.sqrt(2 * 0.9 * 0.9), results.get(1).getDistance(), 1e-9);
	}

	@Test
	public void testExactMatchIsNearest() {
		KDTree tree = diagonal();
		NearestResult nearest = tree.nearestN(new double[] { 3, 3 }, 1).get(0);
		assertEquals("d", nearest.getId());
		assertEquals(0, nearest.getDistance());
		assertArrayEquals(new double[] { 3, 3 }, nearest.getPoint());
	}

	@Test
	public void testKLargerThanTreeReturnsAll() {
		KDTree tree = diagonal();
		List<NearestResult> results = tree.nearestN(new double[] { 0, 0 }, 50);
		assertEquals(5, results.size());
		for (int i = 1; i < results.size(); i++) {
			assertTrue(results.get(i - 1).getDistance() <= results.get(i).getDistance(), "Results should be sorted by ascending distance.");
		}
	}

	@Test
	public void testRadiusBoundaryInclusive() {
		KDTree tree = diagonal();
		double[] query = { 0, 0 };
		// exactly the distance to c = (2,2)
		double radius = Math.sqrt(8);
		Set<String> found = ids(tree.radiusSearch(query, radius));
		assertEquals(Set.of("a", "b", "c"), found);
	}

	@Test
	public void testRadiusSearchEmptyAndAll() {
		KDTree tree = diagonal();
		assertTrue(tree.radiusSearch(new double[] { 100, 100 }, 1).isEmpty());
		assertEquals(5, tree.radiusSearch(new double[] { 2, 2 }, 1000).size());
	}

	@Test
	public void testTreeIsBalanced() {
		int n = 1023;
		Random rnd = new Random(7);
		double[][] points = new double[n][];
		String[] ids = new String[n];
		for (int i = 0; i < n; i++) {
			points[i] = new double[] { rnd.nextDouble(), rnd.nextDouble() };
			ids[i] = "p" + i;
		}
		KDTree tree = KDTree.build(points, ids, 2);
		assertEquals(n, tree.size());
		assertEquals(n, KDTree.size(tree.getRoot()));
		// median splitting over 2^10 - 1 points gives a perfect tree
		assertEquals(10, depth(tree.getRoot()));
		checkNodeInvariants(tree.getRoot(), 0, 2);
	}

	@Test
	public void testDuplicateCoordinates() {
		// many points sharing split values must still satisfy the ordering invariant
		int n = 200;
		double[][] points = new double[n][];
		String[] ids = new String[n];
		for (int i = 0; i < n; i++) {
			points[i] = new double[] { i % 3, i % 5 };
			ids[i] = "p" + i;
		}
		KDTree tree = KDTree.build(points, ids, 2);
		assertEquals(n, tree.size());
		checkNodeInvariants(tree.getRoot(), 0, 2);

		List<NearestResult> results = tree.radiusSearch(new double[] { 1, 1 }, 0);
		long expected = 0;
		for (double[] p : points) {
			if (p[0] == 1 && p[1] == 1) {
				expected++;
			}
		}
		assertEquals(expected, results.size());
	}

	@Test
	public void testInputIsCopied() {
		double[][] points = { { 1, 1 }, { 2, 2 } };
		KDTree tree = KDTree.build(points, new String[] { "a", "b" }, 2);
		points[0][0] = 100;
		assertEquals("a", tree.nearestN(new double[] { 1, 1 }, 1).get(0).getId());

		double[] returned = tree.nearestN(new double[] { 1, 1 }, 1).get(0).getPoint();
		returned[0] = -5;
		assertEquals(0, tree.nearestN(new double[] { 1, 1 }, 1).get(0).getDistance());
	}

	@Test
	public void testValidation() {
		assertThrows(IllegalArgumentException.class, () -> KDTree.build(new double[][] { { 1, 2 } }, new String[] { "a", "b" }, 2));
		assertThrows(IllegalArgumentException.class, () -> KDTree.build(new double[][] { { 1, 2, 3 } }, new String[] { "a" }, 2));
		assertThrows(IllegalArgumentException.class, () -> KDTree.build(new double[][] { { 1, Double.NaN } }, new String[] { "a" }, 2));
		assertThrows(IllegalArgumentException.class,
				() -> KDTree.build(new double[][] { { 1, 2 }, { 3, 4 } }, new String[] { "a", "a" }, 2));
		assertThrows(IllegalArgumentException.class, () -> KDTree.build(new double[0][], new String[0], 0));

		KDTree tree = diagonal();
		assertThrows(IllegalArgumentException.class, () -> tree.nearestN(new double[] { 1 }, 1));
		assertThrows(IllegalArgumentException.class, () -> tree.nearestN(new double[] { 1, 1 }, 0));
		assertThrows(IllegalArgumentException.class, () -> tree.radiusSearch(new double[] { 1, Double.POSITIVE_INFINITY }, 1));
		assertThrows(IllegalArgumentException.class, () -> tree.radiusSearch(new double[] { 1, 1 }, -1));
		assertThrows(IllegalArgumentException.class, () -> tree.radiusSearch(new double[] { 1, 1 }, Double.NaN));
	}

	@ParameterizedTest
	@ValueSource(ints = { 1, 2, 3, 4, 5 })
	public void testNearestMatchesBruteForce(int dimensions) {
		Random rnd = new Random(31L * dimensions);
		List<Datum> data = randomData(rnd, 500, dimensions);
		KDTree tree = build(data, dimensions);

		for (int q = 0; q < 25; q++) {
			double[] query = randomPoint(rnd, dimensions);
			int k = 1 + rnd.nextInt(20);

			List<Datum> sorted = sortedByDistance(data, query);
			List<NearestResult> results = tree.nearestN(query, k);

			assertEquals(k, results.size());
			for (int i = 0; i < k; i++) {
				assertEquals(sorted.get(i).key, results.get(i).getId(), "Neighbour " + i + " should match brute force.");
				assertEquals(sorted.get(i).distance, results.get(i).getDistance(), 1e-12);
			}
		}
	}

	@ParameterizedTest
	@ValueSource(ints = { 1, 2, 3, 4, 5 })
	public void testRadiusMatchesBruteForce(int dimensions) {
		Random rnd = new Random(17L * dimensions);
		List<Datum> data = randomData(rnd, 500, dimensions);
		KDTree tree = build(data, dimensions);

		for (int q = 0; q < 25; q++) {
			double[] query = randomPoint(rnd, dimensions);
			double radius = rnd.nextDouble() * 40;

			Set<String> expected = new HashSet<>();
			for (Datum d : sortedByDistance(data, query)) {
				if (d.distance <= radius) {
					expected.add(d.key);
				}
			}
			assertEquals(expected, ids(tree.radiusSearch(query, radius)));
		}
	}

	@RepeatedTest(10)
	public void testRadiusIncludesPointAtExactDistance(RepetitionInfo info) {
		Random rnd = new Random(info.getCurrentRepetition());
		List<Datum> data = randomData(rnd, 100, 3);
		KDTree tree = build(data, 3);

		double[] query = randomPoint(rnd, 3);
		Datum target = data.get(rnd.nextInt(data.size()));
		double radius = tree.nearestN(query, data.size()).stream().filter(r -> r.getId().equals(target.key)).findFirst().get().getDistance();

		assertTrue(ids(tree.radiusSearch(query, radius)).contains(target.key));
	}

	private static KDTree diagonal() {
		double[][] points = { { 0, 0 }, { 1, 1 }, { 2, 2 }, { 3, 3 }, { 4, 4 } };
		String[] ids = { "a", "b", "c", "d", "e" };
		return KDTree.build(points, ids, 2);
	}

	private static KDTree build(List<Datum> data, int dimensions) {
		double[][] points = new double[data.size()][];
		String[] ids = new String[data.size()];
		for (int i = 0; i < data.size(); i++) {
			points[i] = data.get(i).point;
			ids[i] = data.get(i).key;
		}
		return KDTree.build(points, ids, dimensions);
	}

	private static List<Datum> randomData(Random rnd, int n, int dimensions) {
		List<Datum> data = new ArrayList<>();
		for (int i = 0; i < n; i++) {
			data.add(new Datum("P" + i, randomPoint(rnd, dimensions)));
		}
		return data;
	}

	private static double[] randomPoint(Random rnd, int dimensions) {
		double[] p = new double[dimensions];
		for (int d = 0; d < dimensions; d++) {
			p[d] = rnd.nextDouble() * 100;
		}
		return p;
	}

	private static List<Datum> sortedByDistance(List<Datum> data, double[] query) {
		for (Datum d : data) {
			double sum = 0;
			for (int i = 0; i < query.length; i++) {
				double diff = query[i] - d.point[i];
				sum += diff * diff;
			}
			d.distance = Math.sqrt(sum);
		}
		List<Datum> sorted = new ArrayList<>(data);
		sorted.sort(Comparator.comparingDouble(d -> d.distance));
		return sorted;
	}

	private static Set<String> ids(List<NearestResult> results) {
		Set<String> ids = new HashSet<>();
		for (NearestResult r : results) {
			ids.add(r.getId());
		}
		return ids;
	}

	private static int depth(KDTree.Node node) {
		if (node == null) {
			return 0;
		}
		return 1 + Math.max(depth(node.getLeft()), depth(node.getRight()));
	}

	/**
	 * Checks the split dimension cycles with depth and that every point of each
	 * subtree lies on the correct side of its ancestors' splitting planes.
	 */
	private static void checkNodeInvariants(KDTree.Node node, int depth, int dimensions) {
		if (node == null) {
			return;
		}
		assertNotNull(node.getId());
		int sd = node.getSplitDimension();
		assertEquals(depth % dimensions, sd);
		double split = node.getPoint()[sd];
		forEach(node.getLeft(), p -> assertTrue(p[sd] <= split, "Left subtree point beyond split plane."));
		forEach(node.getRight(), p -> assertTrue(p[sd] >= split, "Right subtree point before split plane."));
		checkNodeInvariants(node.getLeft(), depth + 1, dimensions);
		checkNodeInvariants(node.getRight(), depth + 1, dimensions);
	}

	private static void forEach(KDTree.Node node, java.util.function.Consumer<double[]> action) {
		if (node == null) {
			return;
		}
		action.accept(node.getPoint());
		forEach(node.getLeft(), action);
		forEach(node.getRight(), action);
	}
}
