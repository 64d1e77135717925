package com.github.micycle1.spatialindex;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dynamic R-tree over two-dimensional bounding boxes.
 * <p>
 * Supports incremental insertion (least-enlargement descent with a linear node
 * split), Sort-Tile-Recursive bulk loading, inclusive intersection search and
 * removal by id with tree condensation.
 * <p>
 * Not thread-safe: mutations must not run concurrently with each other or with
 * reads. An exception thrown from a mutating call leaves the tree in an
 * indeterminate state.
 *
 * @param <T> the type of payload carried by the stored items.
 * @author Michael Carleton
 */
public class RTree<T> {

	private static final Logger log = LoggerFactory.getLogger(RTree.class);

	public static final int DEFAULT_MAX_ENTRIES = 9;
	static final int MIN_MAX_ENTRIES = 4;

	Node<T> root;
	private int size;
	private final int maxEntries;
	private final int minEntries;

	/**
	 * Creates an empty tree with {@value #DEFAULT_MAX_ENTRIES} entries per node.
	 */
	public RTree() {
		this(DEFAULT_MAX_ENTRIES);
	}

	/**
	 * Creates an empty tree.
	 *
	 * @param maxEntries maximum entries per node; values below 4 are raised to 4.
	 *                   The minimum fill is derived as
	 *                   {@code max(2, ceil(0.4 * maxEntries))}.
	 */
	public RTree(int maxEntries) {
		if (maxEntries < MIN_MAX_ENTRIES) {
			log.warn("maxEntries = {} is below {}; using {}", maxEntries, MIN_MAX_ENTRIES, MIN_MAX_ENTRIES);
		}
		this.maxEntries = Math.max(MIN_MAX_ENTRIES, maxEntries);
		this.minEntries = Math.max(2, (int) Math.ceil(this.maxEntries * 0.4));
		this.root = Node.leaf();
		log.debug("Created R-tree with maxEntries = {}, minEntries = {}", this.maxEntries, this.minEntries);
	}

	/**
	 * Inserts an item. At each level the child needing the least area enlargement
	 * is chosen (smaller area on ties); overflowing nodes are split, possibly up to
	 * the root.
	 *
	 * @param item the item to insert
	 */
	public void insert(SpatialItem<T> item) {
		Objects.requireNonNull(item, "item");
		insertItem(item);
		size++;
	}

	/**
	 * Convenience form of {@link #insert(SpatialItem)}.
	 */
	public void insert(String id, Envelope envelope, T data) {
		insert(new SpatialItem<>(id, envelope, data));
	}

	private void insertItem(SpatialItem<T> item) {
		List<Node<T>> path = chooseSubtree(item.env, 1);
		Node<T> leaf = path.get(path.size() - 1);
		leaf.items.add(item);
		leaf.mbr.expandToInclude(item.env);
		adjustPath(path, item.env);
	}

	/**
	 * Re-attaches a detached subtree under a node one level above it, keeping the
	 * subtree's structure.
	 */
	private void insertNode(Node<T> node) {
		List<Node<T>> path = chooseSubtree(node.mbr, node.height + 1);
		Node<T> parent = path.get(path.size() - 1);
		parent.children.add(node);
		parent.mbr.expandToInclude(node.mbr);
		adjustPath(path, node.mbr);
	}

	/**
	 * Descends from the root to a node of the given height.
	 *
	 * @return the root-to-target path; the target is the last element
	 */
	private List<Node<T>> chooseSubtree(Envelope env, int height) {
		if (root.height < height) {
			throw new IllegalStateException("Cannot place an entry at height " + height + " in a tree of height " + root.height);
		}
		List<Node<T>> path = new ArrayList<>();
		Node<T> node = root;
		path.add(node);
		while (node.height > height) {
			Node<T> best = null;
			double minEnlargement = Double.POSITIVE_INFINITY;
			double minArea = Double.POSITIVE_INFINITY;
			for (Node<T> child : node.children) {
				double area = Envelopes.area(child.mbr);
				double enlargement = Envelopes.enlargement(child.mbr, env);
				if (enlargement < minEnlargement || (enlargement == minEnlargement && area < minArea)) {
					minEnlargement = enlargement;
					minArea = area;
					best = child;
				}
			}
			if (best == null) {
				throw new IllegalStateException("Internal node at height " + node.height + " has no children");
			}
			node = best;
			path.add(node);
		}
		return path;
	}

	/**
	 * After an entry was added to the last node of {@code path}: grows the
	 * ancestors to include it and splits overflowing nodes bottom-up.
	 */
	private void adjustPath(List<Node<T>> path, Envelope added) {
		for (int i = path.size() - 2; i >= 0; i--) {
			path.get(i).mbr.expandToInclude(added);
		}
		for (int i = path.size() - 1; i >= 0; i--) {
			Node<T> node = path.get(i);
			if (node.entryCount() <= maxEntries) {
				break;
			}
			Node<T> sibling = split(node);
			if (i == 0) {
				growRoot(sibling);
			} else {
				// the parent already covers both halves
				path.get(i - 1).children.add(sibling);
			}
		}
	}

	/**
	 * Splits an overflowing node, moving the tail of its sorted entries to a new
	 * sibling of the same kind and height.
	 *
	 * @return the new sibling (not yet attached to a parent)
	 */
	Node<T> split(Node<T> node) {
		final Node<T> sibling;
		if (node.leaf) {
			int at = NodeSplitter.split(node.items, item -> item.env, minEntries);
			sibling = Node.leaf(tail(node.items, at));
		} else {
			int at = NodeSplitter.split(node.children, child -> child.mbr, minEntries);
			sibling = Node.internal(node.height, tail(node.children, at));
		}
		node.recomputeMbr();
		if (log.isDebugEnabled()) {
			log.debug("Split {} node at height {} into {} + {} entries", node.leaf ? "leaf" : "internal", node.height,
					node.entryCount(), sibling.entryCount());
		}
		return sibling;
	}

	/**
	 * Removes and returns {@code list[from, size)}.
	 */
	private static <E> List<E> tail(List<E> list, int from) {
		List<E> sub = list.subList(from, list.size());
		List<E> moved = new ArrayList<>(sub);
		sub.clear();
		return moved;
	}

	private void growRoot(Node<T> sibling) {
		List<Node<T>> children = new ArrayList<>();
		children.add(root);
		children.add(sibling);
		root = Node.internal(root.height + 1, children);
		log.debug("Root split; tree height is now {}", root.height);
	}

	/**
	 * Loads many items at once.
	 * <p>
	 * On an empty tree this packs the items with Sort-Tile-Recursive: items are
	 * sorted into vertical slices by x-centre, each slice is sorted by y-centre and
	 * cut into full nodes, and the same tiling is repeated level by level until one
	 * root remains. On a non-empty tree the items are inserted one at a time.
	 *
	 * @param items the items to add; the collection itself is not modified
	 */
	public void bulkLoad(Collection<SpatialItem<T>> items) {
		Objects.requireNonNull(items, "items");
		if (items.isEmpty()) {
			return;
		}
		for (SpatialItem<T> item : items) {
			Objects.requireNonNull(item, "item");
		}

		if (size > 0) {
			log.debug("Tree holds {} items; inserting {} items individually", size, items.size());
			for (SpatialItem<T> item : items) {
				insert(item);
			}
			return;
		}

		root = strBuild(new ArrayList<>(items));
		size = items.size();
		log.debug("STR bulk load of {} items; tree height {}", size, root.height);
	}

	private Node<T> strBuild(List<SpatialItem<T>> items) {
		if (items.size() <= maxEntries) {
			return Node.leaf(items);
		}

		List<Node<T>> level = new ArrayList<>();
		for (List<SpatialItem<T>> group : tile(items, item -> item.env)) {
			level.add(Node.leaf(group));
		}
		while (level.size() > 1) {
			int height = level.get(0).height + 1;
			List<Node<T>> parents = new ArrayList<>();
			if (level.size() <= maxEntries) {
				parents.add(Node.internal(height, level));
			} else {
				for (List<Node<T>> group : tile(level, node -> node.mbr)) {
					parents.add(Node.internal(height, group));
				}
			}
			level = parents;
		}
		return level.get(0);
	}

	/**
	 * One STR pass: partitions entries into groups of at most {@code maxEntries}
	 * that are spatially compact.
	 */
	private <E> List<List<E>> tile(List<E> entries, Function<? super E, Envelope> envelopeOf) {
		final int n = entries.size();
		int groups = (n + maxEntries - 1) / maxEntries;
		int slices = (int) Math.ceil(Math.sqrt(groups));
		int sliceSize = (n + slices - 1) / slices;

		entries.sort(Comparator.comparingDouble(e -> Envelopes.centreX(envelopeOf.apply(e))));

		List<List<E>> tiles = new ArrayList<>(groups + slices);
		for (int i = 0; i < n; i += sliceSize) {
			List<E> slice = new ArrayList<>(entries.subList(i, Math.min(i + sliceSize, n)));
			slice.sort(Comparator.comparingDouble(e -> Envelopes.centreY(envelopeOf.apply(e))));
			for (int j = 0; j < slice.size(); j += maxEntries) {
				tiles.add(new ArrayList<>(slice.subList(j, Math.min(j + maxEntries, slice.size()))));
			}
		}
		return tiles;
	}

	/**
	 * Finds all items whose bounding boxes intersect the query box. Boxes that only
	 * touch the query count as intersecting.
	 *
	 * @param query the query box; infinite bounds are allowed
	 * @return the matching items, in no particular order
	 * @throws IllegalArgumentException if the query has a NaN bound
	 */
	public List<SpatialItem<T>> search(Envelope query) {
		Envelopes.checkNotNaN(query);
		List<SpatialItem<T>> results = new ArrayList<>();
		if (Envelopes.intersects(root.mbr, query)) {
			search(root, query, results);
		}
		return results;
	}

	private void search(Node<T> node, Envelope query, List<SpatialItem<T>> results) {
		if (node.leaf) {
			for (SpatialItem<T> item : node.items) {
				if (Envelopes.intersects(item.env, query)) {
					results.add(item);
				}
			}
			return;
		}
		for (Node<T> child : node.children) {
			if (Envelopes.intersects(child.mbr, query)) {
				search(child, query, results);
			}
		}
	}

	/**
	 * Removes the item with the given id. If several items share the id, only the
	 * first one found is removed.
	 * <p>
	 * Nodes left with fewer than the minimum number of entries are detached on
	 * the way back up to the root and their contents re-inserted: items at leaf
	 * level and child subtrees at their original level.
	 *
	 * @param id the item id
	 * @return true if an item was removed; false (tree unchanged) if the id is
	 *         unknown
	 */
	public boolean remove(String id) {
		Objects.requireNonNull(id, "id");
		List<Node<T>> path = new ArrayList<>();
		Node<T> leaf = findLeaf(root, id, path);
		if (leaf == null) {
			return false;
		}

		for (Iterator<SpatialItem<T>> it = leaf.items.iterator(); it.hasNext();) {
			if (it.next().getId().equals(id)) {
				it.remove();
				break;
			}
		}
		size--;

		leaf.recomputeMbr();
		for (int i = path.size() - 1; i >= 0; i--) {
			path.get(i).recomputeMbr();
		}

		condense(leaf, path);

		while (!root.leaf && root.children.size() == 1) {
			root = root.children.get(0);
			log.debug("Root has a single child; tree height is now {}", root.height);
		}
		if (size == 0) {
			root = Node.leaf();
		}
		return true;
	}

	/**
	 * Depth-first search for the leaf holding {@code id}.
	 *
	 * @param path receives the leaf's ancestors, root first
	 */
	private Node<T> findLeaf(Node<T> node, String id, List<Node<T>> path) {
		if (node.leaf) {
			for (SpatialItem<T> item : node.items) {
				if (item.getId().equals(id)) {
					return node;
				}
			}
			return null;
		}
		path.add(node);
		for (Node<T> child : node.children) {
			Node<T> found = findLeaf(child, id, path);
			if (found != null) {
				return found;
			}
		}
		path.remove(path.size() - 1);
		return null;
	}

	/**
	 * Walks from {@code leaf} up through its ancestors, detaching under-full nodes
	 * and re-inserting their orphaned contents.
	 */
	private void condense(Node<T> leaf, List<Node<T>> path) {
		List<SpatialItem<T>> orphanItems = new ArrayList<>();
		List<Node<T>> orphanNodes = new ArrayList<>();

		Node<T> node = leaf;
		for (int i = path.size() - 1; i >= 0; i--) {
			Node<T> parent = path.get(i);
			if (node.entryCount() < minEntries) {
				parent.children.remove(node);
				if (node.leaf) {
					orphanItems.addAll(node.items);
				} else {
					orphanNodes.addAll(node.children);
				}
			}
			parent.recomputeMbr();
			node = parent;
		}

		if (orphanItems.isEmpty() && orphanNodes.isEmpty()) {
			return;
		}
		log.debug("Condensing: re-inserting {} items and {} subtrees", orphanItems.size(), orphanNodes.size());
		for (SpatialItem<T> item : orphanItems) {
			insertItem(item);
		}
		for (Node<T> orphan : orphanNodes) {
			insertNode(orphan);
		}
	}

	/**
	 * @return the number of stored items
	 */
	public int size() {
		return size;
	}

	/**
	 * @return every stored item, in no particular order
	 */
	public List<SpatialItem<T>> all() {
		List<SpatialItem<T>> results = new ArrayList<>(size);
		collect(root, results);
		return results;
	}

	private void collect(Node<T> node, List<SpatialItem<T>> out) {
		if (node.leaf) {
			out.addAll(node.items);
			return;
		}
		for (Node<T> child : node.children) {
			collect(child, out);
		}
	}

	/**
	 * @return the number of levels in the tree (1 for a single leaf)
	 */
	public int height() {
		return root.height;
	}

	public int getMaxEntries() {
		return maxEntries;
	}

	public int getMinEntries() {
		return minEntries;
	}

	@Override
	public String toString() {
		return "RTree[size=" + size + ", height=" + root.height + ", maxEntries=" + maxEntries + "]";
	}

	/**
	 * A tree node: a leaf holding items, or an internal node holding child nodes.
	 * Leaves have height 1 and every node's height is one more than its children's.
	 *
	 * @param <T> the payload type.
	 */
	static final class Node<T> {
		/**
		 * Cached union of the entries' envelopes; the empty (null) envelope when the
		 * node has no entries.
		 */
		Envelope mbr;
		final List<Node<T>> children;
		final List<SpatialItem<T>> items;
		final boolean leaf;
		final int height;

		private Node(boolean leaf, int height, List<Node<T>> children, List<SpatialItem<T>> items) {
			this.leaf = leaf;
			this.height = height;
			this.children = children;
			this.items = items;
			recomputeMbr();
		}

		static <T> Node<T> leaf() {
			return leaf(new ArrayList<>());
		}

		static <T> Node<T> leaf(List<SpatialItem<T>> items) {
			return new Node<>(true, 1, Collections.emptyList(), items);
		}

		static <T> Node<T> internal(int height, List<Node<T>> children) {
			return new Node<>(false, height, children, Collections.emptyList());
		}

		int entryCount() {
			return leaf ? items.size() : children.size();
		}

		void recomputeMbr() {
			Envelope env = new Envelope();
			if (leaf) {
				for (SpatialItem<T> item : items) {
					env.expandToInclude(item.env);
				}
			} else {
				for (Node<T> child : children) {
					env.expandToInclude(child.mbr);
				}
			}
			mbr = env;
		}

		@Override
		public String toString() {
			return (leaf ? "Leaf" : "Internal") + "(height=" + height + ", entries=" + entryCount() + "): " + mbr;
		}
	}
}
