package com.github.micycle1.spatialindex;

import java.util.Objects;

import org.locationtech.jts.geom.Envelope;

/**
 * The unit stored in {@link RTree} leaves: an identifier, the bounding envelope
 * of the indexed object and an optional payload.
 * <p>
 * Items are immutable. The envelope is copied on construction and on access, so
 * no caller can change the geometry an R-tree has indexed.
 *
 * @param <T> the type of the payload.
 * @author Michael Carleton
 */
public final class SpatialItem<T> {

	private final String id;
	final Envelope env; // private copy; read directly by the tree
	private final T data;

	/**
	 * Creates an item without a payload.
	 */
	public SpatialItem(String id, Envelope envelope) {
		this(id, envelope, null);
	}

	/**
	 * @param id       the item identifier
	 * @param envelope the bounding box of the item; must be non-empty and finite
	 * @param data     payload (may be null)
	 * @throws IllegalArgumentException if the envelope is empty or non-finite
	 */
	public SpatialItem(String id, Envelope envelope, T data) {
		this.id = Objects.requireNonNull(id, "id");
		Envelopes.checkFinite(envelope);
		this.env = new Envelope(envelope);
		this.data = data;
	}

	/**
	 * Creates an item from explicit bounds, avoiding JTS's (x1, x2, y1, y2)
	 * constructor ordering.
	 */
	public static <T> SpatialItem<T> of(String id, double minX, double minY, double maxX, double maxY) {
		return new SpatialItem<>(id, new Envelope(minX, maxX, minY, maxY));
	}

	public String getId() {
		return id;
	}

	/**
	 * @return a copy of this item's bounding box
	 */
	public Envelope getEnvelope() {
		return new Envelope(env);
	}

	public T getData() {
		return data;
	}

	@Override
	public String toString() {
		return "SpatialItem[" + id + ": " + env + "]";
	}
}
