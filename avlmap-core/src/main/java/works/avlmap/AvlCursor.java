package works.avlmap;

import java.util.ConcurrentModificationException;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A position in the ascending-key sequence of an {@link AvlMap}'s entries,
 * or the position just past the end.
 *
 * <p>
 * Advancing climbs parent links rather than keeping a stack, so a cursor is
 * just a reference to a node, and copying one is O(1). The flip side is that
 * the node can be relocated or removed by any structural modification of the map;
 * once that has happened, every method except {@link #isEnd()}, {@link #equals}
 * and {@link #hashCode} throws {@link ConcurrentModificationException}.
 *
 * <p>
 * Cursors compare equal if they come from the same map and refer to the same node,
 * so <code>cursor.equals(map.end())</code> detects the end.
 */
public final class AvlCursor<K,V> {
	private final AvlMap<K,V> map;
	private AvlNode<K,V> node; // null means end
	private final int expectedModCount;

	AvlCursor(AvlMap<K,V> map, AvlNode<K,V> node) {
		this(map, node, map.modCount());
	}

	private AvlCursor(AvlMap<K,V> map, AvlNode<K,V> node, int expectedModCount) {
		this.map = map;
		this.node = node;
		this.expectedModCount = expectedModCount;
	}

	public boolean isEnd() {
		return node == null;
	}

	public K key() {
		return currentNode().key;
	}

	public V value() {
		return currentNode().value;
	}

	/**
	 * Replaces the value stored in the map for this cursor's key.
	 * This is not a structural modification, so cursors remain valid.
	 */
	public void setValue(V value) {
		currentNode().value = value;
	}

	/**
	 * Moves to the next entry in key order.
	 * This is the prefix form: it returns this cursor, already advanced.
	 *
	 * @throws NoSuchElementException if this is the end cursor
	 */
	public AvlCursor<K,V> advance() {
		node = currentNode().successor();
		return this;
	}

	/**
	 * The postfix form of {@link #advance()}.
	 *
	 * @return a new cursor at the position this one occupied before advancing
	 */
	public AvlCursor<K,V> getAndAdvance() {
		AvlCursor<K,V> previous = new AvlCursor<>(map, node, expectedModCount);
		advance();
		return previous;
	}

	private AvlNode<K,V> currentNode() {
		if (map.modCount() != expectedModCount) {
			throw new ConcurrentModificationException("Map was structurally modified after this cursor was created");
		}
		if (node == null) {
			throw new NoSuchElementException("Cursor is at the end");
		}
		return node;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof AvlCursor)) {
			return false;
		}
		AvlCursor<?,?> other = (AvlCursor<?,?>) obj;
		return map == other.map && node == other.node;
	}

	@Override
	public int hashCode() {
		return Objects.hash(System.identityHashCode(map), System.identityHashCode(node));
	}

	@Override
	public String toString() {
		return (node == null) ? "AvlCursor(end)" : "AvlCursor(" + node.key + ")";
	}
}
