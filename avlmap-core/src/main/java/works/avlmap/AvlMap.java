package works.avlmap;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.avlmap.exceptions.NonexistentKeyException;

import static java.util.Objects.requireNonNull;

/**
 * A mutable map that keeps its entries sorted by key, using an AVL tree.
 * {@link #update}, {@link #remove}, {@link #hasKey}, {@link #at} and
 * {@link #getOrInsert} take O(log n) time, using O(log n) comparisons.
 *
 * <p>
 * Keys are compared only with the {@link #comparator()}: two keys are the same
 * key if neither is less than the other. {@link Object#equals} is never called
 * on a key.
 *
 * <p>
 * Traversal is by {@link AvlCursor}, starting from {@link #begin()} and ending at
 * {@link #end()}, or by {@link #iterator()}. A cursor refers directly to a tree node,
 * so any <em>structural</em> modification (an insertion, a removal, or {@link #clear()})
 * invalidates every outstanding cursor; using one afterward throws
 * {@link java.util.ConcurrentModificationException}. Replacing the value of an existing
 * key is not a structural modification.
 *
 * <p>
 * Not thread-safe. Concurrent lookups are fine, since they modify nothing, but
 * any mutation requires external locking.
 *
 * @param <K> key type; must be totally ordered by the comparator
 * @param <V> value type; nulls are permitted
 */
@Accessors(fluent = true)
public final class AvlMap<K,V> implements Iterable<Map.Entry<K,V>> {
	@Getter private final Comparator<? super K> comparator;
	private AvlNode<K,V> root;
	@Getter private int size;
	private int modCount; // Counts structural modifications only

	public AvlMap(Comparator<? super K> comparator) {
		this.comparator = requireNonNull(comparator);
	}

	public static <KK extends Comparable<? super KK>, VV> AvlMap<KK,VV> natural() {
		return new AvlMap<>(Comparator.naturalOrder());
	}

	/**
	 * @return a new map with the same comparator and entries as <code>other</code>.
	 * The two maps share no nodes, so mutating one never affects the other.
	 * (The keys and values themselves are not copied.)
	 */
	public static <KK,VV> AvlMap<KK,VV> copyOf(AvlMap<KK,VV> other) {
		AvlMap<KK,VV> result = new AvlMap<>(other.comparator);
		if (other.root != null) {
			result.root = other.root.copySubtree(null);
		}
		result.size = other.size;
		LOGGER.debug("Copied map with {} entries", result.size);
		return result;
	}

	public boolean isEmpty() {
		return size == 0;
	}

	/**
	 * @return the height of the tree: -1 if empty, 0 if it has one entry.
	 */
	public int height() {
		return AvlNode.heightOf(root);
	}

	/**
	 * Adds an entry for <code>key</code>, or replaces the value if
	 * the key is already present.
	 */
	public void update(K key, V value) {
		if (root == null) {
			// Nothing else to compare against; make sure the comparator accepts the key
			comparator.compare(key, key);
		}
		AvlNode<K,V> node = findNode(key);
		if (node != null && isKeyOf(node, key)) {
			node.value = value;
			return;
		}

		AvlNode<K,V> newNode = new AvlNode<>(key, value, node);
		if (node == null) {
			// The tree was empty
			root = newNode;
		} else if (comparator.compare(key, node.key) < 0) {
			node.left = newNode;
		} else {
			node.right = newNode;
		}
		++size;
		++modCount;

		fixUp(newNode);
	}

	/**
	 * Removes the entry for <code>key</code>.
	 *
	 * @throws NonexistentKeyException if there is no such entry
	 */
	public void remove(K key) {
		AvlNode<K,V> node = findNode(key);
		if (node == null || !isKeyOf(node, key)) {
			throw new NonexistentKeyException(key);
		}

		// The node we physically remove is either this one, if it has no left subtree,
		// or else its in-order predecessor, which has no right subtree.
		// Either way, it has at most one child.
		AvlNode<K,V> pluck = (node.left == null) ? node : node.left.rightmostDescendant();
		if (pluck != node) {
			LOGGER.trace("Removing {} by substituting predecessor {}", node.key, pluck.key);
			node.key = pluck.key;
			node.value = pluck.value;
		}

		AvlNode<K,V> pluckParent = pluck.parent;
		pluckNode(pluck);
		fixUp(pluckParent);
	}

	public boolean hasKey(K key) {
		AvlNode<K,V> node = findNode(key);
		return node != null && isKeyOf(node, key);
	}

	/**
	 * @throws NonexistentKeyException if there is no entry for <code>key</code>
	 */
	public V at(K key) {
		AvlNode<K,V> node = findNode(key);
		if (node == null || !isKeyOf(node, key)) {
			throw new NonexistentKeyException(key);
		}
		return node.value;
	}

	/**
	 * Like {@link #at}, except a missing entry is first created with the value
	 * supplied by <code>defaultValue</code>, so that subsequent lookups succeed.
	 */
	public V getOrInsert(K key, Supplier<? extends V> defaultValue) {
		AvlNode<K,V> node = findNode(key);
		if (node != null && isKeyOf(node, key)) {
			return node.value;
		}
		V value = defaultValue.get();
		update(key, value);
		return value;
	}

	/**
	 * Equivalent to <code>getOrInsert(key, () -> null)</code>.
	 */
	public V getOrInsert(K key) {
		return getOrInsert(key, () -> null);
	}

	public void clear() {
		root = null;
		size = 0;
		++modCount;
	}

	/**
	 * @return a cursor at the entry with the smallest key, or {@link #end()} if the map is empty.
	 */
	public AvlCursor<K,V> begin() {
		return new AvlCursor<>(this, (root == null) ? null : root.leftmostDescendant());
	}

	/**
	 * @return the cursor just past the last entry.
	 */
	public AvlCursor<K,V> end() {
		return new AvlCursor<>(this, null);
	}

	/**
	 * @return a cursor at the entry for <code>key</code>, or {@link #end()} if there is none.
	 */
	public AvlCursor<K,V> find(K key) {
		AvlNode<K,V> node = findNode(key);
		if (node != null && isKeyOf(node, key)) {
			return new AvlCursor<>(this, node);
		} else {
			return end();
		}
	}

	/**
	 * Entries are returned in ascending key order. Each entry is a copy taken when
	 * {@link Iterator#next()} returns it, so value changes show up only for entries
	 * not yet visited. After a structural modification of the map, <code>next()</code>
	 * throws {@link java.util.ConcurrentModificationException}.
	 * The iterator does not support {@link Iterator#remove()}.
	 */
	@NotNull
	@Override
	public Iterator<Map.Entry<K,V>> iterator() {
		AvlCursor<K,V> cursor = begin();
		return new Iterator<Map.Entry<K,V>>() {
			@Override
			public boolean hasNext() {
				return !cursor.isEnd();
			}

			@Override
			public Map.Entry<K,V> next() {
				if (cursor.isEnd()) {
					throw new NoSuchElementException();
				}
				Map.Entry<K,V> result = new SimpleImmutableEntry<>(cursor.key(), cursor.value());
				cursor.advance();
				return result;
			}
		};
	}

	/**
	 * @return an immutable list of this map's entries in ascending key order.
	 */
	public PVector<Map.Entry<K,V>> snapshot() {
		List<Map.Entry<K,V>> entries = new ArrayList<>(size);
		this.forEach(entries::add);
		return TreePVector.from(entries);
	}

	/**
	 * @return an unmodifiable live view of this map, iterating in ascending key order.
	 */
	public Map<K,V> asMap() {
		return new AvlMapView<>(this);
	}

	@Override
	public String toString() {
		return asMap().toString();
	}

	int modCount() {
		return modCount;
	}

	/**
	 * @return the node containing the key; or, if there is none, the node that
	 * would be its parent; or null if the tree is empty.
	 */
	@Nullable
	private AvlNode<K,V> findNode(K key) {
		AvlNode<K,V> node = root, parent = null;
		while (node != null) {
			int discriminator = comparator.compare(key, node.key);
			if (discriminator == 0) {
				return node;
			}
			parent = node;
			node = (discriminator < 0) ? node.left : node.right;
		}
		return parent;
	}

	private boolean isKeyOf(AvlNode<K,V> node, K key) {
		return comparator.compare(key, node.key) == 0;
	}

	/**
	 * Removes a node having at most one child, moving that child into its place.
	 */
	private void pluckNode(AvlNode<K,V> node) {
		AvlNode<K,V> child;
		if (node.left != null) {
			assert node.right == null: "Node to pluck must not have two children: " + node;
			child = node.left;
		} else {
			child = node.right; // Null if node is a leaf
		}

		replaceChild(node.parent, node, child);
		if (child != null) {
			child.parent = node.parent;
		}

		node.unlink();
		--size;
		++modCount;
	}

	/**
	 * Restores heights and the AVL property from <code>node</code> up to the root.
	 */
	private void fixUp(AvlNode<K,V> node) {
		while (node != null) {
			node.recalcHeight();
			int lh = node.leftHeight();
			int rh = node.rightHeight();
			assert Math.abs(lh - rh) <= 2: "Imbalance of " + (lh - rh) + " at " + node;

			if (lh == rh + 2) {
				AvlNode<K,V> lchild = node.left;
				if (lchild.leftHeight() < lchild.rightHeight()) {
					// Left-right case
					rotateLeft(lchild);
				}
				node = rotateRight(node);
			} else if (rh == lh + 2) {
				AvlNode<K,V> rchild = node.right;
				if (rchild.leftHeight() > rchild.rightHeight()) {
					// Right-left case
					rotateRight(rchild);
				}
				node = rotateLeft(node);
			}

			// Rotated or not, node now roots the subtree we just checked
			node = node.parent;
		}
	}

	/**
	 * @return the node that has taken the place of <code>node</code>
	 */
	private AvlNode<K,V> rotateRight(AvlNode<K,V> node) {
		AvlNode<K,V> lchild = node.left;
		if (lchild == null) {
			throw new IllegalStateException("Cannot rotate right; no left child: " + node);
		}
		LOGGER.trace("rotateRight({})", node.key);

		replaceChild(node.parent, node, lchild);
		lchild.parent = node.parent;
		node.parent = lchild;

		node.left = lchild.right;
		if (node.left != null) {
			node.left.parent = node;
		}
		lchild.right = node;

		// node is now below lchild, so it goes first
		node.recalcHeight();
		lchild.recalcHeight();
		return lchild;
	}

	/**
	 * @return the node that has taken the place of <code>node</code>
	 */
	private AvlNode<K,V> rotateLeft(AvlNode<K,V> node) {
		AvlNode<K,V> rchild = node.right;
		if (rchild == null) {
			throw new IllegalStateException("Cannot rotate left; no right child: " + node);
		}
		LOGGER.trace("rotateLeft({})", node.key);

		replaceChild(node.parent, node, rchild);
		rchild.parent = node.parent;
		node.parent = rchild;

		node.right = rchild.left;
		if (node.right != null) {
			node.right.parent = node;
		}
		rchild.left = node;

		node.recalcHeight();
		rchild.recalcHeight();
		return rchild;
	}

	/**
	 * Points whichever link referred to <code>oldChild</code> at <code>newChild</code> instead.
	 * Does not touch <code>newChild.parent</code>.
	 */
	private void replaceChild(@Nullable AvlNode<K,V> parent, AvlNode<K,V> oldChild, @Nullable AvlNode<K,V> newChild) {
		if (parent == null) {
			root = newChild;
		} else if (parent.left == oldChild) {
			parent.left = newChild;
		} else {
			parent.right = newChild;
		}
	}

	/**
	 * For tests that check the tree structure directly.
	 */
	AvlNode<K,V> root() {
		return root;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AvlMap.class);
}
