package works.avlmap;

import lombok.ToString;

/**
 * One entry of an {@link AvlMap}, plus its position in the tree.
 *
 * <p>
 * A node owns its {@link #left} and {@link #right} children.
 * {@link #parent} is a back-reference only: it must always mirror the
 * child links, and it is never followed to decide ownership.
 */
@ToString(of = {"key", "value", "height"})
final class AvlNode<K,V> {
	K key; // Only AvlMap writes this after construction
	V value;
	AvlNode<K,V> left, right, parent;
	int height;

	AvlNode(K key, V value, AvlNode<K,V> parent) {
		this.key = key;
		this.value = value;
		this.parent = parent;
		this.height = 0;
	}

	/**
	 * Assumes the children's heights are correct.
	 */
	void recalcHeight() {
		height = 1 + Math.max(leftHeight(), rightHeight());
	}

	int leftHeight() {
		return heightOf(left);
	}

	int rightHeight() {
		return heightOf(right);
	}

	static int heightOf(AvlNode<?,?> node) {
		return (node == null) ? -1 : node.height;
	}

	AvlNode<K,V> leftmostDescendant() {
		AvlNode<K,V> result = this;
		while (result.left != null) {
			result = result.left;
		}
		return result;
	}

	AvlNode<K,V> rightmostDescendant() {
		AvlNode<K,V> result = this;
		while (result.right != null) {
			result = result.right;
		}
		return result;
	}

	/**
	 * @return the in-order successor, or null if this is the last node.
	 */
	AvlNode<K,V> successor() {
		if (right != null) {
			return right.leftmostDescendant();
		}
		AvlNode<K,V> child = this;
		AvlNode<K,V> ancestor = parent;
		while (ancestor != null && ancestor.right == child) {
			child = ancestor;
			ancestor = ancestor.parent;
		}
		return ancestor;
	}

	/**
	 * @return a structurally identical copy of the subtree rooted here,
	 * sharing no nodes with this one.
	 */
	AvlNode<K,V> copySubtree(AvlNode<K,V> newParent) {
		AvlNode<K,V> copy = new AvlNode<>(key, value, newParent);
		copy.height = height;
		if (left != null) {
			copy.left = left.copySubtree(copy);
		}
		if (right != null) {
			copy.right = right.copySubtree(copy);
		}
		return copy;
	}

	void unlink() {
		left = right = parent = null;
	}
}
