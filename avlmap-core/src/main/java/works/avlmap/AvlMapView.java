package works.avlmap;

import java.util.AbstractSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.pcollections.AbstractUnmodifiableMap;

/**
 * Read-only {@link Map} facade over an {@link AvlMap}.
 * Reflects subsequent changes to the underlying map.
 */
@RequiredArgsConstructor
final class AvlMapView<K,V> extends AbstractUnmodifiableMap<K,V> {
	private final AvlMap<K,V> map;

	// AbstractMap's get and containsKey are O(n)
	@Override
	@SuppressWarnings("unchecked")
	public V get(Object key) {
		AvlCursor<K,V> cursor = map.find((K)key);
		return cursor.isEnd() ? null : cursor.value();
	}

	@Override
	@SuppressWarnings("unchecked")
	public boolean containsKey(Object key) {
		return map.hasKey((K)key);
	}

	@Override
	public int size() {
		return map.size();
	}

	@Override
	public Set<Entry<K,V>> entrySet() {
		return new AbstractSet<Entry<K,V>>() {
			@Override
			public Iterator<Entry<K,V>> iterator() {
				return map.iterator();
			}

			@Override
			public int size() {
				return map.size();
			}
		};
	}
}
