package works.avlmap.exceptions;

import works.avlmap.AvlMap;

/**
 * Thrown when {@link AvlMap#remove} or {@link AvlMap#at} is called with a key
 * that is not in the map. Indicates a bug in the caller, which should have
 * checked {@link AvlMap#hasKey} first.
 */
@SuppressWarnings("serial")
public class NonexistentKeyException extends RuntimeException {
	public NonexistentKeyException(Object key) {
		super(message(key));
	}

	private static String message(Object key) {
		return "No entry for key \"" + key + "\"";
	}

}
