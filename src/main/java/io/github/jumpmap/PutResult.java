package io.github.jumpmap;

/**
 * Outcome of {@link JumpMap#insert(Object, Object, boolean)}.
 */
public enum PutResult {
	/** A new mapping was created. */
	INSERTED,
	/** An existing mapping had its value overwritten. */
	REPLACED,
	/** The key was already mapped and overwriting was not requested; nothing changed. */
	ALREADY_MAPPED,
	/** A fixed-size (or saturated) table is at its load limit; nothing changed. */
	CAPACITY_EXCEEDED;

	/**
	 * True when the requested value is now mapped to the key.
	 */
	public boolean isMapped() {
		return this == INSERTED || this == REPLACED;
	}
}
