package io.github.jumpmap;

/**
 * Thrown by the {@link java.util.Map} mutators of a {@link JumpMap} that cannot grow past its load
 * limit. The result-valued API ({@link JumpMap#insert}, {@link JumpMap#tryMap}) reports
 * {@link PutResult#CAPACITY_EXCEEDED} instead.
 */
public class CapacityExceededException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final int loadLimit;

	public CapacityExceededException(int loadLimit) {
		super("Map is at its load limit (" + loadLimit + ") and cannot grow");
		this.loadLimit = loadLimit;
	}

	public int loadLimit() {
		return loadLimit;
	}
}
