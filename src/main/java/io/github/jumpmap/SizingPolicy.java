package io.github.jumpmap;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntToDoubleFunction;

/**
 * Immutable sizing and probing configuration for a {@link JumpMap}.
 *
 * <p>A policy carries the physical initial size (a prime), the load factor, the prime multiplier used
 * to derive probe jumps, and an optional growth function mapping the previous table size to a
 * multiplicative growth factor. A policy without a growth function describes a fixed-size table,
 * which refuses insertions beyond its load limit instead of resizing.
 *
 * <p>All methods are pure functions of the fields; the {@code with*} methods return new policies.
 */
public final class SizingPolicy {

	/* Defaults */
	static final int DEFAULT_USER_CAPACITY = 5;
	static final float DEFAULT_LOAD_FACTOR = 0.72f;
	static final int DEFAULT_HASH_MULTIPLIER = 101;
	static final double DEFAULT_GROW_FACTOR = 2.0d;

	/* Bounds */
	static final float MIN_LOAD_FACTOR = 0.1f * DEFAULT_LOAD_FACTOR;
	static final float MAX_LOAD_FACTOR = 1f;
	static final double MIN_GROW_FACTOR = 1.05d;

	private static final IntToDoubleFunction DEFAULT_GROWTH = prevSize -> DEFAULT_GROW_FACTOR;

	private static final SizingPolicy DEFAULTS = forCapacity(DEFAULT_USER_CAPACITY);

	private final int initialSize;
	private final float loadFactor;
	private final int hashMultiplier;
	private final IntToDoubleFunction growth; // null => fixed size

	private SizingPolicy(int initialSize, float loadFactor, int hashMultiplier, IntToDoubleFunction growth) {
		this.initialSize = initialSize;
		this.loadFactor = loadFactor;
		this.hashMultiplier = hashMultiplier;
		this.growth = growth;
	}

	/* ------------ Factories ------------ */

	public static SizingPolicy defaults() {
		return DEFAULTS;
	}

	/**
	 * Growable policy whose initial table holds at least {@code userCapacity} entries.
	 */
	public static SizingPolicy forCapacity(int userCapacity) {
		return normalized(userCapacity, DEFAULT_LOAD_FACTOR, DEFAULT_HASH_MULTIPLIER, DEFAULT_GROWTH);
	}

	public static SizingPolicy forCapacity(int userCapacity, float loadFactor) {
		return normalized(userCapacity, loadFactor, DEFAULT_HASH_MULTIPLIER, DEFAULT_GROWTH);
	}

	/**
	 * Fixed-size policy holding exactly the load limit derived from {@code userCapacity}.
	 */
	public static SizingPolicy fixedCapacity(int userCapacity) {
		return fixedCapacity(userCapacity, DEFAULT_LOAD_FACTOR);
	}

	public static SizingPolicy fixedCapacity(int userCapacity, float loadFactor) {
		return normalized(userCapacity, loadFactor, DEFAULT_HASH_MULTIPLIER, null);
	}

	/**
	 * Raw policy, taken as given. Intended for values that come from elsewhere (deserialized, hand
	 * tuned); a map receiving a policy that fails {@link #check()} falls back to {@link #defaults()}.
	 *
	 * @param growth growth factor as a function of the previous table size, or {@code null} for a
	 *               fixed-size table
	 */
	public static SizingPolicy of(int initialSize, float loadFactor, int hashMultiplier, IntToDoubleFunction growth) {
		return new SizingPolicy(initialSize, loadFactor, hashMultiplier, growth);
	}

	private static SizingPolicy normalized(int userCapacity, float loadFactor, int hashMultiplier,
		IntToDoubleFunction growth) {
		if (userCapacity < 0) throw new IllegalArgumentException("userCapacity must be >= 0: " + userCapacity);
		float lf = clampLoadFactor(loadFactor);
		int multiplier = Primes.nearestTo(hashMultiplier & Hashing.HASH31_MASK);
		return new SizingPolicy(sizeFor(userCapacity, lf, multiplier), lf, multiplier, growth);
	}

	private static float clampLoadFactor(float lf) {
		if (Float.isNaN(lf)) return DEFAULT_LOAD_FACTOR;
		return Math.max(MIN_LOAD_FACTOR, Math.min(MAX_LOAD_FACTOR, lf));
	}

	public SizingPolicy withGrowth(IntToDoubleFunction growth) {
		return new SizingPolicy(initialSize, loadFactor, hashMultiplier, growth);
	}

	/**
	 * Returns a policy that grows by {@code factor} once the table has reached {@code atSize} slots,
	 * keeping the current growth behavior below it. On a fixed-size policy the table stays fixed
	 * below {@code atSize}.
	 */
	public SizingPolicy withGrowFactor(double factor, int atSize) {
		IntToDoubleFunction below = this.growth;
		IntToDoubleFunction piecewise = prevSize -> {
			if (prevSize >= atSize) return factor;
			return (below == null) ? 0d : below.applyAsDouble(prevSize);
		};
		return new SizingPolicy(initialSize, loadFactor, hashMultiplier, piecewise);
	}

	/**
	 * Returns a policy whose initial table holds at least {@code loadLimit} entries.
	 */
	public SizingPolicy withLoadLimit(int loadLimit) {
		return new SizingPolicy(sizeFor(loadLimit), loadFactor, hashMultiplier, growth);
	}

	public SizingPolicy withInitialSize(int initialSize) {
		return new SizingPolicy(initialSize, loadFactor, hashMultiplier, growth);
	}

	/* ------------ Accessors ------------ */

	public int initialSize() {
		return initialSize;
	}

	public float loadFactor() {
		return loadFactor;
	}

	public int hashMultiplier() {
		return hashMultiplier;
	}

	public boolean isFixedSize() {
		return growth == null;
	}

	/* ------------ Size arithmetic ------------ */

	/**
	 * Number of live entries a table of {@code size} slots may hold.
	 */
	public int loadLimit(int size) {
		return loadLimit(size, loadFactor);
	}

	private static int loadLimit(int size, float loadFactor) {
		return (int) (size * loadFactor + 0.5f);
	}

	public int initialLoadLimit() {
		return loadLimit(initialSize);
	}

	/**
	 * Table size needed to hold {@code loadLimit} entries.
	 */
	public int sizeFor(int loadLimit) {
		return sizeFor(loadLimit, loadFactor, hashMultiplier);
	}

	/* smallest hashable prime whose load limit reaches loadLimit, saturating at MAX_SIZE */
	private static int sizeFor(int loadLimit, float loadFactor, int hashMultiplier) {
		int size = Primes.nextHashableSize((int) Math.ceil(loadLimit / (double) loadFactor), hashMultiplier);
		while (loadLimit(size, loadFactor) < loadLimit && size < Primes.MAX_SIZE) {
			size = Primes.nextHashableSize(size + 1, hashMultiplier);
		}
		return size;
	}

	/**
	 * Probe step for a 31-bit hash in a table of {@code size} slots, in {@code [1, size - 1]}.
	 */
	public int calcJump(int hash31, int size) {
		return 1 + ((hash31 * hashMultiplier) & Hashing.HASH31_MASK) % (size - 1);
	}

	/**
	 * Next table size after {@code prevSize}. Returns {@code prevSize} itself when the table cannot
	 * grow (fixed size, or a growth factor too small to matter).
	 */
	public int calcNextSize(int prevSize, int maxSize) {
		if (growth == null) return prevSize;

		double factor = growth.applyAsDouble(prevSize);
		if (!(factor >= MIN_GROW_FACTOR)) return prevSize;

		if ((int) (maxSize / factor) < prevSize) return maxSize;

		return Math.min(maxSize, Primes.nextHashableSize((int) (prevSize * factor), hashMultiplier));
	}

	public int calcNextSize(int prevSize) {
		return calcNextSize(prevSize, Primes.MAX_SIZE);
	}

	/* ------------ Validation ------------ */

	public boolean check() {
		return violations().isEmpty();
	}

	/**
	 * Human-readable list of every rule this policy breaks; empty when {@link #check()} passes.
	 */
	public List<String> violations() {
		List<String> out = new ArrayList<>(4);
		if (initialSize < Primes.MIN_SIZE || initialSize > Primes.MAX_SIZE) {
			out.add("initialSize out of [" + Primes.MIN_SIZE + ", " + Primes.MAX_SIZE + "]: " + initialSize);
		} else if (initialSize != Primes.MIN_SIZE && !Primes.isPrime(initialSize)) {
			out.add("initialSize is not prime: " + initialSize);
		}
		if (!(loadFactor >= MIN_LOAD_FACTOR && loadFactor <= MAX_LOAD_FACTOR)) {
			out.add("loadFactor out of [" + MIN_LOAD_FACTOR + ", " + MAX_LOAD_FACTOR + "]: " + loadFactor);
		}
		if (hashMultiplier != DEFAULT_HASH_MULTIPLIER && !Primes.isPrime(hashMultiplier)) {
			out.add("hashMultiplier is not prime: " + hashMultiplier);
		}
		return out;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SizingPolicy p)) return false;
		return initialSize == p.initialSize
			&& Float.compare(loadFactor, p.loadFactor) == 0
			&& hashMultiplier == p.hashMultiplier
			&& Objects.equals(growth, p.growth);
	}

	@Override
	public int hashCode() {
		return Objects.hash(initialSize, loadFactor, hashMultiplier, growth);
	}

	@Override
	public String toString() {
		return "SizingPolicy{initialSize=" + initialSize
			+ ", loadFactor=" + loadFactor
			+ ", hashMultiplier=" + hashMultiplier
			+ ", fixed=" + isFixedSize() + '}';
	}
}
