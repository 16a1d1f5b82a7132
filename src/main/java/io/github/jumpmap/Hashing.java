package io.github.jumpmap;

/**
 * Static hash helpers. The smear step is the Guava one, by Kevin Bourrillion, Jesse Wilson,
 * and Austin Appleby, derived from the MurmurHash3 intermediate step (public domain).
 *
 * <p>Slot tags use the sign bit as the tombstone ("dirty") flag and the low 31 bits as the stored hash:
 * {@code 0} is an empty slot, a positive tag is a live slot, a negative tag is a tombstone.
 */
final class Hashing {

	private Hashing() {}

	/*
	 * Use longs to preserve precision (mirrors the Guava implementation).
	 */
	private static final long C1 = 0xcc9e2d51L;
	private static final long C2 = 0x1b873593L;

	static final int HASH31_MASK = 0x7FFFFFFF;
	static final int DIRTY_BIT = 0x80000000;

	static final int TAG_EMPTY = 0;

	/*
	 * This method was rewritten in Java from an intermediate step of the Murmur hash function in
	 * http://code.google.com/p/smhasher/source/browse/trunk/MurmurHash3.cpp, which contained the
	 * following header:
	 *
	 * MurmurHash3 was written by Austin Appleby, and is placed in the public domain. The author
	 * hereby disclaims copyright to this source code.
	 */
	static int smear(int hashCode) {
		return (int) (C2 * Integer.rotateLeft((int) (hashCode * C1), 15));
	}

	static int smearedHash(Object o) {
		return smear((o == null) ? 0 : o.hashCode());
	}

	/**
	 * Folds a full 32-bit hash into the positive 31-bit range used for live tags.
	 * Zero is reserved for empty slots, so it is remapped to 1.
	 */
	static int hash31(int hash) {
		int h = hash & HASH31_MASK;
		return (h == 0) ? 1 : h;
	}

	static boolean isLive(int tag) {
		return tag > 0;
	}

	static boolean isTombstone(int tag) {
		return tag < 0;
	}

	static int tombstoneOf(int tag) {
		return tag | DIRTY_BIT;
	}
}
