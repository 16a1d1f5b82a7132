package io.github.jumpmap;

/**
 * Decoded state of a single bucket, for occupancy inspection.
 */
public enum SlotState {
	EMPTY,
	LIVE,
	TOMBSTONE;

	static SlotState ofTag(int tag) {
		if (tag == Hashing.TAG_EMPTY) return EMPTY;
		return Hashing.isLive(tag) ? LIVE : TOMBSTONE;
	}
}
