package io.github.jumpmap;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closed-hashing map with jump probing (double hashing over prime-sized tables).
 * Null keys NOT allowed, null values allowed.
 *
 * <p>Removal leaves a tombstone so probe chains stay intact; tombstones are reused by later insertions
 * on the same probe path and purged on every rehash. The table grows by the {@link SizingPolicy} growth
 * function once the live count reaches the load limit; a fixed-size table refuses the insertion instead.
 *
 * <p>Not thread-safe. Any structural change invalidates open {@link Cursor}s, except the cursor's own
 * {@link Cursor#remove()} and {@link Cursor#replaceValue(Object)}.
 */
public class JumpMap<K, V> extends AbstractMap<K, V> {

	private static final Logger log = LoggerFactory.getLogger(JumpMap.class);

	/* slotFor() result when the table is full and cannot grow */
	private static final int NO_ROOM = Integer.MIN_VALUE;

	/* Storage */
	private Object[] keys;
	private Object[] vals;
	private int[] tags; // 0 empty, > 0 live hash31, < 0 tombstone
	private int size;
	private int loadLimit;

	/* Bookkeeping */
	private long collisions;
	private long version;
	private int epoch; // bumped whenever the bucket contents are dropped wholesale

	private final SizingPolicy policy;
	private final boolean fallbackPolicy;
	private final Equivalence<? super K> keyEquivalence;
	private final Equivalence<? super V> valueEquivalence; // null => value queries report false

	public JumpMap() {
		this(SizingPolicy.defaults());
	}

	public JumpMap(int userCapacity) {
		this(SizingPolicy.forCapacity(userCapacity));
	}

	public JumpMap(SizingPolicy policy) {
		this(Equivalence.natural(), Equivalence.natural(), policy);
	}

	public JumpMap(Equivalence<? super K> keyEquivalence, SizingPolicy policy) {
		this(keyEquivalence, Equivalence.natural(), policy);
	}

	/**
	 * @param keyEquivalence   key hashing and equality; {@code null} selects {@link Equivalence#natural()}
	 * @param valueEquivalence value equality for value queries; {@code null} makes
	 *                         {@link #containsValue}, {@link #containsEntry} and {@link #remove(Object, Object)}
	 *                         report {@code false}
	 * @param policy           sizing policy; one failing {@link SizingPolicy#check()} is replaced by
	 *                         {@link SizingPolicy#defaults()} with a warning
	 */
	public JumpMap(Equivalence<? super K> keyEquivalence, Equivalence<? super V> valueEquivalence, SizingPolicy policy) {
		Objects.requireNonNull(policy, "policy");
		List<String> violations = policy.violations();
		if (violations.isEmpty()) {
			this.policy = policy;
			this.fallbackPolicy = false;
		} else {
			log.warn("Rejected {}: {}; falling back to defaults", policy, violations);
			this.policy = SizingPolicy.defaults();
			this.fallbackPolicy = true;
		}
		this.keyEquivalence = (keyEquivalence == null) ? Equivalence.natural() : keyEquivalence;
		this.valueEquivalence = valueEquivalence;
		allocate(this.policy.initialSize());
	}

	/**
	 * Pairs keys with values in iteration order. Missing trailing values map to {@code null}.
	 *
	 * @throws IllegalArgumentException if there are more values than keys
	 */
	public JumpMap(Collection<? extends K> keys, Collection<? extends V> values) {
		this(policyFor(keys, values));
		Iterator<? extends V> valIt = values.iterator();
		for (K key : keys) {
			remap(key, valIt.hasNext() ? valIt.next() : null);
		}
	}

	private static SizingPolicy policyFor(Collection<?> keys, Collection<?> values) {
		if (keys.size() < values.size()) {
			throw new IllegalArgumentException("More values (" + values.size() + ") than keys (" + keys.size() + ")");
		}
		return SizingPolicy.defaults().withLoadLimit(keys.size());
	}

	/**
	 * Map that never resizes and holds at most the load limit derived from {@code userCapacity}.
	 */
	public static <K, V> JumpMap<K, V> fixedSize(int userCapacity) {
		return new JumpMap<>(SizingPolicy.fixedCapacity(userCapacity));
	}

	/* ------------ Map API ------------ */

	@Override
	public int size() {
		return size;
	}

	@Override
	public boolean isEmpty() {
		return size == 0;
	}

	@Override
	public boolean containsKey(Object key) {
		return findIndex(key) >= 0;
	}

	@Override
	public boolean containsValue(Object value) {
		if (valueEquivalence == null) return false;
		V v = castValue(value);
		for (int i = 0; i < tags.length; i++) {
			if (Hashing.isLive(tags[i]) && valueEquivalence.equivalent(v, valueAt(i))) return true;
		}
		return false;
	}

	/**
	 * True when {@code key} is mapped to a value equivalent to {@code value}. Always false for a map
	 * built without a value equivalence.
	 */
	public boolean containsEntry(K key, V value) {
		if (valueEquivalence == null) return false;
		int idx = findIndex(key);
		return idx >= 0 && valueEquivalence.equivalent(value, valueAt(idx));
	}

	@Override
	public V get(Object key) {
		int idx = findIndex(key);
		return (idx < 0) ? null : valueAt(idx);
	}

	/**
	 * @throws CapacityExceededException if the key is new and the table cannot grow
	 */
	@Override
	public V put(K key, V value) {
		int h = hash31(key);
		int idx = slotFor(key, h);
		if (idx == NO_ROOM) throw new CapacityExceededException(loadLimit);
		if (idx >= 0) {
			V old = valueAt(idx);
			vals[idx] = value;
			version++;
			return old;
		}
		fillSlot(-idx - 1, key, h, value);
		return null;
	}

	/**
	 * @throws CapacityExceededException if the key is new and the table cannot grow
	 */
	@Override
	public V putIfAbsent(K key, V value) {
		int h = hash31(key);
		int idx = slotFor(key, h);
		if (idx == NO_ROOM) throw new CapacityExceededException(loadLimit);
		if (idx >= 0) return valueAt(idx);
		fillSlot(-idx - 1, key, h, value);
		return null;
	}

	@Override
	public V remove(Object key) {
		int idx = findIndex(key);
		return (idx < 0) ? null : removeAt(idx);
	}

	@Override
	public boolean remove(Object key, Object value) {
		if (valueEquivalence == null) return false;
		int idx = findIndex(key);
		if (idx < 0 || !valueEquivalence.equivalent(castValue(value), valueAt(idx))) return false;
		removeAt(idx);
		return true;
	}

	/**
	 * Drops every mapping and keeps the current bucket arrays.
	 */
	@Override
	public void clear() {
		clear(true);
	}

	@Override
	public Set<Map.Entry<K, V>> entrySet() {
		return new EntrySet();
	}

	/* ------------ Insertion / removal ------------ */

	/**
	 * Maps {@code key} to {@code value}.
	 *
	 * @param overwrite whether an existing mapping may be replaced
	 * @return {@link PutResult#INSERTED} or {@link PutResult#REPLACED} on success,
	 *         {@link PutResult#ALREADY_MAPPED} if the key exists and {@code overwrite} is false,
	 *         {@link PutResult#CAPACITY_EXCEEDED} if the key is new and the table cannot grow
	 */
	public PutResult insert(K key, V value, boolean overwrite) {
		int h = hash31(key);
		int idx = slotFor(key, h);
		if (idx == NO_ROOM) return PutResult.CAPACITY_EXCEEDED;
		if (idx >= 0) {
			if (!overwrite) return PutResult.ALREADY_MAPPED;
			vals[idx] = value;
			version++;
			return PutResult.REPLACED;
		}
		fillSlot(-idx - 1, key, h, value);
		return PutResult.INSERTED;
	}

	/**
	 * Maps {@code key} to {@code value} only if the key is absent.
	 *
	 * @return true if the mapping was created
	 */
	public boolean map(K key, V value) {
		return insert(key, value, false) == PutResult.INSERTED;
	}

	/**
	 * Like {@link #map}, but tells an existing key apart from a full table.
	 */
	public PutResult tryMap(K key, V value) {
		return insert(key, value, false);
	}

	/**
	 * Maps {@code key} to {@code value}, replacing any existing value.
	 *
	 * @return false only if the key is new and the table cannot grow
	 */
	public boolean remap(K key, V value) {
		return insert(key, value, true).isMapped();
	}

	/**
	 * Removes the mapping for {@code key} and returns its value ({@code null} if absent).
	 */
	public V pop(K key) {
		return remove(key);
	}

	/**
	 * @return true if a mapping for {@code key} was removed
	 */
	public boolean unmap(K key) {
		int idx = findIndex(key);
		if (idx < 0) return false;
		removeAt(idx);
		return true;
	}

	/**
	 * Drops every mapping.
	 *
	 * @param keepAllocation keep the current bucket arrays; otherwise reallocate at the policy's
	 *                       initial size
	 */
	public void clear(boolean keepAllocation) {
		if (keepAllocation) {
			Arrays.fill(keys, null);
			Arrays.fill(vals, null);
			Arrays.fill(tags, Hashing.TAG_EMPTY);
		} else {
			allocate(policy.initialSize());
		}
		size = 0;
		version++;
		epoch++;
	}

	/* ------------ Capacity management ------------ */

	/**
	 * Grows the table so it can hold at least {@code loadLimit} entries. Fixed-size tables never grow.
	 * The policy is left as is, so {@link #resetCapacity()} goes back to its initial size.
	 *
	 * @return true if the table can now hold {@code loadLimit} entries
	 */
	public boolean ensureCapacity(int loadLimit) {
		if (loadLimit < 0) throw new IllegalArgumentException("loadLimit must be >= 0: " + loadLimit);
		if (!policy.isFixedSize() && loadLimit > this.loadLimit) {
			rehash(policy.sizeFor(loadLimit));
		}
		return this.loadLimit >= loadLimit;
	}

	/**
	 * Rebuilds the table at the policy's initial size, or at the smallest size holding the current
	 * entries if they would not fit.
	 */
	public void resetCapacity() {
		int target = policy.initialSize();
		if (policy.loadLimit(target) < size) {
			target = policy.sizeFor(size);
		}
		rehash(target);
	}

	/**
	 * Rebuilds the table at its current size, purging tombstones.
	 */
	public void rehash() {
		rehash(tags.length);
	}

	/* ------------ Diagnostics ------------ */

	/** Physical number of slots. */
	public int bucketCount() {
		return tags.length;
	}

	/** Number of live entries the current table may hold before growing. */
	public int loadLimit() {
		return loadLimit;
	}

	/** Probe steps taken past occupied or tombstoned slots, since construction. */
	public long collisions() {
		return collisions;
	}

	public float loadRatio() {
		return (float) size / tags.length;
	}

	public long version() {
		return version;
	}

	public boolean isFixedSize() {
		return policy.isFixedSize();
	}

	public SizingPolicy policy() {
		return policy;
	}

	/** True when the policy given at construction was rejected and the defaults are in use. */
	public boolean usesFallbackPolicy() {
		return fallbackPolicy;
	}

	public SlotState slotState(int index) {
		Objects.checkIndex(index, tags.length);
		return SlotState.ofTag(tags[index]);
	}

	public Diagnostics diagnostics() {
		int tombstones = 0;
		for (int tag : tags) {
			if (Hashing.isTombstone(tag)) tombstones++;
		}
		return new Diagnostics(size, tags.length, loadLimit, tombstones, collisions, loadRatio(), version);
	}

	/**
	 * Point-in-time view of the table's occupancy counters.
	 */
	public record Diagnostics(
		int size,
		int bucketCount,
		int loadLimit,
		int tombstones,
		long collisions,
		float loadRatio,
		long version
	) {}

	/* ------------ Cursor ------------ */

	/**
	 * Opens a cursor over the live entries. Close it (or exhaust it) to apply removals made through it.
	 */
	public Cursor cursor() {
		return new Cursor();
	}

	/* ------------ Internal helpers ------------ */

	private void allocate(int tableSize) {
		this.keys = new Object[tableSize];
		this.vals = new Object[tableSize];
		this.tags = new int[tableSize];
		this.loadLimit = policy.loadLimit(tableSize);
	}

	private int hash31(Object key) {
		if (key == null) throw new NullPointerException("Null keys not supported");
		return Hashing.hash31(keyEquivalence.hash(castKey(key)));
	}

	private static int nextProbe(int idx, int jump, int n) {
		// (idx + jump) % n without overflowing near Integer.MAX_VALUE
		int next = idx - (n - jump);
		return (next < 0) ? next + n : next;
	}

	private int findIndex(Object key) {
		int h = hash31(key);
		K k = castKey(key);
		int[] tags = this.tags;
		int n = tags.length;
		int idx = h % n;
		int jump = policy.calcJump(h, n);
		for (int probes = 0; probes < n; probes++) {
			int tag = tags[idx];
			if (tag == Hashing.TAG_EMPTY) return -1;
			if (tag == h && keyEquivalence.equivalent(k, castKey(keys[idx]))) return idx;
			collisions++;
			idx = nextProbe(idx, jump, n);
		}
		return -1;
	}

	/**
	 * Probes for {@code key}. Returns the index of its live slot, or {@code -(insertionPoint + 1)} where
	 * the insertion point is the first tombstone or empty slot on the probe path.
	 */
	private int probeForInsert(K key, int h) {
		int[] tags = this.tags;
		int n = tags.length;
		int idx = h % n;
		int jump = policy.calcJump(h, n);
		int insertAt = -1;
		for (int probes = 0; probes < n; probes++) {
			int tag = tags[idx];
			if (tag == Hashing.TAG_EMPTY) {
				return -((insertAt < 0 ? idx : insertAt) + 1);
			}
			if (tag == h) {
				if (keyEquivalence.equivalent(key, castKey(keys[idx]))) return idx;
			} else if (insertAt < 0 && Hashing.isTombstone(tag)) {
				insertAt = idx;
			}
			collisions++;
			idx = nextProbe(idx, jump, n);
		}
		if (insertAt < 0) throw new IllegalStateException("Probe cycle exhausted; table has no free slot");
		return -(insertAt + 1);
	}

	/**
	 * Like {@link #probeForInsert}, but first makes room for a new key when the load limit is reached.
	 * Returns {@link #NO_ROOM} if the key is new and the table cannot grow.
	 */
	private int slotFor(K key, int h) {
		if (size >= loadLimit) {
			long before = collisions;
			int found = probeForInsert(key, h);
			if (found >= 0) return found;
			// the key is new; only the probe that places it counts
			collisions = before;
			if (!growToFit()) {
				log.debug("Refused new key at load limit {} ({} slots)", loadLimit, tags.length);
				return NO_ROOM;
			}
		}
		return probeForInsert(key, h);
	}

	private boolean growToFit() {
		while (size >= loadLimit) {
			int oldSize = tags.length;
			int newSize = policy.calcNextSize(oldSize, Primes.MAX_SIZE);
			if (newSize <= oldSize) {
				if (oldSize >= Primes.MAX_SIZE) {
					log.warn("Table saturated at the maximum size ({} slots, load limit {})", oldSize, loadLimit);
				}
				return false;
			}
			rehash(newSize);
		}
		return true;
	}

	/**
	 * Rebuilds the table at {@code newSize}, replaying live entries through the insertion probe and
	 * dropping tombstones. The live count is kept as booked, since open cursors may still owe removals.
	 */
	private void rehash(int newSize) {
		Object[] oldKeys = keys;
		Object[] oldVals = vals;
		int[] oldTags = tags;

		allocate(newSize);

		int live = 0;
		for (int i = 0; i < oldTags.length; i++) {
			int tag = oldTags[i];
			if (!Hashing.isLive(tag)) continue;
			K key = castKey(oldKeys[i]);
			int idx = -probeForInsert(key, tag) - 1;
			keys[idx] = key;
			vals[idx] = oldVals[i];
			tags[idx] = tag;
			live++;
		}
		version++;
		log.debug("Rehashed {} -> {} slots ({} live)", oldTags.length, newSize, live);
	}

	private void fillSlot(int idx, K key, int h, V value) {
		keys[idx] = key;
		vals[idx] = value;
		tags[idx] = h;
		size++;
		version++;
	}

	/* key stays behind so probe chains through this slot still continue */
	private V removeAt(int idx) {
		V old = valueAt(idx);
		vals[idx] = null;
		tags[idx] = Hashing.tombstoneOf(tags[idx]);
		size--;
		version++;
		return old;
	}

	private V valueAt(int idx) {
		return castValue(vals[idx]);
	}

	@SuppressWarnings("unchecked")
	private K castKey(Object key) {
		return (K) key;
	}

	@SuppressWarnings("unchecked")
	private V castValue(Object value) {
		return (V) value;
	}

	/* ------------ EntrySet / Iterator ------------ */

	private final class EntrySet extends AbstractSet<Map.Entry<K, V>> {
		@Override
		public int size() {
			return JumpMap.this.size;
		}

		@Override
		public void clear() {
			JumpMap.this.clear();
		}

		@Override
		public Iterator<Map.Entry<K, V>> iterator() {
			return new EntryIterator();
		}
	}

	/**
	 * Fail-fast iterator for the collection views. Unlike {@link Cursor}, its {@code remove()} updates
	 * the live count immediately.
	 */
	private final class EntryIterator implements Iterator<Map.Entry<K, V>> {
		private int nextIdx;
		private int current = -1;
		private long expectedVersion = version;

		EntryIterator() {
			this.nextIdx = seek(tags.length - 1);
		}

		private int seek(int start) {
			for (int i = start; i >= 0; i--) {
				if (Hashing.isLive(tags[i])) return i;
			}
			return -1;
		}

		@Override
		public boolean hasNext() {
			return nextIdx >= 0;
		}

		@Override
		public Map.Entry<K, V> next() {
			if (version != expectedVersion) throw new ConcurrentModificationException();
			if (nextIdx < 0) throw new NoSuchElementException();
			current = nextIdx;
			nextIdx = seek(current - 1);
			return new EntryView(castKey(keys[current]));
		}

		@Override
		public void remove() {
			if (current < 0) throw new IllegalStateException();
			if (version != expectedVersion) throw new ConcurrentModificationException();
			removeAt(current);
			expectedVersion = version;
			current = -1;
		}
	}

	private final class EntryView implements Map.Entry<K, V> {
		private final K key;

		EntryView(K key) {
			this.key = key;
		}

		@Override
		public K getKey() {
			return key;
		}

		@Override
		public V getValue() {
			return JumpMap.this.get(key);
		}

		/* writes in place; not a structural change */
		@Override
		public V setValue(V value) {
			int idx = findIndex(key);
			if (idx < 0) throw new IllegalStateException("Entry no longer mapped: " + key);
			V old = valueAt(idx);
			vals[idx] = value;
			return old;
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(key) ^ Objects.hashCode(getValue());
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Map.Entry<?, ?> e)) return false;
			return Objects.equals(key, e.getKey()) && Objects.equals(getValue(), e.getValue());
		}

		@Override
		public String toString() {
			return key + "=" + getValue();
		}
	}

	/**
	 * Single-pass traversal of the live entries that allows removing the current entry in place.
	 *
	 * <p>{@link #remove()} tombstones the current slot at once but defers the live-count update: the
	 * removals are applied to the map when the cursor is {@linkplain #close() closed},
	 * {@linkplain #reset() reset} or runs out of entries. Until then {@link JumpMap#size()} still counts
	 * them. If every entry was removed, the map clears itself at that point.
	 *
	 * <p>Any change made to the map other than through this cursor makes its next {@link #next()},
	 * {@link #advance()}, {@link #remove()} or {@link #replaceValue(Object)} throw
	 * {@link ConcurrentModificationException}. {@link #reset()} rewinds and accepts the map as it is.
	 */
	public final class Cursor implements Iterator<Map.Entry<K, V>>, AutoCloseable {
		private int pos;
		private int remaining;
		private long expectedVersion;
		private int expectedEpoch;
		private int pendingRemoved;
		private boolean onEntry;
		private boolean closed;

		Cursor() {
			rewind();
		}

		private void rewind() {
			pos = tags.length;
			remaining = size;
			expectedVersion = version;
			expectedEpoch = epoch;
			onEntry = false;
		}

		/**
		 * Moves to the next live entry.
		 *
		 * @return false once the traversal is exhausted
		 */
		public boolean advance() {
			ensureOpen();
			checkModified();
			onEntry = false;
			if (remaining > 0) {
				int[] tags = JumpMap.this.tags;
				while (--pos >= 0) {
					if (Hashing.isLive(tags[pos])) {
						remaining--;
						onEntry = true;
						return true;
					}
				}
			}
			finish();
			return false;
		}

		/**
		 * Does not move the cursor. Returning false applies pending removals, as exhaustion does.
		 */
		@Override
		public boolean hasNext() {
			if (closed) return false;
			if (remaining > 0) {
				int[] tags = JumpMap.this.tags;
				for (int i = Math.min(pos, tags.length) - 1; i >= 0; i--) {
					if (Hashing.isLive(tags[i])) return true;
				}
			}
			finish();
			return false;
		}

		@Override
		public Map.Entry<K, V> next() {
			if (!advance()) throw new NoSuchElementException();
			return new AbstractMap.SimpleImmutableEntry<>(castKey(keys[pos]), valueAt(pos));
		}

		public K key() {
			ensureCurrent();
			return castKey(keys[pos]);
		}

		public V value() {
			ensureCurrent();
			return valueAt(pos);
		}

		/**
		 * Removes the current entry. Its slot becomes a tombstone immediately; the live count is
		 * updated when the cursor closes, resets or is exhausted.
		 */
		@Override
		public void remove() {
			ensureCurrent();
			vals[pos] = null;
			tags[pos] = Hashing.tombstoneOf(tags[pos]);
			expectedVersion = ++version;
			pendingRemoved++;
			onEntry = false;
		}

		/**
		 * Overwrites the value of the current entry.
		 *
		 * @return the previous value
		 */
		public V replaceValue(V value) {
			ensureCurrent();
			V old = valueAt(pos);
			vals[pos] = value;
			expectedVersion = ++version;
			return old;
		}

		/**
		 * Applies pending removals and rewinds to the first entry of the map as it is now.
		 */
		public void reset() {
			ensureOpen();
			applyPendingRemovals();
			rewind();
		}

		@Override
		public void close() {
			if (closed) return;
			applyPendingRemovals();
			closed = true;
			onEntry = false;
		}

		public boolean isClosed() {
			return closed;
		}

		/** Removals made through this cursor that the map's live count does not reflect yet. */
		public int pendingRemovals() {
			return pendingRemoved;
		}

		private void finish() {
			applyPendingRemovals();
			remaining = 0;
			pos = -1;
			onEntry = false;
		}

		private void applyPendingRemovals() {
			if (pendingRemoved == 0) return;
			// a wholesale clear already dropped the tombstones these removals refer to
			if (expectedEpoch == epoch) {
				boolean inSync = expectedVersion == version;
				if (pendingRemoved >= size) {
					JumpMap.this.clear(true);
				} else {
					size -= pendingRemoved;
				}
				if (inSync) {
					expectedVersion = version;
					expectedEpoch = epoch;
				}
			}
			pendingRemoved = 0;
		}

		private void ensureOpen() {
			if (closed) throw new IllegalStateException("Cursor is closed");
		}

		private void ensureCurrent() {
			ensureOpen();
			checkModified();
			if (!onEntry) throw new IllegalStateException("No current entry");
		}

		private void checkModified() {
			if (version != expectedVersion) {
				throw new ConcurrentModificationException("JumpMap was modified elsewhere while iterating through it");
			}
		}
	}
}
