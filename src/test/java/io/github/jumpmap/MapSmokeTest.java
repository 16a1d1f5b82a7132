package io.github.jumpmap;

import static org.junit.jupiter.api.Assertions.*;

import java.util.function.Supplier;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Bulk workloads over several sizing policies, checking placement results and tombstone bookkeeping.
 */
class MapSmokeTest {

	record Layout(String name, Supplier<JumpMap<Object, Integer>> factory) {
		@Override public String toString() { return name; }
	}

	private static Stream<Layout> layouts() {
		return Stream.of(
			new Layout("defaults", JumpMap::new),
			new Layout("growFactor=1.5", () -> new JumpMap<>(SizingPolicy.defaults().withGrowFactor(1.5d, 0))),
			new Layout("multiplier=3", () -> new JumpMap<>(SizingPolicy.of(7, 0.72f, 3, prev -> 2.0d))),
			new Layout("loadFactor=1", () -> new JumpMap<>(SizingPolicy.forCapacity(5, 1f)))
		);
	}

	@ParameterizedTest(name = "{0} insertDeleteReinsert")
	@MethodSource("layouts")
	void insertDeleteReinsert(Layout layout) {
		var m = layout.factory().get();
		int n = 100_000;

		for (int i = 0; i < n; i++) assertEquals(PutResult.INSERTED, m.insert(i, i * 2, false));
		int grown = m.bucketCount();
		assertTrue(Primes.isPrime(grown));
		assertTrue(n <= m.loadLimit());

		for (int i = 0; i < n; i += 2) assertTrue(m.unmap(i));
		assertEquals(n / 2, m.diagnostics().tombstones());
		assertEquals(n / 2, m.size());

		// the live count never passes the old peak, so reinsertion fits without growing
		for (int i = 0; i < n; i += 2) assertEquals(PutResult.INSERTED, m.insert(i, i * 3, false));
		for (int i = 1; i < n; i += 2) assertEquals(PutResult.ALREADY_MAPPED, m.tryMap(i, -1));
		assertEquals(grown, m.bucketCount());
		// the first reinsert finds nothing but live slots ahead of its own tombstone
		assertTrue(m.diagnostics().tombstones() < n / 2);
		assertTrue(m.size() + m.diagnostics().tombstones() <= grown);

		for (int i = 0; i < n; i++) {
			int expected = (i % 2 == 0) ? i * 3 : i * 2;
			assertEquals(expected, m.get(i));
		}
		assertEquals(n, m.size());
	}

	@ParameterizedTest(name = "{0} heavyCollisions")
	@MethodSource("layouts")
	void heavyCollisions(Layout layout) {
		record Collide(int v) { @Override public int hashCode() { return 0; } }
		var m = layout.factory().get();
		int n = 3_000;

		long before = m.collisions();
		for (int i = 0; i < n; i++) m.put(new Collide(i), i);
		long afterInsert = m.collisions();
		// every key shares one probe sequence, so the i-th insert steps past i occupied slots
		assertTrue(afterInsert - before >= (long) n * (n - 1) / 2, "collisions=" + (afterInsert - before));

		for (int i = 0; i < n; i++) assertEquals(i, m.get(new Collide(i)));
		assertTrue(m.collisions() > afterInsert);

		for (int i = 0; i < n; i += 3) assertEquals(i, m.remove(new Collide(i)));
		var d = m.diagnostics();
		assertEquals(n - (n + 2) / 3, d.size());
		assertEquals((n + 2) / 3, d.tombstones());
		assertTrue(d.size() + d.tombstones() <= d.bucketCount());

		for (int i = 0; i < n; i++) {
			Object v = m.get(new Collide(i));
			if (i % 3 == 0) assertNull(v);
			else assertEquals(i, v);
		}
	}

	@Test
	void fixedTableInsertDeleteReinsert() {
		JumpMap<Object, Integer> m = JumpMap.fixedSize(1_000);
		int limit = m.loadLimit();
		int buckets = m.bucketCount();

		for (int i = 0; i < limit; i++) assertEquals(PutResult.INSERTED, m.insert(i, i, false));
		for (int i = limit; i < limit + 100; i++) assertEquals(PutResult.CAPACITY_EXCEEDED, m.insert(i, i, true));
		for (int i = 0; i < limit; i++) assertEquals(PutResult.REPLACED, m.insert(i, -i, true));

		for (int i = 0; i < limit; i += 2) assertEquals(-i, m.pop(i));
		int half = m.size();

		for (int round = 0; round < 20; round++) {
			int base = limit * (round + 1);
			for (int i = 0; i < limit; i += 2) assertEquals(PutResult.INSERTED, m.insert(i + base, i, false));
			assertEquals(limit, m.size());
			assertEquals(PutResult.CAPACITY_EXCEEDED, m.tryMap(-1, 0), "round " + round);
			for (int i = 0; i < limit; i += 2) assertEquals(i, m.pop(i + base));
			assertEquals(half, m.size());
		}
		assertEquals(buckets, m.bucketCount());
		for (int i = 1; i < limit; i += 2) assertEquals(-i, m.get(i));
	}
}
