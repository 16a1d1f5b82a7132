package io.github.jumpmap;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import org.eclipse.collections.impl.map.mutable.UnifiedMap;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;

/**
 * Run with {@code org.openjdk.jmh.Main JumpMapBenchmark} on the test classpath.
 */
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class JumpMapBenchmark {

	@State(Scope.Benchmark)
	public static class ReadState {
		@Param({ "100", "1000", "10000" })
		int size;

		JumpMap<Integer, Integer> jump;
		HashMap<Integer, Integer> jdk;
		Object2ObjectOpenHashMap<Integer, Integer> fastutil;
		UnifiedMap<Integer, Integer> unified;
		int[] keys;
		int[] misses;
		Random rnd;

		@Setup(Level.Trial)
		public void setup() {
			rnd = new Random(123);
			keys = new int[size];
			misses = new int[size];
			var keySet = new HashSet<Integer>(size * 2);
			for (int i = 0; i < size; i++) {
				int k = rnd.nextInt();
				keys[i] = k;
				keySet.add(k);
			}
			for (int i = 0; i < size; i++) {
				int miss;
				do { miss = rnd.nextInt(); } while (keySet.contains(miss));
				misses[i] = miss;
			}
			jump = new JumpMap<>();
			jdk = new HashMap<>();
			fastutil = new Object2ObjectOpenHashMap<>();
			unified = new UnifiedMap<>();
			for (int i = 0; i < size; i++) {
				jump.put(keys[i], i);
				jdk.put(keys[i], i);
				fastutil.put(keys[i], (Integer) i);
				unified.put(keys[i], i);
			}
		}

		int nextKey() { return keys[rnd.nextInt(keys.length)]; }
		int nextMiss() { return misses[rnd.nextInt(misses.length)]; }
	}

	@State(Scope.Thread)
	public static class MutateState {
		@Param({ "100", "1000", "10000" })
		int size;

		int[] keys;
		int[] misses;
		int putValue;
		JumpMap<Integer, Integer> jump;
		HashMap<Integer, Integer> jdk;
		Object2ObjectOpenHashMap<Integer, Integer> fastutil;

		@Setup(Level.Trial)
		public void initKeys() {
			var rnd = new Random(456);
			keys = IntStream.range(0, size).map(i -> rnd.nextInt()).toArray();
			misses = IntStream.range(0, size).map(i -> rnd.nextInt()).toArray();
		}

		@Setup(Level.Iteration)
		public void resetMaps() {
			jump = new JumpMap<>();
			jdk = new HashMap<>();
			fastutil = new Object2ObjectOpenHashMap<>();
			for (int i = 0; i < size; i++) {
				jump.put(keys[i], i);
				jdk.put(keys[i], i);
				fastutil.put(keys[i], (Integer) i);
			}
			putValue = 0;
		}

		int missingKey(int i) { return misses[i % misses.length]; }
		int nextValue() { return ++putValue; }
	}

	@State(Scope.Thread)
	public static class RemoveState {
		@Param({ "100", "1000", "10000" })
		int size;

		JumpMap<Integer, Integer> jump;
		HashMap<Integer, Integer> jdk;
		int[] keys;
		Random rnd;

		@Setup(Level.Trial)
		public void initData() {
			rnd = new Random(789);
			keys = IntStream.range(0, size).map(i -> rnd.nextInt()).toArray();
		}

		@Setup(Level.Invocation)
		public void resetMaps() {
			jump = new JumpMap<>();
			jdk = new HashMap<>();
			for (int i = 0; i < size; i++) {
				jump.put(keys[i], i);
				jdk.put(keys[i], i);
			}
		}

		int hitKey() { return keys[rnd.nextInt(keys.length)]; }
	}

	// ------- get hit/miss -------
	@Benchmark
	public int jumpGetHit(ReadState s) {
		return s.jump.get(s.nextKey());
	}

	@Benchmark
	public int jdkGetHit(ReadState s) {
		return s.jdk.get(s.nextKey());
	}

	@Benchmark
	public int fastutilGetHit(ReadState s) {
		return s.fastutil.get(s.nextKey());
	}

	@Benchmark
	public int unifiedGetHit(ReadState s) {
		return s.unified.get(s.nextKey());
	}

	@Benchmark
	public int jumpGetMiss(ReadState s) {
		Integer v = s.jump.get(s.nextMiss());
		return v == null ? -1 : v;
	}

	@Benchmark
	public int jdkGetMiss(ReadState s) {
		Integer v = s.jdk.get(s.nextMiss());
		return v == null ? -1 : v;
	}

	@Benchmark
	public int fastutilGetMiss(ReadState s) {
		Integer v = s.fastutil.get(s.nextMiss());
		return v == null ? -1 : v;
	}

	// ------- iterate -------
	@Benchmark
	public long jumpIterate(ReadState s) {
		long sum = 0;
		for (var e : s.jump.entrySet()) sum += e.getValue();
		return sum;
	}

	@Benchmark
	public long jumpCursor(ReadState s) {
		long sum = 0;
		try (var c = s.jump.cursor()) {
			while (c.advance()) sum += c.value();
		}
		return sum;
	}

	@Benchmark
	public long jdkIterate(ReadState s) {
		long sum = 0;
		for (var e : s.jdk.entrySet()) sum += e.getValue();
		return sum;
	}

	// ------- mutating: put miss -------
	@Benchmark
	public int jumpPutMiss(MutateState s) {
		int k = s.missingKey(s.putValue);
		Integer prev = s.jump.put(k, s.nextValue());
		return prev == null ? -1 : prev;
	}

	@Benchmark
	public int jdkPutMiss(MutateState s) {
		int k = s.missingKey(s.putValue);
		Integer prev = s.jdk.put(k, s.nextValue());
		return prev == null ? -1 : prev;
	}

	@Benchmark
	public int fastutilPutMiss(MutateState s) {
		int k = s.missingKey(s.putValue);
		Integer prev = s.fastutil.put((Integer) k, (Integer) s.nextValue());
		return prev == null ? -1 : prev;
	}

	// ------- remove hit -------
	@Benchmark
	public int jumpRemoveHit(RemoveState s) {
		Integer prev = s.jump.remove(s.hitKey());
		return prev == null ? -1 : prev;
	}

	@Benchmark
	public int jdkRemoveHit(RemoveState s) {
		Integer prev = s.jdk.remove(s.hitKey());
		return prev == null ? -1 : prev;
	}
}
