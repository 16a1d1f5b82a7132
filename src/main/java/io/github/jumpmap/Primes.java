package io.github.jumpmap;

/**
 * Prime testing and searching for table sizes.
 *
 * <p>Values below {@link #LOOKUP_LIMIT} are answered from a precomputed sieve; larger values use a
 * deterministic Miller-Rabin test whose witness set {2, 3, 5, 7} is exact for every {@code int}.
 * Searches never fail: when nothing suitable is found they saturate at {@link #MAX_SIZE}.
 */
final class Primes {

	private Primes() {}

	/** Smallest table size handed out. */
	static final int MIN_SIZE = 7;

	/** Largest prime that still fits in a Java array; the ceiling every search saturates at. */
	static final int MAX_SIZE = 2147483629;

	/** Prime gaps below 2^31 never exceed 292, so this radius always brackets a prime. */
	static final int MAX_SEARCH_RADIUS = 512;

	static final int LOOKUP_LIMIT = 1 << 16;

	private static final long[] SIEVE = sieve(LOOKUP_LIMIT);

	private static final long[] WITNESSES = { 2, 3, 5, 7 };

	private static long[] sieve(int limit) {
		// bit set => composite
		long[] bits = new long[(limit + 63) >>> 6];
		bits[0] |= 0b11L; // 0 and 1
		for (int i = 2; (long) i * i < limit; i++) {
			if ((bits[i >>> 6] & (1L << i)) != 0) continue;
			for (int j = i * i; j < limit; j += i) {
				bits[j >>> 6] |= 1L << j;
			}
		}
		return bits;
	}

	static boolean isPrime(int n) {
		if (n < LOOKUP_LIMIT) {
			return n >= 0 && (SIEVE[n >>> 6] & (1L << n)) == 0;
		}
		if ((n & 1) == 0) return false;
		return millerRabin(n);
	}

	/**
	 * Trial division, no table. Slow; kept as an independent oracle for the lookup path.
	 */
	static boolean isPrimeNoLookup(int n) {
		if (n < 2) return false;
		if (n < 4) return true;
		if ((n & 1) == 0 || n % 3 == 0) return false;
		for (long d = 5; d * d <= n; d += 6) {
			if (n % d == 0 || n % (d + 2) == 0) return false;
		}
		return true;
	}

	private static boolean millerRabin(int n) {
		long d = n - 1;
		int r = Long.numberOfTrailingZeros(d);
		d >>>= r;
		for (long a : WITNESSES) {
			if (a % n == 0) continue;
			long x = powMod(a, d, n);
			if (x == 1 || x == n - 1) continue;
			boolean composite = true;
			for (int i = 1; i < r; i++) {
				x = (x * x) % n;
				if (x == n - 1) {
					composite = false;
					break;
				}
			}
			if (composite) return false;
		}
		return true;
	}

	// operands stay below 2^31, so every product fits in a long
	private static long powMod(long base, long exp, long mod) {
		long result = 1;
		base %= mod;
		while (exp > 0) {
			if ((exp & 1) != 0) result = (result * base) % mod;
			base = (base * base) % mod;
			exp >>>= 1;
		}
		return result;
	}

	/**
	 * Smallest prime {@code >= n}, saturating at {@link #MAX_SIZE}.
	 */
	static int next(int n) {
		if (n <= 2) return 2;
		if (n >= MAX_SIZE) return MAX_SIZE;
		for (int p = n | 1; p < MAX_SIZE; p += 2) {
			if (isPrime(p)) return p;
		}
		return MAX_SIZE;
	}

	/**
	 * Smallest prime {@code p >= max(minSize, MIN_SIZE)} usable as a table size under the given
	 * double-hashing multiplier, i.e. {@code p} is not a divisor of {@code hashMultiplier}.
	 */
	static int nextHashableSize(int minSize, int hashMultiplier) {
		int n = Math.max(minSize, MIN_SIZE);
		if (n >= MAX_SIZE) return MAX_SIZE;
		for (int p = n | 1; p < MAX_SIZE; p += 2) {
			if (isPrime(p) && isHashable(p, hashMultiplier)) return p;
		}
		return MAX_SIZE;
	}

	static boolean isHashable(int size, int hashMultiplier) {
		return size != hashMultiplier && hashMultiplier % size != 0;
	}

	/**
	 * Closest prime to {@code n}; ties go to the larger prime.
	 */
	static int nearestTo(int n) {
		if (n <= 2) return 2;
		for (int d = 0; d <= MAX_SEARCH_RADIUS; d++) {
			int hi = n + d;
			if (hi > 0 && hi <= MAX_SIZE && isPrime(hi)) return hi;
			int lo = n - d;
			if (lo >= 2 && lo <= MAX_SIZE && isPrime(lo)) return lo;
		}
		return MAX_SIZE;
	}
}
