package io.github.jumpmap;

import java.util.Objects;

/**
 * Pluggable hashing and equality for keys or values stored in a {@link JumpMap}.
 *
 * <p>Implementations must be consistent: {@code equivalent(a, b)} implies {@code hash(a) == hash(b)}.
 */
public interface Equivalence<T> {

	int hash(T t);

	boolean equivalent(T a, T b);

	/**
	 * {@link Object#equals(Object)} / {@link Object#hashCode()} with a smeared hash.
	 */
	@SuppressWarnings("unchecked")
	static <T> Equivalence<T> natural() {
		return (Equivalence<T>) Natural.INSTANCE;
	}

	/**
	 * Reference equality with {@link System#identityHashCode(Object)}.
	 */
	@SuppressWarnings("unchecked")
	static <T> Equivalence<T> identity() {
		return (Equivalence<T>) Identity.INSTANCE;
	}

	final class Natural implements Equivalence<Object> {
		static final Natural INSTANCE = new Natural();

		private Natural() {}

		@Override
		public int hash(Object o) {
			return Hashing.smearedHash(o);
		}

		@Override
		public boolean equivalent(Object a, Object b) {
			return Objects.equals(a, b);
		}

		@Override
		public String toString() {
			return "Equivalence.natural()";
		}
	}

	final class Identity implements Equivalence<Object> {
		static final Identity INSTANCE = new Identity();

		private Identity() {}

		@Override
		public int hash(Object o) {
			return Hashing.smear(System.identityHashCode(o));
		}

		@Override
		public boolean equivalent(Object a, Object b) {
			return a == b;
		}

		@Override
		public String toString() {
			return "Equivalence.identity()";
		}
	}
}
