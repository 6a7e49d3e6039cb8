package starvation;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/* Immutable finite set of critical pairs; join is union. */
public final class CriticalPairs implements Iterable<CriticalPair> {
	private static final CriticalPairs EMPTY = new CriticalPairs(Collections.emptySet());

	private final Set<CriticalPair> pairs;

	private CriticalPairs(Set<CriticalPair> pairs) {
		this.pairs = pairs;
	}

	public static CriticalPairs empty() {
		return EMPTY;
	}

	public static CriticalPairs of(CriticalPair... ps) {
		CriticalPairs acc = EMPTY;
		for (CriticalPair p : ps) acc = acc.add(p);
		return acc;
	}

	public CriticalPairs add(CriticalPair p) {
		if (pairs.contains(p)) return this;
		Set<CriticalPair> nu = new LinkedHashSet<>(pairs);
		nu.add(p);
		return new CriticalPairs(Collections.unmodifiableSet(nu));
	}

	public CriticalPairs join(CriticalPairs other) {
		if (other.pairs.isEmpty() || pairs.containsAll(other.pairs)) return this;
		if (pairs.isEmpty() || other.pairs.containsAll(pairs)) return other;
		Set<CriticalPair> nu = new LinkedHashSet<>(pairs);
		nu.addAll(other.pairs);
		return new CriticalPairs(Collections.unmodifiableSet(nu));
	}

	public CriticalPairs filter(Predicate<CriticalPair> keep) {
		Set<CriticalPair> nu = new LinkedHashSet<>();
		for (CriticalPair p : pairs) if (keep.test(p)) nu.add(p);
		return (nu.size() == pairs.size()) ? this : new CriticalPairs(Collections.unmodifiableSet(nu));
	}

	public boolean contains(CriticalPair p) { return pairs.contains(p); }
	public boolean isEmpty() { return pairs.isEmpty(); }
	public int size() { return pairs.size(); }
	public Stream<CriticalPair> stream() { return pairs.stream(); }

	@Override
	public Iterator<CriticalPair> iterator() {
		return pairs.iterator();
	}

	@Override
	public boolean equals(Object o) {
		return this == o || (o instanceof CriticalPairs c && pairs.equals(c.pairs));
	}

	@Override
	public int hashCode() {
		return pairs.hashCode();
	}

	@Override
	public String toString() {
		return pairs.toString();
	}
}
