package starvation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Locks believed held at a program point, in acquisition order, each lock at most once.
 * Each entry remembers where and by which procedure the lock was taken, for trace rendering.
 * Equality only looks at the set of locks: two paths that took the same locks in a different
 * order hold the same locks.
 */
public final class Acquisitions implements Iterable<Acquisitions.Acquisition> {

	public static final class Acquisition {
		private final Lock lock;
		private final Location loc;
		private final Procname procname;

		public Acquisition(Lock lock, Location loc, Procname procname) {
			this.lock = lock;
			this.loc = loc;
			this.procname = procname;
		}

		public Lock getLock() { return lock; }
		public Location getLoc() { return loc; }
		public Procname getProcname() { return procname; }

		@Override
		public boolean equals(Object o) {
			return this == o || (o instanceof Acquisition a && lock.equals(a.lock));
		}

		@Override
		public int hashCode() { return lock.hashCode(); }

		@Override
		public String toString() { return lock.toString(); }
	}

	private static final Acquisitions EMPTY = new Acquisitions(Collections.emptyList());

	private final List<Acquisition> elements;

	private Acquisitions(List<Acquisition> elements) {
		this.elements = elements;
	}

	public static Acquisitions empty() {
		return EMPTY;
	}

	public boolean isEmpty() { return elements.isEmpty(); }
	public int size() { return elements.size(); }

	public boolean lockIsHeld(Lock lock) {
		for (Acquisition a : elements) if (a.lock.equals(lock)) return true;
		return false;
	}

	public Acquisitions add(Acquisition a) {
		if (lockIsHeld(a.lock)) return this;
		List<Acquisition> nu = new ArrayList<>(elements);
		nu.add(a);
		return new Acquisitions(Collections.unmodifiableList(nu));
	}

	public Acquisitions remove(Lock lock) {
		if (!lockIsHeld(lock)) return this;
		List<Acquisition> nu = new ArrayList<>(elements.size());
		for (Acquisition a : elements) if (!a.lock.equals(lock)) nu.add(a);
		return new Acquisitions(Collections.unmodifiableList(nu));
	}

	/* this ++ other, keeping the first acquisition of every lock */
	public Acquisitions append(Acquisitions other) {
		if (other.isEmpty()) return this;
		if (isEmpty()) return other;
		Acquisitions acc = this;
		for (Acquisition a : other.elements) acc = acc.add(a);
		return acc;
	}

	public boolean intersects(Acquisitions other) {
		for (Acquisition a : elements) if (other.lockIsHeld(a.lock)) return true;
		return false;
	}

	public List<Lock> locks() {
		List<Lock> out = new ArrayList<>(elements.size());
		for (Acquisition a : elements) out.add(a.lock);
		return out;
	}

	/* Earliest acquisition made by the given procedure itself, if any. */
	public Optional<Location> earliestLocOf(Procname procname) {
		Location best = null;
		for (Acquisition a : elements) {
			if (!a.procname.equals(procname)) continue;
			if (best == null || a.loc.compareTo(best) < 0) best = a.loc;
		}
		return Optional.ofNullable(best);
	}

	@Override
	public Iterator<Acquisition> iterator() {
		return elements.iterator();
	}

	private Set<Lock> lockSet() {
		return new HashSet<>(locks());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Acquisitions other)) return false;
		return elements.size() == other.elements.size() && lockSet().equals(other.lockSet());
	}

	@Override
	public int hashCode() {
		return lockSet().hashCode();
	}

	@Override
	public String toString() {
		return locks().toString();
	}
}
