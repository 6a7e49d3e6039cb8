package starvation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A hazardous event together with the locks held just before it, where it happened, and
 * the chain of call sites leading to it from the procedure whose summary holds the pair.
 * Pairs are values: following a call edge derives a new pair.
 */
public final class CriticalPair {

	public static final class CallSite {
		private final Procname callee;
		private final Location loc;

		public CallSite(Procname callee, Location loc) {
			this.callee = callee;
			this.loc = loc;
		}

		public Procname getCallee() { return callee; }
		public Location getLoc() { return loc; }

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (!(o instanceof CallSite c)) return false;
			return callee.equals(c.callee) && loc.equals(c.loc);
		}

		@Override
		public int hashCode() { return Objects.hash(callee, loc); }

		@Override
		public String toString() { return callee + "@" + loc; }
	}

	private final Event event;
	private final Acquisitions acquisitions;
	// location of the event itself, in the innermost procedure
	private final Location loc;
	private final List<CallSite> trace;

	private CriticalPair(Event event, Acquisitions acquisitions, Location loc, List<CallSite> trace) {
		this.event = event;
		this.acquisitions = acquisitions;
		this.loc = loc;
		this.trace = trace;
	}

	public static CriticalPair make(Event event, Acquisitions acquisitions, Location loc) {
		return new CriticalPair(event, acquisitions, loc, Collections.emptyList());
	}

	public Event getEvent() { return event; }
	public Acquisitions getAcquisitions() { return acquisitions; }
	public List<CallSite> getTrace() { return Collections.unmodifiableList(trace); }

	/* Re-home a callee pair into a caller that holds callerAcquisitions at the call site. */
	public CriticalPair withCallSite(Acquisitions callerAcquisitions, CallSite site) {
		List<CallSite> nu = new ArrayList<>(trace.size() + 1);
		nu.add(site);
		nu.addAll(trace);
		return new CriticalPair(event, callerAcquisitions.append(acquisitions), loc, Collections.unmodifiableList(nu));
	}

	/* Location in the summarized procedure: the first call site, or the event when local. */
	public Location getLoc() {
		return trace.isEmpty() ? loc : trace.get(0).getLoc();
	}

	public Location getEarliestLockOrCallLoc(Procname procname) {
		Location initial = getLoc();
		return acquisitions.earliestLocOf(procname)
			.filter(l -> l.compareTo(initial) < 0)
			.orElse(initial);
	}

	public Lock getAcquiredLock() {
		return (event instanceof Event.LockAcquire a) ? a.getLock() : null;
	}

	/*
	 * Two acquisitions may deadlock when each acquires its lock while holding the other's,
	 * the locks differ, and no common lock serializes the two orderings.
	 */
	public boolean mayDeadlock(CriticalPair other) {
		Lock lock1 = getAcquiredLock();
		Lock lock2 = other.getAcquiredLock();
		if (lock1 == null || lock2 == null) return false;
		return !lock1.equals(lock2)
			&& acquisitions.lockIsHeld(lock2)
			&& other.acquisitions.lockIsHeld(lock1)
			&& !acquisitions.intersects(other.acquisitions);
	}

	public List<TraceElem> makeTrace(String header, Procname top, boolean includeAcquisitions) {
		List<TraceElem> out = new ArrayList<>();
		out.add(new TraceElem(0, getLoc(), header + "`" + top + "`"));
		if (includeAcquisitions) {
			for (Acquisitions.Acquisition a : acquisitions) {
				boolean local = a.getProcname().equals(top);
				String what = "locks " + a.getLock().describe() + (local ? "" : " in `" + a.getProcname() + "`");
				out.add(new TraceElem(local ? 0 : 1, a.getLoc(), what));
			}
		}
		int depth = 0;
		for (CallSite site : trace) {
			out.add(new TraceElem(depth, site.getLoc(), "calls `" + site.getCallee() + "`"));
			depth++;
		}
		out.add(new TraceElem(depth, loc, event.describe()));
		return out;
	}

	public List<TraceElem> makeTrace(String header, Procname top) {
		return makeTrace(header, top, true);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof CriticalPair p)) return false;
		return event.equals(p.event) && acquisitions.equals(p.acquisitions)
			&& loc.equals(p.loc) && trace.equals(p.trace);
	}

	@Override
	public int hashCode() {
		return Objects.hash(event, acquisitions, loc, trace);
	}

	@Override
	public String toString() {
		return "{" + event + ", held=" + acquisitions + ", loc=" + getLoc() + ", trace=" + trace + "}";
	}
}
