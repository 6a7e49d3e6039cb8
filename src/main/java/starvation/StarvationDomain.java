package starvation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Abstract state of one procedure at a program point: the critical pairs seen so far,
 * the locks currently held, the lock each live guard is bound to, and the UI-thread fact.
 * Every operation returns a new state.
 */
public final class StarvationDomain implements LatticeElement {
	private static final StarvationDomain BOTTOM =
		new StarvationDomain(CriticalPairs.empty(), Acquisitions.empty(), Collections.emptyMap(), UIThreadDomain.bottom());

	private final CriticalPairs criticalPairs;
	private final Acquisitions acquisitions;
	private final Map<Exp, Lock> guards;
	private final UIThreadDomain ui;

	private StarvationDomain(CriticalPairs criticalPairs, Acquisitions acquisitions, Map<Exp, Lock> guards, UIThreadDomain ui) {
		this.criticalPairs = criticalPairs;
		this.acquisitions = acquisitions;
		this.guards = guards;
		this.ui = ui;
	}

	public static StarvationDomain bottom() {
		return BOTTOM;
	}

	public CriticalPairs getCriticalPairs() { return criticalPairs; }
	public Acquisitions getAcquisitions() { return acquisitions; }
	public Map<Exp, Lock> getGuards() { return Collections.unmodifiableMap(guards); }
	public UIThreadDomain getUi() { return ui; }

	private StarvationDomain with(CriticalPairs cp, Acquisitions acq, Map<Exp, Lock> g, UIThreadDomain u) {
		if (cp == criticalPairs && acq == acquisitions && g == guards && u == ui) return this;
		return new StarvationDomain(cp, acq, g, u);
	}

	/* -------- Locks -------- */

	/*
	 * Each lock records a LockAcquire pair in the context of the locks held before it.
	 * Re-acquiring a held lock yields a pair whose context contains its own lock, which is
	 * what self-deadlock reporting looks for.
	 */
	public StarvationDomain acquire(Procname procname, Location loc, List<Lock> locks) {
		CriticalPairs cp = criticalPairs;
		Acquisitions acq = acquisitions;
		for (Lock lock : locks) {
			cp = cp.add(CriticalPair.make(Event.makeAcquire(lock), acq, loc));
			acq = acq.add(new Acquisitions.Acquisition(lock, loc, procname));
		}
		return with(cp, acq, guards, ui);
	}

	// releasing a lock that is not held is not this analysis' concern
	public StarvationDomain release(List<Lock> locks) {
		Acquisitions acq = acquisitions;
		for (Lock lock : locks) acq = acq.remove(lock);
		return with(criticalPairs, acq, guards, ui);
	}

	/* -------- Guards -------- */

	public StarvationDomain addGuard(Procname procname, Location loc, Exp guard, Lock lock, boolean acquireNow) {
		Map<Exp, Lock> g = new LinkedHashMap<>(guards);
		g.put(guard, lock);
		StarvationDomain bound = with(criticalPairs, acquisitions, Collections.unmodifiableMap(g), ui);
		return acquireNow ? bound.acquire(procname, loc, List.of(lock)) : bound;
	}

	public StarvationDomain lockGuard(Procname procname, Location loc, Exp guard) {
		Lock lock = guards.get(guard);
		return (lock == null) ? this : acquire(procname, loc, List.of(lock));
	}

	public StarvationDomain unlockGuard(Exp guard) {
		Lock lock = guards.get(guard);
		return (lock == null) ? this : release(List.of(lock));
	}

	// destruction alone does not release; only explicit unlocks do
	public StarvationDomain removeGuard(Exp guard) {
		if (!guards.containsKey(guard)) return this;
		Map<Exp, Lock> g = new LinkedHashMap<>(guards);
		g.remove(guard);
		return with(criticalPairs, acquisitions, Collections.unmodifiableMap(g), ui);
	}

	/* -------- Blocking and strict-mode calls -------- */

	public StarvationDomain blockingCall(Procname callee, Severity severity, Location loc) {
		CriticalPair p = CriticalPair.make(Event.makeBlockingCall(callee, severity), acquisitions, loc);
		return with(criticalPairs.add(p), acquisitions, guards, ui);
	}

	public StarvationDomain strictModeCall(Procname callee, Location loc) {
		CriticalPair p = CriticalPair.make(Event.makeStrictModeCall(callee), acquisitions, loc);
		return with(criticalPairs.add(p), acquisitions, guards, ui);
	}

	public StarvationDomain filterBlockingCalls() {
		return with(criticalPairs.filter(p -> !p.getEvent().isBlockingCall()), acquisitions, guards, ui);
	}

	/* -------- UI thread -------- */

	public StarvationDomain setOnUiThread(Location loc, UIThreadExplanation explanation) {
		return with(criticalPairs, acquisitions, guards, ui.setOnUiThread(loc, explanation));
	}

	/* -------- Calls -------- */

	/*
	 * Every callee pair is re-homed under the locks held here and the call site is pushed
	 * onto its trace. A callee known to run on the UI thread puts the caller there too,
	 * unless the caller already has its own explanation.
	 */
	public StarvationDomain integrateSummary(Summary calleeSummary, Procname callee, Location loc) {
		CriticalPair.CallSite site = new CriticalPair.CallSite(callee, loc);
		CriticalPairs cp = criticalPairs;
		for (CriticalPair p : calleeSummary.getCriticalPairs()) {
			cp = cp.add(p.withCallSite(acquisitions, site));
		}
		UIThreadDomain u = ui.isBottom() ? calleeSummary.getUi() : ui;
		return with(cp, acquisitions, guards, u);
	}

	public Summary toSummary() {
		return new Summary(criticalPairs, ui);
	}

	/* -------- Lattice ops -------- */

	@Override
	public LatticeElement join_op(LatticeElement r) {
		StarvationDomain o = (StarvationDomain) r;
		if (this == o) return this;
		Map<Exp, Lock> g = guards;
		if (!o.guards.isEmpty()) {
			g = new LinkedHashMap<>(guards);
			for (Map.Entry<Exp, Lock> e : o.guards.entrySet()) {
				g.merge(e.getKey(), e.getValue(), (a, b) -> (a.compareTo(b) <= 0) ? a : b);
			}
			g = g.equals(guards) ? guards : Collections.unmodifiableMap(g);
		}
		return with(criticalPairs.join(o.criticalPairs), acquisitions.append(o.acquisitions), g, ui.join(o.ui));
	}

	@Override
	public boolean equals(LatticeElement r) {
		if (this == r) return true;
		if (!(r instanceof StarvationDomain o)) return false;
		return criticalPairs.equals(o.criticalPairs) && acquisitions.equals(o.acquisitions)
			&& guards.equals(o.guards) && ui.equals(o.ui);
	}

	@Override
	public boolean equals(Object o) {
		return (o instanceof LatticeElement l) && equals(l);
	}

	@Override
	public int hashCode() {
		return Objects.hash(criticalPairs, acquisitions, guards, ui);
	}

	@Override
	public boolean isBottom() {
		return criticalPairs.isEmpty() && acquisitions.isEmpty() && guards.isEmpty() && ui.isBottom();
	}

	@Override
	public String toString() {
		return "{pairs=" + criticalPairs + ", held=" + acquisitions + ", guards=" + guards + ", ui=" + ui + "}";
	}
}
