package starvation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static starvation.ProgramBuilder.field;
import static starvation.ProgramBuilder.loc;
import static starvation.ProgramBuilder.lockOf;
import static starvation.ProgramBuilder.proc;

import java.util.List;

import org.junit.Test;

public class StarvationDomainTest {

	private static final Procname P = proc("p");
	private static final Procname Q = proc("q");

	private static long acquiresOf(StarvationDomain s, Lock lock) {
		return s.getCriticalPairs().stream().filter(p -> lock.equals(p.getAcquiredLock())).count();
	}

	@Test
	public void acquireRecordsPairWithPriorContext() {
		StarvationDomain s = StarvationDomain.bottom()
			.acquire(P, loc(1), List.of(lockOf("f1")))
			.acquire(P, loc(2), List.of(lockOf("f2")));
		CriticalPair second = s.getCriticalPairs().stream()
			.filter(p -> lockOf("f2").equals(p.getAcquiredLock())).findFirst().orElseThrow();
		assertEquals(List.of(lockOf("f1")), second.getAcquisitions().locks());
		assertEquals(loc(2), second.getLoc());
		assertEquals(List.of(lockOf("f1"), lockOf("f2")), s.getAcquisitions().locks());
	}

	@Test
	public void reacquireRecordsSelfPair() {
		StarvationDomain s = StarvationDomain.bottom()
			.acquire(P, loc(1), List.of(lockOf("f1")))
			.acquire(P, loc(2), List.of(lockOf("f1")));
		assertEquals(2, acquiresOf(s, lockOf("f1")));
		long self = s.getCriticalPairs().stream()
			.filter(p -> p.getAcquisitions().lockIsHeld(lockOf("f1"))).count();
		assertEquals(1, self);
		assertEquals(1, s.getAcquisitions().size());
	}

	@Test
	public void releaseOfUnheldLockIsHarmless() {
		StarvationDomain s = StarvationDomain.bottom().acquire(P, loc(1), List.of(lockOf("f1")));
		assertSame(s, s.release(List.of(lockOf("f2"))));
		assertTrue(s.release(List.of(lockOf("f1"))).getAcquisitions().isEmpty());
	}

	@Test
	public void guardDestroyDoesNotRelease() {
		Exp guard = Exp.constant("g");
		StarvationDomain s = StarvationDomain.bottom().addGuard(P, loc(1), guard, lockOf("f1"), true);
		assertTrue(s.getAcquisitions().lockIsHeld(lockOf("f1")));

		StarvationDomain destroyed = s.removeGuard(guard);
		assertTrue(destroyed.getAcquisitions().lockIsHeld(lockOf("f1")));
		assertNull(destroyed.getGuards().get(guard));
	}

	@Test
	public void guardLockAndUnlock() {
		Exp guard = Exp.constant("g");
		StarvationDomain s = StarvationDomain.bottom().addGuard(P, loc(1), guard, lockOf("f1"), false);
		assertFalse(s.getAcquisitions().lockIsHeld(lockOf("f1")));
		s = s.lockGuard(P, loc(2), guard);
		assertTrue(s.getAcquisitions().lockIsHeld(lockOf("f1")));
		s = s.unlockGuard(guard);
		assertFalse(s.getAcquisitions().lockIsHeld(lockOf("f1")));
		// unknown guards are ignored
		assertSame(s, s.lockGuard(P, loc(3), Exp.constant("other")));
	}

	@Test
	public void integrateSummaryRehomesPairs() {
		StarvationDomain callee = StarvationDomain.bottom()
			.acquire(Q, loc(20), List.of(lockOf("f2")))
			.blockingCall(ProgramBuilder.SLEEP, Severity.HIGH, loc(21));
		StarvationDomain caller = StarvationDomain.bottom()
			.acquire(P, loc(10), List.of(lockOf("f1")))
			.integrateSummary(callee.toSummary(), Q, loc(11));

		CriticalPair rehomed = caller.getCriticalPairs().stream()
			.filter(p -> lockOf("f2").equals(p.getAcquiredLock())).findFirst().orElseThrow();
		assertEquals(loc(11), rehomed.getLoc());
		assertEquals(1, rehomed.getTrace().size());
		assertEquals(Q, rehomed.getTrace().get(0).getCallee());
		assertTrue(rehomed.getAcquisitions().lockIsHeld(lockOf("f1")));
		// the callee's own summary is untouched
		assertTrue(callee.getCriticalPairs().stream().allMatch(p -> p.getTrace().isEmpty()));
		assertEquals(3, caller.getCriticalPairs().size());
	}

	@Test
	public void integrateSummaryAdoptsCalleeUiOnlyWhenUnknown() {
		UIThreadExplanation calls = UIThreadExplanation.callsModeled(Q, ProgramBuilder.ASSERT_MAIN);
		Summary callee = StarvationDomain.bottom().setOnUiThread(loc(20), calls).toSummary();

		StarvationDomain fresh = StarvationDomain.bottom().integrateSummary(callee, Q, loc(10));
		assertEquals(calls, fresh.getUi().getExplanation());

		UIThreadExplanation own = UIThreadExplanation.annotated(P, "is annotated `UiThread`");
		StarvationDomain annotated = StarvationDomain.bottom().setOnUiThread(loc(1), own)
			.integrateSummary(callee, Q, loc(10));
		assertEquals(own, annotated.getUi().getExplanation());
	}

	@Test
	public void filterBlockingCallsKeepsLockPairs() {
		StarvationDomain s = StarvationDomain.bottom()
			.acquire(P, loc(1), List.of(lockOf("f1")))
			.blockingCall(ProgramBuilder.SLEEP, Severity.HIGH, loc(2))
			.strictModeCall(ProgramBuilder.FILE_EXISTS, loc(3))
			.filterBlockingCalls();
		assertEquals(1, s.getCriticalPairs().size());
		assertEquals(lockOf("f1"), s.getCriticalPairs().iterator().next().getAcquiredLock());
	}

	@Test
	public void mayDeadlockNeedsInvertedOrderAndNoGate() {
		CriticalPair ab = StarvationDomain.bottom()
			.acquire(P, loc(1), List.of(lockOf("a"), lockOf("b"))).getCriticalPairs().stream()
			.filter(p -> lockOf("b").equals(p.getAcquiredLock())).findFirst().orElseThrow();
		CriticalPair ba = StarvationDomain.bottom()
			.acquire(Q, loc(5), List.of(lockOf("b"), lockOf("a"))).getCriticalPairs().stream()
			.filter(p -> lockOf("a").equals(p.getAcquiredLock())).findFirst().orElseThrow();
		assertTrue(ab.mayDeadlock(ba));
		assertTrue(ba.mayDeadlock(ab));

		// both orderings taken under a common gate lock
		CriticalPair gatedAb = StarvationDomain.bottom()
			.acquire(P, loc(1), List.of(lockOf("gate"), lockOf("a"), lockOf("b"))).getCriticalPairs().stream()
			.filter(p -> lockOf("b").equals(p.getAcquiredLock())).findFirst().orElseThrow();
		CriticalPair gatedBa = StarvationDomain.bottom()
			.acquire(Q, loc(5), List.of(lockOf("gate"), lockOf("b"), lockOf("a"))).getCriticalPairs().stream()
			.filter(p -> lockOf("a").equals(p.getAcquiredLock())).findFirst().orElseThrow();
		assertFalse(gatedAb.mayDeadlock(gatedBa));
	}

	@Test
	public void fieldLocksAreRootedAtThis() {
		assertEquals("this.f1", lockOf("f1").toString());
		assertEquals("`this.f1`", Lock.of(field("f1")).describe());
	}
}
