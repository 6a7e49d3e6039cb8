package starvation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static starvation.ProgramBuilder.loc;
import static starvation.ProgramBuilder.lockOf;
import static starvation.ProgramBuilder.proc;

import java.util.List;

import org.junit.Test;

public class DomainJoinTest {

	private static final Procname P = proc("p");

	private static CriticalPair acquire(String lock, int line, String... held) {
		Acquisitions acq = Acquisitions.empty();
		for (String h : held) acq = acq.add(new Acquisitions.Acquisition(lockOf(h), loc(line - 1), P));
		return CriticalPair.make(Event.makeAcquire(lockOf(lock)), acq, loc(line));
	}

	private final CriticalPairs a = CriticalPairs.of(acquire("f1", 10));
	private final CriticalPairs b = CriticalPairs.of(acquire("f2", 11, "f1"));
	private final CriticalPairs c = CriticalPairs.of(acquire("f1", 12), acquire("f3", 13, "f2"));

	@Test
	public void criticalPairsJoinIsUnion() {
		CriticalPairs ab = a.join(b);
		assertEquals(2, ab.size());
		assertTrue(ab.contains(acquire("f1", 10)));
		assertTrue(ab.contains(acquire("f2", 11, "f1")));
	}

	@Test
	public void criticalPairsJoinLaws() {
		assertEquals(a.join(b), b.join(a));
		assertEquals(a.join(b).join(c), a.join(b.join(c)));
		assertEquals(a, a.join(a));
		assertEquals(a, CriticalPairs.empty().join(a));
		assertEquals(a, a.join(CriticalPairs.empty()));
	}

	@Test
	public void criticalPairsJoinIsMonotone() {
		CriticalPairs ab = a.join(b);
		for (CriticalPair p : a) assertTrue(ab.contains(p));
		for (CriticalPair p : b) assertTrue(ab.contains(p));
	}

	private static final UIThreadDomain ANNOTATED =
		UIThreadDomain.of(UIThreadExplanation.annotated(P, "is annotated `UiThread`"), loc(5));
	private static final UIThreadDomain MODELED = UIThreadDomain.of(UIThreadExplanation.isModeled(P), loc(3));
	private static final UIThreadDomain CALLS =
		UIThreadDomain.of(UIThreadExplanation.callsModeled(P, ProgramBuilder.ASSERT_MAIN), loc(1));

	@Test
	public void uiJoinLaws() {
		UIThreadDomain bottom = UIThreadDomain.bottom();
		assertEquals(ANNOTATED, bottom.join(ANNOTATED));
		assertEquals(ANNOTATED, ANNOTATED.join(bottom));
		assertEquals(MODELED.join(CALLS), CALLS.join(MODELED));
		assertEquals(ANNOTATED.join(MODELED).join(CALLS), ANNOTATED.join(MODELED.join(CALLS)));
		assertEquals(CALLS, CALLS.join(CALLS));
	}

	@Test
	public void uiJoinPrefersMostSpecificExplanation() {
		assertSame(ANNOTATED, CALLS.join(ANNOTATED));
		assertSame(MODELED, MODELED.join(CALLS));
	}

	@Test
	public void uiFirstWriterWins() {
		UIThreadDomain u = UIThreadDomain.bottom().setOnUiThread(loc(7), UIThreadExplanation.isModeled(P));
		UIThreadDomain again = u.setOnUiThread(loc(1), UIThreadExplanation.annotated(P, "is annotated `UiThread`"));
		assertSame(u, again);
		assertEquals(UIThreadExplanation.Kind.IS_MODELED, again.getExplanation().getKind());
		assertFalse(again.isBottom());
	}

	@Test
	public void stateJoinMergesHeldLocksAndPairs() {
		StarvationDomain s1 = StarvationDomain.bottom().acquire(P, loc(1), List.of(lockOf("f1")));
		StarvationDomain s2 = StarvationDomain.bottom().acquire(P, loc(2), List.of(lockOf("f2")));
		StarvationDomain j = (StarvationDomain) s1.join_op(s2);
		assertTrue(j.getAcquisitions().lockIsHeld(lockOf("f1")));
		assertTrue(j.getAcquisitions().lockIsHeld(lockOf("f2")));
		assertEquals(2, j.getCriticalPairs().size());
		assertTrue(j.equals((LatticeElement) s2.join_op(s1)));
		assertTrue(s1.join_op(s1).equals(s1));
		assertTrue(StarvationDomain.bottom().join_op(s1).equals(s1));
	}
}
