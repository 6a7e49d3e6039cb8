package starvation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static starvation.ProgramBuilder.THIS;
import static starvation.ProgramBuilder.field;
import static starvation.ProgramBuilder.loc;
import static starvation.ProgramBuilder.lockOf;
import static starvation.ProgramBuilder.proc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

public class KildallTest {

	private final ProgramBuilder.Models models = new ProgramBuilder.Models();
	private final InMemorySummaryStore summaries = new InMemorySummaryStore();

	/* while (...) { lock(f1); unlock(f1); } lock(f2); */
	private static ProcDesc loop() {
		InstrGraph g = new InstrGraph();
		Instr head = g.add(new Instr.Assume("cond", loc(1)));
		Instr lock = g.add(Instr.Call.direct(ProgramBuilder.LOCK, List.of(field("f1")), loc(2)));
		Instr unlock = g.add(Instr.Call.direct(ProgramBuilder.UNLOCK, List.of(field("f1")), loc(3)));
		Instr exit = g.add(Instr.Call.direct(ProgramBuilder.LOCK, List.of(field("f2")), loc(4)));
		g.addEdge(head, lock);
		g.addEdge(lock, unlock);
		g.addEdge(unlock, head);
		g.addEdge(head, exit);
		return new ProcDesc(proc("loop"), ProcDesc.Access.PUBLIC, false, false, loc(1), List.of(THIS), g);
	}

	private Optional<LatticeElement> run(ProcDesc pd, int maxSteps) {
		TransferFunctions tf = new TransferFunctions(pd, models, summaries);
		return new Kildall(maxSteps).computePost(pd.getCfg(), StarvationDomain.bottom(),
			(in, n) -> tf.execInstr((StarvationDomain) in, n));
	}

	@Test
	public void loopConverges() {
		StarvationDomain post = (StarvationDomain) run(loop(), 100).orElseThrow();
		assertTrue(post.getAcquisitions().lockIsHeld(lockOf("f2")));
		assertFalse(post.getAcquisitions().lockIsHeld(lockOf("f1")));
		assertTrue(post.getCriticalPairs().stream().anyMatch(p -> lockOf("f1").equals(p.getAcquiredLock())));
	}

	@Test
	public void visitBudgetExhausted() {
		// the loop head needs a second visit
		assertFalse(run(loop(), 1).isPresent());
		assertTrue(run(loop(), 2).isPresent());
	}

	@Test
	public void straightLineNeedsOneVisitPerNode() {
		List<Instr> body = new ArrayList<>();
		for (int i = 0; i < 200; i++) body.add(Instr.Call.direct(ProgramBuilder.LOCK, List.of(field("f" + i)), loc(i + 1)));
		ProcDesc pd = new ProcDesc(proc("straight"), ProcDesc.Access.PUBLIC, false, false, loc(1), List.of(THIS),
			InstrGraph.sequential(body));
		StarvationDomain post = (StarvationDomain) run(pd, 1).orElseThrow();
		assertEquals(200, post.getAcquisitions().size());
	}

	@Test
	public void emptyBodyKeepsInitialFact() {
		ProcDesc pd = new ProcDesc(proc("empty"), ProcDesc.Access.PUBLIC, false, false, loc(1), List.of(THIS),
			new InstrGraph());
		assertTrue(run(pd, 1).orElseThrow().isBottom());
	}
}
