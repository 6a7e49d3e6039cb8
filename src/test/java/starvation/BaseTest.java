package starvation;

import static org.junit.Assert.assertEquals;
import static starvation.ProgramBuilder.loc;
import static starvation.ProgramBuilder.proc;

import java.util.List;

import org.junit.Test;

public class BaseTest {

	@Test
	public void issuesRenderWithIndentedTraces() {
		IssueLog log = new IssueLog();
		log.log(proc("m"), IssueSink.Level.ERROR, loc(4),
			List.of(new TraceElem(0, loc(4), "[Trace 1] `Sample.m()`"), new TraceElem(1, loc(9), "locks `this.f1`")),
			IssueType.DEADLOCK, "Potential deadlock.");

		List<String> lines = Base.formatOutputData(log);
		assertEquals(3, lines.size());
		assertEquals(loc(4) + ": ERROR: DEADLOCK: Sample.m(): Potential deadlock.", lines.get(0));
		assertEquals("    " + loc(4) + ": [Trace 1] `Sample.m()`", lines.get(1));
		assertEquals("      " + loc(9) + ": locks `this.f1`", lines.get(2));
	}

	@Test
	public void issuesAreSortedByLocation() {
		IssueLog log = new IssueLog();
		log.log(proc("b"), IssueSink.Level.ERROR, loc(20), List.of(), IssueType.STARVATION, "later");
		log.log(proc("a"), IssueSink.Level.ERROR, loc(3), List.of(), IssueType.STARVATION, "earlier");
		List<String> lines = Base.formatOutputData(log, "> ");
		assertEquals("> " + loc(3) + ": ERROR: STARVATION: Sample.a(): earlier", lines.get(0));
	}
}
