package starvation.soot;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import soot.IntType;
import soot.Modifier;
import soot.SootMethod;
import starvation.Analysis;
import starvation.Config;
import starvation.IssueLog;
import starvation.IssueType;
import starvation.ProcDesc;
import starvation.Procname;

public class SootProgramTest {

	@Rule
	public final TemporaryFolder folder = new TemporaryFolder();

	private static IssueLog analyze(SootProgram program) {
		Config config = Config.defaults();
		return Analysis.doAnalysis(program, new JavaModels(program, config), new SootAnnotations(program), config);
	}

	@Test
	public void bundledSampleLoadsFromPackageRoot() {
		Analysis.setupSoot("target/classes");
		SootProgram program = SootProgram.load("test");

		assertFalse(program.getProcedures().isEmpty());
		assertFalse(program.getMethods("test.Test").isEmpty());
		assertTrue(program.getProcDesc(Procname.java("test.Test", "firstThenSecond")).isPresent());

		List<IssueLog.Issue> deadlocks = analyze(program).getIssues(IssueType.DEADLOCK);
		assertFalse(deadlocks.isEmpty());
		for (IssueLog.Issue i : deadlocks) assertEquals("test.Test", i.getProcname().getClassName());
	}

	@Test
	public void covariantBridgeDoesNotHideSourceMethod() throws Exception {
		SootProgram program = new SootFixture()
			.source("fx/bridge/Job.java",
				"package fx.bridge;",
				"import java.util.concurrent.Callable;",
				"public class Job implements Callable<Integer> {",
				"	private final Object a = new Object();",
				"	private final Object b = new Object();",
				"	public Integer call() {",
				"		synchronized (a) {",
				"			synchronized (b) {",
				"				return 1;",
				"			}",
				"		}",
				"	}",
				"	public void other() {",
				"		synchronized (b) {",
				"			synchronized (a) {",
				"				a.hashCode();",
				"			}",
				"		}",
				"	}",
				"}")
			.load(folder.getRoot().toPath(), "fx.bridge");

		ProcDesc call = program.getProcDesc(Procname.java("fx.bridge.Job", "call")).orElseThrow();
		assertFalse(call.isAutogen());
		assertEquals(1, Collections.frequency(program.getMethods("fx.bridge.Job"), call.getProcname()));
		assertTrue(program.isSubtype("fx.bridge.Job", "java.util.concurrent.Callable"));
		assertFalse(program.isSubtype("fx.bridge.Job", "java.lang.Runnable"));

		assertEquals(1, analyze(program).getIssues(IssueType.DEADLOCK).size());
	}

	@Test
	public void sourceMethodReplacesCompilerGeneratedOne() {
		SootMethod written = new SootMethod("call", Collections.emptyList(), IntType.v(), Modifier.PUBLIC);
		SootMethod bridge = new SootMethod("call", Collections.emptyList(), IntType.v(),
			Modifier.PUBLIC | Modifier.SYNTHETIC);
		assertTrue(SootProgram.replaces(written, bridge));
		assertFalse(SootProgram.replaces(bridge, written));
		assertFalse(SootProgram.replaces(written, written));
	}
}
