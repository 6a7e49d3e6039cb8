package starvation.soot;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.ClassRule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import starvation.Exp;
import starvation.Instr;
import starvation.ProcDesc;
import starvation.Procname;

public class JimpleTranslatorTest {
	private static final String CLS = "fx.Locks";
	private static final Exp.Var THIS = new Exp.Var("this", CLS, false);

	@ClassRule
	public static final TemporaryFolder FOLDER = new TemporaryFolder();

	private static SootProgram program;

	@BeforeClass
	public static void loadFixture() throws Exception {
		program = new SootFixture()
			.source("fx/Locks.java",
				"package fx;",
				"public class Locks {",
				"	private final Object a = new Object();",
				"	static final Object G = new Object();",
				"	public void field() {",
				"		synchronized (a) {",
				"			x();",
				"		}",
				"	}",
				"	public void global() {",
				"		synchronized (G) {",
				"		}",
				"	}",
				"	public void klass() {",
				"		synchronized (Locks.class) {",
				"		}",
				"	}",
				"	public void param(Object p) {",
				"		synchronized (p) {",
				"		}",
				"	}",
				"	public void conflicting(boolean c) {",
				"		Object o = c ? a : G;",
				"		synchronized (o) {",
				"		}",
				"	}",
				"	public synchronized void whole() {",
				"	}",
				"	private static void helper() {",
				"	}",
				"	void x() {",
				"		helper();",
				"	}",
				"}")
			.load(FOLDER.getRoot().toPath(), "fx");
	}

	private static ProcDesc proc(String name, String... params) {
		return program.getProcDesc(Procname.java(CLS, name, params)).orElseThrow();
	}

	private static List<Instr.Call> calls(ProcDesc pd, Procname callee) {
		List<Instr.Call> out = new ArrayList<>();
		for (Instr n : pd.getCfg().getNodes()) {
			if (n instanceof Instr.Call c && c.isDirect() && c.getCallee().equals(callee)) out.add(c);
		}
		return out;
	}

	private static List<Exp> monitorsEntered(ProcDesc pd) {
		List<Exp> out = new ArrayList<>();
		for (Instr.Call c : calls(pd, JimpleTranslator.MONITOR_ENTER)) out.add(c.getActuals().get(0));
		return out;
	}

	@Test
	public void fieldMonitorIsRootedAtThis() {
		ProcDesc pd = proc("field");
		Exp expected = Exp.access(THIS, new Exp.Field("a", "java.lang.Object"));
		assertEquals(List.of(expected), monitorsEntered(pd));
		List<Instr.Call> exits = calls(pd, JimpleTranslator.MONITOR_EXIT);
		assertFalse(exits.isEmpty());
		for (Instr.Call c : exits) assertEquals(expected, c.getActuals().get(0));
	}

	@Test
	public void staticFieldMonitorIsGlobal() {
		Exp expected = Exp.access(new Exp.Var(CLS, CLS, true), new Exp.Field("G", "java.lang.Object"));
		assertEquals(List.of(expected), monitorsEntered(proc("global")));
	}

	@Test
	public void classConstantMonitor() {
		assertEquals(List.of(Exp.classLiteral(CLS)), monitorsEntered(proc("klass")));
	}

	@Test
	public void parameterMonitorIsFormal() {
		ProcDesc pd = proc("param", "java.lang.Object");
		Exp.Var p = new Exp.Var("param0", "java.lang.Object", false);
		assertEquals(List.of(Exp.access(p)), monitorsEntered(pd));
		assertEquals(List.of(THIS, p), pd.getFormals());
		assertTrue(pd.isFormal(p));
	}

	@Test
	public void conflictingDefinitionsStayLocal() {
		ProcDesc pd = proc("conflicting", "boolean");
		List<Exp> entered = monitorsEntered(pd);
		assertEquals(1, entered.size());
		Exp.Access lock = (Exp.Access) entered.get(0);
		assertFalse(lock.getBase().isGlobal());
		assertFalse(pd.isFormal(lock.getBase()));
		assertTrue(lock.getFields().isEmpty());
	}

	@Test
	public void instanceCallsPassReceiverFirst() {
		List<Instr.Call> toX = calls(proc("field"), Procname.java(CLS, "x"));
		assertEquals(1, toX.size());
		assertEquals(List.of(Exp.access(THIS)), toX.get(0).getActuals());

		List<Instr.Call> toHelper = calls(proc("x"), Procname.javaStatic(CLS, "helper"));
		assertEquals(1, toHelper.size());
		assertTrue(toHelper.get(0).getActuals().isEmpty());
	}

	@Test
	public void locationsComeFromLineNumbers() {
		Instr.Call enter = calls(proc("field"), JimpleTranslator.MONITOR_ENTER).get(0);
		assertEquals("fx/Locks.java", enter.getLoc().getFile());
		assertEquals(6, enter.getLoc().getLine());
		assertEquals("fx/Locks.java", proc("field").getLoc().getFile());
	}

	@Test
	public void modifiersCarryOver() {
		assertTrue(proc("whole").isSynchronized());
		assertFalse(proc("field").isSynchronized());
		assertEquals(ProcDesc.Access.PUBLIC, proc("field").getAccess());
		assertEquals(ProcDesc.Access.PRIVATE, proc("helper").getAccess());
		assertEquals(ProcDesc.Access.PACKAGE, proc("x").getAccess());
		assertTrue(proc("helper").getFormals().isEmpty());
		assertFalse(proc("field").isAutogen());
	}
}
