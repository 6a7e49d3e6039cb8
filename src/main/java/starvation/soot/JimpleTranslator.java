package starvation.soot;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import soot.Body;
import soot.Local;
import soot.SootClass;
import soot.SootField;
import soot.SootMethod;
import soot.SootMethodRef;
import soot.Type;
import soot.Unit;
import soot.Value;
import soot.jimple.AssignStmt;
import soot.jimple.CastExpr;
import soot.jimple.ClassConstant;
import soot.jimple.DynamicInvokeExpr;
import soot.jimple.EnterMonitorStmt;
import soot.jimple.ExitMonitorStmt;
import soot.jimple.IdentityStmt;
import soot.jimple.IfStmt;
import soot.jimple.InstanceFieldRef;
import soot.jimple.InstanceInvokeExpr;
import soot.jimple.InvokeExpr;
import soot.jimple.ParameterRef;
import soot.jimple.StaticFieldRef;
import soot.jimple.Stmt;
import soot.jimple.ThisRef;
import soot.tagkit.SourceFileTag;
import soot.toolkits.graph.BriefUnitGraph;
import soot.toolkits.graph.UnitGraph;
import starvation.Exp;
import starvation.Instr;
import starvation.InstrGraph;
import starvation.Location;
import starvation.ProcDesc;
import starvation.Procname;

/**
 * Translates a Jimple body into the analysis IR.
 *
 * Every unit becomes one instruction and the brief unit graph gives the edges. Monitor
 * statements become calls to two builtin procedures. Locals are resolved, where their
 * definition is unique, to the access path they were loaded from, so that `r2 = r0.lock;
 * entermonitor r2` acquires `this.lock`.
 */
public final class JimpleTranslator {
	private static final Logger LOGGER = LoggerFactory.getLogger(JimpleTranslator.class);

	public static final String BUILTIN_CLASS = "__builtin";
	public static final Procname MONITOR_ENTER = Procname.javaStatic(BUILTIN_CLASS, "monitorEnter", "java.lang.Object");
	public static final Procname MONITOR_EXIT = Procname.javaStatic(BUILTIN_CLASS, "monitorExit", "java.lang.Object");

	public static final String THIS = "this";

	private JimpleTranslator() {
	}

	/* -------- Names and locations -------- */

	public static Procname procnameOf(SootMethod m) {
		return procname(m.getDeclaringClass().getName(), m.getName(), m.isStatic(), m.getParameterTypes());
	}

	static Procname procnameOf(SootMethodRef ref) {
		SootMethod resolved = ref.tryResolve();
		if (resolved != null) return procnameOf(resolved);
		return procname(ref.getDeclaringClass().getName(), ref.getName(), ref.isStatic(), ref.getParameterTypes());
	}

	private static Procname procname(String cls, String name, boolean isStatic, List<Type> params) {
		List<String> types = new ArrayList<>(params.size());
		for (Type t : params) types.add(t.toString());
		return Procname.java(cls, name, isStatic, types);
	}

	/* "pkg/File.java" when the class file records its source, otherwise a name derived from the class. */
	static String sourceFileOf(SootClass cls) {
		SootClass outer = cls;
		while (outer.hasOuterClass()) outer = outer.getOuterClass();
		String file = outer.getShortName() + ".java";
		SourceFileTag tag = (SourceFileTag) cls.getTag(SourceFileTag.NAME);
		if (tag != null && tag.getSourceFile() != null) file = tag.getSourceFile();
		String pkg = cls.getPackageName();
		return pkg.isEmpty() ? file : pkg.replace('.', '/') + "/" + file;
	}

	/* -------- Bodies -------- */

	public static ProcDesc translate(SootMethod m) {
		Procname procname = procnameOf(m);
		String file = sourceFileOf(m.getDeclaringClass());
		Body body = m.retrieveActiveBody();
		UnitGraph graph = new BriefUnitGraph(body);

		List<Exp.Var> formals = new ArrayList<>();
		if (!m.isStatic()) formals.add(new Exp.Var(THIS, m.getDeclaringClass().getName(), false));
		for (int i = 0; i < m.getParameterCount(); i++) {
			formals.add(new Exp.Var(parameterName(i), m.getParameterType(i).toString(), false));
		}

		Map<Local, Exp> paths = resolveLocals(body);

		InstrGraph cfg = new InstrGraph();
		Map<Unit, Instr> instrs = new IdentityHashMap<>();
		int firstLine = Integer.MAX_VALUE;
		for (Unit u : body.getUnits()) {
			int line = u.getJavaSourceStartLineNumber();
			if (line > 0) firstLine = Math.min(firstLine, line);
			Instr n = translateUnit((Stmt) u, new Location(file, line), paths);
			instrs.put(u, cfg.add(n));
		}
		for (Unit u : body.getUnits()) {
			for (Unit s : graph.getSuccsOf(u)) cfg.addEdge(instrs.get(u), instrs.get(s));
		}

		int declLine = m.getJavaSourceStartLineNumber();
		if (declLine <= 0) declLine = (firstLine == Integer.MAX_VALUE) ? -1 : firstLine;
		boolean autogen = soot.Modifier.isSynthetic(m.getModifiers()) || procname.isAutogenName();
		return new ProcDesc(procname, accessOf(m), m.isSynchronized(), autogen, new Location(file, declLine), formals, cfg);
	}

	static String parameterName(int i) {
		return "param" + i;
	}

	private static ProcDesc.Access accessOf(SootMethod m) {
		if (m.isPublic()) return ProcDesc.Access.PUBLIC;
		if (m.isPrivate()) return ProcDesc.Access.PRIVATE;
		if (m.isProtected()) return ProcDesc.Access.PROTECTED;
		return ProcDesc.Access.PACKAGE;
	}

	private static Instr translateUnit(Stmt s, Location loc, Map<Local, Exp> paths) {
		if (s instanceof EnterMonitorStmt em) {
			return Instr.Call.direct(MONITOR_ENTER, List.of(expOf(em.getOp(), paths)), loc);
		}
		if (s instanceof ExitMonitorStmt xm) {
			return Instr.Call.direct(MONITOR_EXIT, List.of(expOf(xm.getOp(), paths)), loc);
		}
		if (s.containsInvokeExpr()) {
			InvokeExpr ie = s.getInvokeExpr();
			List<Exp> actuals = new ArrayList<>();
			if (ie instanceof InstanceInvokeExpr iie) actuals.add(expOf(iie.getBase(), paths));
			for (Value arg : ie.getArgs()) actuals.add(expOf(arg, paths));
			if (ie instanceof DynamicInvokeExpr) return Instr.Call.indirect(actuals, loc);
			return Instr.Call.direct(procnameOf(ie.getMethodRef()), actuals, loc);
		}
		if (s instanceof IfStmt is) return new Instr.Assume(is.getCondition().toString(), loc);
		if (s instanceof AssignStmt || s instanceof IdentityStmt) return new Instr.Assign(s.toString(), loc);
		return new Instr.Metadata(s.toString(), loc);
	}

	/* -------- Locals -------- */

	static Exp expOf(Value v, Map<Local, Exp> paths) {
		if (v instanceof Local l) {
			Exp e = paths.get(l);
			return (e != null) ? e : Exp.access(new Exp.Var(l.getName(), l.getType().toString(), false));
		}
		if (v instanceof ClassConstant cc) return Exp.classLiteral(classNameOf(cc));
		return Exp.constant(v.toString());
	}

	// "Lpkg/C;" -> "pkg.C"
	static String classNameOf(ClassConstant cc) {
		String s = cc.getValue();
		if (s.startsWith("L") && s.endsWith(";")) s = s.substring(1, s.length() - 1);
		return s.replace('/', '.');
	}

	/*
	 * Single-definition resolution of locals to formal-, global- or class-rooted expressions.
	 * Definitions are revisited until nothing changes, so copies defined before their source
	 * in unit order still resolve. A local with conflicting definitions stays unresolved.
	 */
	static Map<Local, Exp> resolveLocals(Body body) {
		Map<Local, Exp> paths = new HashMap<>();
		Set<Local> conflicting = new HashSet<>();
		boolean changed = true;
		while (changed) {
			changed = false;
			for (Unit u : body.getUnits()) {
				Local lhs;
				Exp rhs;
				if (u instanceof IdentityStmt id && id.getLeftOp() instanceof Local l) {
					lhs = l;
					rhs = identityExp(id.getRightOp());
				} else if (u instanceof AssignStmt as && as.getLeftOp() instanceof Local l) {
					lhs = l;
					rhs = assignedExp(as.getRightOp(), paths);
				} else {
					continue;
				}
				if (conflicting.contains(lhs)) continue;
				Exp old = paths.get(lhs);
				if (rhs == null) {
					if (old != null || isDefinedElsewhere(body, lhs, u)) {
						conflicting.add(lhs);
						if (paths.remove(lhs) != null) changed = true;
					}
					continue;
				}
				if (old == null) {
					paths.put(lhs, rhs);
					changed = true;
				} else if (!old.equals(rhs)) {
					conflicting.add(lhs);
					paths.remove(lhs);
					changed = true;
				}
			}
		}
		LOGGER.trace("{}: resolved locals {}", body.getMethod().getSignature(), paths);
		return paths;
	}

	private static boolean isDefinedElsewhere(Body body, Local l, Unit except) {
		for (Unit u : body.getUnits()) {
			if (u == except) continue;
			for (soot.ValueBox vb : u.getDefBoxes()) if (vb.getValue() == l) return true;
		}
		return false;
	}

	private static Exp identityExp(Value rhs) {
		if (rhs instanceof ThisRef tr) return Exp.access(new Exp.Var(THIS, tr.getType().toString(), false));
		if (rhs instanceof ParameterRef pr) {
			return Exp.access(new Exp.Var(parameterName(pr.getIndex()), pr.getType().toString(), false));
		}
		return null;
	}

	private static Exp assignedExp(Value rhs, Map<Local, Exp> paths) {
		if (rhs instanceof Local src) return paths.get(src);
		if (rhs instanceof CastExpr ce && ce.getOp() instanceof Local src) return paths.get(src);
		if (rhs instanceof ClassConstant cc) return Exp.classLiteral(classNameOf(cc));
		if (rhs instanceof StaticFieldRef sf) {
			SootField f = sf.getField();
			String cls = f.getDeclaringClass().getName();
			return Exp.access(new Exp.Var(cls, cls, true), new Exp.Field(f.getName(), f.getType().toString()));
		}
		if (rhs instanceof InstanceFieldRef ifr && ifr.getBase() instanceof Local base) {
			Exp b = paths.get(base);
			if (b instanceof Exp.Access a) {
				SootField f = ifr.getField();
				return a.withField(new Exp.Field(f.getName(), f.getType().toString()));
			}
		}
		return null;
	}
}
