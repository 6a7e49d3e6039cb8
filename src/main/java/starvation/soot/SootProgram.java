package starvation.soot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import soot.Modifier;
import soot.Scene;
import soot.SootClass;
import soot.SootMethod;
import starvation.ProcDesc;
import starvation.ProgramIndex;
import starvation.Procname;

/* The translated application classes of the Soot scene whose names start with a prefix. */
public final class SootProgram implements ProgramIndex, TypeHierarchy {
	private static final Logger LOGGER = LoggerFactory.getLogger(SootProgram.class);

	private final Map<Procname, ProcDesc> procs = new LinkedHashMap<>();
	private final Map<Procname, SootMethod> methods = new LinkedHashMap<>();
	private final Map<String, List<Procname>> byClass = new LinkedHashMap<>();

	private SootProgram() {
	}

	public static SootProgram load(String packagePrefix) {
		SootProgram p = new SootProgram();
		List<SootClass> classes = new ArrayList<>(Scene.v().getApplicationClasses());
		classes.sort((a, b) -> a.getName().compareTo(b.getName()));
		for (SootClass c : classes) {
			if (!c.getName().startsWith(packagePrefix)) continue;
			List<Procname> names = new ArrayList<>();
			for (SootMethod m : c.getMethods()) {
				Procname pn = JimpleTranslator.procnameOf(m);
				SootMethod existing = p.methods.get(pn);
				if (existing != null) {
					// return types are not part of the name, so a covariant bridge collides with its target
					if (!replaces(m, existing)) {
						LOGGER.debug("{}: keeping {} over {}", pn, existing.getSignature(), m.getSignature());
						continue;
					}
					p.procs.remove(pn);
				} else {
					names.add(pn);
				}
				p.methods.put(pn, m);
				if (m.isPhantom() || !m.isConcrete()) continue;
				try {
					p.procs.put(pn, JimpleTranslator.translate(m));
				} catch (RuntimeException e) {
					throw new IllegalStateException("Cannot translate " + m.getSignature(), e);
				}
			}
			p.byClass.put(c.getName(), Collections.unmodifiableList(names));
		}
		LOGGER.info("Translated {} procedures from {} classes", p.procs.size(), p.byClass.size());
		return p;
	}

	/* Of two methods with the same name and parameters, the one written in source wins. */
	static boolean replaces(SootMethod candidate, SootMethod existing) {
		return isCompilerGenerated(existing) && !isCompilerGenerated(candidate);
	}

	private static boolean isCompilerGenerated(SootMethod m) {
		return Modifier.isSynthetic(m.getModifiers());
	}

	public Optional<SootMethod> getSootMethod(Procname procname) {
		return Optional.ofNullable(methods.get(procname));
	}

	@Override
	public Optional<ProcDesc> getProcDesc(Procname procname) {
		return Optional.ofNullable(procs.get(procname));
	}

	@Override
	public List<Procname> getMethods(String className) {
		return byClass.getOrDefault(className, Collections.emptyList());
	}

	@Override
	public Collection<ProcDesc> getProcedures() {
		return Collections.unmodifiableCollection(procs.values());
	}

	/* -------- Hierarchy -------- */

	@Override
	public boolean isSubtype(String className, String superName) {
		if (className.equals(superName)) return true;
		if (!Scene.v().containsClass(className)) return false;
		for (SootClass s : supertypesOf(Scene.v().getSootClass(className))) {
			if (s.getName().equals(superName)) return true;
		}
		return false;
	}

	/* All proper superclasses and superinterfaces, nearest first. */
	public static List<SootClass> supertypesOf(SootClass cls) {
		List<SootClass> out = new ArrayList<>();
		Set<SootClass> seen = new HashSet<>();
		Deque<SootClass> todo = new ArrayDeque<>();
		todo.add(cls);
		while (!todo.isEmpty()) {
			SootClass c = todo.removeFirst();
			List<SootClass> direct = new ArrayList<>();
			if (c.hasSuperclass()) direct.add(c.getSuperclass());
			direct.addAll(c.getInterfaces());
			for (SootClass s : direct) {
				if (seen.add(s)) {
					out.add(s);
					todo.addLast(s);
				}
			}
		}
		return out;
	}
}
