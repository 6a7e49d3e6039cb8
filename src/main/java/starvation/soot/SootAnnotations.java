package starvation.soot;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import soot.SootClass;
import soot.SootMethod;
import soot.tagkit.AnnotationArrayElem;
import soot.tagkit.AnnotationElem;
import soot.tagkit.AnnotationStringElem;
import soot.tagkit.AnnotationTag;
import soot.tagkit.Host;
import soot.tagkit.Tag;
import soot.tagkit.VisibilityAnnotationTag;
import starvation.AnnotationResolver;
import starvation.IssueType;
import starvation.ProcDesc;
import starvation.Procname;
import starvation.UIThreadExplanation;

/**
 * Reads analysis annotations from class-file tags. Annotations are matched by simple name,
 * so any {@code Lockless}, {@code NonBlocking}, {@code UiThread} or {@code MainThread}
 * annotation type works. Method annotations are inherited from overridden methods, and
 * class annotations from superclasses.
 */
public final class SootAnnotations implements AnnotationResolver {
	static final String LOCKLESS = "Lockless";
	static final String NONBLOCKING = "NonBlocking";
	static final Set<String> UI_THREAD = Set.of("UiThread", "MainThread");
	static final Set<String> SUPPRESSIONS = Set.of("SuppressLint", "SuppressWarnings");

	private static final List<String> UI_CLASSES = List.of(
		"android.app.Activity",
		"android.app.Fragment",
		"androidx.fragment.app.Fragment",
		"android.view.View",
		"android.app.Service");

	private static final Set<String> LIFECYCLE_METHODS = Set.of(
		"onCreate", "onStart", "onRestart", "onResume", "onPause", "onStop", "onDestroy",
		"onCreateView", "onViewCreated", "onAttach", "onDetach", "onStartCommand",
		"onDraw", "onMeasure", "onLayout", "onClick", "onTouchEvent");

	private final SootProgram program;

	public SootAnnotations(SootProgram program) {
		this.program = program;
	}

	/* -------- Tag access -------- */

	static List<AnnotationTag> annotationsOf(Host host) {
		List<AnnotationTag> out = new ArrayList<>();
		for (Tag t : host.getTags()) {
			if (t instanceof VisibilityAnnotationTag v && v.getAnnotations() != null) out.addAll(v.getAnnotations());
		}
		return out;
	}

	// "Lpkg/Outer$UiThread;" -> "UiThread"
	static String simpleTypeName(String descriptor) {
		String s = descriptor;
		if (s.startsWith("L") && s.endsWith(";")) s = s.substring(1, s.length() - 1);
		s = s.substring(s.lastIndexOf('/') + 1);
		return s.substring(s.lastIndexOf('$') + 1);
	}

	static Optional<String> findAnnotation(Host host, Set<String> names) {
		for (AnnotationTag a : annotationsOf(host)) {
			String name = simpleTypeName(a.getType());
			if (names.contains(name)) return Optional.of(name);
		}
		return Optional.empty();
	}

	/* The method itself first, then the methods it overrides. */
	private static List<SootMethod> overrideChain(SootMethod m) {
		List<SootMethod> out = new ArrayList<>();
		out.add(m);
		if (m.isStatic() || m.isConstructor()) return out;
		for (SootClass s : SootProgram.supertypesOf(m.getDeclaringClass())) {
			SootMethod overridden = s.getMethodUnsafe(m.getSubSignature());
			if (overridden != null) out.add(overridden);
		}
		return out;
	}

	private static List<SootClass> classChain(SootClass c) {
		List<SootClass> out = new ArrayList<>();
		out.add(c);
		out.addAll(SootProgram.supertypesOf(c));
		return out;
	}

	private boolean hasAnnotation(Procname procname, Set<String> names) {
		Optional<SootMethod> m = program.getSootMethod(procname);
		if (m.isEmpty()) return false;
		for (SootMethod o : overrideChain(m.get())) if (findAnnotation(o, names).isPresent()) return true;
		for (SootClass c : classChain(m.get().getDeclaringClass())) if (findAnnotation(c, names).isPresent()) return true;
		return false;
	}

	/* -------- AnnotationResolver -------- */

	@Override
	public boolean isLockless(Procname procname) {
		return hasAnnotation(procname, Set.of(LOCKLESS));
	}

	@Override
	public boolean isNonblocking(ProcDesc procDesc) {
		return hasAnnotation(procDesc.getProcname(), Set.of(NONBLOCKING));
	}

	@Override
	public Optional<UIThreadExplanation> uiThreadExplanation(Procname procname) {
		Optional<SootMethod> found = program.getSootMethod(procname);
		if (found.isEmpty()) return Optional.empty();
		SootMethod m = found.get();

		List<SootMethod> chain = overrideChain(m);
		for (SootMethod o : chain) {
			Optional<String> a = findAnnotation(o, UI_THREAD);
			if (a.isEmpty()) continue;
			if (o == m) return Optional.of(UIThreadExplanation.annotated(procname, "is annotated `" + a.get() + "`"));
			return Optional.of(UIThreadExplanation.annotated(procname,
				"overrides `" + JimpleTranslator.procnameOf(o) + "`, which is annotated `" + a.get() + "`"));
		}
		for (SootClass c : classChain(m.getDeclaringClass())) {
			Optional<String> a = findAnnotation(c, UI_THREAD);
			if (a.isPresent()) {
				return Optional.of(UIThreadExplanation.annotated(procname,
					"is a method of `" + Procname.simpleName(c.getName()) + "`, which is annotated `" + a.get() + "`"));
			}
		}
		if (LIFECYCLE_METHODS.contains(m.getName())) {
			for (String ui : UI_CLASSES) {
				if (program.isSubtype(m.getDeclaringClass().getName(), ui)) {
					return Optional.of(UIThreadExplanation.isModeled(procname));
				}
			}
		}
		return Optional.empty();
	}

	/* {@code @SuppressLint("STARVATION")}, {@code @SuppressLint("starvation")} and the like. */
	@Override
	public boolean isSuppressed(ProcDesc procDesc, IssueType issueType) {
		Optional<SootMethod> m = program.getSootMethod(procDesc.getProcname());
		if (m.isEmpty()) return false;
		return suppresses(m.get(), issueType) || suppresses(m.get().getDeclaringClass(), issueType);
	}

	private static boolean suppresses(Host host, IssueType issueType) {
		for (AnnotationTag a : annotationsOf(host)) {
			if (!SUPPRESSIONS.contains(simpleTypeName(a.getType()))) continue;
			for (String v : stringValues(a)) {
				if (v.equalsIgnoreCase(issueType.name()) || v.equalsIgnoreCase(issueType.hyphenated())) return true;
			}
		}
		return false;
	}

	private static List<String> stringValues(AnnotationTag a) {
		List<String> out = new ArrayList<>();
		for (AnnotationElem e : a.getElems()) collectStrings(e, out);
		return out;
	}

	private static void collectStrings(AnnotationElem e, List<String> out) {
		if (e instanceof AnnotationStringElem s) {
			out.add(s.getValue());
		} else if (e instanceof AnnotationArrayElem arr) {
			for (AnnotationElem v : arr.getValues()) collectStrings(v, out);
		}
	}
}
