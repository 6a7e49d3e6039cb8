package starvation.soot;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import starvation.CallClassifier;
import starvation.Config;
import starvation.Exp;
import starvation.LockEffect;
import starvation.Procname;
import starvation.Severity;

/**
 * Models of the Java library calls that matter to the analysis: monitors and
 * {@code java.util.concurrent.locks.Lock}, synchronized collection classes, blocking
 * primitives, strict-mode file I/O and main-thread assertions.
 *
 * Class matching goes through a {@link TypeHierarchy}, so subclasses of the modeled
 * classes are covered when the hierarchy knows about them.
 */
public final class JavaModels implements CallClassifier {

	private static final List<String> LOCK_CLASSES = List.of(
		"java.util.concurrent.locks.Lock",
		"java.util.concurrent.locks.ReentrantLock",
		"java.util.concurrent.locks.ReentrantReadWriteLock$ReadLock",
		"java.util.concurrent.locks.ReentrantReadWriteLock$WriteLock");

	private static final List<String> SYNCHRONIZED_CLASSES = List.of(
		"java.lang.StringBuffer",
		"java.util.Hashtable",
		"java.util.Vector");

	private static final Map<String, Set<String>> HIGH_SEVERITY = Map.of(
		"java.lang.Thread", Set.of("sleep", "join"),
		"java.lang.Object", Set.of("wait"),
		"java.util.concurrent.Future", Set.of("get"));

	private static final Map<String, Set<String>> MEDIUM_SEVERITY = Map.of(
		"java.util.concurrent.CountDownLatch", Set.of("await"),
		"java.util.concurrent.CyclicBarrier", Set.of("await"),
		"java.util.concurrent.Semaphore", Set.of("acquire", "acquireUninterruptibly"),
		"java.util.concurrent.BlockingQueue", Set.of("take", "put"));

	private static final Map<String, Set<String>> LOW_SEVERITY = Map.of(
		"java.io.InputStream", Set.of("read", "readAllBytes", "readNBytes"),
		"java.io.Reader", Set.of("read"),
		"java.io.BufferedReader", Set.of("readLine"));

	private static final Set<String> STRICT_MODE_FILE_METHODS = Set.of(
		"canRead", "canWrite", "createNewFile", "createTempFile", "delete", "exists",
		"getCanonicalFile", "getCanonicalPath", "getFreeSpace", "getTotalSpace", "getUsableSpace",
		"isDirectory", "isFile", "isHidden", "lastModified", "length", "list", "listFiles",
		"mkdir", "mkdirs", "renameTo", "setExecutable", "setLastModified", "setReadable",
		"setReadOnly", "setWritable");

	private static final Set<String> UI_THREAD_ASSERTIONS = Set.of(
		"assertMainThread", "assertOnMainThread", "assertOnUiThread", "assertUiThread", "checkMainThread");

	private final TypeHierarchy hierarchy;
	private final Set<String> skipMethods;

	public JavaModels(TypeHierarchy hierarchy, List<String> skipMethods) {
		this.hierarchy = hierarchy;
		this.skipMethods = new HashSet<>(skipMethods);
	}

	public JavaModels(TypeHierarchy hierarchy, Config config) {
		this(hierarchy, config.getSkipMethods());
	}

	private boolean isSubtypeOfAny(String cls, List<String> supers) {
		for (String s : supers) if (hierarchy.isSubtype(cls, s)) return true;
		return false;
	}

	private boolean matches(Map<String, Set<String>> table, Procname callee) {
		for (Map.Entry<String, Set<String>> e : table.entrySet()) {
			if (e.getValue().contains(callee.getMethodName()) && hierarchy.isSubtype(callee.getClassName(), e.getKey())) {
				return true;
			}
		}
		return false;
	}

	/* -------- Locks -------- */

	@Override
	public LockEffect getLockEffect(Procname callee, List<Exp> actuals) {
		if (callee.equals(JimpleTranslator.MONITOR_ENTER)) return new LockEffect.Acquire(actuals);
		if (callee.equals(JimpleTranslator.MONITOR_EXIT)) return new LockEffect.Release(actuals);
		if (callee.isStatic() || actuals.isEmpty() || !isSubtypeOfAny(callee.getClassName(), LOCK_CLASSES)) {
			return LockEffect.NO_EFFECT;
		}
		List<Exp> receiver = actuals.subList(0, 1);
		switch (callee.getMethodName()) {
		case "lock":
		case "lockInterruptibly":
			return new LockEffect.Acquire(receiver);
		case "unlock":
			return new LockEffect.Release(receiver);
		case "tryLock":
			return new LockEffect.LockedIfTrue(receiver);
		default:
			return LockEffect.NO_EFFECT;
		}
	}

	@Override
	public boolean isSynchronizedLibraryCall(Procname callee) {
		return !callee.isStatic() && !callee.isConstructor()
			&& isSubtypeOfAny(callee.getClassName(), SYNCHRONIZED_CLASSES);
	}

	/* -------- Starvation -------- */

	@Override
	public boolean isUiThreadModel(Procname callee) {
		return UI_THREAD_ASSERTIONS.contains(callee.getMethodName());
	}

	@Override
	public boolean isStrictModeViolation(Procname callee, List<Exp> actuals) {
		return hierarchy.isSubtype(callee.getClassName(), "java.io.File")
			&& STRICT_MODE_FILE_METHODS.contains(callee.getMethodName());
	}

	@Override
	public Optional<Severity> mayBlock(Procname callee, List<Exp> actuals) {
		if (matches(HIGH_SEVERITY, callee)) {
			// a bounded Future.get only blocks for a while
			boolean timed = callee.getMethodName().equals("get") && !callee.getParameterTypes().isEmpty();
			return Optional.of(timed ? Severity.LOW : Severity.HIGH);
		}
		if (matches(MEDIUM_SEVERITY, callee)) return Optional.of(Severity.MEDIUM);
		if (matches(LOW_SEVERITY, callee)) return Optional.of(Severity.LOW);
		return Optional.empty();
	}

	@Override
	public boolean shouldSkipAnalysis(Procname callee, List<Exp> actuals) {
		return skipMethods.contains(callee.getClassName() + "." + callee.getMethodName());
	}
}
