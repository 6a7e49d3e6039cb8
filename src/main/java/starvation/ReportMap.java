package starvation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Candidate reports of one procedure, grouped by location. Filled by the hazard inference
 * and thrown away once logged.
 *
 * With deduplication on, each location keeps one report per problem kind: the one with the
 * highest weight, then the greatest message. Kinds are emitted in declaration order.
 */
final class ReportMap {
	static final String SUPPRESSED_SUFFIX = " Additional report(s) on the same line were suppressed.";

	enum ProblemKind {
		DEADLOCK(IssueType.DEADLOCK),
		LOCKLESS_VIOLATION(IssueType.LOCKLESS_VIOLATION),
		STARVATION(IssueType.STARVATION),
		STRICT_MODE_VIOLATION(IssueType.STRICT_MODE_VIOLATION);

		final IssueType issueType;

		ProblemKind(IssueType issueType) {
			this.issueType = issueType;
		}
	}

	/*
	 * The weight is the trace length for every kind but starvation, where it is the
	 * severity of the blocking call.
	 */
	static final class Problem {
		final ProblemKind kind;
		final int weight;
		final Procname procname;
		final List<TraceElem> trace;
		final String message;

		Problem(ProblemKind kind, int weight, Procname procname, List<TraceElem> trace, String message) {
			this.kind = kind;
			this.weight = weight;
			this.procname = procname;
			this.trace = List.copyOf(trace);
			this.message = message;
		}

		@Override
		public String toString() {
			return kind + "(" + weight + "): " + message;
		}
	}

	static final Comparator<Problem> PRIORITY = Comparator
		.comparingInt((Problem p) -> p.weight)
		.thenComparing(p -> p.message);

	private final Map<Location, List<Problem>> map = new TreeMap<>();

	private void add(Location loc, Problem p) {
		map.computeIfAbsent(loc, k -> new ArrayList<>()).add(p);
	}

	void addDeadlock(Procname procname, Location loc, List<TraceElem> trace, String message) {
		add(loc, new Problem(ProblemKind.DEADLOCK, trace.size(), procname, trace, message));
	}

	void addLocklessViolation(Procname procname, Location loc, List<TraceElem> trace, String message) {
		add(loc, new Problem(ProblemKind.LOCKLESS_VIOLATION, trace.size(), procname, trace, message));
	}

	void addStarvation(Severity severity, Procname procname, Location loc, List<TraceElem> trace, String message) {
		add(loc, new Problem(ProblemKind.STARVATION, severity.ordinal(), procname, trace, message));
	}

	void addStrictModeViolation(Procname procname, Location loc, List<TraceElem> trace, String message) {
		add(loc, new Problem(ProblemKind.STRICT_MODE_VIOLATION, trace.size(), procname, trace, message));
	}

	boolean isEmpty() { return map.isEmpty(); }

	int size() {
		int n = 0;
		for (List<Problem> l : map.values()) n += l.size();
		return n;
	}

	List<Problem> getProblems(Location loc) {
		return map.getOrDefault(loc, List.of());
	}

	/* Emit into the sink, dropping kinds the procedure suppresses. */
	void log(IssueSink sink, AnnotationResolver annotations, ProcDesc procDesc, boolean deduplicate) {
		for (Map.Entry<Location, List<Problem>> e : map.entrySet()) {
			Location loc = e.getKey();
			Map<ProblemKind, List<Problem>> byKind = new EnumMap<>(ProblemKind.class);
			for (Problem p : e.getValue()) byKind.computeIfAbsent(p.kind, k -> new ArrayList<>()).add(p);

			for (Map.Entry<ProblemKind, List<Problem>> k : byKind.entrySet()) {
				if (annotations.isSuppressed(procDesc, k.getKey().issueType)) continue;
				List<Problem> problems = k.getValue();
				if (!deduplicate) {
					for (Problem p : problems) logOne(sink, loc, p, p.message);
				} else if (problems.size() == 1) {
					logOne(sink, loc, problems.get(0), problems.get(0).message);
				} else {
					Problem best = problems.stream().max(PRIORITY).get();
					logOne(sink, loc, best, best.message + SUPPRESSED_SUFFIX);
				}
			}
		}
	}

	private static void logOne(IssueSink sink, Location loc, Problem p, String message) {
		sink.log(p.procname, IssueSink.Level.ERROR, loc, p.trace, p.kind.issueType, message);
	}
}
