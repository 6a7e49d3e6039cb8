package starvation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/* Issue sink that keeps everything in memory. One per reporting task; merged at the end. */
public final class IssueLog implements IssueSink {

	public static final class Issue {
		private final Procname procname;
		private final Level level;
		private final Location loc;
		private final List<TraceElem> trace;
		private final IssueType issueType;
		private final String message;

		Issue(Procname procname, Level level, Location loc, List<TraceElem> trace, IssueType issueType, String message) {
			this.procname = procname;
			this.level = level;
			this.loc = loc;
			this.trace = List.copyOf(trace);
			this.issueType = issueType;
			this.message = message;
		}

		public Procname getProcname() { return procname; }
		public Level getLevel() { return level; }
		public Location getLoc() { return loc; }
		public List<TraceElem> getTrace() { return trace; }
		public IssueType getIssueType() { return issueType; }
		public String getMessage() { return message; }

		@Override
		public String toString() {
			return loc + ": " + level + ": " + issueType + ": " + message;
		}
	}

	// deterministic order regardless of which worker logged first
	private static final Comparator<Issue> ORDER = Comparator
		.comparing(Issue::getLoc)
		.thenComparing(Issue::getIssueType)
		.thenComparing(Issue::getProcname)
		.thenComparing(Issue::getMessage);

	private final List<Issue> issues = new ArrayList<>();

	@Override
	public void log(Procname procname, Level level, Location loc, List<TraceElem> trace, IssueType issueType, String message) {
		issues.add(new Issue(procname, level, loc, trace, issueType, message));
	}

	public IssueLog merge(IssueLog other) {
		issues.addAll(other.issues);
		return this;
	}

	public List<Issue> getIssues() {
		List<Issue> sorted = new ArrayList<>(issues);
		sorted.sort(ORDER);
		return Collections.unmodifiableList(sorted);
	}

	public List<Issue> getIssues(IssueType type) {
		List<Issue> out = new ArrayList<>();
		for (Issue i : getIssues()) if (i.getIssueType() == type) out.add(i);
		return out;
	}

	public int size() {
		return issues.size();
	}
}
