package starvation;

import java.util.List;

/* Where reports end up. */
public interface IssueSink {
	enum Level { ERROR }

	void log(Procname procname, Level level, Location loc, List<TraceElem> trace, IssueType issueType, String message);
}
