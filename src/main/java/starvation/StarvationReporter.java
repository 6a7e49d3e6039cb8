package starvation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second pass: once every summary is stored, pairs each reportable procedure's critical
 * pairs with those of the methods of the classes owning the locks it takes, and turns
 * them into deadlock, lockless, starvation and strict-mode reports.
 *
 * A procedure only ever writes into its own report map, so procedures can be reported
 * in parallel; the resulting issue logs are merged and sorted.
 */
public final class StarvationReporter {
	private static final Logger LOGGER = LoggerFactory.getLogger(StarvationReporter.class);

	private static final String LOCKLESS = "`Lockless`";

	private final ProgramIndex program;
	private final SummaryStore summaries;
	private final AnnotationResolver annotations;
	private final Config config;
	private ClassSummaryIndex classIndex;

	public StarvationReporter(ProgramIndex program, SummaryStore summaries, AnnotationResolver annotations, Config config) {
		this.program = program;
		this.summaries = summaries;
		this.annotations = annotations;
		this.config = config;
	}

	/* Private methods, compiler helpers and class initializers are never reported on. */
	public static boolean shouldReport(ProcDesc procDesc) {
		if (procDesc.getAccess() == ProcDesc.Access.PRIVATE) return false;
		Procname procname = procDesc.getProcname();
		if (!procname.isJava()) return true;
		return !procDesc.isAutogen() && !procname.isAutogenName() && !procname.isClassInitializer();
	}

	private static String pp(Procname procname) {
		return "`" + procname + "`";
	}

	/* -------- Whole program -------- */

	public IssueLog reportAll() {
		classIndex = ClassSummaryIndex.build(program, summaries);
		List<ProcDesc> procs = new ArrayList<>(program.getProcedures());
		procs.sort((a, b) -> a.getProcname().compareTo(b.getProcname()));

		IssueLog log = new IssueLog();
		int threads = config.getThreads();
		if (threads <= 1) {
			for (ProcDesc pd : procs) reportProcedure(pd, log);
		} else {
			ExecutorService pool = Executors.newFixedThreadPool(threads);
			try {
				List<Callable<IssueLog>> tasks = new ArrayList<>(procs.size());
				for (ProcDesc pd : procs) {
					tasks.add(() -> {
						IssueLog own = new IssueLog();
						reportProcedure(pd, own);
						return own;
					});
				}
				for (IssueLog own : StarvationAnalyzer.awaitAll(pool.invokeAll(tasks))) log.merge(own);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new IllegalStateException("Interrupted while reporting", e);
			} finally {
				pool.shutdown();
			}
		}
		LOGGER.info("Reported {} issue(s)", log.size());
		return log;
	}

	void reportProcedure(ProcDesc procDesc, IssueSink sink) {
		if (!shouldReport(procDesc)) return;
		if (classIndex == null) classIndex = ClassSummaryIndex.build(program, summaries);
		Optional<Summary> summary = summaries.readToplevel(procDesc.getProcname());
		if (summary.isEmpty()) return;

		ReportMap reports = new ReportMap();
		reportDeadlocks(procDesc.getProcname(), summary.get(), reports);
		reportLocklessViolations(procDesc.getProcname(), summary.get(), reports);
		reportStarvation(procDesc.getProcname(), summary.get(), reports);
		reports.log(sink, annotations, procDesc, config.isDeduplicate());
	}

	/* -------- Lockless -------- */

	void reportLocklessViolations(Procname procname, Summary summary, ReportMap reports) {
		if (!annotations.isLockless(procname)) return;
		for (CriticalPair pair : summary.getCriticalPairs()) {
			if (!(pair.getEvent() instanceof Event.LockAcquire)) continue;
			String message = "Method " + pp(procname) + " is annotated " + LOCKLESS
				+ " but " + pair.getEvent().describe() + ".";
			reports.addLocklessViolation(procname, pair.getEarliestLockOrCallLoc(procname),
				pair.makeTrace("", procname), message);
		}
	}

	/* -------- Deadlocks -------- */

	void reportDeadlocks(Procname procname, Summary summary, ReportMap reports) {
		UIThreadDomain ui = summary.getUi();
		for (CriticalPair pair : summary.getCriticalPairs()) {
			if (!(pair.getEvent() instanceof Event.LockAcquire acquire)) continue;
			Lock lock = acquire.getLock();

			if (pair.getAcquisitions().lockIsHeld(lock)) {
				String message = "Potential self deadlock. " + pp(procname) + " locks " + lock.describe() + " twice.";
				reports.addDeadlock(procname, pair.getEarliestLockOrCallLoc(procname),
					pair.makeTrace("In method ", procname), message);
				continue;
			}

			Optional<String> owner = lock.ownerClass();
			if (owner.isEmpty()) continue;
			for (ClassSummaryIndex.Entry sibling : classIndex.getReportableSummaries(owner.get())) {
				// two UI-thread methods never run concurrently
				if (!ui.isBottom() && !sibling.getSummary().getUi().isBottom()) continue;
				for (CriticalPair other : sibling.getSummary().getCriticalPairs()) {
					reportDeadlockPair(procname, pair, sibling.getProcname(), other, reports);
				}
			}
		}
	}

	private void reportDeadlockPair(Procname procname, CriticalPair current, Procname endpointName, CriticalPair endpoint, ReportMap reports) {
		if (!current.mayDeadlock(endpoint)) return;
		if (!shouldReportDeadlockOnCurrentProc(current, endpoint, config.isDeduplicate())) return;
		LOGGER.debug("Possible deadlock: {} / {}", current, endpoint);
		Lock lock1 = current.getAcquiredLock();
		Lock lock2 = endpoint.getAcquiredLock();
		String message = "Potential deadlock. " + pp(procname) + " (Trace 1) and " + pp(endpointName)
			+ " (Trace 2) acquire locks " + lock1.describe() + " and " + lock2.describe() + " in reverse orders.";
		List<TraceElem> trace = new ArrayList<>(current.makeTrace("[Trace 1] ", procname));
		trace.addAll(endpoint.makeTrace("[Trace 2] ", endpointName));
		reports.addDeadlock(procname, current.getEarliestLockOrCallLoc(procname), trace, message);
	}

	/*
	 * Both sides of an inversion discover it, so only one of them reports. The side whose
	 * endpoint lock has the smaller type name wins, then the earlier location. This order is
	 * a heuristic: it is stable, not meaningful. A class-object lock on the endpoint side is
	 * never found from the other side, so it always reports.
	 */
	static boolean shouldReportDeadlockOnCurrentProc(CriticalPair current, CriticalPair endpoint, boolean deduplicate) {
		if (!deduplicate) return true;
		Lock currentLock = current.getAcquiredLock();
		Lock endpointLock = endpoint.getAcquiredLock();
		if (currentLock == null || endpointLock == null) {
			throw new IllegalStateException("Deadlock cannot occur without two lock events: " + current + " / " + endpoint);
		}
		if (endpointLock.isClassObject()) return true;
		if (currentLock.isClassObject()) {
			throw new IllegalStateException("Deadlock pairing started from a class object lock: " + current);
		}
		int c = endpointLock.typeName().compareTo(currentLock.typeName());
		return c < 0 || (c == 0 && current.getLoc().compareTo(endpoint.getLoc()) < 0);
	}

	/* -------- Starvation -------- */

	void reportStarvation(Procname procname, Summary summary, ReportMap reports) {
		// constructors leave this to their callers
		if (procname.isConstructor()) return;
		UIThreadDomain ui = summary.getUi();
		if (ui.isBottom()) return;
		String because = ui.getExplanation().describe();

		for (CriticalPair pair : summary.getCriticalPairs()) {
			Event event = pair.getEvent();
			if (event instanceof Event.MayBlock block) {
				String message = "Method " + pp(procname) + " runs on UI thread (because " + because
					+ "), and may block; " + event.describe() + ".";
				reports.addStarvation(block.getSeverity(), procname, pair.getLoc(), uiTrace(pair, procname, ui), message);
			} else if (event instanceof Event.StrictModeCall) {
				String message = "Method " + pp(procname) + " runs on UI thread (because " + because
					+ "), and may violate Strict Mode; " + event.describe() + ".";
				reports.addStrictModeViolation(procname, pair.getLoc(), uiTrace(pair, procname, ui), message);
			} else if (event instanceof Event.LockAcquire acquire) {
				reportRemoteBlocks(procname, pair, acquire.getLock(), ui, reports);
			}
		}
	}

	private static List<TraceElem> uiTrace(CriticalPair pair, Procname procname, UIThreadDomain ui) {
		List<TraceElem> trace = new ArrayList<>(pair.makeTrace("", procname, false));
		trace.addAll(ui.makeTrace("[Trace on UI thread] "));
		return trace;
	}

	/* A lock taken on the UI thread, while a method not on the UI thread blocks holding it. */
	private void reportRemoteBlocks(Procname procname, CriticalPair pair, Lock lock, UIThreadDomain ui, ReportMap reports) {
		Optional<String> owner = lock.ownerClass();
		if (owner.isEmpty()) return;
		for (ClassSummaryIndex.Entry sibling : classIndex.getReportableSummaries(owner.get())) {
			if (!sibling.getSummary().getUi().isBottom()) continue;
			for (CriticalPair other : sibling.getSummary().getCriticalPairs()) {
				if (!(other.getEvent() instanceof Event.MayBlock block)) continue;
				if (!other.getAcquisitions().lockIsHeld(lock)) continue;
				String message = "Method " + pp(procname) + " runs on UI thread (because "
					+ ui.getExplanation().describe() + ") and locks " + lock.describe()
					+ ", which may be held by another thread which " + block.describe() + ".";
				List<TraceElem> trace = new ArrayList<>(pair.makeTrace("[Trace 1] ", procname));
				trace.addAll(other.makeTrace("[Trace 2] ", sibling.getProcname()));
				trace.addAll(ui.makeTrace("[Trace 1 on UI thread] "));
				reports.addStarvation(block.getSeverity(), procname, pair.getEarliestLockOrCallLoc(procname), trace, message);
			}
		}
	}
}
