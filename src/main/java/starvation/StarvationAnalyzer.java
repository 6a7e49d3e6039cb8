package starvation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the summary of every procedure. Callees are summarized before their callers:
 * the direct call graph is split into strongly connected components, and components are
 * grouped into levels where every callee lives in a lower level. Components of one level
 * are independent and may run in parallel; members of one component run in name order.
 */
public final class StarvationAnalyzer {
	private static final Logger LOGGER = LoggerFactory.getLogger(StarvationAnalyzer.class);

	private final CallClassifier models;
	private final AnnotationResolver annotations;
	private final SummaryStore summaries;
	private final Config config;

	public StarvationAnalyzer(CallClassifier models, AnnotationResolver annotations, SummaryStore summaries, Config config) {
		this.models = models;
		this.annotations = annotations;
		this.summaries = summaries;
		this.config = config;
	}

	/* -------- One procedure -------- */

	public Optional<Summary> analyzeProcedure(ProcDesc procDesc) {
		Procname procname = procDesc.getProcname();
		if (models.shouldSkipAnalysis(procname, Collections.emptyList())) {
			LOGGER.debug("{}: skipped by policy", procname);
			return Optional.empty();
		}
		Location loc = procDesc.getLoc();

		StarvationDomain initial = StarvationDomain.bottom();
		if (procDesc.isSynchronized()) {
			Lock lock = synchronizedMethodLock(procDesc);
			if (lock != null) initial = initial.acquire(procname, loc, List.of(lock));
		}
		Optional<UIThreadExplanation> uiExplanation = annotations.uiThreadExplanation(procname);
		if (uiExplanation.isPresent()) initial = initial.setOnUiThread(loc, uiExplanation.get());

		TransferFunctions tf = new TransferFunctions(procDesc, models, summaries);
		Kildall kildall = new Kildall(config.getMaxIterations());
		Optional<LatticeElement> post = kildall.computePost(procDesc.getCfg(), initial,
			(in, n) -> tf.execInstr((StarvationDomain) in, n));
		if (post.isEmpty()) {
			LOGGER.warn("{}: fixpoint not reached within {} visits per node, no summary", procname, config.getMaxIterations());
			summaries.markAbsent(procname);
			return Optional.empty();
		}

		StarvationDomain astate = (StarvationDomain) post.get();
		if (annotations.isNonblocking(procDesc)) astate = astate.filterBlockingCalls();
		Summary summary = astate.toSummary();
		summaries.update(procname, summary);
		return Optional.of(summary);
	}

	/*
	 * A synchronized instance method holds `this`; a static one holds the class object,
	 * which is the same lock as synchronized (C.class).
	 */
	static Lock synchronizedMethodLock(ProcDesc procDesc) {
		Procname procname = procDesc.getProcname();
		if (procname.isStatic()) return Lock.ofClass(procname.getClassName());
		Exp.Var self = procDesc.getFormal(0);
		return (self == null) ? null : Lock.of(self, Collections.emptyList());
	}

	/* -------- Whole program -------- */

	public void analyzeAll(ProgramIndex program) {
		List<List<List<ProcDesc>>> levels = computeLevels(program.getProcedures());
		int threads = config.getThreads();
		LOGGER.info("Analyzing {} procedures in {} levels on {} thread(s)", program.getProcedures().size(), levels.size(), threads);
		if (threads <= 1) {
			for (List<List<ProcDesc>> level : levels) {
				for (List<ProcDesc> scc : level) analyzeComponent(scc);
			}
			return;
		}
		ExecutorService pool = Executors.newFixedThreadPool(threads);
		try {
			for (List<List<ProcDesc>> level : levels) {
				List<Callable<Void>> tasks = new ArrayList<>(level.size());
				for (List<ProcDesc> scc : level) {
					tasks.add(() -> {
						analyzeComponent(scc);
						return null;
					});
				}
				awaitAll(pool.invokeAll(tasks));
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while computing summaries", e);
		} finally {
			pool.shutdown();
		}
	}

	private void analyzeComponent(List<ProcDesc> scc) {
		for (ProcDesc pd : scc) analyzeProcedure(pd);
	}

	/* Rethrows the first failure of a worker on the calling thread. */
	static <T> List<T> awaitAll(List<Future<T>> futures) throws InterruptedException {
		List<T> out = new ArrayList<>(futures.size());
		for (Future<T> f : futures) {
			try {
				out.add(f.get());
			} catch (ExecutionException e) {
				Throwable cause = e.getCause();
				if (cause instanceof RuntimeException re) throw re;
				if (cause instanceof Error err) throw err;
				throw new IllegalStateException(cause);
			}
		}
		return out;
	}

	/*
	 * Tarjan's SCC over direct call edges between known procedures. Tarjan emits components
	 * callees first, so a component's level is one more than the highest level of the
	 * components it calls into.
	 */
	static List<List<List<ProcDesc>>> computeLevels(Collection<ProcDesc> procedures) {
		Map<Procname, ProcDesc> byName = new TreeMap<>();
		for (ProcDesc pd : procedures) byName.put(pd.getProcname(), pd);

		Map<Procname, List<Procname>> edges = new HashMap<>();
		for (ProcDesc pd : byName.values()) {
			Set<Procname> callees = new LinkedHashSet<>();
			for (Instr n : pd.getCfg().getNodes()) {
				if (n instanceof Instr.Call c && c.isDirect() && byName.containsKey(c.getCallee())) {
					callees.add(c.getCallee());
				}
			}
			List<Procname> sorted = new ArrayList<>(callees);
			Collections.sort(sorted);
			edges.put(pd.getProcname(), sorted);
		}

		Tarjan tarjan = new Tarjan(edges);
		for (Procname p : byName.keySet()) tarjan.visit(p);

		Map<Procname, Integer> levelOf = new HashMap<>();
		List<List<List<ProcDesc>>> levels = new ArrayList<>();
		for (List<Procname> scc : tarjan.components) {
			Set<Procname> members = new LinkedHashSet<>(scc);
			int level = 0;
			for (Procname p : scc) {
				for (Procname callee : edges.get(p)) {
					if (!members.contains(callee)) level = Math.max(level, levelOf.get(callee) + 1);
				}
			}
			for (Procname p : scc) levelOf.put(p, level);
			while (levels.size() <= level) levels.add(new ArrayList<>());
			Collections.sort(scc);
			List<ProcDesc> component = new ArrayList<>(scc.size());
			for (Procname p : scc) component.add(byName.get(p));
			levels.get(level).add(component);
		}
		return levels;
	}

	private static final class Tarjan {
		private final Map<Procname, List<Procname>> edges;
		private final Map<Procname, Integer> index = new HashMap<>();
		private final Map<Procname, Integer> lowlink = new HashMap<>();
		private final Deque<Procname> stack = new ArrayDeque<>();
		private final Set<Procname> onStack = new LinkedHashSet<>();
		private final List<List<Procname>> components = new ArrayList<>();
		private int counter = 0;

		Tarjan(Map<Procname, List<Procname>> edges) {
			this.edges = edges;
		}

		void visit(Procname v) {
			if (index.containsKey(v)) return;
			index.put(v, counter);
			lowlink.put(v, counter);
			counter++;
			stack.push(v);
			onStack.add(v);
			for (Procname w : edges.get(v)) {
				if (!index.containsKey(w)) {
					visit(w);
					lowlink.put(v, Math.min(lowlink.get(v), lowlink.get(w)));
				} else if (onStack.contains(w)) {
					lowlink.put(v, Math.min(lowlink.get(v), index.get(w)));
				}
			}
			if (lowlink.get(v).equals(index.get(v))) {
				List<Procname> scc = new ArrayList<>();
				Procname w;
				do {
					w = stack.pop();
					onStack.remove(w);
					scc.add(w);
				} while (!w.equals(v));
				components.add(scc);
			}
		}
	}
}
