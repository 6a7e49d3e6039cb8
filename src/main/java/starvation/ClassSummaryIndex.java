package starvation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only map from a class to the summaries of its reportable methods. Built once after
 * every summary is stored; the hazard inference looks up siblings of a lock's owner here.
 */
public final class ClassSummaryIndex {

	public static final class Entry {
		private final Procname procname;
		private final Summary summary;

		Entry(Procname procname, Summary summary) {
			this.procname = procname;
			this.summary = summary;
		}

		public Procname getProcname() { return procname; }
		public Summary getSummary() { return summary; }
	}

	private final Map<String, List<Entry>> byClass;

	private ClassSummaryIndex(Map<String, List<Entry>> byClass) {
		this.byClass = byClass;
	}

	public static ClassSummaryIndex build(ProgramIndex program, SummaryStore summaries) {
		Map<String, List<Entry>> byClass = new HashMap<>();
		for (ProcDesc pd : program.getProcedures()) {
			String cls = pd.getProcname().getClassName();
			if (byClass.containsKey(cls)) continue;
			List<Procname> methods = new ArrayList<>(program.getMethods(cls));
			Collections.sort(methods);
			List<Entry> entries = new ArrayList<>();
			for (Procname m : methods) {
				Optional<ProcDesc> other = program.getProcDesc(m);
				if (other.isEmpty() || !StarvationReporter.shouldReport(other.get())) continue;
				summaries.readToplevel(m).ifPresent(s -> entries.add(new Entry(m, s)));
			}
			byClass.put(cls, Collections.unmodifiableList(entries));
		}
		return new ClassSummaryIndex(Collections.unmodifiableMap(byClass));
	}

	// empty for classes outside the analyzed program
	public List<Entry> getReportableSummaries(String className) {
		return byClass.getOrDefault(className, Collections.emptyList());
	}
}
