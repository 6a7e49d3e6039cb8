package starvation;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/* Summary store for one analysis run; safe to read and update from worker threads. */
public final class InMemorySummaryStore implements SummaryStore {
	private static final Logger LOGGER = LoggerFactory.getLogger(InMemorySummaryStore.class);

	private final Map<Procname, Summary> summaries = new ConcurrentHashMap<>();
	private final Set<Procname> absent = ConcurrentHashMap.newKeySet();

	@Override
	public Optional<Summary> read(Procname caller, Procname callee) {
		Summary s = summaries.get(callee);
		if (s == null) LOGGER.debug("{}: no summary for callee {}", caller, callee);
		return Optional.ofNullable(s);
	}

	@Override
	public Optional<Summary> readToplevel(Procname procname) {
		return Optional.ofNullable(summaries.get(procname));
	}

	@Override
	public void update(Procname procname, Summary summary) {
		absent.remove(procname);
		summaries.put(procname, summary);
	}

	@Override
	public void markAbsent(Procname procname) {
		summaries.remove(procname);
		absent.add(procname);
	}

	public boolean isAbsent(Procname procname) {
		return absent.contains(procname);
	}

	public int size() {
		return summaries.size();
	}
}
