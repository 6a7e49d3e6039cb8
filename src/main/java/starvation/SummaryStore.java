package starvation;

import java.util.Optional;

/* Per-procedure summaries. A missing summary means "no information", never an error. */
public interface SummaryStore {
	Optional<Summary> read(Procname caller, Procname callee);

	// summary of a procedure being reported on
	Optional<Summary> readToplevel(Procname procname);

	void update(Procname procname, Summary summary);

	// the procedure was attempted but produced no summary, e.g. its fixpoint was cut off
	void markAbsent(Procname procname);
}
