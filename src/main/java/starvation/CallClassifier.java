package starvation;

import java.util.List;
import java.util.Optional;

/* Models of library calls: lock operations and the calls that matter for starvation. */
public interface CallClassifier {
	LockEffect getLockEffect(Procname callee, List<Exp> actuals);

	/* synchronized method of a library class whose body is not analyzed (StringBuffer, Vector, ...) */
	boolean isSynchronizedLibraryCall(Procname callee);

	boolean isUiThreadModel(Procname callee);

	boolean isStrictModeViolation(Procname callee, List<Exp> actuals);

	Optional<Severity> mayBlock(Procname callee, List<Exp> actuals);

	boolean shouldSkipAnalysis(Procname callee, List<Exp> actuals);
}
