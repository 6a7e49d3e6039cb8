package starvation;

import java.util.Optional;

/* Procedure- and class-level facts coming from annotations. */
public interface AnnotationResolver {
	// the annotation on an overridden method or on the class applies too
	boolean isLockless(Procname procname);

	boolean isNonblocking(ProcDesc procDesc);

	Optional<UIThreadExplanation> uiThreadExplanation(Procname procname);

	boolean isSuppressed(ProcDesc procDesc, IssueType issueType);
}
