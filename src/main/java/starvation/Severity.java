package starvation;

/* How bad a blocking call is when made on the UI thread. Declaration order is the priority order. */
public enum Severity {
	LOW,
	MEDIUM,
	HIGH
}
