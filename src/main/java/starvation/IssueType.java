package starvation;

public enum IssueType {
	DEADLOCK,
	LOCKLESS_VIOLATION,
	STARVATION,
	STRICT_MODE_VIOLATION;

	/* "STRICT_MODE_VIOLATION" -> "strict-mode-violation", the form used in suppression annotations */
	public String hyphenated() {
		return name().toLowerCase().replace('_', '-');
	}
}
