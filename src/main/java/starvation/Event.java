package starvation;

import java.util.Objects;

/* The one hazardous action observed at a critical pair's program point. */
public abstract class Event {

	public abstract String describe();

	public boolean isBlockingCall() {
		return false;
	}

	public static final class LockAcquire extends Event {
		private final Lock lock;

		LockAcquire(Lock lock) { this.lock = lock; }

		public Lock getLock() { return lock; }

		@Override
		public String describe() { return "locks " + lock.describe(); }

		@Override
		public boolean equals(Object o) {
			return this == o || (o instanceof LockAcquire a && lock.equals(a.lock));
		}

		@Override
		public int hashCode() { return lock.hashCode(); }

		@Override
		public String toString() { return "LockAcquire(" + lock + ")"; }
	}

	public static final class MayBlock extends Event {
		private final String description;
		private final Severity severity;

		MayBlock(String description, Severity severity) {
			this.description = description;
			this.severity = severity;
		}

		public Severity getSeverity() { return severity; }

		@Override
		public String describe() { return description; }

		@Override
		public boolean isBlockingCall() { return true; }

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (!(o instanceof MayBlock b)) return false;
			return severity == b.severity && description.equals(b.description);
		}

		@Override
		public int hashCode() { return Objects.hash(description, severity); }

		@Override
		public String toString() { return "MayBlock(" + description + ", " + severity + ")"; }
	}

	public static final class StrictModeCall extends Event {
		private final String description;

		StrictModeCall(String description) { this.description = description; }

		@Override
		public String describe() { return description; }

		@Override
		public boolean isBlockingCall() { return true; }

		@Override
		public boolean equals(Object o) {
			return this == o || (o instanceof StrictModeCall s && description.equals(s.description));
		}

		@Override
		public int hashCode() { return description.hashCode(); }

		@Override
		public String toString() { return "StrictModeCall(" + description + ")"; }
	}

	public static LockAcquire makeAcquire(Lock lock) {
		return new LockAcquire(lock);
	}

	public static MayBlock makeBlockingCall(Procname callee, Severity severity) {
		return new MayBlock("calls `" + callee + "`", severity);
	}

	public static StrictModeCall makeStrictModeCall(Procname callee) {
		return new StrictModeCall("calls `" + callee + "`");
	}
}
