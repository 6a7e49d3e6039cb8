package starvation;

import java.util.List;

/* What a call does to locks, as decided by a CallClassifier. */
public abstract class LockEffect {

	public static final LockEffect NO_EFFECT = new LockEffect() {
		@Override
		public String toString() { return "NoEffect"; }
	};

	public static final class Acquire extends LockEffect {
		private final List<Exp> locks;

		public Acquire(List<Exp> locks) { this.locks = List.copyOf(locks); }

		public List<Exp> getLocks() { return locks; }
	}

	public static final class Release extends LockEffect {
		private final List<Exp> locks;

		public Release(List<Exp> locks) { this.locks = List.copyOf(locks); }

		public List<Exp> getLocks() { return locks; }
	}

	/* tryLock() style calls; the lock is held only on the true branch */
	public static final class LockedIfTrue extends LockEffect {
		private final List<Exp> locks;

		public LockedIfTrue(List<Exp> locks) { this.locks = List.copyOf(locks); }

		public List<Exp> getLocks() { return locks; }
	}

	/* -------- RAII-style guards -------- */

	public static final class GuardConstruct extends LockEffect {
		private final Exp guard;
		private final Exp lock;
		private final boolean acquireNow;

		public GuardConstruct(Exp guard, Exp lock, boolean acquireNow) {
			this.guard = guard;
			this.lock = lock;
			this.acquireNow = acquireNow;
		}

		public Exp getGuard() { return guard; }
		public Exp getLock() { return lock; }
		public boolean isAcquireNow() { return acquireNow; }
	}

	public static final class GuardLock extends LockEffect {
		private final Exp guard;

		public GuardLock(Exp guard) { this.guard = guard; }

		public Exp getGuard() { return guard; }
	}

	public static final class GuardUnlock extends LockEffect {
		private final Exp guard;

		public GuardUnlock(Exp guard) { this.guard = guard; }

		public Exp getGuard() { return guard; }
	}

	public static final class GuardDestroy extends LockEffect {
		private final Exp guard;

		public GuardDestroy(Exp guard) { this.guard = guard; }

		public Exp getGuard() { return guard; }
	}

	public static final class GuardLockedIfTrue extends LockEffect {
		private final Exp guard;

		public GuardLockedIfTrue(Exp guard) { this.guard = guard; }

		public Exp getGuard() { return guard; }
	}
}
