package starvation;

import java.util.Collections;
import java.util.List;

/*
 * One instruction of a procedure body. Instructions are CFG nodes and compare by identity.
 * Only calls matter to the analysis; the other kinds are kept so that the CFG has the shape
 * of the translated body.
 */
public abstract class Instr {
	private final Location loc;

	Instr(Location loc) {
		this.loc = loc;
	}

	public Location getLoc() { return loc; }

	public static final class Assign extends Instr {
		private final String text;

		public Assign(String text, Location loc) {
			super(loc);
			this.text = text;
		}

		@Override
		public String toString() { return text; }
	}

	public static final class Assume extends Instr {
		private final String condition;

		public Assume(String condition, Location loc) {
			super(loc);
			this.condition = condition;
		}

		@Override
		public String toString() { return "assume " + condition; }
	}

	public static final class Metadata extends Instr {
		private final String text;

		public Metadata(String text, Location loc) {
			super(loc);
			this.text = text;
		}

		@Override
		public String toString() { return text; }
	}

	/* A call; the callee is null for indirect calls (function pointers, invokedynamic). */
	public static final class Call extends Instr {
		private final Procname callee;
		private final List<Exp> actuals;

		private Call(Procname callee, List<Exp> actuals, Location loc) {
			super(loc);
			this.callee = callee;
			this.actuals = Collections.unmodifiableList(actuals);
		}

		public static Call direct(Procname callee, List<Exp> actuals, Location loc) {
			return new Call(callee, List.copyOf(actuals), loc);
		}

		public static Call indirect(List<Exp> actuals, Location loc) {
			return new Call(null, List.copyOf(actuals), loc);
		}

		public boolean isDirect() { return callee != null; }
		public Procname getCallee() { return callee; }
		public List<Exp> getActuals() { return actuals; }

		@Override
		public String toString() {
			return (isDirect() ? callee.toString() : "<indirect>") + actuals;
		}
	}
}
