package starvation;

import java.util.Collections;
import java.util.List;

/* Everything the analysis needs to know about one procedure: attributes, formals and body. */
public final class ProcDesc {
	public enum Access { PUBLIC, PROTECTED, PACKAGE, PRIVATE }

	private final Procname procname;
	private final Access access;
	private final boolean isSynchronized;
	private final boolean isAutogen;
	private final Location loc;
	private final List<Exp.Var> formals;
	private final ProcCfg cfg;

	public ProcDesc(Procname procname, Access access, boolean isSynchronized, boolean isAutogen,
	                Location loc, List<Exp.Var> formals, ProcCfg cfg) {
		this.procname = procname;
		this.access = access;
		this.isSynchronized = isSynchronized;
		this.isAutogen = isAutogen;
		this.loc = loc;
		this.formals = Collections.unmodifiableList(formals);
		this.cfg = cfg;
	}

	public Procname getProcname() { return procname; }
	public Access getAccess() { return access; }
	public boolean isSynchronized() { return isSynchronized; }
	public boolean isAutogen() { return isAutogen; }
	public Location getLoc() { return loc; }
	public List<Exp.Var> getFormals() { return formals; }
	public ProcCfg getCfg() { return cfg; }

	public boolean isFormal(Exp.Var v) {
		return !v.isGlobal() && formals.contains(v);
	}

	// formal 0 is `this` for instance methods
	public Exp.Var getFormal(int index) {
		return (index < formals.size()) ? formals.get(index) : null;
	}

	@Override
	public String toString() {
		return procname.toString();
	}
}
