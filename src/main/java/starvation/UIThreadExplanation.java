package starvation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/* Why a procedure is believed to run on the UI thread. Ordered most specific first. */
public final class UIThreadExplanation implements Comparable<UIThreadExplanation> {
	public enum Kind {
		// carries a UI-thread annotation, directly, through an overridden method, or through its class
		ANNOTATED,
		// a framework entry point known to run on the main thread
		IS_MODELED,
		// calls a method that asserts or forces the UI thread
		CALLS_MODELED
	}

	private final Kind kind;
	private final Procname procname;
	private final String detail;

	private UIThreadExplanation(Kind kind, Procname procname, String detail) {
		this.kind = kind;
		this.procname = procname;
		this.detail = detail;
	}

	/* detail completes the sentence "`procname` ...", e.g. "is annotated `UiThread`" */
	public static UIThreadExplanation annotated(Procname procname, String detail) {
		return new UIThreadExplanation(Kind.ANNOTATED, procname, detail);
	}

	public static UIThreadExplanation isModeled(Procname procname) {
		return new UIThreadExplanation(Kind.IS_MODELED, procname, "is a standard UI-thread method");
	}

	public static UIThreadExplanation callsModeled(Procname procname, Procname callee) {
		return new UIThreadExplanation(Kind.CALLS_MODELED, procname, "calls `" + callee + "`");
	}

	public Kind getKind() { return kind; }
	public Procname getProcname() { return procname; }

	public String describe() {
		return "`" + procname + "` " + detail;
	}

	public List<TraceElem> makeTrace(String header, Location loc) {
		return Collections.singletonList(new TraceElem(0, loc, header + describe()));
	}

	@Override
	public int compareTo(UIThreadExplanation o) {
		int c = kind.compareTo(o.kind);
		if (c != 0) return c;
		c = procname.compareTo(o.procname);
		return (c != 0) ? c : detail.compareTo(o.detail);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof UIThreadExplanation e)) return false;
		return kind == e.kind && procname.equals(e.procname) && detail.equals(e.detail);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, procname, detail);
	}

	@Override
	public String toString() {
		return describe();
	}
}
