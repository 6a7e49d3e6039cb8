package starvation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Flat lattice over "runs on the UI thread". Bottom means not known to; a non-bottom element
 * carries the explanation and the location it was established at. Joining two non-bottom
 * elements keeps the smaller explanation (then the earlier location) so the result does not
 * depend on the order in which paths are merged.
 */
public final class UIThreadDomain {
	private static final UIThreadDomain BOTTOM = new UIThreadDomain(null, Location.NONE);

	private final UIThreadExplanation explanation;
	private final Location loc;

	private UIThreadDomain(UIThreadExplanation explanation, Location loc) {
		this.explanation = explanation;
		this.loc = loc;
	}

	public static UIThreadDomain bottom() {
		return BOTTOM;
	}

	public static UIThreadDomain of(UIThreadExplanation explanation, Location loc) {
		return new UIThreadDomain(explanation, loc);
	}

	public boolean isBottom() { return explanation == null; }
	public UIThreadExplanation getExplanation() { return explanation; }
	public Location getLoc() { return loc; }

	public UIThreadDomain join(UIThreadDomain other) {
		if (isBottom()) return other;
		if (other.isBottom()) return this;
		int c = explanation.compareTo(other.explanation);
		if (c == 0) c = loc.compareTo(other.loc);
		return (c <= 0) ? this : other;
	}

	/* First writer wins: an established explanation is never replaced. */
	public UIThreadDomain setOnUiThread(Location at, UIThreadExplanation why) {
		return isBottom() ? of(why, at) : this;
	}

	public List<TraceElem> makeTrace(String header) {
		return isBottom() ? Collections.emptyList() : explanation.makeTrace(header, loc);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof UIThreadDomain u)) return false;
		return Objects.equals(explanation, u.explanation) && loc.equals(u.loc);
	}

	@Override
	public int hashCode() {
		return Objects.hash(explanation, loc);
	}

	@Override
	public String toString() {
		return isBottom() ? "Bottom" : "NonBottom(" + explanation + " @" + loc + ")";
	}
}
