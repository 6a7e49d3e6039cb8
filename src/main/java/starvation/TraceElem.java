package starvation;

import java.util.Objects;

/* One step of a rendered explanation: nesting depth, where, and what happened there. */
public final class TraceElem {
	private final int depth;
	private final Location loc;
	private final String description;

	public TraceElem(int depth, Location loc, String description) {
		this.depth = depth;
		this.loc = loc;
		this.description = description;
	}

	public int getDepth() { return depth; }
	public Location getLoc() { return loc; }
	public String getDescription() { return description; }

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof TraceElem t)) return false;
		return depth == t.depth && loc.equals(t.loc) && description.equals(t.description);
	}

	@Override
	public int hashCode() {
		return Objects.hash(depth, loc, description);
	}

	@Override
	public String toString() {
		return "  ".repeat(depth) + loc + ": " + description;
	}
}
