package starvation;

import java.util.Objects;

/* Exported state of one analyzed procedure. Immutable once stored. */
public final class Summary {
	private final CriticalPairs criticalPairs;
	private final UIThreadDomain ui;

	public Summary(CriticalPairs criticalPairs, UIThreadDomain ui) {
		this.criticalPairs = criticalPairs;
		this.ui = ui;
	}

	public CriticalPairs getCriticalPairs() { return criticalPairs; }
	public UIThreadDomain getUi() { return ui; }

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Summary s)) return false;
		return criticalPairs.equals(s.criticalPairs) && ui.equals(s.ui);
	}

	@Override
	public int hashCode() {
		return Objects.hash(criticalPairs, ui);
	}

	@Override
	public String toString() {
		return "{critical_pairs=" + criticalPairs + ", ui=" + ui + "}";
	}
}
