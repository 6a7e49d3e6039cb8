package starvation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/* Mutable adjacency-list CFG, filled by the front end and frozen by use. */
public final class InstrGraph implements ProcCfg {
	private final List<Instr> nodes = new ArrayList<>();
	private final Map<Instr, List<Instr>> preds = new IdentityHashMap<>();
	private final Map<Instr, List<Instr>> succs = new IdentityHashMap<>();

	public Instr add(Instr n) {
		if (!preds.containsKey(n)) {
			nodes.add(n);
			preds.put(n, new ArrayList<>());
			succs.put(n, new ArrayList<>());
		}
		return n;
	}

	public void addEdge(Instr from, Instr to) {
		add(from);
		add(to);
		if (!succs.get(from).contains(to)) {
			succs.get(from).add(to);
			preds.get(to).add(from);
		}
	}

	/* Straight-line body: each instruction falls through to the next. */
	public static InstrGraph sequential(List<? extends Instr> instrs) {
		InstrGraph g = new InstrGraph();
		Instr prev = null;
		for (Instr n : instrs) {
			g.add(n);
			if (prev != null) g.addEdge(prev, n);
			prev = n;
		}
		return g;
	}

	@Override
	public List<Instr> getNodes() { return Collections.unmodifiableList(nodes); }

	@Override
	public List<Instr> getPredsOf(Instr n) {
		List<Instr> l = preds.get(n);
		return (l == null) ? Collections.emptyList() : Collections.unmodifiableList(l);
	}

	@Override
	public List<Instr> getSuccsOf(Instr n) {
		List<Instr> l = succs.get(n);
		return (l == null) ? Collections.emptyList() : Collections.unmodifiableList(l);
	}

	@Override
	public List<Instr> getHeads() {
		List<Instr> heads = new ArrayList<>();
		for (Instr n : nodes) if (preds.get(n).isEmpty()) heads.add(n);
		// a body that loops back to its first node still has an entry
		if (heads.isEmpty() && !nodes.isEmpty()) heads.add(nodes.get(0));
		return heads;
	}

	@Override
	public List<Instr> getTails() {
		List<Instr> tails = new ArrayList<>();
		for (Instr n : nodes) if (succs.get(n).isEmpty()) tails.add(n);
		return tails;
	}
}
