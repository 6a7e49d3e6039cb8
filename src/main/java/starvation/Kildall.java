package starvation;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Kildall's work-list fix-point over a procedure CFG. Facts are only handled as
 * LatticeElement. IN of a node is the join of its predecessors' OUT (plus the initial
 * fact at entry nodes); nodes not yet reached have no fact. The post-state is the join
 * of OUT over the exit nodes.
 *
 * The budget bounds how often any single node is processed, so it does not depend on the
 * size of the body: a loop-free body always fits in a budget of one.
 */
final class Kildall {

	interface Transfer {
		LatticeElement apply(LatticeElement in, Instr n);
	}

	private final int maxVisits;

	Kildall(int maxVisits) {
		this.maxVisits = maxVisits;
	}

	/* Empty when some node is due for more than maxVisits visits before the facts stabilize. */
	Optional<LatticeElement> computePost(ProcCfg cfg, LatticeElement initial, Transfer tf) {
		List<Instr> nodes = cfg.getNodes();
		if (nodes.isEmpty()) return Optional.of(initial);

		Set<Instr> heads = Collections.newSetFromMap(new IdentityHashMap<>());
		heads.addAll(cfg.getHeads());
		Map<Instr, LatticeElement> OUT = new LinkedHashMap<>();

		Deque<Instr> wl = new ArrayDeque<>(cfg.getHeads());
		Set<Instr> queued = Collections.newSetFromMap(new IdentityHashMap<>());
		queued.addAll(wl);

		Map<Instr, Integer> visits = new IdentityHashMap<>();
		while (!wl.isEmpty()) {
			Instr n = wl.removeFirst();
			queued.remove(n);
			if (visits.merge(n, 1, Integer::sum) > maxVisits) return Optional.empty();

			LatticeElement in = heads.contains(n) ? initial : null;
			for (Instr p : cfg.getPredsOf(n)) {
				LatticeElement o = OUT.get(p);
				if (o == null) continue;
				in = (in == null) ? o : in.join_op(o);
			}
			if (in == null) continue;

			LatticeElement newOut = tf.apply(in, n);
			LatticeElement old = OUT.get(n);
			if (old == null || !newOut.equals(old)) {
				OUT.put(n, newOut);
				for (Instr s : cfg.getSuccsOf(n)) {
					if (queued.add(s)) wl.addLast(s);
				}
			}
		}

		LatticeElement post = null;
		for (Instr t : cfg.getTails()) {
			LatticeElement o = OUT.get(t);
			if (o == null) continue;
			post = (post == null) ? o : post.join_op(o);
		}
		// no exit reached, e.g. a body that always throws or loops forever
		if (post == null) {
			for (LatticeElement o : OUT.values()) post = (post == null) ? o : post.join_op(o);
		}
		return Optional.of(post == null ? initial : post);
	}
}
