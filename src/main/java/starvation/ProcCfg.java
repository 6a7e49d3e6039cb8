package starvation;

import java.util.List;

/* Control-flow graph of one procedure body, with the shape of Soot's UnitGraph. */
public interface ProcCfg {
	List<Instr> getNodes();

	List<Instr> getPredsOf(Instr n);

	List<Instr> getSuccsOf(Instr n);

	// entry nodes
	List<Instr> getHeads();

	// exit nodes
	List<Instr> getTails();
}
