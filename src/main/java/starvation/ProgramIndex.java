package starvation;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/* The procedures of the program under analysis, by name and by declaring class. */
public interface ProgramIndex {
	Optional<ProcDesc> getProcDesc(Procname procname);

	List<Procname> getMethods(String className);

	Collection<ProcDesc> getProcedures();
}
