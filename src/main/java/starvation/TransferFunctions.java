package starvation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/* Maps each instruction of one procedure to a StarvationDomain transformation. */
final class TransferFunctions {
	private static final Logger LOGGER = LoggerFactory.getLogger(TransferFunctions.class);

	private final ProcDesc procDesc;
	private final CallClassifier models;
	private final SummaryStore summaries;

	TransferFunctions(ProcDesc procDesc, CallClassifier models, SummaryStore summaries) {
		this.procDesc = procDesc;
		this.models = models;
		this.summaries = summaries;
	}

	/*
	 * Locks rooted at locals can never alias across procedures, so only paths rooted at a
	 * formal or a global are kept. Class literals stand for the class object.
	 */
	Lock getLockPath(Exp e) {
		if (e instanceof Exp.Access a) {
			Exp.Var base = a.getBase();
			if (base.isGlobal() || procDesc.isFormal(base)) return Lock.of(a);
			return null;
		}
		if (e instanceof Exp.ClassLiteral c) return Lock.ofClass(c.getClassName());
		return null;
	}

	private List<Lock> getLockPaths(List<Exp> exps, Instr.Call call) {
		List<Lock> out = new ArrayList<>(exps.size());
		for (Exp e : exps) {
			Lock l = getLockPath(e);
			if (l != null) out.add(l);
			else LOGGER.debug("{}: ignoring lock expression {} in {}", procDesc.getProcname(), e, call);
		}
		return out;
	}

	StarvationDomain execInstr(StarvationDomain astate, Instr instr) {
		if (!(instr instanceof Instr.Call call) || !call.isDirect()) {
			// assignments, assumes, metadata and indirect calls
			return astate;
		}
		Procname procname = procDesc.getProcname();
		Procname callee = call.getCallee();
		List<Exp> actuals = call.getActuals();
		Location loc = call.getLoc();

		LockEffect effect = models.getLockEffect(callee, actuals);
		if (effect instanceof LockEffect.Acquire a) {
			return astate.acquire(procname, loc, getLockPaths(a.getLocks(), call));
		}
		if (effect instanceof LockEffect.Release r) {
			return astate.release(getLockPaths(r.getLocks(), call));
		}
		if (effect instanceof LockEffect.GuardConstruct gc) {
			Lock lock = getLockPath(gc.getLock());
			if (lock == null) {
				LOGGER.debug("{}: couldn't parse lock in guard constructor {}", procname, call);
				return astate;
			}
			return astate.addGuard(procname, loc, gc.getGuard(), lock, gc.isAcquireNow());
		}
		if (effect instanceof LockEffect.GuardLock gl) {
			return astate.lockGuard(procname, loc, gl.getGuard());
		}
		if (effect instanceof LockEffect.GuardUnlock gu) {
			return astate.unlockGuard(gu.getGuard());
		}
		if (effect instanceof LockEffect.GuardDestroy gd) {
			return astate.removeGuard(gd.getGuard());
		}
		if (effect instanceof LockEffect.LockedIfTrue || effect instanceof LockEffect.GuardLockedIfTrue) {
			return astate;
		}

		if (models.shouldSkipAnalysis(callee, actuals)) {
			return astate;
		}
		if (models.isSynchronizedLibraryCall(callee)) {
			// synchronized on the receiver, body not visible
			List<Lock> locks = actuals.isEmpty() ? List.of() : getLockPaths(actuals.subList(0, 1), call);
			return astate.acquire(procname, loc, locks).release(locks);
		}
		// starvation only matters for Java; elsewhere we are after deadlocks
		if (procname.isJava()) {
			if (models.isUiThreadModel(callee)) {
				return astate.setOnUiThread(loc, UIThreadExplanation.callsModeled(procname, callee));
			}
			if (models.isStrictModeViolation(callee, actuals)) {
				return astate.strictModeCall(callee, loc);
			}
			Optional<Severity> sev = models.mayBlock(callee, actuals);
			if (sev.isPresent()) {
				return astate.blockingCall(callee, sev.get(), loc);
			}
		}
		return doCall(astate, callee, loc);
	}

	private StarvationDomain doCall(StarvationDomain astate, Procname callee, Location loc) {
		Optional<Summary> calleeSummary = summaries.read(procDesc.getProcname(), callee);
		return calleeSummary.map(s -> astate.integrateSummary(s, callee, loc)).orElse(astate);
	}
}
