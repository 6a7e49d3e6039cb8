// This file has the helper functions needed for output formatting and printing method bodies

package starvation;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import soot.Body;
import soot.NormalUnitPrinter;
import soot.SootMethod;
import soot.Unit;
import soot.UnitPrinter;
import soot.jimple.Stmt;

public class Base {

	// Logger for logging messages
	public class SLF4J {
		public static Logger LOGGER = LoggerFactory.getLogger(SLF4J.class);
	}

	// Protected functions for formatting output
	protected static String formatIssueHeader(IssueLog.Issue issue) {
		return issue.getLoc() + ": " + issue.getLevel() + ": " + issue.getIssueType() + ": "
			+ issue.getProcname() + ": " + issue.getMessage();
	}

	protected static String formatTraceLine(TraceElem elem, String prefix) {
		return prefix + "  ".repeat(elem.getDepth()) + elem.getLoc() + ": " + elem.getDescription();
	}

	/* One header line per issue, its trace indented below. */
	protected static List<String> formatOutputData(IssueLog log, String prefix) {
		List<String> outputlines = new ArrayList<>();
		for (IssueLog.Issue issue : log.getIssues()) {
			outputlines.add(prefix + formatIssueHeader(issue));
			for (TraceElem elem : issue.getTrace()) {
				outputlines.add(formatTraceLine(elem, prefix + "    "));
			}
		}
		return outputlines;
	}

	protected static List<String> formatOutputData(IssueLog log) {
		return formatOutputData(log, "");
	}

	// Public functions for printing method info
	public static void printUnit(int lineno, Body b, Unit u) {
		UnitPrinter up = new NormalUnitPrinter(b);
		u.toString(up);
		String linenostr = String.format("%02d", lineno) + ": ";
		System.out.println(linenostr + up.toString());
	}

	public static void printInfo(SootMethod entryMethod) {
		if (!entryMethod.isPhantom() && entryMethod.isConcrete()) {
			Body body = entryMethod.retrieveActiveBody();

			int lineno = 0;
			for (Unit u : body.getUnits()) {
				if (!(u instanceof Stmt)) {
					continue;
				}
				printUnit(lineno, body, u);
				lineno++;
			}
		}
	}
}
