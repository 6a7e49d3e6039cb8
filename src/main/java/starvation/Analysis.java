/* Runs the starvation and deadlock analysis over the classes of a directory.
 * Arguments : <ClassRootDirectory> <TargetPackagePrefix>
 * ClassRootDirectory is the package root (e.g. target/classes), not a package subdirectory.
 *
 * References:
 *		https://github.com/soot-oss/soot/wiki/Tutorials
 *		https://fbinfer.com/docs/checker-starvation
 */

package starvation;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import soot.Scene;
import soot.options.Options;
import starvation.soot.JavaModels;
import starvation.soot.SootAnnotations;
import starvation.soot.SootProgram;

public class Analysis extends Base {
	public static final String OUTPUT_FILE = "starvation_issues.txt";

	/* Summaries bottom-up, then reports. The returned log is sorted by location. */
	public static IssueLog doAnalysis(ProgramIndex program, CallClassifier models, AnnotationResolver annotations, Config config) {
		InMemorySummaryStore summaries = new InMemorySummaryStore();
		new StarvationAnalyzer(models, annotations, summaries, config).analyzeAll(program);
		SLF4J.LOGGER.info("Computed {} summaries", summaries.size());
		return new StarvationReporter(program, summaries, annotations, config).reportAll();
	}

	public static Path writeOutput(IssueLog log, Config config) throws IOException {
		Path outDir = Path.of(config.getOutputDir());
		Path outFile = outDir.resolve(OUTPUT_FILE);
		Files.createDirectories(outDir);
		Files.write(outFile, formatOutputData(log));
		return outFile;
	}

	/* Loads the classes under a package root directory into a fresh Soot scene. */
	public static void setupSoot(String classDirectory) {
		List<String> procDir = new ArrayList<String>();
		procDir.add(classDirectory);

		// Set Soot options
		soot.G.reset();
		Options.v().set_process_dir(procDir);
		Options.v().set_prepend_classpath(true);  // Allow Soot to find classes
		// The directory is the package root, so class names keep their packages
		Options.v().set_soot_classpath(new File(classDirectory).getAbsolutePath());
		Options.v().set_src_prec(Options.src_prec_only_class);
		Options.v().set_whole_program(true);
		Options.v().set_allow_phantom_refs(true);
		Options.v().set_output_format(Options.output_format_none);
		Options.v().set_keep_line_number(true);

		Scene.v().loadNecessaryClasses();
	}

	public static void main(String[] args) throws Exception {
		String targetDirectory, packagePrefix;
		if (args.length == 0) {
			// Default values if no arguments are given for the analysis
			targetDirectory = "target/classes";
			packagePrefix = "test";
		}
		else if (args.length == 2) {
			targetDirectory = args[0];
			packagePrefix = args[1];
		}
		else {
			throw new IllegalArgumentException("Invalid number of arguments. Expected 0 or 2 arguments: <ClassRootDirectory> <TargetPackagePrefix>");
		}
		Config config = Config.load();

		setupSoot(targetDirectory);

		SLF4J.LOGGER.info("Target Directory: " + targetDirectory);
		SLF4J.LOGGER.info("Package Prefix: " + packagePrefix);
		SLF4J.LOGGER.info("Deduplicate: {}, threads: {}, max iterations: {}",
			config.isDeduplicate(), config.getThreads(), config.getMaxIterations());

		SootProgram program = SootProgram.load(packagePrefix);
		if (config.isPrintBodies()) {
			for (ProcDesc pd : program.getProcedures()) {
				// Print the method body
				System.out.println("\n\nMethod: " + pd.getProcname());
				program.getSootMethod(pd.getProcname()).ifPresent(Base::printInfo);
			}
		}

		JavaModels models = new JavaModels(program, config);
		SootAnnotations annotations = new SootAnnotations(program);
		IssueLog log = doAnalysis(program, models, annotations, config);

		for (String line : formatOutputData(log)) System.out.println(line);
		Path out = writeOutput(log, config);
		SLF4J.LOGGER.info("Wrote " + log.size() + " issue(s) to " + out);
	}
}
