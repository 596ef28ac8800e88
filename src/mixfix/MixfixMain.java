package mixfix;

import mixfix.config.IOErrorIssue;
import mixfix.config.OperatorTableLoader;
import mixfix.config.OptionParsingPass;
import mixfix.config.WhileLoadingTable;
import mixfix.errors.Issue;
import mixfix.errors.TopLevelIssueContext;
import mixfix.formatters.ParseNodeFormattingVisitor;
import mixfix.lexer.TokenReader;
import mixfix.model.tree.ParseNode;
import mixfix.parser.ExpressionBatchParser;
import mixfix.parser.MixfixParser;
import mixfix.registry.OperatorRegistry;
import mixfix.registry.RegistrySnapshot;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Logger;

public class MixfixMain {
	private final String[] cmdArgs;
	private static Logger logger;

	public MixfixMain(String[] args) {
		cmdArgs = args;
		// the parent of every logger in the project
		logger = Logger.getLogger("mixfix");
	}

	public static void main(String[] args) {
		if (new MixfixMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
		}
	}

	// Top-level workhorse method.
	public boolean run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging.
		MixfixOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
		if (opts == null) {
			return true;
		}
		if (ctx.hasErrors()) {
			System.err.println(ctx.format());
			opts.printHelp();
			return false;
		}

		logger.info("Loading operator table");
		Path tablePath = Paths.get(opts.tableFilePath);
		OperatorRegistry registry = new OperatorRegistry();
		RegistrySnapshot snapshot = null;
		try {
			new OperatorTableLoader(registry).load(tablePath);
			snapshot = registry.snapshot();
		} catch (Issue issue) {
			ctx.withContext(new WhileLoadingTable(tablePath)).error(issue);
		}
		if (checkErrors(ctx)) {
			return false;
		}

		logger.info("Compiling grammar");
		ExpressionBatchParser parser = new ExpressionBatchParser(new MixfixParser(snapshot));

		for (String expressionFile : opts.expressionFilePaths) {
			logger.info("Parsing expressions from \"" + expressionFile + "\"");
			Path path = Paths.get(expressionFile);
			String text;
			try {
				text = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
			} catch (IOException e) {
				ctx.error(new IOErrorIssue(e));
				continue;
			}
			// one expression per non-blank line
			List<ParseNode> trees = parser.parseLines(ctx, snapshot.getScope(opts.scope), new TokenReader(path), text);
			for (ParseNode tree : trees) {
				if (opts.display) {
					System.out.println(ParseNodeFormattingVisitor.format(tree, snapshot.getGrammar()));
				} else {
					System.out.println(tree);
				}
			}
		}
		return !checkErrors(ctx);
	}

	private static boolean checkErrors(TopLevelIssueContext ctx) {
		if (ctx.hasErrors()) {
			System.err.println(ctx.format());
			return true;
		}
		return false;
	}
}
