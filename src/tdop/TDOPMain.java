package tdop;

import tdop.calc.CalcContext;
import tdop.calc.CalcGrammars;
import tdop.errors.ExpressionIssue;
import tdop.errors.OptionIssue;
import tdop.errors.TopLevelIssueContext;
import tdop.eval.EvaluationException;
import tdop.formatters.IndentingWriter;
import tdop.formatters.TokenTreeFormatter;
import tdop.formatters.ValueFormatter;
import tdop.grammar.GrammarException;
import tdop.parser.Parser;
import tdop.parser.Token;

import java.io.IOException;
import java.io.PrintStream;
import java.io.StringWriter;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line front end: parses and evaluates calc expressions.
 *
 * <pre>
 * tdop [-c config.json] [-g calc-1.0] [-t] [-s] [-f file] expression...
 * </pre>
 */
public class TDOPMain {
	private final String[] cmdArgs;
	private final PrintStream out;
	private final PrintStream err;
	private static final Logger logger = Logger.getLogger("TDOPMain");

	public TDOPMain(String[] args, PrintStream out, PrintStream err) {
		this.cmdArgs = args;
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		if (new TDOPMain(args, System.out, System.err).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	private TDOPOptions parseOptions(TopLevelIssueContext ctx) {
		TDOPOptions opts = new TDOPOptions(cmdArgs);
		try {
			opts.parse();
		} catch (TDOPOptionException e) {
			ctx.error(new OptionIssue(e.getMsg()));
		}
		// set the logger's log level based on command line arguments
		if (opts.logLvlQuiet) {
			logger.setLevel(Level.WARNING);
		} else if (opts.logLvlVerbose) {
			logger.setLevel(Level.FINE);
		} else {
			logger.setLevel(Level.INFO);
		}
		return opts;
	}

	// Top-level workhorse method.
	public boolean run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		TDOPOptions opts = parseOptions(ctx);
		if (ctx.hasErrors()) {
			err.println(ctx.format());
			opts.printHelp(err);
			return false;
		}
		if (opts.version) {
			out.println("tdop version " + TDOPOptions.VERSION);
			return true;
		}
		if (opts.help) {
			opts.printHelp(out);
			return true;
		}

		Parser<CalcContext> parser;
		try {
			parser = CalcGrammars.parser(opts.grammar);
		} catch (GrammarException e) {
			ctx.error(new OptionIssue(e.getMsg()));
			err.println(ctx.format());
			return false;
		}
		parser.setStaticEvaluation(opts.staticEvaluation);
		logger.info("Using grammar " + parser.getGrammar().getName());

		CalcContext context = new CalcContext(opts.variables);
		List<String> expressions = opts.expressions;
		for (int i = 0; i < expressions.size(); i++) {
			String expression = expressions.get(i);
			logger.info("Parsing expression " + (i + 1));
			try {
				Token<CalcContext> root = parser.parse(expression);
				if (opts.printTree) {
					out.println(formatTree(root));
				}
				if (opts.printSource) {
					out.println(root.source());
				}
				logger.fine("Evaluating " + root.tree());
				out.println(formatValue(root, context));
			} catch (TDOPException e) {
				ctx.error(new ExpressionIssue(i + 1, expression, e));
			} catch (StackOverflowError e) {
				ctx.error(new ExpressionIssue(i + 1, expression, EvaluationException.tooDeeplyNested(e)));
			}
		}

		if (ctx.hasErrors()) {
			logger.severe("found issues");
			err.println(ctx.format());
			return false;
		}
		return true;
	}

	private static String formatTree(Token<?> root) {
		StringWriter w = new StringWriter();
		try {
			new TokenTreeFormatter(new IndentingWriter(w)).format(root);
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return w.toString();
	}

	private static String formatValue(Token<CalcContext> root, CalcContext context) {
		StringWriter w = new StringWriter();
		try {
			new ValueFormatter(w).format(root.select(context));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return w.toString();
	}
}
