package com.stylgebra;

import com.stylgebra.adapt.SymbolicAdapter;
import com.stylgebra.adapt.SymbolicExprParser;
import com.stylgebra.node.Node;
import com.stylgebra.render.Renderer;
import com.stylgebra.rules.RuleTable;
import com.stylgebra.rules.RuleTableReader;
import com.stylgebra.style.Style;
import com.stylgebra.text.Text;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "stylgebra", mixinStandardHelpOptions = true, version = "1.0",
         description = "Render a symbolic expression as LaTeX, styled by a rule table")
public class Stylgebra implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Stylgebra.class);

    @Parameters(index = "0", arity = "0..1", description = "Expression JSON file (default: stdin)")
    private File inputFile;

    @Option(names = {"-r", "--rules"}, description = "JSON file mapping selector chains to styles")
    private File rulesFile;

    @Option(names = {"-s", "--style"}, description = "JSON style for the root expression")
    private String style;

    @Option(names = {"-d", "--document"}, description = "Write math output between $ delimiters, as in running text")
    private boolean document = false;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Stylgebra()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            Node expression = readExpression();

            RuleTableReader reader = new RuleTableReader();
            RuleTable rules = null;
            if (rulesFile != null) {
                try (InputStream in = new FileInputStream(rulesFile)) {
                    rules = reader.read(in);
                }
            }
            Style rootStyle = style != null ? reader.readStyle(style) : null;

            Text result = new Renderer().renderText(expression, rootStyle, rules);
            if (document && result instanceof Text.Math) {
                out.println("$" + result.content() + "$");
            } else {
                out.println(result.content());
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.debug("Rendering failed", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private Node readExpression() throws IOException {
        SymbolicExprParser parser = new SymbolicExprParser();
        SymbolicAdapter adapter = new SymbolicAdapter();
        if (inputFile == null) {
            return adapter.adapt(parser.parse(System.in));
        }
        try (InputStream in = new FileInputStream(inputFile)) {
            return adapter.adapt(parser.parse(in));
        }
    }
}
