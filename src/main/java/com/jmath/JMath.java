package com.jmath;

import com.jmath.interpreting.Evaluator;
import com.jmath.interpreting.InfixPrinter;
import com.jmath.json.NodeJsonReader;
import com.jmath.json.NodeJsonWriter;
import com.jmath.nodes.DepthLimit;
import com.jmath.nodes.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "jmath", mixinStandardHelpOptions = true, version = "1.0",
         description = "Inspect and evaluate expression trees stored as JSON")
public class JMath implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(JMath.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Input JSON tree (default: stdin)")
    private File inputFile;

    @Option(names = {"-j", "--json"}, description = "Print the tree as JSON instead of infix text")
    private boolean jsonOutput = false;

    @Option(names = {"-c", "--compact-output"}, description = "Compact JSON output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-x", "--complexity"}, description = "Print the complexity score of the tree")
    private boolean complexity = false;

    @Option(names = {"-t", "--terminal"}, description = "Print whether the root is a terminal node")
    private boolean terminal = false;

    @Option(names = {"-e", "--evaluate"}, description = "Evaluate the tree numerically")
    private boolean evaluate = false;

    @Option(names = {"-D", "--bind"}, paramLabel = "NAME=VALUE",
            description = "Variable value used by --evaluate (repeatable)")
    private Map<String, Double> bindings = new LinkedHashMap<>();

    @Option(names = "--max-depth", description = "Nesting limit for evaluation and printing (default: ${DEFAULT-VALUE})")
    private int maxDepth = DepthLimit.DEFAULT_MAX_DEPTH;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JMath()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            NodeJsonReader reader = new NodeJsonReader();
            Node tree;
            try (InputStream input = inputFile != null ? new FileInputStream(inputFile) : System.in) {
                tree = reader.parse(input);
            }

            boolean printTree = !(complexity || terminal || evaluate) || jsonOutput;
            if (printTree) {
                if (jsonOutput) {
                    out.println(new NodeJsonWriter(!compactOutput, maxDepth).write(tree));
                } else {
                    out.println(new InfixPrinter(maxDepth).format(tree));
                }
            }
            if (complexity) {
                out.println(tree.complexity());
            }
            if (terminal) {
                out.println(tree.isTerminal());
            }
            if (evaluate) {
                log.debug("Evaluating with bindings {}", bindings);
                out.println(tree.evaluate(new Evaluator(bindings, maxDepth)));
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.debug("jmath failed", e);
            PrintWriter err = spec.commandLine().getErr();
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
