package org.sysmlite.cli.commands;

import com.typesafe.config.ConfigException;
import org.sysmlite.api.IModelFrontend;
import org.sysmlite.api.ParseResult;
import org.sysmlite.cli.CommandLineInterface;
import org.sysmlite.config.FrontendOptions;
import org.sysmlite.config.OutputFormat;
import org.sysmlite.frontend.AstJsonExporter;
import org.sysmlite.frontend.AstPrinter;
import org.sysmlite.frontend.ModelFrontend;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "parse", description = "Parses a model file and prints its syntax tree.")
public class ParseCommand implements Callable<Integer> {

    /** Exit code when parsing stopped on an error. The partial tree is still printed. */
    public static final int EXIT_PARSE_ERROR = 1;
    /** Exit code when the file cannot be read. */
    public static final int EXIT_IO_ERROR = 2;

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the model file.")
    private File file;

    @Option(names = "--format", description = "Output format: tree, json (default: from configuration)")
    private String format;

    @Option(names = "--pretty", negatable = true, description = "Indent JSON output (default: from configuration)")
    private Boolean pretty;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        FrontendOptions options;
        try {
            options = FrontendOptions.fromConfig(parent.getConfig());
        } catch (ConfigException e) {
            throw new ParameterException(spec.commandLine(), "Invalid configuration: " + e.getMessage(), e);
        }
        OutputFormat outputFormat = options.format();
        if (format != null) {
            try {
                outputFormat = OutputFormat.fromName(format);
            } catch (IllegalArgumentException e) {
                throw new ParameterException(spec.commandLine(), e.getMessage(), e);
            }
        }
        boolean indent = pretty != null ? pretty : options.pretty();

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        IModelFrontend frontend = new ModelFrontend();
        ParseResult result;
        try {
            result = frontend.parseFile(file.toPath());
        } catch (IOException e) {
            err.println("Cannot read " + file + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        if (outputFormat == OutputFormat.JSON) {
            out.println(new AstJsonExporter(indent).export(result.root()));
        } else {
            out.print(AstPrinter.print(result.root()));
        }
        out.flush();

        if (!result.diagnostics().isEmpty()) {
            result.diagnostics().forEach(err::println);
        }
        return result.hasErrors() ? EXIT_PARSE_ERROR : 0;
    }
}
