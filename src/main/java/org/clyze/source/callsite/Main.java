package org.clyze.source.callsite;

import java.io.File;
import java.nio.file.Paths;
import java.util.StringJoiner;
import java.util.function.Function;
import org.apache.commons.cli.*;
import org.clyze.source.callsite.ir.UnitId;
import org.clyze.source.callsite.target.AssignedNames;

/** The main application class: resolves one execution position given on the command line. */
public class Main {

    public static void main(String[] args) {
        run(args);
    }

    /**
     * Main entry point.
     * @param args    command-line arguments
     * @return        the resolved call site, or null if nothing was resolved
     */
    public static CallSite run(String[] args) {
        return run(args, CallSiteResolver::new);
    }

    static CallSite run(String[] args, Function<ResolverOptions, CallSiteResolver> resolvers) {
        Options options = new Options();

        Option srcOpt = new Option("s", "source", true, "The source file (.java or .groovy).");
        srcOpt.setRequired(true);
        srcOpt.setArgName("PATH");
        options.addOption(srcOpt);

        Option classOpt = new Option("c", "class", true, "The binary name of the executing class.");
        classOpt.setRequired(true);
        classOpt.setArgName("CLASS");
        options.addOption(classOpt);

        Option methodOpt = new Option("m", "method", true, "The name of the executing method.");
        methodOpt.setRequired(true);
        methodOpt.setArgName("METHOD");
        options.addOption(methodOpt);

        Option descOpt = new Option(null, "descriptor", true, "The JVM descriptor of the executing method.");
        descOpt.setArgName("DESCRIPTOR");
        options.addOption(descOpt);

        Option lineOpt = new Option("l", "line", true, "The executing source line.");
        lineOpt.setRequired(true);
        lineOpt.setArgName("LINE");
        options.addOption(lineOpt);

        Option offsetOpt = new Option("o", "offset", true, "The bytecode index of the executing instruction.");
        offsetOpt.setRequired(true);
        offsetOpt.setArgName("BCI");
        options.addOption(offsetOpt);

        Option cpOpt = new Option("cp", "classpath", true, "Extra classpath entries for recompilation.");
        cpOpt.setArgName("PATH");
        cpOpt.setArgs(Option.UNLIMITED_VALUES);
        options.addOption(cpOpt);

        Option assignedOpt = new Option("a", "assigned", false, "Print the names assigned the call's value.");
        options.addOption(assignedOpt);

        Option singleOpt = new Option(null, "allow-single", false, "Accept bindings of a single name.");
        options.addOption(singleOpt);

        Option loopsOpt = new Option(null, "allow-loops", false, "Accept loop variables as bindings.");
        options.addOption(loopsOpt);

        Option debugOpt = new Option("d", "debug", false, "Enable debug mode.");
        options.addOption(debugOpt);

        Option versionOpt = new Option("v", "version", false, "Print version.");
        options.addOption(versionOpt);

        Option helpOpt = new Option("h", "help", false, "Print help.");
        options.addOption(helpOpt);

        if (args.length == 0) {
            printUsage(options);
            return null;
        }
        String version1 = "-" + versionOpt.getOpt();
        String version2 = "--" + versionOpt.getLongOpt();
        String help1 = "-" + helpOpt.getOpt();
        String help2 = "--" + helpOpt.getLongOpt();
        for (String arg : args)
            if (arg.equals(version1) || arg.equals(version2)) {
                System.out.println(getVersionInfo());
                return null;
            } else if (arg.equals(help1) || arg.equals(help2)) {
                printUsage(options);
                return null;
            }

        CommandLineParser parser = new GnuParser();
        boolean debug = false;
        try {
            CommandLine cli = parser.parse(options, args);
            debug = cli.hasOption(debugOpt.getOpt());
            boolean assigned = cli.hasOption(assignedOpt.getOpt());
            if (missingOption(cli, singleOpt, assignedOpt) || missingOption(cli, loopsOpt, assignedOpt))
                return null;
            File srcFile = new File(cli.getOptionValue(srcOpt.getOpt()));
            if (!srcFile.exists()) {
                System.err.println("ERROR: path does not exist: " + srcFile);
                return null;
            }
            int line, offset;
            try {
                line = Integer.parseInt(cli.getOptionValue(lineOpt.getOpt()));
                offset = Integer.parseInt(cli.getOptionValue(offsetOpt.getOpt()));
            } catch (NumberFormatException ex) {
                System.err.println("ERROR: bad number: " + ex.getMessage());
                return null;
            }

            ResolverOptions resolverOptions = ResolverOptions.defaults().setDebug(debug);
            String[] classpath = cli.getOptionValues(cpOpt.getOpt());
            if (classpath != null)
                for (String entry : classpath)
                    resolverOptions.addClasspathEntry(entry);
            UnitId unit = new UnitId(cli.getOptionValue(classOpt.getOpt()),
                    cli.getOptionValue(methodOpt.getOpt()), cli.getOptionValue(descOpt.getLongOpt()));
            ExecutionPosition position = new ExecutionPosition(Paths.get(srcFile.getPath()), line, offset, unit);

            CallSiteResolver resolver = resolvers.apply(resolverOptions);
            CallSite site = resolver.resolveCallSite(position);
            System.out.println("Call: " + site.getCallSource());
            if (assigned) {
                AssignedNames names = site.assignedNames(cli.hasOption(singleOpt.getLongOpt()), cli.hasOption(loopsOpt.getLongOpt()));
                System.out.println("Names: " + String.join(", ", names.names));
            }
            return site;
        } catch (ParseException e) {
            System.err.println("ERROR: " + e.getMessage());
            printUsage(options);
            return null;
        } catch (ResolutionException | IllegalStateException e) {
            System.err.println("ERROR: " + e.getMessage());
            if (debug)
                e.printStackTrace();
            return null;
        }
    }

    private static String getVersionInfo() {
        String version = Main.class.getPackage().getImplementationVersion();
        return "source-callsite-resolver " + (version == null ? "(development version)" : version);
    }

    private static void printUsage(Options options) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.setWidth(100);
        formatter.printHelp("source-callsite-resolver [OPTION]...", options);
    }

    private static boolean missingOption(CommandLine cli, Option opt, Option depOpt) {
        for (String optLabel : new String[] {opt.getLongOpt(), opt.getOpt()})
            if (optLabel != null)
                if (cli.hasOption(optLabel))
                    if (!cli.hasOption(depOpt.getOpt()) && !cli.hasOption(depOpt.getLongOpt())) {
                        StringJoiner sj = new StringJoiner("/");
                        if (depOpt.getOpt() != null)
                            sj.add("-" + depOpt.getOpt());
                        if (depOpt.getLongOpt() != null)
                            sj.add("--" + depOpt.getLongOpt());
                        System.err.println("ERROR: --" + opt.getLongOpt() + " requires " + sj);
                        return true;
                    }
        return false;
    }
}
