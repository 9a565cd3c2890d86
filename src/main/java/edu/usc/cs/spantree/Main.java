package edu.usc.cs.spantree;

import edu.usc.cs.spantree.cmd.CycleCommand;
import edu.usc.cs.spantree.cmd.SpanningTreeCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.lang.reflect.Method;

/**
 * This class offers CLI interface for the project
 */
public class Main {

    public static final Logger LOG = LoggerFactory.getLogger(Main.class);

    /**
     * known sub-commands
     */
    enum Cmd {
        cycle("Checks whether the graph has a cycle", CycleCommand.class),
        spantree("Draws a random spanning tree of the graph", SpanningTreeCommand.class);

        private final String description;
        private final Class<?> clazz;

        Cmd(String description, Class<?> clazz) {
            this.description = description;
            this.clazz = clazz;
        }

        public String getDescription() {
            return description;
        }

        public Class<?> getClazz() {
            return clazz;
        }
    }

    static Cmd getCommand(String cmdName) {
        try {
            return Cmd.valueOf(cmdName);
        } catch (IllegalArgumentException e) {
            System.err.println("Unknown command " + cmdName);
            printUsage(System.err);
            System.exit(2);
            throw new IllegalArgumentException("Unknown command " + cmdName, e);
        }
    }

    public static void printUsage(PrintStream out) {
        out.println("Usage : Main <CMD> [ARGS]");
        out.println("The following command(CMD)s are available");
        for (Cmd cmd : Cmd.values()) {
            out.printf("%12s :  %s", cmd.name(), cmd.getDescription());
            out.println();
        }
        out.println();
        out.flush();
    }

    public static void main(String[] args) throws Exception {
        if (args.length == 0) {
            printUsage(System.out);
            System.exit(1);
        }
        Cmd cmd = getCommand(args[0]);  // the first argument has to be positional param
        String[] subCmdArgs = new String[args.length - 1];
        System.arraycopy(args, 1, subCmdArgs, 0, args.length - 1);

        LOG.debug("Running {} with {} args", cmd, subCmdArgs.length);
        Method mainMethod = cmd.getClazz().getDeclaredMethod("main", args.getClass());
        mainMethod.invoke(null, (Object) subCmdArgs);
    }
}
