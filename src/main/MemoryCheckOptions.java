package main;

import java.util.ArrayList;
import java.util.List;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

/**
 * Command line options for {@link MemoryCheckMain}
 */
public final class MemoryCheckOptions {

    /**
     * IR documents to analyze
     */
    @Parameter(names = { "-ir" }, description = "JSON IR file written by the front end, may be repeated.")
    private List<String> irFiles = new ArrayList<>();

    /**
     * Explicit entry points
     */
    @Parameter(
        names = { "-entries", "-e" },
        description = "Comma separated dotted path suffixes of the entry functions, e.g. \"demo.main,Buffer.new\". If absent the functions with no local callers are used.")
    private List<String> entries = new ArrayList<>();

    /**
     * Debug topics to print
     */
    @Parameter(
        names = { "-debug", "-DBG" },
        description = "Comma separated debug topics: entries, reachable, body, assign, call, pfg, worklist, check or all. Only printed with -openDebug.")
    private List<String> debugTopics = new ArrayList<>();

    /**
     * Flag for initializing verbose logging
     */
    @Parameter(names = { "-openDebug" }, description = "If set, initialize verbose logging.")
    private boolean openDebug = false;

    /**
     * JSON output file
     */
    @Parameter(names = { "-out" }, description = "Write the findings as JSON to this file.")
    private String outputFile;

    /**
     * Directory for graphviz output
     */
    @Parameter(
        names = { "-writeDotPFG" },
        description = "Write a graphviz .dot file of the pointer flow graph of each entry point into this directory.")
    private String dotDirectory;

    /**
     * Flag for printing usage information
     */
    @Parameter(names = { "-h", "-help", "-usage", "--help" }, description = "Print usage information")
    private boolean help = false;

    /**
     * Parse the command line
     *
     * @param args command line arguments
     * @return parsed options
     * @throws ParameterException if the arguments are not valid options
     */
    public static MemoryCheckOptions getOptions(String[] args) {
        MemoryCheckOptions o = new MemoryCheckOptions();
        JCommander jc = new JCommander();
        jc.addObject(o);
        jc.parse(args);
        return o;
    }

    /**
     * Get the IR files to analyze
     *
     * @return paths of the IR files
     * @throws ParameterException if none was given
     */
    public List<String> getIRFiles() {
        if (irFiles.isEmpty()) {
            throw new ParameterException("Must specify at least one IR file with -ir.");
        }
        return irFiles;
    }

    public List<String> getEntries() {
        return entries;
    }

    public List<String> getDebugTopics() {
        return debugTopics;
    }

    public boolean isOpenDebug() {
        return openDebug;
    }

    /**
     * Get the JSON output file
     *
     * @return file name or null if results should not be written as JSON
     */
    public String getOutputFile() {
        return outputFile;
    }

    /**
     * Get the directory for graphviz output
     *
     * @return directory or null if no graphs should be written
     */
    public String getDotDirectory() {
        return dotDirectory;
    }

    public boolean shouldPrintUsage() {
        return help;
    }

    /**
     * Print the usage information
     *
     * @return usage text
     */
    public static String getUsage() {
        StringBuilder sb = new StringBuilder();
        MemoryCheckOptions o = new MemoryCheckOptions();
        JCommander jc = new JCommander(o);
        jc.setProgramName("memcheck");
        jc.getUsageFormatter().usage(sb);
        return sb.toString();
    }
}
