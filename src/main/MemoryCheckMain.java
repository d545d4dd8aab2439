package main;

import ir.FunctionId;
import ir.IRReader;
import ir.Program;

import java.io.IOException;
import java.util.Set;

import org.json.JSONException;

import results.MemoryCheckResult;
import signatures.LibrarySignatures;
import util.Logger;
import analysis.EntryPoints;
import analysis.MemoryCheck;

import com.beust.jcommander.ParameterException;

/**
 * Detect use-after-free and double-free bugs in the program described by the given IR files, see usage
 */
public class MemoryCheckMain {

    /**
     * Exit status when findings were reported
     */
    public static final int EXIT_FINDINGS = 1;
    /**
     * Exit status for bad options or unreadable input
     */
    public static final int EXIT_ERROR = 2;

    /**
     * Run the analysis and exit with a nonzero status if any bug was found
     *
     * @param args options and parameters see usage (pass in "-h") for details
     */
    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Run the analysis
     *
     * @param args options and parameters
     * @return process exit status: 0 for no findings, {@link #EXIT_FINDINGS} or {@link #EXIT_ERROR}
     */
    public static int run(String[] args) {
        MemoryCheckOptions options;
        Program program;
        try {
            options = MemoryCheckOptions.getOptions(args);
            if (options.shouldPrintUsage()) {
                System.err.println(MemoryCheckOptions.getUsage());
                return 0;
            }
            Logger.init(options.isOpenDebug(), options.getDebugTopics());
            program = new Program(IRReader.read(options.getIRFiles()));
        }
        catch (ParameterException e) {
            System.err.println(e.getMessage());
            System.err.println(MemoryCheckOptions.getUsage());
            return EXIT_ERROR;
        }
        catch (IOException | JSONException e) {
            System.err.println("Could not read IR: " + e.getMessage());
            return EXIT_ERROR;
        }

        MemoryCheckResult result;
        try {
            // function bodies are parsed when first reached
            Set<FunctionId> entries = EntryPoints.select(program, options.getEntries());
            Logger.println("Analyzing " + entries.size() + " entry points");

            MemoryCheck check = new MemoryCheck(program, new LibrarySignatures());
            check.setDotDirectory(options.getDotDirectory());
            result = check.run(entries);
        }
        catch (JSONException e) {
            System.err.println("Could not read IR: " + e.getMessage());
            return EXIT_ERROR;
        }
        result.print(System.out);

        if (options.getOutputFile() != null) {
            try {
                result.writeJSONToFile(options.getOutputFile());
                System.err.println("JSON written to: " + options.getOutputFile());
            }
            catch (IOException e) {
                System.err.println("Could not write JSON to file, " + options.getOutputFile() + ", " + e.getMessage());
                return EXIT_ERROR;
            }
        }
        return result.isEmpty() ? 0 : EXIT_FINDINGS;
    }
}
