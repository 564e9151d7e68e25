package org.literalscan;

import org.literalscan.parser.EscapeTable;
import org.literalscan.parser.Whitespace;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.literalscan.runtime.ScalarUtils.printable;

/**
 * The ArgumentParser class is responsible for parsing command-line arguments
 * and configuring the ScannerOptions accordingly.
 */
public class ArgumentParser {

    /**
     * Parses the command-line arguments and returns a ScannerOptions object
     * configured based on the provided arguments.
     *
     * @param args The command-line arguments to parse.
     * @return A ScannerOptions object with settings derived from the arguments.
     * @throws IllegalArgumentException on an unknown switch or a missing switch value
     */
    public static ScannerOptions parseArguments(String[] args) {
        ScannerOptions parsedArgs = new ScannerOptions();
        boolean readingArgv = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (readingArgv || !arg.startsWith("-") || arg.equals("-")) {
                processNonSwitchArgument(parsedArgs, arg);
                continue;
            }
            switch (arg) {
                case "--":
                    readingArgv = true;
                    break;
                case "-e":
                    parsedArgs.code = requireValue(args, ++i, arg);
                    parsedArgs.fileName = "-e";
                    break;
                case "--kind":
                    parsedArgs.kind = LiteralKind.forName(requireValue(args, ++i, arg));
                    break;
                case "--quotes":
                    parsedArgs.quotes = requireValue(args, ++i, arg);
                    break;
                case "--ws":
                    parsedArgs.whitespaceName = requireValue(args, ++i, arg);
                    parsedArgs.whitespace = Whitespace.forName(parsedArgs.whitespaceName);
                    break;
                case "--config":
                    // switches after --config override the file, switches before it do not
                    parsedArgs.configFile = requireValue(args, ++i, arg);
                    ScannerConfig.loadFile(parsedArgs.configPath()).applyTo(parsedArgs);
                    break;
                case "--json":
                    parsedArgs.jsonOutput = true;
                    break;
                case "--debug":
                    parsedArgs.debugEnabled = true;
                    break;
                case "-h":
                case "--help":
                    parsedArgs.helpRequested = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unrecognized switch: " + arg + "  (-h will show valid options)");
            }
        }
        return parsedArgs;
    }

    private static String requireValue(String[] args, int index, String arg) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + arg);
        }
        return args[index];
    }

    /**
     * A non-switch argument names the file holding the literal, unless -e gave the code.
     */
    private static void processNonSwitchArgument(ScannerOptions parsedArgs, String arg) {
        if (parsedArgs.code != null) {
            throw new IllegalArgumentException("Unexpected argument: " + arg);
        }
        parsedArgs.fileName = arg;
        try {
            parsedArgs.code = arg.equals("-")
                    ? new String(System.in.readAllBytes(), StandardCharsets.UTF_8)
                    : Files.readString(Paths.get(arg), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to read file " + arg, e);
        }
    }

    public static String helpText() {
        return """
                Usage: literalscan [switches] [--] [file | -]
                  -e CODE          scan CODE instead of a file
                  --kind KIND      string, unicode, number, match or replace (default: unicode)
                  --quotes CHARS   allowed quotes for --kind string (default: "')
                  --ws POLICY      whitespace policy: ascii, unicode or none (default: ascii)
                  --config FILE    YAML file with quotes, whitespace and escapes
                  --json           print the literal as JSON
                  --debug          print scanner debug output
                  -h, --help       show this help
                """;
    }

    /**
     * Options for one scanner run, filled from the command line and the optional YAML
     * configuration file.
     */
    public static class ScannerOptions {
        public boolean debugEnabled = false;
        public boolean jsonOutput = false;
        public boolean helpRequested = false;
        public LiteralKind kind = LiteralKind.UNICODE;
        public String quotes = "\"'";
        public String whitespaceName = "ascii";
        public Whitespace whitespace = Whitespace.ASCII;
        public EscapeTable escapes = EscapeTable.DEFAULT;
        public String configFile = null;
        public String code = null;
        public String fileName = null;

        public Path configPath() {
            return configFile == null ? null : Paths.get(configFile);
        }

        @Override
        public String toString() {
            return "ScannerOptions{\n" +
                    "    debugEnabled=" + debugEnabled + ",\n" +
                    "    jsonOutput=" + jsonOutput + ",\n" +
                    "    kind=" + kind + ",\n" +
                    "    quotes=" + printable(quotes) + ",\n" +
                    "    whitespace=" + whitespaceName + ",\n" +
                    "    escapes=" + escapes + ",\n" +
                    "    configFile=" + printable(configFile) + ",\n" +
                    "    code='" + (code != null ? printable(code) : "null") + "',\n" +
                    "    fileName='" + printable(fileName) + "'\n" +
                    "}";
        }
    }
}
