package org.literalscan;

import org.literalscan.astnode.Node;
import org.literalscan.astvisitor.JsonVisitor;
import org.literalscan.runtime.LiteralSyntaxException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point: scans one literal and prints its node tree.
 * <p>
 * A {@code .literalscan.yaml} file in the working directory is applied before the
 * command line switches.
 */
public class Main {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        ArgumentParser.ScannerOptions options;
        try {
            options = parseOptions(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        if (options.helpRequested) {
            System.out.println("literalscan " + Configuration.version);
            System.out.print(ArgumentParser.helpText());
            return 0;
        }

        try {
            Node node = LiteralScanner.scan(options);
            System.out.print(options.jsonOutput ? JsonVisitor.toJson(node, true) + "\n" : node.toString());
            return 0;
        } catch (LiteralSyntaxException e) {
            System.err.print(e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static ArgumentParser.ScannerOptions parseOptions(String[] args) {
        Path defaultConfig = Paths.get(Configuration.configFileName);
        if (!Files.isRegularFile(defaultConfig)) {
            return ArgumentParser.parseArguments(args);
        }
        String[] withConfig = new String[args.length + 2];
        withConfig[0] = "--config";
        withConfig[1] = defaultConfig.toString();
        System.arraycopy(args, 0, withConfig, 2, args.length);
        return ArgumentParser.parseArguments(withConfig);
    }
}
