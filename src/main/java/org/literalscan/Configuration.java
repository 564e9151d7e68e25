package org.literalscan;

/**
 * Central configuration class for the literal scanner.
 */
public final class Configuration {

    public static final String version = "1.0.0";
    public static final String configFileName = ".literalscan.yaml";

    // Prevent instantiation
    private Configuration() {
    }
}
