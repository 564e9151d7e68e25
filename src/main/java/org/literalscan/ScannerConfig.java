package org.literalscan;

import org.literalscan.parser.EscapeTable;
import org.literalscan.parser.Whitespace;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Scanner settings read from a YAML document:
 * <pre>
 * kind: string            # string, unicode, number, match or replace
 * quotes: "\"'`"
 * whitespace: unicode     # ascii, unicode or none
 * debug: false
 * defaultEscapes: true    # start from the built-in escape table
 * escapes:
 *   e: 27                 # code point
 *   0: "\0"               # or a one-character string
 * </pre>
 * All keys are optional; absent keys leave the options untouched.
 */
public final class ScannerConfig {
    private String kind;
    private String quotes;
    private String whitespace;
    private Boolean debug;
    private EscapeTable escapes;

    private ScannerConfig() {
    }

    public static ScannerConfig loadFile(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to read config file " + path, e);
        }
    }

    /**
     * Parses a configuration document.
     *
     * @param reader the YAML source
     * @param label  name used in error messages
     * @throws IllegalArgumentException if the document is not valid YAML or holds a bad value
     */
    public static ScannerConfig load(Reader reader, String label) {
        LoadSettings settings = LoadSettings.builder()
                .setLabel(label)
                .setAllowDuplicateKeys(false)
                .build();
        Object document;
        try {
            document = new Load(settings).loadFromReader(reader);
        } catch (YamlEngineException e) {
            throw new IllegalArgumentException("Invalid config " + label + ": " + e.getMessage(), e);
        }

        ScannerConfig config = new ScannerConfig();
        if (document == null) {
            return config;
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Config " + label + " must be a mapping");
        }

        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
                case "kind" -> config.kind = requireString(key, value);
                case "quotes" -> config.quotes = requireString(key, value);
                case "whitespace" -> config.whitespace = requireString(key, value);
                case "debug" -> config.debug = requireBoolean(key, value);
                case "defaultEscapes", "escapes" -> {
                    // handled below, the two keys depend on each other
                }
                default -> throw new IllegalArgumentException("Unknown config key: " + key);
            }
        }

        boolean inheritDefaults = !map.containsKey("defaultEscapes") || requireBoolean("defaultEscapes", map.get("defaultEscapes"));
        Object escapes = map.get("escapes");
        if (escapes != null || !inheritDefaults) {
            config.escapes = parseEscapes(escapes, inheritDefaults);
        }
        return config;
    }

    private static EscapeTable parseEscapes(Object value, boolean inheritDefaults) {
        Map<Integer, Integer> escapes = new HashMap<>(inheritDefaults ? EscapeTable.DEFAULT.asMap() : Map.of());
        if (value != null) {
            if (!(value instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException("Config key escapes must be a mapping");
            }
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                int letter = singleCodePoint("escapes key", String.valueOf(entry.getKey()));
                Object replacement = entry.getValue();
                int codePoint;
                if (replacement instanceof Number number) {
                    // large YAML integers load as Long or BigInteger
                    if (!(number instanceof Integer) || !Character.isValidCodePoint(number.intValue())) {
                        throw new IllegalArgumentException("Invalid code point for escape " + entry.getKey() + ": " + number);
                    }
                    codePoint = number.intValue();
                } else if (replacement instanceof String string) {
                    codePoint = singleCodePoint("escape " + entry.getKey(), string);
                } else {
                    throw new IllegalArgumentException("Escape " + entry.getKey() + " must map to a character or a code point");
                }
                escapes.put(letter, codePoint);
            }
        }
        return EscapeTable.of(escapes);
    }

    private static int singleCodePoint(String what, String text) {
        if (text.isEmpty() || text.codePointCount(0, text.length()) != 1) {
            throw new IllegalArgumentException(what + " must be a single character: " + text);
        }
        return text.codePointAt(0);
    }

    private static String requireString(String key, Object value) {
        if (!(value instanceof String string)) {
            throw new IllegalArgumentException("Config key " + key + " must be a string");
        }
        return string;
    }

    private static boolean requireBoolean(String key, Object value) {
        if (!(value instanceof Boolean bool)) {
            throw new IllegalArgumentException("Config key " + key + " must be true or false");
        }
        return bool;
    }

    /**
     * Copies the values present in this configuration into the options.
     */
    public void applyTo(ArgumentParser.ScannerOptions options) {
        if (kind != null) {
            options.kind = LiteralKind.forName(kind);
        }
        if (quotes != null) {
            options.quotes = quotes;
        }
        if (whitespace != null) {
            options.whitespace = Whitespace.forName(whitespace);
            options.whitespaceName = whitespace;
        }
        if (debug != null) {
            options.debugEnabled = debug;
        }
        if (escapes != null) {
            options.escapes = escapes;
        }
    }

    public String getQuotes() {
        return quotes;
    }

    public EscapeTable getEscapes() {
        return escapes;
    }
}
