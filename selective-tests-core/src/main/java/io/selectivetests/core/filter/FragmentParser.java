package io.selectivetests.core.filter;

import io.selectivetests.core.ConfigurationException;
import io.selectivetests.core.config.SelectiveTestsConfig;
import io.selectivetests.core.output.Output;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the raw {@code --tests} argument into name fragments.
 *
 * <p>The argument is either an inline list such as {@code "FooTest,Bar\,Baz"} or the path of a
 * text file holding such a list, which gets around command line length limits. Fragments are
 * split on the configured delimiter; the escape character makes the next character literal.
 */
public final class FragmentParser {

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private static final Logger log = LoggerFactory.getLogger(FragmentParser.class);

    private final SelectiveTestsConfig config;
    private final Output output;

    public FragmentParser(SelectiveTestsConfig config, Output output) {
        this.config = config;
        this.output = output;
    }

    /**
     * Parses the argument into an ordered list of trimmed, non-blank fragments.
     *
     * @throws ConfigurationException if no fragment remains, or the fragment file cannot be read
     */
    public List<String> parse(String argument) {
        List<String> fragments = new ArrayList<>();

        if (argument != null && !argument.isBlank()) {
            String effective = argument;
            if (argument.endsWith(config.fragmentFileExtension())) {
                effective = readFragmentFile(argument);
                output.information("Read specified cases from " + argument + " successfully");
            }

            for (String token : tokenize(effective, config.delimiter(), config.escapeCharacter())) {
                if (!token.isBlank()) {
                    fragments.add(token.strip());
                }
            }
        }

        if (fragments.isEmpty()) {
            throw new ConfigurationException(
                    "The --tests argument requires one or more specific test names or their substrings. "
                    + "Examples: --tests TestMethod1, --tests TestMethod1,method2");
        }

        log.debug("Parsed {} name fragments: {}", fragments.size(), fragments);
        return fragments;
    }

    /**
     * Splits {@code input} on {@code delimiter}. An {@code escape} character is dropped and the
     * character after it is kept literally; a trailing escape is dropped. A trailing empty token
     * is not produced.
     */
    static List<String> tokenize(String input, char delimiter, char escape) {
        List<String> tokens = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        boolean escaping = false;

        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (escaping) {
                buffer.append(c);
                escaping = false;
            } else if (c == escape) {
                escaping = true;
            } else if (c == delimiter) {
                tokens.add(buffer.toString());
                buffer.setLength(0);
            } else {
                buffer.append(c);
            }
        }
        if (buffer.length() > 0) {
            tokens.add(buffer.toString());
        }
        return tokens;
    }

    private String readFragmentFile(String argument) {
        try {
            String content = Files.readString(Path.of(argument), StandardCharsets.UTF_8);
            // A leading byte order mark is not part of the first name
            return content.startsWith(BYTE_ORDER_MARK) ? content.substring(1) : content;
        } catch (IOException | InvalidPathException e) {
            log.error("Failed to read test names from {}: {}", argument, e.getMessage());
            throw new ConfigurationException("Unable to read test names from " + argument, e);
        }
    }
}
