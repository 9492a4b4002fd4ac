package com.codeoptimizer.parser;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import com.codeoptimizer.plugins.FileType;
import com.codeoptimizer.plugins.java.JavaSourceParser;
import com.codeoptimizer.plugins.javascript.JavaScriptParser;
import com.codeoptimizer.util.LoggerUtil;

/**
 * Parsers by file type.
 */
public class ParserRegistry {
    private static final Logger logger = LoggerUtil.getLogger(ParserRegistry.class);

    private final Map<FileType, SyntaxParser> parsers = new ConcurrentHashMap<>();

    /**
     * Registry with the Java and JavaScript parsers.
     */
    public static ParserRegistry withDefaults() {
        ParserRegistry registry = new ParserRegistry();
        registry.register(new JavaSourceParser());
        registry.register(new JavaScriptParser());
        return registry;
    }

    public void register(SyntaxParser parser) {
        for (FileType type : parser.getSupportedTypes()) {
            parsers.put(type, parser);
            logger.fine("Registered parser " + parser.getClass().getSimpleName() + " for " + type.getDescription());
        }
    }

    public Optional<SyntaxParser> forType(FileType type) {
        return Optional.ofNullable(parsers.get(type));
    }

    public boolean supports(FileType type) {
        return parsers.containsKey(type);
    }
}
