package com.codeoptimizer.dependency;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.codeoptimizer.parser.SourceMask;
import com.codeoptimizer.plugins.FileType;

/**
 * Extracts static import specifiers from source text. Comments are ignored.
 */
public class ImportExtractor {
    private static final List<Pattern> JS_IMPORTS = List.of(
            Pattern.compile("\\bimport\\s+(?:[\\w*${}\\s,]+?\\s+from\\s+)?['\"]([^'\"\\n]+)['\"]"),
            Pattern.compile("\\bexport\\s+(?:type\\s+)?(?:\\*(?:\\s+as\\s+[\\w$]+)?|\\{[^}]*\\})\\s+from\\s+['\"]([^'\"\\n]+)['\"]"),
            Pattern.compile("\\brequire\\s*\\(\\s*['\"]([^'\"\\n]+)['\"]\\s*\\)"),
            Pattern.compile("\\bimport\\s*\\(\\s*['\"]([^'\"\\n]+)['\"]\\s*\\)"));

    private static final Pattern JAVA_IMPORT = Pattern.compile(
            "^\\s*import\\s+(static\\s+)?([\\w.]+?)(\\.\\*)?\\s*;", Pattern.MULTILINE);
    private static final Pattern JAVA_PACKAGE = Pattern.compile("^\\s*package\\s+([\\w.]+)\\s*;", Pattern.MULTILINE);

    /**
     * Relative specifiers (starting with '.') of a JavaScript-family file, in source order, without duplicates.
     */
    public List<String> extractRelativeSpecifiers(String text, FileType type) {
        String code = SourceMask.maskComments(text, type);
        List<String> specifiers = new ArrayList<>();

        for (Pattern pattern : JS_IMPORTS) {
            Matcher matcher = pattern.matcher(code);
            while (matcher.find()) {
                String specifier = matcher.group(1).trim();
                if (specifier.startsWith(".") && !specifiers.contains(specifier)) {
                    specifiers.add(specifier);
                }
            }
        }
        return specifiers;
    }

    /**
     * Imported type names of a Java file. Wildcard imports are skipped.
     */
    public List<String> extractJavaImports(String text) {
        String code = SourceMask.maskComments(text, FileType.JAVA);
        List<String> imports = new ArrayList<>();

        Matcher matcher = JAVA_IMPORT.matcher(code);
        while (matcher.find()) {
            if (matcher.group(3) != null) {
                continue;
            }
            String name = matcher.group(2);
            if (!imports.contains(name)) {
                imports.add(name);
            }
        }
        return imports;
    }

    public Optional<String> extractJavaPackage(String text) {
        Matcher matcher = JAVA_PACKAGE.matcher(SourceMask.maskComments(text, FileType.JAVA));
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
