package com.codeoptimizer.plugins.javascript;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Builds the scripts the validation gate runs inside the sandbox. Free identifiers of the code
 * under test resolve to globals or to undefined, so fragments can run outside their file.
 */
public final class ScriptHarness {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Pattern EXPORT_PREFIX = Pattern.compile("^export\\s+(?:default\\s+)?");
    private static final Pattern ARROW_START = Pattern.compile("^(?:async\\s+)?(?:\\([^()]*\\)|[A-Za-z_$][\\w$]*)\\s*=>");
    private static final Pattern FUNCTION_KEYWORD_BEFORE = Pattern.compile("(?:async\\s+)?function\\s*\\*?\\s*$");
    private static final int KEYWORD_LOOKBEHIND = 40;

    private static final String SCOPE =
            "var __scope = new Proxy(Object.create(null), {\n" +
            "  has: function (t, k) { return typeof k === 'string' && k.indexOf('__') !== 0; },\n" +
            "  get: function (t, k) {\n" +
            "    if (k === Symbol.unscopables) { return undefined; }\n" +
            "    return (k in t) ? t[k] : globalThis[k];\n" +
            "  }\n" +
            "});\n";

    private static final String DESCRIBE =
            "var __describe = function (v) {\n" +
            "  var type = typeof v;\n" +
            "  if (v === undefined) { return { type: 'undefined' }; }\n" +
            "  if (type === 'number' && !isFinite(v)) { return { type: 'number', value: String(v) }; }\n" +
            "  if (type === 'function' || type === 'symbol' || type === 'bigint') { return { type: type, value: String(v) }; }\n" +
            "  try { return { type: type, value: JSON.parse(JSON.stringify(v)) }; }\n" +
            "  catch (e) { return { type: type, value: String(v) }; }\n" +
            "};\n";

    private ScriptHarness() {
    }

    /**
     * The function source in a form that can stand in expression position, or empty when the
     * function is a method or accessor that cannot be evaluated on its own.
     *
     * @param text  full file text
     * @param start start offset of the function within the text
     * @param source function text, possibly already edited
     */
    public static Optional<String> functionExpression(String text, int start, String source) {
        String trimmed = EXPORT_PREFIX.matcher(source.trim()).replaceFirst("");
        if (trimmed.startsWith("function") || trimmed.startsWith("async") || ARROW_START.matcher(trimmed).find()) {
            return Optional.of(trimmed);
        }

        String before = text.substring(Math.max(0, start - KEYWORD_LOOKBEHIND), start);
        Matcher keyword = FUNCTION_KEYWORD_BEFORE.matcher(before);
        if (keyword.find()) {
            return Optional.of(before.substring(keyword.start()) + source);
        }
        return Optional.empty();
    }

    /**
     * Defines the function and calls it once without arguments.
     */
    public static String invokeOnce(String functionExpression) {
        return "(function () {\n" +
                SCOPE +
                "var __fn;\n" +
                "with (__scope) { __fn = (" + functionExpression + "\n); }\n" +
                "__fn();\n" +
                "return 'ok';\n" +
                "})()";
    }

    /**
     * Runs top-level statements in a function scope of their own.
     */
    public static String runStatements(String statements) {
        return "(function () {\n" +
                SCOPE +
                "with (__scope) {\n" + statements + "\n}\n" +
                "return 'ok';\n" +
                "})()";
    }

    /**
     * Calls the function with every argument vector and returns a JSON array of
     * {@code {ok, value}} or {@code {ok: false, error}} entries, one per case.
     */
    public static String testCases(String functionExpression, List<List<Object>> cases) {
        return "(function () {\n" +
                SCOPE +
                DESCRIBE +
                "var __fn;\n" +
                "with (__scope) { __fn = (" + functionExpression + "\n); }\n" +
                "var __cases = " + _toJson(cases) + ";\n" +
                "var __results = [];\n" +
                "for (var __i = 0; __i < __cases.length; __i++) {\n" +
                "  try { __results.push({ ok: true, value: __describe(__fn.apply(null, __cases[__i])) }); }\n" +
                "  catch (e) { __results.push({ ok: false, error: String(e) }); }\n" +
                "}\n" +
                "return JSON.stringify(__results);\n" +
                "})()";
    }

    /**
     * Argument vectors for a function of the given arity: zeros, ascending numbers, letters,
     * numeric strings, small arrays and nulls. A function without parameters gets one empty vector.
     */
    public static List<List<Object>> argumentVectors(int arity) {
        if (arity <= 0) {
            return List.of(List.of());
        }

        List<List<Object>> vectors = new ArrayList<>();
        List<Object> zeros = new ArrayList<>();
        List<Object> ascending = new ArrayList<>();
        List<Object> letters = new ArrayList<>();
        List<Object> numericStrings = new ArrayList<>();
        List<Object> arrays = new ArrayList<>();

        for (int i = 0; i < arity; i++) {
            zeros.add(0);
            ascending.add(i + 1);
            letters.add(String.valueOf((char) ('a' + i % 26)));
            numericStrings.add(String.valueOf(i + 1));
            arrays.add(List.of(1, 2, 3));
        }

        vectors.add(zeros);
        vectors.add(ascending);
        vectors.add(letters);
        vectors.add(numericStrings);
        vectors.add(arrays);
        vectors.add(new ArrayList<>(Collections.nCopies(arity, null)));
        return vectors;
    }

    private static String _toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize test cases", e);
        }
    }
}
