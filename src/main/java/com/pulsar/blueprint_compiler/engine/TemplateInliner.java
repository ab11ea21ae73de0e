package com.pulsar.blueprint_compiler.engine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a control-flow node's source template into inline code.
 *
 * <pre>
 *   fn branch(condition: bool) {          if node_cmp_result {
 *       if condition {                        print_string("yes");
 *           exec_output!("True");    ──▶  } else {
 *       } else {                              print_string("no");
 *           exec_output!("False");        }
 *       }
 *   }
 * </pre>
 *
 * Parameters are substituted in the template first; execution blocks are spliced in afterwards
 * so generated downstream code is never rewritten.
 */
public final class TemplateInliner {

    private static final Pattern EXEC_OUTPUT = Pattern.compile("exec_output!\\s*\\(\\s*\"([^\"]*)\"\\s*\\)");
    private static final Pattern EXEC_STATEMENT = Pattern.compile("^(\\s*)exec_output!\\s*\\(\\s*\"([^\"]*)\"\\s*\\)\\s*;?\\s*$");

    private static final Pattern IDENTIFIER_OR_PATH = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(::[A-Za-z_][A-Za-z0-9_]*)*(\\.[A-Za-z0-9_]+)*");
    private static final Pattern NUMBER = Pattern.compile("[0-9][0-9_]*(\\.[0-9]+)?([a-z][0-9a-z]*)?");
    private static final Pattern CALL_HEAD = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(::[A-Za-z_][A-Za-z0-9_]*)*!?\\(");

    private TemplateInliner() {
    }

    /**
     * @param execBlocks code per execution output label, generated at indent 0
     * @param params     expression per parameter name
     * @param indentUnit one level of indentation, used inside expression-position blocks
     */
    public static String inline(String source, Map<String, String> execBlocks,
                                Map<String, String> params, String indentUnit) {
        String body = stripFunctionWrapper(source);
        body = substituteParameters(body, params);
        return spliceExecOutputs(body, execBlocks, indentUnit);
    }

    // ── Wrapper ───────────────────────────────────────────────────────────────

    /** Body of {@code fn name(...) { body }}, dedented. Text without a wrapper is only dedented. */
    public static String stripFunctionWrapper(String source) {
        String trimmed = source.strip();
        String body = source;
        if (trimmed.startsWith("fn ") || trimmed.startsWith("pub fn ")) {
            int open = trimmed.indexOf('{');
            int close = trimmed.lastIndexOf('}');
            if (open < 0 || close < open) {
                throw new IllegalArgumentException("Malformed function template: " + firstLine(trimmed));
            }
            body = trimmed.substring(open + 1, close);
        }
        return dedent(body);
    }

    static String dedent(String text) {
        List<String> lines = new ArrayList<>(List.of(text.split("\n", -1)));
        while (!lines.isEmpty() && lines.get(0).isBlank()) lines.remove(0);
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) lines.remove(lines.size() - 1);

        int common = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line.isBlank()) continue;
            common = Math.min(common, leadingWhitespace(line).length());
        }
        if (common == Integer.MAX_VALUE) common = 0;

        List<String> out = new ArrayList<>(lines.size());
        for (String line : lines) {
            out.add(line.isBlank() ? "" : line.substring(common).stripTrailing());
        }
        return String.join("\n", out);
    }

    // ── Parameters ────────────────────────────────────────────────────────────

    /**
     * Replaces free uses of parameter names. String literals, comments, field accesses
     * ({@code .name}), path segments ({@code a::name}, {@code name::x}) and macro names
     * ({@code name!}) are left alone.
     */
    public static String substituteParameters(String code, Map<String, String> params) {
        if (params.isEmpty()) return code;
        StringBuilder out = new StringBuilder(code.length());
        int i = 0;
        int n = code.length();
        while (i < n) {
            char c = code.charAt(i);
            if (c == '"') {
                int end = skipString(code, i);
                out.append(code, i, end);
                i = end;
            } else if (c == '/' && i + 1 < n && code.charAt(i + 1) == '/') {
                int end = code.indexOf('\n', i);
                end = end < 0 ? n : end;
                out.append(code, i, end);
                i = end;
            } else if (Character.isLetter(c) || c == '_') {
                int end = i;
                while (end < n && (Character.isLetterOrDigit(code.charAt(end)) || code.charAt(end) == '_')) end++;
                String word = code.substring(i, end);
                String replacement = params.get(word);
                if (replacement != null && isFreeUse(code, i, end)) {
                    out.append(atomic(replacement) ? replacement : "(" + replacement + ")");
                } else {
                    out.append(word);
                }
                i = end;
            } else if (Character.isDigit(c)) {
                // Keep numeric literals with suffixes (10i64) intact
                int end = i;
                while (end < n && (Character.isLetterOrDigit(code.charAt(end)) || code.charAt(end) == '_')) end++;
                out.append(code, i, end);
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static boolean isFreeUse(String code, int start, int end) {
        int before = start - 1;
        while (before >= 0 && code.charAt(before) == ' ') before--;
        if (before >= 0 && code.charAt(before) == '.' && !(before > 0 && code.charAt(before - 1) == '.')) return false;
        if (start >= 2 && code.startsWith("::", start - 2)) return false;
        if (end < code.length() && code.charAt(end) == '!') return false;
        return !code.startsWith("::", end);
    }

    /** True when {@code expression} can be dropped into any operator context without parentheses. */
    static boolean atomic(String expression) {
        String e = expression.strip();
        if (IDENTIFIER_OR_PATH.matcher(e).matches() || NUMBER.matcher(e).matches()) return true;
        if (e.startsWith("\"") && skipString(e, 0) == e.length()) return true;
        if (e.startsWith("(") && closingParen(e, 0) == e.length() - 1) return true;

        Matcher head = CALL_HEAD.matcher(e);
        if (head.lookingAt()) {
            int close = closingParen(e, head.end() - 1);
            if (close < 0) return false;
            String rest = e.substring(close + 1);
            return rest.isEmpty() || rest.matches("(\\.[A-Za-z0-9_]+)+");
        }
        return false;
    }

    // ── Execution outputs ─────────────────────────────────────────────────────

    /**
     * Replaces {@code exec_output!("Label")}. On a line of its own the placeholder becomes the
     * block's lines at the placeholder's indentation (nothing if the block is empty); inside an
     * expression it becomes {@code { block }}. Labels without a block count as empty.
     */
    public static String spliceExecOutputs(String code, Map<String, String> execBlocks, String indentUnit) {
        List<String> out = new ArrayList<>();
        for (String line : code.split("\n", -1)) {
            Matcher statement = EXEC_STATEMENT.matcher(line);
            if (statement.matches()) {
                String indent = statement.group(1);
                String block = execBlocks.getOrDefault(statement.group(2), "");
                for (String blockLine : block.split("\n")) {
                    if (!blockLine.isBlank()) out.add(indent + blockLine);
                }
                continue;
            }
            out.add(replaceExpressionPlaceholders(line, execBlocks, indentUnit));
        }
        return String.join("\n", out);
    }

    /**
     * Labels whose placeholder is a statement outside every brace of the template body. Their
     * blocks land in the scope that encloses the node, as in {@code sequence} or a loop's
     * {@code Completed}.
     */
    public static Set<String> topLevelOutputs(String source) {
        Set<String> labels = new LinkedHashSet<>();
        int depth = 0;
        for (String line : stripFunctionWrapper(source).split("\n", -1)) {
            Matcher statement = EXEC_STATEMENT.matcher(line);
            if (statement.matches()) {
                if (depth == 0) labels.add(statement.group(2));
                continue;
            }
            depth += braceBalance(line);
        }
        return labels;
    }

    private static int braceBalance(String line) {
        int balance = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                i = skipString(line, i) - 1;
            } else if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                break;
            } else if (c == '{') {
                balance++;
            } else if (c == '}') {
                balance--;
            }
        }
        return balance;
    }

    private static String replaceExpressionPlaceholders(String line, Map<String, String> execBlocks, String indentUnit) {
        Matcher matcher = EXEC_OUTPUT.matcher(line);
        if (!matcher.find()) return line;

        String indent = leadingWhitespace(line);
        StringBuilder result = new StringBuilder();
        int last = 0;
        do {
            result.append(line, last, matcher.start());
            result.append(blockExpression(execBlocks.getOrDefault(matcher.group(1), ""), indent, indentUnit));
            last = matcher.end();
        } while (matcher.find());
        result.append(line.substring(last));
        return result.toString();
    }

    private static String blockExpression(String block, String indent, String indentUnit) {
        List<String> lines = block.lines().filter(l -> !l.isBlank()).toList();
        if (lines.isEmpty()) return "{}";
        if (lines.size() == 1) return "{ " + lines.get(0).strip() + " }";
        StringBuilder sb = new StringBuilder("{\n");
        for (String l : lines) {
            sb.append(indent).append(indentUnit).append(l).append('\n');
        }
        return sb.append(indent).append('}').toString();
    }

    // ── Scanning helpers ──────────────────────────────────────────────────────

    // Index just past the string literal starting at start
    private static int skipString(String code, int start) {
        int i = start + 1;
        while (i < code.length()) {
            char c = code.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"') return i + 1;
            i++;
        }
        return code.length();
    }

    private static int closingParen(String e, int open) {
        int depth = 0;
        for (int i = open; i < e.length(); i++) {
            char c = e.charAt(i);
            if (c == '"') {
                i = skipString(e, i) - 1;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    private static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) i++;
        return line.substring(0, i);
    }

    private static String firstLine(String text) {
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl);
    }
}
