package com.xmile.equation;

import com.xmile.equation.IdentifierException.Kind;
import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A validated XMILE name. The normalized form maps underscores and stray whitespace to single spaces
 * while keeping case, so {@code Cash_Balance} and {@code "Cash Balance"} name the same variable.
 * Equality ignores case and how the name was originally spelled.
 */
public final class Identifier {

    private static final Logger LOGGER = Logger.getLogger(Identifier.class.getName());

    private static final Set<String> KEYWORDS =
            Set.of("and", "or", "not", "mod", "if", "then", "else");

    // Stored in normalized form: underscores already mapped to spaces.
    private static final Set<String> RESERVED =
            Set.of(
                    "and", "or", "not", "mod", "if", "then", "else", "std",
                    "abs", "sin", "cos", "tan", "arcsin", "arccos", "arctan",
                    "asin", "acos", "atan", "atan2", "sinh", "cosh", "tanh",
                    "asinh", "acosh", "atanh", "sqrt", "exp", "ln", "log", "log10",
                    "pow", "power", "min", "max", "sum", "mean", "median", "stddev",
                    "time", "dt", "starttime", "stoptime", "timestep",
                    "delay", "delay1", "delay3", "delayn", "smth1", "smth3", "smthn",
                    "trend", "forcst", "if then else", "pulse", "pulse train", "ramp", "step",
                    "lookup", "with lookup", "random", "normal", "poisson", "int", "round",
                    "safediv", "previous", "self", "init");

    private final String raw;
    private final String normalized;
    private final String compareKey;
    private final List<Namespace> namespacePath;
    private final boolean quoted;

    private Identifier(
            String raw, String normalized, List<Namespace> namespacePath, boolean quoted) {
        this.raw = raw;
        this.normalized = normalized;
        this.compareKey = foldCase(normalized);
        this.namespacePath = List.copyOf(namespacePath);
        this.quoted = quoted;
    }

    public static Identifier parse(String text) throws IdentifierException {
        return parse(text, IdentifierOptions.defaults());
    }

    public static Identifier parse(String text, IdentifierOptions options)
            throws IdentifierException {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(options, "options");
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            throw new IdentifierException(Kind.EMPTY, text, "Identifier is empty");
        }
        int dot = lastDotOutsideQuotes(trimmed);
        if (dot >= 0) {
            return parseQualified(trimmed, dot, options);
        }
        if (isFullyQuoted(trimmed)) {
            return parseQuoted(trimmed);
        }
        return parseUnquoted(trimmed, options);
    }

    /** Returns true when the text is one of the reserved keywords or built-in function names. */
    public static boolean isReserved(String text) {
        return RESERVED.contains(foldCase(normalize(text)));
    }

    public String getRaw() {
        return raw;
    }

    public String getNormalized() {
        return normalized;
    }

    public String getCompareKey() {
        return compareKey;
    }

    public List<Namespace> getNamespacePath() {
        return namespacePath;
    }

    public boolean isQuoted() {
        return quoted;
    }

    public boolean isQualified() {
        return !namespacePath.isEmpty();
    }

    public String getQualifiedName() {
        if (namespacePath.isEmpty()) {
            return normalized;
        }
        return Namespace.asPrefix(namespacePath) + "." + normalized;
    }

    /** The form used inside equation text: bare when the lexer would read it back as one token. */
    public String toExpressionText() {
        String name = needsQuoting(normalized) ? quote(normalized) : normalized;
        if (namespacePath.isEmpty()) {
            return name;
        }
        return Namespace.asPrefix(namespacePath) + "." + name;
    }

    private static Identifier parseQualified(String text, int dot, IdentifierOptions options)
            throws IdentifierException {
        String namespacePart = text.substring(0, dot);
        String namePart = text.substring(dot + 1);
        if (namespacePart.isBlank() || namePart.isBlank()) {
            throw new IdentifierException(
                    Kind.INVALID_QUALIFIED_NAME, text, "Invalid qualified name: " + text);
        }
        List<Namespace> path = Namespace.fromPath(namespacePart);
        for (Namespace namespace : path) {
            if (namespace.getName().isBlank()) {
                throw new IdentifierException(
                        Kind.INVALID_QUALIFIED_NAME, text, "Invalid qualified name: " + text);
            }
        }
        Identifier name = parse(namePart, options);
        return new Identifier(text, name.normalized, path, name.quoted);
    }

    private static Identifier parseQuoted(String text) throws IdentifierException {
        String inner = text.substring(1, text.length() - 1);
        StringBuilder unescaped = new StringBuilder(inner.length());
        for (int i = 0; i < inner.length(); i++) {
            char ch = inner.charAt(i);
            if (ch != '\\') {
                unescaped.append(ch);
                continue;
            }
            if (i + 1 >= inner.length()) {
                throw new IdentifierException(
                        Kind.INVALID_CHARACTER, text, "Dangling escape in identifier: " + text);
            }
            char escaped = inner.charAt(++i);
            switch (escaped) {
                case '"' -> unescaped.append('"');
                case '\\' -> unescaped.append('\\');
                case 'n' -> unescaped.append('\n');
                default -> throw new IdentifierException(
                        Kind.INVALID_CHARACTER,
                        text,
                        "Unsupported escape sequence \\" + escaped + " in identifier: " + text);
            }
        }
        String normalized = normalize(unescaped.toString());
        if (normalized.isEmpty()) {
            throw new IdentifierException(Kind.EMPTY, text, "Identifier is empty");
        }
        return new Identifier(text, normalized, List.of(), true);
    }

    private static Identifier parseUnquoted(String text, IdentifierOptions options)
            throws IdentifierException {
        char first = text.charAt(0);
        if (first == '_'
                || (!options.isAllowDigit() && isAsciiDigit(first))
                || (!options.isAllowDollar() && first == '$')) {
            throw new IdentifierException(
                    Kind.INVALID_FIRST_CHARACTER,
                    text,
                    "Invalid first character '" + first + "' in identifier: " + text);
        }
        if (text.endsWith("_")) {
            throw new IdentifierException(
                    Kind.INVALID_LAST_CHARACTER,
                    text,
                    "Invalid last character '_' in identifier: " + text);
        }
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (!isNameChar(ch) && !Character.isWhitespace(ch) && !Character.isSpaceChar(ch)) {
                throw new IdentifierException(
                        Kind.INVALID_CHARACTER,
                        text,
                        "Invalid character '" + ch + "' in identifier: " + text);
            }
        }
        String normalized = normalize(text);
        if (!options.isAllowReserved() && RESERVED.contains(foldCase(normalized))) {
            throw new IdentifierException(Kind.RESERVED, text, "Reserved identifier: " + text);
        }
        return new Identifier(text, normalized, List.of(), false);
    }

    static String normalize(String text) {
        String composed = Normalizer.normalize(text, Normalizer.Form.NFKC);
        if (!composed.equals(text) && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Identifier '" + text + "' rewritten by NFKC normalization");
        }
        StringBuilder builder = new StringBuilder(composed.length());
        boolean pendingSpace = false;
        for (int i = 0; i < composed.length(); i++) {
            char ch = composed.charAt(i);
            boolean space =
                    ch == '_'
                            || Character.isWhitespace(ch)
                            || Character.isSpaceChar(ch)
                            || Character.isISOControl(ch);
            if (space) {
                pendingSpace = builder.length() > 0;
                continue;
            }
            if (pendingSpace) {
                builder.append(' ');
                pendingSpace = false;
            }
            builder.append(ch);
        }
        return builder.toString();
    }

    private static String foldCase(String text) {
        return text.toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
    }

    private static boolean needsQuoting(String name) {
        // Equation names never start with '$', and the lexer only reads BMP characters bare.
        if (name.isEmpty() || isAsciiDigit(name.charAt(0)) || name.charAt(0) == '$') {
            return true;
        }
        for (int i = 0; i < name.length(); i++) {
            char ch = name.charAt(i);
            if (!isNameChar(ch) || Character.isSurrogate(ch)) {
                return true;
            }
        }
        return KEYWORDS.contains(foldCase(name));
    }

    private static String quote(String name) {
        StringBuilder builder = new StringBuilder(name.length() + 2).append('"');
        for (int i = 0; i < name.length(); i++) {
            char ch = name.charAt(i);
            if (ch == '"' || ch == '\\') {
                builder.append('\\');
            }
            builder.append(ch);
        }
        return builder.append('"').toString();
    }

    private static boolean isNameChar(char ch) {
        return (ch >= 'a' && ch <= 'z')
                || (ch >= 'A' && ch <= 'Z')
                || isAsciiDigit(ch)
                || ch == '_'
                || ch == '$'
                || ch > '\u007F';
    }

    private static boolean isAsciiDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isFullyQuoted(String text) {
        if (text.length() < 2 || text.charAt(0) != '"') {
            return false;
        }
        return closingQuote(text, 0) == text.length() - 1;
    }

    private static int closingQuote(String text, int open) {
        for (int i = open + 1; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\\') {
                i++;
            } else if (ch == '"') {
                return i;
            }
        }
        return -1;
    }

    private static int lastDotOutsideQuotes(String text) {
        int last = -1;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '"') {
                int close = closingQuote(text, i);
                if (close < 0) {
                    return last;
                }
                i = close;
            } else if (ch == '.') {
                last = i;
            }
        }
        return last;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Identifier other)) {
            return false;
        }
        return compareKey.equals(other.compareKey) && namespacePath.equals(other.namespacePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(compareKey, namespacePath);
    }

    @Override
    public String toString() {
        return getQualifiedName();
    }
}
