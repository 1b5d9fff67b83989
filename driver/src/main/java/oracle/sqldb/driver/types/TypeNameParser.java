/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.types;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import oracle.sqldb.driver.UnsupportedTypeException;

/**
 * Parses SQL type text, as written in a column definition or after a "::"
 * cast, into a {@link TypeDescriptor}. Keywords are case-insensitive and
 * whitespace between tokens is ignored.
 * <p>
 * Container types nest: {@code ARRAY[type[,max]]}, {@code SET[type[,max]]}
 * and {@code ROW([name] type, ...)}. Unnamed row fields are named f0, f1,
 * ... by position, the names the server uses for anonymous fields.
 * <p>
 * Instances are not thread-safe; use {@link #parse(String)}.
 */
public class TypeNameParser {

    private final String text;
    private final List<String> tokens;
    private int pos;

    private TypeNameParser(String text) {
        this.text = text;
        this.tokens = tokenize(text);
    }

    /**
     * Parses the type text.
     *
     * @param text the type text
     * @return the descriptor
     *
     * @throws UnsupportedTypeException if the text does not name a supported
     * type
     */
    public static TypeDescriptor parse(String text) {
        requireNonNull(text, "TypeNameParser.parse: text must be non-null");
        TypeNameParser parser = new TypeNameParser(text);
        TypeDescriptor td = parser.parseType();
        if (parser.pos < parser.tokens.size()) {
            throw parser.error("unexpected '" + parser.peek() + "'");
        }
        return td;
    }

    private TypeDescriptor parseType() {
        String word = nextKeyword();
        switch (word) {
        case "BOOL":
        case "BOOLEAN":
            return TypeDescriptor.booleanType();
        case "INT":
        case "INTEGER":
        case "BIGINT":
        case "INT8":
        case "SMALLINT":
        case "TINYINT":
            return TypeDescriptor.integerType();
        case "FLOAT":
            /* FLOAT(n) is still a double */
            optionalModifier();
            return TypeDescriptor.floatType();
        case "FLOAT8":
        case "REAL":
            return TypeDescriptor.floatType();
        case "DOUBLE":
            acceptKeyword("PRECISION");
            return TypeDescriptor.floatType();
        case "NUMERIC":
        case "DECIMAL":
        case "NUMBER":
            return parseDecimalModifiers();
        case "MONEY":
            return TypeDescriptor.decimalType(18, 4);
        case "CHAR":
        case "CHARACTER":
            if (acceptKeyword("VARYING")) {
                return TypeDescriptor.varcharType(optionalModifier());
            }
            return TypeDescriptor.charType(optionalModifier(1));
        case "VARCHAR":
            return TypeDescriptor.varcharType(optionalModifier());
        case "LONG":
            if (acceptKeyword("VARCHAR")) {
                return TypeDescriptor.varcharType(optionalModifier());
            }
            if (acceptKeyword("VARBINARY")) {
                return TypeDescriptor.varbinaryType(optionalModifier());
            }
            throw error("expected VARCHAR or VARBINARY after LONG");
        case "BINARY":
            return TypeDescriptor.binaryType(optionalModifier(1));
        case "VARBINARY":
        case "BYTEA":
        case "RAW":
            return TypeDescriptor.varbinaryType(optionalModifier());
        case "UUID":
            return TypeDescriptor.uuidType();
        case "DATE":
            return TypeDescriptor.dateType();
        case "TIME": {
            int precision = optionalModifier();
            return parseZoneSuffix() ? TypeDescriptor.timeTzType(precision) :
                TypeDescriptor.timeType(precision);
        }
        case "TIMETZ":
            return TypeDescriptor.timeTzType(optionalModifier());
        case "TIMESTAMP":
        case "DATETIME":
        case "SMALLDATETIME": {
            int precision = optionalModifier();
            return parseZoneSuffix() ?
                TypeDescriptor.timestampTzType(precision) :
                TypeDescriptor.timestampType(precision);
        }
        case "TIMESTAMPTZ":
            return TypeDescriptor.timestampTzType(optionalModifier());
        case "INTERVAL":
            return parseInterval();
        case "ARRAY":
            return parseCollection(TypeDescriptor.Kind.ARRAY);
        case "SET":
            return parseCollection(TypeDescriptor.Kind.SET);
        case "ROW":
            return parseRow();
        default:
            throw error("unknown type name '" + word + "'");
        }
    }

    private TypeDescriptor parseDecimalModifiers() {
        if (!accept("(")) {
            return TypeDescriptor.decimalType();
        }
        int precision = nextInt();
        int scale = 0;
        if (accept(",")) {
            scale = nextInt();
        }
        expect(")");
        if (scale > precision) {
            throw error("scale " + scale + " exceeds precision " + precision);
        }
        return TypeDescriptor.decimalType(precision, scale);
    }

    /* WITH TIME ZONE / WITHOUT TIME ZONE */
    private boolean parseZoneSuffix() {
        boolean with;
        if (acceptKeyword("WITH")) {
            with = true;
        } else if (acceptKeyword("WITHOUT")) {
            with = false;
        } else {
            return false;
        }
        expectKeyword("TIME");
        expectKeyword("ZONE");
        return with;
    }

    private TypeDescriptor parseInterval() {
        int precision = optionalModifier();
        IntervalUnit start = acceptUnit();
        if (start == null) {
            return TypeDescriptor.intervalType(IntervalRange.DAY_TO_SECOND,
                                               precision);
        }
        IntervalUnit end = start;
        if (acceptKeyword("TO")) {
            end = acceptUnit();
            if (end == null) {
                throw error("expected an interval field after TO");
            }
        }
        if (precision < 0) {
            precision = optionalModifier();
        }
        IntervalRange range;
        try {
            range = IntervalRange.of(start, end);
        } catch (UnsupportedTypeException ute) {
            throw error(ute.getMessage());
        }
        return TypeDescriptor.intervalType(range, precision);
    }

    private IntervalUnit acceptUnit() {
        String tok = peek();
        if (tok == null) {
            return null;
        }
        String word = tok.toUpperCase(Locale.ROOT);
        for (IntervalUnit unit : IntervalUnit.values()) {
            if (unit.name().equals(word)) {
                pos++;
                return unit;
            }
        }
        return null;
    }

    private TypeDescriptor parseCollection(TypeDescriptor.Kind kind) {
        expect("[");
        TypeDescriptor element = parseType();
        int max = -1;
        if (accept(",")) {
            max = nextInt();
        }
        expect("]");
        if (kind == TypeDescriptor.Kind.ARRAY) {
            return TypeDescriptor.arrayOf(element, max);
        }
        return TypeDescriptor.setOf(element, max);
    }

    private TypeDescriptor parseRow() {
        expect("(");
        List<RowField> fields = new ArrayList<RowField>();
        if (!accept(")")) {
            do {
                fields.add(parseRowField(fields.size()));
            } while (accept(","));
            expect(")");
        }
        try {
            return TypeDescriptor.row(fields);
        } catch (IllegalArgumentException iae) {
            throw error(iae.getMessage());
        }
    }

    /*
     * A field is either "name type" or just "type". Try the unnamed form
     * first and fall back to the named one.
     */
    private RowField parseRowField(int index) {
        int start = pos;
        UnsupportedTypeException unnamedError = null;
        try {
            TypeDescriptor type = parseType();
            String next = peek();
            if (next == null || next.equals(",") || next.equals(")")) {
                return new RowField("f" + index, type);
            }
        } catch (UnsupportedTypeException ute) {
            unnamedError = ute;
        }
        pos = start;
        try {
            String name = nextName();
            return new RowField(name, parseType());
        } catch (UnsupportedTypeException ute) {
            if (unnamedError != null) {
                ute.addSuppressed(unnamedError);
            }
            throw ute;
        }
    }

    private int optionalModifier() {
        return optionalModifier(-1);
    }

    private int optionalModifier(int defaultValue) {
        if (!accept("(")) {
            return defaultValue;
        }
        int value = nextInt();
        expect(")");
        return value;
    }

    private String peek() {
        return (pos < tokens.size() ? tokens.get(pos) : null);
    }

    private String next() {
        String tok = peek();
        if (tok == null) {
            throw error("unexpected end of type");
        }
        pos++;
        return tok;
    }

    private String nextKeyword() {
        String tok = next();
        if (!isWord(tok)) {
            throw error("expected a type name, found '" + tok + "'");
        }
        return tok.toUpperCase(Locale.ROOT);
    }

    private String nextName() {
        String tok = next();
        if (tok.startsWith("\"")) {
            return tok.substring(1, tok.length() - 1).replace("\"\"", "\"");
        }
        if (!isWord(tok)) {
            throw error("expected a field name, found '" + tok + "'");
        }
        return tok;
    }

    private int nextInt() {
        String tok = next();
        try {
            return Integer.parseInt(tok);
        } catch (NumberFormatException nfe) {
            throw error("expected a number, found '" + tok + "'");
        }
    }

    private boolean accept(String punct) {
        if (punct.equals(peek())) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(String punct) {
        if (!accept(punct)) {
            String tok = peek();
            throw error("expected '" + punct + "'" +
                        (tok == null ? " at end of type" :
                         ", found '" + tok + "'"));
        }
    }

    private boolean acceptKeyword(String keyword) {
        String tok = peek();
        if (tok != null && tok.equalsIgnoreCase(keyword)) {
            pos++;
            return true;
        }
        return false;
    }

    private void expectKeyword(String keyword) {
        if (!acceptKeyword(keyword)) {
            throw error("expected " + keyword);
        }
    }

    private UnsupportedTypeException error(String msg) {
        return new UnsupportedTypeException(
            "Invalid type '" + text + "': " + msg, text);
    }

    private static boolean isAsciiDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isWord(String tok) {
        char ch = tok.charAt(0);
        return Character.isLetter(ch) || ch == '_';
    }

    private List<String> tokenize(String input) {
        List<String> result = new ArrayList<String>();
        int len = input.length();
        int i = 0;
        while (i < len) {
            char ch = input.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
            } else if (Character.isLetter(ch) || ch == '_') {
                int start = i;
                while (i < len && (Character.isLetterOrDigit(input.charAt(i))
                                   || input.charAt(i) == '_' ||
                                   input.charAt(i) == '$')) {
                    i++;
                }
                result.add(input.substring(start, i));
            } else if (isAsciiDigit(ch)) {
                int start = i;
                while (i < len && isAsciiDigit(input.charAt(i))) {
                    i++;
                }
                result.add(input.substring(start, i));
            } else if (ch == '"') {
                int start = i++;
                while (true) {
                    if (i >= len) {
                        throw new UnsupportedTypeException(
                            "Invalid type '" + input +
                            "': unterminated quoted name", input);
                    }
                    if (input.charAt(i) == '"') {
                        if (i + 1 < len && input.charAt(i + 1) == '"') {
                            i += 2;
                            continue;
                        }
                        i++;
                        break;
                    }
                    i++;
                }
                result.add(input.substring(start, i));
            } else if ("()[],".indexOf(ch) >= 0) {
                result.add(String.valueOf(ch));
                i++;
            } else {
                throw new UnsupportedTypeException(
                    "Invalid type '" + input + "': unexpected character '" +
                    ch + "'", input);
            }
        }
        if (result.isEmpty()) {
            throw new UnsupportedTypeException(
                "Invalid type: empty type text", input);
        }
        return result;
    }
}
