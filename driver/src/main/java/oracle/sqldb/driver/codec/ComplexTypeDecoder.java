/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.codec;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import oracle.sqldb.driver.ValueFormatException;
import oracle.sqldb.driver.types.RowField;
import oracle.sqldb.driver.types.TypeDescriptor;
import oracle.sqldb.driver.util.BinaryUtil;
import oracle.sqldb.driver.values.ArrayValue;
import oracle.sqldb.driver.values.BinaryValue;
import oracle.sqldb.driver.values.FieldValue;
import oracle.sqldb.driver.values.NullValue;
import oracle.sqldb.driver.values.RowValue;
import oracle.sqldb.driver.values.SetValue;

/**
 * Decodes the text form of ARRAY, SET and ROW values, recursively, using
 * the type descriptor to interpret each element.
 * <p>
 * Arrays and sets are written {@code [e1,e2,...]} and rows
 * {@code (e1,e2,...)}, each optionally preceded by its keyword and followed
 * by a {@code ::type} cast. Rows may also use the JSON object form
 * {@code {"f0":e1,"f1":e2}}, in which case the keys are ignored and the
 * values are matched to the row's fields by position.
 * <p>
 * An element is one of:
 * <ul>
 * <li>NULL, in any case, meaning a null element</li>
 * <li>a nested container</li>
 * <li>a quoted string, {@code 'a''b'}, {@code E'a\'b'} or {@code "a\"b"}</li>
 * <li>{@code HEX_TO_BINARY('0x...')} for binary element types</li>
 * <li>a bare token, in which a backslash escapes the next character</li>
 * </ul>
 * Each scalar form may be followed by a {@code ::type} cast, which is
 * ignored. The unescaped text is then decoded by the {@link ScalarCodec}.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public class ComplexTypeDecoder {

    private static final String HEX_TO_BINARY = "HEX_TO_BINARY(";

    private final ScalarCodec scalar;

    public ComplexTypeDecoder(ScalarCodec scalar) {
        requireNonNull(scalar, "ComplexTypeDecoder: scalar must be non-null");
        this.scalar = scalar;
    }

    /**
     * Decodes the text of a container value.
     *
     * @param text the text
     * @param type an ARRAY, SET or ROW type
     * @param zone the session zone
     *
     * @return an ArrayValue, SetValue or RowValue
     *
     * @throws ValueFormatException if the text is not a well formed value of
     * the type
     */
    public FieldValue decode(String text, TypeDescriptor type, ZoneId zone) {
        requireNonNull(text, "ComplexTypeDecoder.decode: text must be non-null");
        requireNonNull(type, "ComplexTypeDecoder.decode: type must be non-null");
        if (!type.isContainer()) {
            throw formatError("not a container type", text, type);
        }

        String t = text.trim();
        int pos = 0;
        String keyword = type.getKind().name();
        if (t.regionMatches(true, 0, keyword, 0, keyword.length())) {
            pos = skipWhitespace(t, keyword.length());
        }
        if (pos >= t.length()) {
            throw formatError("missing opening delimiter", text, type);
        }

        char open = t.charAt(pos);
        boolean objectForm = false;
        if (type.getKind() == TypeDescriptor.Kind.ROW) {
            if (open != '(' && open != '{') {
                throw formatError("expected '(' or '{'", text, type);
            }
            objectForm = (open == '{');
        } else if (open != '[') {
            throw formatError("expected '['", text, type);
        }

        List<String> elements = new ArrayList<String>();
        int close = splitElements(t, pos, elements, text, type);
        String rest = t.substring(close + 1).trim();
        if (!rest.isEmpty() && !rest.startsWith("::")) {
            throw formatError("unexpected text '" + rest + "' after value",
                              text, type);
        }

        if (objectForm) {
            for (int i = 0; i < elements.size(); i++) {
                elements.set(i, stripKey(elements.get(i), text, type));
            }
        }

        int max = type.getMaxElements();
        if (max >= 0 && elements.size() > max) {
            throw formatError(elements.size() + " elements exceed the " +
                              "maximum of " + max, text, type);
        }

        switch (type.getKind()) {
        case ARRAY: {
            ArrayValue array = new ArrayValue(elements.size());
            for (String element : elements) {
                array.add(decodeElement(element, type.getElement(), zone));
            }
            return array;
        }
        case SET: {
            SetValue set = new SetValue();
            for (String element : elements) {
                set.add(decodeElement(element, type.getElement(), zone));
            }
            return set;
        }
        default: {
            List<RowField> fields = type.getFields();
            if (elements.size() != fields.size()) {
                throw formatError("expected " + fields.size() +
                                  " fields, found " + elements.size(),
                                  text, type);
            }
            RowValue row = new RowValue(fields.size());
            for (int i = 0; i < fields.size(); i++) {
                RowField field = fields.get(i);
                row.put(field.getName(),
                        decodeElement(elements.get(i), field.getType(),
                                      zone));
            }
            return row;
        }
        }
    }

    /**
     * Decodes a single element, as found inside a container or written by
     * the literal encoder.
     *
     * @param raw the element text
     * @param type the element type
     * @param zone the session zone
     *
     * @return the value
     *
     * @throws ValueFormatException if the element is malformed or does not
     * match the type
     */
    public FieldValue decodeElement(String raw,
                                    TypeDescriptor type,
                                    ZoneId zone) {
        requireNonNull(raw, "ComplexTypeDecoder.decodeElement: text must " +
                       "be non-null");
        requireNonNull(type, "ComplexTypeDecoder.decodeElement: type must " +
                       "be non-null");
        String e = raw.trim();
        if (e.equalsIgnoreCase("NULL")) {
            return NullValue.getInstance();
        }
        if (type.isContainer()) {
            return decode(e, type, zone);
        }
        if (e.isEmpty()) {
            throw formatError("empty element", raw, type);
        }
        if (type.isNumeric()) {
            e = unwrapParentheses(e);
        }
        char first = e.charAt(0);
        if (first == '[' || first == '(' || first == '{') {
            throw formatError("expected a scalar value", raw, type);
        }

        try {
            if ((first == 'E' || first == 'e') && e.length() > 1 &&
                e.charAt(1) == '\'') {
                int end = endOfSingleQuoted(e, 1, true);
                checkTrailer(e, end, raw, type);
                return scalar.decode(unescapeEString(e.substring(2, end - 1)),
                                     type, zone);
            }
            if (first == '\'') {
                int end = endOfSingleQuoted(e, 0, false);
                checkTrailer(e, end, raw, type);
                return scalar.decode(
                    e.substring(1, end - 1).replace("''", "'"), type, zone);
            }
            if (first == '"') {
                int end = endOfDoubleQuoted(e, 0);
                checkTrailer(e, end, raw, type);
                return scalar.decode(unescapeJson(e.substring(1, end - 1)),
                                     type, zone);
            }
            if (e.regionMatches(true, 0, HEX_TO_BINARY, 0,
                                HEX_TO_BINARY.length())) {
                return decodeHexToBinary(e, raw, type);
            }
            return scalar.decode(unescapeBare(stripCast(e)), type, zone);
        } catch (IllegalArgumentException iae) {
            throw new ValueFormatException(
                "Invalid element '" + raw + "' for " + type.getTypeName() +
                ": " + iae.getMessage(), type.getTypeName(), raw, iae);
        }
    }

    private FieldValue decodeHexToBinary(String e,
                                         String raw,
                                         TypeDescriptor type) {
        if (!type.isBinary()) {
            throw formatError("HEX_TO_BINARY is only valid for binary types",
                              raw, type);
        }
        int pos = skipWhitespace(e, HEX_TO_BINARY.length());
        if (pos >= e.length() || e.charAt(pos) != '\'') {
            throw formatError("expected a quoted hex string", raw, type);
        }
        int end = endOfSingleQuoted(e, pos, false);
        if (end < 0) {
            throw formatError("unterminated quoted string", raw, type);
        }
        String hex = e.substring(pos + 1, end - 1);
        pos = skipWhitespace(e, end);
        if (pos >= e.length() || e.charAt(pos) != ')') {
            throw formatError("expected ')'", raw, type);
        }
        checkTrailer(e, pos + 1, raw, type);
        return new BinaryValue(
            scalar.padBinary(BinaryUtil.convertHexToBytes(hex.trim()), type));
    }

    /*
     * Splits the content of the container opened at openPos on top level
     * commas, adding the raw elements to the list. Returns the position of
     * the matching closing delimiter.
     */
    private static int splitElements(String t,
                                     int openPos,
                                     List<String> elements,
                                     String text,
                                     TypeDescriptor type) {
        Deque<Character> closers = new ArrayDeque<Character>();
        int elemStart = openPos + 1;
        int i = openPos;
        int len = t.length();
        while (i < len) {
            char ch = t.charAt(i);
            switch (ch) {
            case '\\':
                i += 2;
                continue;
            case '\'':
                i = endOfSingleQuoted(t, i, isEscapePrefix(t, i));
                if (i < 0) {
                    throw formatError("unterminated quoted string", text,
                                      type);
                }
                continue;
            case '"':
                i = endOfDoubleQuoted(t, i);
                if (i < 0) {
                    throw formatError("unterminated quoted string", text,
                                      type);
                }
                continue;
            case '[':
                closers.push(']');
                break;
            case '(':
                closers.push(')');
                break;
            case '{':
                closers.push('}');
                break;
            case ']':
            case ')':
            case '}':
                if (closers.isEmpty() || closers.peek() != ch) {
                    throw formatError("unbalanced '" + ch + "'", text, type);
                }
                closers.pop();
                if (closers.isEmpty()) {
                    addElement(t.substring(elemStart, i), elements, text,
                               type);
                    return i;
                }
                break;
            case ',':
                if (closers.size() == 1) {
                    String element = t.substring(elemStart, i);
                    if (element.trim().isEmpty()) {
                        throw formatError("empty element", text, type);
                    }
                    elements.add(element);
                    elemStart = i + 1;
                }
                break;
            default:
                break;
            }
            i++;
        }
        throw formatError("missing closing delimiter", text, type);
    }

    /* the last element; an empty one is only valid for an empty container */
    private static void addElement(String element,
                                   List<String> elements,
                                   String text,
                                   TypeDescriptor type) {
        if (element.trim().isEmpty()) {
            if (!elements.isEmpty()) {
                throw formatError("empty element", text, type);
            }
            return;
        }
        elements.add(element);
    }

    private static String stripKey(String element,
                                   String text,
                                   TypeDescriptor type) {
        String e = element.trim();
        if (e.isEmpty() || e.charAt(0) != '"') {
            throw formatError("expected a quoted key", text, type);
        }
        int end = endOfDoubleQuoted(e, 0);
        int pos = skipWhitespace(e, end);
        if (end < 0 || pos >= e.length() || e.charAt(pos) != ':') {
            throw formatError("expected ':' after key", text, type);
        }
        return e.substring(pos + 1);
    }

    /*
     * Returns the position after the closing quote of the single quoted
     * string starting at start, or -1 if it is not terminated. A doubled
     * quote stands for one quote; in escaped strings a backslash also
     * escapes the next character.
     */
    private static int endOfSingleQuoted(String s, int start, boolean escapes) {
        int i = start + 1;
        int len = s.length();
        while (i < len) {
            char ch = s.charAt(i);
            if (escapes && ch == '\\') {
                i += 2;
                continue;
            }
            if (ch == '\'') {
                if (i + 1 < len && s.charAt(i + 1) == '\'') {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return -1;
    }

    private static int endOfDoubleQuoted(String s, int start) {
        int i = start + 1;
        int len = s.length();
        while (i < len) {
            char ch = s.charAt(i);
            if (ch == '\\') {
                i += 2;
                continue;
            }
            if (ch == '"') {
                return i + 1;
            }
            i++;
        }
        return -1;
    }

    /* true if the quote at pos opens an E'...' string */
    private static boolean isEscapePrefix(String s, int pos) {
        if (pos == 0) {
            return false;
        }
        char prev = s.charAt(pos - 1);
        if (prev != 'E' && prev != 'e') {
            return false;
        }
        return pos == 1 || !Character.isLetterOrDigit(s.charAt(pos - 2)) &&
            s.charAt(pos - 2) != '_';
    }

    private static void checkTrailer(String e,
                                     int end,
                                     String raw,
                                     TypeDescriptor type) {
        if (end < 0) {
            throw formatError("unterminated quoted string", raw, type);
        }
        String rest = e.substring(end).trim();
        if (!rest.isEmpty() && !rest.startsWith("::")) {
            throw formatError("unexpected text '" + rest + "' after value",
                              raw, type);
        }
    }

    /*
     * Removes one pair of parentheses around a number, as written by the
     * literal encoder for negative numbers. Nested or unbalanced
     * parentheses are left for the caller to reject.
     */
    private static String unwrapParentheses(String e) {
        int len = e.length();
        if (len < 2 || e.charAt(0) != '(' || e.charAt(len - 1) != ')') {
            return e;
        }
        String inner = e.substring(1, len - 1).trim();
        if (inner.isEmpty() || inner.indexOf('(') >= 0 ||
            inner.indexOf(')') >= 0) {
            return e;
        }
        return inner;
    }

    /* removes an unescaped trailing ::type cast from a bare token */
    private static String stripCast(String e) {
        int len = e.length();
        for (int i = 0; i < len; i++) {
            char ch = e.charAt(i);
            if (ch == '\\') {
                i++;
            } else if (ch == ':' && i + 1 < len && e.charAt(i + 1) == ':') {
                return e.substring(0, i).trim();
            }
        }
        return e;
    }

    private static String unescapeBare(String e) {
        if (e.indexOf('\\') < 0) {
            return e;
        }
        StringBuilder sb = new StringBuilder(e.length());
        int len = e.length();
        for (int i = 0; i < len; i++) {
            char ch = e.charAt(i);
            if (ch == '\\') {
                if (++i == len) {
                    throw new IllegalArgumentException("trailing backslash");
                }
                ch = e.charAt(i);
            }
            sb.append(ch);
        }
        return sb.toString();
    }

    /**
     * Resolves the backslash escapes of an E'...' string body: \b \f \n \r
     * \t, \xHH, \ooo and a backslash before any other character. A doubled
     * quote stands for one quote.
     */
    static String unescapeEString(String body) {
        StringBuilder sb = new StringBuilder(body.length());
        int len = body.length();
        int i = 0;
        while (i < len) {
            char ch = body.charAt(i++);
            if (ch == '\'') {
                /* the closing scan guarantees a second quote */
                i++;
                sb.append('\'');
                continue;
            }
            if (ch != '\\') {
                sb.append(ch);
                continue;
            }
            if (i == len) {
                throw new IllegalArgumentException("trailing backslash");
            }
            ch = body.charAt(i++);
            switch (ch) {
            case 'b':
                sb.append('\b');
                break;
            case 'f':
                sb.append('\f');
                break;
            case 'n':
                sb.append('\n');
                break;
            case 'r':
                sb.append('\r');
                break;
            case 't':
                sb.append('\t');
                break;
            case 'x': {
                int start = i;
                while (i < len && i - start < 2 &&
                       BinaryUtil.hexValue(body.charAt(i)) >= 0) {
                    i++;
                }
                if (i == start) {
                    throw new IllegalArgumentException(
                        "invalid hex escape in '" + body + "'");
                }
                sb.append((char) Integer.parseInt(body.substring(start, i),
                                                  16));
                break;
            }
            default:
                if (ch >= '0' && ch <= '7') {
                    int start = i - 1;
                    while (i < len && i - start < 3 &&
                           body.charAt(i) >= '0' && body.charAt(i) <= '7') {
                        i++;
                    }
                    sb.append((char) Integer.parseInt(
                        body.substring(start, i), 8));
                } else {
                    sb.append(ch);
                }
            }
        }
        return sb.toString();
    }

    private static String unescapeJson(String body) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        int len = body.length();
        int i = 0;
        while (i < len) {
            char ch = body.charAt(i++);
            if (ch != '\\') {
                sb.append(ch);
                continue;
            }
            if (i == len) {
                throw new IllegalArgumentException("trailing backslash");
            }
            ch = body.charAt(i++);
            switch (ch) {
            case 'b':
                sb.append('\b');
                break;
            case 'f':
                sb.append('\f');
                break;
            case 'n':
                sb.append('\n');
                break;
            case 'r':
                sb.append('\r');
                break;
            case 't':
                sb.append('\t');
                break;
            case 'u':
                if (i + 4 > len) {
                    throw new IllegalArgumentException(
                        "truncated unicode escape in '" + body + "'");
                }
                sb.append((char) Integer.parseInt(body.substring(i, i + 4),
                                                  16));
                i += 4;
                break;
            default:
                /* \" \\ \/ */
                sb.append(ch);
            }
        }
        return sb.toString();
    }

    private static int skipWhitespace(String s, int pos) {
        int i = pos;
        while (i >= 0 && i < s.length() &&
               Character.isWhitespace(s.charAt(i))) {
            i++;
        }
        return i;
    }

    private static ValueFormatException formatError(String msg,
                                                    String text,
                                                    TypeDescriptor type) {
        return new ValueFormatException(
            "Invalid " + type.getTypeName() + " value '" + text + "': " + msg,
            type.getTypeName(), text);
    }
}
