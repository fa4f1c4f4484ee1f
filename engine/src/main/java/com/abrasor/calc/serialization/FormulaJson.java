package com.abrasor.calc.serialization;

import com.abrasor.calc.formula.FormulaParseException;
import com.abrasor.calc.formula.FormulaParser;
import com.abrasor.calc.formula.ast.FormulaNode;
import com.abrasor.calc.formula.ast.FormulaVisitor;
import com.abrasor.calc.formula.ast.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JSON codec for formula trees as stored with a calculator definition.
 *
 * Node shapes:
 * <pre>
 * {"type":"number","value":"60"}
 * {"type":"input","value":"vw","label":"Work Speed"}
 * {"type":"operator","value":"*","children":[left,right]}
 * </pre>
 *
 * Reading ignores "id" (a UI list key). An "input" node whose value is not a
 * plain name holds formula text saved by older editors and is parsed.
 *
 * Reads and writes JSON without a JSON library.
 */
public final class FormulaJson {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormulaJson.class);

    public static final String TYPE_NUMBER = "number";
    public static final String TYPE_INPUT = "input";
    public static final String TYPE_OPERATOR = "operator";
    public static final String TYPE_FUNCTION = "function";

    private FormulaJson() {
    }

    // ========== WRITING ==========

    public static String toJson(FormulaNode formula) {
        StringBuilder sb = new StringBuilder();
        formula.accept(new TreeWriter(sb));
        return sb.toString();
    }

    /**
     * Appends nodes in key order type, value, label, children. The label is
     * written only when present.
     */
    private static final class TreeWriter implements FormulaVisitor<Void> {

        private final StringBuilder sb;

        TreeWriter(StringBuilder sb) {
            this.sb = sb;
        }

        @Override
        public Void visitLiteral(FormulaNode.Literal literal) {
            openNode(TYPE_NUMBER, literal.value());
            sb.append('}');
            return null;
        }

        @Override
        public Void visitVariable(FormulaNode.Variable variable) {
            openNode(TYPE_INPUT, variable.name());
            if (variable.hasLabel()) {
                sb.append(",\"label\":");
                writeString(sb, variable.label());
            }
            sb.append('}');
            return null;
        }

        @Override
        public Void visitBinaryOp(FormulaNode.BinaryOp binaryOp) {
            openNode(TYPE_OPERATOR, String.valueOf(binaryOp.operator().symbol()));
            sb.append(",\"children\":[");
            binaryOp.left().accept(this);
            sb.append(',');
            binaryOp.right().accept(this);
            sb.append("]}");
            return null;
        }

        private void openNode(String type, String value) {
            sb.append("{\"type\":\"").append(type).append("\",\"value\":");
            writeString(sb, value);
        }
    }

    private static void writeString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    // ========== READING ==========

    /**
     * Reads a persisted formula.
     *
     * @return The tree, or empty for JSON null, a blank document, or an empty legacy text node
     * @throws FormulaJsonException if the document is not a valid formula tree
     */
    public static Optional<FormulaNode> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        Parser parser = new Parser(json.trim());
        Object value = parser.parseValue();
        parser.expectEnd();
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new FormulaJsonException("Formula must be a JSON object");
        }
        return fromMap(asObject(value));
    }

    /**
     * Decodes a formula from nested maps and lists, e.g. a node taken from a
     * larger calculator document.
     */
    public static Optional<FormulaNode> fromMap(Map<String, Object> map) {
        String type = getString(map, "type");
        String value = getString(map, "value");
        if (TYPE_INPUT.equals(type) && value != null && !map.containsKey("children") && !FormulaNode.isName(value)) {
            return parseLegacyText(value);
        }
        return Optional.of(decodeNode(map));
    }

    private static FormulaNode decodeNode(Map<String, Object> map) {
        String type = getString(map, "type");
        String value = getString(map, "value");
        if (type == null) {
            throw new FormulaJsonException("Formula node has no type: " + map);
        }
        if (value == null) {
            throw new FormulaJsonException("Formula node has no value: " + map);
        }

        return switch (type) {
            case TYPE_NUMBER -> {
                if (!FormulaNode.isNumber(value)) {
                    throw new FormulaJsonException("Not a numeric literal: '" + value + "'");
                }
                yield FormulaNode.literal(value);
            }
            case TYPE_INPUT -> {
                if (FormulaNode.isName(value)) {
                    yield FormulaNode.variable(value, getString(map, "label"));
                }
                yield parseLegacyText(value).orElseThrow(
                        () -> new FormulaJsonException("Empty input node inside a formula"));
            }
            case TYPE_OPERATOR -> decodeOperator(map, value);
            case TYPE_FUNCTION -> throw new FormulaJsonException("Function nodes are not supported: " + value);
            default -> throw new FormulaJsonException("Unknown formula node type: " + type);
        };
    }

    private static FormulaNode decodeOperator(Map<String, Object> map, String symbol) {
        Operator op = symbol.length() == 1 ? Operator.fromSymbol(symbol.charAt(0)) : null;
        if (op == null) {
            throw new FormulaJsonException("Unknown operator: '" + symbol + "'");
        }
        List<Object> children = getList(map, "children");
        if (children == null || children.size() != 2) {
            throw new FormulaJsonException("Operator '" + symbol + "' needs exactly two children");
        }
        FormulaNode left = decodeNode(asObject(children.get(0)));
        FormulaNode right = decodeNode(asObject(children.get(1)));
        return new FormulaNode.BinaryOp(left, op, right);
    }

    private static Optional<FormulaNode> parseLegacyText(String text) {
        LOGGER.warn("Re-parsing formula stored as text: '{}'", text);
        try {
            return FormulaParser.parse(text);
        } catch (FormulaParseException e) {
            throw new FormulaJsonException("Stored formula text does not parse: '" + text + "'", e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asObject(Object value) {
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) value;
        }
        throw new FormulaJsonException("Expected a formula node object, got: " + value);
    }

    private static String getString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof String s ? s : null;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> getList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof List ? (List<Object>) value : null;
    }

    // ========== PARSER IMPLEMENTATION ==========

    private static class Parser {
        private final String json;
        private int pos = 0;

        Parser(String json) {
            this.json = json;
        }

        Object parseValue() {
            skipWhitespace();
            if (pos >= json.length())
                throw error("Unexpected end of JSON");

            char c = json.charAt(pos);
            return switch (c) {
                case '{' -> parseObject();
                case '[' -> parseArray();
                case '"' -> parseString();
                case 't', 'f' -> parseBoolean();
                case 'n' -> parseNull();
                default -> parseNumber();
            };
        }

        void expectEnd() {
            skipWhitespace();
            if (pos < json.length()) {
                throw error("Unexpected content after JSON value");
            }
        }

        private Map<String, Object> parseObject() {
            Map<String, Object> map = new LinkedHashMap<>();
            pos++; // skip '{'
            skipWhitespace();

            if (pos < json.length() && json.charAt(pos) == '}') {
                pos++;
                return map;
            }

            while (true) {
                skipWhitespace();
                if (pos >= json.length() || json.charAt(pos) != '"') {
                    throw error("Expected object key");
                }
                String key = parseString();
                skipWhitespace();
                expect(':');
                Object value = parseValue();
                map.put(key, value);
                skipWhitespace();

                if (pos >= json.length())
                    throw error("Unterminated object");
                char c = json.charAt(pos++);
                if (c == '}') {
                    return map;
                } else if (c != ',') {
                    throw error("Expected ',' or '}'");
                }
            }
        }

        private List<Object> parseArray() {
            List<Object> list = new ArrayList<>();
            pos++; // skip '['
            skipWhitespace();

            if (pos < json.length() && json.charAt(pos) == ']') {
                pos++;
                return list;
            }

            while (true) {
                list.add(parseValue());
                skipWhitespace();

                if (pos >= json.length())
                    throw error("Unterminated array");
                char c = json.charAt(pos++);
                if (c == ']') {
                    return list;
                } else if (c != ',') {
                    throw error("Expected ',' or ']'");
                }
            }
        }

        private String parseString() {
            pos++; // skip opening quote
            StringBuilder sb = new StringBuilder();
            while (pos < json.length()) {
                char c = json.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                } else if (c == '\\' && pos < json.length()) {
                    char escaped = json.charAt(pos++);
                    switch (escaped) {
                        case '"' -> sb.append('"');
                        case '\\' -> sb.append('\\');
                        case '/' -> sb.append('/');
                        case 'b' -> sb.append('\b');
                        case 'f' -> sb.append('\f');
                        case 'n' -> sb.append('\n');
                        case 'r' -> sb.append('\r');
                        case 't' -> sb.append('\t');
                        case 'u' -> {
                            if (pos + 4 > json.length()) {
                                throw error("Truncated unicode escape");
                            }
                            String hex = json.substring(pos, pos + 4);
                            try {
                                sb.append((char) Integer.parseInt(hex, 16));
                            } catch (NumberFormatException e) {
                                throw new FormulaJsonException("Bad unicode escape '" + hex + "' at position " + pos, e);
                            }
                            pos += 4;
                        }
                        default -> sb.append(escaped);
                    }
                } else {
                    sb.append(c);
                }
            }
            throw error("Unterminated string");
        }

        private Number parseNumber() {
            int start = pos;
            if (pos < json.length() && json.charAt(pos) == '-')
                pos++;
            while (pos < json.length() && Character.isDigit(json.charAt(pos)))
                pos++;

            boolean isFloat = false;
            if (pos < json.length() && json.charAt(pos) == '.') {
                isFloat = true;
                pos++;
                while (pos < json.length() && Character.isDigit(json.charAt(pos)))
                    pos++;
            }
            if (pos < json.length() && (json.charAt(pos) == 'e' || json.charAt(pos) == 'E')) {
                isFloat = true;
                pos++;
                if (pos < json.length() && (json.charAt(pos) == '+' || json.charAt(pos) == '-'))
                    pos++;
                while (pos < json.length() && Character.isDigit(json.charAt(pos)))
                    pos++;
            }

            String num = json.substring(start, pos);
            try {
                return isFloat ? Double.parseDouble(num) : Long.parseLong(num);
            } catch (NumberFormatException e) {
                throw new FormulaJsonException("Invalid JSON value at position " + start, e);
            }
        }

        private Boolean parseBoolean() {
            if (json.startsWith("true", pos)) {
                pos += 4;
                return true;
            } else if (json.startsWith("false", pos)) {
                pos += 5;
                return false;
            }
            throw error("Invalid boolean");
        }

        private Object parseNull() {
            if (json.startsWith("null", pos)) {
                pos += 4;
                return null;
            }
            throw error("Invalid null");
        }

        private void skipWhitespace() {
            while (pos < json.length() && Character.isWhitespace(json.charAt(pos))) {
                pos++;
            }
        }

        private void expect(char expected) {
            if (pos < json.length() && json.charAt(pos) == expected) {
                pos++;
            } else {
                throw error("Expected '" + expected + "'");
            }
        }

        private FormulaJsonException error(String message) {
            return new FormulaJsonException(message + " at position " + pos);
        }
    }
}
