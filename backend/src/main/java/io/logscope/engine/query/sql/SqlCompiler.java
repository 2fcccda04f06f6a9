package io.logscope.engine.query.sql;

import io.logscope.engine.query.FieldDefinition;
import io.logscope.engine.query.FieldRegistry;
import io.logscope.engine.query.FieldType;
import io.logscope.engine.query.ast.Node;
import io.logscope.engine.query.ast.NodeVisitor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Translates a parsed filter expression into a parameterised ClickHouse condition.
 * <p>
 * Every user-supplied literal becomes a {@code ?} placeholder; string literals are
 * lower-cased and string columns wrapped in {@code lower()}, so text comparisons are
 * case-insensitive. Only JSON property names, already restricted to {@code [A-Za-z0-9_-]},
 * and rendered durations appear inline.
 */
public class SqlCompiler {

    private static final Pattern JSON_PROPERTY = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final Set<String> ORDERING = Set.of(">", ">=", "<", "<=");
    private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "%");

    private final FieldRegistry registry;

    public SqlCompiler(FieldRegistry registry) {
        this.registry = registry;
    }

    public CompiledFilter compile(Node root) {
        Emitter emitter = new Emitter();
        String sql = root.accept(emitter);
        return new CompiledFilter(sql, emitter.args);
    }

    private final class Emitter implements NodeVisitor<String> {

        private final List<Object> args = new ArrayList<>();

        @Override
        public String visitBinary(Node.Binary node) {
            String operator = node.operator();
            switch (operator) {
                case "and":
                    return "(" + node.left().accept(this) + " AND " + node.right().accept(this) + ")";
                case "or":
                    return "(" + node.left().accept(this) + " OR " + node.right().accept(this) + ")";
                case "==":
                case "!=":
                    return equality(node);
                case "contains":
                case "startsWith":
                case "endsWith":
                case "matches":
                    return predicate(node);
                case "in":
                    return membership(node);
                default:
                    if (ORDERING.contains(operator)) {
                        return ordering(node);
                    }
                    if (ARITHMETIC.contains(operator)) {
                        return "(" + node.left().accept(this) + " " + operator + " " + node.right().accept(this) + ")";
                    }
                    throw new CompileException("unsupported operator '" + operator + "'");
            }
        }

        @Override
        public String visitUnary(Node.Unary node) {
            switch (node.operator()) {
                case "not":
                    return "NOT (" + node.operand().accept(this) + ")";
                case "-":
                    return "-" + node.operand().accept(this);
                default:
                    throw new CompileException("unsupported unary operator '" + node.operator() + "'");
            }
        }

        @Override
        public String visitIdentifier(Node.Identifier node) {
            FieldDefinition field = field(node.name());
            if (field.isJson()) {
                throw new CompileException("field '" + field.name() + "' supports member access only, e.g. "
                        + field.name() + ".key");
            }
            return field.column();
        }

        @Override
        public String visitString(Node.StringLiteral node) {
            args.add(node.value().toLowerCase(Locale.ROOT));
            return "?";
        }

        @Override
        public String visitInteger(Node.IntegerLiteral node) {
            args.add(node.value());
            return "?";
        }

        @Override
        public String visitFloat(Node.FloatLiteral node) {
            args.add(node.value());
            return "?";
        }

        @Override
        public String visitBool(Node.BoolLiteral node) {
            args.add(node.value());
            return "?";
        }

        @Override
        public String visitNil(Node.NilLiteral node) {
            return "NULL";
        }

        @Override
        public String visitArray(Node.ArrayLiteral node) {
            if (node.elements().isEmpty()) {
                throw new CompileException("empty array is not allowed");
            }
            StringJoiner joiner = new StringJoiner(", ", "(", ")");
            for (Node element : node.elements()) {
                joiner.add(element.accept(this));
            }
            return joiner.toString();
        }

        @Override
        public String visitConstantSet(Node.ConstantSet node) {
            if (node.values().isEmpty()) {
                throw new CompileException("empty array is not allowed");
            }
            StringJoiner joiner = new StringJoiner(", ", "(", ")");
            for (Object value : node.values()) {
                args.add(value instanceof String s ? s.toLowerCase(Locale.ROOT) : value);
                joiner.add("?");
            }
            return joiner.toString();
        }

        @Override
        public String visitCall(Node.Call node) {
            List<Node> arguments = node.arguments();
            switch (node.function()) {
                case "now":
                    requireArity(node, 0);
                    return "now()";
                case "duration": {
                    requireArity(node, 1);
                    if (!(arguments.get(0) instanceof Node.StringLiteral literal)) {
                        throw new CompileException("duration() requires a string literal argument");
                    }
                    return DurationLiteral.toInterval(literal.value());
                }
                case "lower":
                    requireArity(node, 1);
                    return "lower(" + arguments.get(0).accept(this) + ")";
                case "upper":
                    requireArity(node, 1);
                    return "upper(" + arguments.get(0).accept(this) + ")";
                case "len":
                    requireArity(node, 1);
                    return "length(" + arguments.get(0).accept(this) + ")";
                default:
                    throw new CompileException("unsupported function '" + node.function() + "'");
            }
        }

        @Override
        public String visitMember(Node.Member node) {
            if (!(node.target() instanceof Node.Identifier identifier)) {
                throw new CompileException("member access is only supported directly on fields and labels");
            }
            FieldDefinition field = field(identifier.name());
            if (!field.isJson()) {
                throw new CompileException("field '" + field.name() + "' does not support member access");
            }
            if (!JSON_PROPERTY.matcher(node.property()).matches()) {
                throw new CompileException("invalid property name '" + node.property() + "'");
            }
            return "JSONExtractString(" + field.column() + ", '" + node.property() + "')";
        }

        // --- Operator families ----------------------------------------------------------------

        private String equality(Node.Binary node) {
            String sqlOperator = node.operator().equals("==") ? "=" : "!=";
            Optional<FieldDefinition> field = checkOperator(node);

            if (node.right() instanceof Node.NilLiteral) {
                String nullCheck = node.operator().equals("==") ? " IS NULL)" : " IS NOT NULL)";
                return "(" + node.left().accept(this) + nullCheck;
            }
            if (node.left() instanceof Node.NilLiteral) {
                String nullCheck = node.operator().equals("==") ? " IS NULL)" : " IS NOT NULL)";
                return "(" + node.right().accept(this) + nullCheck;
            }

            field.ifPresent(f -> checkLiteral(f, node));
            return "(" + operand(node.left()) + " " + sqlOperator + " " + operand(node.right()) + ")";
        }

        private String ordering(Node.Binary node) {
            Optional<FieldDefinition> field = checkOperator(node);
            field.ifPresent(f -> checkLiteral(f, node));
            return "(" + operand(node.left()) + " " + node.operator() + " " + operand(node.right()) + ")";
        }

        private String predicate(Node.Binary node) {
            checkOperator(node);
            if (!(node.right() instanceof Node.StringLiteral literal)) {
                throw new CompileException("'" + node.operator() + "' requires a string literal on the right");
            }
            if (node.operator().equals("matches")) {
                RegexGuard.check(literal.value());
            }
            String left = "lower(" + node.left().accept(this) + ")";
            String right = node.right().accept(this);
            switch (node.operator()) {
                case "contains":
                    return "position(" + left + ", " + right + ") > 0";
                case "startsWith":
                    return "startsWith(" + left + ", " + right + ")";
                case "endsWith":
                    return "endsWith(" + left + ", " + right + ")";
                default:
                    return "match(" + left + ", " + right + ")";
            }
        }

        private String membership(Node.Binary node) {
            Optional<FieldDefinition> field = checkOperator(node);
            Node right = node.right();
            if (!(right instanceof Node.ArrayLiteral) && !(right instanceof Node.ConstantSet)) {
                throw new CompileException("'in' requires an array literal on the right");
            }
            if (field.isPresent() && right instanceof Node.ConstantSet set) {
                for (Object value : set.values()) {
                    checkValue(field.get(), value, node);
                }
            }
            return node.left().accept(this) + " IN " + right.accept(this);
        }

        /** String columns are lower-cased on comparison so they line up with lower-cased literals. */
        private String operand(Node node) {
            String sql = node.accept(this);
            if (node instanceof Node.Identifier identifier && field(identifier.name()).isCaseInsensitive()) {
                return "lower(" + sql + ")";
            }
            return sql;
        }

        // --- Validation -----------------------------------------------------------------------

        private Optional<FieldDefinition> checkOperator(Node.Binary node) {
            Optional<FieldDefinition> field = fieldOf(node.left());
            if (field.isEmpty()) {
                field = fieldOf(node.right());
            }
            field.ifPresent(f -> {
                if (!f.allows(node.operator())) {
                    throw new CompileException("operator '" + node.operator() + "' is not allowed for field '"
                            + f.name() + "'");
                }
            });
            return field;
        }

        private Optional<FieldDefinition> fieldOf(Node node) {
            if (node instanceof Node.Identifier identifier) {
                return registry.lookup(identifier.name());
            }
            if (node instanceof Node.Member member && member.target() instanceof Node.Identifier identifier) {
                return registry.lookup(identifier.name());
            }
            // fields wrapped in functions or arithmetic are still subject to their operator table
            if (node instanceof Node.Call call) {
                for (Node argument : call.arguments()) {
                    Optional<FieldDefinition> field = fieldOf(argument);
                    if (field.isPresent()) {
                        return field;
                    }
                }
            }
            if (node instanceof Node.Binary binary && ARITHMETIC.contains(binary.operator())) {
                Optional<FieldDefinition> field = fieldOf(binary.left());
                return field.isPresent() ? field : fieldOf(binary.right());
            }
            if (node instanceof Node.Unary unary) {
                return fieldOf(unary.operand());
            }
            return Optional.empty();
        }

        private void checkLiteral(FieldDefinition field, Node.Binary node) {
            boolean fieldOnLeft = fieldOf(node.left()).isPresent();
            Node fieldSide = fieldOnLeft ? node.left() : node.right();
            Node other = fieldOnLeft ? node.right() : node.left();
            FieldType type = valueType(fieldSide, field);
            if (other instanceof Node.StringLiteral s) {
                checkValue(field, type, s.value(), node);
            } else if (other instanceof Node.IntegerLiteral i) {
                checkValue(field, type, i.value(), node);
            } else if (other instanceof Node.FloatLiteral f) {
                checkValue(field, type, f.value(), node);
            } else if (other instanceof Node.BoolLiteral b) {
                checkValue(field, type, b.value(), node);
            }
        }

        /** Type of the value an operand produces; {@code len()} yields an integer whatever it wraps. */
        private FieldType valueType(Node node, FieldDefinition field) {
            if (node instanceof Node.Call call) {
                if (call.function().equals("len")) {
                    return FieldType.INT;
                }
                for (Node argument : call.arguments()) {
                    if (fieldOf(argument).isPresent()) {
                        return valueType(argument, field);
                    }
                }
            }
            if (node instanceof Node.Binary binary && ARITHMETIC.contains(binary.operator())) {
                return valueType(fieldOf(binary.left()).isPresent() ? binary.left() : binary.right(), field);
            }
            if (node instanceof Node.Unary unary) {
                return valueType(unary.operand(), field);
            }
            return field.type();
        }

        private void checkValue(FieldDefinition field, Object value, Node.Binary node) {
            checkValue(field, field.type(), value, node);
        }

        private void checkValue(FieldDefinition field, FieldType type, Object value, Node.Binary node) {
            boolean compatible;
            if (type == FieldType.STRING) {
                compatible = value instanceof String;
            } else if (type.isNumeric()) {
                compatible = value instanceof Long || value instanceof Double;
            } else if (type == FieldType.JSON) {
                compatible = !(value instanceof Boolean);
            } else {
                compatible = false;
            }
            if (!compatible) {
                throw new CompileException("cannot compare field '" + field.name() + "' (" + type.name().toLowerCase(Locale.ROOT)
                        + ") with " + describe(value) + " using '" + node.operator() + "'");
            }
        }

        private String describe(Object value) {
            if (value instanceof String) {
                return "string literal";
            }
            if (value instanceof Boolean) {
                return "boolean literal";
            }
            return "numeric literal";
        }

        private FieldDefinition field(String name) {
            return registry.lookup(name)
                    .orElseThrow(() -> new CompileException("unknown field '" + name + "'"));
        }

        private void requireArity(Node.Call call, int expected) {
            if (call.arguments().size() != expected) {
                throw new CompileException(call.function() + "() expects " + expected + " argument(s) but got "
                        + call.arguments().size());
            }
        }
    }
}
