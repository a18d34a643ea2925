package com.pineparser.dump;

import com.pineparser.DeepStack;
import com.pineparser.ast.Node;

import java.util.List;

/**
 * Deterministic text dump of an AST, for inspection and debugging.
 *
 * <p>Without indentation every node renders on one line as {@code Type(field=value, ...)}.
 * With indentation each field goes on its own line and nested nodes and non-empty lists
 * are rendered one level deeper:</p>
 * <pre>
 * Script(
 *   body=[
 *     Expr(
 *       value=Call(
 *         func=Name(id='plot'),
 * ...
 * </pre>
 * Fields appear in the order the node declares them. Deep trees are rendered on a
 * {@link DeepStack} sized for their depth.
 */
public final class AstDump {

    private AstDump() {
        // Utility class
    }

    public static String dump(Node node) {
        return dump(node, "");
    }

    /**
     * @param indent number of spaces per level; 0 selects the single-line form
     */
    public static String dump(Node node, int indent) {
        if (indent < 0) {
            throw new IllegalArgumentException("indent must not be negative, got " + indent);
        }
        return dump(node, " ".repeat(indent));
    }

    /**
     * @param indent the string repeated once per level; null or empty selects the single-line form
     */
    public static String dump(Node node, String indent) {
        String unit = indent == null ? "" : indent;
        return DeepStack.call(DeepStack.treeDepth(node), () -> dumpNode(node, unit, 0));
    }

    private static String dumpNode(Node node, String indent, int depth) {
        List<Node.Field> fields = node.fields();
        if (indent.isEmpty() || fields.isEmpty()) {
            StringBuilder out = new StringBuilder();
            appendRepr(out, node);
            return out.toString();
        }

        StringBuilder out = new StringBuilder();
        out.append(node.type()).append("(\n");
        for (Node.Field field : fields) {
            out.append(indent.repeat(depth + 1))
                .append(field.name())
                .append('=')
                .append(dumpValue(field.value(), indent, depth + 1))
                .append(",\n");
        }
        out.append(indent.repeat(depth)).append(')');
        return out.toString();
    }

    private static String dumpValue(Object value, String indent, int depth) {
        if (value instanceof Node node) {
            return dumpNode(node, indent, depth);
        }
        if (value instanceof List<?> list && !list.isEmpty()) {
            StringBuilder out = new StringBuilder("[\n");
            for (Object item : list) {
                out.append(indent.repeat(depth + 1))
                    .append(dumpValue(item, indent, depth + 1))
                    .append(",\n");
            }
            out.append(indent.repeat(depth)).append(']');
            return out.toString();
        }
        StringBuilder out = new StringBuilder();
        appendRepr(out, value);
        return out.toString();
    }

    /**
     * Single-line representation of any field value.
     */
    public static String repr(Object value) {
        return DeepStack.call(DeepStack.treeDepth(value), () -> {
            StringBuilder out = new StringBuilder();
            appendRepr(out, value);
            return out.toString();
        });
    }

    private static void appendRepr(StringBuilder out, Object value) {
        if (value instanceof Node node) {
            out.append(node.type()).append('(');
            String separator = "";
            for (Node.Field field : node.fields()) {
                out.append(separator).append(field.name()).append('=');
                appendRepr(out, field.value());
                separator = ", ";
            }
            out.append(')');
        } else if (value instanceof List<?> list) {
            out.append('[');
            String separator = "";
            for (Object item : list) {
                out.append(separator);
                appendRepr(out, item);
                separator = ", ";
            }
            out.append(']');
        } else {
            out.append(Literals.repr(value));
        }
    }
}
