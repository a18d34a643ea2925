package com.pineparser.unparse;

import com.pineparser.DeepStack;
import com.pineparser.ast.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an AST back to Pine Script source. Blocks are indented by four spaces and
 * parentheses are only emitted where operator precedence requires them, so re-parsing
 * the output yields a structurally equal tree.
 */
public class Unparser {

    private static final String INDENT = "    ";

    // Precedence levels, matching the parser's binding powers.
    private static final int PREC_TERNARY = 1;
    private static final int PREC_OR = 2;
    private static final int PREC_AND = 3;
    private static final int PREC_EQUALITY = 4;
    private static final int PREC_RELATIONAL = 5;
    private static final int PREC_ADDITIVE = 6;
    private static final int PREC_MULTIPLICATIVE = 7;
    private static final int PREC_UNARY = 8;
    private static final int PREC_ATOM = 10;

    /**
     * Renders any node. Deep trees are rendered on a {@link DeepStack} sized for their depth.
     */
    public String unparse(Node node) {
        return DeepStack.call(DeepStack.treeDepth(node), () -> write(node));
    }

    public String expr(Expression e) {
        return DeepStack.call(DeepStack.treeDepth(e), () -> render(e));
    }

    private String write(Node node) {
        StringBuilder out = new StringBuilder();
        if (node instanceof Script script) {
            if (script.version() != null) {
                out.append("//@version=").append(script.version()).append('\n');
            }
            writeStatements(out, script.body(), 0);
        } else if (node instanceof Statement statement) {
            writeStatement(out, statement, 0);
        } else if (node instanceof Expression expression) {
            if (isStructure(expression)) {
                writeStructure(out, "", expression, 0);
            } else {
                out.append(render(expression));
            }
        } else if (node instanceof Arg arg) {
            out.append(arg(arg));
        } else if (node instanceof Param param) {
            out.append(param(param));
        } else if (node instanceof TypeField field) {
            out.append(typeField(field));
        } else if (node instanceof Case c) {
            writeCase(out, c, 0);
        }
        return out.toString();
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private void writeStatements(StringBuilder out, List<Statement> statements, int level) {
        for (Statement statement : statements) {
            writeStatement(out, statement, level);
        }
    }

    private void writeStatement(StringBuilder out, Statement statement, int level) {
        if (statement instanceof Expr e) {
            writeValueLine(out, "", e.value(), level);
        } else if (statement instanceof Assign a) {
            StringBuilder prefix = new StringBuilder();
            if (a.mode() != null) {
                prefix.append(a.mode()).append(' ');
            }
            if (a.declaredType() != null) {
                prefix.append(render(a.declaredType())).append(' ');
            }
            prefix.append(render(a.target())).append(" = ");
            writeValueLine(out, prefix.toString(), a.value(), level);
        } else if (statement instanceof ReAssign r) {
            writeValueLine(out, render(r.target()) + " := ", r.value(), level);
        } else if (statement instanceof AugAssign a) {
            writeValueLine(out, render(a.target()) + " " + a.op() + "= ", a.value(), level);
        } else if (statement instanceof Import i) {
            String line = "import " + i.namespace() + "/" + i.name() + "/" + i.version();
            if (i.alias() != null) {
                line += " as " + i.alias();
            }
            writeLine(out, line, level);
        } else if (statement instanceof FunctionDef f) {
            writeFunctionDef(out, f, level);
        } else if (statement instanceof TypeDef t) {
            writeLine(out, (t.export() ? "export " : "") + "type " + t.name(), level);
            for (TypeField field : t.body()) {
                writeLine(out, typeField(field), level + 1);
            }
        } else if (statement instanceof Break) {
            writeLine(out, "break", level);
        } else if (statement instanceof Continue) {
            writeLine(out, "continue", level);
        }
    }

    private void writeFunctionDef(StringBuilder out, FunctionDef f, int level) {
        StringBuilder header = new StringBuilder();
        if (f.export()) {
            header.append("export ");
        }
        if (f.method()) {
            header.append("method ");
        }
        header.append(f.name())
            .append(f.args().stream().map(this::param).collect(Collectors.joining(", ", "(", ")")))
            .append(" =>");
        writeBody(out, header.toString(), f.body(), level);
    }

    /**
     * Writes {@code header} followed by the body: on the same line when the body is a single
     * plain expression, as an indented block otherwise.
     */
    private void writeBody(StringBuilder out, String header, List<Statement> body, int level) {
        if (body.size() == 1 && body.get(0) instanceof Expr e && !isStructure(e.value())) {
            writeLine(out, header + " " + render(e.value()), level);
            return;
        }
        writeLine(out, header, level);
        writeStatements(out, body, level + 1);
    }

    private void writeValueLine(StringBuilder out, String prefix, Expression value, int level) {
        if (isStructure(value)) {
            writeStructure(out, prefix, value, level);
        } else {
            writeLine(out, prefix + render(value), level);
        }
    }

    // ========================================================================
    // Structures (if, switch, loops)
    // ========================================================================

    private boolean isStructure(Expression expression) {
        return expression instanceof If
            || expression instanceof Switch
            || expression instanceof ForTo
            || expression instanceof ForIn
            || expression instanceof While;
    }

    private void writeStructure(StringBuilder out, String prefix, Expression structure, int level) {
        if (structure instanceof If i) {
            writeIf(out, prefix + "if ", i, level);
        } else if (structure instanceof Switch s) {
            writeLine(out, prefix + "switch" + (s.subject() != null ? " " + render(s.subject()) : ""), level);
            for (Case c : s.cases()) {
                writeCase(out, c, level + 1);
            }
        } else if (structure instanceof ForTo f) {
            String header = prefix + "for " + render(f.target()) + " = " + render(f.start()) + " to " + render(f.end());
            if (f.step() != null) {
                header += " by " + render(f.step());
            }
            writeLine(out, header, level);
            writeStatements(out, f.body(), level + 1);
        } else if (structure instanceof ForIn f) {
            writeLine(out, prefix + "for " + render(f.target()) + " in " + render(f.iter()), level);
            writeStatements(out, f.body(), level + 1);
        } else if (structure instanceof While w) {
            writeLine(out, prefix + "while " + render(w.test()), level);
            writeStatements(out, w.body(), level + 1);
        }
    }

    private void writeIf(StringBuilder out, String header, If node, int level) {
        writeLine(out, header + render(node.test()), level);
        writeStatements(out, node.body(), level + 1);

        List<Statement> orelse = node.orelse();
        if (orelse.size() == 1 && orelse.get(0) instanceof Expr e && e.value() instanceof If elseIf) {
            writeIf(out, "else if ", elseIf, level);
        } else if (!orelse.isEmpty()) {
            writeLine(out, "else", level);
            writeStatements(out, orelse, level + 1);
        }
    }

    private void writeCase(StringBuilder out, Case c, int level) {
        String header = c.pattern() != null ? render(c.pattern()) + " =>" : "=>";
        writeBody(out, header, c.body(), level);
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private String render(Expression e) {
        if (e instanceof Name n) {
            return n.id();
        }
        if (e instanceof Constant c) {
            return constant(c);
        }
        if (e instanceof Attribute a) {
            return wrap(a.value(), PREC_ATOM) + "." + a.attr();
        }
        if (e instanceof Subscript s) {
            return wrap(s.value(), PREC_ATOM) + "[" + render(s.slice()) + "]";
        }
        if (e instanceof Call c) {
            return wrap(c.func(), PREC_ATOM)
                + c.args().stream().map(this::arg).collect(Collectors.joining(", ", "(", ")"));
        }
        if (e instanceof Specialize s) {
            return wrap(s.value(), PREC_ATOM)
                + s.args().stream().map(this::render).collect(Collectors.joining(", ", "<", ">"));
        }
        if (e instanceof Tuple t) {
            return t.elts().stream().map(this::render).collect(Collectors.joining(", ", "[", "]"));
        }
        if (e instanceof BinOp b) {
            int prec = precedence(b);
            return wrap(b.left(), prec) + " " + b.op() + " " + wrap(b.right(), prec + 1);
        }
        if (e instanceof Compare c) {
            int prec = precedence(c);
            return wrap(c.left(), prec) + " " + c.op() + " " + wrap(c.right(), prec + 1);
        }
        if (e instanceof BoolOp b) {
            int prec = precedence(b);
            return b.values().stream()
                .map(value -> wrap(value, prec + 1))
                .collect(Collectors.joining(" " + b.op() + " "));
        }
        if (e instanceof UnaryOp u) {
            String op = u.op().equals("not") ? "not " : u.op();
            return op + wrap(u.operand(), PREC_UNARY);
        }
        if (e instanceof Conditional c) {
            return wrap(c.test(), PREC_TERNARY + 1) + " ? " + render(c.body()) + " : " + render(c.orelse());
        }
        throw new IllegalArgumentException(e.type() + " cannot be rendered inside an expression");
    }

    private String wrap(Expression e, int minPrecedence) {
        String text = render(e);
        return precedence(e) < minPrecedence ? "(" + text + ")" : text;
    }

    private int precedence(Expression e) {
        if (e instanceof Conditional) {
            return PREC_TERNARY;
        }
        if (e instanceof BoolOp b) {
            return b.op().equals("or") ? PREC_OR : PREC_AND;
        }
        if (e instanceof Compare c) {
            return c.op().equals("==") || c.op().equals("!=") ? PREC_EQUALITY : PREC_RELATIONAL;
        }
        if (e instanceof BinOp b) {
            return b.op().equals("+") || b.op().equals("-") ? PREC_ADDITIVE : PREC_MULTIPLICATIVE;
        }
        if (e instanceof UnaryOp) {
            return PREC_UNARY;
        }
        return PREC_ATOM;
    }

    private String constant(Constant c) {
        Object value = c.value();
        if ("color".equals(c.kind())) {
            return String.valueOf(value);
        }
        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof Boolean b) {
            return b ? "true" : "false";
        }
        if (value instanceof Double d) {
            return Double.toString(d);
        }
        return String.valueOf(value);
    }

    private String quote(String s) {
        StringBuilder out = new StringBuilder("\"");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\t' -> out.append("\\t");
                case '\r' -> out.append("\\r");
                default -> out.append(c);
            }
        }
        return out.append('"').toString();
    }

    private String arg(Arg arg) {
        return (arg.name() != null ? arg.name() + "=" : "") + render(arg.value());
    }

    private String param(Param param) {
        StringBuilder out = new StringBuilder();
        if (param.declaredType() != null) {
            out.append(render(param.declaredType())).append(' ');
        }
        out.append(param.name());
        if (param.defaultValue() != null) {
            out.append(" = ").append(render(param.defaultValue()));
        }
        return out.toString();
    }

    private String typeField(TypeField field) {
        String text = render(field.declaredType()) + " " + field.name();
        return field.defaultValue() != null ? text + " = " + render(field.defaultValue()) : text;
    }

    private void writeLine(StringBuilder out, String text, int level) {
        out.append(INDENT.repeat(level)).append(text).append('\n');
    }
}
