package com.jcomp.output;

import com.jcomp.value.Value;
import com.jcomp.value.Values;
import org.eclipse.collections.api.tuple.Pair;


public class ValueFormatter {
    private final boolean prettyPrint;
    private final boolean sortKeys;

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public ValueFormatter(boolean prettyPrint) {
        this(prettyPrint, false);
    }

    public ValueFormatter(boolean prettyPrint, boolean sortKeys) {
        this.prettyPrint = prettyPrint;
        this.sortKeys = sortKeys;
    }

    public String format(Value value) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        int mark = sb.length();

        // Values.show() may re-enter while an outer format() is still using the pooled builder
        if (prettyPrint) {
            formatPretty(value, 0, sb);
        } else {
            formatCompact(value, sb);
        }

        String result = sb.substring(mark);
        sb.setLength(mark);
        return result;
    }

    private void formatPretty(Value value, int indent, StringBuilder sb) {
        String indentStr = " ".repeat(indent);

        if (value instanceof Value.MapValue map) {
            if (map.entries().isEmpty()) {
                sb.append("{}");
                return;
            }

            sb.append("{\n");

            boolean first = true;
            for (var entry : entries(map)) {
                if (!first) {
                    sb.append(",\n");
                }
                first = false;

                sb.append(indentStr).append("  ");
                formatCompact(entry.getOne(), sb);
                sb.append(": ");
                formatPretty(entry.getTwo(), indent + 2, sb);
            }

            sb.append("\n").append(indentStr).append("}");
        } else if (value instanceof Value.ListValue list) {
            if (list.elements().isEmpty()) {
                sb.append("[]");
                return;
            }

            sb.append("[\n");

            boolean first = true;
            for (Value element : list.elements()) {
                if (!first) {
                    sb.append(",\n");
                }
                first = false;

                sb.append(indentStr).append("  ");
                formatPretty(element, indent + 2, sb);
            }

            sb.append("\n").append(indentStr).append("]");
        } else {
            // Scalars and tuples always print on one line
            formatCompact(value, sb);
        }
    }

    private void formatCompact(Value value, StringBuilder sb) {
        if (value instanceof Value.MapValue map) {
            sb.append("{");
            boolean first = true;
            for (var entry : entries(map)) {
                if (!first) {
                    sb.append(",");
                }
                first = false;
                formatCompact(entry.getOne(), sb);
                sb.append(":");
                formatCompact(entry.getTwo(), sb);
            }
            sb.append("}");
        } else if (value instanceof Value.ListValue list) {
            sb.append("[");
            boolean first = true;
            for (Value element : list.elements()) {
                if (!first) {
                    sb.append(",");
                }
                first = false;
                formatCompact(element, sb);
            }
            sb.append("]");
        } else if (value instanceof Value.TupleValue tuple) {
            sb.append("(");
            boolean first = true;
            for (Value element : tuple.elements()) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                formatCompact(element, sb);
            }
            if (tuple.arity() == 1) {
                sb.append(",");
            }
            sb.append(")");
        } else if (value instanceof Value.IntValue i) {
            sb.append(i.value());
        } else if (value instanceof Value.FloatValue f) {
            sb.append(f.value());
        } else if (value instanceof Value.StrValue s) {
            sb.append("\"").append(escape(s.value(), '"')).append("\"");
        } else if (value instanceof Value.CharValue c) {
            sb.append("'").append(escape(String.valueOf(c.value()), '\'')).append("'");
        } else if (value instanceof Value.BoolValue b) {
            sb.append(b.value());
        } else if (value instanceof Value.RangeValue r) {
            appendBound(r.start(), r.chars(), sb);
            sb.append(r.inclusive() ? "..=" : "..");
            appendBound(r.end(), r.chars(), sb);
        } else {
            sb.append("()");
        }
    }

    private Iterable<Pair<Value, Value>> entries(Value.MapValue map) {
        return sortKeys
            ? map.entries().keyValuesView().toSortedList((a, b) -> compareKeys(a.getOne(), b.getOne()))
            : map.entries().keyValuesView();
    }

    private static int compareKeys(Value a, Value b) {
        if (a instanceof Value.IntValue x && b instanceof Value.IntValue y) {
            return Long.compare(x.value(), y.value());
        }
        if (a instanceof Value.FloatValue x && b instanceof Value.FloatValue y) {
            return Double.compare(x.value(), y.value());
        }
        return Values.show(a).compareTo(Values.show(b));
    }

    private void appendBound(long bound, boolean chars, StringBuilder sb) {
        if (chars) {
            sb.append("'").append(escape(String.valueOf((char) bound), '\'')).append("'");
        } else {
            sb.append(bound);
        }
    }

    private String escape(String s, char quote) {
        // Fast path: if no escaping needed, return original
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == quote || c == '\n' || c == '\r' || c == '\t') {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default -> {
                    if (c == quote) {
                        result.append('\\');
                    }
                    result.append(c);
                }
            }
        }
        return result.toString();
    }
}
