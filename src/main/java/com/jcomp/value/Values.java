package com.jcomp.value;

import com.jcomp.EvaluationException;
import com.jcomp.output.ValueFormatter;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Iterator;
import java.util.NoSuchElementException;

public final class Values {
    private static final ValueFormatter COMPACT = new ValueFormatter(false);

    private Values() {
    }

    public static String typeName(Value value) {
        if (value instanceof Value.IntValue) {
            return "int";
        } else if (value instanceof Value.FloatValue) {
            return "float";
        } else if (value instanceof Value.StrValue) {
            return "string";
        } else if (value instanceof Value.CharValue) {
            return "char";
        } else if (value instanceof Value.BoolValue) {
            return "bool";
        } else if (value instanceof Value.TupleValue) {
            return "tuple";
        } else if (value instanceof Value.ListValue) {
            return "list";
        } else if (value instanceof Value.MapValue) {
            return "map";
        } else if (value instanceof Value.RangeValue) {
            return "range";
        }
        return "unit";
    }

    public static String show(Value value) {
        return COMPACT.format(value);
    }

    /**
     * Elements produced by iterating {@code value}. Maps yield {@code (key, value)} tuples.
     *
     * @throws EvaluationException if the value is not iterable
     */
    public static Iterable<Value> iterate(Value value) {
        if (value instanceof Value.ListValue list) {
            // Snapshot so a body that appends to the list it iterates cannot loop forever
            return Lists.immutable.withAll(list.elements());
        } else if (value instanceof Value.TupleValue tuple) {
            return tuple.elements();
        } else if (value instanceof Value.RangeValue range) {
            return () -> rangeIterator(range);
        } else if (value instanceof Value.StrValue str) {
            return Lists.immutable.withAll(str.value().chars().mapToObj(c -> Value.of((char) c)).toList());
        } else if (value instanceof Value.MapValue map) {
            return map.entries().keyValuesView()
                .collect(pair -> (Value) Value.TupleValue.of(pair.getOne(), pair.getTwo()))
                .toList()
                .toImmutable();
        }
        throw new EvaluationException("Value of type " + typeName(value) + " is not iterable: " + show(value));
    }

    private static Iterator<Value> rangeIterator(Value.RangeValue range) {
        return new Iterator<>() {
            private long next = range.start();
            private boolean exhausted = range.isEmpty();

            @Override
            public boolean hasNext() {
                return !exhausted;
            }

            @Override
            public Value next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                long current = next;
                if (current == range.last()) {
                    exhausted = true;
                } else {
                    next++;
                }
                return range.chars() ? Value.of((char) current) : Value.of(current);
            }
        };
    }
}
