package com.jcomp.value;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Runtime values produced and consumed by comprehensions.
 */
public sealed interface Value {

    record IntValue(long value) implements Value {}

    record FloatValue(double value) implements Value {}

    record StrValue(String value) implements Value {}

    record CharValue(char value) implements Value {}

    record BoolValue(boolean value) implements Value {
        public static final BoolValue TRUE = new BoolValue(true);
        public static final BoolValue FALSE = new BoolValue(false);

        public static BoolValue of(boolean value) {
            return value ? TRUE : FALSE;
        }
    }

    record TupleValue(ImmutableList<Value> elements) implements Value {
        public static TupleValue of(Value... elements) {
            return new TupleValue(Lists.immutable.of(elements));
        }

        public int arity() {
            return elements.size();
        }
    }

    record ListValue(MutableList<Value> elements) implements Value {
        public static ListValue empty() {
            return new ListValue(Lists.mutable.empty());
        }

        public static ListValue of(Value... elements) {
            return new ListValue(Lists.mutable.of(elements));
        }
    }

    record MapValue(MutableMap<Value, Value> entries) implements Value {
        public static MapValue empty() {
            return new MapValue(Maps.mutable.empty());
        }

        public MapValue with(Value key, Value value) {
            MutableMap<Value, Value> copy = Maps.mutable.ofMap(entries);
            copy.put(key, value);
            return new MapValue(copy);
        }
    }

    /**
     * Integer or char range, stepping by one. Chars are carried as their code unit.
     */
    record RangeValue(long start, long end, boolean inclusive, boolean chars) implements Value {
        public boolean isEmpty() {
            return inclusive ? start > end : start >= end;
        }

        /** The last element; only meaningful when the range is not empty. */
        public long last() {
            return inclusive ? end : end - 1;
        }

        /** Saturates at {@code Long.MAX_VALUE} for ranges wider than a long can count. */
        public long size() {
            if (isEmpty()) {
                return 0;
            }
            long span = last() - start;
            return span < 0 || span == Long.MAX_VALUE ? Long.MAX_VALUE : span + 1;
        }
    }

    record UnitValue() implements Value {
        public static final UnitValue INSTANCE = new UnitValue();
    }

    static Value of(long value) {
        return new IntValue(value);
    }

    static Value of(double value) {
        return new FloatValue(value);
    }

    static Value of(String value) {
        return new StrValue(value);
    }

    static Value of(char value) {
        return new CharValue(value);
    }

    static Value of(boolean value) {
        return BoolValue.of(value);
    }

    static Value unit() {
        return UnitValue.INSTANCE;
    }
}
