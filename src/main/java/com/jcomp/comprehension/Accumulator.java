package com.jcomp.comprehension;

import com.jcomp.value.Value;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

/**
 * The output container of a single evaluation. Never shared between evaluations and not
 * visible to the caller until evaluation completes.
 */
public interface Accumulator {

    void append(Value value);

    void insert(Value key, Value value);

    Value result();

    static Accumulator forKind(OutputKind kind) {
        return switch (kind) {
            case SEQUENCE -> new SequenceAccumulator();
            case MAPPING -> new MappingAccumulator();
            case STATEMENT -> new StatementAccumulator();
        };
    }

    final class SequenceAccumulator implements Accumulator {
        private final MutableList<Value> elements = Lists.mutable.empty();

        @Override
        public void append(Value value) {
            elements.add(value);
        }

        @Override
        public void insert(Value key, Value value) {
            throw new UnsupportedOperationException("A sequence comprehension has no keys");
        }

        @Override
        public Value result() {
            return new Value.ListValue(elements);
        }
    }

    /** Hash-ordered; a repeated key keeps the value inserted last. */
    final class MappingAccumulator implements Accumulator {
        private final MutableMap<Value, Value> entries = Maps.mutable.empty();

        @Override
        public void append(Value value) {
            throw new UnsupportedOperationException("A mapping comprehension needs a key");
        }

        @Override
        public void insert(Value key, Value value) {
            entries.put(key, value);
        }

        @Override
        public Value result() {
            return new Value.MapValue(entries);
        }
    }

    final class StatementAccumulator implements Accumulator {
        @Override
        public void append(Value value) {
            throw new UnsupportedOperationException("A statement comprehension collects nothing");
        }

        @Override
        public void insert(Value key, Value value) {
            throw new UnsupportedOperationException("A statement comprehension collects nothing");
        }

        @Override
        public Value result() {
            return Value.unit();
        }
    }
}
