package com.jcomp.comprehension;

import com.jcomp.ComprehensionSyntaxException;
import com.jcomp.ErrorKind;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Iterator;

/**
 * Clauses in the order written, which is also their nesting order from outermost to
 * innermost. Never empty, and always led by a {@link Clause.For}.
 */
public final class ClauseList implements Iterable<Clause> {
    private final ImmutableList<Clause> clauses;

    public ClauseList(ListIterable<Clause> clauses) {
        if (clauses.isEmpty() || !(clauses.getFirst() instanceof Clause.For)) {
            throw new ComprehensionSyntaxException(ErrorKind.MISSING_LOOP_CLAUSE,
                "The first clause of a comprehension must be 'for ... in ...'", -1);
        }
        this.clauses = Lists.immutable.withAll(clauses);
    }

    public int size() {
        return clauses.size();
    }

    public Clause get(int index) {
        return clauses.get(index);
    }

    public ImmutableList<Clause> asList() {
        return clauses;
    }

    @Override
    public Iterator<Clause> iterator() {
        return clauses.iterator();
    }

    @Override
    public String toString() {
        return clauses.toString();
    }
}
