package eu.fbk.stardog.data;

import java.util.Iterator;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.openrdf.query.BindingSet;

/**
 * The decoded result of a query.
 * <p>
 * The shape of the result depends on the {@link QueryKind}: SELECT and PATHS queries produce
 * {@link Tuples}, ASK queries produce a {@link Bool}, while GRAPH, UPDATE and EXPLAIN queries
 * produce {@link Text} (an RDF document, an acknowledgement and a plan, respectively).
 * </p>
 */
public abstract class QueryResult {

    private final QueryKind kind;

    QueryResult(final QueryKind kind) {
        this.kind = Preconditions.checkNotNull(kind);
    }

    public static Tuples tuples(final QueryKind kind, final List<String> variables,
            final List<BindingSet> rows) {
        return new Tuples(kind, variables, rows);
    }

    public static Bool bool(final QueryKind kind, final boolean value) {
        return new Bool(kind, value);
    }

    public static Text text(final QueryKind kind, final String text) {
        return new Text(kind, text);
    }

    public final QueryKind getKind() {
        return this.kind;
    }

    /**
     * A table of variable bindings, with rows in server order.
     */
    public static final class Tuples extends QueryResult implements Iterable<BindingSet> {

        private final List<String> variables;

        private final List<BindingSet> rows;

        Tuples(final QueryKind kind, final List<String> variables, final List<BindingSet> rows) {
            super(kind);
            Preconditions.checkArgument(kind.isTupleKind(), "Not a tuple query kind: %s", kind);
            this.variables = ImmutableList.copyOf(variables);
            this.rows = ImmutableList.copyOf(rows);
        }

        public List<String> getVariables() {
            return this.variables;
        }

        public List<BindingSet> getRows() {
            return this.rows;
        }

        public int size() {
            return this.rows.size();
        }

        @Override
        public Iterator<BindingSet> iterator() {
            return this.rows.iterator();
        }

        @Override
        public String toString() {
            return this.rows.size() + " tuple(s)";
        }

    }

    public static final class Bool extends QueryResult {

        private final boolean value;

        Bool(final QueryKind kind, final boolean value) {
            super(kind);
            this.value = value;
        }

        public boolean getValue() {
            return this.value;
        }

        @Override
        public String toString() {
            return Boolean.toString(this.value);
        }

    }

    public static final class Text extends QueryResult {

        private final String text;

        Text(final QueryKind kind, final String text) {
            super(kind);
            this.text = Preconditions.checkNotNull(text);
        }

        public String getText() {
            return this.text;
        }

        @Override
        public String toString() {
            return this.text.length() + " char(s)";
        }

    }

}
