package org.namix.convention;

import org.namix.naming.NameRewriter;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable, ordered list of conventions.
 *
 * <p>The order is the delivery order of every event, including {@link ModelConvention#modelFinalizing}.
 * Conventions that depend on the outcome of another one must be registered after it.
 */
public final class ConventionSet {

    private final List<ModelConvention> conventions;

    private ConventionSet(List<ModelConvention> conventions) {
        this.conventions = List.copyOf(conventions);
    }

    public static ConventionSet empty() {
        return new ConventionSet(List.of());
    }

    public static ConventionSet of(ModelConvention... conventions) {
        return new ConventionSet(List.of(conventions));
    }

    /**
     * Host conventions every model needs: currently the shared-column disambiguation pass.
     */
    public static ConventionSet createDefault() {
        return of(new SharedColumnConvention());
    }

    /**
     * Default conventions followed by the name-rewriting convention, which has to come last.
     */
    public static ConventionSet withNameRewriting(NameRewriter rewriter) {
        return createDefault().plus(new NameRewritingConvention(rewriter));
    }

    /**
     * Returns a new set with {@code convention} appended at the end.
     */
    public ConventionSet plus(ModelConvention convention) {
        if (convention == null) {
            throw new IllegalArgumentException("convention must not be null");
        }
        List<ModelConvention> next = new ArrayList<>(conventions);
        next.add(convention);
        return new ConventionSet(next);
    }

    public List<ModelConvention> getConventions() {
        return conventions;
    }

    public int size() {
        return conventions.size();
    }
}
