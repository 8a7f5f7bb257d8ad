package org.namix.naming;

/**
 * Rewrites a default identifier into the target naming convention.
 *
 * <p>Implementations must be pure: the same input always yields the same output and no state is kept
 * between calls. Callers are responsible for only ever passing unrewritten default names.
 * {@code null} and empty input are returned unchanged.
 */
@FunctionalInterface
public interface NameRewriter {

    String rewriteName(String name);

    static NameRewriter identity() {
        return name -> name;
    }
}
