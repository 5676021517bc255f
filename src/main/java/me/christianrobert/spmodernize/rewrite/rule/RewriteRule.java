package me.christianrobert.spmodernize.rewrite.rule;

/**
 * A stateless text-to-text substitution.
 * Implementations must be idempotent: {@code apply(apply(t)).equals(apply(t))}.
 */
public interface RewriteRule {

    String getName();

    String apply(String text);
}
