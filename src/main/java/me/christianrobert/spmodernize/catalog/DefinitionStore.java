package me.christianrobert.spmodernize.catalog;

import me.christianrobert.spmodernize.core.model.UnitIdentity;

import java.util.Optional;

/**
 * Reads and replaces the definition text of a stored routine.
 */
public interface DefinitionStore {

    /**
     * @return current definition, or empty if the unit does not exist
     */
    Optional<String> getText(UnitIdentity unit);

    /**
     * Deploys {@code text} as the new definition of the unit.
     *
     * @throws CommitException if the store rejects the text
     */
    void setText(UnitIdentity unit, String text);
}
