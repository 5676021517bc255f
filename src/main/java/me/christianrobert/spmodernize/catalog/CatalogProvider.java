package me.christianrobert.spmodernize.catalog;

import me.christianrobert.spmodernize.core.model.SourceUnit;

import java.util.List;

/**
 * Enumerates stored routines together with their current definition text.
 */
public interface CatalogProvider {

    /**
     * @return units in scope, ordered by schema and name
     * @throws CatalogException if the catalog cannot be read
     */
    List<SourceUnit> findUnits(CatalogScope scope);
}
