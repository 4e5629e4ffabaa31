package com.library.circulation.service;

import java.util.OptionalInt;

/**
 * Read-only view of the catalog that the circulation engine depends on.
 * Copy-count changes flow the other way, through
 * {@link CirculationCoordinator#onTotalCopiesChanged}.
 */
public interface TitleCatalog {

    /** Current number of physical copies, or empty if the title is unknown. */
    OptionalInt totalCopies(Long titleId);
}
