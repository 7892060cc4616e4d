package com.datachain.resolver;

import com.datachain.query.Dimension;
import com.datachain.types.Sorting;

/**
 * Order-by entry typed by what it sorts on.
 */
public sealed interface ResolvedOrderBy {

    Sorting sorting();

    record ByDimension(Dimension dimension, Sorting sorting) implements ResolvedOrderBy {
    }

    record ByMeasure(ResolvedMeasure measure, Sorting sorting) implements ResolvedOrderBy {
    }
}
