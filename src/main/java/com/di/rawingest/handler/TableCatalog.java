package com.di.rawingest.handler;

import com.di.rawingest.schema.TableRef;

/**
 * Read-only view of the warehouse metadata catalog, used to look up the destination before a load.
 */
public interface TableCatalog {

    /**
     * @return {@code true} if the table exists; {@code false} only for the not-found case.
     *         Any other lookup failure is thrown.
     */
    boolean tableExists(TableRef table);
}
