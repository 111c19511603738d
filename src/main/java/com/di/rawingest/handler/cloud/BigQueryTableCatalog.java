package com.di.rawingest.handler.cloud;

import com.di.rawingest.handler.TableCatalog;
import com.di.rawingest.schema.TableRef;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.Table;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * {@link TableCatalog} backed by the BigQuery client.
 * <p>
 * The client is resolved on first lookup, so runs that stop before the destination check
 * never create one. {@link BigQuery#getTable} returns {@code null} for a missing table;
 * every other error surfaces as a {@link com.google.cloud.bigquery.BigQueryException}.
 */
@Component
@Slf4j
public class BigQueryTableCatalog implements TableCatalog {

    private final ObjectProvider<BigQuery> bigQuery;

    public BigQueryTableCatalog(ObjectProvider<BigQuery> bigQuery) {
        this.bigQuery = bigQuery;
    }

    @Override
    public boolean tableExists(TableRef table) {
        Table found = bigQuery.getObject().getTable(table.toTableId());
        boolean exists = found != null;
        log.debug("[CATALOG] {} exists={}", table, exists);
        return exists;
    }
}
