package com.rollupquery.infrastructure.sql;

import com.rollupquery.domain.model.QueryDescriptor;

/**
 * Turns a query descriptor into SQL against a chosen source.
 */
public interface SqlAssembler {

    /**
     * @param descriptor the query
     * @param source     rollup name or raw table chosen by the router
     * @return executable SQL
     * @throws com.rollupquery.domain.parse.MalformedDescriptorException if the descriptor
     *         contains identifiers or values that cannot be rendered safely
     */
    String assemble(QueryDescriptor descriptor, String source);
}
