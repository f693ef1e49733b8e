package com.msgpattern.decoder.schema;

/**
 * Callback for the outcome of each definition line while a {@link SchemaCatalog} is built.
 */
public interface CatalogBuildListener {

    CatalogBuildListener NOOP = new CatalogBuildListener() {};

    /**
     * Called when a pattern is added to the catalog.
     */
    default void onPatternAccepted(MessagePattern pattern) {}

    /**
     * Called when a definition line fails to parse.
     */
    default void onDefinitionRejected(SchemaParseException error) {}

    /**
     * Called when a pattern is discarded because its id is already taken.
     *
     * @param discarded the later definition
     * @param kept the definition already in the catalog
     */
    default void onDuplicateDiscarded(MessagePattern discarded, MessagePattern kept) {}
}
