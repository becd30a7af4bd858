package com.catalog.crossmatch.schema;

/**
 * Built-in schemas.
 */
public final class DefaultSchemas {

    private DefaultSchemas() {
    }

    /**
     * Schema whose columns already carry the canonical names.
     */
    public static CatalogueSchema canonical(String name) {
        return CatalogueSchema.builder(name).build();
    }
}
