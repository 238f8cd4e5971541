package com.meterly.api.catalog.entities;

import com.fasterxml.jackson.core.type.TypeReference;
import com.meterly.api.contracts.CatalogSnapshot;
import com.meterly.api.platform.persistence.JsonTextConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores the modules bundled with a plan as a JSON array.
 */
@Converter
public class IncludedModulesConverter extends JsonTextConverter<List<CatalogSnapshot.IncludedModule>> {

    public IncludedModulesConverter() {
        super(new TypeReference<List<CatalogSnapshot.IncludedModule>>() {
        });
    }

    @Override
    protected List<CatalogSnapshot.IncludedModule> emptyValue() {
        return new ArrayList<>();
    }
}
