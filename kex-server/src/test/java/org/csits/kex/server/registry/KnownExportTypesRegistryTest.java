package org.csits.kex.server.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Collections;
import org.csits.kex.server.datasource.InMemoryPagedDataSource;
import org.csits.kex.server.datasource.PagedDataSourceFactory;
import org.csits.kex.server.exception.UnknownExportTypeException;
import org.junit.jupiter.api.Test;

class KnownExportTypesRegistryTest {

    private static final PagedDataSourceFactory EMPTY =
        query -> new InMemoryPagedDataSource<>(query, Collections::emptyList);

    @Test
    void collectsDefinitionsInRegistrationOrder() {
        KnownExportTypesRegistry registry = new KnownExportTypesRegistry(Arrays.asList(
            definition("Catalog.Product", "catalog:export"),
            definition("Order.CustomerOrder", "order:export")));

        assertThat(registry.getRegisteredTypes())
            .extracting(ExportedTypeDefinition::getName)
            .containsExactly("Catalog.Product", "Order.CustomerOrder");
    }

    @Test
    void register_lastWriteWins() {
        KnownExportTypesRegistry registry = new KnownExportTypesRegistry(Collections.emptyList());
        registry.register(definition("Catalog.Product", "catalog:export"));
        ExportedTypeDefinition replacement = definition("Catalog.Product", "catalog:export:all");

        registry.register(replacement);

        assertThat(registry.resolveExportedTypeDefinition("Catalog.Product")).isSameAs(replacement);
        assertThat(registry.getRegisteredTypes()).hasSize(1);
    }

    @Test
    void resolve_unknownNameFails() {
        KnownExportTypesRegistry registry = new KnownExportTypesRegistry(Collections.emptyList());

        assertThatThrownBy(() -> registry.resolveExportedTypeDefinition("Catalog.Missing"))
            .isInstanceOf(UnknownExportTypeException.class)
            .extracting("exportTypeName").isEqualTo("Catalog.Missing");
        assertThatThrownBy(() -> registry.resolveExportedTypeDefinition(null))
            .isInstanceOf(UnknownExportTypeException.class);
    }

    @Test
    void register_rejectsIncompleteDefinitions() {
        KnownExportTypesRegistry registry = new KnownExportTypesRegistry(Collections.emptyList());

        assertThatThrownBy(() -> registry.register(definition(" ", null)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(ExportedTypeDefinition.builder().name("NoSource").build()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void policyName_derivedFromTypeName() {
        assertThat(definition("Catalog.Product", null).getPolicyName())
            .isEqualTo("Catalog.ProductExportDataPolicy");
    }

    private static ExportedTypeDefinition definition(String name, String permission) {
        return ExportedTypeDefinition.builder()
            .name(name)
            .requiredPermission(permission)
            .dataSourceFactory(EMPTY)
            .build();
    }
}
