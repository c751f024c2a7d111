package com.lantern.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ColumnCatalog
 */
@DisplayName("ColumnCatalog Tests")
class ColumnCatalogTest {

    @Test
    @DisplayName("Should find columns by name and id")
    void findsByNameAndId() {
        // Given: The fixture catalog
        ColumnCatalog catalog = ColumnFixtures.catalog();

        // When / Then: Lookups match display names and ids, and misses are empty
        assertThat(catalog.find("Model")).map(ColumnDefinition::getQualifiedColumn)
            .contains("o.provided_model_name");
        assertThat(catalog.find("model")).isEqualTo(catalog.find("Model"));
        assertThat(catalog.find(null)).isEmpty();
        assertThat(catalog.find("missing")).isEmpty();
    }

    @Test
    @DisplayName("Require should throw UnknownFieldException for unknown references")
    void requireUnknown() {
        // Given: A reference the catalog does not define

        // When / Then: The error names the column
        assertThatThrownBy(() -> ColumnFixtures.catalog().require("missing"))
            .isInstanceOf(UnknownFieldException.class)
            .extracting("column").isEqualTo("missing");
    }

    @Test
    @DisplayName("Conflicting references should be rejected")
    void rejectsConflicts() {
        // Given: One column whose id collides with another column's name
        List<ColumnDefinition> columns = List.of(
            new ColumnDefinition("Name", "name", TableTag.TRACES, "name", ColumnType.STRING),
            new ColumnDefinition("Other", "Name", TableTag.SCORES, "name", ColumnType.STRING));

        // When / Then
        assertThatThrownBy(() -> new ColumnCatalog(columns))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Name");
    }
}
