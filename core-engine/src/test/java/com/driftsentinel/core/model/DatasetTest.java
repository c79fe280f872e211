package com.driftsentinel.core.model;

import com.driftsentinel.core.error.SchemaMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Dataset}.
 */
class DatasetTest {

    @Test
    @DisplayName("Should extract columns in row order")
    void shouldExtractColumns() {
        Dataset dataset = Dataset.of(new double[][] { { 1, 10 }, { 2, 20 }, { 3, 30 } });

        assertThat(dataset.width()).isEqualTo(2);
        assertThat(dataset.rowCount()).isEqualTo(3);
        assertThat(dataset.column(1)).containsExactly(10, 20, 30);
    }

    @Test
    @DisplayName("Should copy the input matrix")
    void shouldCopyInput() {
        double[][] rows = { { 1, 2 } };
        Dataset dataset = Dataset.of(rows);

        rows[0][0] = 99;

        assertThat(dataset.column(0)).containsExactly(1);
    }

    @Test
    @DisplayName("Should reject ragged rows")
    void shouldRejectRaggedRows() {
        assertThatThrownBy(() -> Dataset.of(new double[][] { { 1, 2 }, { 3 } }))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("Row 1");
    }

    @Test
    @DisplayName("Empty dataset keeps its declared width")
    void emptyKeepsWidth() {
        assertThat(Dataset.empty(4).width()).isEqualTo(4);
        assertThat(Dataset.empty(4).rowCount()).isZero();
        assertThat(Dataset.of(new double[0][]).width()).isZero();
    }

    @Test
    @DisplayName("Should reject out-of-range column index")
    void shouldRejectBadColumn() {
        Dataset dataset = Dataset.of(new double[][] { { 1, 2 } });

        assertThatThrownBy(() -> dataset.column(2)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
