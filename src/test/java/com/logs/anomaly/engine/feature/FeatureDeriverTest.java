package com.logs.anomaly.engine.feature;

import com.logs.anomaly.exception.DataFormatException;
import com.logs.anomaly.exception.InputMissingException;
import com.logs.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.logs.anomaly.testutil.TestDataFactory.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureDeriverTest {

    private FeatureDeriver deriver;

    @BeforeEach
    void setUp() {
        deriver = new FeatureDeriver();
    }

    @Test
    void derive_nullOrEmptyBatch_throwsInputMissing() {
        assertThatThrownBy(() -> deriver.derive(null)).isInstanceOf(InputMissingException.class);
        assertThatThrownBy(() -> deriver.derive(Collections.emptyList()))
                .isInstanceOf(InputMissingException.class)
                .hasMessage("No log data provided");
    }

    @Test
    void derive_timestamp_addsHourAndDayOfWeek() {
        FeatureMatrix matrix = deriver.derive(List.of(
                record("timestamp", "2024-01-15T10:30:00", "message", "login")));

        assertThat(matrix.getManifest().names()).containsExactly("hour", "day_of_week");
        assertThat(matrix.column("hour")).containsExactly(10.0);
        assertThat(matrix.column("day_of_week")).containsExactly(0.0);
    }

    @Test
    void derive_timestampVariants_decomposedInTheirOwnOffset() {
        FeatureMatrix matrix = deriver.derive(List.of(
                record("timestamp", "2024-01-20T23:15:00+05:30"),
                record("timestamp", "2024-01-16 08:00:00"),
                record("timestamp", "2024-01-21"),
                record("timestamp", "2024-01-17T14:05:09.123Z")));

        assertThat(matrix.column("hour")).containsExactly(23.0, 8.0, 0.0, 14.0);
        assertThat(matrix.column("day_of_week")).containsExactly(5.0, 1.0, 6.0, 2.0);
    }

    @Test
    void derive_columnOrder_firstSeenThenTimestampColumns() {
        FeatureMatrix matrix = deriver.derive(List.of(
                record("b", 1, "timestamp", "2024-01-15T10:30:00", "a", 2.5, "msg", "x"),
                record("a", 3.5, "timestamp", "2024-01-16T11:00:00", "b", 2, "msg", "y")));

        assertThat(matrix.getManifest().names()).containsExactly("b", "a", "hour", "day_of_week");
        assertThat(matrix.rowCount()).isEqualTo(2);
        assertThat(matrix.column("b")).containsExactly(1.0, 2.0);
        assertThat(matrix.column("a")).containsExactly(2.5, 3.5);
    }

    @Test
    void derive_derivedColumnsOverrideInputFieldsOfSameName() {
        FeatureMatrix matrix = deriver.derive(List.of(
                record("hour", 99, "timestamp", "2024-01-15T10:30:00")));

        assertThat(matrix.getManifest().names()).containsExactly("hour", "day_of_week");
        assertThat(matrix.column("hour")).containsExactly(10.0);
    }

    @Test
    void derive_nonNumericAndMixedColumns_areIgnored() {
        FeatureMatrix matrix = deriver.derive(List.of(
                record("status", 200, "code", "E1", "ok", true, "size", 10),
                record("status", "timeout", "code", "E2", "ok", false, "size", 12)));

        assertThat(matrix.getManifest().names()).containsExactly("size");
    }

    @Test
    void derive_columnWithOnlyNulls_isIgnored() {
        FeatureMatrix matrix = deriver.derive(List.of(
                record("trace", null, "size", 1),
                record("trace", null, "size", 2)));

        assertThat(matrix.getManifest().names()).containsExactly("size");
    }

    @Test
    void derive_noNumericColumns_fallsBackToRowIndex() {
        FeatureMatrix matrix = deriver.derive(TestDataFactory.textOnlyBatch(4));

        assertThat(matrix.getManifest().names()).containsExactly("dummy_feature");
        assertThat(matrix.column("dummy_feature")).containsExactly(0.0, 1.0, 2.0, 3.0);
    }

    @Test
    void derive_numericFieldMissingInOneRecord_throwsDataFormat() {
        List<Map<String, Object>> batch = List.of(
                record("latency", 10),
                record("message", "no latency here"),
                record("latency", 12));

        assertThatThrownBy(() -> deriver.derive(batch))
                .isInstanceOf(DataFormatException.class)
                .hasMessageContaining("latency")
                .hasMessageContaining("record 1");
    }

    @Test
    void derive_numericFieldExplicitNull_throwsDataFormat() {
        List<Map<String, Object>> batch = List.of(
                record("latency", 10),
                record("latency", null));

        assertThatThrownBy(() -> deriver.derive(batch))
                .isInstanceOf(DataFormatException.class)
                .hasMessageContaining("latency");
    }

    @Test
    void derive_unparseableTimestamp_failsWholeBatch() {
        List<Map<String, Object>> batch = List.of(
                record("timestamp", "2024-01-15T10:30:00"),
                record("timestamp", "yesterday at noon"));

        assertThatThrownBy(() -> deriver.derive(batch))
                .isInstanceOf(DataFormatException.class)
                .hasMessageContaining("timestamp")
                .hasMessageContaining("record 1");
    }

    @Test
    void derive_numericTimestamp_throwsDataFormat() {
        assertThatThrownBy(() -> deriver.derive(List.of(record("timestamp", 1705314600000L))))
                .isInstanceOf(DataFormatException.class)
                .hasMessageContaining("timestamp");
    }

    @Test
    void derive_timestampMissingFromSomeRecords_throwsDataFormat() {
        List<Map<String, Object>> batch = List.of(
                record("timestamp", "2024-01-15T10:30:00", "size", 1),
                record("size", 2));

        assertThatThrownBy(() -> deriver.derive(batch))
                .isInstanceOf(DataFormatException.class)
                .hasMessageContaining("timestamp");
    }

    @Test
    void derive_rowCountAlwaysMatchesBatch() {
        FeatureMatrix matrix = deriver.derive(TestDataFactory.timestampedBatch(37));

        assertThat(matrix.rowCount()).isEqualTo(37);
        assertThat(matrix.getManifest().names()).containsExactly("bytes", "hour", "day_of_week");
    }
}
