package com.foo.sheetimport.service.pipeline.clean;

import static org.assertj.core.api.Assertions.assertThat;

import com.foo.sheetimport.dataset.CellValue;
import com.foo.sheetimport.dataset.ColumnType;
import com.foo.sheetimport.dataset.Dataset;
import com.foo.sheetimport.dataset.DatasetColumn;
import com.foo.sheetimport.service.pipeline.clean.TypeInferrer.TypedColumn;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TypeInferrerTest {

  private final TypeInferrer inferrer = new TypeInferrer();

  @Test
  void mostlyNumericText_isPromotedAndStragglersBecomeNull() {
    List<CellValue> values = texts(85, "1200", 15, "n/a");

    TypedColumn typed = inferrer.inferColumn("revenue", values);

    assertThat(typed.type()).isEqualTo(ColumnType.INTEGER);
    assertThat(typed.values()).hasSize(100);
    assertThat(typed.values().stream().filter(CellValue::isNull)).hasSize(15);
    assertThat(typed.values().get(0)).isEqualTo(CellValue.integer(1200));
  }

  @Test
  void belowThreshold_staysText() {
    List<CellValue> values = texts(70, "42", 30, "pending");

    TypedColumn typed = inferrer.inferColumn("status", values);

    assertThat(typed.type()).isEqualTo(ColumnType.TEXT);
    assertThat(typed.values()).isEqualTo(values);
  }

  @Test
  void exactlyAtThreshold_isPromoted() {
    TypedColumn typed = inferrer.inferColumn("score", texts(80, "7", 20, "x"));

    assertThat(typed.type()).isEqualTo(ColumnType.INTEGER);
  }

  @Test
  void nullsDoNotCountTowardsThreshold() {
    List<CellValue> values = new ArrayList<>(texts(9, "3.25", 1, "unknown"));
    for (int i = 0; i < 50; i++) {
      values.add(CellValue.NULL);
    }

    TypedColumn typed = inferrer.inferColumn("rate", values);

    assertThat(typed.type()).isEqualTo(ColumnType.DECIMAL);
    assertThat(typed.values().get(0)).isEqualTo(CellValue.decimal(new BigDecimal("3.25")));
  }

  @Test
  void fractionalValues_makeColumnDecimal() {
    TypedColumn typed =
        inferrer.inferColumn(
            "price", List.of(CellValue.text("10"), CellValue.text("12.5"), CellValue.text("1e3")));

    assertThat(typed.type()).isEqualTo(ColumnType.DECIMAL);
    assertThat(typed.values())
        .extracting(CellValue::asDecimal)
        .usingElementComparator(BigDecimal::compareTo)
        .containsExactly(new BigDecimal("10"), new BigDecimal("12.5"), new BigDecimal("1000"));
  }

  @Test
  void wholeNumbersWrittenWithTrailingZeros_areInteger() {
    TypedColumn typed =
        inferrer.inferColumn("count", List.of(CellValue.text("1.0"), CellValue.text("2")));

    assertThat(typed.type()).isEqualTo(ColumnType.INTEGER);
    assertThat(typed.values()).containsExactly(CellValue.integer(1), CellValue.integer(2));
  }

  @Test
  void mixedNativeAndTextNumbers_arePromoted() {
    TypedColumn typed =
        inferrer.inferColumn("qty", List.of(CellValue.integer(5), CellValue.text("7")));

    assertThat(typed.type()).isEqualTo(ColumnType.INTEGER);
    assertThat(typed.values()).containsExactly(CellValue.integer(5), CellValue.integer(7));
  }

  @Test
  void nativeIntegerColumn_staysIntegerWithNulls() {
    TypedColumn typed =
        inferrer.inferColumn("units", List.of(CellValue.integer(1), CellValue.NULL));

    assertThat(typed.type()).isEqualTo(ColumnType.INTEGER);
    assertThat(typed.values()).containsExactly(CellValue.integer(1), CellValue.NULL);
  }

  @Test
  void nativeIntegerAndDecimal_widenToDecimal() {
    TypedColumn typed =
        inferrer.inferColumn(
            "amount", List.of(CellValue.integer(3), CellValue.decimal(new BigDecimal("0.5"))));

    assertThat(typed.type()).isEqualTo(ColumnType.DECIMAL);
    assertThat(typed.values().get(0)).isEqualTo(CellValue.decimal(BigDecimal.valueOf(3)));
  }

  @Test
  void booleanColumn_keepsType() {
    TypedColumn typed =
        inferrer.inferColumn("active", List.of(CellValue.bool(true), CellValue.NULL));

    assertThat(typed.type()).isEqualTo(ColumnType.BOOLEAN);
  }

  @Test
  void allNullColumn_isText() {
    TypedColumn typed = inferrer.inferColumn("notes", List.of(CellValue.NULL, CellValue.NULL));

    assertThat(typed.type()).isEqualTo(ColumnType.TEXT);
  }

  @Test
  void dateNamedColumn_isParsedAsTimestamp() {
    TypedColumn typed =
        inferrer.inferColumn(
            "expiration_date",
            List.of(
                CellValue.text("2025-06-30"),
                CellValue.integer(20240115),
                CellValue.timestamp(LocalDateTime.of(2023, 3, 1, 9, 0)),
                CellValue.text("someday"),
                CellValue.bool(false),
                CellValue.NULL));

    assertThat(typed.type()).isEqualTo(ColumnType.TIMESTAMP);
    assertThat(typed.values())
        .containsExactly(
            CellValue.timestamp(LocalDateTime.of(2025, 6, 30, 0, 0)),
            CellValue.timestamp(LocalDateTime.of(2024, 1, 15, 0, 0)),
            CellValue.timestamp(LocalDateTime.of(2023, 3, 1, 9, 0)),
            CellValue.NULL,
            CellValue.NULL,
            CellValue.NULL);
  }

  @Test
  void timeNamedNumericColumn_isTimestampNotNumber() {
    TypedColumn typed =
        inferrer.inferColumn("Update_Time", List.of(CellValue.text("1"), CellValue.text("2")));

    assertThat(typed.type()).isEqualTo(ColumnType.TIMESTAMP);
    assertThat(typed.values()).allMatch(CellValue::isNull);
  }

  @Test
  void infer_setsColumnTypesAndKeepsRowNumbers() {
    Dataset dataset =
        new Dataset(
            List.of(
                DatasetColumn.raw("Name").withName("name"),
                DatasetColumn.raw("Amount").withName("amount")),
            Dataset.of(
                    List.of("Name", "Amount"),
                    List.of(
                        List.of(CellValue.text("Alpha"), CellValue.text("10")),
                        List.of(CellValue.text("Beta"), CellValue.text("20"))))
                .rows());

    Dataset typed = inferrer.infer(dataset);

    assertThat(typed.columns())
        .extracting(DatasetColumn::type)
        .containsExactly(ColumnType.TEXT, ColumnType.INTEGER);
    assertThat(typed.rows().get(1).sourceRowNumber()).isEqualTo(3);
    assertThat(typed.rows().get(1).get(1)).isEqualTo(CellValue.integer(20));
  }

  @Test
  void parseNumber_rejectsNonNumbers() {
    assertThat(TypeInferrer.parseNumber("12.5")).isEqualByComparingTo("12.5");
    assertThat(TypeInferrer.parseNumber(" -3 ")).isEqualByComparingTo("-3");
    assertThat(TypeInferrer.parseNumber("1,000")).isNull();
    assertThat(TypeInferrer.parseNumber("Infinity")).isNull();
    assertThat(TypeInferrer.parseNumber("")).isNull();
  }

  @Test
  void parseNumber_rejectsValuesNoNumericColumnCanHold() {
    assertThat(TypeInferrer.parseNumber("1e999999999")).isNull();
    assertThat(TypeInferrer.parseNumber("-1E+25")).isNull();
    assertThat(TypeInferrer.parseNumber("1e-999999999")).isNull();
    assertThat(TypeInferrer.parseNumber("12345678901234567890")).isNull();
    assertThat(TypeInferrer.parseNumber("1234567890123456789"))
        .isEqualByComparingTo("1234567890123456789");
    assertThat(TypeInferrer.parseNumber("0E+999999999")).isEqualTo(BigDecimal.ZERO);
  }

  @Test
  void hugeExponentText_becomesNullInsteadOfPoisoningColumn() {
    List<CellValue> values = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      values.add(CellValue.text(i + ".5"));
    }
    values.add(CellValue.text("1e999999999"));

    TypedColumn typed = inferrer.inferColumn("amount", values);

    assertThat(typed.type()).isEqualTo(ColumnType.DECIMAL);
    assertThat(typed.values().get(10).isNull()).isTrue();
    assertThat(typed.values().get(0)).isEqualTo(CellValue.decimal(new BigDecimal("0.5")));
  }

  private static List<CellValue> texts(int count, String value, int otherCount, String other) {
    List<CellValue> values = new ArrayList<>(count + otherCount);
    for (int i = 0; i < count; i++) {
      values.add(CellValue.text(value));
    }
    for (int i = 0; i < otherCount; i++) {
      values.add(CellValue.text(other));
    }
    return values;
  }
}
