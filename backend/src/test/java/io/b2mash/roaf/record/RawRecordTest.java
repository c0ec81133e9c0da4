package io.b2mash.roaf.record;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.roaf.flag.ConditionFlag;
import io.b2mash.roaf.flag.FlagDeriver;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RawRecordTest {

  @Test
  void missingAndNullFieldsReadAsUnset() {
    var fields = new HashMap<String, Object>();
    fields.put("present", "value");
    fields.put("nullValue", null);
    var record = RawRecord.of(fields);

    assertThat(record.has("present")).isTrue();
    assertThat(record.has("nullValue")).isFalse();
    assertThat(record.has("missing")).isFalse();
    assertThat(record.textOrEmpty("nullValue")).isEmpty();
    assertThat(record.textOrNull("missing")).isNull();
    assertThat(record.code("missing")).isNull();
  }

  @Test
  void isTrueOnlyAcceptsBooleanTrue() {
    var record = RawRecord.of(Map.of("yes", true, "no", false, "text", "true", "one", 1));

    assertThat(record.isTrue("yes")).isTrue();
    assertThat(record.isTrue("no")).isFalse();
    assertThat(record.isTrue("text")).isFalse();
    assertThat(record.isTrue("one")).isFalse();
    assertThat(record.isTrue("missing")).isFalse();
  }

  @Test
  void textRendersNumbersAndIgnoresNestedValues() {
    var record = RawRecord.of(Map.of("number", 42, "nested", Map.of("a", 1), "list", List.of()));

    assertThat(record.textOrEmpty("number")).isEqualTo("42");
    assertThat(record.text("nested")).isEmpty();
    assertThat(record.text("list")).isEmpty();
  }

  @Test
  void dateKeepsOnlyCalendarPart() {
    var record =
        RawRecord.of(
            Map.of("timestamp", "2025-12-25T00:00:00Z", "plain", "2024-02-29", "blank", "  "));

    assertThat(record.dateOrEmpty("timestamp")).isEqualTo("2025-12-25");
    assertThat(record.dateOrEmpty("plain")).isEqualTo("2024-02-29");
    assertThat(record.dateOrNull("blank")).isNull();
  }

  @Test
  void dateFallsBackToAlternativeField() {
    var record = RawRecord.of(Map.of("legacy", "1980-03-13"));

    assertThat(record.dateOrEmpty("current", "legacy")).isEqualTo("1980-03-13");
    assertThat(record.dateOrEmpty("current", "other")).isEmpty();
  }

  @Test
  void dateUsesFirstFieldWhenBothPresent() {
    var record = RawRecord.of(Map.of("current", "1980-03-14T00:00:00Z", "legacy", "1980-03-13"));

    assertThat(record.dateOrEmpty("current", "legacy")).isEqualTo("1980-03-14");
  }

  @Test
  void codeAcceptsNumbersAndStringsOnly() {
    var record = RawRecord.of(Map.of("number", 356960241, "string", "356960241", "bool", true));

    assertThat(record.code("number")).isEqualTo(356960241);
    assertThat(record.code("string")).isEqualTo("356960241");
    assertThat(record.code("bool")).isNull();
    assertThat(record.hasCode("bool")).isFalse();
  }

  @Test
  void hasItemsRequiresNonEmptyArray() {
    var record =
        RawRecord.of(Map.of("items", List.of(Map.of()), "empty", List.of(), "scalar", "x"));

    assertThat(record.hasItems("items")).isTrue();
    assertThat(record.hasItems("empty")).isFalse();
    assertThat(record.hasItems("scalar")).isFalse();
    assertThat(record.hasItems("missing")).isFalse();
  }

  @Test
  void primaryIdIgnoresBlankValues() {
    assertThat(RawRecord.of(Map.of("id", " abc ")).primaryId("id")).contains("abc");
    assertThat(RawRecord.of(Map.of("id", "   ")).primaryId("id")).isEmpty();
    assertThat(RawRecord.empty().primaryId("id")).isEmpty();
  }

  @Test
  void isImmutableCopyOfInput() {
    var fields = new HashMap<String, Object>();
    fields.put("a", "1");
    var record = RawRecord.of(fields);
    fields.put("b", "2");

    assertThat(record.has("b")).isFalse();
    assertThat(record.asMap()).isUnmodifiable();
  }

  @Test
  @SuppressWarnings("unchecked")
  void nestedArraysAreCopiedAndUnmodifiable() {
    var rows = new ArrayList<Object>();
    var row = new HashMap<String, Object>();
    row.put("name", "first");
    rows.add(row);
    rows.add(null);
    var fields = new HashMap<String, Object>();
    fields.put(AuthorisedIndividualFields.CAREER_HISTORY, rows);
    fields.put(AuthorisedIndividualFields.OTHER_HOLDINGS, new ArrayList<>());
    var record = RawRecord.of(fields);
    var deriver = new FlagDeriver();
    var before = deriver.deriveFlags(record);

    rows.add(Map.of("name", "second"));
    row.put("name", "changed");

    var careerHistory = (List<Object>) record.raw(AuthorisedIndividualFields.CAREER_HISTORY);
    assertThat(careerHistory).hasSize(2).isUnmodifiable();
    assertThat((Map<String, Object>) careerHistory.get(0))
        .containsEntry("name", "first")
        .isUnmodifiable();
    assertThat(careerHistory.get(1)).isNull();
    var otherHoldings = (List<Object>) record.raw(AuthorisedIndividualFields.OTHER_HOLDINGS);
    assertThatThrownBy(() -> otherHoldings.add(Map.of("x", 1)))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThat(deriver.deriveFlags(record)).isEqualTo(before);
    assertThat(before.isSet(ConditionFlag.HAS_OTHER_HOLDINGS)).isFalse();
  }
}
