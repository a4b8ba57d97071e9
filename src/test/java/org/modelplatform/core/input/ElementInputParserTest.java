package org.modelplatform.core.input;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.modelplatform.api.exceptions.ValidationException;
import org.modelplatform.api.item.Element;

@Tag("unit")
class ElementInputParserTest {

    private static final List<String> PLAIN = List.of();
    private static final List<String> ONE_D = List.of("i");
    private static final List<String> TWO_D = List.of("i", "j");

    @Nested
    @DisplayName("Sets")
    class Sets {

        @Test
        void bareKeyOfPlainSet() {
            List<Element> elements = ElementInputParser.parseSet("i", PLAIN, ElementInput.key(2020), FieldInput.none());

            assertThat(elements).containsExactly(Element.ofKey(List.of("2020")));
        }

        @Test
        void flatListOfPlainSetIsOneKeyPerEntry() {
            List<Element> elements = ElementInputParser.parseSet("i", PLAIN, ElementInput.keys("a", "b"),
                    FieldInput.each(List.of("first", "second")));

            assertThat(elements).containsExactly(Element.ofKey(List.of("a"), "first"),
                    Element.ofKey(List.of("b"), "second"));
        }

        @Test
        void flatListOfMatchingLengthIsOneKeyOfIndexedSet() {
            List<Element> elements = ElementInputParser.parseSet("ij", TWO_D, ElementInput.keys("a", "x"),
                    FieldInput.of("pair"));

            assertThat(elements).containsExactly(Element.ofKey(List.of("a", "x"), "pair"));
        }

        @Test
        void flatListOfOneDimensionalIndexedSetIsOneKeyPerEntry() {
            List<Element> elements = ElementInputParser.parseSet("sub", ONE_D, ElementInput.keys("a", "b"),
                    FieldInput.none());

            assertThat(elements).extracting(Element::key).containsExactly(List.of("a"), List.of("b"));
        }

        @Test
        void nestedKeysMustFitDimensions() {
            assertThatThrownBy(() -> ElementInputParser.parseSet("ij", TWO_D,
                    ElementInput.keys(List.of(List.of("a", "x"), List.of("b"))), FieldInput.none()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("1-D key [b] invalid for 2-D set 'ij'[i, j]");
        }

        @Test
        void tableColumnsFollowIndexNames() {
            List<Map<String, Object>> rows = List.of(
                    Map.of("i", "a", "j", "x", "comment", "c1"),
                    Map.of("i", "b", "j", "y", "comment", "c2"));

            List<Element> elements = ElementInputParser.parseSet("ij", TWO_D, ElementInput.table(rows),
                    FieldInput.none());

            assertThat(elements).containsExactly(Element.ofKey(List.of("a", "x"), "c1"),
                    Element.ofKey(List.of("b", "y"), "c2"));
        }

        @Test
        void commentColumnAndArgumentAreAmbiguous() {
            ElementInput table = ElementInput.table(List.of(Map.of("i", "a", "j", "x", "comment", "c")));

            assertThatThrownBy(() -> ElementInputParser.parseSet("ij", TWO_D, table, FieldInput.of("other")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Ambiguous comments");
        }

        @Test
        void setsTakeNoValues() {
            ElementInput table = ElementInput.table(List.of(Map.of("i", "a", "value", 1)));

            assertThatThrownBy(() -> ElementInputParser.parseSet("i2", ONE_D, table, FieldInput.none()))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void commentsMustPairWithKeys() {
            assertThatThrownBy(() -> ElementInputParser.parseSet("i", PLAIN, ElementInput.keys("a", "b"),
                    FieldInput.each(List.of("only one"))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageStartingWith("Length mismatch between keys and comments");
        }
    }

    @Nested
    @DisplayName("Parameters")
    class Parameters {

        @Test
        void scalarValueBroadcastsOverKeys() {
            List<Element> elements = ElementInputParser.parseParameter("p", ONE_D, ElementInput.keys("a", "b"),
                    FieldInput.of(2.5), FieldInput.of("t"), FieldInput.none());

            assertThat(elements).containsExactly(Element.ofValue(List.of("a"), 2.5, "t"),
                    Element.ofValue(List.of("b"), 2.5, "t"));
        }

        @Test
        void listOfLengthOneDoesNotBroadcast() {
            assertThatThrownBy(() -> ElementInputParser.parseParameter("p", ONE_D, ElementInput.keys("a", "b"),
                    FieldInput.each(List.of(1.0)), FieldInput.none(), FieldInput.none()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageStartingWith("Length mismatch between keys and values");
        }

        @Test
        void perKeyValuesAndUnits() {
            List<Element> elements = ElementInputParser.parseParameter("d", TWO_D,
                    ElementInput.keys(List.of(List.of("a", "x"), List.of("b", "y"))),
                    FieldInput.each(List.of(1, 2)), FieldInput.each(List.of("km", "mi")),
                    FieldInput.each(List.of("near", "far")));

            assertThat(elements).containsExactly(
                    new Element(List.of("a", "x"), 1.0, "km", "near"),
                    new Element(List.of("b", "y"), 2.0, "mi", "far"));
        }

        @Test
        void scalarParameterHasNoKey() {
            List<Element> elements = ElementInputParser.parseParameter("s", PLAIN, ElementInput.none(),
                    FieldInput.of(3), FieldInput.of("t"), FieldInput.of("note"));

            assertThat(elements).containsExactly(new Element(null, 3.0, "t", "note"));
        }

        @Test
        void missingValueIsRejected() {
            assertThatThrownBy(() -> ElementInputParser.parseParameter("p", ONE_D, ElementInput.key("a"),
                    FieldInput.none(), FieldInput.of("t"), FieldInput.none()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("No parameter values supplied for 'p'");
        }

        @Test
        void keyLengthMustMatchDimensions() {
            assertThatThrownBy(() -> ElementInputParser.parseParameter("d", TWO_D, ElementInput.key("a"),
                    FieldInput.of(1.0), FieldInput.none(), FieldInput.none()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("1-D key [a] invalid for 2-D parameter 'd'[i, j]");
        }

        @Test
        void columnsCarryValuesUnitsAndComments() {
            Map<String, List<?>> columns = new LinkedHashMap<>();
            columns.put("i", List.of("a", "b"));
            columns.put("j", List.of("x", "y"));
            columns.put("value", List.of(1, "2.5"));
            columns.put("unit", List.of("km", "km"));

            List<Element> elements = ElementInputParser.parseParameter("d", TWO_D, ElementInput.columns(columns),
                    FieldInput.none(), FieldInput.none(), FieldInput.of("imported"));

            assertThat(elements).containsExactly(
                    new Element(List.of("a", "x"), 1.0, "km", "imported"),
                    new Element(List.of("b", "y"), 2.5, "km", "imported"));
        }

        @Test
        void keyColumnReplacesIndexColumns() {
            List<Map<String, Object>> rows = List.of(Map.of("key", List.of("a", "x"), "value", 4));

            List<Element> elements = ElementInputParser.parseParameter("d", TWO_D, ElementInput.table(rows),
                    FieldInput.none(), FieldInput.of("t"), FieldInput.none());

            assertThat(elements).containsExactly(Element.ofValue(List.of("a", "x"), 4.0, "t"));
        }

        @Test
        void valueColumnAndArgumentConflict() {
            ElementInput table = ElementInput.table(List.of(Map.of("i", "a", "value", 1)));

            assertThatThrownBy(() -> ElementInputParser.parseParameter("p", ONE_D, table, FieldInput.of(2.0),
                    FieldInput.none(), FieldInput.none()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Both a 'value' column and a value argument given for 'p'");
        }

        @Test
        void nonNumericValueColumnIsRejected() {
            ElementInput table = ElementInput.table(List.of(Map.of("i", "a", "value", "lots")));

            assertThatThrownBy(() -> ElementInputParser.parseParameter("p", ONE_D, table, FieldInput.none(),
                    FieldInput.none(), FieldInput.none()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("non-numeric");
        }

        @Test
        void missingIndexColumnIsRejected() {
            ElementInput table = ElementInput.table(List.of(Map.of("i", "a", "value", 1)));

            assertThatThrownBy(() -> ElementInputParser.parseParameter("d", TWO_D, table, FieldInput.none(),
                    FieldInput.none(), FieldInput.none()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("has no column 'j'");
        }
    }

    @Nested
    @DisplayName("Keys and shapes")
    class Keys {

        @Test
        void deleteKeysFollowTheSameRules() {
            assertThat(ElementInputParser.parseKeys("ij", TWO_D, false, ElementInput.keys("a", "x")))
                    .containsExactly(List.of("a", "x"));
            assertThat(ElementInputParser.parseKeys("i", PLAIN, true, ElementInput.keys("a", "b")))
                    .containsExactly(List.of("a"), List.of("b"));
            assertThat(ElementInputParser.parseKeys("f", PLAIN, false, ElementInput.none()))
                    .containsExactly(List.of());
        }

        @Test
        void deletingFromAnIndexSetNeedsKeys() {
            assertThatThrownBy(() -> ElementInputParser.parseKeys("i", PLAIN, true, ElementInput.none()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Keys of the elements to remove from 1-D item 'i' are required");
        }

        @Test
        void deleteKeysMustMatchTheDimension() {
            assertThatThrownBy(() -> ElementInputParser.parseKeys("ij", TWO_D, false,
                    ElementInput.keys(List.of(List.of("a", "x"), List.of("b")))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("1-D key [b] invalid for 2-D item 'ij'[i, j]");
            assertThatThrownBy(() -> ElementInputParser.parseKeys("i", PLAIN, true,
                    ElementInput.keys(List.of(List.of("a", "b")))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("2-D key [a, b] invalid for 1-D item 'i'");
        }

        @Test
        void componentsMustBeScalars() {
            assertThatThrownBy(() -> ElementInputParser.parseSet("i", PLAIN, ElementInput.keys(new Object()),
                    FieldInput.none()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageStartingWith("Key components must be strings, numbers or booleans");
        }

        @Test
        void mixedKeyListsAreRejected() {
            assertThatThrownBy(() -> ElementInput.keys(List.of("a", List.of("b"))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageStartingWith("Keys mix single components and key lists");
        }

        @Test
        void unevenColumnsAreRejected() {
            Map<String, List<?>> columns = new LinkedHashMap<>();
            columns.put("i", List.of("a", "b"));
            columns.put("value", List.of(1));

            assertThatThrownBy(() -> ElementInput.columns(columns))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("'value'");
        }

        @Test
        void keyRejectsLists() {
            assertThatThrownBy(() -> ElementInput.key(List.of("a")))
                    .isInstanceOf(ValidationException.class);
            assertThat(ElementInput.keys("a").shape()).isEqualTo(ElementInput.Shape.FLAT);
            assertThat(ElementInput.none().isTabular()).isFalse();
        }
    }
}
