package com.pipeduck.functions;

import com.pipeduck.test.TestBase;
import com.pipeduck.test.TestCategories;
import com.pipeduck.types.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Test suite for FunctionRegistry.
 *
 * Covers:
 * - Signature lookup and arity
 * - Return type rules
 * - Spark SQL translation, renamed and custom mappings
 */
@DisplayName("FunctionRegistry Tests")
@TestCategories.Unit
public class FunctionRegistryTest extends TestBase {

    private static FunctionSignature signature(String name) {
        return FunctionRegistry.lookup(name).orElseThrow();
    }

    private static DataType returnType(String name, DataType... args) {
        return signature(name).returnType().resolve(List.of(args));
    }

    // ==================== Lookup ====================

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        @DisplayName("TC-FUNC-001: lookup is case-insensitive")
        void testCaseInsensitiveLookup() {
            assertThat(FunctionRegistry.lookup("UPPER")).isPresent();
            assertThat(FunctionRegistry.lookup("Count")).isPresent();
            assertThat(FunctionRegistry.isSupported("DayS")).isFalse();
        }

        @Test
        @DisplayName("TC-FUNC-002: unknown and null names")
        void testUnknownNames() {
            assertThat(FunctionRegistry.lookup("frobnicate")).isEmpty();
            assertThat(FunctionRegistry.lookup(null)).isEmpty();
            assertThat(FunctionRegistry.isAggregate("frobnicate")).isFalse();
        }

        @Test
        @DisplayName("TC-FUNC-003: aggregate and scalar kinds")
        void testKinds() {
            for (String name : List.of("count", "sum", "avg", "min", "max", "dc", "distinct_count",
                                       "stddev_samp", "stddev_pop", "var_samp", "var_pop")) {
                assertThat(FunctionRegistry.isAggregate(name)).as(name).isTrue();
            }
            for (String name : List.of("upper", "year", "abs", "coalesce", "now")) {
                assertThat(FunctionRegistry.isAggregate(name)).as(name).isFalse();
            }
        }

        @Test
        @DisplayName("TC-FUNC-004: distinct aggregates")
        void testDistinctAggregates() {
            assertThat(FunctionRegistry.isDistinctAggregate("dc")).isTrue();
            assertThat(FunctionRegistry.isDistinctAggregate("DISTINCT_COUNT")).isTrue();
            assertThat(FunctionRegistry.isDistinctAggregate("count")).isFalse();
        }
    }

    // ==================== Arity ====================

    @Nested
    @DisplayName("Arity")
    class Arity {

        @Test
        @DisplayName("TC-FUNC-005: fixed, ranged and variadic arity")
        void testArity() {
            assertThat(signature("upper").acceptsArgumentCount(1)).isTrue();
            assertThat(signature("upper").acceptsArgumentCount(2)).isFalse();
            assertThat(signature("substring").acceptsArgumentCount(3)).isTrue();
            assertThat(signature("substring").acceptsArgumentCount(1)).isFalse();
            assertThat(signature("concat").acceptsArgumentCount(7)).isTrue();
            assertThat(signature("count").acceptsArgumentCount(0)).isTrue();
            assertThat(signature("now").acceptsArgumentCount(1)).isFalse();
        }

        @Test
        @DisplayName("TC-FUNC-006: arity descriptions")
        void testArityDescription() {
            assertThat(signature("upper").arityDescription()).isEqualTo("1");
            assertThat(signature("substring").arityDescription()).isEqualTo("2..3");
            assertThat(signature("concat").arityDescription()).isEqualTo("at least 1");
        }
    }

    // ==================== Return Types ====================

    @Nested
    @DisplayName("Return Types")
    class ReturnTypes {

        @Test
        @DisplayName("TC-FUNC-007: sum widens integral input to long and floating input to double")
        void testSumType() {
            assertThat(returnType("sum", IntegerType.get())).isEqualTo(LongType.get());
            assertThat(returnType("sum", ShortType.get())).isEqualTo(LongType.get());
            assertThat(returnType("sum", FloatType.get())).isEqualTo(DoubleType.get());
            assertThat(returnType("sum", new DecimalType(10, 2))).isEqualTo(new DecimalType(20, 2));
        }

        @Test
        @DisplayName("TC-FUNC-008: avg is double, or a wider decimal")
        void testAvgType() {
            assertThat(returnType("avg", LongType.get())).isEqualTo(DoubleType.get());
            assertThat(returnType("avg", new DecimalType(10, 2))).isEqualTo(new DecimalType(14, 6));
        }

        @Test
        @DisplayName("TC-FUNC-009: min and max keep the argument type")
        void testMinMaxType() {
            assertThat(returnType("min", DateType.get())).isEqualTo(DateType.get());
            assertThat(returnType("max", StringType.get())).isEqualTo(StringType.get());
        }

        @Test
        @DisplayName("TC-FUNC-010: counts are long")
        void testCountType() {
            assertThat(returnType("count")).isEqualTo(LongType.get());
            assertThat(returnType("dc", StringType.get())).isEqualTo(LongType.get());
        }

        @Test
        @DisplayName("TC-FUNC-011: date functions")
        void testDateFunctionTypes() {
            assertThat(returnType("year", TimestampType.get())).isEqualTo(IntegerType.get());
            assertThat(returnType("date", StringType.get())).isEqualTo(DateType.get());
            assertThat(returnType("now")).isEqualTo(TimestampType.get());
            assertThat(returnType("adddate", DateType.get(), IntegerType.get())).isEqualTo(DateType.get());
        }

        @Test
        @DisplayName("TC-FUNC-012: math functions")
        void testMathFunctionTypes() {
            assertThat(returnType("abs", IntegerType.get())).isEqualTo(IntegerType.get());
            assertThat(returnType("ceil", DoubleType.get())).isEqualTo(LongType.get());
            assertThat(returnType("sqrt", IntegerType.get())).isEqualTo(DoubleType.get());
            assertThat(returnType("round", DoubleType.get(), IntegerType.get())).isEqualTo(DoubleType.get());
        }

        @Test
        @DisplayName("TC-FUNC-013: conditional functions share the argument type")
        void testConditionalTypes() {
            assertThat(returnType("coalesce", NullType.get(), StringType.get())).isEqualTo(StringType.get());
            assertThat(returnType("ifnull", IntegerType.get(), LongType.get())).isEqualTo(LongType.get());
            assertThat(returnType("if", BooleanType.get(), IntegerType.get(), DoubleType.get()))
                .isEqualTo(DoubleType.get());
        }

        @Test
        @DisplayName("TC-FUNC-014: rejected argument types")
        void testRejectedArguments() {
            assertThatThrownBy(() -> returnType("sum", StringType.get()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sum expects a numeric argument");
            assertThatThrownBy(() -> returnType("upper", IntegerType.get()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("upper expects a string argument");
            assertThatThrownBy(() -> returnType("year", BooleanType.get()))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> returnType("if", IntegerType.get(), IntegerType.get(), IntegerType.get()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("boolean condition");
            assertThatThrownBy(() -> returnType("coalesce", StringType.get(), IntegerType.get()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must share a type");
        }
    }

    // ==================== Translation ====================

    @Nested
    @DisplayName("Translation")
    class Translation {

        @ParameterizedTest(name = "{0} -> {2}")
        @CsvSource(delimiter = '|', value = {
            "upper      | name          | upper(name)",
            "dc         | region        | count(region)",
            "date       | raw_date      | to_date(raw_date)",
            "timestamp  | ts            | to_timestamp(ts)",
            "day        | created       | dayofmonth(created)",
            "LENGTH     | name          | length(name)"
        })
        @DisplayName("TC-FUNC-015: single-argument mappings")
        void testSingleArgumentMappings(String function, String arg, String expected) {
            assertThat(FunctionRegistry.translate(function, arg)).isEqualTo(expected);
        }

        @Test
        @DisplayName("TC-FUNC-016: renamed functions with several arguments")
        void testRenamedMappings() {
            logStep("Translate renamed functions");

            assertThat(FunctionRegistry.translate("pow", "x", "2")).isEqualTo("power(x, 2)");
            assertThat(FunctionRegistry.translate("adddate", "created", "3")).isEqualTo("date_add(created, 3)");
            assertThat(FunctionRegistry.translate("subdate", "created", "3")).isEqualTo("date_sub(created, 3)");
            assertThat(FunctionRegistry.translate("now")).isEqualTo("current_timestamp()");
        }

        @Test
        @DisplayName("TC-FUNC-017: ifnull is rendered as coalesce")
        void testCustomTranslator() {
            assertThat(FunctionRegistry.translate("ifnull", "a", "0")).isEqualTo("coalesce(a, 0)");
        }

        @Test
        @DisplayName("TC-FUNC-018: host engine names")
        void testResolveName() {
            assertThat(FunctionRegistry.resolveName("dc")).isEqualTo("count");
            assertThat(FunctionRegistry.resolveName("SUM")).isEqualTo("sum");
        }

        @Test
        @DisplayName("TC-FUNC-019: unsupported functions")
        @TestCategories.Tier2
        void testUnsupportedFunction() {
            assertThatThrownBy(() -> FunctionRegistry.translate("frobnicate", "x"))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessage("Unsupported function: frobnicate");
            assertThatThrownBy(() -> FunctionRegistry.translate(""))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
