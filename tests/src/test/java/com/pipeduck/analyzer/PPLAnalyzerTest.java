package com.pipeduck.analyzer;

import com.pipeduck.catalog.Catalog;
import com.pipeduck.catalog.InMemoryCatalog;
import com.pipeduck.config.AnalyzerOptions;
import com.pipeduck.exception.AnalysisException;
import com.pipeduck.exception.UnsupportedConstructException;
import com.pipeduck.expression.*;
import com.pipeduck.logical.*;
import com.pipeduck.parser.PPLSyntaxParser;
import com.pipeduck.test.TestBase;
import com.pipeduck.test.TestCategories;
import com.pipeduck.types.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PPLAnalyzer}: parsed pipelines to logical plans.
 */
@DisplayName("PPLAnalyzer Tests")
@Tag("analyzer")
@TestCategories.Unit
public class PPLAnalyzerTest extends TestBase {

    private static final StructType ORDERS = new StructType(
        new StructField("status", StringType.get()),
        new StructField("region", StringType.get()));

    private static final StructType CUSTOMER = new StructType(
        new StructField("id", LongType.get()),
        new StructField("name", StringType.get()),
        new StructField("region", StringType.get()));

    private static final StructType PURCHASES = new StructType(
        new StructField("id", LongType.get()),
        new StructField("customer_id", LongType.get()),
        new StructField("amount", DoubleType.get()),
        new StructField("region", StringType.get()),
        new StructField("created", DateType.get()),
        new StructField("ts", TimestampType.get()),
        new StructField("address", new StructType(
            new StructField("city", StringType.get()),
            new StructField("zip", IntegerType.get()))));

    private InMemoryCatalog catalog;
    private PPLAnalyzer analyzer;

    @Override
    protected void doSetUp() {
        catalog = new InMemoryCatalog()
            .register("orders", ORDERS)
            .register("customer", CUSTOMER)
            .register("purchases", PURCHASES);
        analyzer = new PPLAnalyzer(catalog);
    }

    private LogicalPlan analyze(String ppl) {
        return analyzer.analyze(PPLSyntaxParser.getInstance().parse(ppl));
    }

    private static Expression filterCondition(LogicalPlan plan) {
        assertThat(plan).isInstanceOf(Filter.class);
        return ((Filter) plan).condition();
    }

    private static Expression projection(LogicalPlan plan, String name) {
        assertThat(plan).isInstanceOf(Project.class);
        Project project = (Project) plan;
        return project.projections().get(project.names().indexOf(name));
    }

    @Nested
    @DisplayName("End-to-End Pipeline")
    @TestCategories.Tier1
    class EndToEnd {

        @Test
        @DisplayName("where | stats | sort | head builds the expected plan chain")
        void testOrdersPipeline() {
            // Given: orders(status string, region string)
            logStep("Analyze the orders pipeline");

            // When
            LogicalPlan plan = analyze(
                "source = orders | where status = 'open' | stats count() as n by region | sort - n | head 5");

            // Then: limit -> sort -> aggregate -> filter -> scan
            assertThat(plan).isInstanceOf(Limit.class);
            Limit limit = (Limit) plan;
            assertThat(limit.limit()).isEqualTo(5);
            assertThat(limit.offset()).isZero();

            Sort sort = (Sort) limit.child();
            assertThat(sort.sortOrders()).hasSize(1);
            Sort.SortOrder order = sort.sortOrders().get(0);
            assertThat(((ColumnReference) order.expression()).columnName()).isEqualTo("n");
            assertThat(order.direction()).isEqualTo(Sort.SortDirection.DESCENDING);

            Aggregate aggregate = (Aggregate) sort.child();
            assertThat(aggregate.groupingExpressions()).hasSize(1);
            assertThat(((ColumnReference) aggregate.groupingExpressions().get(0)).columnName()).isEqualTo("region");
            AggregateExpression count = aggregate.aggregateExpressions().get(0);
            assertThat(count.function()).isEqualTo("count");
            assertThat(count.argument()).isNull();
            assertThat(count.alias()).isEqualTo("n");

            Filter filter = (Filter) aggregate.child();
            assertThat(filter.condition().toSQL()).isEqualTo("(orders.status = 'open')");
            assertThat(filter.child()).isInstanceOf(TableScan.class);
            assertThat(((TableScan) filter.child()).tableName()).isEqualTo("orders");

            logStep("Verify the output schema");
            assertThat(plan.schema().fieldNames()).containsExactly("region", "n");
            assertThat(plan.schema().fieldAt(0).dataType()).isEqualTo(StringType.get());
            assertThat(plan.schema().fieldAt(1).dataType()).isEqualTo(LongType.get());
            assertThat(plan.schema().fieldAt(1).nullable()).isFalse();
        }

        @Test
        @DisplayName("source alone is a table scan with the catalog schema")
        void testSourceOnly() {
            LogicalPlan plan = analyze("source = purchases");

            assertThat(plan).isInstanceOf(TableScan.class);
            assertThat(plan.schema()).isEqualTo(PURCHASES);
        }

        @Test
        @DisplayName("Unknown table")
        void testUnknownTable() {
            assertThatThrownBy(() -> analyze("source = nope | head 1"))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("Table or index 'nope' not found")
                .satisfies(e -> assertThat(((AnalysisException) e).reference()).isEqualTo("nope"));
        }

        @Test
        @DisplayName("Catalog failures surface as analysis errors")
        void testCatalogFailure() {
            Catalog failing = name -> {
                throw new IllegalStateException("backend unavailable");
            };

            assertThatThrownBy(() -> new PPLAnalyzer(failing).analyze(
                    PPLSyntaxParser.getInstance().parse("source = orders")))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("backend unavailable")
                .hasCauseInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("where")
    class Where {

        @Test
        @DisplayName("Comparison, between, like, in and null checks")
        void testPredicates() {
            assertThat(filterCondition(analyze("source = purchases | where amount between 10 and 20")))
                .isInstanceOf(BetweenExpression.class);
            assertThat(filterCondition(analyze("source = purchases | where region like 'N%'")))
                .isInstanceOf(LikeExpression.class);
            assertThat(filterCondition(analyze("source = purchases | where region not in ('N', 'S')")).toSQL())
                .isEqualTo("(purchases.region NOT IN ('N', 'S'))");

            Expression isNull = filterCondition(analyze("source = purchases | where region is null"));
            assertThat(isNull).isInstanceOf(UnaryExpression.class);
            assertThat(((UnaryExpression) isNull).operator()).isEqualTo(UnaryExpression.Operator.IS_NULL);
            assertThat(isNull.nullable()).isFalse();
        }

        @Test
        @DisplayName("Logical operators combine boolean predicates")
        void testLogical() {
            Expression condition = filterCondition(analyze(
                "source = purchases | where amount > 10 and (region = 'N' or not region = 'S')"));

            assertThat(condition.dataType()).isEqualTo(BooleanType.get());
            assertThat(condition.toSQL()).isEqualTo(
                "((purchases.amount > 10) AND ((purchases.region = 'N') OR (NOT (purchases.region = 'S'))))");
        }

        @Test
        @DisplayName("Qualified references by table name and alias")
        void testQualifiedReferences() {
            Expression condition = filterCondition(analyze(
                "source = purchases as p | where p.amount > 10 and purchases.region = 'N'"));

            assertThat(condition.toSQL()).isEqualTo("((p.amount > 10) AND (p.region = 'N'))");
        }

        @Test
        @DisplayName("Nested struct fields")
        void testNestedFields() {
            Expression condition = filterCondition(analyze("source = purchases | where address.city = 'Paris'"));
            BinaryExpression eq = (BinaryExpression) condition;

            assertThat(eq.left()).isInstanceOf(StructFieldAccess.class);
            assertThat(eq.left().dataType()).isEqualTo(StringType.get());
            assertThat(eq.toSQL()).isEqualTo("(purchases.address.city = 'Paris')");

            Expression qualified = filterCondition(analyze(
                "source = purchases | where purchases.address.zip > 1000"));
            assertThat(((BinaryExpression) qualified).left().dataType()).isEqualTo(IntegerType.get());
        }

        @Test
        @DisplayName("Timestamps compare with string literals")
        void testTemporalStringComparison() {
            assertThat(filterCondition(analyze("source = purchases | where ts > '2024-01-01'")).dataType())
                .isEqualTo(BooleanType.get());
        }

        @Test
        @DisplayName("Non-boolean condition")
        @TestCategories.Tier2
        void testNonBooleanCondition() {
            assertThatThrownBy(() -> analyze("source = purchases | where amount"))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("where condition must be boolean, but 'amount' is double");
        }

        @Test
        @DisplayName("Type mismatches")
        @TestCategories.Tier2
        void testTypeMismatch() {
            assertThatThrownBy(() -> analyze("source = purchases | where region > 5"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Type mismatch in 'region > 5'");
            assertThatThrownBy(() -> analyze("source = purchases | where amount like 'x%'"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("like expects strings");
            assertThatThrownBy(() -> analyze("source = purchases | where region + 1 > 0"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Type mismatch");
            assertThatThrownBy(() -> analyze("source = purchases | where amount > 1 and region"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Type mismatch");
        }

        @Test
        @DisplayName("Unknown columns list the available ones")
        @TestCategories.Tier2
        void testUnknownColumn() {
            assertThatThrownBy(() -> analyze("source = orders | where state = 'x'"))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("Column 'state' cannot be resolved; available columns: [status, region]");
            assertThatThrownBy(() -> analyze("source = purchases | where address.country = 'x'"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Column 'address.country' cannot be resolved");
        }

        @Test
        @DisplayName("Aggregates are not allowed outside stats")
        @TestCategories.Tier2
        void testAggregateInWhere() {
            assertThatThrownBy(() -> analyze("source = purchases | where count() > 1"))
                .isInstanceOf(UnsupportedConstructException.class)
                .hasMessageContaining("only allowed in the stats aggregate list");
        }
    }

    @Nested
    @DisplayName("stats")
    class Stats {

        @Test
        @DisplayName("Default names are the canonical call text")
        void testDefaultNames() {
            LogicalPlan plan = analyze("source = purchases | stats count(), avg(amount), sum(id) by region");

            assertThat(plan.schema().fieldNames()).containsExactly("region", "count()", "avg(amount)", "sum(id)");
            assertThat(plan.schema().fieldAt(2).dataType()).isEqualTo(DoubleType.get());
            assertThat(plan.schema().fieldAt(3).dataType()).isEqualTo(LongType.get());
        }

        @Test
        @DisplayName("Global aggregation has no group columns")
        void testGlobalAggregation() {
            Aggregate aggregate = (Aggregate) analyze("source = purchases | stats max(amount) as top, min(created)");

            assertThat(aggregate.isGlobal()).isTrue();
            assertThat(aggregate.schema().fieldNames()).containsExactly("top", "min(created)");
            assertThat(aggregate.schema().fieldAt(1).dataType()).isEqualTo(DateType.get());
        }

        @Test
        @DisplayName("dc counts distinct values")
        void testDistinctCount() {
            Aggregate aggregate = (Aggregate) analyze("source = purchases | stats dc(region) as regions");

            AggregateExpression dc = aggregate.aggregateExpressions().get(0);
            assertThat(dc.isDistinct()).isTrue();
            assertThat(dc.toSQL()).isEqualTo("COUNT(DISTINCT purchases.region)");
            assertThat(dc.dataType()).isEqualTo(LongType.get());
        }

        @Test
        @DisplayName("Grouping by a nested field names the column by its path")
        void testNestedGroupKey() {
            LogicalPlan plan = analyze("source = purchases | stats count() as n by address.city");

            assertThat(plan.schema().fieldNames()).containsExactly("address.city", "n");
        }

        @Test
        @DisplayName("Group columns keep their qualifiers downstream")
        void testQualifiersAfterStats() {
            LogicalPlan plan = analyze("source = purchases | stats count() as n by region | where purchases.region = 'N'");

            assertThat(plan).isInstanceOf(Filter.class);
        }

        @Test
        @DisplayName("Columns not in the output are gone after stats")
        @TestCategories.Tier2
        void testColumnsGoneAfterStats() {
            assertThatThrownBy(() -> analyze("source = purchases | stats count() as n by region | where amount > 1"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("available columns: [region, n]");
        }

        @Test
        @DisplayName("Invalid aggregate lists")
        @TestCategories.Tier2
        void testInvalidAggregates() {
            assertThatThrownBy(() -> analyze("source = purchases | stats upper(region)"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("'upper' is not an aggregate function");
            assertThatThrownBy(() -> analyze("source = purchases | stats amount"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("stats expects aggregate function calls");
            assertThatThrownBy(() -> analyze("source = purchases | stats avg(region)"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Invalid arguments in 'avg(region)'");
            assertThatThrownBy(() -> analyze("source = purchases | stats sum()"))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("Function sum expects 1 argument(s), got 0");
        }

        @Test
        @DisplayName("Duplicate output names")
        @TestCategories.Tier2
        void testDuplicateNames() {
            assertThatThrownBy(() -> analyze("source = purchases | stats count() as region by region"))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("stats produces column 'region' more than once");
        }
    }

    @Nested
    @DisplayName("eval")
    class Eval {

        @Test
        @DisplayName("New columns are appended and may use earlier assignments")
        void testAppend() {
            LogicalPlan plan = analyze(
                "source = purchases | eval doubled = amount * 2, tripled = doubled + amount");

            assertThat(plan.schema().fieldNames()).containsExactly(
                "id", "customer_id", "amount", "region", "created", "ts", "address", "doubled", "tripled");
            assertThat(plan.schema().fieldByName("tripled").dataType()).isEqualTo(DoubleType.get());
            assertThat(projection(plan, "tripled").toSQL())
                .isEqualTo("((purchases.amount * 2) + purchases.amount)");
        }

        @Test
        @DisplayName("Assigning an existing name replaces it in place")
        void testOverwrite() {
            LogicalPlan plan = analyze("source = orders | eval status = upper(status)");

            assertThat(plan.schema().fieldNames()).containsExactly("status", "region");
            assertThat(projection(plan, "status").toSQL()).isEqualTo("upper(orders.status)");
        }

        @Test
        @DisplayName("Evaluated columns are visible to later commands")
        void testLaterCommands() {
            LogicalPlan plan = analyze("source = purchases | eval big = amount > 100 | where big | fields id, big");

            assertThat(plan.schema().fieldNames()).containsExactly("id", "big");
            assertThat(plan.schema().fieldByName("big").dataType()).isEqualTo(BooleanType.get());
        }

        @Test
        @DisplayName("Integer division yields double")
        void testDivision() {
            LogicalPlan plan = analyze("source = purchases | eval ratio = id / customer_id");

            assertThat(plan.schema().fieldByName("ratio").dataType()).isEqualTo(DoubleType.get());
            assertThat(plan.schema().fieldByName("ratio").nullable()).isTrue();
        }

        @Test
        @DisplayName("Scalar functions")
        void testFunctions() {
            LogicalPlan plan = analyze(
                "source = purchases | eval r = upper(region), y = year(created), a = abs(amount), n = isnull(region)");

            assertThat(plan.schema().fieldByName("r").dataType()).isEqualTo(StringType.get());
            assertThat(plan.schema().fieldByName("y").dataType()).isEqualTo(IntegerType.get());
            assertThat(plan.schema().fieldByName("a").dataType()).isEqualTo(DoubleType.get());
            assertThat(plan.schema().fieldByName("n").nullable()).isFalse();
        }

        @Test
        @DisplayName("Function errors")
        @TestCategories.Tier2
        void testFunctionErrors() {
            assertThatThrownBy(() -> analyze("source = purchases | eval x = frobnicate(region)"))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("Unsupported function: frobnicate");
            assertThatThrownBy(() -> analyze("source = purchases | eval x = upper()"))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("Function upper expects 1 argument(s), got 0");
            assertThatThrownBy(() -> analyze("source = purchases | eval x = upper(amount)"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Invalid arguments in 'upper(amount)'");
        }
    }

    @Nested
    @DisplayName("Date Arithmetic")
    class DateArithmetic {

        @Test
        @DisplayName("Date plus a day interval stays a date")
        void testDatePlusDays() {
            LogicalPlan plan = analyze("source = purchases | eval next = created + interval 1 day");

            Expression next = projection(plan, "next");
            assertThat(next.dataType()).isEqualTo(DateType.get());
            assertThat(next.toSQL()).isEqualTo("(purchases.created + INTERVAL 1 DAY)");
        }

        @Test
        @DisplayName("Date plus an hour interval is a timestamp")
        void testDatePlusHours() {
            LogicalPlan plan = analyze("source = purchases | eval later = created + interval 2 hours");

            assertThat(plan.schema().fieldByName("later").dataType()).isEqualTo(TimestampType.get());
        }

        @Test
        @DisplayName("adddate and subdate with intervals become date arithmetic")
        void testDateFunctionsWithIntervals() {
            LogicalPlan plan = analyze(
                "source = purchases | eval a = adddate(created, interval 1 week), s = subdate(ts, interval 1 day)");

            BinaryExpression add = (BinaryExpression) projection(plan, "a");
            assertThat(add.operator()).isEqualTo(BinaryExpression.Operator.ADD);
            assertThat(add.right()).isEqualTo(new IntervalLiteral(1, IntervalLiteral.Unit.WEEK));
            assertThat(add.dataType()).isEqualTo(DateType.get());

            BinaryExpression sub = (BinaryExpression) projection(plan, "s");
            assertThat(sub.operator()).isEqualTo(BinaryExpression.Operator.SUBTRACT);
            assertThat(sub.dataType()).isEqualTo(TimestampType.get());
        }

        @Test
        @DisplayName("adddate with a day count is a function call")
        void testDateFunctionWithDays() {
            LogicalPlan plan = analyze("source = purchases | eval a = adddate(created, 3)");

            assertThat(projection(plan, "a").toSQL()).isEqualTo("date_add(purchases.created, 3)");
            assertThat(plan.schema().fieldByName("a").dataType()).isEqualTo(DateType.get());
        }

        @Test
        @DisplayName("Interval misuse")
        @TestCategories.Tier2
        void testIntervalMisuse() {
            assertThatThrownBy(() -> analyze("source = purchases | eval x = interval 1 day"))
                .isInstanceOf(UnsupportedConstructException.class)
                .hasMessageContaining("interval 1 day");
            assertThatThrownBy(() -> analyze("source = purchases | eval x = amount + interval 1 day"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("interval arithmetic needs a date or timestamp");
        }
    }

    @Nested
    @DisplayName("sort and head")
    class SortAndHead {

        @Test
        @DisplayName("Sort directions and null placement")
        void testSortDirections() {
            Sort sort = (Sort) analyze("source = purchases | sort - amount, region");

            assertThat(sort.sortOrders()).extracting(Sort.SortOrder::direction)
                .containsExactly(Sort.SortDirection.DESCENDING, Sort.SortDirection.ASCENDING);
            assertThat(sort.sortOrders()).extracting(Sort.SortOrder::nullOrdering)
                .containsExactly(Sort.NullOrdering.NULLS_LAST, Sort.NullOrdering.NULLS_FIRST);
        }

        @Test
        @DisplayName("head defaults, explicit size and offset")
        void testHead() {
            assertThat(((Limit) analyze("source = orders | head")).limit()).isEqualTo(10);

            Limit limit = (Limit) analyze("source = orders | head 3 from 2");
            assertThat(limit.limit()).isEqualTo(3);
            assertThat(limit.offset()).isEqualTo(2);
        }

        @Test
        @DisplayName("Configured default head size")
        void testConfiguredHeadSize() {
            PPLAnalyzer configured = new PPLAnalyzer(catalog, new AnalyzerOptions(25));

            Limit limit = (Limit) configured.analyze(PPLSyntaxParser.getInstance().parse("source = orders | head"));

            assertThat(limit.limit()).isEqualTo(25);
        }

        @Test
        @DisplayName("Negative head size")
        @TestCategories.Tier2
        void testNegativeHead() {
            assertThatThrownBy(() -> analyze("source = orders | head -1"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("non-negative");
        }
    }

    @Nested
    @DisplayName("fields and rename")
    class FieldsAndRename {

        @Test
        @DisplayName("fields keeps the listed columns in the listed order")
        void testFieldsInclude() {
            LogicalPlan plan = analyze("source = purchases | fields region, amount, address.city");

            assertThat(plan.schema().fieldNames()).containsExactly("region", "amount", "address.city");
        }

        @Test
        @DisplayName("fields - removes the listed columns")
        void testFieldsExclude() {
            LogicalPlan plan = analyze("source = purchases | fields - address, ts, created");

            assertThat(plan.schema().fieldNames()).containsExactly("id", "customer_id", "amount", "region");
        }

        @Test
        @DisplayName("fields errors")
        @TestCategories.Tier2
        void testFieldsErrors() {
            assertThatThrownBy(() -> analyze("source = orders | fields region, region"))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("fields produces column 'region' more than once");
            assertThatThrownBy(() -> analyze("source = orders | fields - status, region"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("removes every column");
            assertThatThrownBy(() -> analyze("source = purchases | fields - address.city"))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("'address.city' is not a column of the current pipeline");
            assertThatThrownBy(() -> analyze("source = orders | fields - nope"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Column 'nope' cannot be resolved");
        }

        @Test
        @DisplayName("rename changes names, keeps order and types")
        void testRename() {
            LogicalPlan plan = analyze("source = purchases | rename amount as total, region as area | where total > 1");

            assertThat(plan.schema().fieldNames()).containsExactly(
                "id", "customer_id", "total", "area", "created", "ts", "address");
            assertThat(plan.schema().fieldByName("total").dataType()).isEqualTo(DoubleType.get());
        }

        @Test
        @DisplayName("rename resolves every clause against the input")
        void testRenameSwap() {
            LogicalPlan plan = analyze("source = orders | rename status as region, region as status");

            assertThat(plan.schema().fieldNames()).containsExactly("region", "status");
            assertThat(projection(plan, "region").toSQL()).isEqualTo("orders.status");
        }

        @Test
        @DisplayName("rename errors")
        @TestCategories.Tier2
        void testRenameErrors() {
            assertThatThrownBy(() -> analyze("source = orders | rename status as s | where status = 'x'"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Column 'status' cannot be resolved");
            assertThatThrownBy(() -> analyze("source = orders | rename status as a, status as b"))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("Column 'status' is renamed twice");
            assertThatThrownBy(() -> analyze("source = orders | rename status as region"))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("rename: duplicate output column: region");
        }
    }

    @Nested
    @DisplayName("join")
    @TestCategories.Tier1
    class Joins {

        @Test
        @DisplayName("Join output is left columns then right columns")
        void testJoinSchema() {
            logStep("Join customer with purchases");
            LogicalPlan plan = analyze(
                "source = customer | join left = c right = p on c.id = p.customer_id purchases");

            assertThat(plan).isInstanceOf(Join.class);
            Join join = (Join) plan;
            assertThat(join.joinType()).isEqualTo(Join.JoinType.INNER);
            assertThat(join.condition().toSQL()).isEqualTo("(c.id = p.customer_id)");
            assertThat(plan.schema().fieldNames()).containsExactly(
                "id", "name", "region",
                "id", "customer_id", "amount", "region", "created", "ts", "address");
        }

        @Test
        @DisplayName("Unqualified keys with distinct names join without qualifiers")
        void testKeyNamedJoin() {
            InMemoryCatalog tpch = new InMemoryCatalog()
                .register("customer", new StructType(
                    new StructField("c_custkey", LongType.get()),
                    new StructField("c_name", StringType.get())))
                .register("orders", new StructType(
                    new StructField("o_custkey", LongType.get()),
                    new StructField("o_orderkey", LongType.get())));

            LogicalPlan plan = new PPLAnalyzer(tpch).analyze(PPLSyntaxParser.getInstance().parse(
                "source = customer | join on c_custkey = o_custkey orders"));

            assertThat(plan.schema().fieldNames()).containsExactly("c_custkey", "c_name", "o_custkey", "o_orderkey");
            assertThat(((Join) plan).condition().toSQL()).isEqualTo("(customer.c_custkey = orders.o_custkey)");
        }

        @Test
        @DisplayName("Both table names and aliases qualify join columns")
        void testQualifiedAfterJoin() {
            LogicalPlan plan = analyze(
                "source = customer | join left = c right = p on c.id = p.customer_id purchases"
                    + " | fields customer.name, p.amount, purchases.region");

            assertThat(plan.schema().fieldNames()).containsExactly("name", "amount", "region");
            assertThat(projection(plan, "name").toSQL()).isEqualTo("c.name");
        }

        @Test
        @DisplayName("Unqualified names present on both sides are ambiguous")
        @TestCategories.Tier2
        void testAmbiguousReference() {
            assertThatThrownBy(() -> analyze(
                    "source = customer | join on customer.id = purchases.customer_id purchases | where region = 'N'"))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("Reference 'region' is ambiguous, could be: [customer.region, purchases.region]");
        }

        @Test
        @DisplayName("Unique names resolve without qualification")
        void testUniqueNamesAfterJoin() {
            LogicalPlan plan = analyze(
                "source = customer | join on customer.id = customer_id purchases | stats sum(amount) as total by name");

            assertThat(plan.schema().fieldNames()).containsExactly("name", "total");
            assertThat(plan.schema().fieldAt(1).dataType()).isEqualTo(DoubleType.get());
        }

        @Test
        @DisplayName("Join type inference")
        void testJoinTypes() {
            assertThat(((Join) analyze("source = customer | join purchases")).joinType())
                .isEqualTo(Join.JoinType.CROSS);
            assertThat(((Join) analyze("source = customer | cross join purchases")).joinType())
                .isEqualTo(Join.JoinType.CROSS);
            assertThat(((Join) analyze("source = customer | right join on customer.id = customer_id purchases")).joinType())
                .isEqualTo(Join.JoinType.RIGHT);
            assertThat(((Join) analyze("source = customer | full outer join on customer.id = customer_id purchases")).joinType())
                .isEqualTo(Join.JoinType.FULL);
        }

        @Test
        @DisplayName("Semi and anti joins keep only the left columns")
        void testSemiAntiJoin() {
            LogicalPlan semi = analyze("source = customer | semi join on customer.id = customer_id purchases");
            LogicalPlan anti = analyze("source = customer | left anti join on customer.id = customer_id purchases");

            assertThat(((Join) semi).joinType()).isEqualTo(Join.JoinType.LEFT_SEMI);
            assertThat(((Join) anti).joinType()).isEqualTo(Join.JoinType.LEFT_ANTI);
            assertThat(semi.schema()).isEqualTo(CUSTOMER);
            assertThat(anti.schema()).isEqualTo(CUSTOMER);
        }

        @Test
        @DisplayName("Join with a subquery on the right")
        void testSubqueryJoin() {
            LogicalPlan plan = analyze(
                "source = customer | join on customer.id = o.customer_id [ source = purchases | where amount > 10 | fields customer_id, amount ] as o"
                    + " | fields name, o.amount");

            assertThat(plan.schema().fieldNames()).containsExactly("name", "amount");
        }

        @Test
        @DisplayName("eval, rename and fields - keep both sides of a shared column name")
        void testProjectionsOverSharedNames() {
            String join = "source = customer | join on customer.id = purchases.customer_id purchases";

            logStep("eval after the join");
            LogicalPlan eval = analyze(join + " | eval doubled = amount * 2");
            assertThat(eval.schema().fieldNames()).containsExactly(
                "id", "name", "region",
                "id", "customer_id", "amount", "region", "created", "ts", "address", "doubled");
            assertThat(projection(eval, "doubled").toSQL()).isEqualTo("(purchases.amount * 2)");

            logStep("rename after the join");
            LogicalPlan rename = analyze(join + " | rename name as customer_name");
            assertThat(rename.schema().fieldNames()).containsExactly(
                "id", "customer_name", "region",
                "id", "customer_id", "amount", "region", "created", "ts", "address");

            logStep("fields - after the join");
            LogicalPlan without = analyze(join + " | fields - name, address");
            assertThat(without.schema().fieldNames()).containsExactly(
                "id", "region", "id", "customer_id", "amount", "region", "created", "ts");
        }

        @Test
        @DisplayName("Shared names stay referable once renamed right after the join")
        void testRenameSharedName() {
            LogicalPlan plan = analyze("source = customer | join on customer.id = purchases.customer_id purchases"
                + " | rename purchases.id as purchase_id | where amount > 1 | fields customer.id, purchase_id");

            assertThat(plan.schema().fieldNames()).containsExactly("id", "purchase_id");
        }

        @Test
        @DisplayName("Shared names wrapped in a subquery cannot be referenced")
        @TestCategories.Tier2
        void testSharedNameAfterSubquery() {
            String join = "source = customer | join on customer.id = purchases.customer_id purchases";

            assertThatThrownBy(() -> analyze(join + " | where amount > 1 | fields customer.id"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Reference 'customer.id' is ambiguous")
                .hasMessageContaining("rename them directly after the join");
            assertThatThrownBy(() -> analyze(join + " | eval doubled = amount * 2 | eval tripled = amount * 3"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("2 columns named 'id'");
            assertThatThrownBy(() -> analyze(join + " | eval id = 1"))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("eval: 'id' names more than one column; rename one of them before assigning it");
        }

        @Test
        @DisplayName("Join errors")
        @TestCategories.Tier2
        void testJoinErrors() {
            assertThatThrownBy(() -> analyze("source = customer | cross join on customer.id = customer_id purchases"))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("cross join does not take an ON condition");
            assertThatThrownBy(() -> analyze("source = customer | join right = a on customer.id = a.customer_id purchases as b"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("two aliases");
            assertThatThrownBy(() -> analyze("source = customer | join on customer.id = x.id nope as x"))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("Table or index 'nope' not found");
            assertThatThrownBy(() -> analyze("source = customer | join on customer.id = customer_id purchases | fields - id"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("ambiguous");
        }

        @Test
        @DisplayName("A join subquery cannot see the left side")
        @TestCategories.Tier2
        void testJoinSubqueryIsIndependent() {
            assertThatThrownBy(() -> analyze(
                    "source = customer | join on customer.id = p.customer_id [ source = purchases | where name = 'x' ] as p"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Column 'name' cannot be resolved");
        }
    }

    @Nested
    @DisplayName("Subqueries")
    class Subqueries {

        @Test
        @DisplayName("in subquery")
        void testInSubquery() {
            Expression condition = filterCondition(analyze(
                "source = customer | where id in [ source = purchases | fields customer_id ]"));

            assertThat(condition).isInstanceOf(InSubquery.class);
            assertThat(((InSubquery) condition).subquery().schema().fieldNames()).containsExactly("customer_id");
        }

        @Test
        @DisplayName("Correlated exists resolves outer columns")
        void testCorrelatedExists() {
            Expression condition = filterCondition(analyze(
                "source = customer | where exists [ source = purchases | where customer_id = customer.id ]"));

            assertThat(condition).isInstanceOf(ExistsSubquery.class);
            Filter inner = (Filter) ((ExistsSubquery) condition).subquery();
            ColumnReference outer = (ColumnReference) ((BinaryExpression) inner.condition()).right();
            assertThat(outer.isOuter()).isTrue();
            assertThat(outer.qualifiedName()).isEqualTo("customer.id");
        }

        @Test
        @DisplayName("Local names shadow outer names")
        void testShadowing() {
            Expression condition = filterCondition(analyze(
                "source = customer | where exists [ source = purchases | where region = 'N' ]"));

            Filter inner = (Filter) ((ExistsSubquery) condition).subquery();
            ColumnReference region = (ColumnReference) ((BinaryExpression) inner.condition()).left();
            assertThat(region.isOuter()).isFalse();
            assertThat(region.qualifier()).isEqualTo("purchases");
        }

        @Test
        @DisplayName("Scalar subquery takes the type of its only column")
        void testScalarSubquery() {
            Expression condition = filterCondition(analyze(
                "source = purchases | where amount > [ source = purchases | stats avg(amount) ]"));

            ScalarSubquery scalar = (ScalarSubquery) ((BinaryExpression) condition).right();
            assertThat(scalar.dataType()).isEqualTo(DoubleType.get());
        }

        @Test
        @DisplayName("Subqueries returning several columns")
        @TestCategories.Tier2
        void testMultiColumnSubquery() {
            assertThatThrownBy(() -> analyze(
                    "source = customer | where id in [ source = purchases | fields customer_id, amount ]"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("in subquery must return exactly one column, but returns 2");
        }

        @Test
        @DisplayName("Outer columns cannot be projected by fields")
        @TestCategories.Tier2
        void testOuterColumnInFields() {
            assertThatThrownBy(() -> analyze(
                    "source = customer | where exists [ source = purchases | fields name ]"))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("'name' is not a column of the current pipeline");
        }
    }
}
