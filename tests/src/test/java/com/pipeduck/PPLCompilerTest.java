package com.pipeduck;

import com.pipeduck.catalog.IndexMappingCatalog;
import com.pipeduck.catalog.InMemoryCatalog;
import com.pipeduck.config.AnalyzerOptions;
import com.pipeduck.exception.AnalysisException;
import com.pipeduck.logical.LogicalPlan;
import com.pipeduck.parser.PPLParseException;
import com.pipeduck.ppl.ast.PPLQuery;
import com.pipeduck.test.TestBase;
import com.pipeduck.test.TestCategories;
import com.pipeduck.types.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests: PPL text to logical plan and Spark SQL.
 */
@DisplayName("PPLCompiler End-to-End Tests")
@TestCategories.Integration
public class PPLCompilerTest extends TestBase {

    private static final String ORDERS_PIPELINE =
        "source = orders | where status = 'open' | stats count() as n by region | sort - n | head 5";

    private PPLCompiler compiler;

    @Override
    protected void doSetUp() {
        InMemoryCatalog catalog = new InMemoryCatalog()
            .register("orders", new StructType(
                new StructField("status", StringType.get()),
                new StructField("region", StringType.get())))
            .register("customer", new StructType(
                new StructField("id", LongType.get()),
                new StructField("name", StringType.get()),
                new StructField("region", StringType.get())))
            .register("purchases", new StructType(
                new StructField("id", LongType.get()),
                new StructField("customer_id", LongType.get()),
                new StructField("amount", DoubleType.get()),
                new StructField("region", StringType.get())));
        compiler = new PPLCompiler(catalog, AnalyzerOptions.DEFAULTS);
    }

    @Nested
    @DisplayName("Orders Pipeline")
    @TestCategories.Tier1
    class OrdersPipeline {

        @Test
        @DisplayName("Plan tree of where | stats | sort | head")
        void testPlanTree() {
            logStep("Compile the orders pipeline");
            LogicalPlan plan = compiler.compile(ORDERS_PIPELINE);

            assertThat(plan.treeString()).isEqualTo(
                "Limit(5)\n"
                    + "+- Sort([orders.n DESCENDING NULLS_LAST])\n"
                    + "   +- Aggregate(groupBy=[orders.region], agg=[COUNT(*) AS n])\n"
                    + "      +- Filter((orders.status = 'open'))\n"
                    + "         +- TableScan(orders)\n");
        }

        @Test
        @DisplayName("Spark SQL of where | stats | sort | head")
        void testSQL() {
            logStep("Render the orders pipeline");
            String sql = compiler.toSQL(ORDERS_PIPELINE);

            assertThat(sql).isEqualTo(
                "SELECT * FROM (SELECT * FROM (SELECT orders.region, COUNT(*) AS n "
                    + "FROM (SELECT * FROM orders WHERE (orders.status = 'open')) AS orders "
                    + "GROUP BY orders.region) AS orders ORDER BY orders.n DESC NULLS LAST) AS orders LIMIT 5");
        }

        @Test
        @DisplayName("Output schema")
        void testSchema() {
            StructType schema = compiler.compile(ORDERS_PIPELINE).schema();

            assertThat(schema.fieldNames()).containsExactly("region", "n");
            assertThat(schema.fieldAt(1).dataType()).isEqualTo(LongType.get());
            assertThat(schema.fieldAt(1).nullable()).isFalse();
        }
    }

    @Nested
    @DisplayName("Spark SQL")
    class SparkSQL {

        @Test
        @DisplayName("Source only")
        void testSourceOnly() {
            assertThat(compiler.toSQL("source = orders")).isEqualTo("SELECT * FROM orders");
            assertThat(compiler.toSQL("search source = orders as o | where o.region = 'N'"))
                .isEqualTo("SELECT * FROM orders AS o WHERE (o.region = 'N')");
        }

        @Test
        @DisplayName("eval, fields and rename")
        void testProjections() {
            assertThat(compiler.toSQL("source = purchases | eval big = amount > 100 | fields id, big"))
                .isEqualTo("SELECT purchases.id, purchases.big FROM (SELECT purchases.id, purchases.customer_id, "
                    + "purchases.amount, purchases.region, (purchases.amount > 100) AS big FROM purchases) AS purchases");
            assertThat(compiler.toSQL("source = orders | rename region as area"))
                .isEqualTo("SELECT orders.status, orders.region AS area FROM orders");
        }

        @Test
        @DisplayName("Join with aliases")
        void testJoinWithAliases() {
            assertThat(compiler.toSQL("source = customer | join left = c right = p on c.id = p.customer_id purchases"))
                .isEqualTo("SELECT * FROM customer AS c INNER JOIN purchases AS p ON (c.id = p.customer_id)");
            assertThat(compiler.toSQL(
                    "source = customer | join left = c right = p on c.id = p.customer_id purchases | fields c.name, p.amount"))
                .isEqualTo("SELECT c.name, p.amount FROM customer AS c INNER JOIN purchases AS p ON (c.id = p.customer_id)");
        }

        @Test
        @DisplayName("Aggregation over a join")
        void testAggregateOverJoin() {
            assertThat(compiler.toSQL(
                    "source = customer | join on customer.id = purchases.customer_id purchases"
                        + " | stats sum(amount) as total by customer.name"))
                .isEqualTo("SELECT customer.name, SUM(purchases.amount) AS total FROM customer "
                    + "INNER JOIN purchases ON (customer.id = purchases.customer_id) GROUP BY customer.name");
        }

        @Test
        @DisplayName("eval over a join whose sides share column names")
        void testEvalOverJoin() {
            assertThat(compiler.toSQL(
                    "source = customer | join on customer.id = purchases.customer_id purchases | eval doubled = amount * 2"))
                .isEqualTo("SELECT customer.id, customer.name, customer.region, purchases.id, purchases.customer_id, "
                    + "purchases.amount, purchases.region, (purchases.amount * 2) AS doubled FROM customer "
                    + "INNER JOIN purchases ON (customer.id = purchases.customer_id)");
        }

        @Test
        @DisplayName("Join with a subquery")
        void testSubqueryJoin() {
            assertThat(compiler.toSQL(
                    "source = customer | join on customer.id = o.customer_id [ source = purchases | where amount > 10 ] as o"))
                .isEqualTo("SELECT * FROM customer INNER JOIN "
                    + "(SELECT * FROM purchases WHERE (purchases.amount > 10)) AS o ON (customer.id = o.customer_id)");
        }

        @Test
        @DisplayName("Correlated exists")
        void testCorrelatedExists() {
            assertThat(compiler.toSQL(
                    "source = customer | where exists [ source = purchases | where customer_id = customer.id ]"))
                .isEqualTo("SELECT * FROM customer WHERE EXISTS "
                    + "(SELECT * FROM purchases WHERE (purchases.customer_id = customer.id))");
        }

        @Test
        @DisplayName("head with offset and date arithmetic")
        void testHeadAndFunctions() {
            assertThat(compiler.toSQL("source = orders | head 3 from 2"))
                .isEqualTo("SELECT * FROM orders LIMIT 3 OFFSET 2");
            assertThat(compiler.toSQL("source = customer | eval n = upper(name) | fields n"))
                .isEqualTo("SELECT customer.n FROM (SELECT customer.id, customer.name, customer.region, "
                    + "upper(customer.name) AS n FROM customer) AS customer");
        }
    }

    @Nested
    @DisplayName("Index Mappings")
    @TestCategories.TypeMapping
    class IndexMappings {

        @Test
        @DisplayName("Pipelines over an index registered from its mapping")
        void testMappingCatalog() throws IOException {
            String mapping;
            try (InputStream in = PPLCompilerTest.class.getResourceAsStream("/mappings/accounts.json")) {
                assertThat(in).isNotNull();
                mapping = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            PPLCompiler accounts = new PPLCompiler(new IndexMappingCatalog().registerIndex("accounts", mapping));

            logStep("Filter on a nested field and a date");
            String sql = accounts.toSQL(
                "source = accounts | where address.city = 'Paris' and birthday < '2000-01-01' | fields firstname, age");

            assertThat(sql).isEqualTo("SELECT accounts.firstname, accounts.age FROM (SELECT * FROM accounts WHERE "
                + "((accounts.address.city = 'Paris') AND (accounts.birthday < '2000-01-01'))) AS accounts");
        }
    }

    @Nested
    @DisplayName("Failures")
    @TestCategories.Tier2
    class Failures {

        @Test
        @DisplayName("Syntax errors surface as parse exceptions")
        void testSyntaxError() {
            assertThatThrownBy(() -> compiler.toSQL("source = orders | where"))
                .isInstanceOf(PPLParseException.class);
        }

        @Test
        @DisplayName("Analysis errors surface as analysis exceptions")
        void testAnalysisError() {
            assertThatThrownBy(() -> compiler.toSQL("source = orders | where amount > 1"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Column 'amount' cannot be resolved");
        }

        @Test
        @DisplayName("parse only checks syntax")
        void testParseOnly() {
            PPLQuery query = compiler.parse("source = nope | where whatever = 1");

            assertThat(query.source().table()).isEqualTo("nope");
        }
    }
}
