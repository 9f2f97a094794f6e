package com.pipeduck.parser;

import com.pipeduck.ppl.ast.*;
import com.pipeduck.test.TestBase;
import com.pipeduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PPLSyntaxParser}: PPL text to AST.
 */
@DisplayName("PPLSyntaxParser Tests")
@Tag("parser")
@TestCategories.Unit
public class PPLSyntaxParserTest extends TestBase {

    private PPLQuery parse(String text) {
        return PPLSyntaxParser.getInstance().parse(text);
    }

    private AstExpression wherePredicate(String text) {
        PPLQuery query = parse(text);
        return ((WhereCommand) query.pipeline().get(0)).predicate();
    }

    @Nested
    @DisplayName("Source")
    class Source {

        @Test
        @DisplayName("source with an optional search keyword")
        void testSource() {
            assertThat(parse("source = orders").source()).isEqualTo(new SourceCommand("orders", null));
            assertThat(parse("search source=orders").source()).isEqualTo(new SourceCommand("orders", null));
        }

        @Test
        @DisplayName("Dotted and back-quoted table names")
        void testTableNames() {
            assertThat(parse("source = sales.orders").source().table()).isEqualTo("sales.orders");
            assertThat(parse("source = `logs-2024`").source().table()).isEqualTo("logs-2024");
        }

        @Test
        @DisplayName("Source alias")
        void testSourceAlias() {
            assertThat(parse("source = orders as o").source()).isEqualTo(new SourceCommand("orders", "o"));
        }

        @Test
        @DisplayName("Keywords are case-insensitive, identifiers keep their case")
        void testCaseInsensitiveKeywords() {
            PPLQuery query = parse("SOURCE = Orders | WHERE Status = 'open' | Head 3");

            assertThat(query.source().table()).isEqualTo("Orders");
            assertThat(query.pipeline()).hasSize(2);
            assertThat(((BinaryOperation) ((WhereCommand) query.pipeline().get(0)).predicate()).left())
                .isEqualTo(UnresolvedField.of("Status"));
        }
    }

    @Nested
    @DisplayName("Commands")
    @TestCategories.Tier1
    class Commands {

        @Test
        @DisplayName("The orders pipeline")
        void testOrdersPipeline() {
            logStep("Parse a five command pipeline");
            PPLQuery query = parse(
                "source = orders | where status = 'open' | stats count() as n by region | sort - n | head 5");

            assertThat(query.pipeline()).hasSize(4);
            assertThat(query.pipeline().get(0)).isInstanceOf(WhereCommand.class);
            assertThat(query.pipeline().get(1)).isInstanceOf(StatsCommand.class);
            assertThat(query.pipeline().get(2)).isInstanceOf(SortCommand.class);
            assertThat(query.pipeline().get(3)).isEqualTo(new HeadCommand(5L, 0));

            logStep("Render it back");
            assertThat(query.canonicalText()).isEqualTo(
                "source = orders | where status = 'open' | stats count() as n by region | sort - n | head 5");
        }

        @Test
        @DisplayName("stats with several aggregates, aliases and group keys")
        void testStats() {
            StatsCommand stats = (StatsCommand) parse(
                "source = t | stats count(), avg(amount) as avg_amount, dc(user) by region, city").pipeline().get(0);

            assertThat(stats.aggregations()).extracting(StatsCommand.Aggregation::outputName)
                .containsExactly("count()", "avg_amount", "dc(user)");
            assertThat(stats.groupBy()).containsExactly(UnresolvedField.of("region"), UnresolvedField.of("city"));
        }

        @Test
        @DisplayName("count(*) is count()")
        void testCountStar() {
            StatsCommand stats = (StatsCommand) parse("source = t | stats count(*)").pipeline().get(0);

            assertThat(stats.aggregations().get(0).expression())
                .isEqualTo(new FunctionInvocation("count", List.of()));
        }

        @Test
        @DisplayName("eval with several assignments")
        void testEval() {
            EvalCommand eval = (EvalCommand) parse("source = t | eval a = x + 1, b = a * 2").pipeline().get(0);

            assertThat(eval.assignments()).extracting(EvalCommand.Assignment::name).containsExactly("a", "b");
            assertThat(eval.assignments().get(0).expression())
                .isEqualTo(new BinaryOperation("+", UnresolvedField.of("x"), LiteralValue.ofInteger(1)));
        }

        @Test
        @DisplayName("sort signs")
        void testSort() {
            SortCommand sort = (SortCommand) parse("source = t | sort - a, + b, c").pipeline().get(0);

            assertThat(sort.keys()).extracting(SortCommand.SortKey::ascending).containsExactly(false, true, true);
        }

        @Test
        @DisplayName("head with and without size and offset")
        void testHead() {
            assertThat(parse("source = t | head").pipeline().get(0)).isEqualTo(new HeadCommand(null, 0));
            assertThat(parse("source = t | head 20 from 40").pipeline().get(0)).isEqualTo(new HeadCommand(20L, 40));
            assertThat(parse("source = t | head -1").pipeline().get(0)).isEqualTo(new HeadCommand(-1L, 0));
        }

        @Test
        @DisplayName("fields include and exclude")
        void testFields() {
            FieldsCommand include = (FieldsCommand) parse("source = t | fields a, b.c").pipeline().get(0);
            FieldsCommand plus = (FieldsCommand) parse("source = t | fields + a").pipeline().get(0);
            FieldsCommand exclude = (FieldsCommand) parse("source = t | fields - a").pipeline().get(0);

            assertThat(include.exclude()).isFalse();
            assertThat(include.fields()).containsExactly(UnresolvedField.of("a"), UnresolvedField.of("b", "c"));
            assertThat(plus.exclude()).isFalse();
            assertThat(exclude.exclude()).isTrue();
        }

        @Test
        @DisplayName("rename")
        void testRename() {
            RenameCommand rename = (RenameCommand) parse("source = t | rename a as b, `x y` as z").pipeline().get(0);

            assertThat(rename.renames()).containsExactly(
                new RenameCommand.Rename(UnresolvedField.of("a"), "b"),
                new RenameCommand.Rename(UnresolvedField.of("x y"), "z"));
        }
    }

    @Nested
    @DisplayName("Join")
    class Joins {

        @Test
        @DisplayName("Join with aliases and condition")
        void testJoinWithAliases() {
            JoinCommand join = (JoinCommand) parse(
                "source = customer | left join left = c right = o on c.id = o.cid orders").pipeline().get(0);

            assertThat(join.joinType()).isEqualTo(JoinCommand.JoinKind.LEFT);
            assertThat(join.leftAlias()).isEqualTo("c");
            assertThat(join.rightAlias()).isEqualTo("o");
            assertThat(join.condition()).isEqualTo(
                new BinaryOperation("=", UnresolvedField.of("c", "id"), UnresolvedField.of("o", "cid")));
            assertThat(join.right()).isEqualTo(new TableRelation("orders", null));
        }

        @Test
        @DisplayName("Join against a subquery")
        void testSubqueryJoin() {
            JoinCommand join = (JoinCommand) parse(
                "source = customer | join on id = cid [ source = orders | where amount > 10 ] as o").pipeline().get(0);

            assertThat(join.joinType()).isNull();
            assertThat(join.right()).isInstanceOf(SubqueryRelation.class);
            SubqueryRelation right = (SubqueryRelation) join.right();
            assertThat(right.alias()).isEqualTo("o");
            assertThat(right.query().source().table()).isEqualTo("orders");
        }

        @ParameterizedTest(name = "{0} join")
        @ValueSource(strings = {"inner", "cross", "left", "left outer", "right", "right outer",
            "full", "full outer", "semi", "left semi", "anti", "left anti"})
        void testJoinTypes(String type) {
            JoinCommand join = (JoinCommand) parse("source = a | " + type + " join b").pipeline().get(0);

            String expected = type.replace("left ", "").replace(" outer", "").toUpperCase();
            if (type.equals("left outer")) {
                expected = "LEFT";
            }
            assertThat(join.joinType()).isEqualTo(JoinCommand.JoinKind.valueOf(expected));
        }
    }

    @Nested
    @DisplayName("Expressions")
    class Expressions {

        @Test
        @DisplayName("and binds tighter than or; not tighter than and")
        void testLogicalPrecedence() {
            AstExpression expr = wherePredicate("source = t | where not a = 1 and b = 2 or c = 3");

            assertThat(expr).isInstanceOf(BinaryOperation.class);
            BinaryOperation or = (BinaryOperation) expr;
            assertThat(or.operator()).isEqualTo("or");
            BinaryOperation and = (BinaryOperation) or.left();
            assertThat(and.operator()).isEqualTo("and");
            assertThat(and.left()).isInstanceOf(UnaryOperation.class);
        }

        @Test
        @DisplayName("Multiplication binds tighter than addition")
        void testArithmeticPrecedence() {
            AstExpression expr = wherePredicate("source = t | where a + b * 2 > 10");

            BinaryOperation gt = (BinaryOperation) expr;
            BinaryOperation plus = (BinaryOperation) gt.left();
            assertThat(plus.operator()).isEqualTo("+");
            assertThat(((BinaryOperation) plus.right()).operator()).isEqualTo("*");
        }

        @Test
        @DisplayName("== and <> normalize to = and !=")
        void testOperatorSpellings() {
            assertThat(((BinaryOperation) wherePredicate("source = t | where a == 1")).operator()).isEqualTo("=");
            assertThat(((BinaryOperation) wherePredicate("source = t | where a <> 1")).operator()).isEqualTo("!=");
        }

        @Test
        @DisplayName("between, like, in, is null")
        void testPredicates() {
            assertThat(wherePredicate("source = t | where a between 1 and 5"))
                .isEqualTo(new BetweenPredicate(UnresolvedField.of("a"), LiteralValue.ofInteger(1),
                    LiteralValue.ofInteger(5), false));
            assertThat(wherePredicate("source = t | where name not like 'J%'"))
                .isEqualTo(new LikePredicate(UnresolvedField.of("name"), LiteralValue.ofString("J%"), true));
            assertThat(wherePredicate("source = t | where a in (1, 2)"))
                .isEqualTo(new InListPredicate(UnresolvedField.of("a"),
                    List.of(LiteralValue.ofInteger(1), LiteralValue.ofInteger(2)), false));
            assertThat(wherePredicate("source = t | where a is not null"))
                .isEqualTo(new IsNullPredicate(UnresolvedField.of("a"), true));
        }

        @Test
        @DisplayName("Subquery predicates")
        void testSubqueries() {
            assertThat(wherePredicate("source = t | where id in [ source = u | fields id ]"))
                .isInstanceOf(InSubqueryPredicate.class);
            assertThat(wherePredicate("source = t | where exists [ source = u | where u.id = t.id ]"))
                .isInstanceOf(ExistsPredicate.class);
            assertThat(((BinaryOperation) wherePredicate(
                    "source = t | where amount > [ source = t | stats avg(amount) ]")).right())
                .isInstanceOf(ScalarSubqueryValue.class);
        }

        @Test
        @DisplayName("Negative numeric literals fold the sign")
        void testNegativeLiterals() {
            assertThat(((BinaryOperation) wherePredicate("source = t | where a > -5")).right())
                .isEqualTo(LiteralValue.ofInteger(-5));
            assertThat(((BinaryOperation) wherePredicate("source = t | where a > -2.5")).right())
                .isEqualTo(LiteralValue.ofDecimal(-2.5));
            assertThat(((BinaryOperation) wherePredicate("source = t | where a > -b")).right())
                .isEqualTo(new UnaryOperation("-", UnresolvedField.of("b")));
        }

        @Test
        @DisplayName("The smallest long literal parses with its sign")
        void testLongMinValue() {
            assertThat(((BinaryOperation) wherePredicate("source = t | where a > -9223372036854775808")).right())
                .isEqualTo(LiteralValue.ofInteger(Long.MIN_VALUE));
        }

        @Test
        @DisplayName("Literals of every kind")
        void testLiterals() {
            AstExpression expr = wherePredicate("source = t | where a in (1, 2.5, 'x', \"y\", true, null)");

            assertThat(((InListPredicate) expr).values()).containsExactly(
                LiteralValue.ofInteger(1), LiteralValue.ofDecimal(2.5), LiteralValue.ofString("x"),
                LiteralValue.ofString("y"), LiteralValue.ofBoolean(true), LiteralValue.ofNull());
        }

        @Test
        @DisplayName("Interval literals with singular and plural units")
        void testIntervals() {
            EvalCommand eval = (EvalCommand) parse(
                "source = t | eval d = adddate(day, interval 2 days), e = ts - interval 1 hour").pipeline().get(0);

            FunctionInvocation call = (FunctionInvocation) eval.assignments().get(0).expression();
            assertThat(call.arguments().get(1)).isEqualTo(new IntervalValue(2, "days"));
            assertThat(((BinaryOperation) eval.assignments().get(1).expression()).right())
                .isEqualTo(new IntervalValue(1, "hour"));
        }

        @Test
        @DisplayName("Function names are lower-cased")
        void testFunctionNames() {
            assertThat(wherePredicate("source = t | where UPPER(name) = 'X'"))
                .isEqualTo(new BinaryOperation("=",
                    new FunctionInvocation("upper", List.of(UnresolvedField.of("name"))), LiteralValue.ofString("X")));
        }
    }

    @Nested
    @DisplayName("String Literals")
    class StringLiterals {

        @Test
        @DisplayName("Escapes and doubled quotes")
        void testUnquote() {
            assertThat(PPLAstBuilder.unquoteString("'it''s'")).isEqualTo("it's");
            assertThat(PPLAstBuilder.unquoteString("'it\\'s'")).isEqualTo("it's");
            assertThat(PPLAstBuilder.unquoteString("\"a\\tb\\n\"")).isEqualTo("a\tb\n");
            assertThat(PPLAstBuilder.unquoteString("\"say \"\"hi\"\"\"")).isEqualTo("say \"hi\"");
        }

        @Test
        @DisplayName("String literal case is preserved")
        void testCasePreserved() {
            assertThat(((BinaryOperation) wherePredicate("source = t | where s = 'MiXeD'")).right())
                .isEqualTo(LiteralValue.ofString("MiXeD"));
        }
    }

    @Nested
    @DisplayName("Syntax Errors")
    @TestCategories.Tier2
    class SyntaxErrors {

        @Test
        @DisplayName("Empty input")
        void testEmptyInput() {
            assertThatThrownBy(() -> parse("   "))
                .isInstanceOf(PPLParseException.class)
                .hasMessage("Syntax error: PPL query must not be null or empty");
            assertThatThrownBy(() -> parse(null)).isInstanceOf(PPLParseException.class);
        }

        @Test
        @DisplayName("Unknown command reports its position and token")
        void testUnknownCommand() {
            assertThatThrownBy(() -> parse("source = orders | wher x = 1"))
                .isInstanceOf(PPLParseException.class)
                .satisfies(e -> {
                    PPLParseException pe = (PPLParseException) e;
                    assertThat(pe.line()).isEqualTo(1);
                    assertThat(pe.column()).isEqualTo(18);
                    assertThat(pe.offendingToken()).isEqualTo("wher");
                    assertThat(pe.getMessage()).startsWith("Syntax error at line 1:18 near 'wher'");
                });
        }

        @Test
        @DisplayName("Premature end of input")
        void testPrematureEnd() {
            assertThatThrownBy(() -> parse("source = orders | where"))
                .isInstanceOf(PPLParseException.class)
                .satisfies(e -> assertThat(((PPLParseException) e).offendingToken()).isEqualTo("<EOF>"));
        }

        @Test
        @DisplayName("Errors on later lines")
        void testMultiLine() {
            assertThatThrownBy(() -> parse("source = orders\n| head 5 5"))
                .isInstanceOf(PPLParseException.class)
                .satisfies(e -> assertThat(((PPLParseException) e).line()).isEqualTo(2));
        }

        @Test
        @DisplayName("Integer literal overflow")
        void testIntegerOverflow() {
            assertThatThrownBy(() -> parse("source = t | head 99999999999999999999"))
                .isInstanceOf(PPLParseException.class)
                .hasMessageContaining("integer literal out of range");
            assertThatThrownBy(() -> parse("source = t | where a > 9223372036854775808"))
                .isInstanceOf(PPLParseException.class)
                .hasMessageContaining("integer literal out of range");
        }

        @Test
        @DisplayName("Unknown interval unit")
        void testUnknownIntervalUnit() {
            assertThatThrownBy(() -> parse("source = t | eval d = ts + interval 1 fortnight"))
                .isInstanceOf(PPLParseException.class)
                .hasMessageContaining("unknown interval unit 'fortnight'");
        }

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {
            "orders",
            "source orders",
            "source = orders | where",
            "source = orders | stats by region",
            "source = orders | sort",
            "source = orders | where a ! b",
            "source = orders || head 1",
            "source = orders | join"
        })
        void testInvalidPipelines(String text) {
            assertThat(PPLSyntaxParser.getInstance().canParse(text)).isFalse();
        }

        @Test
        @DisplayName("Parser recovers for the next query after an error")
        void testReuseAfterError() {
            assertThat(PPLSyntaxParser.getInstance().canParse("source = orders | wher")).isFalse();
            assertThat(PPLSyntaxParser.getInstance().canParse("source = orders | where a = 1")).isTrue();
        }
    }
}
