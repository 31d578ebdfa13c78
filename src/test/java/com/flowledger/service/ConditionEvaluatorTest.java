package com.flowledger.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowledger.model.step.ConditionOperator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.flowledger.model.step.ConditionOperator.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the ConditionEvaluator, which picks the branch a condition step
 * takes. Every operator is covered, plus absent values and shapes the
 * operators cannot handle, since evaluation must never throw.
 */
class ConditionEvaluatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private ConditionEvaluator evaluator;
    private JsonNode payload;

    @BeforeEach
    void setUp() throws Exception {
        evaluator = new ConditionEvaluator();
        payload = mapper.readTree("""
                {
                  "status": "open",
                  "total": 1500,
                  "ratio": 0.5,
                  "amount": "250",
                  "empty": "",
                  "nothing": null,
                  "customer": {"name": "Acme Corp", "tier": "gold"},
                  "items": [{"sku": "A-1"}, {"sku": "B-2"}]
                }
                """);
    }

    private boolean eval(String path, ConditionOperator op, JsonNode value) {
        return evaluator.evaluate(payload, path, op, value);
    }

    @Nested
    @DisplayName("eq / neq")
    class EqualityTests {

        @Test
        @DisplayName("eq matches identical strings")
        void eq_string() {
            assertTrue(eval("status", EQ, TextNode.valueOf("open")));
        }

        @Test
        @DisplayName("eq is case-sensitive for strings")
        void eq_caseSensitive() {
            assertFalse(eval("status", EQ, TextNode.valueOf("OPEN")));
        }

        @Test
        @DisplayName("eq compares numbers numerically (1500 == 1500.0)")
        void eq_numeric() {
            assertTrue(eval("total", EQ, DoubleNode.valueOf(1500.0)));
            assertTrue(eval("total", EQ, DecimalNode.valueOf(new BigDecimal("1500.00"))));
        }

        @Test
        @DisplayName("eq does not treat a numeric string as a number")
        void eq_stringVsNumber() {
            assertFalse(eval("amount", EQ, IntNode.valueOf(250)));
        }

        @Test
        @DisplayName("eq compares objects structurally")
        void eq_object() throws Exception {
            assertTrue(eval("customer", EQ, mapper.readTree("{\"tier\": \"gold\", \"name\": \"Acme Corp\"}")));
            assertFalse(eval("customer", EQ, mapper.readTree("{\"name\": \"Acme Corp\"}")));
        }

        @Test
        @DisplayName("eq against an absent value is false")
        void eq_absent() {
            assertFalse(eval("missing", EQ, TextNode.valueOf("open")));
        }

        @Test
        @DisplayName("neq is true when values differ")
        void neq_differs() {
            assertTrue(eval("status", NEQ, TextNode.valueOf("closed")));
            assertFalse(eval("status", NEQ, TextNode.valueOf("open")));
        }

        @Test
        @DisplayName("neq against an absent value is true")
        void neq_absent() {
            assertTrue(eval("missing", NEQ, TextNode.valueOf("open")));
        }

        @Test
        @DisplayName("explicit null equals a null comparison value")
        void eq_null() {
            assertTrue(eval("nothing", EQ, NullNode.getInstance()));
        }
    }

    @Nested
    @DisplayName("gt / gte / lt / lte")
    class NumericTests {

        @Test
        @DisplayName("compares numbers")
        void numbers() {
            assertTrue(eval("total", GT, IntNode.valueOf(1000)));
            assertFalse(eval("total", GT, IntNode.valueOf(1500)));
            assertTrue(eval("total", GTE, IntNode.valueOf(1500)));
            assertTrue(eval("ratio", LT, IntNode.valueOf(1)));
            assertTrue(eval("ratio", LTE, DoubleNode.valueOf(0.5)));
        }

        @Test
        @DisplayName("parses numeric strings")
        void numericStrings() {
            assertTrue(eval("amount", GT, IntNode.valueOf(200)));
            assertTrue(eval("total", LT, TextNode.valueOf("2000")));
        }

        @Test
        @DisplayName("non-numeric operands count as 0")
        void nonNumericAsZero() {
            assertTrue(eval("status", GTE, TextNode.valueOf("zzz")));
            assertFalse(eval("status", GT, TextNode.valueOf("zzz")));
            assertTrue(eval("status", LT, IntNode.valueOf(1)));
            assertTrue(eval("customer", LTE, BooleanNode.TRUE));
        }

        @Test
        @DisplayName("absent value is never ordered")
        void absent() {
            assertFalse(eval("missing", GT, IntNode.valueOf(-1)));
            assertFalse(eval("missing", LTE, IntNode.valueOf(0)));
        }
    }

    @Nested
    @DisplayName("contains")
    class ContainsTests {

        @Test
        @DisplayName("is a case-insensitive substring test")
        void caseInsensitive() {
            assertTrue(eval("customer.name", CONTAINS, TextNode.valueOf("acme")));
            assertFalse(eval("customer.name", CONTAINS, TextNode.valueOf("globex")));
        }

        @Test
        @DisplayName("works on the text form of non-strings")
        void nonStrings() {
            assertTrue(eval("total", CONTAINS, IntNode.valueOf(50)));
            assertTrue(eval("items", CONTAINS, TextNode.valueOf("b-2")));
        }

        @Test
        @DisplayName("absent value contains nothing")
        void absent() {
            assertFalse(eval("missing", CONTAINS, TextNode.valueOf("")));
        }
    }

    @Nested
    @DisplayName("exists")
    class ExistsTests {

        @Test
        @DisplayName("present values exist")
        void present() {
            assertTrue(eval("status", EXISTS, null));
            assertTrue(eval("total", EXISTS, null));
            assertTrue(eval("customer", EXISTS, null));
        }

        @Test
        @DisplayName("absent, null and empty-string values do not exist")
        void notPresent() {
            assertFalse(eval("missing", EXISTS, null));
            assertFalse(eval("nothing", EXISTS, null));
            assertFalse(eval("empty", EXISTS, null));
        }
    }

    @Nested
    @DisplayName("Field paths")
    class FieldPathTests {

        @Test
        @DisplayName("leading payload. is stripped")
        void payloadPrefix() {
            assertTrue(eval("payload.status", EQ, TextNode.valueOf("open")));
        }

        @Test
        @DisplayName("numeric segments index arrays")
        void arrayIndex() {
            assertTrue(eval("items.1.sku", EQ, TextNode.valueOf("B-2")));
            assertFalse(eval("items.5.sku", EXISTS, null));
        }

        @Test
        @DisplayName("malformed paths resolve to absent")
        void malformed() {
            assertFalse(eval("customer..name", EXISTS, null));
            assertFalse(eval("status.inner", EXISTS, null));
            assertFalse(eval("", EXISTS, null));
        }
    }

    @Nested
    @DisplayName("Totality")
    class TotalityTests {

        @Test
        @DisplayName("null operator and null payload evaluate to false")
        void nulls() {
            assertFalse(evaluator.evaluate(payload, "status", null, TextNode.valueOf("open")));
            assertFalse(evaluator.evaluate(null, "status", EQ, TextNode.valueOf("open")));
        }

        @Test
        @DisplayName("same inputs always give the same answer")
        void deterministic() {
            boolean first = eval("total", GT, IntNode.valueOf(1000));
            for (int i = 0; i < 10; i++) {
                assertEquals(first, eval("total", GT, IntNode.valueOf(1000)));
            }
        }
    }
}
