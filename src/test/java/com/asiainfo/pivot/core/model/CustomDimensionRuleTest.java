package com.asiainfo.pivot.core.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CustomDimensionRuleTest {

    @Test
    void testBucketBounds() {
        CustomDimensionRule rule = CustomDimensionRule.bucket("Mid", 50.0, 149.0);
        assertTrue(rule.matchesBucket(50.0));
        assertTrue(rule.matchesBucket(149.0));
        assertFalse(rule.matchesBucket(149.5));
        assertFalse(rule.matchesBucket(null));

        assertTrue(CustomDimensionRule.bucket("High", 100.0, null).matchesBucket(1e9));
        assertFalse(CustomDimensionRule.bucket("Empty", null, null).matchesBucket(1.0));
    }

    @Test
    void testBucketEquals() {
        CustomDimensionRule zero = new CustomDimensionRule("Zero", null, null, 0.0, null, null, null);
        assertTrue(zero.matchesBucket(0.0));
        assertFalse(zero.matchesBucket(1.0));
    }

    @Test
    void testDateRangeInclusive() {
        CustomDimensionRule rule = CustomDimensionRule.dateRange("Jan",
                LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31));
        assertTrue(rule.matchesDate(LocalDate.of(2025, 1, 1)));
        assertTrue(rule.matchesDate(LocalDate.of(2025, 1, 31)));
        assertFalse(rule.matchesDate(LocalDate.of(2025, 2, 1)));
        assertFalse(rule.matchesDate(null));
    }

    @Test
    void testConditionsAreConjunction() {
        CustomDimensionRule rule = CustomDimensionRule.condition("Mid", List.of(
                new MetricCondition(ConditionOperator.GTE, 10.0, null),
                new MetricCondition(ConditionOperator.LT, 20.0, null)));
        assertTrue(rule.matchesConditions(10.0));
        assertTrue(rule.matchesConditions(19.9));
        assertFalse(rule.matchesConditions(20.0));
        assertFalse(rule.matchesConditions(null));
    }

    @Test
    void testOperators() {
        assertTrue(new MetricCondition(ConditionOperator.BETWEEN, 1.0, 3.0).matches(3.0));
        assertFalse(new MetricCondition(ConditionOperator.BETWEEN, 1.0, 3.0).matches(3.1));
        assertTrue(new MetricCondition(ConditionOperator.NE, 1.0, null).matches(2.0));
        assertTrue(new MetricCondition(ConditionOperator.EQ, 2.0, null).matches(2.0));
        assertTrue(new MetricCondition(ConditionOperator.IS_NULL, null, null).matches(null));
        assertFalse(new MetricCondition(ConditionOperator.IS_NOT_NULL, null, null).matches(null));
        assertTrue(new MetricCondition(ConditionOperator.IS_NOT_NULL, null, null).matches(0.0));
    }

    @Test
    void testOperatorSymbols() {
        assertEquals(ConditionOperator.GTE, ConditionOperator.fromSymbol(">="));
        assertEquals(ConditionOperator.NE, ConditionOperator.fromSymbol("<>"));
        assertEquals(ConditionOperator.EQ, ConditionOperator.fromSymbol("=="));
        assertEquals(ConditionOperator.IS_NULL, ConditionOperator.fromSymbol("IS_NULL"));
        assertThrows(IllegalArgumentException.class, () -> ConditionOperator.fromSymbol("~"));
    }
}
