package org.nrg.profiles.model.template;

import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestRule;
import org.junit.rules.TestWatcher;
import org.junit.runner.Description;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

@Slf4j
public class ParameterConditionTest {
    @Rule
    public TestRule watcher = new TestWatcher() {
        protected void starting(Description description) {
            log.info("BEGINNING TEST " + description.getMethodName());
        }

        protected void finished(Description description) {
            log.info("ENDING TEST " + description.getMethodName());
        }
    };

    private static final Map<String, Object> BOTH = ImmutableMap.of("x", 1, "y", 2);
    private static final Map<String, Object> ONLY_Y = ImmutableMap.of("y", 2);
    private static final Map<String, Object> NONE = Collections.emptyMap();

    private static ParameterCondition.Builder<String> xAndY() {
        return ParameterCondition.<String>builder()
                .when(Condition.is("x", 1))
                .when(Condition.is("y", 2));
    }

    @Test
    public void testConjunction() {
        final ParameterCondition<String> condition = xAndY().then("yes").build();

        assertThat(condition.match(BOTH), is(true));
        assertThat(condition.match(ONLY_Y), is(false));
        assertThat(condition.match(NONE), is(false));
    }

    @Test
    public void testDisjunction() {
        final ParameterCondition<String> condition = xAndY().disjunction(true).then("yes").build();

        assertThat(condition.match(BOTH), is(true));
        assertThat(condition.match(ONLY_Y), is(true));
        assertThat(condition.match(NONE), is(false));
    }

    @Test
    public void testEmptyConditions() {
        final ParameterCondition<String> conjunction = ParameterCondition.<String>builder().then("yes").build();
        final ParameterCondition<String> disjunction = ParameterCondition.<String>builder()
                .disjunction(true)
                .then("yes")
                .build();

        assertThat(conjunction.match(NONE), is(true));
        assertThat(disjunction.match(NONE), is(false));
    }

    @Test
    public void testEvaluateWithoutMatchIsEmpty() {
        final ParameterCondition<String> condition = xAndY().then("yes").build();

        assertThat(condition.evaluate(BOTH), is(Optional.of("yes")));
        assertThat(condition.evaluate(ONLY_Y), is(Optional.<String>empty()));
    }

    @Test
    public void testEvaluateOtherwise() {
        final ParameterCondition<String> condition = xAndY().then("yes").otherwise("no").build();

        assertThat(condition.evaluate(BOTH), is(Optional.of("yes")));
        assertThat(condition.evaluate(ONLY_Y), is(Optional.of("no")));
    }

    @Test
    public void testNestedConditions() {
        final ParameterCondition<String> inner = ParameterCondition.<String>builder()
                .when("mode", ConditionOperator.EQUALS, "fast")
                .then("fast output")
                .otherwise("slow output")
                .build();
        final ParameterCondition<String> outer = ParameterCondition.<String>builder()
                .when("enabled", ConditionOperator.EQUALS, true)
                .then(inner)
                .build();

        assertThat(outer.evaluate(ImmutableMap.of("enabled", true, "mode", "fast")), is(Optional.of("fast output")));
        assertThat(outer.evaluate(ImmutableMap.of("enabled", "true")), is(Optional.of("slow output")));
        assertThat(outer.evaluate(ImmutableMap.of("enabled", false, "mode", "fast")), is(Optional.<String>empty()));

        assertThat(outer.allPossibilities(), contains("fast output", "slow output"));
        assertThat(outer.depth(), is(2));
    }

    @Test
    public void testMapKeepsShape() {
        final ParameterCondition<String> condition = xAndY().then("yes").otherwise("no").build();
        final ParameterCondition<Integer> lengths = condition.map(String::length);

        assertThat(lengths.evaluate(BOTH), is(Optional.of(3)));
        assertThat(lengths.evaluate(NONE), is(Optional.of(2)));
        assertThat(lengths.conditions(), is(condition.conditions()));
    }

    @Test
    public void testDepthLimit() {
        ParameterCondition<String> condition = ParameterCondition.<String>builder().then("leaf").build();
        for (int i = 1; i < ParameterCondition.MAX_DEPTH; i++) {
            condition = ParameterCondition.<String>builder().then(condition).build();
        }
        assertThat(condition.depth(), is(ParameterCondition.MAX_DEPTH));

        try {
            ParameterCondition.<String>builder().then(condition).build();
            fail("Conditions nested deeper than the limit should be rejected.");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString(String.valueOf(ParameterCondition.MAX_DEPTH)));
        }
    }

    @Test
    public void testOperators() {
        assertThat(ConditionOperator.EQUALS.test("3", 3), is(true));
        assertThat(ConditionOperator.EQUALS.test(3.0, 3), is(true));
        assertThat(ConditionOperator.EQUALS.test(null, null), is(true));
        assertThat(ConditionOperator.EQUALS.test(null, "a"), is(false));
        assertThat(ConditionOperator.EQUALS.test("1.50", "1.5"), is(true));
        assertThat(ConditionOperator.NOT_EQUALS.test("1.50", "1.5"), is(false));
        assertThat(ConditionOperator.NOT_EQUALS.test(null, "a"), is(true));
        assertThat(ConditionOperator.NOT_EQUALS.test("a", "a"), is(false));

        assertThat(ConditionOperator.CONTAINS.test("world", "hello world"), is(true));
        assertThat(ConditionOperator.CONTAINS.test("en", "english"), is(true));
        assertThat(ConditionOperator.CONTAINS.test("hello world", "world"), is(false));
        assertThat(ConditionOperator.CONTAINS.test("b", Arrays.asList("a", "b")), is(true));
        assertThat(ConditionOperator.CONTAINS.test("2", Arrays.asList(1, 2)), is(true));
        assertThat(ConditionOperator.CONTAINS.test("c", Arrays.asList("a", "b")), is(false));
        assertThat(ConditionOperator.CONTAINS.test(null, "b"), is(false));

        assertThat(ConditionOperator.GREATER_THAN.test("10", "9"), is(true));
        assertThat(ConditionOperator.GREATER_THAN.test("b", "a"), is(true));
        assertThat(ConditionOperator.GREATER_EQUAL_THAN.test(5, 5), is(true));
        assertThat(ConditionOperator.LESS_THAN.test(4, 5), is(true));
        assertThat(ConditionOperator.LESS_THAN.test(5, 5), is(false));
        assertThat(ConditionOperator.LESS_EQUAL_THAN.test(5, 5.0), is(true));
        assertThat(ConditionOperator.GREATER_THAN.test(null, 1), is(false));
        assertThat(ConditionOperator.LESS_THAN.test(true, 1), is(false));
    }

    @Test
    public void testContainsOptions() {
        final Condition condition = Condition.create("lang", Arrays.asList("en", "nl"), ConditionOperator.CONTAINS);
        assertThat(condition.test(ImmutableMap.of("lang", "nl")), is(true));
        assertThat(condition.test(ImmutableMap.of("lang", "de")), is(false));
        assertThat(condition.test(Collections.emptyMap()), is(false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOptionsOnlyForContains() {
        Condition.create("lang", Arrays.asList("en", "nl"), ConditionOperator.EQUALS);
    }

    @Test
    public void testEqualsAbsent() {
        final Condition condition = Condition.is("lang", null);
        assertThat(condition.test(Collections.emptyMap()), is(true));
        assertThat(condition.test(ImmutableMap.of("lang", "en")), is(false));
    }

    @Test
    public void testOperatorNames() {
        assertThat(ConditionOperator.fromName("greaterequalthan"), is(ConditionOperator.GREATER_EQUAL_THAN));
        assertThat(ConditionOperator.LESS_EQUAL_THAN.getName(), is("lessequalthan"));
    }
}
