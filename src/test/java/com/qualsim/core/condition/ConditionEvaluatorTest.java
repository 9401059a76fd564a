package com.qualsim.core.condition;

import com.qualsim.core.error.ValidationException;
import com.qualsim.core.model.SimulationScope;
import com.qualsim.core.model.WorldSnapshot;
import com.qualsim.core.space.Operator;
import com.qualsim.support.Flashlight;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.qualsim.support.Flashlight.BRIGHTNESS;
import static com.qualsim.support.Flashlight.LEVEL;
import static com.qualsim.support.Flashlight.STATE;
import static com.qualsim.support.Flashlight.check;
import static org.junit.jupiter.api.Assertions.*;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();
    private final SimulationScope scope = Flashlight.scope();

    private Evaluation eval(Condition condition, WorldSnapshot snapshot) {
        return evaluator.evaluate(condition, snapshot, Map.of(), scope);
    }

    @Nested
    @DisplayName("attribute checks")
    class AttributeChecks {

        @Test
        @DisplayName("known value gives a definite result")
        void knownValue() {
            WorldSnapshot snapshot = Flashlight.withLevels(scope, "high");

            assertTrue(eval(check(LEVEL, Operator.GREATER_THAN, "medium"), snapshot).isTrue());
            assertTrue(eval(check(LEVEL, Operator.LESS_THAN, "medium"), snapshot).isFalse());
        }

        @Test
        @DisplayName("value set entirely inside the satisfying set is true")
        void setInside() {
            WorldSnapshot snapshot = Flashlight.withLevels(scope, "medium", "high");

            assertTrue(eval(check(LEVEL, Operator.NOT_EQUALS, "empty"), snapshot).isTrue());
        }

        @Test
        @DisplayName("value set entirely outside the satisfying set is false")
        void setOutside() {
            WorldSnapshot snapshot = Flashlight.withLevels(scope, "empty", "low");

            assertTrue(eval(check(LEVEL, Operator.GREATER_THAN_OR_EQUAL, "medium"), snapshot).isFalse());
        }

        @Test
        @DisplayName("partial overlap is unknown and names the attribute as witness")
        void partialOverlap() {
            Evaluation result = eval(check(LEVEL, Operator.EQUALS, "full"), Flashlight.initial(scope));

            assertTrue(result.isUnknown());
            assertEquals(Set.of(LEVEL), result.witnesses());
        }

        @Test
        @DisplayName("set operators compare against several levels")
        void setOperators() {
            WorldSnapshot snapshot = Flashlight.withLevels(scope, "low", "medium");
            Condition in = new AttributeCheck(LEVEL, Operator.IN, ValueRef.levels(List.of("low", "medium", "high")));

            assertTrue(eval(in, snapshot).isTrue());
        }

        @Test
        @DisplayName("parameter references resolve against the supplied parameters")
        void parameterReference() {
            Condition c = new AttributeCheck(STATE, Operator.EQUALS, ValueRef.parameter("state"));
            WorldSnapshot snapshot = Flashlight.initial(scope);

            assertTrue(evaluator.evaluate(c, snapshot, Map.of("state", "dark"), scope).isTrue());
            assertTrue(evaluator.evaluate(c, snapshot, Map.of("state", "lit"), scope).isFalse());
            assertThrows(ValidationException.class, () -> evaluator.evaluate(c, snapshot, Map.of(), scope));
        }
    }

    @Nested
    @DisplayName("compound conditions")
    class Compounds {

        private final WorldSnapshot unknownLevel = Flashlight.initial(scope);

        @Test
        @DisplayName("and is false as soon as one item is false")
        void andFalse() {
            Condition c = new And(List.of(check(LEVEL, Operator.EQUALS, "full"), check(STATE, Operator.EQUALS, "lit")));

            assertTrue(eval(c, unknownLevel).isFalse());
        }

        @Test
        @DisplayName("and with true and unknown items is unknown")
        void andUnknown() {
            Condition c = new And(List.of(check(LEVEL, Operator.EQUALS, "full"), check(STATE, Operator.EQUALS, "dark")));

            Evaluation result = eval(c, unknownLevel);
            assertTrue(result.isUnknown());
            assertEquals(Set.of(LEVEL), result.witnesses());
        }

        @Test
        @DisplayName("or is true as soon as one item is true")
        void orTrue() {
            Condition c = new Or(List.of(check(LEVEL, Operator.EQUALS, "full"), check(STATE, Operator.EQUALS, "dark")));

            assertTrue(eval(c, unknownLevel).isTrue());
        }

        @Test
        @DisplayName("or of false items is false")
        void orFalse() {
            Condition c = new Or(List.of(check(STATE, Operator.EQUALS, "lit"), check(BRIGHTNESS, Operator.EQUALS, "dim")));

            assertTrue(eval(c, unknownLevel).isFalse());
        }

        @Test
        @DisplayName("not swaps true and false and keeps unknown")
        void not() {
            assertTrue(eval(new Not(check(STATE, Operator.EQUALS, "dark")), unknownLevel).isFalse());
            assertTrue(eval(new Not(check(LEVEL, Operator.EQUALS, "full")), unknownLevel).isUnknown());
        }

        @Test
        @DisplayName("implication with false antecedent is true")
        void implication() {
            Condition c = new Implication(check(STATE, Operator.EQUALS, "lit"), check(LEVEL, Operator.NOT_EQUALS, "empty"));

            assertTrue(eval(c, unknownLevel).isTrue());
            WorldSnapshot lit = unknownLevel.narrow(Map.of(STATE, List.of("lit")));
            assertTrue(eval(c, lit).isUnknown());
        }

        @Test
        @DisplayName("null condition is true")
        void nullCondition() {
            assertTrue(eval(null, unknownLevel).isTrue());
        }
    }

    @Nested
    @DisplayName("parameter checks")
    class ParameterChecks {

        @Test
        @DisplayName("equality and membership never depend on the snapshot")
        void parameterChecks() {
            WorldSnapshot snapshot = Flashlight.initial(scope);

            assertTrue(evaluator.evaluate(ParameterCheck.equalTo("mode", "eco"), snapshot, Map.of("mode", "eco"), scope).isTrue());
            assertTrue(evaluator.evaluate(ParameterCheck.equalTo("mode", "eco"), snapshot, Map.of("mode", "normal"), scope).isFalse());
            assertTrue(evaluator.evaluate(ParameterCheck.valid("mode", List.of("eco", "normal")), snapshot,
                    Map.of("mode", "turbo"), scope).isFalse());
            assertTrue(evaluator.evaluate(ParameterCheck.valid("mode", List.of("eco")), snapshot, Map.of(), scope).isFalse());
        }
    }

    @Test
    @DisplayName("targets collects attributes in first-seen order")
    void targets() {
        Condition c = new Or(List.of(
                new Not(check(STATE, Operator.EQUALS, "lit")),
                new And(List.of(check(LEVEL, Operator.EQUALS, "low"), check(STATE, Operator.EQUALS, "dark")))));

        assertEquals(List.of(STATE, LEVEL), List.copyOf(Conditions.targets(c)));
    }
}
