package com.qualsim.support;

import com.qualsim.core.branching.BranchGenerator;
import com.qualsim.core.condition.AttributeCheck;
import com.qualsim.core.condition.Condition;
import com.qualsim.core.condition.ConditionEvaluator;
import com.qualsim.core.condition.ParameterCheck;
import com.qualsim.core.condition.ValueRef;
import com.qualsim.core.constraint.ConstraintChecker;
import com.qualsim.core.constraint.DependencyConstraint;
import com.qualsim.core.effect.Conditional;
import com.qualsim.core.effect.Effect;
import com.qualsim.core.effect.EffectApplier;
import com.qualsim.core.effect.SetAttribute;
import com.qualsim.core.effect.SetTrend;
import com.qualsim.core.engine.TransitionEngine;
import com.qualsim.core.model.Action;
import com.qualsim.core.model.AttributePath;
import com.qualsim.core.model.AttributeSpec;
import com.qualsim.core.model.KnowledgeBase;
import com.qualsim.core.model.ObjectType;
import com.qualsim.core.model.ParameterSpec;
import com.qualsim.core.model.SimulationScope;
import com.qualsim.core.model.WorldSnapshot;
import com.qualsim.core.space.Operator;
import com.qualsim.core.space.QualitativeSpace;
import com.qualsim.core.space.Trend;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flashlight knowledge base built in code, mirroring {@code kb/flashlight.yaml}.
 */
public final class Flashlight {

    public static final AttributePath LEVEL = AttributePath.parse("battery.level");
    public static final AttributePath STATE = AttributePath.parse("bulb.state");
    public static final AttributePath BRIGHTNESS = AttributePath.parse("bulb.brightness");
    public static final AttributePath POSITION = AttributePath.parse("switch.position");
    public static final AttributePath HOUSING = AttributePath.global("housing");

    public static final QualitativeSpace BATTERY_LEVEL =
            new QualitativeSpace("battery_level", List.of("empty", "low", "medium", "high", "full"));

    private Flashlight() {}

    public static KnowledgeBase knowledgeBase() {
        Map<String, QualitativeSpace> spaces = new LinkedHashMap<>();
        spaces.put("battery_level", BATTERY_LEVEL);
        spaces.put("light_state", new QualitativeSpace("light_state", List.of("dark", "lit")));
        spaces.put("brightness", new QualitativeSpace("brightness", List.of("none", "dim", "bright")));
        spaces.put("switch_position", new QualitativeSpace("switch_position", List.of("released", "pressed")));
        spaces.put("housing_material", new QualitativeSpace("housing_material", List.of("plastic", "aluminium")));

        Map<AttributePath, AttributeSpec> attributes = new LinkedHashMap<>();
        attributes.put(LEVEL, new AttributeSpec("battery_level", AttributeSpec.UNKNOWN, true));
        attributes.put(STATE, new AttributeSpec("light_state", "dark", true));
        attributes.put(BRIGHTNESS, new AttributeSpec("brightness", "none", true));
        attributes.put(POSITION, new AttributeSpec("switch_position", "released", true));
        attributes.put(HOUSING, new AttributeSpec("housing_material", "aluminium", false));

        DependencyConstraint litNeedsCharge = new DependencyConstraint(
                check(STATE, Operator.EQUALS, "lit"),
                check(LEVEL, Operator.NOT_EQUALS, "empty"),
                "a lit bulb needs charge");
        ObjectType flashlight = new ObjectType("flashlight", attributes, List.of(litNeedsCharge));

        List<Action> actions = List.of(
                action("turn_on", List.of(check(LEVEL, Operator.NOT_EQUALS, "empty")), List.of(
                        set(POSITION, "pressed"),
                        set(STATE, "lit"),
                        new Conditional(check(LEVEL, Operator.EQUALS, "full"), List.of(set(BRIGHTNESS, "bright")),
                                List.of(new Conditional(check(LEVEL, Operator.EQUALS, "high"),
                                        List.of(set(BRIGHTNESS, "bright")),
                                        List.of(set(BRIGHTNESS, "dim"))))))),
                action("turn_off", List.of(), List.of(
                        set(POSITION, "released"), set(STATE, "dark"), set(BRIGHTNESS, "none"))),
                action("drain", List.of(check(STATE, Operator.EQUALS, "lit")), List.of(
                        new SetTrend(LEVEL, Trend.DOWN))),
                action("recharge", List.of(), List.of(set(LEVEL, "full"), new SetTrend(LEVEL, Trend.NONE))),
                new Action("set_mode", "flashlight",
                        List.of(new ParameterSpec("mode", true, List.of("eco", "normal"), null)),
                        List.of(check(STATE, Operator.EQUALS, "lit")),
                        List.of(new Conditional(ParameterCheck.equalTo("mode", "eco"),
                                List.of(set(BRIGHTNESS, "dim")), List.of(set(BRIGHTNESS, "bright"))))),
                action("boost", List.of(), List.of(
                        new Conditional(check(LEVEL, Operator.GREATER_THAN_OR_EQUAL, "medium"),
                                List.of(set(BRIGHTNESS, "bright")), null))),
                action("force_light", List.of(), List.of(set(STATE, "lit"))),
                action("repaint", List.of(), List.of(set(HOUSING, "plastic"))),
                action("overload", List.of(), List.of(set(BRIGHTNESS, "blinding"))));

        return new KnowledgeBase(spaces, Map.of("flashlight", flashlight), actions);
    }

    public static SimulationScope scope() {
        KnowledgeBase kb = knowledgeBase();
        return new SimulationScope(kb, kb.objectType("flashlight").orElseThrow());
    }

    public static WorldSnapshot initial(SimulationScope scope) {
        return WorldSnapshot.initial(scope, Map.of());
    }

    public static WorldSnapshot withLevels(SimulationScope scope, String... levels) {
        return WorldSnapshot.initial(scope, Map.of(LEVEL, List.of(levels)));
    }

    public static Action action(SimulationScope scope, String name) {
        return scope.knowledgeBase().action("flashlight", name).orElseThrow();
    }

    public static TransitionEngine engine() {
        ConditionEvaluator evaluator = new ConditionEvaluator();
        return new TransitionEngine(evaluator, new EffectApplier(evaluator), new BranchGenerator(evaluator),
                new ConstraintChecker(evaluator));
    }

    public static AttributeCheck check(AttributePath path, Operator operator, String value) {
        return new AttributeCheck(path, operator, ValueRef.level(value));
    }

    public static SetAttribute set(AttributePath path, String value) {
        return new SetAttribute(path, ValueRef.level(value));
    }

    private static Action action(String name, List<Condition> preconditions, List<Effect> effects) {
        return new Action(name, "flashlight", List.of(), preconditions, effects);
    }
}
