package com.qualsim.kb;

import com.qualsim.core.condition.And;
import com.qualsim.core.condition.AttributeCheck;
import com.qualsim.core.condition.Condition;
import com.qualsim.core.condition.Conditions;
import com.qualsim.core.condition.Implication;
import com.qualsim.core.condition.Not;
import com.qualsim.core.condition.Or;
import com.qualsim.core.condition.ParameterCheck;
import com.qualsim.core.constraint.DependencyConstraint;
import com.qualsim.core.effect.Conditional;
import com.qualsim.core.effect.Effect;
import com.qualsim.core.effect.SetAttribute;
import com.qualsim.core.effect.SetTrend;
import com.qualsim.core.model.Action;
import com.qualsim.core.model.AttributePath;
import com.qualsim.core.model.AttributeSpec;
import com.qualsim.core.model.KnowledgeBase;
import com.qualsim.core.model.ObjectType;
import com.qualsim.core.model.ParameterSpec;
import com.qualsim.core.space.Operator;
import com.qualsim.core.space.QualitativeSpace;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a loaded knowledge base for dangling references before anything runs against it.
 * Problems are collected, not thrown, so one pass reports all of them.
 */
@Component
public class KnowledgeBaseValidator {

    /**
     * @param element key of the offending element, {@code object:<type>} or {@code action:<type>.<name>}
     * @param message what is wrong
     */
    public record Problem(String element, String message) {}

    public List<Problem> validate(KnowledgeBase kb) {
        List<Problem> problems = new ArrayList<>();
        for (ObjectType type : kb.objectTypes().values()) {
            validateObjectType(kb, type, problems);
        }
        Set<String> seen = new HashSet<>();
        for (Action action : kb.actions()) {
            String element = elementKey(action);
            if (!seen.add(element)) {
                problems.add(new Problem(element, "duplicate action '" + action.name()
                        + "' for object type '" + action.objectType() + "'"));
            }
            Optional<ObjectType> type = kb.objectType(action.objectType());
            if (type.isEmpty()) {
                problems.add(new Problem(element, "unknown object type '" + action.objectType() + "'"));
                continue;
            }
            validateAction(new Context(kb, type.get(), element, declaredParameters(action, element, problems)),
                    action, problems);
        }
        return problems;
    }

    public static String elementKey(ObjectType type) {
        return "object:" + type.name();
    }

    public static String elementKey(Action action) {
        return "action:" + action.objectType() + "." + action.name();
    }

    private void validateObjectType(KnowledgeBase kb, ObjectType type, List<Problem> problems) {
        String element = elementKey(type);
        for (var entry : type.attributes().entrySet()) {
            AttributeSpec spec = entry.getValue();
            Optional<QualitativeSpace> space = kb.space(spec.space());
            if (space.isEmpty()) {
                problems.add(new Problem(element, "attribute '" + entry.getKey()
                        + "' references unknown space '" + spec.space() + "'"));
            } else if (!spec.defaultsToUnknown() && !space.get().contains(spec.defaultValue())) {
                problems.add(new Problem(element, "default '" + spec.defaultValue() + "' of attribute '"
                        + entry.getKey() + "' is not a level of space '" + spec.space() + "'"));
            }
        }
        Context context = new Context(kb, type, element, Set.of());
        for (DependencyConstraint constraint : type.constraints()) {
            validateCondition(context, constraint.condition(), problems);
            validateCondition(context, constraint.requires(), problems);
        }
    }

    private Set<String> declaredParameters(Action action, String element, List<Problem> problems) {
        Set<String> names = new HashSet<>();
        for (ParameterSpec parameter : action.parameters()) {
            if (!names.add(parameter.name())) {
                problems.add(new Problem(element, "duplicate parameter '" + parameter.name() + "'"));
            }
            if (parameter.defaultValue() != null && !parameter.accepts(parameter.defaultValue())) {
                problems.add(new Problem(element, "default '" + parameter.defaultValue()
                        + "' of parameter '" + parameter.name() + "' is not one of " + parameter.choices()));
            }
        }
        return names;
    }

    private void validateAction(Context context, Action action, List<Problem> problems) {
        for (Condition condition : action.preconditions()) {
            validateCondition(context, condition, problems);
        }
        validateEffects(context, action.effects(), null, problems);
    }

    private void validateEffects(Context context, List<Effect> effects, Set<AttributePath> ancestorTargets,
                                 List<Problem> problems) {
        for (Effect effect : effects) {
            if (effect instanceof SetAttribute set) {
                Optional<AttributeSpec> spec = attribute(context, set.target(), problems);
                if (spec.isEmpty()) {
                    continue;
                }
                if (!spec.get().mutable()) {
                    problems.add(new Problem(context.element(), "effect writes immutable attribute '"
                            + set.target() + "'"));
                }
                if (set.value().isParameter()) {
                    checkParameter(context, set.value().parameter(), problems);
                } else if (set.value().levels().size() != 1) {
                    problems.add(new Problem(context.element(), "effect on '" + set.target()
                            + "' must set a single level"));
                } else {
                    checkLevels(context, set.target(), spec.get(), set.value().levels(), problems);
                }
            } else if (effect instanceof SetTrend trend) {
                attribute(context, trend.target(), problems);
            } else if (effect instanceof Conditional conditional) {
                validateCondition(context, conditional.condition(), problems);
                Set<AttributePath> targets = Conditions.targets(conditional.condition());
                if (ancestorTargets != null && !ancestorTargets.isEmpty() && !targets.isEmpty()
                        && !ancestorTargets.equals(targets)) {
                    problems.add(new Problem(context.element(), "nested conditional on " + targets
                            + " inside a conditional on " + ancestorTargets));
                }
                Set<AttributePath> scope = targets.isEmpty() ? ancestorTargets : targets;
                validateEffects(context, conditional.then(), scope, problems);
                if (conditional.hasElse()) {
                    validateEffects(context, conditional.otherwise(), scope, problems);
                }
            }
        }
    }

    private void validateCondition(Context context, Condition condition, List<Problem> problems) {
        if (condition instanceof AttributeCheck check) {
            Optional<AttributeSpec> spec = attribute(context, check.target(), problems);
            if (check.value().isParameter()) {
                checkParameter(context, check.value().parameter(), problems);
            } else {
                List<String> levels = check.value().levels();
                boolean listAllowed = check.operator().isSetOperator()
                        || check.operator() == Operator.EQUALS || check.operator() == Operator.NOT_EQUALS;
                if (levels.size() > 1 && !listAllowed) {
                    problems.add(new Problem(context.element(), "operator '" + check.operator().id()
                            + "' on '" + check.target() + "' takes a single level"));
                }
                spec.ifPresent(s -> checkLevels(context, check.target(), s, levels, problems));
            }
        } else if (condition instanceof ParameterCheck check) {
            checkParameter(context, check.parameter(), problems);
        } else if (condition instanceof And and) {
            and.items().forEach(c -> validateCondition(context, c, problems));
        } else if (condition instanceof Or or) {
            or.items().forEach(c -> validateCondition(context, c, problems));
        } else if (condition instanceof Not not) {
            validateCondition(context, not.item(), problems);
        } else if (condition instanceof Implication implication) {
            validateCondition(context, implication.antecedent(), problems);
            validateCondition(context, implication.consequent(), problems);
        }
    }

    private Optional<AttributeSpec> attribute(Context context, AttributePath path, List<Problem> problems) {
        Optional<AttributeSpec> spec = context.objectType().attribute(path);
        if (spec.isEmpty()) {
            problems.add(new Problem(context.element(), "unknown attribute '" + path
                    + "' on object type '" + context.objectType().name() + "'"));
        }
        return spec;
    }

    private void checkLevels(Context context, AttributePath path, AttributeSpec spec, List<String> levels,
                             List<Problem> problems) {
        Optional<QualitativeSpace> space = context.kb().space(spec.space());
        if (space.isEmpty()) {
            return;
        }
        for (String level : levels) {
            if (!space.get().contains(level)) {
                problems.add(new Problem(context.element(), "level '" + level + "' used with '" + path
                        + "' is not defined in space '" + spec.space() + "'"));
            }
        }
    }

    private void checkParameter(Context context, String parameter, List<Problem> problems) {
        if (!context.parameters().contains(parameter)) {
            problems.add(new Problem(context.element(), "reference to undeclared parameter '" + parameter + "'"));
        }
    }

    private record Context(KnowledgeBase kb, ObjectType objectType, String element, Set<String> parameters) {}
}
