package com.bizflow.process.core.engine.expression;

import com.bizflow.process.core.exception.BizFlowRuntimeException;
import com.bizflow.process.core.exception.codes.BizFlowErrorCodes;
import com.bizflow.process.core.util.CastUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.DataBindingPropertyAccessor;
import org.springframework.expression.spel.support.MapAccessor;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates {@code onComplete} branch conditions written in Spring Expression Language.
 *
 * <p>The root object is a map with {@code output} (alias {@code form}) holding the completed task's
 * data, {@code variables} holding the instance variables and {@code task} holding task attributes.
 * Map entries are reachable with property syntax, so {@code output.approved == true} works.
 * Only read access is granted; conditions cannot assign or call constructors.</p>
 */
@Slf4j
public class BranchConditionEvaluator {

    public static final String OUTPUT = "output";
    public static final String FORM = "form";
    public static final String VARIABLES = "variables";
    public static final String TASK = "task";

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> parsedExpressions = new ConcurrentHashMap<>();

    /**
     * Parse failure description for {@code condition}, or empty when it parses.
     */
    public Optional<String> syntaxError(String condition) {
        try {
            parse(condition);
            return Optional.empty();
        } catch (ParseException e) {
            return Optional.of(e.getSimpleMessage());
        }
    }

    public boolean evaluate(String condition, Map<String, Object> output, Map<String, Object> variables,
                            Map<String, Object> task) {
        if (condition == null || condition.isBlank()) {
            return true;
        }
        try {
            Map<String, Object> root = new HashMap<>();
            root.put(OUTPUT, output == null ? Map.of() : output);
            root.put(FORM, root.get(OUTPUT));
            root.put(VARIABLES, variables == null ? Map.of() : variables);
            root.put(TASK, task == null ? Map.of() : task);

            SimpleEvaluationContext context = SimpleEvaluationContext
                    .forPropertyAccessors(new MapAccessor(), DataBindingPropertyAccessor.forReadOnlyAccess())
                    .withRootObject(root)
                    .build();
            Object value = parse(condition).getValue(context);
            boolean matched = CastUtil.castAsBoolean(value);
            log.debug("Condition [{}] evaluated to {} ({})", condition, matched, value);
            return matched;
        } catch (Exception e) {
            throw new BizFlowRuntimeException(BizFlowErrorCodes.CONDITION_EVALUATION_FAILED,
                    "Condition evaluation failed: " + condition, e);
        }
    }

    private Expression parse(String condition) {
        Expression cached = parsedExpressions.get(condition);
        if (cached != null) {
            return cached;
        }
        Expression expression = parser.parseExpression(condition);
        parsedExpressions.put(condition, expression);
        return expression;
    }
}
