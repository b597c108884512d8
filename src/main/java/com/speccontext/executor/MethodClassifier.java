package com.speccontext.executor;

import com.speccontext.core.Order;
import com.speccontext.core.Skip;
import com.speccontext.core.Tag;
import com.speccontext.model.MethodRole;
import com.speccontext.model.ScenarioMethods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

import static org.reflections.ReflectionUtils.getMethods;
import static org.reflections.ReflectionUtils.withModifier;
import static org.reflections.ReflectionUtils.withParametersCount;
import static org.reflections.ReflectionUtils.withReturnType;

/**
 * Discovers the convention-named methods of a scenario type and partitions them by role.
 *
 * For each class between the scenario type and its root type the classifier:
 *   1. Uses the Reflections library to list the class's public, zero-argument,
 *      {@code void} instance methods
 *   2. Keeps those whose name contains the word separator and starts with a
 *      {@link MethodRole} prefix (first matching role wins)
 *   3. Lists an overridden method once, under its most-derived declaration
 *
 * Ordering within one class is by {@link Order} then name. Across classes, ancestors come
 * first. In legacy mode the lists are built most-derived-first and reversed only when the
 * scenario is more than one level below the root type, which reproduces the ordering of
 * scenarios written for the bottom-up discovery rule.
 *
 * Results are cached per (type, root, mode); discovery runs once per scenario type.
 */
public final class MethodClassifier {

    private static final Logger log = LoggerFactory.getLogger(MethodClassifier.class);

    private static final Comparator<Method> WITHIN_CLASS_ORDER =
        Comparator.comparingInt(MethodClassifier::orderOf).thenComparing(Method::getName);

    private static final Map<CacheKey, ScenarioMethods> CACHE = new ConcurrentHashMap<>();

    private record CacheKey(Class<?> scenarioType, Class<?> rootType, boolean legacyOrder) {}

    private MethodClassifier() {
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Returns the classified methods of {@code scenarioType}, discovering them on first use.
     *
     * @param scenarioType the concrete scenario class
     * @param rootType     the abstract base whose own methods are never scenario methods
     * @param legacyOrder  reproduce the reverse-when-deep ordering rule
     */
    public static ScenarioMethods classify(Class<?> scenarioType, Class<?> rootType, boolean legacyOrder) {
        return CACHE.computeIfAbsent(new CacheKey(scenarioType, rootType, legacyOrder),
            key -> discover(key.scenarioType(), key.rootType(), key.legacyOrder()));
    }

    /** {@code true} when the type carries {@link Skip}, directly or through a superclass. */
    public static boolean isSkipped(Class<?> type) {
        return type.isAnnotationPresent(Skip.class);
    }

    // ── Discovery ─────────────────────────────────────────────────────────────

    private static ScenarioMethods discover(Class<?> scenarioType, Class<?> rootType, boolean legacyOrder) {
        if (!rootType.isAssignableFrom(scenarioType) || scenarioType == rootType) {
            throw new IllegalStateException(
                "Class " + scenarioType.getName() + " is not a scenario below " + rootType.getName());
        }

        // levels.get(0) holds the concrete type's methods, the last entry the topmost ancestor's
        List<Map<MethodRole, List<Method>>> levels = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (Class<?> cls = scenarioType; cls != null && cls != rootType; cls = cls.getSuperclass()) {
            Map<MethodRole, List<Method>> level = new EnumMap<>(MethodRole.class);
            for (Method method : candidates(cls)) {
                if (!seen.add(method.getName())) continue;  // overridden further down

                MethodRole role = MethodRole.of(method.getName());
                if (role == null) continue;

                makeAccessible(method);
                level.computeIfAbsent(role, r -> new ArrayList<>()).add(method);
                log.debug("MethodClassifier: {}.{} -> {}",
                    cls.getSimpleName(), method.getName(), role);
            }
            levels.add(level);
        }

        boolean deep = scenarioType.getSuperclass() != rootType;
        ScenarioMethods.Builder builder = ScenarioMethods.builder(scenarioType)
            .typeSkipped(isSkipped(scenarioType));

        for (MethodRole role : MethodRole.values()) {
            List<Method> ordered = legacyOrder
                ? legacyOrder(levels, role, deep)
                : ancestorsFirst(levels, role);

            if (role == MethodRole.ACT) {
                ordered = ordered.stream()
                    .filter(m -> !isSkipped(m.getDeclaringClass()))
                    .toList();
            }
            if (role == MethodRole.EXAMPLE) {
                ordered = selectTagged(ordered);
                builder.tags(tagNames(ordered));
                ordered.stream()
                    .filter(m -> isSkipped(m.getDeclaringClass()))
                    .forEach(builder::skippedExample);
            }
            builder.bucket(role, ordered);
        }

        ScenarioMethods methods = builder.build();
        log.info("MethodClassifier: {} classified (arrange={}, act={}, teardown={}, examples={}, skipped={}, order={})",
            scenarioType.getSimpleName(),
            methods.getArrangeMethods().size(), methods.getActMethods().size(),
            methods.getTeardownMethods().size(), methods.getExamples().size(),
            methods.isTypeSkipped(), legacyOrder ? "legacy" : "ancestors-first");
        return methods;
    }

    private static List<Method> candidates(Class<?> cls) {
        Predicate<Method> declaredInstanceMethod = m -> m.getDeclaringClass() == cls
            && !Modifier.isStatic(m.getModifiers())
            && !m.isSynthetic()
            && !m.isBridge();

        Set<Method> found = getMethods(cls, declaredInstanceMethod
            .and(withModifier(Modifier.PUBLIC))
            .and(withParametersCount(0))
            .and(withReturnType(void.class)));

        List<Method> sorted = new ArrayList<>(found);
        sorted.sort(WITHIN_CLASS_ORDER);
        return sorted;
    }

    private static List<Method> ancestorsFirst(List<Map<MethodRole, List<Method>>> levels, MethodRole role) {
        List<Method> ordered = new ArrayList<>();
        for (int i = levels.size() - 1; i >= 0; i--) {
            ordered.addAll(levels.get(i).getOrDefault(role, List.of()));
        }
        return ordered;
    }

    private static List<Method> legacyOrder(List<Map<MethodRole, List<Method>>> levels,
                                            MethodRole role, boolean deep) {
        List<Method> ordered = new ArrayList<>();
        for (Map<MethodRole, List<Method>> level : levels) {
            ordered.addAll(level.getOrDefault(role, List.of()));
        }
        if (deep) {
            Collections.reverse(ordered);
        }
        return ordered;
    }

    private static List<Method> selectTagged(List<Method> examples) {
        List<Method> tagged = examples.stream()
            .filter(m -> m.isAnnotationPresent(Tag.class))
            .toList();
        return tagged.isEmpty() ? examples : tagged;
    }

    private static List<String> tagNames(List<Method> examples) {
        return examples.stream()
            .map(m -> m.getAnnotation(Tag.class))
            .filter(t -> t != null && !t.value().isBlank())
            .map(Tag::value)
            .toList();
    }

    private static int orderOf(Method method) {
        Order order = method.getAnnotation(Order.class);
        return order != null ? order.value() : Order.DEFAULT;
    }

    private static void makeAccessible(Method method) {
        try {
            method.setAccessible(true);  // support scenarios declared as non-public nested classes
        } catch (RuntimeException e) {
            throw new IllegalStateException(
                "Scenario method " + method.getDeclaringClass().getName() + "." + method.getName() +
                " cannot be made accessible.", e);
        }
    }
}
