package org.nrg.profiles.model.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.nrg.profiles.utils.ValueUtils;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("notequals"),
    CONTAINS("contains"),
    GREATER_THAN("greaterthan"),
    GREATER_EQUAL_THAN("greaterequalthan"),
    LESS_THAN("lessthan"),
    LESS_EQUAL_THAN("lessequalthan");

    private final String name;

    private static final Map<String, ConditionOperator> ENUM_MAP;
    static {
        Map<String, ConditionOperator> map = new ConcurrentHashMap<>(ConditionOperator.values().length);
        for (ConditionOperator instance : ConditionOperator.values()) {
            map.put(instance.getName(), instance);
        }
        ENUM_MAP = Collections.unmodifiableMap(map);
    }

    ConditionOperator(final String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    public static Collection<String> names() {
        return ENUM_MAP.keySet();
    }

    @JsonCreator
    @Nullable
    public static ConditionOperator fromName(final String name) {
        return ENUM_MAP.get(name);
    }

    /**
     * @param actual The submitted value, null if nothing was submitted
     * @param expected The value the condition compares against. For {@link #CONTAINS} this is the
     *                 collection of accepted options, or a string the submitted value must be part of.
     */
    public boolean test(@Nullable final Object actual, @Nullable final Object expected) {
        switch (this) {
            case EQUALS:
                return ValueUtils.sameValue(actual, expected);
            case NOT_EQUALS:
                return !ValueUtils.sameValue(actual, expected);
            case CONTAINS:
                return ValueUtils.contains(expected, actual);
            default:
                break;
        }

        final Integer comparison = ValueUtils.compare(actual, expected);
        if (comparison == null) {
            return false;
        }
        switch (this) {
            case GREATER_THAN:
                return comparison > 0;
            case GREATER_EQUAL_THAN:
                return comparison >= 0;
            case LESS_THAN:
                return comparison < 0;
            case LESS_EQUAL_THAN:
                return comparison <= 0;
            default:
                return false;
        }
    }
}
