package com.eidos.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Top-level operating constraint, independent of any episode. Higher priority wins.
 */
public record Policy(
    String policyId,
    String statement,
    PolicyScope scope,
    int priority,
    PolicySource source,
    double createdAt
) {

    public static final int DEFAULT_PRIORITY = 50;

    public Policy {
        statement = statement == null ? "" : statement;
        scope = scope == null ? PolicyScope.GLOBAL : scope;
        source = source == null ? PolicySource.INFERRED : source;
        if (ContentIds.isBlank(policyId)) {
            policyId = ContentIds.generate(scope.name() + ":" + ContentIds.prefix(statement, 50), createdAt);
        }
    }

    public static Policy of(String statement, PolicyScope scope, int priority, PolicySource source) {
        return new Policy(null, statement, scope, priority, source, ContentIds.now());
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("policy_id", policyId);
        out.put("statement", statement);
        out.put("scope", scope.name());
        out.put("priority", priority);
        out.put("source", source.name());
        out.put("created_at", createdAt);
        return out;
    }

    public static Policy fromMap(Map<String, ?> data) {
        return new Policy(
                MapValues.string(data, "policy_id", null),
                MapValues.string(data, "statement", ""),
                PolicyScope.fromValue(MapValues.string(data, "scope", null)),
                MapValues.integer(data, "priority", DEFAULT_PRIORITY),
                PolicySource.fromValue(MapValues.string(data, "source", null)),
                MapValues.number(data, "created_at", ContentIds.now()));
    }
}
