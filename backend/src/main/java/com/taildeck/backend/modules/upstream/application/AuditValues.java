package com.taildeck.backend.modules.upstream.application;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * null 값을 허용하는 감사 값 맵.
 */
final class AuditValues {

    private AuditValues() {
    }

    static Map<String, Object> of(String key, Object value) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(key, value);
        return values;
    }

    static Map<String, Object> of(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> values = of(k1, v1);
        values.put(k2, v2);
        return values;
    }

    static Map<String, Object> of(String k1, Object v1, String k2, Object v2, String k3, Object v3) {
        Map<String, Object> values = of(k1, v1, k2, v2);
        values.put(k3, v3);
        return values;
    }

    static Map<String, Object> of(String k1, Object v1, String k2, Object v2, String k3, Object v3,
                                  String k4, Object v4) {
        Map<String, Object> values = of(k1, v1, k2, v2, k3, v3);
        values.put(k4, v4);
        return values;
    }
}
