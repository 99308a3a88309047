package work.bindlang.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One applied state mutation: {@code key} moved from {@code oldValue} to {@code newValue}.
 */
public record StateChange(String key, Object oldValue, Object newValue) {
    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("key", key);
        map.put("old", oldValue);
        map.put("new", newValue);
        return map;
    }
}
