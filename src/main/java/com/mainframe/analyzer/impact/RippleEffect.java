package com.mainframe.analyzer.impact;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Impacted entities grouped by direct, indirect or cascading change for depth 1, depth 2 and depth 3 or deeper.
 */
@Value
public class RippleEffect {

    Map<ChangeType, List<EntityRef>> level1;
    Map<ChangeType, List<EntityRef>> level2;
    Map<ChangeType, List<EntityRef>> level3;

    public static RippleEffect of(List<ImpactedItem> items) {
        List<Map<ChangeType, List<EntityRef>>> levels = List.of(
                new EnumMap<>(ChangeType.class), new EnumMap<>(ChangeType.class), new EnumMap<>(ChangeType.class));
        for (ImpactedItem item : items) {
            int level = Math.min(item.getDepth(), 3) - 1;
            levels.get(level).computeIfAbsent(item.getChangeType(), k -> new ArrayList<>()).add(item.getEntity());
        }
        return new RippleEffect(freeze(levels.get(0)), freeze(levels.get(1)), freeze(levels.get(2)));
    }

    private static Map<ChangeType, List<EntityRef>> freeze(Map<ChangeType, List<EntityRef>> level) {
        Map<ChangeType, List<EntityRef>> copy = new EnumMap<>(ChangeType.class);
        level.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }
}
