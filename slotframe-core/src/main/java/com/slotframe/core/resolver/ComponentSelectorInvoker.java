package com.slotframe.core.resolver;

import com.slotframe.api.component.ComponentSelector;
import com.slotframe.api.component.SelectorResult;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.Map;

@Slf4j
public class ComponentSelectorInvoker {

    @Nullable
    public SelectorResult invoke(@Nullable ComponentSelector selector, @Nullable Map<String, Object> params) {
        if (selector == null) {
            return null;
        }
        SelectorResult result = selector.select(params != null ? params : Collections.emptyMap());
        log.debug("Selector {} chose {}", selector.getClass().getName(),
                result != null ? result.getComponent() : null);
        return result;
    }
}
