package com.slotframe.core.resolver;

import com.slotframe.core.exception.ComponentConflictException;
import com.slotframe.core.exception.MissingFrameworkWrapperException;
import lombok.extern.slf4j.Slf4j;

/**
 * 拒绝互斥的定义组合
 */
@Slf4j
public class ComponentSpecificationValidator {

    public void validate(ComponentSpecification spec, String propertyName, boolean frameworkWrapperInstalled) {
        int nativeCount = spec.nativeHardcodedCount();
        boolean framework = spec.getFrameworkComponent() != null;

        if (nativeCount > 1 || (framework && nativeCount > 0)) {
            log.error("Component {} is specified more than once", propertyName);
            throw new ComponentConflictException(propertyName,
                    "You are trying to specify: " + propertyName + " twice as a component.");
        }

        if (spec.getSelector() != null && spec.hasHardcoded()) {
            log.error("Component {} has both a selector and a hardcoded component", propertyName);
            throw new ComponentConflictException(propertyName,
                    "You can't specify both, the selector and the component for: " + propertyName);
        }

        if (framework && !frameworkWrapperInstalled) {
            log.error("Framework component given for {} but no FrameworkComponentWrapper installed", propertyName);
            throw new MissingFrameworkWrapperException(propertyName);
        }
    }
}
